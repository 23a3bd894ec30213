/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.gbif.equi7.common.data;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.io.ByteSource;
import com.google.common.io.Files;
import com.google.common.io.Resources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the static dataset from a JSON document on the classpath or the filesystem.
 * <pre>
 * {
 *   "version": "...",
 *   "subgrids": {
 *     "EU": {
 *       "zoneExtent": "MULTIPOLYGON (...)",
 *       "wkt": "PROJCS[...]",
 *       "proj4": "+proj=aeqd ...",
 *       "coverland": {"T6": ["E048N012T6", ...], "T3": [...], "T1": [...]}
 *     },
 *     ...
 *   }
 * }
 * </pre>
 */
public class JsonStaticDataProvider implements StaticDataProvider {
  private static final Logger LOG = LoggerFactory.getLogger(JsonStaticDataProvider.class);

  /**
   * The dataset bundled with this library.
   */
  public static final String DEFAULT_RESOURCE = "/equi7grid/equi7grid.json";

  private static final ObjectMapper MAPPER =
    new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private final String location;
  private final ByteSource source;

  private JsonStaticDataProvider(String location, ByteSource source) {
    this.location = location;
    this.source = source;
  }

  /**
   * @param resource absolute classpath location, e.g. "/equi7grid/equi7grid.json"
   * @throws DataUnavailableException if the resource does not exist
   */
  public static JsonStaticDataProvider fromClasspath(String resource) {
    String absolute = resource.startsWith("/") ? resource : "/" + resource;
    try {
      URL url = Resources.getResource(JsonStaticDataProvider.class, absolute);
      return new JsonStaticDataProvider(url.toString(), Resources.asByteSource(url));
    } catch (IllegalArgumentException e) {
      throw new DataUnavailableException("Cannot find Equi7Grid dataset on classpath: " + absolute, e);
    }
  }

  /**
   * @throws DataUnavailableException if the file does not exist
   */
  public static JsonStaticDataProvider fromFile(File file) {
    if (!file.isFile()) {
      throw new DataUnavailableException("Cannot find Equi7Grid dataset file: " + file.getAbsolutePath());
    }
    return new JsonStaticDataProvider(file.getAbsolutePath(), Files.asByteSource(file));
  }

  public static JsonStaticDataProvider bundled() {
    return fromClasspath(DEFAULT_RESOURCE);
  }

  @Override
  public Equi7Data load() {
    LOG.info("Reading Equi7Grid dataset from {}", location);
    Equi7Data data;
    try (InputStream in = source.openStream()) {
      data = MAPPER.readValue(in, Equi7Data.class);
    } catch (IOException e) {
      throw new DataUnavailableException("Cannot load Equi7Grid dataset from " + location, e);
    }
    if (data == null || data.getSubgrids() == null || data.getSubgrids().isEmpty()) {
      throw new DataUnavailableException("Equi7Grid dataset at " + location + " holds no subgrids");
    }
    LOG.info("Equi7Grid dataset version [{}] holds subgrids {}", data.getVersion(), data.getSubgrids().keySet());
    return data;
  }

  @Override
  public String toString() {
    return "JsonStaticDataProvider{" + location + '}';
  }
}
