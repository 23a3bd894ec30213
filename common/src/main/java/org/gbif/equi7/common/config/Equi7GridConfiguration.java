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
package org.gbif.equi7.common.config;

import java.io.IOException;
import java.net.URL;

import org.gbif.equi7.common.data.JsonStaticDataProvider;
import org.gbif.equi7.common.tile.PixelOrigin;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.io.Resources;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;
import lombok.extern.slf4j.Slf4j;

/**
 * Configuration of a grid with sensible defaults, read from YAML:
 * <pre>
 * sampling: 500
 * tileNamesInMetres: false
 * dataResource: /equi7grid/equi7grid.json
 * dataFile: /data/equi7grid-full.json   # optional, overrides dataResource
 * pixelOrigin: TOP_DOWN
 * parallelThreshold: 10000
 * </pre>
 */
@Data
@Builder
@Jacksonized
@Slf4j
public class Equi7GridConfiguration {

  @Builder.Default
  private int sampling = 500;

  @Builder.Default
  private boolean tileNamesInMetres = false;

  @Builder.Default
  private String dataResource = JsonStaticDataProvider.DEFAULT_RESOURCE;

  private String dataFile;

  @Builder.Default
  private PixelOrigin pixelOrigin = PixelOrigin.TOP_DOWN;

  @Builder.Default
  private int parallelThreshold = 10_000;

  /** E.g. pass in the filename relative to the classpath, e.g. "/equi7grid.yml" */
  public static Equi7GridConfiguration build(String filename) throws IOException {
    URL conf = Resources.getResource(Equi7GridConfiguration.class, filename);
    log.info("Reading from {}", conf);
    return new ObjectMapper(new YAMLFactory()).readValue(conf, Equi7GridConfiguration.class);
  }
}
