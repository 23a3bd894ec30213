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
package org.gbif.equi7.common.grid;

import java.io.File;
import java.util.EnumMap;
import java.util.Map;

import org.gbif.equi7.common.config.Equi7GridConfiguration;
import org.gbif.equi7.common.data.DataUnavailableException;
import org.gbif.equi7.common.data.Equi7Data;
import org.gbif.equi7.common.data.JsonStaticDataProvider;
import org.gbif.equi7.common.data.StaticDataProvider;
import org.gbif.equi7.common.tile.PixelOrigin;
import org.gbif.equi7.common.tile.SubgridId;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import org.locationtech.jts.io.WKTReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the static dataset once and builds grids at any legal sampling from it.
 * <p/>
 * All the expensive state (parsed zone extents, projections, land coverage and the subgrid index) is built on
 * construction and shared read-only by every grid, so grids are cheap to create.  Construction fails with
 * {@link DataUnavailableException} if the dataset is incomplete or corrupt.  This class is threadsafe.
 */
public class Equi7GridFactory {
  private static final Logger LOG = LoggerFactory.getLogger(Equi7GridFactory.class);

  public static final int DEFAULT_PARALLEL_THRESHOLD = 10_000;

  private final String version;
  private final ImmutableMap<SubgridId, SubgridZone> zones;
  private final SubgridResolver resolver;

  private Equi7GridFactory(String version, Map<SubgridId, SubgridZone> zones, int parallelThreshold) {
    this.version = version;
    this.zones = Maps.immutableEnumMap(zones);
    this.resolver = new SubgridResolver(this.zones.values(), parallelThreshold);
  }

  /**
   * @return a factory for the dataset bundled with this library
   */
  public static Equi7GridFactory bundled() {
    return create(JsonStaticDataProvider.bundled(), DEFAULT_PARALLEL_THRESHOLD);
  }

  /**
   * Builds the factory described by the configuration: the dataset is read from {@code dataFile} if set, otherwise
   * from the {@code dataResource} classpath location.
   */
  public static Equi7GridFactory fromConfiguration(Equi7GridConfiguration config) {
    StaticDataProvider provider = config.getDataFile() != null
      ? JsonStaticDataProvider.fromFile(new File(config.getDataFile()))
      : JsonStaticDataProvider.fromClasspath(config.getDataResource());
    return create(provider, config.getParallelThreshold());
  }

  /**
   * @param provider supplier of the static dataset
   * @param parallelThreshold batches of at least this many points are resolved in parallel
   * @throws DataUnavailableException if the dataset cannot be loaded or lacks a subgrid
   */
  public static Equi7GridFactory create(StaticDataProvider provider, int parallelThreshold) {
    Equi7Data data = provider.load();

    for (String tag : data.getSubgrids().keySet()) {
      if (SubgridId.fromTag(tag) == null) {
        throw new DataUnavailableException("Dataset holds unknown subgrid " + tag);
      }
    }

    WKTReader reader = new WKTReader();
    Map<SubgridId, SubgridZone> zones = new EnumMap<>(SubgridId.class);
    for (SubgridId id : SubgridId.values()) {
      Equi7Data.SubgridData subgrid = data.getSubgrids().get(id.name());
      if (subgrid == null) {
        throw new DataUnavailableException("Dataset lacks subgrid " + id);
      }
      zones.put(id, SubgridZone.fromData(id, subgrid, reader));
    }
    LOG.info("Built Equi7Grid factory for dataset version [{}] with {} subgrids", data.getVersion(), zones.size());
    return new Equi7GridFactory(data.getVersion(), zones, parallelThreshold);
  }

  /**
   * @return the grid at the sampling, with tile names in kilometre form above 999m
   * @throws org.gbif.equi7.common.tile.UnsupportedSamplingException if the sampling is not legal
   */
  public Equi7Grid grid(int sampling) {
    return grid(sampling, false);
  }

  /**
   * @param sampling a legal sampling in metres
   * @param tileNamesInMetres true to keep sampling tokens in metres above 999m
   * @throws org.gbif.equi7.common.tile.UnsupportedSamplingException if the sampling is not legal
   */
  public Equi7Grid grid(int sampling, boolean tileNamesInMetres) {
    return grid(sampling, tileNamesInMetres, PixelOrigin.TOP_DOWN);
  }

  /**
   * @param pixelOrigin the row convention of pixel lookups that do not name one
   * @see #grid(int, boolean)
   */
  public Equi7Grid grid(int sampling, boolean tileNamesInMetres, PixelOrigin pixelOrigin) {
    return new Equi7Grid(sampling, tileNamesInMetres, pixelOrigin, zones, resolver);
  }

  /**
   * @return the grid described by the configuration, pixel origin included
   */
  public Equi7Grid grid(Equi7GridConfiguration config) {
    return grid(config.getSampling(), config.isTileNamesInMetres(), config.getPixelOrigin());
  }

  public SubgridZone zone(SubgridId id) {
    return Preconditions.checkNotNull(zones.get(id), "Unknown subgrid %s", id);
  }

  public SubgridResolver getResolver() {
    return resolver;
  }

  public String getVersion() {
    return version;
  }
}
