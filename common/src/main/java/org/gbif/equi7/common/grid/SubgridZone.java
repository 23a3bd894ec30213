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

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.gbif.equi7.common.data.DataUnavailableException;
import org.gbif.equi7.common.data.Equi7Data;
import org.gbif.equi7.common.projection.Projections;
import org.gbif.equi7.common.projection.SubgridProjection;
import org.gbif.equi7.common.tile.Samplings;
import org.gbif.equi7.common.tile.SubgridId;
import org.gbif.equi7.common.tile.TileClass;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;

/**
 * One continental subgrid: its extent in WGS84, its projection and the tiles known to cover land.
 * Zones are built once from the static dataset and never change.  This class is threadsafe.
 */
public class SubgridZone {
  private static final String NAME_PREFIX = "EQUI7_";

  private final SubgridId id;
  private final Geometry extent;
  private final PreparedGeometry preparedExtent;
  private final String wkt;
  private final SubgridProjection projection;
  private final ImmutableMap<TileClass, ImmutableSet<String>> landTiles;

  SubgridZone(SubgridId id, Geometry extent, String wkt, SubgridProjection projection,
              Map<TileClass, ? extends Set<String>> landTiles) {
    this.id = id;
    this.extent = extent;
    this.preparedExtent = PreparedGeometryFactory.prepare(extent);
    this.wkt = wkt;
    this.projection = projection;
    Map<TileClass, ImmutableSet<String>> land = new EnumMap<>(TileClass.class);
    for (TileClass tileClass : TileClass.values()) {
      Set<String> names = landTiles.get(tileClass);
      land.put(tileClass, names == null ? ImmutableSet.of() : ImmutableSet.copyOf(names));
    }
    this.landTiles = Maps.immutableEnumMap(land);
  }

  /**
   * Builds the zone from its entry in the static dataset.
   *
   * @param reader a WKT reader, which must not be shared between threads
   * @throws DataUnavailableException if the extent, projection or land coverage cannot be read
   */
  static SubgridZone fromData(SubgridId id, Equi7Data.SubgridData data, WKTReader reader) {
    if (data.getZoneExtent() == null) {
      throw new DataUnavailableException("No zone extent for subgrid " + id);
    }
    Geometry extent;
    try {
      extent = reader.read(data.getZoneExtent());
    } catch (ParseException | IllegalArgumentException e) {
      throw new DataUnavailableException("Invalid zone extent for subgrid " + id, e);
    }
    if (!(extent instanceof Polygonal) || extent.isEmpty()) {
      throw new DataUnavailableException("Zone extent for subgrid " + id + " is not a polygon: "
                                         + extent.getGeometryType());
    }

    SubgridProjection projection;
    try {
      projection = Projections.fromProj4(id.name(), data.getProj4());
    } catch (IllegalArgumentException e) {
      throw new DataUnavailableException("Invalid projection for subgrid " + id, e);
    }

    Map<TileClass, Set<String>> land = new EnumMap<>(TileClass.class);
    if (data.getCoverland() != null) {
      for (Map.Entry<String, List<String>> e : data.getCoverland().entrySet()) {
        TileClass tileClass;
        try {
          tileClass = TileClass.fromCode(e.getKey());
        } catch (IllegalArgumentException ex) {
          throw new DataUnavailableException("Invalid land coverage for subgrid " + id, ex);
        }
        land.put(tileClass, e.getValue() == null ? ImmutableSet.of() : ImmutableSet.copyOf(e.getValue()));
      }
    }
    return new SubgridZone(id, extent, data.getWkt(), projection, land);
  }

  /**
   * @return true if the point lies strictly within the zone; points on the zone boundary are not contained
   */
  public boolean contains(Point lonLat) {
    return preparedExtent.contains(lonLat);
  }

  /**
   * Looks up the precomputed land coverage.  Tiles absent from the coverage are assumed to hold no land.
   *
   * @param tileClass the class of the tile
   * @param shortName the short tile name, e.g. "E048N012T6"
   */
  public boolean coversLand(TileClass tileClass, String shortName) {
    return landTiles.get(tileClass).contains(shortName);
  }

  /**
   * @return the short names of all tiles of the class covering land
   */
  public ImmutableSet<String> getLandTiles(TileClass tileClass) {
    return landTiles.get(tileClass);
  }

  /**
   * @return the name of the subgrid at the given sampling, e.g. "EQUI7_EU500M"
   */
  public String getName(int sampling, boolean inMetres) {
    return NAME_PREFIX + id + Samplings.encode(sampling, inMetres) + "M";
  }

  public SubgridId getId() {
    return id;
  }

  public Geometry getExtent() {
    return extent;
  }

  public String getWkt() {
    return wkt;
  }

  public SubgridProjection getProjection() {
    return projection;
  }

  @Override
  public String toString() {
    return "SubgridZone{" + id + ", " + projection + '}';
  }
}
