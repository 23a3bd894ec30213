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

import org.gbif.equi7.common.projection.LonLat;
import org.gbif.equi7.common.projection.PlanarPoint;
import org.gbif.equi7.common.tile.MalformedTileNameException;
import org.gbif.equi7.common.tile.PixelIndex;
import org.gbif.equi7.common.tile.PixelOrigin;
import org.gbif.equi7.common.tile.Samplings;
import org.gbif.equi7.common.tile.SubgridId;
import org.gbif.equi7.common.tile.Tile;
import org.gbif.equi7.common.tile.TileClass;
import org.gbif.equi7.common.tile.TileNameForm;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import static org.gbif.equi7.common.tile.MalformedTileNameException.Check.STRUCTURE;

/**
 * The grid at one sampling: seven subgrids sharing the tile class of the sampling.
 * <p/>
 * Grids are created by {@link Equi7GridFactory}, which shares the subgrid zones between grids of all samplings.
 * This class is threadsafe.
 */
public class Equi7Grid {
  private final int sampling;
  private final TileClass tileClass;
  private final boolean tileNamesInMetres;
  private final PixelOrigin pixelOrigin;
  private final SubgridResolver resolver;
  private final ImmutableMap<SubgridId, TilingSystem> subgrids;

  /**
   * @param pixelOrigin the row convention used when none is passed to a pixel lookup
   * @throws org.gbif.equi7.common.tile.UnsupportedSamplingException if the sampling is not legal
   */
  Equi7Grid(int sampling, boolean tileNamesInMetres, PixelOrigin pixelOrigin, Map<SubgridId, SubgridZone> zones,
            SubgridResolver resolver) {
    this.tileClass = Samplings.requireLegal(sampling);
    this.sampling = sampling;
    this.tileNamesInMetres = tileNamesInMetres;
    this.pixelOrigin = Preconditions.checkNotNull(pixelOrigin, "Pixel origin is required");
    this.resolver = resolver;
    Map<SubgridId, TilingSystem> tilings = new EnumMap<>(SubgridId.class);
    zones.forEach((id, zone) -> tilings.put(id, new TilingSystem(zone, sampling, tileNamesInMetres)));
    this.subgrids = Maps.immutableEnumMap(tilings);
  }

  /**
   * @return the tiling of the subgrid
   */
  public TilingSystem subgrid(SubgridId id) {
    return Preconditions.checkNotNull(subgrids.get(id), "Unknown subgrid %s", id);
  }

  /**
   * @return the name of the subgrid at this grid's sampling, e.g. "EQUI7_EU500M"
   */
  public String subgridName(SubgridId id) {
    return subgrid(id).getName();
  }

  /**
   * Creates a tile from its long name, using the subgrid named by its first two characters.
   *
   * @throws MalformedTileNameException if the name is not a valid long name of this grid
   */
  public Tile tile(String tileName) {
    return tilingOf(tileName).tile(tileName);
  }

  /**
   * @return the tile of the subgrid containing the projected coordinate
   */
  public Tile tileFor(SubgridId id, double x, double y) {
    return subgrid(id).tileFor(x, y);
  }

  /**
   * @return true if the long named tile is listed as covering land
   */
  public boolean coversLand(String tileName) {
    return tilingOf(tileName).coversLand(tileName);
  }

  /**
   * @return the subgrid containing the point, or null if none or several do
   */
  public SubgridId resolveSubgrid(double lon, double lat) {
    return resolver.resolve(lon, lat);
  }

  /**
   * @return the subgrid containing each point, in input order, null where the point does not resolve
   */
  public SubgridId[] resolveSubgrids(double[] lons, double[] lats) {
    return resolver.resolve(lons, lats);
  }

  /**
   * Projects a point into the subgrid holding it.
   *
   * @throws UnresolvedPointException if no single subgrid holds the point
   */
  public ProjectedPoint lonLatToXY(double lon, double lat) {
    SubgridId id = resolver.resolveOrThrow(lon, lat);
    PlanarPoint p = subgrid(id).getZone().getProjection().toPlanar(lon, lat);
    return new ProjectedPoint(id, p.getX(), p.getY());
  }

  /**
   * Projects many points, each into the subgrid holding it.  Unresolved points leave a null slot.
   */
  public ProjectedPoint[] lonLatToXY(double[] lons, double[] lats) {
    SubgridId[] ids = resolver.resolve(lons, lats);
    ProjectedPoint[] result = new ProjectedPoint[ids.length];
    for (int i = 0; i < ids.length; i++) {
      if (ids[i] != null) {
        PlanarPoint p = subgrid(ids[i]).getZone().getProjection().toPlanar(lons[i], lats[i]);
        result[i] = new ProjectedPoint(ids[i], p.getX(), p.getY());
      }
    }
    return result;
  }

  /**
   * @return the geodetic position of a projected coordinate of the subgrid
   */
  public LonLat xyToLonLat(SubgridId id, double x, double y) {
    return subgrid(id).getZone().getProjection().toGeodetic(x, y);
  }

  /**
   * Finds the tile holding a point and the pixel within it, using this grid's pixel origin.
   *
   * @throws UnresolvedPointException if no single subgrid holds the point
   */
  public TilePixel lonLatToTilePixel(double lon, double lat) {
    return lonLatToTilePixel(lon, lat, pixelOrigin);
  }

  /**
   * Finds the tile holding a point and the pixel within it.
   *
   * @throws UnresolvedPointException if no single subgrid holds the point
   */
  public TilePixel lonLatToTilePixel(double lon, double lat, PixelOrigin origin) {
    ProjectedPoint p = lonLatToXY(lon, lat);
    Tile tile = subgrid(p.getSubgrid()).tileFor(p.getX(), p.getY());
    PixelIndex pixel = tile.pixelIndex(p.getX(), p.getY(), origin);
    return new TilePixel(tile.getName(), pixel.getColumn(), pixel.getRow());
  }

  /**
   * Finds the tile and pixel of many points using this grid's pixel origin.
   *
   * @see #lonLatToTilePixels(double[], double[], PixelOrigin)
   */
  public TilePixel[] lonLatToTilePixels(double[] lons, double[] lats) {
    return lonLatToTilePixels(lons, lats, pixelOrigin);
  }

  /**
   * Finds the tile and pixel of many points.  Points are grouped by subgrid and then by tile, so each tile is built
   * once.  The result holds one slot per point in input order, null where the point does not resolve to a subgrid or
   * projects outside the namable tiles.
   */
  public TilePixel[] lonLatToTilePixels(double[] lons, double[] lats, PixelOrigin origin) {
    SubgridId[] ids = resolver.resolve(lons, lats);
    Map<SubgridId, IntArrayList> bySubgrid = new EnumMap<>(SubgridId.class);
    for (int i = 0; i < ids.length; i++) {
      if (ids[i] != null) {
        bySubgrid.computeIfAbsent(ids[i], k -> new IntArrayList()).add(i);
      }
    }

    TilePixel[] result = new TilePixel[ids.length];
    bySubgrid.forEach((id, indexes) -> {
      TilingSystem tiling = subgrid(id);
      double[] xs = new double[indexes.size()];
      double[] ys = new double[indexes.size()];
      for (int k = 0; k < indexes.size(); k++) {
        int i = indexes.getInt(k);
        PlanarPoint p = tiling.getZone().getProjection().toPlanar(lons[i], lats[i]);
        xs[k] = p.getX();
        ys[k] = p.getY();
      }
      Tile[] tiles = tiling.tilesFor(xs, ys);
      for (int k = 0; k < indexes.size(); k++) {
        if (tiles[k] == null) {
          continue;
        }
        PixelIndex pixel = tiles[k].pixelIndex(xs[k], ys[k], origin);
        result[indexes.getInt(k)] = new TilePixel(tiles[k].getName(), pixel.getColumn(), pixel.getRow());
      }
    });
    return result;
  }

  /**
   * Family tiles of a long named tile at another sampling, in long form.
   *
   * @see TilingSystem#familyTiles(String, int)
   */
  public List<String> familyTiles(String tileName, int targetSampling) {
    return tilingOf(tileName).familyTiles(tileName, targetSampling);
  }

  /**
   * Family tiles of a long named tile in another tile class, in short form.
   *
   * @see TilingSystem#familyTiles(String, TileClass)
   */
  public List<String> familyTiles(String tileName, TileClass targetClass) {
    return tilingOf(tileName).familyTiles(tileName, targetClass);
  }

  private TilingSystem tilingOf(String tileName) {
    if (TileNameForm.of(tileName) != TileNameForm.LONG) {
      throw new MalformedTileNameException(tileName, STRUCTURE, "a long form name is needed to identify the subgrid");
    }
    SubgridId id = SubgridId.fromTag(tileName.substring(0, 2));
    if (id == null || !subgrids.containsKey(id)) {
      throw new MalformedTileNameException(tileName, STRUCTURE, "unknown subgrid " + tileName.substring(0, 2));
    }
    return subgrids.get(id);
  }

  public int getSampling() {
    return sampling;
  }

  public TileClass getTileClass() {
    return tileClass;
  }

  /**
   * @return the tile width and height in metres
   */
  public int getTileExtent() {
    return tileClass.getExtent();
  }

  public boolean isTileNamesInMetres() {
    return tileNamesInMetres;
  }

  /**
   * @return the row convention of pixel lookups that do not name one
   */
  public PixelOrigin getPixelOrigin() {
    return pixelOrigin;
  }

  @Override
  public String toString() {
    return "Equi7Grid{sampling=" + sampling + "m, tileClass=" + tileClass + ", pixelOrigin=" + pixelOrigin
           + ", subgrids=" + subgrids.keySet() + '}';
  }
}
