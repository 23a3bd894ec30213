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

import java.util.List;

import org.gbif.equi7.common.tile.FamilyTiles;
import org.gbif.equi7.common.tile.SubgridId;
import org.gbif.equi7.common.tile.Tile;
import org.gbif.equi7.common.tile.TileAttributes;
import org.gbif.equi7.common.tile.TileClass;
import org.gbif.equi7.common.tile.TileNameCodec;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The tiling of one subgrid at one sampling: maps projected coordinates to tiles, names tiles and answers land
 * coverage.  This class is threadsafe.
 */
public class TilingSystem {
  private static final Logger LOG = LoggerFactory.getLogger(TilingSystem.class);

  private final SubgridZone zone;
  private final TileNameCodec codec;
  private final int extent;

  TilingSystem(SubgridZone zone, int sampling, boolean inMetres) {
    this.zone = zone;
    this.codec = new TileNameCodec(zone.getId(), sampling, inMetres);
    this.extent = codec.getTileClass().getExtent();
  }

  /**
   * @return the tile containing the projected coordinate
   */
  public Tile tileFor(double x, double y) {
    return createTile(lowerLeft(x), lowerLeft(y));
  }

  /**
   * Returns the tiles containing each coordinate, in input order.  Coordinates sharing a tile share one instance.
   * Each tile is the one {@link #tileFor(double, double)} returns, except that a coordinate which is not finite or
   * falls in a tile that cannot be named leaves a null slot rather than failing the batch.
   */
  public Tile[] tilesFor(double[] xs, double[] ys) {
    Preconditions.checkArgument(xs.length == ys.length, "x and y coordinates differ in length");
    Tile[] tiles = new Tile[xs.length];
    Long2ObjectMap<Tile> byCorner = new Long2ObjectOpenHashMap<>();
    int skipped = 0;
    for (int i = 0; i < xs.length; i++) {
      if (!Double.isFinite(xs[i]) || !Double.isFinite(ys[i])) {
        skipped++;
        continue;
      }
      long llx = lowerLeft(xs[i]);
      long lly = lowerLeft(ys[i]);
      if (!TileNameCodec.isNamable(llx) || !TileNameCodec.isNamable(lly)) {
        skipped++;
        continue;
      }
      long key = cornerKey(llx, lly);
      Tile tile = byCorner.get(key);
      if (tile == null) {
        tile = createTile(llx, lly);
        byCorner.put(key, tile);
      }
      tiles[i] = tile;
    }
    if (skipped > 0) {
      LOG.debug("{} of {} coordinates in {} lie outside the namable tiles", skipped, xs.length, getName());
    }
    return tiles;
  }

  /**
   * Creates the tile from its long or short name.
   *
   * @throws org.gbif.equi7.common.tile.MalformedTileNameException if the name does not belong to this tiling
   */
  public Tile tile(String tileName) {
    TileAttributes attributes = codec.decode(tileName);
    return createTile(attributes.getLlx(), attributes.getLly());
  }

  /**
   * @return the name of the tile containing the projected coordinate
   */
  public String pointToTileName(double x, double y, boolean shortform) {
    return codec.encode(lowerLeft(x), lowerLeft(y), shortform);
  }

  /**
   * Names a tile of this subgrid at any sampling.
   */
  public String encodeTileName(long llx, long lly, int sampling, TileClass tileClass, boolean shortform) {
    return codec.encode(llx, lly, sampling, tileClass, shortform);
  }

  public TileAttributes decodeTileName(String tileName) {
    return codec.decode(tileName);
  }

  public String toShortName(String tileName) {
    return codec.toShortName(tileName);
  }

  public boolean isValidTileName(String tileName) {
    return codec.isValid(tileName);
  }

  /**
   * @return true if the named tile is listed in the land coverage of the subgrid
   */
  public boolean coversLand(String tileName) {
    return zone.coversLand(codec.getTileClass(), codec.toShortName(tileName));
  }

  /**
   * @return the short names of the tiles of this tiling covering land, sorted
   */
  public List<String> listTilesCoveringLand() {
    return ImmutableList.sortedCopyOf(Ordering.natural(), zone.getLandTiles(codec.getTileClass()));
  }

  /**
   * @see FamilyTiles#of(TileNameCodec, String, int)
   */
  public List<String> familyTiles(String tileName, int targetSampling) {
    return FamilyTiles.of(codec, tileName, targetSampling);
  }

  /**
   * @see FamilyTiles#of(TileNameCodec, String, TileClass)
   */
  public List<String> familyTiles(String tileName, TileClass targetClass) {
    return FamilyTiles.of(codec, tileName, targetClass);
  }

  private Tile createTile(long llx, long lly) {
    String name = codec.encode(llx, lly, false);
    boolean land = zone.coversLand(codec.getTileClass(), codec.encode(llx, lly, true));
    return new Tile(name, zone.getId(), codec.getSampling(), codec.getTileClass(), llx, lly, land);
  }

  /**
   * Rounds the coordinate down to the tile edge.
   */
  @VisibleForTesting
  long lowerLeft(double coordinate) {
    Preconditions.checkArgument(Double.isFinite(coordinate), "Coordinate is not finite: %s", coordinate);
    return (long) Math.floor(coordinate / extent) * extent;
  }

  // tile column in the high 32 bits, tile row in the low
  private long cornerKey(long llx, long lly) {
    return (llx / extent) << 32 | ((lly / extent) & 0xffffffffL);
  }

  public SubgridId getSubgrid() {
    return zone.getId();
  }

  public SubgridZone getZone() {
    return zone;
  }

  public int getSampling() {
    return codec.getSampling();
  }

  public TileClass getTileClass() {
    return codec.getTileClass();
  }

  /**
   * @return the subgrid name, e.g. "EQUI7_EU500M"
   */
  public String getName() {
    return zone.getName(codec.getSampling(), codec.isInMetres());
  }
}
