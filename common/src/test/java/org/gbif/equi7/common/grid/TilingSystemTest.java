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

import org.gbif.equi7.common.tile.MalformedTileNameException;
import org.gbif.equi7.common.tile.SubgridId;
import org.gbif.equi7.common.tile.Tile;
import org.gbif.equi7.common.tile.TileClass;

import com.google.common.collect.ImmutableList;
import org.junit.BeforeClass;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TilingSystemTest {
  private static SubgridZone europe;

  @BeforeClass
  public static void loadZone() {
    europe = Equi7GridFactory.bundled().zone(SubgridId.EU);
  }

  @Test
  public void testTileFor() {
    TilingSystem tiling = new TilingSystem(europe, 500, false);
    Tile tile = tiling.tileFor(112_345, 318_210);
    assertEquals("EU500M_E000N000T6", tile.getName());
    assertEquals(0, tile.getLlx());
    assertEquals(0, tile.getLly());
    assertFalse(tile.isCoversLand());

    Tile vienna = tiling.tileFor(5_272_242, 1_618_250);
    assertEquals("EU500M_E048N012T6", vienna.getName());
    assertTrue(vienna.isCoversLand());
    assertTrue(vienna.contains(5_272_242, 1_618_250));
  }

  @Test
  public void testTileEdgesBelongToTheNextTile() {
    TilingSystem tiling = new TilingSystem(europe, 500, false);
    assertEquals("EU500M_E006N000T6", tiling.tileFor(600_000, 0).getName());
    assertEquals("EU500M_E000N000T6", tiling.tileFor(599_999.99, 0).getName());
    assertEquals("E000N006T6", tiling.pointToTileName(0, 600_000, true));
  }

  @Test
  public void testTileClassFollowsSampling() {
    assertEquals("EU020M_E003N003T3", new TilingSystem(europe, 20, false).tileFor(300_001, 599_999).getName());
    assertEquals("EU010M_E003N005T1", new TilingSystem(europe, 10, false).tileFor(300_001, 599_999).getName());
    assertEquals(TileClass.T1, new TilingSystem(europe, 1, false).getTileClass());
  }

  @Test
  public void testBatchMatchesScalar() {
    TilingSystem tiling = new TilingSystem(europe, 500, false);
    double[] xs = {112_345, 5_272_242, 200_000, 1_300_000, 5_300_000};
    double[] ys = {318_210, 1_618_250, 100_000, 1_900_000, 1_700_000};
    Tile[] tiles = tiling.tilesFor(xs, ys);
    assertEquals(xs.length, tiles.length);
    for (int i = 0; i < xs.length; i++) {
      assertEquals(tiling.tileFor(xs[i], ys[i]), tiles[i]);
    }
    // points sharing a tile share the instance
    assertSame(tiles[0], tiles[2]);
    assertSame(tiles[1], tiles[4]);
  }

  @Test
  public void testBatchLeavesUnnamableSlotsEmpty() {
    TilingSystem tiling = new TilingSystem(europe, 500, false);
    Tile[] tiles = tiling.tilesFor(new double[] {-1, 112_345, Double.NaN, 120_000_000},
                                   new double[] {0, 318_210, 0, 0});
    assertNull(tiles[0]);
    assertEquals("EU500M_E000N000T6", tiles[1].getName());
    assertNull(tiles[2]);
    assertNull(tiles[3]);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBatchLengthMismatch() {
    new TilingSystem(europe, 500, false).tilesFor(new double[] {1}, new double[0]);
  }

  @Test
  public void testLowerLeft() {
    TilingSystem tiling = new TilingSystem(europe, 500, false);
    assertEquals(0, tiling.lowerLeft(0));
    assertEquals(0, tiling.lowerLeft(599_999.9));
    assertEquals(600_000, tiling.lowerLeft(600_000));
    assertEquals(-600_000, tiling.lowerLeft(-1));
    try {
      tiling.lowerLeft(Double.NaN);
      fail("NaN has no tile");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeCoordinateCannotBeNamed() {
    new TilingSystem(europe, 500, false).tileFor(-1, 0);
  }

  @Test
  public void testTileFromName() {
    TilingSystem tiling = new TilingSystem(europe, 500, false);
    Tile tile = tiling.tile("EU500M_E048N012T6");
    assertEquals(tile, tiling.tile("E048N012T6"));
    assertEquals(4_800_000, tile.getLlx());
    assertEquals(1_200_000, tile.getLly());
    assertTrue(tile.isCoversLand());
    try {
      tiling.tile("EU500M_E048N013T6");
      fail("N013 is not aligned to 600km");
    } catch (MalformedTileNameException e) {
      assertEquals(MalformedTileNameException.Check.ALIGNMENT, e.getCheck());
    }
  }

  @Test
  public void testNames() {
    TilingSystem tiling = new TilingSystem(europe, 500, false);
    assertEquals("EU500M_E012N018T6", tiling.encodeTileName(1_200_000, 1_800_000, 500, TileClass.T6, false));
    assertEquals("E013N019T1", tiling.encodeTileName(1_300_000, 1_900_000, 10, TileClass.T1, true));
    assertEquals(1_800_000, tiling.decodeTileName("EU500M_E012N018T6").getLly());
    assertEquals("E012N018T6", tiling.toShortName("EU500M_E012N018T6"));
    assertTrue(tiling.isValidTileName("E012N018T6"));
    assertFalse(tiling.isValidTileName("E012N018T3"));

    assertEquals("EQUI7_EU500M", tiling.getName());
    assertEquals("EQUI7_EU3K0M", new TilingSystem(europe, 3000, false).getName());
    assertEquals("EQUI7_EU3000M", new TilingSystem(europe, 3000, true).getName());
  }

  @Test
  public void testLandCoverage() {
    TilingSystem tiling = new TilingSystem(europe, 500, false);
    assertTrue(tiling.coversLand("EU500M_E048N012T6"));
    assertTrue(tiling.coversLand("E048N012T6"));
    assertFalse(tiling.coversLand("EU500M_E000N000T6"));
    assertEquals(ImmutableList.of("E036N012T6", "E036N018T6", "E042N012T6", "E042N018T6", "E048N006T6",
                                  "E048N012T6", "E048N018T6", "E054N012T6", "E054N018T6"),
                 tiling.listTilesCoveringLand());

    TilingSystem t1 = new TilingSystem(europe, 10, false);
    assertEquals(ImmutableList.of("E052N015T1", "E052N016T1", "E053N015T1"), t1.listTilesCoveringLand());
    assertTrue(t1.coversLand("EU010M_E052N016T1"));
  }

  @Test
  public void testFamilyTiles() {
    TilingSystem tiling = new TilingSystem(europe, 500, false);
    assertEquals(36, tiling.familyTiles("EU500M_E048N012T6", 10).size());
    assertEquals(ImmutableList.of("E048N012T3", "E048N015T3", "E051N012T3", "E051N015T3"),
                 tiling.familyTiles("EU500M_E048N012T6", TileClass.T3));
  }
}
