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
import java.util.Random;

import org.gbif.equi7.common.projection.LonLat;
import org.gbif.equi7.common.tile.MalformedTileNameException;
import org.gbif.equi7.common.tile.PixelOrigin;
import org.gbif.equi7.common.tile.SubgridId;
import org.gbif.equi7.common.tile.Tile;
import org.gbif.equi7.common.tile.TileClass;
import org.gbif.equi7.common.tile.UnsupportedSamplingException;

import org.junit.BeforeClass;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class Equi7GridTest {
  private static Equi7GridFactory factory;
  private static Equi7Grid grid;

  @BeforeClass
  public static void loadGrid() {
    factory = Equi7GridFactory.bundled();
    grid = factory.grid(500);
  }

  @Test
  public void testResolveSubgrid() {
    assertEquals(SubgridId.EU, grid.resolveSubgrid(16.37, 48.21)); // Vienna
    assertEquals(SubgridId.AF, grid.resolveSubgrid(36.82, -1.29)); // Nairobi
    assertEquals(SubgridId.AS, grid.resolveSubgrid(139.69, 35.69)); // Tokyo
    assertEquals(SubgridId.NA, grid.resolveSubgrid(-74.01, 40.71)); // New York
    assertEquals(SubgridId.OC, grid.resolveSubgrid(151.21, -33.87)); // Sydney
    assertEquals(SubgridId.OC, grid.resolveSubgrid(-149.57, -17.54)); // Tahiti, east of the antimeridian
    assertEquals(SubgridId.SA, grid.resolveSubgrid(-46.63, -23.55)); // São Paulo
    assertEquals(SubgridId.AN, grid.resolveSubgrid(0, -85));
    // on the boundary between EU and AS
    assertNull(grid.resolveSubgrid(60, 50));
  }

  @Test
  public void testLonLatToXY() {
    ProjectedPoint vienna = grid.lonLatToXY(16.37, 48.21);
    assertEquals(SubgridId.EU, vienna.getSubgrid());
    assertTrue(vienna.getX() > 4_800_000 && vienna.getX() < 5_400_000);
    assertTrue(vienna.getY() > 1_200_000 && vienna.getY() < 1_800_000);

    LonLat back = grid.xyToLonLat(SubgridId.EU, vienna.getX(), vienna.getY());
    assertEquals(16.37, back.getLon(), 1e-4);
    assertEquals(48.21, back.getLat(), 1e-4);

    ProjectedPoint centre = grid.lonLatToXY(24, 53);
    assertEquals(5_837_287.81977, centre.getX(), 0.01);
    assertEquals(2_121_415.69617, centre.getY(), 0.01);
  }

  @Test
  public void testUnresolvedPointThrows() {
    try {
      grid.lonLatToXY(60, 50);
      fail("Boundary points do not resolve");
    } catch (UnresolvedPointException e) {
      assertEquals(UnresolvedPointException.Reason.NO_SUBGRID, e.getReason());
    }
    try {
      grid.lonLatToTilePixel(60, 50, PixelOrigin.TOP_DOWN);
      fail("Boundary points do not resolve");
    } catch (UnresolvedPointException e) {
      assertTrue(e.getCandidates().isEmpty());
    }
  }

  @Test
  public void testBatchLeavesUnresolvedSlotsEmpty() {
    double[] lons = {16.37, 60, 139.69};
    double[] lats = {48.21, 50, 35.69};
    ProjectedPoint[] points = grid.lonLatToXY(lons, lats);
    assertEquals(3, points.length);
    assertEquals(grid.lonLatToXY(16.37, 48.21), points[0]);
    assertNull(points[1]);
    assertEquals(SubgridId.AS, points[2].getSubgrid());
    assertArrayEquals(new SubgridId[] {SubgridId.EU, null, SubgridId.AS}, grid.resolveSubgrids(lons, lats));
  }

  @Test
  public void testLonLatToTilePixel() {
    TilePixel vienna = grid.lonLatToTilePixel(16.37, 48.21, PixelOrigin.TOP_DOWN);
    assertEquals("EU500M_E048N012T6", vienna.getTileName());
    assertTrue(vienna.getColumn() >= 0 && vienna.getColumn() < 1200);
    assertTrue(vienna.getRow() >= 0 && vienna.getRow() < 1200);

    TilePixel bottomUp = grid.lonLatToTilePixel(16.37, 48.21, PixelOrigin.BOTTOM_UP);
    assertEquals(vienna.getColumn(), bottomUp.getColumn());
    assertEquals(1199 - vienna.getRow(), bottomUp.getRow());

    // the pixel agrees with the projected coordinate
    ProjectedPoint p = grid.lonLatToXY(16.37, 48.21);
    Tile tile = grid.tile(vienna.getTileName());
    assertEquals(tile.pixelIndex(p.getX(), p.getY(), PixelOrigin.TOP_DOWN).getColumn(), vienna.getColumn());
    assertEquals(tile.pixelIndex(p.getX(), p.getY(), PixelOrigin.TOP_DOWN).getRow(), vienna.getRow());
  }

  @Test
  public void testBatchTilePixelsMatchScalar() {
    Random random = new Random(42);
    int n = 500;
    double[] lons = new double[n];
    double[] lats = new double[n];
    for (int i = 0; i < n; i++) {
      lons[i] = -25 + random.nextDouble() * 80;
      lats[i] = 36 + random.nextDouble() * 40;
    }
    lons[7] = 60;
    lats[7] = 50;

    TilePixel[] pixels = grid.lonLatToTilePixels(lons, lats, PixelOrigin.TOP_DOWN);
    assertEquals(n, pixels.length);
    assertNull(pixels[7]);
    for (int i = 0; i < n; i++) {
      if (i != 7) {
        assertNotNull(pixels[i]);
        assertEquals(grid.lonLatToTilePixel(lons[i], lats[i], PixelOrigin.TOP_DOWN), pixels[i]);
      }
    }
  }

  @Test
  public void testTilesByName() {
    Tile tile = grid.tile("EU500M_E048N012T6");
    assertEquals(SubgridId.EU, tile.getSubgrid());
    assertTrue(tile.isCoversLand());
    assertTrue(grid.coversLand("EU500M_E048N012T6"));
    assertFalse(grid.coversLand("EU500M_E000N000T6"));
    assertFalse(grid.coversLand("AF500M_E048N012T6"));

    assertMalformed("E048N012T6", MalformedTileNameException.Check.STRUCTURE);
    assertMalformed("XX500M_E048N012T6", MalformedTileNameException.Check.STRUCTURE);
    assertMalformed("EU250M_E048N012T6", MalformedTileNameException.Check.SAMPLING_MISMATCH);
  }

  @Test
  public void testTileFor() {
    assertEquals("AF500M_E006N012T6", grid.tileFor(SubgridId.AF, 612_345, 1_234_567).getName());
  }

  @Test
  public void testFamilyTiles() {
    List<String> family = grid.familyTiles("EU500M_E048N012T6", 10);
    assertEquals(36, family.size());
    assertEquals("EU010M_E048N012T1", family.get(0));
    assertEquals(4, grid.familyTiles("EU500M_E048N012T6", TileClass.T3).size());
    assertEquals("E048N012T6", grid.familyTiles("EU500M_E048N012T6", TileClass.T6).get(0));
  }

  @Test
  public void testGridsAtOtherSamplings() {
    assertEquals(TileClass.T6, grid.getTileClass());
    assertEquals(600_000, grid.getTileExtent());
    assertEquals("EQUI7_EU500M", grid.subgridName(SubgridId.EU));

    Equi7Grid t3 = factory.grid(20);
    assertEquals(TileClass.T3, t3.getTileClass());
    assertEquals("EQUI7_AS020M", t3.subgridName(SubgridId.AS));

    Equi7Grid km = factory.grid(3000);
    assertEquals("EQUI7_NA3K0M", km.subgridName(SubgridId.NA));
    assertEquals("EQUI7_NA3000M", factory.grid(3000, true).subgridName(SubgridId.NA));
    assertTrue(factory.grid(3000, true).isTileNamesInMetres());
    assertTrue(km.lonLatToTilePixel(16.37, 48.21, PixelOrigin.TOP_DOWN).getTileName().startsWith("EU3K0M_E048N012"));
  }

  @Test
  public void testUnsupportedSampling() {
    for (int sampling : new int[] {1234, 1200, 1500, 0, 7}) {
      try {
        factory.grid(sampling);
        fail("Sampling " + sampling + " is not legal");
      } catch (UnsupportedSamplingException e) {
        assertEquals(sampling, e.getSampling());
      }
    }
  }

  private static void assertMalformed(String name, MalformedTileNameException.Check check) {
    try {
      grid.tile(name);
      fail("Name [" + name + "] should be rejected");
    } catch (MalformedTileNameException e) {
      assertEquals(check, e.getCheck());
    }
  }
}
