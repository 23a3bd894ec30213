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
package org.gbif.equi7.common.tile;

import org.junit.Test;
import org.locationtech.jts.geom.Envelope;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TileTest {

  @Test
  public void testAttributes() {
    Tile tile = new Tile("EU500M_E012N018T6", SubgridId.EU, 500, TileClass.T6, 1_200_000, 1_800_000, true);
    assertEquals("E012N018T6", tile.getShortName());
    assertEquals(600_000, tile.getExtent());
    assertEquals(1200, tile.getSizePx());
    assertEquals(new Envelope(1_200_000, 1_800_000, 1_800_000, 2_400_000), tile.getEnvelope());
    assertTrue(tile.isCoversLand());
  }

  @Test
  public void testContainsIsHalfOpen() {
    Tile tile = new Tile("EU500M_E000N000T6", SubgridId.EU, 500, TileClass.T6, 0, 0, false);
    assertTrue(tile.contains(0, 0));
    assertTrue(tile.contains(599_999.9, 599_999.9));
    assertFalse(tile.contains(600_000, 0));
    assertFalse(tile.contains(0, 600_000));
    assertFalse(tile.contains(-0.1, 10));
  }

  @Test
  public void testEquality() {
    Tile a = new Tile("EU500M_E000N000T6", SubgridId.EU, 500, TileClass.T6, 0, 0, false);
    Tile b = new Tile("EU500M_E000N000T6", SubgridId.EU, 500, TileClass.T6, 0, 0, false);
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testShortNameRejected() {
    new Tile("E000N000T6", SubgridId.EU, 500, TileClass.T6, 0, 0, false);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnalignedCornerRejected() {
    new Tile("EU500M_E001N000T6", SubgridId.EU, 500, TileClass.T6, 100_000, 0, false);
  }
}
