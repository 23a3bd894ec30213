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

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the "family" of a tile at another resolution: the single tile containing it when the target tiles are larger
 * or equal, or the tiles it contains when they are smaller.
 * <p/>
 * Smaller tiles are listed east-index major: for each column from west to east, the tiles from south to north.
 */
public class FamilyTiles {
  private static final Logger LOG = LoggerFactory.getLogger(FamilyTiles.class);

  private FamilyTiles() {}

  /**
   * Family tiles at a given sampling, named in long form with that sampling.
   *
   * @param source the codec of the grid the tile name belongs to
   * @param tileName the source tile in long or short form
   * @param targetSampling a legal sampling
   * @throws UnsupportedSamplingException if the target sampling is not legal
   * @throws MalformedTileNameException if the tile name does not belong to the source grid
   */
  public static List<String> of(TileNameCodec source, String tileName, int targetSampling) {
    Samplings.requireLegal(targetSampling);
    return family(source, tileName, targetSampling, false);
  }

  /**
   * Family tiles of a tile class, named in short form.  The class's representative sampling is used internally and
   * does not appear in the names.
   */
  public static List<String> of(TileNameCodec source, String tileName, TileClass targetClass) {
    Preconditions.checkNotNull(targetClass, "Target tile class is required");
    return family(source, tileName, targetClass.getRepresentativeSampling(), true);
  }

  private static List<String> family(TileNameCodec source, String tileName, int targetSampling, boolean shortform) {
    TileAttributes tile = source.decode(tileName);
    TileClass targetClass = TileClass.forSampling(targetSampling);
    long targetExtent = targetClass.getExtent();

    if (targetClass.isLargerOrEqual(tile.getTileClass())) {
      long east = Math.floorDiv(tile.getLlx(), targetExtent) * targetExtent;
      long north = Math.floorDiv(tile.getLly(), targetExtent) * targetExtent;
      return ImmutableList.of(source.encode(east, north, targetSampling, targetClass, shortform));
    }

    int n = (int) (tile.getTileSize() / targetExtent);
    ImmutableList.Builder<String> family = ImmutableList.builderWithExpectedSize(n * n);
    for (int i = 0; i < n; i++) {
      for (int j = 0; j < n; j++) {
        family.add(source.encode(tile.getLlx() + i * targetExtent, tile.getLly() + j * targetExtent,
                                 targetSampling, targetClass, shortform));
      }
    }
    if (LOG.isTraceEnabled()) {
      LOG.trace("Tile {} has {}×{} family tiles of class {}", tileName, n, n, targetClass);
    }
    return family.build();
  }
}
