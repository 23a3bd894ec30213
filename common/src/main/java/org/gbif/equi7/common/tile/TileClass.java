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

import java.util.Comparator;

/**
 * The three tile classes of the grid.  Each carries a fixed tile extent in metres which is independent of the
 * sampling in use: every T6 tile is 600×600km whether the pixels are 100m or 6000m.
 * <p/>
 * The sampling decides the class through a divisibility rule on disjoint sampling ranges, see {@link #forSampling}.
 */
public enum TileClass {
  T6(600_000, 64, 6000, 500),
  T3(300_000, 20, 60, 20),
  T1(100_000, 1, 16, 10);

  /**
   * Orders tile classes by their extent, smallest first.
   */
  public static final Comparator<TileClass> BY_EXTENT = Comparator.comparingInt(TileClass::getExtent);

  private final int extent;
  private final int minSampling;
  private final int maxSampling;
  private final int representativeSampling;

  TileClass(int extent, int minSampling, int maxSampling, int representativeSampling) {
    this.extent = extent;
    this.minSampling = minSampling;
    this.maxSampling = maxSampling;
    this.representativeSampling = representativeSampling;
  }

  /**
   * Resolves the tile class for a pixel sampling.
   *
   * @param sampling the pixel size in metres
   * @return the single class whose sampling range holds the value and whose extent it divides
   * @throws UnsupportedSamplingException if no class accepts the sampling
   */
  public static TileClass forSampling(int sampling) {
    for (TileClass tileClass : values()) {
      if (tileClass.accepts(sampling)) {
        return tileClass;
      }
    }
    throw new UnsupportedSamplingException(sampling);
  }

  /**
   * @return the tile class for the code (e.g. "T6")
   * @throws IllegalArgumentException if the code names no tile class
   */
  public static TileClass fromCode(String code) {
    for (TileClass tileClass : values()) {
      if (tileClass.name().equals(code)) {
        return tileClass;
      }
    }
    throw new IllegalArgumentException("Tile class must be one of T6, T3, T1. Supplied: " + code);
  }

  boolean accepts(int sampling) {
    return sampling >= minSampling && sampling <= maxSampling && extent % sampling == 0;
  }

  /**
   * @return the tile width and height in metres
   */
  public int getExtent() {
    return extent;
  }

  /**
   * @return the code used within tile names, e.g. "T6"
   */
  public String getCode() {
    return name();
  }

  /**
   * @return the extent in units of 100km, which is also the digit closing a tile name
   */
  public int getExtentUnits() {
    return extent / 100_000;
  }

  /**
   * The sampling used when a tile class is requested without a sampling.  Names built from it are only meaningful in
   * short form, as the sampling token would not reflect the caller's own sampling.
   */
  public int getRepresentativeSampling() {
    return representativeSampling;
  }

  public boolean isLargerOrEqual(TileClass other) {
    return extent >= other.extent;
  }
}
