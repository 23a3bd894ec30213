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

/**
 * Thrown when the east or north corner of a tile is not a multiple of its tile class extent.
 */
public class UnalignedCornerException extends MalformedTileNameException {
  private static final long serialVersionUID = -1452879110931522475L;

  private final long corner;
  private final int alignmentUnits;

  /**
   * @param tileName the offending name, or a description of the corner when no name exists yet
   * @param corner the corner in metres
   * @param alignmentUnits the required multiple, in units of 100km
   */
  public UnalignedCornerException(String tileName, long corner, int alignmentUnits) {
    super(tileName, Check.ALIGNMENT,
          "East and North coordinates of the lower-left pixel must be multiples of " + alignmentUnits
          + "00km. Supplied: " + corner + "m");
    this.corner = corner;
    this.alignmentUnits = alignmentUnits;
  }

  public long getCorner() {
    return corner;
  }

  public int getAlignmentUnits() {
    return alignmentUnits;
  }
}
