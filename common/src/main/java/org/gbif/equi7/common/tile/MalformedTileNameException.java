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
 * Thrown when a tile name cannot be parsed, or when it parses but contradicts the grid it is decoded against.
 * The failed check is available from {@link #getCheck()}.
 */
public class MalformedTileNameException extends IllegalArgumentException {
  private static final long serialVersionUID = 6047163387221419552L;

  /**
   * The validation that rejected the name.
   */
  public enum Check {
    STRUCTURE,
    SUBGRID_MISMATCH,
    SAMPLING_MISMATCH,
    TILE_SIZE_MISMATCH,
    ALIGNMENT
  }

  private final String tileName;
  private final Check check;

  public MalformedTileNameException(String tileName, Check check, String detail) {
    super(String.format("Tile name [%s] failed %s check: %s", tileName, check, detail));
    this.tileName = tileName;
    this.check = check;
  }

  public MalformedTileNameException(String tileName, Check check, String detail, Throwable cause) {
    this(tileName, check, detail);
    initCause(cause);
  }

  public String getTileName() {
    return tileName;
  }

  public Check getCheck() {
    return check;
  }
}
