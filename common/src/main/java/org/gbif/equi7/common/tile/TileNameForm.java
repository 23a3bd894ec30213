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
 * The two textual forms of a tile name.
 * <ul>
 *   <li>{@link #LONG}: subgrid, sampling token, then the corner block, e.g. "EU500M_E012N018T6"</li>
 *   <li>{@link #SHORT}: the corner block only, e.g. "E012N018T6", meaningful only when the subgrid and sampling are
 *   known from context</li>
 * </ul>
 */
public enum TileNameForm {
  SHORT,
  LONG;

  static final char SEPARATOR = '_';
  static final char EAST = 'E';

  /**
   * Determines the form from the structure of the name: the separator marks the long form, a leading easting marker
   * without separator marks the short form.
   *
   * @throws MalformedTileNameException if the name has neither structure
   */
  public static TileNameForm of(String tileName) {
    if (tileName == null || tileName.isEmpty()) {
      throw new MalformedTileNameException(String.valueOf(tileName), MalformedTileNameException.Check.STRUCTURE,
                                           "Tile name is empty");
    }
    if (tileName.indexOf(SEPARATOR) > 0) {
      return LONG;
    }
    if (tileName.charAt(0) == EAST) {
      return SHORT;
    }
    throw new MalformedTileNameException(tileName, MalformedTileNameException.Check.STRUCTURE,
                                         "Neither long form (e.g. EU500M_E012N018T6) nor short form (e.g. E012N018T6)");
  }
}
