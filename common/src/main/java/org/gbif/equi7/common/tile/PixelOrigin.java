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
 * Where row 0 of a tile lies.  Columns always start at the west edge and increase eastwards.
 */
public enum PixelOrigin {
  /** Row 0 at the north edge, rows increase southwards. */
  TOP_DOWN,
  /** Row 0 at the south edge, rows increase northwards. */
  BOTTOM_UP
}
