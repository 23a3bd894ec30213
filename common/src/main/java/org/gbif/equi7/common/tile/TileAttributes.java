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

import java.io.Serializable;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * The structured content of a tile name.  Corners are in metres.
 */
@Data
@AllArgsConstructor
public class TileAttributes implements Serializable {
  private static final long serialVersionUID = 2270135829017262146L;

  private final SubgridId subgrid;
  private final int sampling;
  private final int tileSize;
  private final long llx;
  private final long lly;
  private final TileClass tileClass;
}
