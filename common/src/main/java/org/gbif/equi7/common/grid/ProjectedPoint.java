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

import java.io.Serializable;

import org.gbif.equi7.common.tile.SubgridId;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A position projected into the plane of the subgrid holding it.
 */
@Data
@AllArgsConstructor
public class ProjectedPoint implements Serializable {
  private static final long serialVersionUID = 8094718562617015683L;

  private final SubgridId subgrid;
  private final double x;
  private final double y;
}
