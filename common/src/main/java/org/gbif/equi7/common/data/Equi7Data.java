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
package org.gbif.equi7.common.data;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

/**
 * The static dataset of the grid, keyed by subgrid tag.
 */
@Data
@Builder
@Jacksonized
public class Equi7Data {
  private final String version;
  private final Map<String, SubgridData> subgrids;

  /**
   * The static data of one subgrid.
   */
  @Data
  @Builder
  @Jacksonized
  public static class SubgridData {
    // extent in WGS84 as WKT (multi)polygon
    private final String zoneExtent;
    // projection as WKT, kept for reference
    private final String wkt;
    // projection as PROJ parameters, used for transforms
    private final String proj4;
    // tile class code to the short names of tiles covering land
    private final Map<String, List<String>> coverland;
  }
}
