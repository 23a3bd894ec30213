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
 * The seven continental subgrids, each with its own azimuthal equidistant projection.
 */
public enum SubgridId {
  AF("Africa"),
  AN("Antarctica"),
  AS("Asia"),
  EU("Europe"),
  NA("North America"),
  OC("Oceania"),
  SA("South America");

  private final String continent;

  SubgridId(String continent) {
    this.continent = continent;
  }

  public String getContinent() {
    return continent;
  }

  /**
   * @return the subgrid for the two letter tag, or null if the tag names no subgrid
   */
  public static SubgridId fromTag(String tag) {
    for (SubgridId id : values()) {
      if (id.name().equals(tag)) {
        return id;
      }
    }
    return null;
  }
}
