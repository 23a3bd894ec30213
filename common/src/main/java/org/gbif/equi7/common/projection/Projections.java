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
package org.gbif.equi7.common.projection;

import org.locationtech.proj4j.Proj4jException;

/**
 * Factories for subgrid projections.
 */
public class Projections {

  private Projections() {}

  /**
   * Builds the projection from PROJ parameters.
   *
   * @param name a label for the projection, e.g. the subgrid tag
   * @param parameters the PROJ parameter string
   * @return the projection
   * @throws IllegalArgumentException if the parameters cannot be parsed
   */
  public static SubgridProjection fromProj4(String name, String parameters) throws IllegalArgumentException {
    if (parameters == null || parameters.trim().isEmpty()) {
      throw new IllegalArgumentException("No projection parameters supplied for " + name);
    }
    try {
      return new Proj4SubgridProjection(name, parameters.trim());
    } catch (Proj4jException | IllegalArgumentException e) {
      throw new IllegalArgumentException("Unable to build projection " + name + " from [" + parameters + "]", e);
    }
  }
}
