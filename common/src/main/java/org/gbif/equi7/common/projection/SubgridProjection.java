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

/**
 * Converts between WGS84 longitude/latitude and the projected plane of one subgrid.  Implementations must be
 * threadsafe and deterministic.
 * <p/>
 * The Proj4J implementation agrees with the reference Equi7Grid coordinates to a few centimetres, not exactly.  At
 * 1m sampling a point lying within that distance of a pixel edge may be assigned to the neighbouring pixel.
 */
public interface SubgridProjection {

  /**
   * @param lon longitude in decimal degrees
   * @param lat latitude in decimal degrees
   * @return the projected coordinate in metres
   */
  PlanarPoint toPlanar(double lon, double lat);

  /**
   * @param x projected easting in metres
   * @param y projected northing in metres
   * @return the geodetic position
   */
  LonLat toGeodetic(double x, double y);
}
