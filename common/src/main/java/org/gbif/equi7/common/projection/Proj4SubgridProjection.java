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

import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.ProjCoordinate;

/**
 * A subgrid projection defined by PROJ parameters, e.g.
 * {@code +proj=aeqd +lat_0=53 +lon_0=24 +x_0=5837287.81977 +y_0=2121415.69617 +datum=WGS84 +units=m +no_defs}.
 * <p/>
 * Proj4J transforms hold intermediate state, so each thread is given its own pair.  This class is threadsafe.
 */
class Proj4SubgridProjection implements SubgridProjection {
  static final String WGS84_PARAMETERS = "+proj=longlat +datum=WGS84 +no_defs";

  private final String name;
  private final String parameters;
  private final ThreadLocal<Transforms> transforms;

  /**
   * @throws org.locationtech.proj4j.Proj4jException if the parameters cannot be parsed
   */
  Proj4SubgridProjection(String name, String parameters) {
    this.name = name;
    this.parameters = parameters;
    Transforms initial = new Transforms(name, parameters); // fail early on bad parameters
    this.transforms = ThreadLocal.withInitial(() -> new Transforms(name, parameters));
    this.transforms.set(initial);
  }

  @Override
  public PlanarPoint toPlanar(double lon, double lat) {
    ProjCoordinate p = transforms.get().forward.transform(new ProjCoordinate(lon, lat), new ProjCoordinate());
    return new PlanarPoint(p.x, p.y);
  }

  @Override
  public LonLat toGeodetic(double x, double y) {
    ProjCoordinate p = transforms.get().inverse.transform(new ProjCoordinate(x, y), new ProjCoordinate());
    return new LonLat(p.x, p.y);
  }

  String getParameters() {
    return parameters;
  }

  @Override
  public String toString() {
    return "Proj4SubgridProjection{" + name + ": " + parameters + '}';
  }

  private static class Transforms {
    private final CoordinateTransform forward;
    private final CoordinateTransform inverse;

    Transforms(String name, String parameters) {
      CRSFactory crsFactory = new CRSFactory();
      CoordinateReferenceSystem geodetic = crsFactory.createFromParameters("WGS84", WGS84_PARAMETERS);
      CoordinateReferenceSystem planar = crsFactory.createFromParameters(name, parameters);
      CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();
      forward = transformFactory.createTransform(geodetic, planar);
      inverse = transformFactory.createTransform(planar, geodetic);
    }
  }
}
