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

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.stream.IntStream;

import org.gbif.equi7.common.tile.SubgridId;

import com.google.common.base.Preconditions;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.index.strtree.STRtree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Determines which subgrid holds a WGS84 point.
 * <p/>
 * A point resolves only if exactly one zone contains it strictly.  Points in no zone (open ocean, or exactly on a
 * zone boundary) and points in several zones (overlaps) do not resolve; the resolver never picks one arbitrarily.
 * <p/>
 * Zones are indexed in an STRtree by the envelope of each of their polygons, so a query only tests the zones whose
 * envelope holds the point.  The index is built on construction, after which this class is threadsafe.
 */
public class SubgridResolver {
  private static final Logger LOG = LoggerFactory.getLogger(SubgridResolver.class);
  private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

  private final STRtree index = new STRtree();
  private final int parallelThreshold;

  /**
   * @param zones the zones to resolve against
   * @param parallelThreshold batches of at least this many points are resolved in parallel
   */
  public SubgridResolver(Collection<SubgridZone> zones, int parallelThreshold) {
    Preconditions.checkArgument(parallelThreshold > 0, "Parallel threshold must be positive");
    this.parallelThreshold = parallelThreshold;
    for (SubgridZone zone : zones) {
      Geometry extent = zone.getExtent();
      // index polygons separately, as a zone split at the antimeridian has a world-wide envelope
      for (int i = 0; i < extent.getNumGeometries(); i++) {
        index.insert(extent.getGeometryN(i).getEnvelopeInternal(), zone);
      }
    }
    index.build();
  }

  /**
   * @return every subgrid strictly containing the point
   */
  public EnumSet<SubgridId> matching(double lon, double lat) {
    Point point = GEOMETRY_FACTORY.createPoint(new Coordinate(lon, lat));
    EnumSet<SubgridId> matches = EnumSet.noneOf(SubgridId.class);
    List<?> candidates = index.query(point.getEnvelopeInternal());
    for (Object candidate : candidates) {
      SubgridZone zone = (SubgridZone) candidate;
      if (!matches.contains(zone.getId()) && zone.contains(point)) {
        matches.add(zone.getId());
      }
    }
    return matches;
  }

  /**
   * @return the only subgrid containing the point, or null if none or several contain it
   */
  public SubgridId resolve(double lon, double lat) {
    EnumSet<SubgridId> matches = matching(lon, lat);
    return matches.size() == 1 ? matches.iterator().next() : null;
  }

  /**
   * @return the only subgrid containing the point
   * @throws UnresolvedPointException if none or several contain it
   */
  public SubgridId resolveOrThrow(double lon, double lat) {
    EnumSet<SubgridId> matches = matching(lon, lat);
    if (matches.size() != 1) {
      throw new UnresolvedPointException(lon, lat, matches);
    }
    return matches.iterator().next();
  }

  /**
   * Resolves many points.  The result holds one slot per input point in input order, null where the point does not
   * resolve.
   */
  public SubgridId[] resolve(double[] lons, double[] lats) {
    Preconditions.checkArgument(lons.length == lats.length, "Longitudes and latitudes differ in length");
    SubgridId[] result = new SubgridId[lons.length];
    IntStream indexes = IntStream.range(0, lons.length);
    if (lons.length >= parallelThreshold) {
      indexes = indexes.parallel();
    }
    indexes.forEach(i -> result[i] = resolve(lons[i], lats[i]));

    if (LOG.isDebugEnabled()) {
      long unresolved = IntStream.range(0, result.length).filter(i -> result[i] == null).count();
      LOG.debug("Resolved {} of {} points to a subgrid", result.length - unresolved, result.length);
    }
    return result;
  }
}
