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

import java.util.Set;

import org.gbif.equi7.common.tile.SubgridId;

import com.google.common.collect.ImmutableSet;

/**
 * Thrown when a point lies in no subgrid, or in more than one.
 */
public class UnresolvedPointException extends IllegalArgumentException {
  private static final long serialVersionUID = -715218860398106402L;

  public enum Reason {
    NO_SUBGRID,
    AMBIGUOUS
  }

  private final double lon;
  private final double lat;
  private final Reason reason;
  private final ImmutableSet<SubgridId> candidates;

  public UnresolvedPointException(double lon, double lat, Set<SubgridId> candidates) {
    super(String.format("Point (%s, %s) %s", lon, lat,
                        candidates.isEmpty() ? "lies in no subgrid" : "is ambiguous between subgrids " + candidates));
    this.lon = lon;
    this.lat = lat;
    this.reason = candidates.isEmpty() ? Reason.NO_SUBGRID : Reason.AMBIGUOUS;
    this.candidates = ImmutableSet.copyOf(candidates);
  }

  public double getLon() {
    return lon;
  }

  public double getLat() {
    return lat;
  }

  public Reason getReason() {
    return reason;
  }

  public ImmutableSet<SubgridId> getCandidates() {
    return candidates;
  }
}
