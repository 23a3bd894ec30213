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
 * Thrown when a sampling falls outside every tile class, or outside the legal samplings of a grid.
 */
public class UnsupportedSamplingException extends IllegalArgumentException {
  private static final long serialVersionUID = -3216407915218806733L;

  private final int sampling;

  public UnsupportedSamplingException(int sampling) {
    super("Sampling " + sampling + "m is not supported. Supported samplings: " + Samplings.LEGAL);
    this.sampling = sampling;
  }

  public int getSampling() {
    return sampling;
  }
}
