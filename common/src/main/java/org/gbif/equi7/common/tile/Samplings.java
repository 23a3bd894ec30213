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

import java.util.regex.Pattern;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The legal samplings of the grid and the token encoding of a sampling inside tile names.
 * <p/>
 * Tokens are the zero padded value in metres (e.g. "010", "500") below 1000m.  From 1000m upwards the kilometre form
 * "&lt;thousands&gt;K&lt;hundreds&gt;" is used (e.g. 1500 is "1K5") unless names in metres are requested, in which case
 * the value in metres is kept (e.g. "1500").  The kilometre form is lossy for samplings which are not a multiple of
 * 100m.
 */
public class Samplings {
  private static final Logger LOG = LoggerFactory.getLogger(Samplings.class);

  private static final Pattern DIGITS = Pattern.compile("\\d+");
  private static final char KILOMETRE = 'K';

  /**
   * The samplings a grid may be constructed with, in metres.
   */
  public static final ImmutableSet<Integer> LEGAL = ImmutableSet.of(
    6000, 3000, 1000, 800, 750, 600, 500, 400, 300, 250, 200, 150, 125, 100, 96, 80, 75, 64,
    60, 50, 48, 40, 32, 30, 25, 24, 20,
    16, 10, 8, 5, 4, 2, 1);

  static {
    for (int sampling : inconsistentSamplings()) {
      LOG.warn("Legal sampling {}m fails the tile class divisibility rule and will be rejected", sampling);
    }
  }

  private Samplings() {}

  public static boolean isLegal(int sampling) {
    return LEGAL.contains(sampling);
  }

  /**
   * Ensures the sampling is both enumerated as legal and accepted by a tile class.
   *
   * @return the tile class of the sampling
   * @throws UnsupportedSamplingException otherwise
   */
  public static TileClass requireLegal(int sampling) {
    if (!isLegal(sampling)) {
      throw new UnsupportedSamplingException(sampling);
    }
    return TileClass.forSampling(sampling);
  }

  /**
   * Encodes the sampling for use in a tile name.
   *
   * @param sampling the sampling in metres
   * @param inMetres keep the value in metres even above 999m
   * @return the sampling token, e.g. "500", "1K5" or "1500"
   */
  public static String encode(int sampling, boolean inMetres) {
    if (sampling <= 0) {
      throw new UnsupportedSamplingException(sampling);
    }
    if (inMetres || sampling < 1000) {
      return Strings.padStart(String.valueOf(sampling), 3, '0');
    }
    if (sampling >= 10_000) {
      throw new UnsupportedSamplingException(sampling);
    }
    if (!isKilometreExact(sampling)) {
      LOG.warn("Sampling {}m cannot be expressed exactly in kilometre form", sampling);
    }
    return "" + sampling / 1000 + KILOMETRE + (sampling % 1000) / 100;
  }

  /**
   * Decodes a sampling token as produced by {@link #encode(int, boolean)}.
   *
   * @return the sampling in metres
   * @throws IllegalArgumentException if the token cannot be read
   */
  public static int decode(String token, boolean inMetres) {
    if (token == null || token.isEmpty()) {
      throw new IllegalArgumentException("Sampling token is empty");
    }
    if (!inMetres) {
      if (token.length() != 3) {
        throw new IllegalArgumentException("Sampling token must have 3 characters. Supplied: " + token);
      }
      if (token.charAt(1) == KILOMETRE) {
        char thousands = token.charAt(0);
        char hundreds = token.charAt(2);
        if (!Character.isDigit(thousands) || !Character.isDigit(hundreds)) {
          throw new IllegalArgumentException("Malformed kilometre sampling token: " + token);
        }
        return (thousands - '0') * 1000 + (hundreds - '0') * 100;
      }
    }
    if (!DIGITS.matcher(token).matches()) {
      throw new IllegalArgumentException("Malformed sampling token: " + token);
    }
    return Integer.parseInt(token);
  }

  /**
   * @return true if the kilometre form of the sampling decodes back to the same value
   */
  public static boolean isKilometreExact(int sampling) {
    return sampling > 0 && sampling < 10_000 && sampling % 100 == 0;
  }

  /**
   * The enumerated samplings rejected by {@link TileClass#forSampling(int)}.  The divisibility rule is authoritative,
   * so any value listed here cannot be used to build a grid.
   */
  @VisibleForTesting
  static ImmutableSet<Integer> inconsistentSamplings() {
    ImmutableSet.Builder<Integer> inconsistent = ImmutableSet.builder();
    for (int sampling : LEGAL) {
      try {
        TileClass.forSampling(sampling);
      } catch (UnsupportedSamplingException e) {
        inconsistent.add(sampling);
      }
    }
    return inconsistent.build();
  }
}
