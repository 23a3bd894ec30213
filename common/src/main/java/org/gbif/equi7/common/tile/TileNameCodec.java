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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;

import static org.gbif.equi7.common.tile.MalformedTileNameException.Check.SAMPLING_MISMATCH;
import static org.gbif.equi7.common.tile.MalformedTileNameException.Check.STRUCTURE;
import static org.gbif.equi7.common.tile.MalformedTileNameException.Check.SUBGRID_MISMATCH;
import static org.gbif.equi7.common.tile.MalformedTileNameException.Check.TILE_SIZE_MISMATCH;

/**
 * Encodes and decodes tile names for one subgrid at one sampling.
 * <p/>
 * A long name is {@code <subgrid><sampling token>M_E<east>N<north><tile class>}, with east and north being the
 * lower-left corner in units of 100km padded to 3 digits, e.g. "EU500M_E012N018T6".  The short name drops everything
 * up to and including the underscore, e.g. "E012N018T6".
 * <p/>
 * Decoding validates every field against this codec's subgrid, sampling and tile class, so a name that decodes is
 * guaranteed to belong to the grid.  This class is threadsafe.
 */
public class TileNameCodec {
  static final int UNIT = 100_000;

  private static final Pattern LONG_NAME = Pattern.compile("^([A-Z]{2})([0-9K]+)M_(E\\d{3}N\\d{3}T\\d)$");
  private static final Pattern SHORT_NAME = Pattern.compile("^E(\\d{3})N(\\d{3})T(\\d)$");
  private static final int MAX_UNITS = 999;

  private final SubgridId subgrid;
  private final int sampling;
  private final TileClass tileClass;
  private final boolean inMetres;

  /**
   * @param subgrid the subgrid names belong to
   * @param sampling the sampling in metres, which determines the tile class
   * @param inMetres true to keep sampling tokens in metres above 999m
   * @throws UnsupportedSamplingException if no tile class accepts the sampling
   */
  public TileNameCodec(SubgridId subgrid, int sampling, boolean inMetres) {
    this.subgrid = Preconditions.checkNotNull(subgrid, "Subgrid is required");
    this.sampling = sampling;
    this.tileClass = TileClass.forSampling(sampling);
    this.inMetres = inMetres;
  }

  /**
   * Encodes the name of the tile with the given lower-left corner at this codec's sampling.
   */
  public String encode(long llx, long lly, boolean shortform) {
    return encode(llx, lly, sampling, tileClass, shortform);
  }

  /**
   * Encodes a tile name in this codec's subgrid for an arbitrary sampling and tile class, as needed when naming tiles
   * of another resolution.
   *
   * @param llx lower-left x in metres
   * @param lly lower-left y in metres
   * @param sampling the sampling for the name's token
   * @param tileClass the tile class, which must be the class of the sampling
   * @param shortform true for the short form
   * @throws UnalignedCornerException if a corner is not a multiple of the tile class extent
   */
  public String encode(long llx, long lly, int sampling, TileClass tileClass, boolean shortform) {
    Preconditions.checkArgument(TileClass.forSampling(sampling) == tileClass,
                                "Sampling %sm does not belong to tile class %s", sampling, tileClass);
    String corners = String.format("E%03dN%03d%s",
                                   toUnits(llx, tileClass, "llx"), toUnits(lly, tileClass, "lly"), tileClass.getCode());
    if (shortform) {
      return corners;
    }
    return subgrid.name() + Samplings.encode(sampling, inMetres) + "M" + TileNameForm.SEPARATOR + corners;
  }

  private static long toUnits(long corner, TileClass tileClass, String axis) {
    if (corner % tileClass.getExtent() != 0) {
      throw new UnalignedCornerException(axis + "=" + corner, corner, tileClass.getExtentUnits());
    }
    Preconditions.checkArgument(isNamable(corner),
                                "Corner %s=%sm is outside the namable range 0..%s00km", axis, corner, MAX_UNITS);
    return corner / UNIT;
  }

  /**
   * @return true if the corner fits the three digits of a tile name
   */
  public static boolean isNamable(long corner) {
    return corner >= 0 && corner / UNIT <= MAX_UNITS;
  }

  /**
   * Decodes a long or short tile name, validating every field against this codec.
   *
   * @return the decoded attributes; short names take subgrid and sampling from this codec
   * @throws MalformedTileNameException if parsing or any check fails
   * @throws UnalignedCornerException if a corner is not aligned to the tile class
   */
  public TileAttributes decode(String tileName) {
    TileNameForm form = TileNameForm.of(tileName);
    if (form == TileNameForm.LONG) {
      Matcher matcher = LONG_NAME.matcher(tileName);
      if (!matcher.matches()) {
        throw new MalformedTileNameException(tileName, STRUCTURE, expectedForms());
      }
      if (!subgrid.name().equals(matcher.group(1))) {
        throw new MalformedTileNameException(tileName, SUBGRID_MISMATCH, "expected subgrid " + subgrid);
      }
      int decodedSampling;
      try {
        decodedSampling = Samplings.decode(matcher.group(2), inMetres);
      } catch (IllegalArgumentException e) {
        throw new MalformedTileNameException(tileName, STRUCTURE, e.getMessage(), e);
      }
      if (decodedSampling != sampling) {
        throw new MalformedTileNameException(tileName, SAMPLING_MISMATCH,
                                             "expected " + sampling + "m, found " + decodedSampling + "m");
      }
      return decodeCorners(tileName, matcher.group(3));
    }
    return decodeCorners(tileName, tileName);
  }

  private TileAttributes decodeCorners(String tileName, String corners) {
    Matcher matcher = SHORT_NAME.matcher(corners);
    if (!matcher.matches()) {
      throw new MalformedTileNameException(tileName, STRUCTURE, expectedForms());
    }
    // the class token carries the tile size, so a matching size also means a matching class
    int tileSize = Integer.parseInt(matcher.group(3)) * UNIT;
    if (tileSize != tileClass.getExtent()) {
      throw new MalformedTileNameException(tileName, TILE_SIZE_MISMATCH,
                                           "expected " + tileClass.getExtent() + "m, found " + tileSize + "m");
    }
    int alignment = tileClass.getExtentUnits();
    long llx = Long.parseLong(matcher.group(1)) * UNIT;
    if (llx % tileClass.getExtent() != 0) {
      throw new UnalignedCornerException(tileName, llx, alignment);
    }
    long lly = Long.parseLong(matcher.group(2)) * UNIT;
    if (lly % tileClass.getExtent() != 0) {
      throw new UnalignedCornerException(tileName, lly, alignment);
    }
    return new TileAttributes(subgrid, sampling, tileSize, llx, lly, tileClass);
  }

  /**
   * Converts a valid name to its short form; short names are returned unchanged.
   *
   * @throws MalformedTileNameException if the name does not belong to this codec
   */
  public String toShortName(String tileName) {
    decode(tileName);
    return shortNameOf(tileName);
  }

  /**
   * @return true if the name decodes without error
   */
  public boolean isValid(String tileName) {
    try {
      decode(tileName);
      return true;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  /**
   * Strips the subgrid and sampling prefix without validation.
   */
  static String shortNameOf(String tileName) {
    return tileName.substring(tileName.indexOf(TileNameForm.SEPARATOR) + 1);
  }

  private String expectedForms() {
    return String.format("Examples: \"%s%sM_E012N036%s\" or \"E012N036%s\"",
                         subgrid, Samplings.encode(sampling, inMetres), tileClass, tileClass);
  }

  public SubgridId getSubgrid() {
    return subgrid;
  }

  public int getSampling() {
    return sampling;
  }

  public TileClass getTileClass() {
    return tileClass;
  }

  public boolean isInMetres() {
    return inMetres;
  }
}
