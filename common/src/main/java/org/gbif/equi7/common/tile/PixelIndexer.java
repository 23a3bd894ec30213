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

import java.awt.geom.AffineTransform;
import java.awt.geom.NoninvertibleTransformException;
import java.awt.geom.Point2D;

/**
 * Converts projected coordinates into pixel addresses within a tile, by inverting the tile's affine transform.
 * Results are floored, so a coordinate on a pixel edge belongs to the pixel that starts at that edge.
 */
public class PixelIndexer {

  private PixelIndexer() {}

  /**
   * The GDAL ordered geotransform of the tile:
   * {@code [originX, pixelWidth, rowRotation, originY, columnRotation, pixelHeight]}.
   * The origin is the north-west corner for {@link PixelOrigin#TOP_DOWN} (with a negative pixel height) and the
   * south-west corner for {@link PixelOrigin#BOTTOM_UP}.
   */
  public static double[] geoTransform(Tile tile, PixelOrigin origin) {
    double sampling = tile.getSampling();
    if (origin == PixelOrigin.BOTTOM_UP) {
      return new double[] {tile.getLlx(), sampling, 0, tile.getLly(), 0, sampling};
    }
    return new double[] {tile.getLlx(), sampling, 0, tile.getLly() + tile.getExtent(), 0, -sampling};
  }

  /**
   * Returns the pixel holding the projected coordinate.  Coordinates outside the tile yield indexes outside
   * {@code [0, tile.getSizePx())}; the caller decides whether that matters.
   *
   * @param tile the tile addressed
   * @param x projected easting in metres
   * @param y projected northing in metres
   * @param origin the row convention
   */
  public static PixelIndex pixelIndex(Tile tile, double x, double y, PixelOrigin origin) {
    AffineTransform pixelToWorld = toAffineTransform(geoTransform(tile, origin));
    try {
      Point2D pixel = pixelToWorld.inverseTransform(new Point2D.Double(x, y), null);
      return new PixelIndex((long) Math.floor(pixel.getX()), (long) Math.floor(pixel.getY()));
    } catch (NoninvertibleTransformException e) {
      throw new IllegalStateException("Geotransform of tile " + tile.getName() + " is not invertible", e);
    }
  }

  static AffineTransform toAffineTransform(double[] gt) {
    // AffineTransform orders its arguments m00, m10, m01, m11, m02, m12
    return new AffineTransform(gt[1], gt[4], gt[2], gt[5], gt[0], gt[3]);
  }
}
