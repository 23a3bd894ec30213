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

import java.io.Serializable;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.locationtech.jts.geom.Envelope;

/**
 * A square tile of a subgrid, identified by its long name.  Tiles are values built on demand; the land flag is taken
 * from the subgrid's precomputed coverage when the tile is created.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Tile implements Serializable {
  private static final long serialVersionUID = -2905712208658342918L;

  private final String name;
  private final SubgridId subgrid;
  private final int sampling;
  private final TileClass tileClass;
  private final long llx;
  private final long lly;
  private final boolean coversLand;

  public Tile(String name, SubgridId subgrid, int sampling, TileClass tileClass, long llx, long lly,
              boolean coversLand) {
    Preconditions.checkArgument(TileNameForm.of(name) == TileNameForm.LONG, "Tiles are named in long form: %s", name);
    Preconditions.checkArgument(llx % tileClass.getExtent() == 0 && lly % tileClass.getExtent() == 0,
                                "Corner (%s, %s) is not aligned to %s", llx, lly, tileClass);
    this.name = name;
    this.subgrid = subgrid;
    this.sampling = sampling;
    this.tileClass = tileClass;
    this.llx = llx;
    this.lly = lly;
    this.coversLand = coversLand;
  }

  /**
   * @return the name without subgrid and sampling, e.g. "E012N018T6"
   */
  public String getShortName() {
    return TileNameCodec.shortNameOf(name);
  }

  /**
   * @return the tile width and height in metres
   */
  public int getExtent() {
    return tileClass.getExtent();
  }

  /**
   * @return the tile width and height in pixels
   */
  public int getSizePx() {
    return tileClass.getExtent() / sampling;
  }

  /**
   * @return the projected bounds of the tile
   */
  public Envelope getEnvelope() {
    return new Envelope(llx, llx + getExtent(), lly, lly + getExtent());
  }

  /**
   * Tiles share their edges, so containment is half-open: west and south edges belong to the tile, east and north
   * edges to the neighbours.
   */
  public boolean contains(double x, double y) {
    return x >= llx && x < llx + getExtent() && y >= lly && y < lly + getExtent();
  }

  public double[] getGeoTransform(PixelOrigin origin) {
    return PixelIndexer.geoTransform(this, origin);
  }

  public PixelIndex pixelIndex(double x, double y, PixelOrigin origin) {
    return PixelIndexer.pixelIndex(this, x, y, origin);
  }
}
