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
package org.gbif.overlays.common.projection;

import org.gbif.overlays.common.error.InvalidInputException;
import org.gbif.overlays.common.model.Bounds;
import org.gbif.overlays.common.model.TileRange;

/**
 * Factories and utilities for addressing slippy map tiles.
 */
public class Tiles {

  /**
   * The deepest zoom level an overlay is tiled to.
   */
  public static final int MAX_ZOOM = 22;

  private Tiles() {}

  /**
   * Factory of TileProjection for the given ESPG code.
   * @param epsg That defines the projection
   * @param size Of the tile in use
   * @return The TileProjection for the EPSG
   * @throws IllegalArgumentException If the EPSG is not supported
   */
  public static TileProjection fromEPSG(String epsg, int size) throws IllegalArgumentException {
    if (SphericalMercator.EPSG_CODE.equalsIgnoreCase(epsg)) {
      return new SphericalMercator(size);
    }
    throw new IllegalArgumentException("Unsupported EPSG supplied: " + epsg);
  }

  /**
   * @return the number of tiles along each axis at the zoom
   */
  public static long tilesAtZoom(int z) {
    return 1L << z;
  }

  /**
   * Verifies the zoom lies within the supported range.
   * @throws InvalidInputException if not
   */
  public static void checkZoom(int z) {
    if (z < 0 || z > MAX_ZOOM) {
      throw new InvalidInputException("Zoom must be between 0 and " + MAX_ZOOM + ", supplied: " + z);
    }
  }

  /**
   * Verifies the tile address satisfies 0 <= x,y < 2^z.
   * @throws InvalidInputException if not
   */
  public static void checkAddress(int z, long x, long y) {
    checkZoom(z);
    long n = tilesAtZoom(z);
    if (x < 0 || y < 0 || x >= n || y >= n) {
      throw new InvalidInputException(String.format("Tile %d/%d/%d is outside the tile matrix", z, x, y));
    }
  }

  /**
   * Provides the range of tiles whose envelope intersects the given bounds at the zoom.  Latitudes beyond the limit of
   * the projection are clamped to it, and the range is clamped to [0, 2^z).
   *
   * @param bounds     The geographic bounds to cover
   * @param projection The projection defining the tiles
   * @param z          The zoom level
   *
   * @return The inclusive range of tile addresses
   */
  public static TileRange tileRange(Bounds bounds, TileProjection projection, int z) {
    checkZoom(z);
    int tileSize = projection.getTileSize();
    double west = Math.max(-180, Math.min(180, bounds.getWest()));
    double east = Math.max(-180, Math.min(180, bounds.getEast()));
    Double2D nw = projection.toGlobalPixelXY(bounds.getNorth(), west, z);
    Double2D se = projection.toGlobalPixelXY(bounds.getSouth(), east, z);

    long maxAddress = tilesAtZoom(z) - 1;
    long minX = clamp((long) Math.floor(nw.getX() / tileSize), maxAddress);
    long minY = clamp((long) Math.floor(nw.getY() / tileSize), maxAddress);
    long maxX = clamp(Math.max(minX, (long) Math.ceil(se.getX() / tileSize) - 1), maxAddress);
    long maxY = clamp(Math.max(minY, (long) Math.ceil(se.getY() / tileSize) - 1), maxAddress);
    return new TileRange(z, minX, minY, maxX, maxY);
  }

  private static long clamp(long address, long maxAddress) {
    return Math.min(Math.max(address, 0), maxAddress);
  }
}
