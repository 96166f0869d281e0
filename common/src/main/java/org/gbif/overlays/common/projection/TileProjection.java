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

import org.gbif.overlays.common.model.Bounds;

/**
 * Defines the interface for dealing with conversions between WGS84 referenced coordinates and pixels within tiles
 * at various zoom levels.
 */
public interface TileProjection {

  /**
   * Converts the coordinate to the global pixel address at the given zoom.
   * @param latitude To convert
   * @param longitude To convert
   * @param zoom The zoom level
   * @return The pixel location addressed globally
   */
  Double2D toGlobalPixelXY(double latitude, double longitude, int zoom);

  /**
   * Converts a global pixel address back to the coordinate.
   * @param globalPixelXY The pixel location addressed globally
   * @param zoom The zoom level
   * @return The coordinate with x as longitude and y as latitude
   */
  Double2D fromGlobalPixelXY(Double2D globalPixelXY, int zoom);

  boolean isPlottable(double latitude, double longitude);

  /**
   * Returns the bounding box enveloping the given tile.
   * @param zoom The zoom level
   * @param x The tile column
   * @param y The tile row
   */
  Bounds tileBoundary(int zoom, long x, long y);

  int getTileSize();
}
