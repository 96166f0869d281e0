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
package org.gbif.overlays.common.error;

/**
 * Raised when the share of failed tiles at a zoom level exceeds the threshold.
 */
public class PartialTileFailureException extends OverlayException {

  private final int zoom;
  private final int failed;
  private final int total;

  public PartialTileFailureException(int zoom, int failed, int total, double threshold) {
    super(ErrorKind.PARTIAL_TILE_FAILURE,
          String.format("Zoom %d: %d of %d tiles failed, above the threshold of %.1f%%", zoom, failed, total,
                        threshold * 100));
    this.zoom = zoom;
    this.failed = failed;
    this.total = total;
  }

  public int getZoom() {
    return zoom;
  }

  public int getFailed() {
    return failed;
  }

  public int getTotal() {
    return total;
  }
}
