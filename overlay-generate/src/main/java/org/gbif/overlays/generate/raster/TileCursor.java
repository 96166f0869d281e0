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
package org.gbif.overlays.generate.raster;

import java.io.Serializable;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A position in a tile sequence: a zoom level and the row-major index of a tile within that level's range.  Recording
 * the cursor allows a sequence to resume without replaying completed tiles.
 */
@Data
@AllArgsConstructor
public class TileCursor implements Serializable {
  private static final long serialVersionUID = -1848124406771587207L;

  public static final TileCursor START = new TileCursor(0, 0);

  private final int zoom;
  private final long index;

  /**
   * @return the first tile of the zoom level
   */
  public static TileCursor atZoom(int zoom) {
    return new TileCursor(zoom, 0);
  }
}
