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
package org.gbif.overlays.common.model;

import java.util.Iterator;
import java.util.NoSuchElementException;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * An inclusive, rectangular range of tiles at one zoom level.  Tiles are indexed row by row, so that a position
 * within the range can be recorded as a single number.
 */
@Data
@AllArgsConstructor
public class TileRange implements Iterable<TileAddress> {
  private final int zoom;
  private final long minX;
  private final long minY;
  private final long maxX;
  private final long maxY;

  public long width() {
    return maxX - minX + 1;
  }

  public long height() {
    return maxY - minY + 1;
  }

  public long size() {
    return width() * height();
  }

  public boolean contains(long x, long y) {
    return x >= minX && x <= maxX && y >= minY && y <= maxY;
  }

  /**
   * @return the tile at the row-major index within the range
   */
  public TileAddress address(long index) {
    if (index < 0 || index >= size()) {
      throw new IndexOutOfBoundsException("Index " + index + " outside range of " + size() + " tiles");
    }
    return new TileAddress(zoom, minX + index % width(), minY + index / width());
  }

  @Override
  public Iterator<TileAddress> iterator() {
    return new Iterator<TileAddress>() {
      private long next = 0;

      @Override
      public boolean hasNext() {
        return next < size();
      }

      @Override
      public TileAddress next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        return address(next++);
      }
    };
  }
}
