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

import org.gbif.overlays.common.model.TileAddress;

/**
 * A single tile could not be rendered.  Sibling tiles are unaffected.
 */
public class TileRenderException extends RuntimeException {
  private final TileAddress address;

  public TileRenderException(TileAddress address, String message) {
    super("Tile " + address + ": " + message);
    this.address = address;
  }

  public TileRenderException(TileAddress address, String message, Throwable cause) {
    super("Tile " + address + ": " + message, cause);
    this.address = address;
  }

  public TileAddress getAddress() {
    return address;
  }
}
