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

import java.time.Instant;

import com.google.common.hash.Hashing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * A rendered raster tile of an overlay, belonging to exactly one transform version.
 */
@Data
@Builder
@AllArgsConstructor
public class Tile {
  public static final String PNG = "png";

  private final String overlayId;
  private final int transformVersion;
  private final int z;
  private final long x;
  private final long y;
  private final String format;
  private final byte[] payload;
  // SHA-256 of the payload
  private final String etag;
  private final Instant createdAt;

  /**
   * @return the entity tag of the payload, identical for identical bytes
   */
  public static String etagOf(byte[] payload) {
    return Hashing.sha256().hashBytes(payload).toString();
  }

  public int getSize() {
    return payload == null ? 0 : payload.length;
  }

  public TileAddress getAddress() {
    return new TileAddress(z, x, y);
  }

  @Override
  public String toString() {
    return "Tile{" + overlayId + " v" + transformVersion + " " + z + "/" + x + "/" + y + " " + format
           + ", " + getSize() + " bytes, etag=" + etag + '}';
  }
}
