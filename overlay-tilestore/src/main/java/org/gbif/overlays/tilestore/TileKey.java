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
package org.gbif.overlays.tilestore;

import java.io.Serializable;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Identifies a tile of one transform version of an overlay.
 */
@Data
@AllArgsConstructor
public class TileKey implements Serializable {
  private static final long serialVersionUID = -3287216409917374163L;

  private final String overlayId;
  private final int version;
  private final int z;
  private final long x;
  private final long y;

  /**
   * @return the storage key, {@code tiles/<overlay>/v<version>/<z>/<x>/<y>.png}
   */
  public String blobKey() {
    return versionPrefix(overlayId, version) + z + "/" + x + "/" + y + ".png";
  }

  static String overlayPrefix(String overlayId) {
    return "tiles/" + overlayId + "/";
  }

  static String versionPrefix(String overlayId, int version) {
    return overlayPrefix(overlayId) + "v" + version + "/";
  }

  static String reclaimableMarker(String overlayId, int version) {
    return overlayPrefix(overlayId) + "v" + version + ".reclaimable";
  }
}
