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

import java.io.Serializable;

import javax.annotation.Nullable;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

/**
 * A correspondence between a pixel of the source page and a geographic coordinate.  Pixel coordinates are continuous
 * with the origin at the top left corner of the page, so the centre of the first pixel is (0.5, 0.5).
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
@AllArgsConstructor
public class ControlPoint implements Serializable {
  private static final long serialVersionUID = 2338914727411025310L;

  // assigned by the store
  @Nullable
  private final String id;
  private final double pixelX;
  private final double pixelY;
  private final double lon;
  private final double lat;

  public static ControlPoint of(double pixelX, double pixelY, double lon, double lat) {
    return new ControlPoint(null, pixelX, pixelY, lon, lat);
  }
}
