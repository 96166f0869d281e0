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

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * The pixel dimensions of an overlay's source page.
 */
@Data
@AllArgsConstructor
public class PageSize implements Serializable {
  private static final long serialVersionUID = 6006254530183415213L;

  private final int width;
  private final int height;

  /**
   * True if the continuous pixel position lies on the page, edges included.
   */
  public boolean contains(double x, double y) {
    return x >= 0 && y >= 0 && x <= width && y <= height;
  }
}
