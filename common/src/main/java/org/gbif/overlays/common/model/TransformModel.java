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
import java.time.Instant;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

/**
 * A fitted mapping from the pixels of an overlay's source page to geographic coordinates.  The coefficients are those
 * of the kind's transformation and restore it exactly.  Models are never edited; committing new control points
 * creates a new version.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
@AllArgsConstructor
public class TransformModel implements Serializable {
  private static final long serialVersionUID = -5617261587440335917L;

  private final String overlayId;
  // 0 until persisted
  private final int version;
  private final TransformKind kind;
  private final double[] coefficients;
  private final double rmse;
  private final Bounds bounds;
  private final Instant createdAt;
  private final List<ControlPoint> controlPoints;
  private final int pageWidth;
  private final int pageHeight;
}
