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

/**
 * The stages an overlay passes through while being georeferenced and tiled.
 * <pre>
 *   PENDING -> SOLVING -> RASTERIZING -> READY
 *                 |            |
 *                 +-> FAILED <-+
 * </pre>
 * A commit of new control points against a READY overlay starts a new job which enters SOLVING again.
 */
public enum JobStage {
  PENDING,
  SOLVING,
  RASTERIZING,
  READY,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this == READY || this == FAILED || this == CANCELLED;
  }
}
