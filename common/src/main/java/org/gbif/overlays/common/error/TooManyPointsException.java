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
 * Raised when a solver's cost ceiling on the number of control points is exceeded.
 */
public class TooManyPointsException extends OverlayException {

  private final int limit;

  public TooManyPointsException(int supplied, int limit) {
    super(ErrorKind.TOO_MANY_POINTS, "At most " + limit + " control points are accepted, supplied: " + supplied);
    this.limit = limit;
  }

  public int getLimit() {
    return limit;
  }
}
