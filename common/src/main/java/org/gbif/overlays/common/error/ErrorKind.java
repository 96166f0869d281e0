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
 * The kinds of error reported by the georeferencing engine, from the most specific cause.
 */
public enum ErrorKind {
  /** Bad control point or tile address data. */
  INVALID_INPUT(false),
  /** The control points cannot determine a transformation of the requested kind. */
  DEGENERATE_GEOMETRY(false),
  /** More control points than the solver accepts for the kind. */
  TOO_MANY_POINTS(false),
  /** The source page is unreadable. */
  SOURCE_UNAVAILABLE(false),
  /** Object storage failed, possibly temporarily. */
  STORAGE_FAILURE(true),
  /** A job attempt exceeded its time allowance. */
  TIMEOUT(true),
  /** Too many tiles of a zoom level failed to render. */
  PARTIAL_TILE_FAILURE(true);

  private final boolean retryable;

  ErrorKind(boolean retryable) {
    this.retryable = retryable;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
