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
package org.gbif.overlays.common.meta;

import org.gbif.overlays.common.error.StorageException;

import java.io.Closeable;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Shared state about overlays which must be consistent across worker processes: which transform version is active,
 * and which job currently owns each overlay.
 * <p>
 * Ownership is an explicit token rather than a lock.  At most one token is held per overlay, it is taken by an
 * exclusive create and released only by its holder.
 * Implementations report failures of their backing service as {@link StorageException}.
 */
public interface OverlayMetastore extends Closeable {

  /**
   * @return the version tiles are currently served from, if any
   */
  OptionalInt activeVersion(String overlayId);

  /**
   * Makes the version current, replacing any other.
   */
  void activate(String overlayId, int version);

  /**
   * Takes ownership of the overlay for the token.
   *
   * @return true if the token now holds the overlay, including when it already did
   */
  boolean acquire(String overlayId, String token);

  /**
   * @return the token currently holding the overlay
   */
  Optional<String> owner(String overlayId);

  /**
   * Gives up ownership, if the token holds it.
   *
   * @return true if the token held the overlay
   */
  boolean release(String overlayId, String token);
}
