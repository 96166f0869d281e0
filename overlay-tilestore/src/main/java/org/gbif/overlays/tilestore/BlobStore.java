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

import org.gbif.overlays.common.error.StorageException;

import java.util.List;
import java.util.Optional;

/**
 * The object storage boundary.  Keys are '/' separated paths.  Implementations must accept concurrent writers of
 * distinct keys, and resolve concurrent writers of the same key by last writer wins.
 * <p>
 * Any retrying of the underlying service is the implementation's concern.  Failures which remain are reported as
 * {@link StorageException}, which callers treat as transient.
 */
public interface BlobStore {

  /**
   * Writes the bytes, replacing any existing blob.
   */
  void put(String key, byte[] data);

  Optional<Blob> get(String key);

  /**
   * @return true if a blob was deleted
   */
  boolean delete(String key);

  /**
   * @return the keys starting with the prefix, in lexicographic order
   */
  List<String> list(String prefix);
}
