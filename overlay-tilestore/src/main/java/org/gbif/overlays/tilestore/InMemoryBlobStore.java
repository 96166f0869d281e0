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

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Object storage held in memory, for tests and single process use.  This class is threadsafe.
 */
public class InMemoryBlobStore implements BlobStore {
  private final ConcurrentNavigableMap<String, Blob> blobs = new ConcurrentSkipListMap<>();

  @Override
  public void put(String key, byte[] data) {
    Preconditions.checkNotNull(key, "A key is required");
    Preconditions.checkNotNull(data, "Data is required");
    blobs.put(key, new Blob(data.clone(), Instant.now()));
  }

  @Override
  public Optional<Blob> get(String key) {
    Blob blob = blobs.get(key);
    return blob == null ? Optional.empty() : Optional.of(new Blob(blob.getData().clone(), blob.getLastModified()));
  }

  @Override
  public boolean delete(String key) {
    return blobs.remove(key) != null;
  }

  @Override
  public List<String> list(String prefix) {
    return ImmutableList.copyOf(blobs.tailMap(prefix, true).keySet().stream()
                                  .takeWhile(k -> k.startsWith(prefix))
                                  .iterator());
  }

  /**
   * @return the number of blobs held
   */
  public int size() {
    return blobs.size();
  }
}
