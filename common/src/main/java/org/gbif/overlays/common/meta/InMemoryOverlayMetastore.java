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

import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A metastore for a single process.
 */
class InMemoryOverlayMetastore implements OverlayMetastore {
  private final Map<String, Integer> active = new ConcurrentHashMap<>();
  private final Map<String, String> owners = new ConcurrentHashMap<>();

  @Override
  public OptionalInt activeVersion(String overlayId) {
    Integer version = active.get(overlayId);
    return version == null ? OptionalInt.empty() : OptionalInt.of(version);
  }

  @Override
  public void activate(String overlayId, int version) {
    active.put(overlayId, version);
  }

  @Override
  public boolean acquire(String overlayId, String token) {
    String holder = owners.putIfAbsent(overlayId, token);
    return holder == null || holder.equals(token);
  }

  @Override
  public Optional<String> owner(String overlayId) {
    return Optional.ofNullable(owners.get(overlayId));
  }

  @Override
  public boolean release(String overlayId, String token) {
    return owners.remove(overlayId, token);
  }

  @Override
  public void close() {
  }
}
