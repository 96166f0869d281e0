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
package org.gbif.overlays.generate.workflow;

import org.gbif.overlays.common.error.StorageException;
import org.gbif.overlays.tilestore.TileStore;

import java.util.Set;

import com.google.common.collect.ImmutableSet;

import lombok.extern.slf4j.Slf4j;

/**
 * Garbage collection of superseded tile versions, run periodically.  Deletion is kept out of the jobs themselves so
 * that readers of an old version are not cut off mid-request.
 */
@Slf4j
class TileSweeper implements Runnable {
  private final TileStore tileStore;
  private final Set<String> overlays;
  private final int keepLatestVersions;

  /**
   * @param overlays the overlays awaiting a sweep, threadsafe and shared with the writers that invalidate versions
   */
  TileSweeper(TileStore tileStore, Set<String> overlays, int keepLatestVersions) {
    this.tileStore = tileStore;
    this.overlays = overlays;
    this.keepLatestVersions = keepLatestVersions;
  }

  @Override
  public void run() {
    for (String overlayId : ImmutableSet.copyOf(overlays)) {
      // removed first, so a version invalidated during the sweep is picked up next time
      overlays.remove(overlayId);
      try {
        tileStore.evictOlderThan(overlayId, keepLatestVersions);
      } catch (StorageException e) {
        overlays.add(overlayId);
        log.warn("Sweep of overlay {} failed", overlayId, e);
      }
    }
  }
}
