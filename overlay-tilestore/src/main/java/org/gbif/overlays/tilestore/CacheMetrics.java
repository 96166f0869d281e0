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

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.cache2k.Cache;
import org.cache2k.core.api.InternalCache;

/**
 * Exposes cache2k statistics as Micrometer gauges.
 */
public class CacheMetrics {

  private CacheMetrics() {}

  public static void register(Cache<?, ?> cache, MeterRegistry meterRegistry) {
    InternalCache<?, ?> internalCache = cache.requestInterface(InternalCache.class);

    Gauge.builder("cache.size", internalCache, InternalCache::getTotalEntryCount)
        .description("The number of entries in the cache")
        .tags("cache", cache.getName())
        .register(meterRegistry);

    Gauge.builder("cache.gets", internalCache, c -> c.getInfo().getGetCount())
        .description("The number of cache gets (hits + misses)")
        .tags("cache", cache.getName())
        .register(meterRegistry);

    Gauge.builder("cache.hits", internalCache, c -> c.getInfo().getHeapHitCount())
        .description("The number of cache hits")
        .tags("cache", cache.getName())
        .register(meterRegistry);

    Gauge.builder("cache.misses", internalCache, c -> c.getInfo().getMissCount())
        .description("The number of cache misses")
        .tags("cache", cache.getName())
        .register(meterRegistry);

    Gauge.builder("cache.hit_rate", internalCache, c -> c.getInfo().getHitRate())
        .description("Hit rate for this cache")
        .tags("cache", cache.getName())
        .register(meterRegistry);

    Gauge.builder("cache.load_count", internalCache, c -> c.getInfo().getLoadCount())
        .description("Tiles read from storage")
        .tags("cache", cache.getName())
        .register(meterRegistry);

    Gauge.builder("cache.expired_count", internalCache, c -> c.getInfo().getExpiredCount())
        .description("Counts entries that expired")
        .tags("cache", cache.getName())
        .register(meterRegistry);

    Gauge.builder("cache.heap_capacity", internalCache, c -> c.getInfo().getHeapCapacity())
        .description("Configured limit of the total cache entry capacity")
        .tags("cache", cache.getName())
        .register(meterRegistry);
  }
}
