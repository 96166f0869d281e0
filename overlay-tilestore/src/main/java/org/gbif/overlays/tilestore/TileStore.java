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
import org.gbif.overlays.common.meta.OverlayMetastore;
import org.gbif.overlays.common.model.Tile;
import org.gbif.overlays.common.projection.Tiles;

import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.base.Preconditions;
import io.micrometer.core.instrument.MeterRegistry;
import org.cache2k.Cache;
import org.cache2k.Cache2kBuilder;
import org.cache2k.expiry.ExpiryTimeValues;
import org.cache2k.io.CacheLoaderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists tiles by overlay, transform version and address through a {@link BlobStore}, reading through a cache.
 * <p>
 * Every tile key includes the transform version, so a caller asking for one version can never receive a tile of
 * another.  Superseded versions are first marked reclaimable by {@link #invalidate}, keeping them readable, and are
 * only deleted by a later {@link #evictOlderThan} sweep.  The active version is never deleted.
 * <p>
 * Writes to distinct keys are independent, and rewriting the same key replaces it with the last writer winning.
 * This class is threadsafe.
 */
public class TileStore implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(TileStore.class);
  private static final AtomicInteger INSTANCES = new AtomicInteger();

  private final BlobStore blobs;
  private final OverlayMetastore metastore;
  private final Cache<TileKey, Optional<Tile>> tileCache;

  public TileStore(BlobStore blobs, OverlayMetastore metastore, TileCacheConfiguration cacheConfiguration,
                   MeterRegistry meterRegistry) {
    this.blobs = blobs;
    this.metastore = metastore;
    this.tileCache = new Cache2kBuilder<TileKey, Optional<Tile>>() {}
      .name("overlayTiles" + INSTANCES.incrementAndGet())
      .entryCapacity(cacheConfiguration.getEntryCapacity())
      .expireAfterWrite(Duration.ofSeconds(cacheConfiguration.getExpireAfterWriteSeconds()))
      // misses are not kept, another process may write the tile at any time
      .expiryPolicy((key, tile, startTime, entry) ->
                      tile.isPresent() ? ExpiryTimeValues.ETERNAL : ExpiryTimeValues.NOW)
      .loader(this::load)
      .build();
    CacheMetrics.register(tileCache, meterRegistry);
  }

  private Optional<Tile> load(TileKey key) {
    return blobs.get(key.blobKey()).map(blob -> Tile.builder()
      .overlayId(key.getOverlayId())
      .transformVersion(key.getVersion())
      .z(key.getZ())
      .x(key.getX())
      .y(key.getY())
      .format(Tile.PNG)
      .payload(blob.getData())
      .etag(Tile.etagOf(blob.getData()))
      .createdAt(blob.getLastModified())
      .build());
  }

  /**
   * Stores the tile, replacing any tile with the same key.
   *
   * @throws StorageException if the tile cannot be written
   */
  public void put(Tile tile) {
    Preconditions.checkArgument(tile.getTransformVersion() > 0, "Tiles belong to a persisted transform version");
    Preconditions.checkArgument(Tile.PNG.equals(tile.getFormat()), "Unsupported tile format %s", tile.getFormat());
    Tiles.checkAddress(tile.getZ(), tile.getX(), tile.getY());
    TileKey key = new TileKey(tile.getOverlayId(), tile.getTransformVersion(), tile.getZ(), tile.getX(), tile.getY());
    blobs.put(key.blobKey(), tile.getPayload());
    tileCache.put(key, Optional.of(copyOf(tile)));
  }

  // cached tiles never share their payload with a caller
  private static Tile copyOf(Tile tile) {
    return Tile.builder()
      .overlayId(tile.getOverlayId())
      .transformVersion(tile.getTransformVersion())
      .z(tile.getZ())
      .x(tile.getX())
      .y(tile.getY())
      .format(tile.getFormat())
      .payload(tile.getPayload().clone())
      .etag(tile.getEtag())
      .createdAt(tile.getCreatedAt())
      .build();
  }

  /**
   * Absent tiles are looked up in storage on every call.
   *
   * @return a copy of the tile of the given transform version, or empty if there is none or it has been reclaimed
   * @throws StorageException if storage cannot be read
   */
  public Optional<Tile> get(String overlayId, int z, long x, long y, int version) {
    Tiles.checkAddress(z, x, y);
    try {
      return tileCache.get(new TileKey(overlayId, version, z, x, y)).map(TileStore::copyOf);
    } catch (CacheLoaderException e) {
      if (e.getCause() instanceof StorageException) {
        throw (StorageException) e.getCause();
      }
      throw new StorageException("Unable to read tile " + z + "/" + x + "/" + y + " of overlay " + overlayId, e);
    }
  }

  /**
   * @return the tile of the overlay's active transform version
   */
  public Optional<Tile> getCurrent(String overlayId, int z, long x, long y) {
    OptionalInt version = metastore.activeVersion(overlayId);
    return version.isPresent() ? get(overlayId, z, x, y, version.getAsInt()) : Optional.empty();
  }

  /**
   * Marks the tiles of a superseded version as reclaimable.  They remain readable until swept.
   */
  public void invalidate(String overlayId, int version) {
    blobs.put(TileKey.reclaimableMarker(overlayId, version), new byte[0]);
    LOG.info("Tiles of overlay {} version {} marked reclaimable", overlayId, version);
  }

  public boolean isReclaimable(String overlayId, int version) {
    return blobs.get(TileKey.reclaimableMarker(overlayId, version)).isPresent();
  }

  /**
   * @return the versions of the overlay with stored tiles or a reclaimable marker, in ascending order
   */
  public SortedSet<Integer> versions(String overlayId) {
    String prefix = TileKey.overlayPrefix(overlayId);
    SortedSet<Integer> versions = new TreeSet<>();
    for (String key : blobs.list(prefix)) {
      String rest = key.substring(prefix.length());
      int end = rest.indexOf('/');
      if (end < 0) {
        end = rest.indexOf('.');
      }
      if (rest.startsWith("v") && end > 1) {
        try {
          versions.add(Integer.parseInt(rest.substring(1, end)));
        } catch (NumberFormatException e) {
          LOG.warn("Ignoring unexpected key {}", key);
        }
      }
    }
    return versions;
  }

  /**
   * Deletes the reclaimable versions of the overlay other than the latest ones.  The active version is always kept.
   *
   * @param keepLatestVersions how many of the most recent versions to keep regardless, which may be 0
   * @return the versions deleted
   */
  public List<Integer> evictOlderThan(String overlayId, int keepLatestVersions) {
    Preconditions.checkArgument(keepLatestVersions >= 0, "Cannot keep a negative number of versions");
    OptionalInt active = metastore.activeVersion(overlayId);

    List<Integer> newestFirst = new ArrayList<>(versions(overlayId));
    Collections.reverse(newestFirst);

    List<Integer> swept = new ArrayList<>();
    for (int i = keepLatestVersions; i < newestFirst.size(); i++) {
      int version = newestFirst.get(i);
      if ((active.isPresent() && active.getAsInt() == version) || !isReclaimable(overlayId, version)) {
        continue;
      }
      int deleted = 0;
      for (String key : blobs.list(TileKey.versionPrefix(overlayId, version))) {
        if (blobs.delete(key)) {
          deleted++;
        }
      }
      tileCache.keys().stream()
        .filter(k -> k.getOverlayId().equals(overlayId) && k.getVersion() == version)
        .forEach(tileCache::remove);
      // the marker goes last, so an interrupted sweep is repeated
      blobs.delete(TileKey.reclaimableMarker(overlayId, version));
      swept.add(version);
      LOG.info("Swept {} tiles of overlay {} version {}", deleted, overlayId, version);
    }
    return swept;
  }

  @Override
  public void close() {
    tileCache.close();
  }
}
