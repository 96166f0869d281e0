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

import org.gbif.overlays.common.error.InvalidInputException;
import org.gbif.overlays.common.error.StorageException;
import org.gbif.overlays.common.meta.Metastores;
import org.gbif.overlays.common.meta.OverlayMetastore;
import org.gbif.overlays.common.model.Tile;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TileStoreTest {
  private InMemoryBlobStore blobs;
  private OverlayMetastore metastore;
  private SimpleMeterRegistry registry;
  private TileStore store;

  @Before
  public void setup() {
    blobs = new InMemoryBlobStore();
    metastore = Metastores.newInMemoryMetastore();
    registry = new SimpleMeterRegistry();
    store = new TileStore(blobs, metastore, TileCacheConfiguration.builder().build(), registry);
  }

  @After
  public void tearDown() {
    store.close();
  }

  private static Tile tile(int version, int z, long x, long y, String content) {
    byte[] payload = content.getBytes(StandardCharsets.UTF_8);
    return Tile.builder()
      .overlayId("map")
      .transformVersion(version)
      .z(z)
      .x(x)
      .y(y)
      .format(Tile.PNG)
      .payload(payload)
      .etag(Tile.etagOf(payload))
      .createdAt(Instant.now())
      .build();
  }

  @Test
  public void testPutGet() {
    store.put(tile(1, 2, 1, 3, "a"));
    Tile read = store.get("map", 2, 1, 3, 1).get();
    assertArrayEquals("a".getBytes(StandardCharsets.UTF_8), read.getPayload());
    assertEquals(Tile.etagOf(read.getPayload()), read.getEtag());
    assertTrue(blobs.get("tiles/map/v1/2/1/3.png").isPresent());
    assertFalse(store.get("map", 2, 1, 2, 1).isPresent());
  }

  @Test
  public void testReadsThroughToStorage() {
    blobs.put("tiles/map/v4/1/0/1.png", "external".getBytes(StandardCharsets.UTF_8));
    Tile read = store.get("map", 1, 0, 1, 4).get();
    assertEquals(4, read.getTransformVersion());
    assertEquals(Tile.PNG, read.getFormat());
    assertEquals(8, read.getSize());
    assertTrue(registry.get("cache.load_count").gauge().value() >= 1);
  }

  @Test
  public void testPutIsIdempotentLastWriterWins() {
    store.put(tile(1, 0, 0, 0, "first"));
    store.put(tile(1, 0, 0, 0, "second"));
    store.put(tile(1, 0, 0, 0, "second"));
    Tile read = store.get("map", 0, 0, 0, 1).get();
    assertEquals(Tile.etagOf("second".getBytes(StandardCharsets.UTF_8)), read.getEtag());
    assertEquals(1, blobs.size());
  }

  @Test(expected = InvalidInputException.class)
  public void testRejectsAddressOutsideTileMatrix() {
    store.put(tile(1, 1, 2, 0, "a"));
  }

  @Test
  public void testVersionIsolation() {
    store.put(tile(1, 3, 4, 2, "old"));
    metastore.activate("map", 1);
    store.put(tile(2, 3, 4, 2, "new"));
    store.put(tile(2, 3, 5, 2, "new only"));
    metastore.activate("map", 2);
    store.invalidate("map", 1);

    // the old version is still served until swept, and never with new content
    Tile old = store.get("map", 3, 4, 2, 1).get();
    assertEquals(Tile.etagOf("old".getBytes(StandardCharsets.UTF_8)), old.getEtag());
    assertFalse(store.get("map", 3, 5, 2, 1).isPresent());
    assertEquals(Tile.etagOf("new".getBytes(StandardCharsets.UTF_8)), store.getCurrent("map", 3, 4, 2).get().getEtag());

    assertEquals(Collections.singletonList(1), store.evictOlderThan("map", 1));
    assertFalse(store.get("map", 3, 4, 2, 1).isPresent());
    assertTrue(store.get("map", 3, 4, 2, 2).isPresent());
  }

  @Test
  public void testCurrentWithoutActiveVersion() {
    store.put(tile(1, 0, 0, 0, "a"));
    assertFalse(store.getCurrent("map", 0, 0, 0).isPresent());
  }

  @Test
  public void testGarbageCollection() {
    for (int v = 1; v <= 4; v++) {
      store.put(tile(v, 1, 0, 0, "v" + v));
      store.put(tile(v, 1, 1, 0, "v" + v));
    }
    metastore.activate("map", 4);
    store.invalidate("map", 1);
    store.invalidate("map", 3);

    assertEquals(Arrays.asList(1, 2, 3, 4), new ArrayList<>(store.versions("map")));
    // version 3 is within the latest two, version 2 was never invalidated
    assertEquals(Collections.singletonList(1), store.evictOlderThan("map", 2));
    assertFalse(blobs.get("tiles/map/v1/1/0/0.png").isPresent());
    assertFalse(store.isReclaimable("map", 1));
    assertTrue(store.get("map", 1, 0, 0, 2).isPresent());
    assertTrue(store.get("map", 1, 0, 0, 3).isPresent());

    // keeping none still spares the active version
    store.invalidate("map", 4);
    assertEquals(Collections.singletonList(3), store.evictOlderThan("map", 0));
    assertTrue(store.get("map", 1, 1, 0, 4).isPresent());
    assertEquals(Arrays.asList(2, 4), new ArrayList<>(store.versions("map")));
  }

  @Test
  public void testStorageFailureIsReported() {
    BlobStore failing = new InMemoryBlobStore() {
      @Override
      public Optional<Blob> get(String key) {
        throw new StorageException("unavailable");
      }
    };
    try (TileStore failingStore = new TileStore(failing, metastore, TileCacheConfiguration.builder().build(),
                                                registry)) {
      failingStore.get("map", 0, 0, 0, 1);
      fail("Expected the storage failure to be reported");
    } catch (StorageException e) {
      assertEquals("unavailable", e.getMessage());
    }
  }

  @Test
  public void testOverlaysAreDistinct() {
    store.put(tile(1, 0, 0, 0, "a"));
    assertNotEquals(Optional.empty(), store.get("map", 0, 0, 0, 1));
    assertFalse(store.get("map2", 0, 0, 0, 1).isPresent());
    assertTrue(store.versions("ma").isEmpty());
  }

  @Test
  public void testMissIsNotRemembered() {
    try (TileStore worker = new TileStore(blobs, metastore, TileCacheConfiguration.builder().build(), registry)) {
      assertFalse(store.get("map", 0, 0, 0, 1).isPresent());
      worker.put(tile(1, 0, 0, 0, "written elsewhere"));
      Tile read = store.get("map", 0, 0, 0, 1).get();
      assertEquals(Tile.etagOf("written elsewhere".getBytes(StandardCharsets.UTF_8)), read.getEtag());
    }
  }

  @Test
  public void testPayloadIsNotShared() {
    Tile written = tile(1, 0, 0, 0, "tile");
    store.put(written);
    written.getPayload()[0] = 'W';

    Tile first = store.get("map", 0, 0, 0, 1).get();
    assertArrayEquals("tile".getBytes(StandardCharsets.UTF_8), first.getPayload());
    first.getPayload()[0] = 'X';

    Tile second = store.get("map", 0, 0, 0, 1).get();
    assertArrayEquals("tile".getBytes(StandardCharsets.UTF_8), second.getPayload());
    assertEquals(Tile.etagOf(second.getPayload()), second.getEtag());
  }
}
