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

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class InMemoryOverlayMetastoreTest {

  @Test
  public void testLifeCycle() {
    OverlayMetastore metastore = Metastores.newInMemoryMetastore();
    assertFalse(metastore.activeVersion("map").isPresent());
    metastore.activate("map", 3);
    assertEquals(3, metastore.activeVersion("map").getAsInt());

    assertTrue(metastore.acquire("map", "a"));
    assertFalse(metastore.acquire("map", "b"));
    assertFalse(metastore.release("map", "b"));
    assertTrue(metastore.release("map", "a"));
    assertTrue(metastore.acquire("map", "b"));
  }
}
