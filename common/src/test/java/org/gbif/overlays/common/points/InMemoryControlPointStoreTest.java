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
package org.gbif.overlays.common.points;

import org.gbif.overlays.common.error.InvalidInputException;
import org.gbif.overlays.common.model.ControlPoint;
import org.gbif.overlays.common.model.PageSize;

import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class InMemoryControlPointStoreTest {
  private ControlPointStore store;

  @Before
  public void setup() {
    store = new InMemoryControlPointStore();
    store.registerPage("map", 1000, 800);
  }

  @Test
  public void testAddListRemove() {
    String first = store.add("map", ControlPoint.of(10, 20, 5, 50));
    String second = store.add("map", ControlPoint.of(1000, 800, 6, 49));
    assertNotEquals(first, second);

    List<ControlPoint> points = store.list("map");
    assertEquals(2, points.size());
    assertEquals(first, points.get(0).getId());
    assertEquals(10, points.get(0).getPixelX(), 0);

    assertTrue(store.remove(first));
    assertFalse(store.remove(first));
    assertEquals(1, store.list("map").size());
    assertEquals(second, store.list("map").get(0).getId());
  }

  @Test
  public void testPage() {
    assertEquals(new PageSize(1000, 800), store.page("map").get());
    assertFalse(store.page("other").isPresent());
  }

  @Test
  public void testRejectsPixelsOffThePage() {
    expectInvalid(ControlPoint.of(-1, 10, 5, 50));
    expectInvalid(ControlPoint.of(10, -0.5, 5, 50));
    expectInvalid(ControlPoint.of(1000.5, 10, 5, 50));
    expectInvalid(ControlPoint.of(10, 801, 5, 50));
    expectInvalid(ControlPoint.of(Double.NaN, 10, 5, 50));
    assertTrue(store.list("map").isEmpty());
  }

  @Test
  public void testRejectsGeographyOutOfRange() {
    expectInvalid(ControlPoint.of(10, 10, 181, 50));
    expectInvalid(ControlPoint.of(10, 10, 5, -90.1));
    expectInvalid(ControlPoint.of(10, 10, 5, Double.POSITIVE_INFINITY));
  }

  @Test(expected = InvalidInputException.class)
  public void testUnregisteredOverlay() {
    store.add("unknown", ControlPoint.of(10, 10, 5, 50));
  }

  @Test
  public void testReplaceAllIsAtomic() {
    store.add("map", ControlPoint.of(10, 20, 5, 50));
    try {
      store.replaceAll("map", Arrays.asList(ControlPoint.of(1, 1, 5, 50), ControlPoint.of(2000, 1, 5, 50)));
      fail("Expected the second point to be rejected");
    } catch (InvalidInputException e) {
      assertTrue(e.getMessage().contains("1"));
    }
    assertEquals(1, store.list("map").size());

    List<ControlPoint> replaced = store.replaceAll("map", Arrays.asList(ControlPoint.of(1, 1, 5, 50),
                                                                        ControlPoint.of(2, 2, 6, 51)));
    assertEquals(2, replaced.size());
    assertNotNull(replaced.get(0).getId());
    assertEquals(replaced, store.list("map"));
  }

  private void expectInvalid(ControlPoint point) {
    try {
      store.add("map", point);
      fail("Expected " + point + " to be rejected");
    } catch (InvalidInputException e) {
      // expected
    }
  }
}
