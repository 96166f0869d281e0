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
package org.gbif.overlays.common.model;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TileRangeTest {

  @Test
  public void testRowMajorOrder() {
    TileRange range = new TileRange(3, 2, 5, 4, 6);
    assertEquals(6, range.size());

    List<TileAddress> addresses = new ArrayList<>();
    range.forEach(addresses::add);
    assertEquals(6, addresses.size());
    assertEquals(new TileAddress(3, 2, 5), addresses.get(0));
    assertEquals(new TileAddress(3, 4, 5), addresses.get(2));
    assertEquals(new TileAddress(3, 2, 6), addresses.get(3));
    assertEquals(addresses.get(4), range.address(4));
  }

  @Test
  public void testContains() {
    TileRange range = new TileRange(3, 2, 5, 4, 6);
    assertTrue(range.contains(2, 5));
    assertTrue(range.contains(4, 6));
    assertFalse(range.contains(5, 6));
    assertFalse(range.contains(2, 4));
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void testAddressOutOfRange() {
    new TileRange(0, 0, 0, 0, 0).address(1);
  }
}
