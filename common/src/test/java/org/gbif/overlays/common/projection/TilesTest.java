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
package org.gbif.overlays.common.projection;

import org.gbif.overlays.common.error.InvalidInputException;
import org.gbif.overlays.common.model.Bounds;
import org.gbif.overlays.common.model.TileAddress;
import org.gbif.overlays.common.model.TileRange;

import java.util.HashSet;
import java.util.Set;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TilesTest {
  private static final TileProjection WEB_MERCATOR = Tiles.fromEPSG("EPSG:3857", 256);

  @Test(expected = IllegalArgumentException.class)
  public void testUnsupportedEPSG() {
    Tiles.fromEPSG("EPSG:4326", 256);
  }

  @Test
  public void testCheckAddress() {
    Tiles.checkAddress(0, 0, 0);
    Tiles.checkAddress(3, 7, 7);
    Tiles.checkAddress(Tiles.MAX_ZOOM, (1L << Tiles.MAX_ZOOM) - 1, 0);
    expectInvalid(3, 8, 0);
    expectInvalid(3, 0, 8);
    expectInvalid(3, -1, 0);
    expectInvalid(-1, 0, 0);
    expectInvalid(Tiles.MAX_ZOOM + 1, 0, 0);
  }

  private static void expectInvalid(int z, long x, long y) {
    try {
      Tiles.checkAddress(z, x, y);
      fail("Expected " + z + "/" + x + "/" + y + " to be rejected");
    } catch (InvalidInputException e) {
      // expected
    }
  }

  @Test
  public void testTileRangeOfWorld() {
    Bounds world = new Bounds(90, -90, 180, -180);
    for (int z = 0; z < 5; z++) {
      TileRange range = Tiles.tileRange(world, WEB_MERCATOR, z);
      assertEquals(Tiles.tilesAtZoom(z) * Tiles.tilesAtZoom(z), range.size());
    }
  }

  @Test
  public void testTileRangeOnTileEdge() {
    // the eastern hemisphere north of the equator is exactly tile 1/1/0
    TileRange range = Tiles.tileRange(new Bounds(60, 0, 180, 0), WEB_MERCATOR, 1);
    assertEquals(new TileRange(1, 1, 0, 1, 0), range);
  }

  /**
   * Every tile whose envelope intersects the bounds is in the range, and no other.
   */
  @Test
  public void testTileRangeMatchesIntersectingTiles() {
    Bounds[] samples = {
      new Bounds(52.61, 51.23, 1.37, -0.83),
      new Bounds(-33.1, -34.9, 151.7, 150.2),
      new Bounds(84.2, 10.5, 43.3, -170.4),
      new Bounds(0.0003, -0.0002, 0.0004, -0.0001)
    };
    for (Bounds bounds : samples) {
      for (int z = 0; z <= 8; z++) {
        TileRange range = Tiles.tileRange(bounds, WEB_MERCATOR, z);
        Set<TileAddress> expected = new HashSet<>();
        long n = Tiles.tilesAtZoom(z);
        for (long x = 0; x < n; x++) {
          for (long y = 0; y < n; y++) {
            if (WEB_MERCATOR.tileBoundary(z, x, y).intersects(bounds)) {
              expected.add(new TileAddress(z, x, y));
            }
          }
        }
        Set<TileAddress> actual = new HashSet<>();
        for (TileAddress address : range) {
          assertTrue("Duplicate tile " + address, actual.add(address));
        }
        assertEquals("Zoom " + z + " of " + bounds, expected, actual);
      }
    }
  }
}
