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

import org.gbif.overlays.common.model.Bounds;

import org.junit.Test;

import static org.gbif.overlays.common.projection.AssertOnDouble2D.assertEquals;
import static org.gbif.overlays.common.projection.SphericalMercator.MAX_LATITUDE;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SphericalMercatorTest {

  static final double ε = 1e-5;

  static final double L85 = 85.0511287798066;

  @Test
  public void testIsPlottable() {
    SphericalMercator sm = new SphericalMercator(512);

    // The limit of the Spherical Mercator projection, a tiny bit over 85.05113°.
    assertTrue(sm.isPlottable(+L85, 0));
    assertTrue(sm.isPlottable(-L85, 0));

    // Just beyond that is off the map.
    assertFalse(sm.isPlottable(+L85+ε, 0));
    assertFalse(sm.isPlottable(-L85-ε, 0));
  }

  @Test
  public void testToGlobalPixelXY() {
    SphericalMercator sm = new SphericalMercator(512);

    // Zoom 0 has one tile, 512×512.
    assertEquals(new Double2D( 256,  256), sm.toGlobalPixelXY(   0,    0, 0), ε); // Middle of map
    assertEquals(new Double2D(   0,  256), sm.toGlobalPixelXY(   0, -180, 0), ε); // Left edge centre
    assertEquals(new Double2D( 512,  256), sm.toGlobalPixelXY(   0,  180, 0), ε); // Right edge centre
    assertEquals(new Double2D( 256,    0), sm.toGlobalPixelXY( L85,    0, 0), ε); // Top edge centre
    assertEquals(new Double2D( 256,  512), sm.toGlobalPixelXY(-L85,    0, 0), ε); // Bottom edge centre

    // Zoom 2 has 4×4 tiles, giving a total area of 2048×2048.
    assertEquals(new Double2D( 1024,  1024), sm.toGlobalPixelXY(   0,    0, 2), ε);
    assertEquals(new Double2D(    0,  1024), sm.toGlobalPixelXY(   0, -180, 2), ε);
    assertEquals(new Double2D( 1024,  2048), sm.toGlobalPixelXY(-L85,    0, 2), ε);

    assertEquals(new Double2D( 291.46666,148.19743), sm.toGlobalPixelXY(60.170833, 24.9375, 0), ε); // Helsinki
    assertEquals(new Double2D(1165.86666,592.78972), sm.toGlobalPixelXY(60.170833, 24.9375, 2), ε); // Helsinki
  }

  @Test
  public void testPoleIsClamped() {
    SphericalMercator sm = new SphericalMercator(256);
    Double2D north = sm.toGlobalPixelXY(90, 0, 3);
    assertTrue(north.isFinite());
    assertEquals(new Double2D(1024, 0), north, ε);
    assertEquals(new Double2D(1024, 2048), sm.toGlobalPixelXY(-90, 0, 3), ε);
  }

  @Test
  public void testFromGlobalPixelXY() {
    SphericalMercator sm = new SphericalMercator(256);
    for (int z = 0; z < 6; z++) {
      Double2D helsinki = sm.toGlobalPixelXY(60.170833, 24.9375, z);
      assertEquals("Round trip at zoom " + z, new Double2D(24.9375, 60.170833), sm.fromGlobalPixelXY(helsinki, z), 1e-9);
    }
  }

  @Test
  public void testTileBoundary() {
    SphericalMercator sm = new SphericalMercator(256);

    // ■
    Bounds world = sm.tileBoundary(0, 0, 0);
    assertEquals(new Double2D(-180, -MAX_LATITUDE), new Double2D(world.getWest(), world.getSouth()), ε);
    assertEquals(new Double2D(180, MAX_LATITUDE), new Double2D(world.getEast(), world.getNorth()), ε);

    // ■□
    // □□
    Bounds nw = sm.tileBoundary(1, 0, 0);
    assertEquals("1/0/0 failed", new Double2D(-180, 0), new Double2D(nw.getWest(), nw.getSouth()), ε);
    assertEquals("1/0/0 failed", new Double2D(0, MAX_LATITUDE), new Double2D(nw.getEast(), nw.getNorth()), ε);

    // □□
    // □■
    Bounds se = sm.tileBoundary(1, 1, 1);
    assertEquals("1/1/1 failed", new Double2D(0, -MAX_LATITUDE), new Double2D(se.getWest(), se.getSouth()), ε);
    assertEquals("1/1/1 failed", new Double2D(180, 0), new Double2D(se.getEast(), se.getNorth()), ε);
  }
}
