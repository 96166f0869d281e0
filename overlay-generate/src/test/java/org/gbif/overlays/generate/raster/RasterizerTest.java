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
package org.gbif.overlays.generate.raster;

import org.gbif.overlays.common.error.InvalidInputException;
import org.gbif.overlays.common.model.Tile;
import org.gbif.overlays.common.model.TileAddress;
import org.gbif.overlays.common.model.TransformKind;
import org.gbif.overlays.common.model.TransformModel;
import org.gbif.overlays.common.projection.Double2D;
import org.gbif.overlays.common.projection.SphericalMercator;
import org.gbif.overlays.common.projection.TileProjection;
import org.gbif.overlays.common.projection.Tiles;
import org.gbif.overlays.common.transform.GeoTransformation;
import org.gbif.overlays.common.transform.TransformSolver;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import javax.imageio.ImageIO;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class RasterizerTest {
  private final TileProjection projection = new SphericalMercator(256);
  private final Rasterizer rasterizer = new Rasterizer(projection);
  private SourcePage page;
  private TransformModel model;

  @Before
  public void setup() {
    page = SourcePage.of(PageFixtures.halves(400, 300));
    model = new TransformSolver()
      .solve("map", PageFixtures.smallPagePoints(), TransformKind.AFFINE, 400, 300)
      .getModel()
      .toBuilder()
      .version(1)
      .build();
  }

  private static List<TileAddress> addresses(Iterable<Tile> tiles) {
    List<TileAddress> addresses = new ArrayList<>();
    for (Tile tile : tiles) {
      addresses.add(tile.getAddress());
    }
    return addresses;
  }

  /**
   * Every tile whose envelope intersects the bounds, exactly once.
   */
  @Test
  public void testCoverage() {
    List<Integer> zooms = Arrays.asList(0, 1, 2, 3, 4, 5, 6);
    List<TileAddress> generated = addresses(rasterizer.generateTiles(model, page, zooms));
    assertEquals("Duplicate tiles", generated.size(), new HashSet<>(generated).size());

    Set<TileAddress> expected = new HashSet<>();
    for (int z : zooms) {
      long n = Tiles.tilesAtZoom(z);
      for (long x = 0; x < n; x++) {
        for (long y = 0; y < n; y++) {
          if (projection.tileBoundary(z, x, y).intersects(model.getBounds())) {
            expected.add(new TileAddress(z, x, y));
          }
        }
      }
    }
    assertEquals(expected, new HashSet<>(generated));
  }

  @Test
  public void testLowestZoomFirst() {
    List<TileAddress> generated = addresses(rasterizer.generateTiles(model, page, Arrays.asList(8, 2, 5)));
    for (int i = 1; i < generated.size(); i++) {
      assertTrue(generated.get(i - 1).getZ() <= generated.get(i).getZ());
    }
    assertEquals(2, generated.get(0).getZ());
    assertEquals(8, generated.get(generated.size() - 1).getZ());
  }

  @Test
  public void testIdempotentRegeneration() {
    List<Integer> zooms = Arrays.asList(0, 1, 2, 7);
    List<Tile> first = new ArrayList<>();
    rasterizer.generateTiles(model, page, zooms).forEach(first::add);
    List<Tile> second = new ArrayList<>();
    rasterizer.generateTiles(model, page, zooms).forEach(second::add);

    assertEquals(first.size(), second.size());
    for (int i = 0; i < first.size(); i++) {
      assertEquals(first.get(i).getEtag(), second.get(i).getEtag());
      assertArrayEquals(first.get(i).getPayload(), second.get(i).getPayload());
    }
  }

  @Test
  public void testResumeFromCursor() {
    List<Integer> zooms = Arrays.asList(9, 10, 11);
    List<TileAddress> all = addresses(rasterizer.generateTiles(model, page, zooms));
    assertTrue(all.size() > 3);

    TileSequence.TileIterator iterator = rasterizer.generateTiles(model, page, zooms).iterator();
    for (int i = 0; i < 3; i++) {
      iterator.next();
    }
    TileCursor cursor = iterator.cursor();
    List<TileAddress> rest = addresses(rasterizer.generateTiles(model, page, zooms, cursor));
    assertEquals(all.subList(3, all.size()), rest);

    while (iterator.hasNext()) {
      iterator.next();
    }
    assertNull(iterator.cursor());
  }

  @Test
  public void testResumeAtZoom() {
    List<TileAddress> rest =
      addresses(rasterizer.generateTiles(model, page, Arrays.asList(0, 1, 2, 3), TileCursor.atZoom(2)));
    assertFalse(rest.isEmpty());
    for (TileAddress address : rest) {
      assertTrue(address.getZ() >= 2);
    }
  }

  @Test
  public void testRenderedPixels() throws IOException {
    int z = 6;
    // the centre of the left quarter of the page is red, far from the blue half
    Double2D global = projection.toGlobalPixelXY(50 - 150.5 / 1000, 10 + 100.5 / 1000, z);
    long tileX = (long) Math.floor(global.getX() / 256);
    long tileY = (long) Math.floor(global.getY() / 256);

    Tile tile = rasterizer.render(model, GeoTransformation.of(model), page, new TileAddress(z, tileX, tileY));
    assertEquals(Tile.PNG, tile.getFormat());
    assertEquals(1, tile.getTransformVersion());
    assertEquals(Tile.etagOf(tile.getPayload()), tile.getEtag());

    BufferedImage image = ImageIO.read(new ByteArrayInputStream(tile.getPayload()));
    assertEquals(256, image.getWidth());
    assertEquals(256, image.getHeight());
    int px = (int) (Math.floor(global.getX()) - tileX * 256);
    int py = (int) (Math.floor(global.getY()) - tileY * 256);
    assertEquals(PageFixtures.RED, image.getRGB(px, py));

    // the page covers only a few pixels of a tile this large, so its corner is off the page
    assertEquals(0, image.getRGB(0, 0) >>> 24);
  }

  @Test(expected = InvalidInputException.class)
  public void testZoomOutOfRange() {
    rasterizer.generateTiles(model, page, Arrays.asList(0, 23));
  }
}
