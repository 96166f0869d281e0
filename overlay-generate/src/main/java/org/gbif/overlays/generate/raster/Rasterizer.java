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

import org.gbif.overlays.common.model.TileAddress;
import org.gbif.overlays.common.model.Tile;
import org.gbif.overlays.common.model.TileRange;
import org.gbif.overlays.common.model.TransformModel;
import org.gbif.overlays.common.projection.Double2D;
import org.gbif.overlays.common.projection.TileProjection;
import org.gbif.overlays.common.projection.Tiles;
import org.gbif.overlays.common.transform.GeoTransformation;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.List;

import javax.imageio.ImageIO;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resamples a source page into Web Mercator tiles through the inverse of its transformation.
 * <p>
 * The inverse is evaluated exactly on a grid of nodes every {@link #GRID_STEP} output pixels and interpolated between
 * them, falling back to the exact inverse of each pixel in cells where a node has no preimage.  Colours are sampled
 * bilinearly, and positions mapping off the page are transparent.
 * This class is threadsafe; tasks may render distinct tiles concurrently.
 */
public class Rasterizer {
  private static final Logger LOG = LoggerFactory.getLogger(Rasterizer.class);

  static final int GRID_STEP = 16;

  private final TileProjection projection;

  public Rasterizer(TileProjection projection) {
    Preconditions.checkArgument(projection.getTileSize() % GRID_STEP == 0,
                                "Tile size must be a multiple of %s", GRID_STEP);
    this.projection = projection;
  }

  public int getTileSize() {
    return projection.getTileSize();
  }

  /**
   * @return the tiles at the zoom whose envelope intersects the bounds of the model
   */
  public TileRange tileRange(TransformModel model, int z) {
    return Tiles.tileRange(model.getBounds(), projection, z);
  }

  /**
   * A lazy sequence over the tiles of the zoom levels, lowest zoom first.
   */
  public TileSequence generateTiles(TransformModel model, SourcePage page, List<Integer> zoomLevels) {
    return new TileSequence(this, model, GeoTransformation.of(model), page, zoomLevels, TileCursor.START);
  }

  /**
   * A lazy sequence resuming at the cursor, as recorded from an earlier sequence.
   */
  public TileSequence generateTiles(TransformModel model, SourcePage page, List<Integer> zoomLevels,
                                    TileCursor from) {
    return new TileSequence(this, model, GeoTransformation.of(model), page, zoomLevels, from);
  }

  /**
   * Renders one tile as PNG.
   *
   * @throws TileRenderException if no pixel of the tile can be mapped back to the page, or encoding fails
   */
  public Tile render(TransformModel model, GeoTransformation transformation, SourcePage page, TileAddress address) {
    int size = projection.getTileSize();
    int z = address.getZ();
    double originX = (double) address.getX() * size;
    double originY = (double) address.getY() * size;

    int nodes = size / GRID_STEP + 1;
    double[] nodeX = new double[nodes * nodes];
    double[] nodeY = new double[nodes * nodes];
    for (int j = 0; j < nodes; j++) {
      for (int i = 0; i < nodes; i++) {
        Double2D source = inverse(transformation, originX + i * GRID_STEP, originY + j * GRID_STEP, z);
        nodeX[j * nodes + i] = source == null ? Double.NaN : source.getX();
        nodeY[j * nodes + i] = source == null ? Double.NaN : source.getY();
      }
    }

    int[] argb = new int[size * size];
    int unmapped = 0;
    for (int j = 0; j < size; j++) {
      int cj = j / GRID_STEP;
      double v = (j + 0.5 - cj * GRID_STEP) / GRID_STEP;
      for (int i = 0; i < size; i++) {
        int ci = i / GRID_STEP;
        double u = (i + 0.5 - ci * GRID_STEP) / GRID_STEP;
        int n00 = cj * nodes + ci;
        int n10 = n00 + 1;
        int n01 = n00 + nodes;
        int n11 = n01 + 1;

        double sx = lerp(nodeX[n00], nodeX[n10], nodeX[n01], nodeX[n11], u, v);
        double sy = lerp(nodeY[n00], nodeY[n10], nodeY[n01], nodeY[n11], u, v);
        if (Double.isNaN(sx) || Double.isNaN(sy)) {
          Double2D source = inverse(transformation, originX + i + 0.5, originY + j + 0.5, z);
          if (source == null) {
            unmapped++;
            continue;
          }
          sx = source.getX();
          sy = source.getY();
        }
        argb[j * size + i] = page.sample(sx, sy);
      }
    }
    if (unmapped == argb.length) {
      throw new TileRenderException(address, "no pixel maps back to the source page");
    }

    byte[] payload = encode(argb, size, address);
    return Tile.builder()
      .overlayId(model.getOverlayId())
      .transformVersion(model.getVersion())
      .z(z)
      .x(address.getX())
      .y(address.getY())
      .format(Tile.PNG)
      .payload(payload)
      .etag(Tile.etagOf(payload))
      .createdAt(Instant.now())
      .build();
  }

  /**
   * @return the source pixel at the global pixel position, or null if it has no preimage
   */
  private Double2D inverse(GeoTransformation transformation, double globalX, double globalY, int z) {
    Double2D geographic = projection.fromGlobalPixelXY(new Double2D(globalX, globalY), z);
    try {
      return transformation.inverse(geographic.getX(), geographic.getY());
    } catch (ArithmeticException e) {
      // positions far from the page may lie beyond the horizon, or outside where the inverse converges
      LOG.trace("No preimage of {} at zoom {}: {}", geographic, z, e.getMessage());
      return null;
    }
  }

  private static double lerp(double a00, double a10, double a01, double a11, double u, double v) {
    return (1 - v) * ((1 - u) * a00 + u * a10) + v * ((1 - u) * a01 + u * a11);
  }

  private static byte[] encode(int[] argb, int size, TileAddress address) {
    BufferedImage image = new BufferedImage(size, size, BufferedImage.TYPE_INT_ARGB);
    image.setRGB(0, 0, size, size, argb, 0, size);
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      if (!ImageIO.write(image, Tile.PNG, out)) {
        throw new TileRenderException(address, "no PNG encoder is available");
      }
    } catch (IOException e) {
      throw new TileRenderException(address, "PNG encoding failed", e);
    }
    return out.toByteArray();
  }
}
