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

import org.gbif.overlays.common.model.ControlPoint;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

import javax.imageio.ImageIO;

import com.google.common.collect.ImmutableList;

/**
 * Source pages and control points with a known georeferencing, shared by tests.
 */
public class PageFixtures {
  public static final int RED = 0xFFFF0000;
  public static final int BLUE = 0xFF0000FF;

  private PageFixtures() {}

  /**
   * An opaque page, red on the left half and blue on the right.
   */
  public static BufferedImage halves(int width, int height) {
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        image.setRGB(x, y, x < width / 2 ? RED : BLUE);
      }
    }
    return image;
  }

  public static byte[] png(BufferedImage image) {
    try {
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      ImageIO.write(image, "png", out);
      return out.toByteArray();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * Ground truth for a 400 by 300 page: lon = 10 + px / 1000, lat = 50 - py / 1000.
   */
  public static ControlPoint smallPage(double px, double py) {
    return ControlPoint.of(px, py, 10 + px / 1000, 50 - py / 1000);
  }

  public static List<ControlPoint> smallPagePoints() {
    return ImmutableList.of(smallPage(20, 20), smallPage(380, 30), smallPage(30, 280), smallPage(370, 270));
  }

  /**
   * Ground truth for a 358 by 160 page spanning most of the world: lon = px - 179, lat = 80 - py.  Its bounds cover
   * all 64 tiles of zoom 3.
   */
  public static ControlPoint worldPage(double px, double py) {
    return ControlPoint.of(px, py, px - 179, 80 - py);
  }

  public static List<ControlPoint> worldPagePoints() {
    return ImmutableList.of(worldPage(10, 10), worldPage(350, 15), worldPage(20, 150), worldPage(340, 145));
  }
}
