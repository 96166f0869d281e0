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

import java.awt.image.BufferedImage;

import com.google.common.base.Preconditions;

/**
 * The decoded raster of a source page, as ARGB pixels.  Instances are immutable and shared by reference between the
 * tile tasks of a job.
 * <p>
 * Positions are continuous with the origin at the top left corner of the page, so pixel (i, j) covers
 * [i, i+1) × [j, j+1) and has its centre at (i + 0.5, j + 0.5).
 */
public final class SourcePage {
  private final int width;
  private final int height;
  private final int[] argb;

  private SourcePage(int width, int height, int[] argb) {
    this.width = width;
    this.height = height;
    this.argb = argb;
  }

  public static SourcePage of(BufferedImage image) {
    int width = image.getWidth();
    int height = image.getHeight();
    return new SourcePage(width, height, image.getRGB(0, 0, width, height, null, 0, width));
  }

  /**
   * @param argb the pixels row by row
   */
  public static SourcePage of(int width, int height, int[] argb) {
    Preconditions.checkArgument(width > 0 && height > 0, "Page dimensions must be positive");
    Preconditions.checkArgument(argb.length == width * height, "Expected %s pixels", width * height);
    return new SourcePage(width, height, argb.clone());
  }

  public int getWidth() {
    return width;
  }

  public int getHeight() {
    return height;
  }

  public boolean contains(double x, double y) {
    return x >= 0 && y >= 0 && x <= width && y <= height;
  }

  /**
   * Bilinear interpolation of the four pixels nearest the position, each channel weighted by alpha.
   *
   * @return the interpolated ARGB colour, or 0 (transparent) if the position is off the page
   */
  public int sample(double x, double y) {
    if (!contains(x, y)) {
      return 0;
    }
    // pixel centres sit at +0.5
    double fx = x - 0.5;
    double fy = y - 0.5;
    int x0 = (int) Math.floor(fx);
    int y0 = (int) Math.floor(fy);
    double dx = fx - x0;
    double dy = fy - y0;

    int p00 = pixel(x0, y0);
    int p10 = pixel(x0 + 1, y0);
    int p01 = pixel(x0, y0 + 1);
    int p11 = pixel(x0 + 1, y0 + 1);
    double w00 = (1 - dx) * (1 - dy);
    double w10 = dx * (1 - dy);
    double w01 = (1 - dx) * dy;
    double w11 = dx * dy;

    double a = w00 * alpha(p00) + w10 * alpha(p10) + w01 * alpha(p01) + w11 * alpha(p11);
    if (a <= 0) {
      return 0;
    }
    int r = channel(16, a, w00, p00, w10, p10, w01, p01, w11, p11);
    int g = channel(8, a, w00, p00, w10, p10, w01, p01, w11, p11);
    int b = channel(0, a, w00, p00, w10, p10, w01, p01, w11, p11);
    return (clamp(a) << 24) | (r << 16) | (g << 8) | b;
  }

  private int pixel(int x, int y) {
    // neighbours beyond the edge repeat the edge pixel
    int cx = Math.max(0, Math.min(width - 1, x));
    int cy = Math.max(0, Math.min(height - 1, y));
    return argb[cy * width + cx];
  }

  private static int alpha(int p) {
    return (p >>> 24) & 0xFF;
  }

  private static int channel(int shift, double alpha, double w00, int p00, double w10, int p10, double w01, int p01,
                             double w11, int p11) {
    double premultiplied = w00 * alpha(p00) * ((p00 >> shift) & 0xFF)
                           + w10 * alpha(p10) * ((p10 >> shift) & 0xFF)
                           + w01 * alpha(p01) * ((p01 >> shift) & 0xFF)
                           + w11 * alpha(p11) * ((p11 >> shift) & 0xFF);
    return clamp(premultiplied / alpha);
  }

  private static int clamp(double value) {
    return (int) Math.max(0, Math.min(255, Math.round(value)));
  }
}
