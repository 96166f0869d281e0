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
package org.gbif.overlays.common.transform;

import org.gbif.overlays.common.projection.Double2D;

import java.util.List;

/**
 * Translates positions to have their centroid at the origin and scales them to an average distance of √2 from it,
 * which keeps the linear systems of the solvers well conditioned whatever the units.
 */
final class Normalization {
  final double cx;
  final double cy;
  final double scale;

  Normalization(double cx, double cy, double scale) {
    this.cx = cx;
    this.cy = cy;
    this.scale = scale;
  }

  static Normalization of(List<Double2D> positions) {
    double cx = 0, cy = 0;
    for (Double2D p : positions) {
      cx += p.getX();
      cy += p.getY();
    }
    cx /= positions.size();
    cy /= positions.size();

    double meanDistance = 0;
    for (Double2D p : positions) {
      meanDistance += Math.hypot(p.getX() - cx, p.getY() - cy);
    }
    meanDistance /= positions.size();
    return new Normalization(cx, cy, meanDistance > 0 ? Math.sqrt(2) / meanDistance : 1);
  }

  double x(double x) {
    return (x - cx) * scale;
  }

  double y(double y) {
    return (y - cy) * scale;
  }

  double unX(double xn) {
    return xn / scale + cx;
  }

  double unY(double yn) {
    return yn / scale + cy;
  }
}
