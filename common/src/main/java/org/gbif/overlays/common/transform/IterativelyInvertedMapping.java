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

/**
 * Base for mappings without a closed form inverse, which is found by damped Newton iteration from the inverse of the
 * mapping's linear part.
 */
abstract class IterativelyInvertedMapping implements PlanarMapping {
  private static final int MAX_ITERATIONS = 50;
  private static final int MAX_HALVINGS = 20;
  // relative to the magnitude of the target position
  private static final double CONVERGED = 1e-14;
  private static final double ACCEPTABLE = 1e-8;

  /**
   * @return the partial derivatives {∂e/∂x, ∂e/∂y, ∂n/∂x, ∂n/∂y} at the pixel
   */
  abstract double[] jacobian(double x, double y);

  /**
   * @return a first estimate of the pixel mapping to the planar position
   */
  abstract Double2D initialGuess(double east, double north);

  @Override
  public Double2D inverse(double east, double north) {
    double magnitude = 1 + Math.abs(east) + Math.abs(north);
    Double2D guess = initialGuess(east, north);
    double x = guess.getX();
    double y = guess.getY();
    double error = error(x, y, east, north);

    for (int i = 0; i < MAX_ITERATIONS && error > CONVERGED * magnitude; i++) {
      Double2D f = forward(x, y);
      double rx = f.getX() - east;
      double ry = f.getY() - north;
      double[] j = jacobian(x, y);
      double det = j[0] * j[3] - j[1] * j[2];
      if (det == 0 || !Double.isFinite(det)) {
        throw new ArithmeticException("Singular Jacobian while inverting at (" + east + ", " + north + ")");
      }
      double dx = (j[3] * rx - j[1] * ry) / det;
      double dy = (j[0] * ry - j[2] * rx) / det;

      boolean improved = false;
      double step = 1;
      for (int h = 0; h < MAX_HALVINGS && !improved; h++, step /= 2) {
        double candidate = error(x - step * dx, y - step * dy, east, north);
        if (candidate < error) {
          x -= step * dx;
          y -= step * dy;
          error = candidate;
          improved = true;
        }
      }
      if (!improved) {
        break;
      }
    }

    if (!(error <= ACCEPTABLE * magnitude)) {
      throw new ArithmeticException("Inverse did not converge at (" + east + ", " + north + "), error " + error);
    }
    return new Double2D(x, y);
  }

  private double error(double x, double y, double east, double north) {
    Double2D f = forward(x, y);
    return Math.hypot(f.getX() - east, f.getY() - north);
  }

  /**
   * Solves the 2×2 linear part [[ex, ey], [nx, ny]]·(x, y) = (east, north).
   */
  static Double2D solveLinear(double ex, double ey, double nx, double ny, double east, double north) {
    double det = ex * ny - ey * nx;
    if (det == 0) {
      return new Double2D(0, 0);
    }
    return new Double2D((ny * east - ey * north) / det, (ex * north - nx * east) / det);
  }
}
