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

import org.gbif.overlays.common.error.DegenerateGeometryException;
import org.gbif.overlays.common.projection.Double2D;

import java.util.List;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * The six parameter map east = a0 + a1·x + a2·y, north = b0 + b1·x + b2·y, covering rotation, scale, skew and
 * translation.  Exact for three points and a least squares fit for more.
 */
final class AffineMapping implements PlanarMapping {
  static final double SINGULARITY_THRESHOLD = 1e-10;

  private final double a0, a1, a2, b0, b1, b2;
  private final double det;

  AffineMapping(double a0, double a1, double a2, double b0, double b1, double b2) {
    this.a0 = a0;
    this.a1 = a1;
    this.a2 = a2;
    this.b0 = b0;
    this.b1 = b1;
    this.b2 = b2;
    this.det = a1 * b2 - a2 * b1;
  }

  static AffineMapping fromCoefficients(double[] c, int offset) {
    return new AffineMapping(c[offset], c[offset + 1], c[offset + 2], c[offset + 3], c[offset + 4], c[offset + 5]);
  }

  /**
   * Least squares fit, carried out on normalized pixels and converted back to raw pixel coefficients.
   */
  static AffineMapping fit(List<Double2D> pixels, List<Double2D> planar) {
    Normalization norm = Normalization.of(pixels);
    int n = pixels.size();
    RealMatrix design = new Array2DRowRealMatrix(n, 3);
    RealMatrix targets = new Array2DRowRealMatrix(n, 2);
    for (int i = 0; i < n; i++) {
      design.setEntry(i, 0, 1);
      design.setEntry(i, 1, norm.x(pixels.get(i).getX()));
      design.setEntry(i, 2, norm.y(pixels.get(i).getY()));
      targets.setEntry(i, 0, planar.get(i).getX());
      targets.setEntry(i, 1, planar.get(i).getY());
    }

    DecompositionSolver solver = new QRDecomposition(design, SINGULARITY_THRESHOLD).getSolver();
    if (!solver.isNonSingular()) {
      throw new DegenerateGeometryException("Control points do not determine an affine transformation");
    }
    RealMatrix c = solver.solve(targets);

    double s = norm.scale;
    double a1 = c.getEntry(1, 0) * s, a2 = c.getEntry(2, 0) * s;
    double b1 = c.getEntry(1, 1) * s, b2 = c.getEntry(2, 1) * s;
    AffineMapping mapping = new AffineMapping(c.getEntry(0, 0) - a1 * norm.cx - a2 * norm.cy, a1, a2,
                                              c.getEntry(0, 1) - b1 * norm.cx - b2 * norm.cy, b1, b2);
    if (!mapping.isInvertible()) {
      throw new DegenerateGeometryException("Control points collapse the page onto a line");
    }
    return mapping;
  }

  boolean isInvertible() {
    return Double.isFinite(det) && Math.abs(det) > 1e-12 * (Math.abs(a1 * b2) + Math.abs(a2 * b1));
  }

  @Override
  public Double2D forward(double x, double y) {
    return new Double2D(a0 + a1 * x + a2 * y, b0 + b1 * x + b2 * y);
  }

  @Override
  public Double2D inverse(double east, double north) {
    if (det == 0) {
      throw new ArithmeticException("Affine transformation is not invertible");
    }
    double e = east - a0;
    double n = north - b0;
    return new Double2D((b2 * e - a2 * n) / det, (a1 * n - b1 * e) / det);
  }

  @Override
  public double[] coefficients() {
    return new double[] {a0, a1, a2, b0, b1, b2};
  }
}
