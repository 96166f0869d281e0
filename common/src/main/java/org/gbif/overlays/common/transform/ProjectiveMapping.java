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
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * An eight parameter homography.  The 3×3 homogeneous matrix is solved by linear least squares on normalized
 * coordinates (the direct linear transform) and scaled so that h[2][2] = 1.
 */
final class ProjectiveMapping implements PlanarMapping {
  // a point closer than this to the horizon line has no finite image
  private static final double HORIZON_EPSILON = 1e-12;

  private final double[][] h;
  private final double[][] inverse;

  private ProjectiveMapping(RealMatrix h) {
    this.h = h.getData();
    LUDecomposition lu = new LUDecomposition(h);
    if (!lu.getSolver().isNonSingular()) {
      throw new DegenerateGeometryException("Control points give a singular projective transformation");
    }
    this.inverse = lu.getSolver().getInverse().getData();
  }

  /**
   * @param c the nine entries of the matrix, row by row
   */
  static ProjectiveMapping fromCoefficients(double[] c, int offset) {
    RealMatrix h = new Array2DRowRealMatrix(3, 3);
    for (int i = 0; i < 9; i++) {
      h.setEntry(i / 3, i % 3, c[offset + i]);
    }
    return new ProjectiveMapping(h);
  }

  static ProjectiveMapping fit(List<Double2D> pixels, List<Double2D> planar) {
    Normalization from = Normalization.of(pixels);
    Normalization to = Normalization.of(planar);

    int n = pixels.size();
    RealMatrix design = new Array2DRowRealMatrix(2 * n, 8);
    RealVector targets = new ArrayRealVector(2 * n);
    for (int i = 0; i < n; i++) {
      double x = from.x(pixels.get(i).getX());
      double y = from.y(pixels.get(i).getY());
      double u = to.x(planar.get(i).getX());
      double v = to.y(planar.get(i).getY());

      design.setRow(2 * i, new double[] {x, y, 1, 0, 0, 0, -x * u, -y * u});
      targets.setEntry(2 * i, u);
      design.setRow(2 * i + 1, new double[] {0, 0, 0, x, y, 1, -x * v, -y * v});
      targets.setEntry(2 * i + 1, v);
    }

    DecompositionSolver solver = new QRDecomposition(design, AffineMapping.SINGULARITY_THRESHOLD).getSolver();
    if (!solver.isNonSingular()) {
      throw new DegenerateGeometryException("Control points do not determine a projective transformation");
    }
    RealVector p = solver.solve(targets);
    RealMatrix normalized = MatrixUtils.createRealMatrix(new double[][] {
      {p.getEntry(0), p.getEntry(1), p.getEntry(2)},
      {p.getEntry(3), p.getEntry(4), p.getEntry(5)},
      {p.getEntry(6), p.getEntry(7), 1}
    });

    // undo the normalizations: H = To⁻¹ · Hn · From
    RealMatrix fromMatrix = MatrixUtils.createRealMatrix(new double[][] {
      {from.scale, 0, -from.scale * from.cx},
      {0, from.scale, -from.scale * from.cy},
      {0, 0, 1}
    });
    RealMatrix toInverse = MatrixUtils.createRealMatrix(new double[][] {
      {1 / to.scale, 0, to.cx},
      {0, 1 / to.scale, to.cy},
      {0, 0, 1}
    });
    RealMatrix h = toInverse.multiply(normalized).multiply(fromMatrix);
    double h22 = h.getEntry(2, 2);
    if (Math.abs(h22) < HORIZON_EPSILON || !Double.isFinite(h22)) {
      throw new DegenerateGeometryException("Projective transformation cannot be normalized");
    }
    return new ProjectiveMapping(h.scalarMultiply(1 / h22));
  }

  private static Double2D apply(double[][] m, double x, double y) {
    double w = m[2][0] * x + m[2][1] * y + m[2][2];
    double magnitude = Math.abs(m[2][0] * x) + Math.abs(m[2][1] * y) + Math.abs(m[2][2]);
    if (!(Math.abs(w) > HORIZON_EPSILON * magnitude)) {
      throw new ArithmeticException("Position lies on the horizon of the projective transformation");
    }
    return new Double2D((m[0][0] * x + m[0][1] * y + m[0][2]) / w, (m[1][0] * x + m[1][1] * y + m[1][2]) / w);
  }

  @Override
  public Double2D forward(double x, double y) {
    return apply(h, x, y);
  }

  @Override
  public Double2D inverse(double east, double north) {
    return apply(inverse, east, north);
  }

  @Override
  public double[] coefficients() {
    double[] c = new double[9];
    for (int i = 0; i < 9; i++) {
      c[i] = h[i / 3][i % 3];
    }
    return c;
  }
}
