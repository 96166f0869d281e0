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
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * A thin plate spline through the control points: an affine part plus radial terms U(r) = r²·ln r centred on each
 * normalized control pixel.  With zero smoothing the spline passes exactly through every point.
 * <p>
 * Coefficients are laid out as {n, cx, cy, scale, smoothing, n centre pairs, n east weights, 3 east affine terms,
 * n north weights, 3 north affine terms}.
 */
final class ThinPlateSplineMapping extends IterativelyInvertedMapping {
  private static final double SINGULARITY_THRESHOLD = 1e-12;

  private final Normalization norm;
  private final double smoothing;
  private final double[] cx;
  private final double[] cy;
  private final double[] eastWeights;
  private final double[] eastAffine;
  private final double[] northWeights;
  private final double[] northAffine;

  private ThinPlateSplineMapping(Normalization norm, double smoothing, double[] cx, double[] cy,
                                 double[] eastWeights, double[] eastAffine,
                                 double[] northWeights, double[] northAffine) {
    this.norm = norm;
    this.smoothing = smoothing;
    this.cx = cx;
    this.cy = cy;
    this.eastWeights = eastWeights;
    this.eastAffine = eastAffine;
    this.northWeights = northWeights;
    this.northAffine = northAffine;
  }

  static ThinPlateSplineMapping fromCoefficients(double[] c, int offset) {
    int n = (int) c[offset];
    Normalization norm = new Normalization(c[offset + 1], c[offset + 2], c[offset + 3]);
    double smoothing = c[offset + 4];
    int i = offset + 5;
    double[] cx = new double[n];
    double[] cy = new double[n];
    for (int k = 0; k < n; k++) {
      cx[k] = c[i++];
      cy[k] = c[i++];
    }
    double[] eastWeights = copy(c, i, n);
    double[] eastAffine = copy(c, i + n, 3);
    double[] northWeights = copy(c, i + n + 3, n);
    double[] northAffine = copy(c, i + 2 * n + 3, 3);
    return new ThinPlateSplineMapping(norm, smoothing, cx, cy, eastWeights, eastAffine, northWeights, northAffine);
  }

  private static double[] copy(double[] c, int from, int length) {
    double[] out = new double[length];
    System.arraycopy(c, from, out, 0, length);
    return out;
  }

  static ThinPlateSplineMapping fit(List<Double2D> pixels, List<Double2D> planar, double smoothing) {
    Normalization norm = Normalization.of(pixels);
    int n = pixels.size();
    double[] cx = new double[n];
    double[] cy = new double[n];
    for (int i = 0; i < n; i++) {
      cx[i] = norm.x(pixels.get(i).getX());
      cy[i] = norm.y(pixels.get(i).getY());
    }

    // [K + λI  P] [w]   [v]
    // [Pᵀ      0] [a] = [0]
    RealMatrix system = new Array2DRowRealMatrix(n + 3, n + 3);
    RealMatrix targets = new Array2DRowRealMatrix(n + 3, 2);
    for (int i = 0; i < n; i++) {
      for (int j = 0; j < n; j++) {
        double k = i == j ? smoothing : radial(cx[i] - cx[j], cy[i] - cy[j]);
        system.setEntry(i, j, k);
      }
      system.setEntry(i, n, 1);
      system.setEntry(i, n + 1, cx[i]);
      system.setEntry(i, n + 2, cy[i]);
      system.setEntry(n, i, 1);
      system.setEntry(n + 1, i, cx[i]);
      system.setEntry(n + 2, i, cy[i]);
      targets.setEntry(i, 0, planar.get(i).getX());
      targets.setEntry(i, 1, planar.get(i).getY());
    }

    DecompositionSolver solver = new LUDecomposition(system, SINGULARITY_THRESHOLD).getSolver();
    if (!solver.isNonSingular()) {
      throw new DegenerateGeometryException("Control points do not determine a thin plate spline");
    }
    RealMatrix solution = solver.solve(targets);
    double[] east = solution.getColumn(0);
    double[] north = solution.getColumn(1);
    return new ThinPlateSplineMapping(norm, smoothing, cx, cy,
                                      copy(east, 0, n), copy(east, n, 3), copy(north, 0, n), copy(north, n, 3));
  }

  private static double radial(double dx, double dy) {
    double r2 = dx * dx + dy * dy;
    return r2 == 0 ? 0 : 0.5 * r2 * Math.log(r2);
  }

  @Override
  public Double2D forward(double x, double y) {
    double xn = norm.x(x);
    double yn = norm.y(y);
    double e = eastAffine[0] + eastAffine[1] * xn + eastAffine[2] * yn;
    double n = northAffine[0] + northAffine[1] * xn + northAffine[2] * yn;
    for (int i = 0; i < cx.length; i++) {
      double u = radial(xn - cx[i], yn - cy[i]);
      e += eastWeights[i] * u;
      n += northWeights[i] * u;
    }
    return new Double2D(e, n);
  }

  @Override
  double[] jacobian(double x, double y) {
    double xn = norm.x(x);
    double yn = norm.y(y);
    double[] j = {eastAffine[1], eastAffine[2], northAffine[1], northAffine[2]};
    for (int i = 0; i < cx.length; i++) {
      double dx = xn - cx[i];
      double dy = yn - cy[i];
      double r2 = dx * dx + dy * dy;
      if (r2 > 0) {
        // d/dx of r²·ln r is x·(2·ln r + 1)
        double f = Math.log(r2) + 1;
        j[0] += eastWeights[i] * dx * f;
        j[1] += eastWeights[i] * dy * f;
        j[2] += northWeights[i] * dx * f;
        j[3] += northWeights[i] * dy * f;
      }
    }
    for (int i = 0; i < 4; i++) {
      j[i] *= norm.scale;
    }
    return j;
  }

  @Override
  Double2D initialGuess(double e, double n) {
    Double2D xy = solveLinear(eastAffine[1], eastAffine[2], northAffine[1], northAffine[2],
                              e - eastAffine[0], n - northAffine[0]);
    return new Double2D(norm.unX(xy.getX()), norm.unY(xy.getY()));
  }

  @Override
  public double[] coefficients() {
    int n = cx.length;
    double[] c = new double[5 + 4 * n + 6];
    c[0] = n;
    c[1] = norm.cx;
    c[2] = norm.cy;
    c[3] = norm.scale;
    c[4] = smoothing;
    int i = 5;
    for (int k = 0; k < n; k++) {
      c[i++] = cx[k];
      c[i++] = cy[k];
    }
    System.arraycopy(eastWeights, 0, c, i, n);
    System.arraycopy(eastAffine, 0, c, i + n, 3);
    System.arraycopy(northWeights, 0, c, i + n + 3, n);
    System.arraycopy(northAffine, 0, c, i + 2 * n + 3, 3);
    return c;
  }
}
