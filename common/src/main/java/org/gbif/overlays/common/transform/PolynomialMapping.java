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
 * A polynomial of the given order in the normalized pixel coordinates, fitted independently for each planar axis.
 * Terms are ordered by degree: 1, x, y, x², xy, y², x³ …
 * <p>
 * Coefficients are laid out as {order, cx, cy, scale, east terms…, north terms…}.
 */
final class PolynomialMapping extends IterativelyInvertedMapping {
  static final int MAX_ORDER = 3;

  private final int order;
  private final Normalization norm;
  private final int[] xPowers;
  private final int[] yPowers;
  private final double[] east;
  private final double[] north;

  private PolynomialMapping(int order, Normalization norm, double[] east, double[] north) {
    this.order = order;
    this.norm = norm;
    this.xPowers = new int[termCount(order)];
    this.yPowers = new int[termCount(order)];
    int t = 0;
    for (int degree = 0; degree <= order; degree++) {
      for (int j = 0; j <= degree; j++) {
        xPowers[t] = degree - j;
        yPowers[t] = j;
        t++;
      }
    }
    this.east = east;
    this.north = north;
  }

  static int termCount(int order) {
    return (order + 1) * (order + 2) / 2;
  }

  static PolynomialMapping fromCoefficients(double[] c, int offset) {
    int order = (int) c[offset];
    int terms = termCount(order);
    Normalization norm = new Normalization(c[offset + 1], c[offset + 2], c[offset + 3]);
    double[] east = new double[terms];
    double[] north = new double[terms];
    System.arraycopy(c, offset + 4, east, 0, terms);
    System.arraycopy(c, offset + 4 + terms, north, 0, terms);
    return new PolynomialMapping(order, norm, east, north);
  }

  static PolynomialMapping fit(int order, List<Double2D> pixels, List<Double2D> planar) {
    if (order < 1 || order > MAX_ORDER) {
      throw new IllegalArgumentException("Polynomial order must be between 1 and " + MAX_ORDER + ": " + order);
    }
    Normalization norm = Normalization.of(pixels);
    PolynomialMapping shape = new PolynomialMapping(order, norm, null, null);

    int n = pixels.size();
    RealMatrix design = new Array2DRowRealMatrix(n, termCount(order));
    RealMatrix targets = new Array2DRowRealMatrix(n, 2);
    for (int i = 0; i < n; i++) {
      design.setRow(i, shape.terms(norm.x(pixels.get(i).getX()), norm.y(pixels.get(i).getY())));
      targets.setEntry(i, 0, planar.get(i).getX());
      targets.setEntry(i, 1, planar.get(i).getY());
    }

    DecompositionSolver solver = new QRDecomposition(design, AffineMapping.SINGULARITY_THRESHOLD).getSolver();
    if (!solver.isNonSingular()) {
      throw new DegenerateGeometryException("Control points do not determine a polynomial of order " + order);
    }
    RealMatrix c = solver.solve(targets);
    return new PolynomialMapping(order, norm, c.getColumn(0), c.getColumn(1));
  }

  private double[] terms(double xn, double yn) {
    double[] terms = new double[xPowers.length];
    for (int t = 0; t < terms.length; t++) {
      terms[t] = Math.pow(xn, xPowers[t]) * Math.pow(yn, yPowers[t]);
    }
    return terms;
  }

  @Override
  public Double2D forward(double x, double y) {
    double[] terms = terms(norm.x(x), norm.y(y));
    double e = 0, n = 0;
    for (int t = 0; t < terms.length; t++) {
      e += east[t] * terms[t];
      n += north[t] * terms[t];
    }
    return new Double2D(e, n);
  }

  @Override
  double[] jacobian(double x, double y) {
    double xn = norm.x(x);
    double yn = norm.y(y);
    double[] j = new double[4];
    for (int t = 1; t < xPowers.length; t++) {
      int px = xPowers[t];
      int py = yPowers[t];
      double dx = px == 0 ? 0 : px * Math.pow(xn, px - 1) * Math.pow(yn, py);
      double dy = py == 0 ? 0 : py * Math.pow(xn, px) * Math.pow(yn, py - 1);
      j[0] += east[t] * dx;
      j[1] += east[t] * dy;
      j[2] += north[t] * dx;
      j[3] += north[t] * dy;
    }
    for (int i = 0; i < 4; i++) {
      j[i] *= norm.scale;
    }
    return j;
  }

  @Override
  Double2D initialGuess(double e, double n) {
    // terms 1 and 2 are x and y
    Double2D xy = solveLinear(east[1], east[2], north[1], north[2], e - east[0], n - north[0]);
    return new Double2D(norm.unX(xy.getX()), norm.unY(xy.getY()));
  }

  @Override
  public double[] coefficients() {
    int terms = east.length;
    double[] c = new double[4 + 2 * terms];
    c[0] = order;
    c[1] = norm.cx;
    c[2] = norm.cy;
    c[3] = norm.scale;
    System.arraycopy(east, 0, c, 4, terms);
    System.arraycopy(north, 0, c, 4 + terms, terms);
    return c;
  }
}
