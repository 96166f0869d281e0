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
import org.gbif.overlays.common.error.InvalidInputException;
import org.gbif.overlays.common.error.TooManyPointsException;
import org.gbif.overlays.common.model.Bounds;
import org.gbif.overlays.common.model.ControlPoint;
import org.gbif.overlays.common.model.TransformKind;
import org.gbif.overlays.common.model.TransformModel;
import org.gbif.overlays.common.projection.Double2D;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits a transformation of the requested kind to control points, measuring the fit in metres of a local
 * equirectangular frame centred on the points.
 * <p>
 * Configurations which cannot determine a transformation fail with {@link DegenerateGeometryException} before any
 * model is produced.  The thin plate spline is limited to a number of points, as its cost is cubic in them.
 * This class is threadsafe.
 */
public class TransformSolver {
  private static final Logger LOG = LoggerFactory.getLogger(TransformSolver.class);

  public static final int DEFAULT_POLYNOMIAL_ORDER = 2;
  public static final int DEFAULT_TPS_MAX_POINTS = 20;
  public static final double OUTLIER_FACTOR = 3;
  // segments along each page edge projected to find the bounds
  static final int BORDER_SEGMENTS = 8;

  private final int polynomialOrder;
  private final int tpsMaxPoints;
  private final double tpsSmoothing;

  public TransformSolver() {
    this(DEFAULT_POLYNOMIAL_ORDER, DEFAULT_TPS_MAX_POINTS, 0);
  }

  public TransformSolver(int polynomialOrder, int tpsMaxPoints, double tpsSmoothing) {
    Preconditions.checkArgument(polynomialOrder >= 1 && polynomialOrder <= PolynomialMapping.MAX_ORDER,
                                "Polynomial order must be between 1 and %s", PolynomialMapping.MAX_ORDER);
    Preconditions.checkArgument(tpsMaxPoints >= TransformKind.THIN_PLATE_SPLINE.minimumPoints(polynomialOrder),
                                "The thin plate spline point limit is too small");
    Preconditions.checkArgument(tpsSmoothing >= 0 && Double.isFinite(tpsSmoothing), "Smoothing must be >= 0");
    this.polynomialOrder = polynomialOrder;
    this.tpsMaxPoints = tpsMaxPoints;
    this.tpsSmoothing = tpsSmoothing;
  }

  public int getPolynomialOrder() {
    return polynomialOrder;
  }

  /**
   * Rejects control points which cannot be solved for the kind, without solving.
   *
   * @throws InvalidInputException if a point is malformed
   * @throws DegenerateGeometryException if there are too few points, or they coincide or are collinear
   * @throws TooManyPointsException if a thin plate spline is requested through too many points
   */
  public void validate(List<ControlPoint> points, TransformKind kind) {
    Preconditions.checkNotNull(kind, "A transformation kind is required");
    if (points == null) {
      throw new InvalidInputException("Control points are required");
    }
    GeometryChecks.checkValues(points);

    int minimum = kind.minimumPoints(polynomialOrder);
    if (points.size() < minimum) {
      throw new DegenerateGeometryException(
        kind + " needs at least " + minimum + " control points, supplied: " + points.size());
    }
    if (kind == TransformKind.THIN_PLATE_SPLINE && points.size() > tpsMaxPoints) {
      throw new TooManyPointsException(points.size(), tpsMaxPoints);
    }

    LocalFrame frame = LocalFrame.centredOn(geographic(points));
    List<Double2D> pixels = pixels(points);
    List<Double2D> planar = planar(points, frame);
    GeometryChecks.checkDistinct(pixels, "pixel");
    GeometryChecks.checkDistinct(planar, "geographic");
    GeometryChecks.checkNotCollinear(pixels, "pixel");
    GeometryChecks.checkNotCollinear(planar, "geographic");
  }

  /**
   * Fits the transformation and the envelope of the page mapped through it.  The model is unversioned.
   *
   * @param pageWidth the width of the source page in pixels
   * @param pageHeight the height of the source page in pixels
   */
  public SolveResult solve(String overlayId, List<ControlPoint> points, TransformKind kind, int pageWidth,
                           int pageHeight) {
    Preconditions.checkArgument(pageWidth > 0 && pageHeight > 0, "Page dimensions must be positive");
    validate(points, kind);

    LocalFrame frame = LocalFrame.centredOn(geographic(points));
    List<Double2D> pixels = pixels(points);
    List<Double2D> planar = planar(points, frame);

    PlanarMapping mapping;
    switch (kind) {
      case AFFINE:
        mapping = AffineMapping.fit(pixels, planar);
        break;
      case POLYNOMIAL:
        mapping = PolynomialMapping.fit(polynomialOrder, pixels, planar);
        break;
      case THIN_PLATE_SPLINE:
        mapping = ThinPlateSplineMapping.fit(pixels, planar, tpsSmoothing);
        break;
      case PROJECTIVE:
        mapping = ProjectiveMapping.fit(pixels, planar);
        break;
      default:
        throw new IllegalArgumentException("Unknown transformation kind " + kind);
    }
    GeoTransformation transformation = new GeoTransformation(kind, frame, mapping);

    double[] residuals = new double[points.size()];
    double sumOfSquares = 0;
    for (int i = 0; i < points.size(); i++) {
      Double2D fitted = forwardOrFail(transformation, pixels.get(i));
      Double2D expected = planar.get(i);
      residuals[i] = Math.hypot(fitted.getX() - expected.getX(), fitted.getY() - expected.getY());
      sumOfSquares += residuals[i] * residuals[i];
    }
    double rmse = Math.sqrt(sumOfSquares / points.size());

    ImmutableList.Builder<Integer> outliers = ImmutableList.builder();
    for (int i = 0; i < residuals.length; i++) {
      if (residuals[i] > OUTLIER_FACTOR * rmse) {
        outliers.add(i);
      }
    }

    TransformModel model = TransformModel.builder()
      .overlayId(overlayId)
      .kind(kind)
      .coefficients(transformation.coefficients())
      .rmse(rmse)
      .bounds(bounds(transformation, pageWidth, pageHeight))
      .createdAt(Instant.now())
      .controlPoints(ImmutableList.copyOf(points))
      .pageWidth(pageWidth)
      .pageHeight(pageHeight)
      .build();
    LOG.debug("Solved {} for overlay {} from {} points, RMSE {} m", kind, overlayId, points.size(), rmse);
    return new SolveResult(model, transformation, residuals, outliers.build());
  }

  /**
   * The envelope of the page border, which is sampled along each edge as well as at the corners since only the
   * affine transformation maps the border to straight lines.
   */
  static Bounds bounds(GeoTransformation transformation, int width, int height) {
    List<Double2D> border = new ArrayList<>(4 * BORDER_SEGMENTS);
    for (int i = 0; i < BORDER_SEGMENTS; i++) {
      double fx = width * (double) i / BORDER_SEGMENTS;
      double fy = height * (double) i / BORDER_SEGMENTS;
      border.add(geographicOrFail(transformation, fx, 0));
      border.add(geographicOrFail(transformation, width, fy));
      border.add(geographicOrFail(transformation, width - fx, height));
      border.add(geographicOrFail(transformation, 0, height - fy));
    }
    return Bounds.envelope(border);
  }

  private static Double2D geographicOrFail(GeoTransformation transformation, double x, double y) {
    try {
      return transformation.forward(x, y);
    } catch (ArithmeticException e) {
      throw new DegenerateGeometryException("The page cannot be mapped through the transformation", e);
    }
  }

  private static Double2D forwardOrFail(GeoTransformation transformation, Double2D pixel) {
    try {
      return transformation.forwardPlanar(pixel.getX(), pixel.getY());
    } catch (ArithmeticException e) {
      throw new DegenerateGeometryException("A control point cannot be mapped through the transformation", e);
    }
  }

  private static List<Double2D> pixels(List<ControlPoint> points) {
    List<Double2D> pixels = new ArrayList<>(points.size());
    for (ControlPoint p : points) {
      pixels.add(new Double2D(p.getPixelX(), p.getPixelY()));
    }
    return pixels;
  }

  private static List<Double2D> geographic(List<ControlPoint> points) {
    List<Double2D> geographic = new ArrayList<>(points.size());
    for (ControlPoint p : points) {
      geographic.add(new Double2D(p.getLon(), p.getLat()));
    }
    return geographic;
  }

  private static List<Double2D> planar(List<ControlPoint> points, LocalFrame frame) {
    List<Double2D> planar = new ArrayList<>(points.size());
    for (ControlPoint p : points) {
      planar.add(frame.toLocal(p.getLon(), p.getLat()));
    }
    return planar;
  }
}
