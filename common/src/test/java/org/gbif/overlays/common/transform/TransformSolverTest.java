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
import org.gbif.overlays.common.projection.Double2D;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import static org.gbif.overlays.common.projection.AssertOnDouble2D.assertEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TransformSolverTest {
  private static final int WIDTH = 1000;
  private static final int HEIGHT = 800;

  private final TransformSolver solver = new TransformSolver();

  /**
   * A page with north up, about 1° across, slightly sheared.
   */
  private static ControlPoint affine(double x, double y) {
    return ControlPoint.of(x, y, 10 + 0.001 * x + 0.0002 * y, 50 + 0.0001 * x - 0.0008 * y);
  }

  /**
   * As {@link #affine} with a gentle quadratic warp.
   */
  private static ControlPoint warped(double x, double y) {
    return ControlPoint.of(x, y, 10 + 0.001 * x + 0.0002 * y + 1e-8 * x * x,
                           50 + 0.0001 * x - 0.0008 * y + 1e-8 * x * y);
  }

  private static List<ControlPoint> grid(int columns, int rows, boolean warp) {
    List<ControlPoint> points = new ArrayList<>();
    for (int i = 0; i < columns; i++) {
      for (int j = 0; j < rows; j++) {
        double x = 50 + i * 900.0 / (columns - 1);
        double y = 40 + j * 720.0 / (rows - 1);
        points.add(warp ? warped(x, y) : affine(x, y));
      }
    }
    return points;
  }

  @Test
  public void testAffineExactFit() {
    List<ControlPoint> points = Arrays.asList(affine(100, 100), affine(900, 150), affine(400, 700));
    SolveResult result = solver.solve("o1", points, TransformKind.AFFINE, WIDTH, HEIGHT);
    assertTrue("RMSE " + result.getRmse(), result.getRmse() < 1e-9);
    assertEquals(3, result.getResiduals().length);
    assertEquals(TransformKind.AFFINE, result.getModel().getKind());
    assertEquals(0, result.getModel().getVersion());
  }

  @Test
  public void testAddingConsistentPointDoesNotWorsenFit() {
    List<ControlPoint> three = Arrays.asList(affine(100, 100), affine(900, 150), affine(400, 700));
    List<ControlPoint> four = new ArrayList<>(three);
    four.add(affine(800, 650));
    double rmse3 = solver.solve("o1", three, TransformKind.AFFINE, WIDTH, HEIGHT).getRmse();
    double rmse4 = solver.solve("o1", four, TransformKind.AFFINE, WIDTH, HEIGHT).getRmse();
    assertTrue(rmse4 + " > " + rmse3, rmse4 <= rmse3 + 1e-9);
  }

  @Test
  public void testHappyPathBounds() {
    List<ControlPoint> points = Arrays.asList(affine(0, 0), affine(1000, 0), affine(1000, 800), affine(0, 800));
    SolveResult result = solver.solve("o1", points, TransformKind.AFFINE, WIDTH, HEIGHT);
    assertTrue(result.getRmse() < 1);
    assertTrue(result.getOutliers().isEmpty());

    // an affine page maps to a parallelogram, whose envelope is that of its corners
    Bounds bounds = result.getModel().getBounds();
    assertEquals(50.1, bounds.getNorth(), 1e-9);
    assertEquals(49.36, bounds.getSouth(), 1e-9);
    assertEquals(11.16, bounds.getEast(), 1e-9);
    assertEquals(10, bounds.getWest(), 1e-9);
  }

  @Test
  public void testExactKinds() {
    assertTrue(solver.solve("o1", grid(3, 3, true), TransformKind.POLYNOMIAL, WIDTH, HEIGHT).getRmse() < 1e-6);
    assertTrue(solver.solve("o1", grid(4, 3, true), TransformKind.THIN_PLATE_SPLINE, WIDTH, HEIGHT).getRmse() < 1e-6);
    assertTrue(solver.solve("o1", grid(2, 2, false), TransformKind.PROJECTIVE, WIDTH, HEIGHT).getRmse() < 1e-6);
  }

  @Test
  public void testWarpedPagesFitBetterWithMoreFlexibleKinds() {
    List<ControlPoint> points = grid(4, 4, true);
    double affine = solver.solve("o1", points, TransformKind.AFFINE, WIDTH, HEIGHT).getRmse();
    double polynomial = solver.solve("o1", points, TransformKind.POLYNOMIAL, WIDTH, HEIGHT).getRmse();
    assertTrue(affine > 10);
    assertTrue(polynomial < 1e-6);
  }

  @Test
  public void testRoundTrip() {
    List<ControlPoint> points = grid(4, 4, true);
    for (TransformKind kind : TransformKind.values()) {
      GeoTransformation t = solver.solve("o1", points, kind, WIDTH, HEIGHT).getTransformation();
      for (double x = 0; x <= WIDTH; x += 125) {
        for (double y = 0; y <= HEIGHT; y += 100) {
          Double2D geographic = t.forward(x, y);
          assertEquals(kind + " at " + x + "," + y, new Double2D(x, y),
                       t.inverse(geographic.getX(), geographic.getY()), 1e-6);
        }
      }
    }
  }

  @Test
  public void testRestoreFromCoefficients() {
    List<ControlPoint> points = grid(4, 4, true);
    for (TransformKind kind : TransformKind.values()) {
      SolveResult result = solver.solve("o1", points, kind, WIDTH, HEIGHT);
      GeoTransformation restored = GeoTransformation.of(result.getModel());
      for (ControlPoint p : points) {
        assertEquals(kind.toString(), result.getTransformation().forward(p.getPixelX(), p.getPixelY()),
                     restored.forward(p.getPixelX(), p.getPixelY()), 1e-12);
      }
    }
  }

  @Test
  public void testOutlierIsFlaggedNotDiscarded() {
    List<ControlPoint> points = grid(5, 4, false);
    ControlPoint good = points.get(6);
    points.set(6, good.toBuilder().lat(good.getLat() + 0.01).build());

    SolveResult result = solver.solve("o1", points, TransformKind.AFFINE, WIDTH, HEIGHT);
    assertEquals(Collections.singletonList(6), result.getOutliers());
    assertEquals(20, result.getModel().getControlPoints().size());
    assertTrue(result.getRmse() > 1);
  }

  @Test(expected = DegenerateGeometryException.class)
  public void testCollinearPixels() {
    List<ControlPoint> points = Arrays.asList(ControlPoint.of(0, 0, 10, 50), ControlPoint.of(100, 100, 10.1, 50),
                                              ControlPoint.of(200, 200, 10.1, 50.1));
    solver.solve("o1", points, TransformKind.AFFINE, WIDTH, HEIGHT);
  }

  @Test(expected = DegenerateGeometryException.class)
  public void testCollinearGeography() {
    List<ControlPoint> points = Arrays.asList(affine(0, 0), ControlPoint.of(500, 0, 10.5, 50.5),
                                              ControlPoint.of(0, 500, 11, 51));
    solver.solve("o1", points, TransformKind.AFFINE, WIDTH, HEIGHT);
  }

  @Test
  public void testCollinearForEveryKind() {
    List<ControlPoint> line = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      line.add(affine(100 * i, 100 * i));
    }
    for (TransformKind kind : TransformKind.values()) {
      try {
        solver.solve("o1", line, kind, WIDTH, HEIGHT);
        fail(kind + " solved collinear points");
      } catch (DegenerateGeometryException e) {
        // expected
      }
    }
  }

  @Test(expected = DegenerateGeometryException.class)
  public void testDuplicatePoint() {
    List<ControlPoint> points = Arrays.asList(affine(100, 100), affine(900, 150), affine(400, 700),
                                              affine(100, 100));
    solver.solve("o1", points, TransformKind.AFFINE, WIDTH, HEIGHT);
  }

  @Test(expected = DegenerateGeometryException.class)
  public void testTooFewPoints() {
    solver.solve("o1", grid(2, 2, false), TransformKind.POLYNOMIAL, WIDTH, HEIGHT);
  }

  @Test
  public void testTooManyPointsForSpline() {
    List<ControlPoint> points = grid(7, 3, true);
    try {
      solver.solve("o1", points, TransformKind.THIN_PLATE_SPLINE, WIDTH, HEIGHT);
      fail("Expected 21 points to be rejected");
    } catch (TooManyPointsException e) {
      assertEquals(TransformSolver.DEFAULT_TPS_MAX_POINTS, e.getLimit());
    }
    // other kinds are not limited
    solver.solve("o1", points, TransformKind.POLYNOMIAL, WIDTH, HEIGHT);
  }

  @Test(expected = InvalidInputException.class)
  public void testLatitudeOutOfRange() {
    solver.validate(Arrays.asList(affine(0, 0), affine(500, 0), ControlPoint.of(0, 500, 10, 91)),
                    TransformKind.AFFINE);
  }

  @Test
  public void testSmoothedSplineApproximates() {
    List<ControlPoint> points = grid(4, 4, true);
    ControlPoint good = points.get(5);
    points.set(5, good.toBuilder().lon(good.getLon() + 0.001).build());

    double exact = new TransformSolver(2, 20, 0).solve("o1", points, TransformKind.THIN_PLATE_SPLINE, WIDTH, HEIGHT)
      .getRmse();
    double smoothed = new TransformSolver(2, 20, 1).solve("o1", points, TransformKind.THIN_PLATE_SPLINE, WIDTH,
                                                          HEIGHT).getRmse();
    assertTrue(exact < 1e-6);
    assertTrue(smoothed > exact);
  }
}
