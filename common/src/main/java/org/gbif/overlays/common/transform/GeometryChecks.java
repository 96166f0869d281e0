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
import org.gbif.overlays.common.model.ControlPoint;
import org.gbif.overlays.common.projection.Double2D;

import java.util.List;

/**
 * Checks made before solving, rejecting control points which cannot determine any transformation.
 */
final class GeometryChecks {
  // positions closer than this are treated as the same point, in pixels or metres
  static final double DUPLICATE_TOLERANCE = 1e-6;
  // ratio of the smaller to larger spread of the points below which they lie on a line
  static final double COLLINEARITY_RATIO = 1e-12;

  private GeometryChecks() {}

  /**
   * @throws InvalidInputException if a point is missing, not finite or outside the valid geographic range
   */
  static void checkValues(List<ControlPoint> points) {
    for (int i = 0; i < points.size(); i++) {
      ControlPoint p = points.get(i);
      if (p == null) {
        throw new InvalidInputException("Control point " + i + " is missing");
      }
      if (!Double.isFinite(p.getPixelX()) || !Double.isFinite(p.getPixelY())
          || !Double.isFinite(p.getLon()) || !Double.isFinite(p.getLat())) {
        throw new InvalidInputException("Control point " + i + " has a non finite coordinate: " + p);
      }
      if (p.getLat() < -90 || p.getLat() > 90) {
        throw new InvalidInputException("Control point " + i + " has latitude out of range: " + p.getLat());
      }
      if (p.getLon() < -180 || p.getLon() > 180) {
        throw new InvalidInputException("Control point " + i + " has longitude out of range: " + p.getLon());
      }
    }
  }

  /**
   * @throws DegenerateGeometryException if two positions coincide
   */
  static void checkDistinct(List<Double2D> positions, String what) {
    for (int i = 0; i < positions.size(); i++) {
      for (int j = i + 1; j < positions.size(); j++) {
        Double2D a = positions.get(i);
        Double2D b = positions.get(j);
        if (Math.hypot(a.getX() - b.getX(), a.getY() - b.getY()) <= DUPLICATE_TOLERANCE) {
          throw new DegenerateGeometryException("Control points " + i + " and " + j + " have the same " + what);
        }
      }
    }
  }

  /**
   * @throws DegenerateGeometryException if all positions lie on one line
   */
  static void checkNotCollinear(List<Double2D> positions, String what) {
    double cx = 0, cy = 0;
    for (Double2D p : positions) {
      cx += p.getX();
      cy += p.getY();
    }
    cx /= positions.size();
    cy /= positions.size();

    double sxx = 0, syy = 0, sxy = 0;
    for (Double2D p : positions) {
      double dx = p.getX() - cx;
      double dy = p.getY() - cy;
      sxx += dx * dx;
      syy += dy * dy;
      sxy += dx * dy;
    }

    // eigenvalues of the scatter matrix
    double mean = (sxx + syy) / 2;
    double spread = Math.hypot((sxx - syy) / 2, sxy);
    double largest = mean + spread;
    double smallest = Math.max(0, mean - spread);
    if (largest == 0 || smallest / largest < COLLINEARITY_RATIO) {
      throw new DegenerateGeometryException("Control points are collinear in " + what + " coordinates");
    }
  }
}
