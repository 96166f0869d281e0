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

import org.gbif.overlays.common.model.TransformKind;
import org.gbif.overlays.common.model.TransformModel;
import org.gbif.overlays.common.projection.Double2D;

import com.google.common.base.Preconditions;

/**
 * A solved mapping between source page pixels and geographic coordinates, composed of a planar mapping fitted in a
 * {@link LocalFrame}.  Instances are immutable and may be shared between threads.
 */
public final class GeoTransformation {
  private final TransformKind kind;
  private final LocalFrame frame;
  private final PlanarMapping mapping;

  GeoTransformation(TransformKind kind, LocalFrame frame, PlanarMapping mapping) {
    this.kind = kind;
    this.frame = frame;
    this.mapping = mapping;
  }

  /**
   * Restores the transformation a model was solved to.
   */
  public static GeoTransformation of(TransformModel model) {
    return restore(model.getKind(), model.getCoefficients());
  }

  /**
   * @param coefficients as given by {@link #coefficients()}
   */
  public static GeoTransformation restore(TransformKind kind, double[] coefficients) {
    Preconditions.checkArgument(coefficients != null && coefficients.length > 2, "Missing coefficients");
    LocalFrame frame = new LocalFrame(coefficients[0], coefficients[1]);
    PlanarMapping mapping;
    switch (kind) {
      case AFFINE:
        mapping = AffineMapping.fromCoefficients(coefficients, 2);
        break;
      case POLYNOMIAL:
        mapping = PolynomialMapping.fromCoefficients(coefficients, 2);
        break;
      case THIN_PLATE_SPLINE:
        mapping = ThinPlateSplineMapping.fromCoefficients(coefficients, 2);
        break;
      case PROJECTIVE:
        mapping = ProjectiveMapping.fromCoefficients(coefficients, 2);
        break;
      default:
        throw new IllegalArgumentException("Unknown transformation kind " + kind);
    }
    return new GeoTransformation(kind, frame, mapping);
  }

  /**
   * @return the longitude (x) and latitude (y) of the pixel
   * @throws ArithmeticException if the pixel has no finite image
   */
  public Double2D forward(double pixelX, double pixelY) {
    Double2D planar = mapping.forward(pixelX, pixelY);
    Double2D geographic = frame.toGeographic(planar.getX(), planar.getY());
    if (!geographic.isFinite()) {
      throw new ArithmeticException("Pixel (" + pixelX + ", " + pixelY + ") has no finite image");
    }
    return geographic;
  }

  /**
   * @return the source page pixel at the geographic position
   * @throws ArithmeticException if no pixel maps to the position
   */
  public Double2D inverse(double lon, double lat) {
    Double2D planar = frame.toLocal(lon, lat);
    Double2D pixel = mapping.inverse(planar.getX(), planar.getY());
    if (!pixel.isFinite()) {
      throw new ArithmeticException("Position (" + lon + ", " + lat + ") has no finite preimage");
    }
    return pixel;
  }

  /**
   * @return the planar position of the pixel, in metres of the local frame
   */
  Double2D forwardPlanar(double pixelX, double pixelY) {
    return mapping.forward(pixelX, pixelY);
  }

  public TransformKind getKind() {
    return kind;
  }

  public LocalFrame getFrame() {
    return frame;
  }

  /**
   * @return the frame origin followed by the parameters of the planar mapping
   */
  public double[] coefficients() {
    double[] m = mapping.coefficients();
    double[] c = new double[m.length + 2];
    c[0] = frame.getOriginLon();
    c[1] = frame.getOriginLat();
    System.arraycopy(m, 0, c, 2, m.length);
    return c;
  }
}
