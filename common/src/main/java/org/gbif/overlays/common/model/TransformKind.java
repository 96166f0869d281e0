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
package org.gbif.overlays.common.model;

/**
 * The families of transformation which map source pixels to geographic coordinates.
 */
public enum TransformKind {
  AFFINE,
  POLYNOMIAL,
  THIN_PLATE_SPLINE,
  PROJECTIVE;

  /**
   * The fewest control points which determine a transformation of this kind.
   * @param polynomialOrder only used for {@link #POLYNOMIAL}
   */
  public int minimumPoints(int polynomialOrder) {
    switch (this) {
      case AFFINE: return 3;
      case POLYNOMIAL: return (polynomialOrder + 1) * (polynomialOrder + 2) / 2;
      case THIN_PLATE_SPLINE: return 3;
      case PROJECTIVE: return 4;
      default: throw new IllegalStateException("Unknown kind " + this);
    }
  }
}
