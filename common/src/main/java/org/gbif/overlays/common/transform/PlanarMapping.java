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
 * A mapping between source page pixels and metres in a {@link LocalFrame}.  Implementations are immutable.
 */
interface PlanarMapping {

  /**
   * @return metres east (x) and north (y)
   * @throws ArithmeticException if the pixel has no finite image
   */
  Double2D forward(double x, double y);

  /**
   * @return the pixel mapping to the planar position
   * @throws ArithmeticException if no pixel can be found
   */
  Double2D inverse(double east, double north);

  /**
   * @return the parameters restoring this mapping through the kind's factory
   */
  double[] coefficients();
}
