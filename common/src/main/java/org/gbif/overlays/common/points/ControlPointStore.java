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
package org.gbif.overlays.common.points;

import org.gbif.overlays.common.error.InvalidInputException;
import org.gbif.overlays.common.model.ControlPoint;
import org.gbif.overlays.common.model.PageSize;

import java.util.List;
import java.util.Optional;

/**
 * The working set of control points of each overlay, staged by an editor until they are committed for solving.
 * Storing points never triggers a solve.
 */
public interface ControlPointStore {

  /**
   * Records the dimensions of the overlay's source page, against which point pixels are validated.
   */
  void registerPage(String overlayId, int width, int height);

  Optional<PageSize> page(String overlayId);

  /**
   * @return the identifier assigned to the point
   * @throws InvalidInputException if the page is unknown or the point lies outside it or the valid geographic range
   */
  String add(String overlayId, ControlPoint point);

  /**
   * @return the points of the overlay in the order they were added, each with its identifier
   */
  List<ControlPoint> list(String overlayId);

  /**
   * @return true if the point existed
   */
  boolean remove(String pointId);

  /**
   * Validates all points and only then replaces the overlay's working set with them.
   *
   * @return the stored points with their identifiers
   * @throws InvalidInputException if any point is invalid, leaving the working set unchanged
   */
  List<ControlPoint> replaceAll(String overlayId, List<ControlPoint> points);
}
