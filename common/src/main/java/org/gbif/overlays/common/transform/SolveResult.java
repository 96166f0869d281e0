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

import org.gbif.overlays.common.model.TransformModel;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A solved model with the residual of each control point in metres, in the order the points were supplied.
 * Outliers are the indices of points whose residual exceeds three times the RMSE; they are only flagged for review.
 */
@Data
@AllArgsConstructor
public class SolveResult {
  private final TransformModel model;
  private final GeoTransformation transformation;
  private final double[] residuals;
  private final List<Integer> outliers;

  public double getRmse() {
    return model.getRmse();
  }
}
