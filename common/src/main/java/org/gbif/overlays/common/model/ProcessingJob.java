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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

/**
 * The record of a job driving one overlay from control points to a tile pyramid.  The highest completed zoom level
 * is what allows an interrupted job to resume without redoing finished levels.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
@AllArgsConstructor
public class ProcessingJob {
  private String id;
  private String overlayId;
  private String sourceRef;
  private int pageWidth;
  private int pageHeight;
  private TransformKind kind;
  private List<ControlPoint> controlPoints;
  private List<Integer> zoomLevels;

  private JobStage stage;
  private JobStatus status;
  private int progressPct;
  private String currentStep;
  private JobError error;
  private int attemptCount;

  // 0 until the solve succeeds
  private int transformVersion;
  @Builder.Default
  private int highestCompletedZoom = -1;
  private long totalTiles;
  private long completedTiles;
  @Builder.Default
  private List<TileFailure> tileFailures = new ArrayList<>();

  private Instant createdAt;
  private Instant updatedAt;
  private Instant startedAt;
  private Instant completedAt;

  /**
   * @return a copy safe to hand to other threads
   */
  public ProcessingJob snapshot() {
    return toBuilder()
      .controlPoints(controlPoints == null ? null : new ArrayList<>(controlPoints))
      .zoomLevels(zoomLevels == null ? null : new ArrayList<>(zoomLevels))
      .tileFailures(new ArrayList<>(tileFailures))
      .build();
  }
}
