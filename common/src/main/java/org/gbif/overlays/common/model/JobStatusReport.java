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

import javax.annotation.Nullable;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * What an external presentation layer polls for an overlay.
 */
@Data
@Builder
@AllArgsConstructor
public class JobStatusReport {
  private final String overlayId;
  private final String jobId;
  private final JobStage stage;
  private final JobStatus status;
  private final int progressPct;
  @Nullable
  private final JobError error;
  private final int transformVersion;
  private final int failedTiles;
  private final int queuedCommits;
}
