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
package org.gbif.overlays.generate.workflow;

import org.gbif.overlays.common.model.ProcessingJob;

/**
 * Notified after every change of a job's stage, for example to push status to a presentation layer.
 */
@FunctionalInterface
public interface JobListener {

  /**
   * Called on the job's driving thread with a snapshot of the job.  Exceptions are logged and ignored.
   */
  void onTransition(ProcessingJob job);
}
