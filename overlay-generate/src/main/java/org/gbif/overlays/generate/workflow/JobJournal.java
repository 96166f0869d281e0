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

import org.gbif.overlays.common.error.StorageException;
import org.gbif.overlays.common.model.ProcessingJob;
import org.gbif.overlays.tilestore.BlobStore;
import org.gbif.overlays.tilestore.StoreMapper;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Snapshots of processing jobs kept as JSON at {@code jobs/<overlay>/<jobId>.json}, written on every transition so
 * another process can inspect a job or resume it after a crash.
 */
@Slf4j
public class JobJournal {
  private final BlobStore blobs;
  private final ObjectMapper mapper = StoreMapper.create();

  public JobJournal(BlobStore blobs) {
    this.blobs = blobs;
  }

  private static String prefix(String overlayId) {
    return "jobs/" + overlayId + "/";
  }

  private static String key(String overlayId, String jobId) {
    return prefix(overlayId) + jobId + ".json";
  }

  /**
   * Writes the snapshot.  A failure is logged rather than raised: the job itself carries on, and only an interrupted
   * job would resume from an older snapshot.
   */
  public void record(ProcessingJob job) {
    try {
      blobs.put(key(job.getOverlayId(), job.getId()), mapper.writeValueAsBytes(job));
    } catch (IOException | StorageException e) {
      log.warn("Unable to journal job {} of overlay {} at stage {}", job.getId(), job.getOverlayId(), job.getStage(),
               e);
    }
  }

  public Optional<ProcessingJob> get(String overlayId, String jobId) {
    return blobs.get(key(overlayId, jobId)).map(blob -> {
      try {
        return mapper.readValue(blob.getData(), ProcessingJob.class);
      } catch (IOException e) {
        throw new StorageException("Corrupt journal of job " + jobId + " of overlay " + overlayId, e);
      }
    });
  }

  /**
   * @return all journaled jobs of the overlay, oldest first
   */
  public List<ProcessingJob> jobs(String overlayId) {
    String prefix = prefix(overlayId);
    return blobs.list(prefix).stream()
      .filter(key -> key.endsWith(".json"))
      .map(key -> key.substring(prefix.length(), key.length() - ".json".length()))
      .map(jobId -> get(overlayId, jobId).orElse(null))
      .filter(Objects::nonNull)
      .sorted(Comparator.comparing(ProcessingJob::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
      .collect(Collectors.toList());
  }

  /**
   * @return the most recently created job of the overlay
   */
  public Optional<ProcessingJob> latest(String overlayId) {
    List<ProcessingJob> jobs = jobs(overlayId);
    return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(jobs.size() - 1));
  }
}
