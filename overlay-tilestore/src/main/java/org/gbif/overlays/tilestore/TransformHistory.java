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
package org.gbif.overlays.tilestore;

import org.gbif.overlays.common.error.StorageException;
import org.gbif.overlays.common.model.TransformModel;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Every transform model solved for an overlay, retained as JSON at {@code transforms/<overlay>/v<version>.json} for
 * audit and rollback.  Versions are numbered from 1 and never reused.
 * <p>
 * Callers must hold the overlay's ownership token while saving, which makes version numbering race free.
 */
public class TransformHistory {
  private static final Logger LOG = LoggerFactory.getLogger(TransformHistory.class);

  private final BlobStore blobs;
  private final ObjectMapper mapper = StoreMapper.create();

  public TransformHistory(BlobStore blobs) {
    this.blobs = blobs;
  }

  private static String prefix(String overlayId) {
    return "transforms/" + overlayId + "/v";
  }

  private static String key(String overlayId, int version) {
    return prefix(overlayId) + version + ".json";
  }

  /**
   * Persists an unversioned model as the overlay's next version.
   *
   * @return the model with its version assigned
   */
  public synchronized TransformModel save(TransformModel model) {
    Preconditions.checkArgument(model.getVersion() == 0, "Model is already version %s", model.getVersion());
    SortedSet<Integer> existing = versions(model.getOverlayId());
    int version = existing.isEmpty() ? 1 : existing.last() + 1;
    TransformModel versioned = model.toBuilder().version(version).build();
    try {
      blobs.put(key(model.getOverlayId(), version), mapper.writeValueAsBytes(versioned));
    } catch (IOException e) {
      throw new StorageException("Unable to serialise transform of overlay " + model.getOverlayId(), e);
    }
    LOG.info("Saved {} transform of overlay {} as version {}, RMSE {} m", model.getKind(), model.getOverlayId(),
             version, model.getRmse());
    return versioned;
  }

  public Optional<TransformModel> get(String overlayId, int version) {
    return blobs.get(key(overlayId, version)).map(blob -> {
      try {
        return mapper.readValue(blob.getData(), TransformModel.class);
      } catch (IOException e) {
        throw new StorageException("Corrupt transform " + version + " of overlay " + overlayId, e);
      }
    });
  }

  /**
   * @return the retained versions in ascending order
   */
  public SortedSet<Integer> versions(String overlayId) {
    String prefix = prefix(overlayId);
    SortedSet<Integer> versions = new TreeSet<>();
    for (String key : blobs.list(prefix)) {
      if (key.endsWith(".json")) {
        String number = key.substring(prefix.length(), key.length() - ".json".length());
        if (!number.isEmpty() && number.chars().allMatch(Character::isDigit)) {
          versions.add(Integer.parseInt(number));
        }
      }
    }
    return versions;
  }

  /**
   * @return all retained models, oldest first
   */
  public List<TransformModel> history(String overlayId) {
    ImmutableList.Builder<TransformModel> models = ImmutableList.builder();
    for (int version : versions(overlayId)) {
      get(overlayId, version).ifPresent(models::add);
    }
    return models.build();
  }
}
