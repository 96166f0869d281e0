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

import org.gbif.overlays.common.model.Bounds;
import org.gbif.overlays.common.model.ControlPoint;
import org.gbif.overlays.common.model.TransformKind;
import org.gbif.overlays.common.model.TransformModel;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TransformHistoryTest {

  private static TransformModel model(String overlayId, double rmse) {
    return TransformModel.builder()
      .overlayId(overlayId)
      .kind(TransformKind.AFFINE)
      .coefficients(new double[] {10, 50, 0.5, 0.001, 0.0002, 3, 0.0001, -0.0008})
      .rmse(rmse)
      .bounds(new Bounds(50.1, 49.36, 11.16, 10))
      .createdAt(Instant.parse("2024-03-01T10:15:30.123456Z"))
      .controlPoints(Arrays.asList(ControlPoint.of(0, 0, 10, 50), new ControlPoint("cp-2", 1000, 0, 11, 50.1)))
      .pageWidth(1000)
      .pageHeight(800)
      .build();
  }

  @Test
  public void testVersionsAreSequential() {
    TransformHistory history = new TransformHistory(new InMemoryBlobStore());
    assertTrue(history.versions("map").isEmpty());

    assertEquals(1, history.save(model("map", 1.5)).getVersion());
    assertEquals(2, history.save(model("map", 0.5)).getVersion());
    assertEquals(1, history.save(model("other", 0.5)).getVersion());

    assertEquals(Arrays.asList(1, 2), new ArrayList<>(history.versions("map")));
    assertEquals(2, history.history("map").size());
    assertEquals(1.5, history.history("map").get(0).getRmse(), 0);
  }

  @Test
  public void testModelSurvivesStorage() {
    InMemoryBlobStore blobs = new InMemoryBlobStore();
    TransformModel saved = new TransformHistory(blobs).save(model("map", 0.25));

    // as read by another process
    TransformModel read = new TransformHistory(blobs).get("map", 1).get();
    assertEquals(saved, read);
    assertFalse(new TransformHistory(blobs).get("map", 2).isPresent());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testVersionedModelIsNotResaved() {
    TransformHistory history = new TransformHistory(new InMemoryBlobStore());
    history.save(history.save(model("map", 1)));
  }
}
