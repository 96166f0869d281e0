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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A control point store held in memory.  This class is threadsafe.
 */
public class InMemoryControlPointStore implements ControlPointStore {
  private static final Logger LOG = LoggerFactory.getLogger(InMemoryControlPointStore.class);

  private final Map<String, PageSize> pages = new HashMap<>();
  private final Map<String, LinkedHashMap<String, ControlPoint>> points = new HashMap<>();
  // point id to overlay id
  private final Map<String, String> owners = new HashMap<>();
  private final AtomicLong sequence = new AtomicLong();

  @Override
  public synchronized void registerPage(String overlayId, int width, int height) {
    Preconditions.checkNotNull(overlayId, "An overlay is required");
    if (width <= 0 || height <= 0) {
      throw new InvalidInputException("Page dimensions must be positive: " + width + "x" + height);
    }
    pages.put(overlayId, new PageSize(width, height));
  }

  @Override
  public synchronized Optional<PageSize> page(String overlayId) {
    return Optional.ofNullable(pages.get(overlayId));
  }

  @Override
  public synchronized String add(String overlayId, ControlPoint point) {
    ControlPoint stored = withId(check(overlayId, point, 0));
    points.computeIfAbsent(overlayId, k -> new LinkedHashMap<>()).put(stored.getId(), stored);
    owners.put(stored.getId(), overlayId);
    return stored.getId();
  }

  @Override
  public synchronized List<ControlPoint> list(String overlayId) {
    LinkedHashMap<String, ControlPoint> overlayPoints = points.get(overlayId);
    return overlayPoints == null ? ImmutableList.of() : ImmutableList.copyOf(overlayPoints.values());
  }

  @Override
  public synchronized boolean remove(String pointId) {
    String overlayId = owners.remove(pointId);
    if (overlayId == null) {
      return false;
    }
    points.get(overlayId).remove(pointId);
    return true;
  }

  @Override
  public synchronized List<ControlPoint> replaceAll(String overlayId, List<ControlPoint> replacements) {
    if (replacements == null) {
      throw new InvalidInputException("Control points are required");
    }
    List<ControlPoint> checked = new ArrayList<>(replacements.size());
    for (int i = 0; i < replacements.size(); i++) {
      checked.add(check(overlayId, replacements.get(i), i));
    }

    LinkedHashMap<String, ControlPoint> previous = points.remove(overlayId);
    if (previous != null) {
      previous.keySet().forEach(owners::remove);
    }
    LinkedHashMap<String, ControlPoint> stored = new LinkedHashMap<>();
    for (ControlPoint p : checked) {
      ControlPoint withId = withId(p);
      stored.put(withId.getId(), withId);
      owners.put(withId.getId(), overlayId);
    }
    points.put(overlayId, stored);
    LOG.debug("Replaced control points of overlay {} with {} points", overlayId, stored.size());
    return ImmutableList.copyOf(stored.values());
  }

  private ControlPoint withId(ControlPoint point) {
    return point.toBuilder().id("cp-" + sequence.incrementAndGet()).build();
  }

  private ControlPoint check(String overlayId, ControlPoint point, int index) {
    PageSize page = pages.get(overlayId);
    if (page == null) {
      throw new InvalidInputException("No source page is registered for overlay " + overlayId);
    }
    if (point == null) {
      throw new InvalidInputException("Control point " + index + " is missing");
    }
    if (!Double.isFinite(point.getPixelX()) || !Double.isFinite(point.getPixelY())
        || !page.contains(point.getPixelX(), point.getPixelY())) {
      throw new InvalidInputException(String.format("Control point %d pixel (%s, %s) lies outside the %dx%d page",
                                                    index, point.getPixelX(), point.getPixelY(),
                                                    page.getWidth(), page.getHeight()));
    }
    if (!Double.isFinite(point.getLat()) || point.getLat() < -90 || point.getLat() > 90) {
      throw new InvalidInputException("Control point " + index + " latitude out of range: " + point.getLat());
    }
    if (!Double.isFinite(point.getLon()) || point.getLon() < -180 || point.getLon() > 180) {
      throw new InvalidInputException("Control point " + index + " longitude out of range: " + point.getLon());
    }
    return point;
  }
}
