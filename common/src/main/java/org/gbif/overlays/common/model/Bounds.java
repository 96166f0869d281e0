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

import org.gbif.overlays.common.projection.Double2D;

import java.io.Serializable;
import java.util.Collection;

import com.google.common.base.Preconditions;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

/**
 * A geographic envelope in WGS84 degrees.  Envelopes crossing the antimeridian are not supported, so west is never
 * greater than east.
 */
@Data
@Builder
@Jacksonized
@AllArgsConstructor
public class Bounds implements Serializable {
  private static final long serialVersionUID = -2104617711230567817L;

  private final double north;
  private final double south;
  private final double east;
  private final double west;

  /**
   * @param positions with x as longitude and y as latitude
   * @return the smallest envelope containing all positions
   */
  public static Bounds envelope(Collection<Double2D> positions) {
    Preconditions.checkArgument(!positions.isEmpty(), "An envelope needs at least one position");
    double north = -Double.MAX_VALUE, south = Double.MAX_VALUE, east = -Double.MAX_VALUE, west = Double.MAX_VALUE;
    for (Double2D p : positions) {
      north = Math.max(north, p.getY());
      south = Math.min(south, p.getY());
      east = Math.max(east, p.getX());
      west = Math.min(west, p.getX());
    }
    return new Bounds(north, south, east, west);
  }

  /**
   * True if the two envelopes share an area, touching edges excluded.
   */
  public boolean intersects(Bounds other) {
    return west < other.east && east > other.west && south < other.north && north > other.south;
  }
}
