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

import org.gbif.overlays.common.projection.Double2D;

import java.util.List;

import static java.lang.Math.PI;
import static java.lang.Math.cos;
import static java.lang.Math.max;
import static java.lang.Math.toRadians;
import static org.gbif.overlays.common.projection.AbstractTileProjection.EARTH_RADIUS;

/**
 * An equirectangular plane in metres, tangent at an origin which is normally the centroid of the control points.
 * Transformations are fitted in this plane so that residuals are measured in metres along both axes, rather than
 * mixing degrees of longitude and latitude.
 * This class is threadsafe.
 */
public final class LocalFrame {
  // keeps the longitude scale invertible at the poles
  private static final double MIN_COS_LATITUDE = 1e-9;

  private final double originLon;
  private final double originLat;
  private final double metresPerDegreeLon;
  private final double metresPerDegreeLat;

  public LocalFrame(double originLon, double originLat) {
    this.originLon = originLon;
    this.originLat = originLat;
    this.metresPerDegreeLat = EARTH_RADIUS * PI / 180;
    this.metresPerDegreeLon = metresPerDegreeLat * max(cos(toRadians(originLat)), MIN_COS_LATITUDE);
  }

  /**
   * @param geographic positions with x as longitude and y as latitude
   * @return a frame with its origin at the centroid of the positions
   */
  public static LocalFrame centredOn(List<Double2D> geographic) {
    double lon = 0, lat = 0;
    for (Double2D g : geographic) {
      lon += g.getX();
      lat += g.getY();
    }
    return new LocalFrame(lon / geographic.size(), lat / geographic.size());
  }

  /**
   * @return metres east and north of the origin
   */
  public Double2D toLocal(double lon, double lat) {
    return new Double2D((lon - originLon) * metresPerDegreeLon, (lat - originLat) * metresPerDegreeLat);
  }

  /**
   * @return the longitude (x) and latitude (y) of the planar position
   */
  public Double2D toGeographic(double east, double north) {
    return new Double2D(originLon + east / metresPerDegreeLon, originLat + north / metresPerDegreeLat);
  }

  public double getOriginLon() {
    return originLon;
  }

  public double getOriginLat() {
    return originLat;
  }
}
