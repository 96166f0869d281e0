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

import org.gbif.overlays.common.meta.Metastores;
import org.gbif.overlays.common.meta.OverlayMetastore;
import org.gbif.overlays.common.projection.Tiles;
import org.gbif.overlays.common.transform.TransformSolver;
import org.gbif.overlays.tilestore.TileCacheConfiguration;

import java.io.IOException;
import java.net.URL;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Resources;

import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;
import lombok.extern.slf4j.Slf4j;

@Data
@Builder
@Jacksonized
@Slf4j
public class OverlayConfiguration {

  @Builder.Default
  private int tileSize = 256;
  @Builder.Default
  private List<Integer> defaultZoomLevels = ImmutableList.of(0, 1, 2, 3, 4, 5, 6);
  @Builder.Default
  private int maxZoom = Tiles.MAX_ZOOM;
  @Builder.Default
  private int polynomialOrder = TransformSolver.DEFAULT_POLYNOMIAL_ORDER;
  @Builder.Default
  private int tpsMaxPoints = TransformSolver.DEFAULT_TPS_MAX_POINTS;
  private double tpsSmoothing;
  @Builder.Default
  private double failedTileThreshold = 0.05;
  @Builder.Default
  private int workerThreads = Runtime.getRuntime().availableProcessors();
  // per attempt, 0 for none
  @Builder.Default
  private long jobTimeoutMs = 600_000;
  @Builder.Default
  private int keepLatestVersions = 1;
  // 0 disables the scheduled sweep
  private long sweepIntervalMs;
  @Builder.Default
  private RetryConfiguration retry = RetryConfiguration.builder().build();
  @Builder.Default
  private TileCacheConfiguration cache = TileCacheConfiguration.builder().build();
  // absent for a single process deployment
  private ZookeeperConfiguration zookeeper;

  @Data
  @Builder
  @Jacksonized
  public static class RetryConfiguration {
    @Builder.Default
    private int maxAttempts = 3;
    @Builder.Default
    private int initialBackoffMs = 1000;
    @Builder.Default
    private int maxBackoffMs = 30_000;
  }

  @Data
  @Builder
  @Jacksonized
  public static class ZookeeperConfiguration {
    private String ensemble;
    private String basePath;
    @Builder.Default
    private int retryIntervalMs = 1000;
  }

  /** E.g. pass in the filename relative to the classpath, e.g. "overlays.yml" */
  public static OverlayConfiguration build(String filename) throws IOException {
    URL conf = Resources.getResource(filename);
    log.info("Reading from {}", conf);
    return new ObjectMapper(new YAMLFactory()).readValue(conf, OverlayConfiguration.class);
  }

  /**
   * @return the ZooKeeper metastore when an ensemble is configured, otherwise one local to this process
   */
  public OverlayMetastore newMetastore() throws Exception {
    if (zookeeper == null || zookeeper.getEnsemble() == null) {
      log.info("No ZooKeeper ensemble configured, using an in-memory metastore");
      return Metastores.newInMemoryMetastore();
    }
    return Metastores.newZookeeperMetastore(zookeeper.getEnsemble(), zookeeper.getRetryIntervalMs(),
                                            zookeeper.getBasePath());
  }
}
