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
package org.gbif.overlays.common.meta;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factories for {@link OverlayMetastore}s, and a utility to inspect or set the active version of an overlay.
 */
public class Metastores {
  private static final Logger LOG = LoggerFactory.getLogger(Metastores.class);

  public static void main(String[] args) throws Exception {
    if (args.length == 3 || args.length == 4) {
      String zkQuorum = args[0];
      String zkPath = args[1];
      String overlayId = args[2];
      LOG.info("Reading ZK[{}], path[{}], overlay[{}]", zkQuorum, zkPath, overlayId);
      try (OverlayMetastore meta = newZookeeperMetastore(zkQuorum, 1000, zkPath)) {
        LOG.info("Active version {}, owner {}", meta.activeVersion(overlayId), meta.owner(overlayId));

        if (args.length == 4) {
          int version = Integer.parseInt(args[3]);
          LOG.info("Activating version [{}]", version);
          meta.activate(overlayId, version);
          LOG.info("Done.");
        }
      }
    } else {
      LOG.error("Usage (supply a version to activate it): Metastores zkQuorum path overlayId [version]");
    }
  }

  /**
   * Creates a metastore in ZooKeeper, shared between processes.
   * @param zkEnsemble For the ZK ensemble
   * @param retryIntervalMs Number of msecs between retries on ZK issues (1000 is sensible value)
   * @param zkBasePath Under which overlays are stored
   * @return The metastore
   * @throws Exception If the environment is not working
   */
  public static OverlayMetastore newZookeeperMetastore(String zkEnsemble, int retryIntervalMs, String zkBasePath)
    throws Exception {
    return new ZKOverlayMetastore(zkEnsemble, retryIntervalMs, zkBasePath);
  }

  /**
   * @return a metastore held in this process only
   */
  public static OverlayMetastore newInMemoryMetastore() {
    return new InMemoryOverlayMetastore();
  }
}
