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

import org.gbif.overlays.common.error.StorageException;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.OptionalInt;

import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.retry.RetryNTimes;
import org.apache.curator.utils.ZKPaths;
import org.apache.zookeeper.CreateMode;
import org.apache.zookeeper.KeeperException;
import org.apache.zookeeper.data.Stat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.io.Closeables;

/**
 * A metastore in ZooKeeper, shared by every process connected to the ensemble.
 * <p>
 * Each overlay has a node {@code <base>/<overlay>} holding a persistent {@code active} child with the version number
 * and, while a job runs, an ephemeral {@code owner} child with the token.  Ephemeral ownership means a crashed
 * process cannot hold an overlay beyond its session.
 */
class ZKOverlayMetastore implements OverlayMetastore, Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(ZKOverlayMetastore.class);

  private final CuratorFramework client;
  private final String basePath;

  ZKOverlayMetastore(String zkEnsemble, int retryIntervalMs, String basePath) throws Exception {
    this.basePath = basePath;
    client = CuratorFrameworkFactory.newClient(zkEnsemble, new RetryNTimes(3, retryIntervalMs));
    client.start();
    client.createContainers(basePath);
    LOG.info("Overlay metastore using ZooKeeper path {}", basePath);
  }

  private String activePath(String overlayId) {
    return ZKPaths.makePath(basePath, overlayId, "active");
  }

  private String ownerPath(String overlayId) {
    return ZKPaths.makePath(basePath, overlayId, "owner");
  }

  @Override
  public OptionalInt activeVersion(String overlayId) {
    try {
      byte[] data = client.getData().forPath(activePath(overlayId));
      return OptionalInt.of(Integer.parseInt(new String(data, StandardCharsets.UTF_8)));
    } catch (KeeperException.NoNodeException e) {
      return OptionalInt.empty();
    } catch (Exception e) {
      throw new StorageException("Unable to read the active version of overlay " + overlayId, e);
    }
  }

  @Override
  public void activate(String overlayId, int version) {
    byte[] data = String.valueOf(version).getBytes(StandardCharsets.UTF_8);
    String path = activePath(overlayId);
    try {
      try {
        client.setData().forPath(path, data);
      } catch (KeeperException.NoNodeException e) {
        client.create().creatingParentContainersIfNeeded().forPath(path, data);
      }
      LOG.info("Overlay {} now serves version {}", overlayId, version);
    } catch (Exception e) {
      throw new StorageException("Unable to activate version " + version + " of overlay " + overlayId, e);
    }
  }

  @Override
  public boolean acquire(String overlayId, String token) {
    try {
      client.create()
        .creatingParentContainersIfNeeded()
        .withMode(CreateMode.EPHEMERAL)
        .forPath(ownerPath(overlayId), token.getBytes(StandardCharsets.UTF_8));
      return true;
    } catch (KeeperException.NodeExistsException e) {
      return owner(overlayId).map(token::equals).orElse(false);
    } catch (Exception e) {
      throw new StorageException("Unable to take ownership of overlay " + overlayId, e);
    }
  }

  @Override
  public Optional<String> owner(String overlayId) {
    try {
      return Optional.of(new String(client.getData().forPath(ownerPath(overlayId)), StandardCharsets.UTF_8));
    } catch (KeeperException.NoNodeException e) {
      return Optional.empty();
    } catch (Exception e) {
      throw new StorageException("Unable to read the owner of overlay " + overlayId, e);
    }
  }

  @Override
  public boolean release(String overlayId, String token) {
    String path = ownerPath(overlayId);
    try {
      Stat stat = new Stat();
      byte[] data = client.getData().storingStatIn(stat).forPath(path);
      if (!token.equals(new String(data, StandardCharsets.UTF_8))) {
        return false;
      }
      // only deletes the node that was read
      client.delete().withVersion(stat.getVersion()).forPath(path);
      return true;
    } catch (KeeperException.NoNodeException | KeeperException.BadVersionException e) {
      return false;
    } catch (Exception e) {
      throw new StorageException("Unable to release ownership of overlay " + overlayId, e);
    }
  }

  @Override
  public void close() throws IOException {
    Closeables.close(client, true);
  }
}
