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
package org.gbif.overlays.generate.raster;

import org.gbif.overlays.common.error.SourceUnavailableException;
import org.gbif.overlays.tilestore.Blob;
import org.gbif.overlays.tilestore.BlobStore;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads source pages stored as encoded images (PNG, JPEG, GIF or BMP) in object storage, the source reference being
 * the storage key.
 */
public class BlobSourcePageReader implements SourcePageReader {
  private static final Logger LOG = LoggerFactory.getLogger(BlobSourcePageReader.class);

  private final BlobStore blobs;

  public BlobSourcePageReader(BlobStore blobs) {
    this.blobs = blobs;
  }

  @Override
  public SourcePage read(String sourceRef) {
    Blob blob = blobs.get(sourceRef)
      .orElseThrow(() -> new SourceUnavailableException("No source page stored at " + sourceRef));
    BufferedImage image;
    try {
      image = ImageIO.read(new ByteArrayInputStream(blob.getData()));
    } catch (IOException | IllegalArgumentException e) {
      throw new SourceUnavailableException("Source page " + sourceRef + " is corrupt", e);
    }
    if (image == null) {
      throw new SourceUnavailableException("Source page " + sourceRef + " is not a readable image");
    }
    LOG.debug("Read source page {} of {}x{} pixels", sourceRef, image.getWidth(), image.getHeight());
    return SourcePage.of(image);
  }
}
