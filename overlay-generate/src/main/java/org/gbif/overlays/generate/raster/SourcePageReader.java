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
import org.gbif.overlays.common.error.StorageException;

/**
 * Access to the uploaded source pages, which are managed elsewhere.
 */
public interface SourcePageReader {

  /**
   * @throws SourceUnavailableException if the page is missing or cannot be decoded
   * @throws StorageException if storage failed transiently
   */
  SourcePage read(String sourceRef);
}
