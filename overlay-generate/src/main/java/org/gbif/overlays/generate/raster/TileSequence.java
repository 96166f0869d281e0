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

import org.gbif.overlays.common.model.Tile;
import org.gbif.overlays.common.model.TileRange;
import org.gbif.overlays.common.model.TransformModel;
import org.gbif.overlays.common.projection.Tiles;
import org.gbif.overlays.common.transform.GeoTransformation;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.TreeSet;

import com.google.common.collect.ImmutableList;

/**
 * The finite, lazily rendered sequence of tiles covering a model's bounds at each zoom level, lowest zoom first and
 * row by row within a level.  Tiles are only rendered as the iterator reaches them.
 * <p>
 * A tile which fails to render throws {@link TileRenderException} from {@code next()}; the iterator has already moved
 * past it, so iteration may continue with its siblings.
 */
public class TileSequence implements Iterable<Tile> {
  private final Rasterizer rasterizer;
  private final TransformModel model;
  private final GeoTransformation transformation;
  private final SourcePage page;
  private final List<Integer> zoomLevels;
  private final TileCursor start;

  TileSequence(Rasterizer rasterizer, TransformModel model, GeoTransformation transformation, SourcePage page,
               List<Integer> zoomLevels, TileCursor start) {
    for (int z : zoomLevels) {
      Tiles.checkZoom(z);
    }
    this.rasterizer = rasterizer;
    this.model = model;
    this.transformation = transformation;
    this.page = page;
    this.zoomLevels = ImmutableList.copyOf(new TreeSet<>(zoomLevels));
    this.start = start;
  }

  public List<Integer> getZoomLevels() {
    return zoomLevels;
  }

  @Override
  public TileIterator iterator() {
    return new TileIterator();
  }

  /**
   * Iterates the sequence, exposing the position reached.
   */
  public class TileIterator implements Iterator<Tile> {
    private int level = -1;
    private TileRange range;
    private long index;

    private TileIterator() {
      while (++level < zoomLevels.size() && zoomLevels.get(level) < start.getZoom()) {
        // skip levels before the start
      }
      if (level < zoomLevels.size()) {
        range = rasterizer.tileRange(model, zoomLevels.get(level));
        index = zoomLevels.get(level) == start.getZoom() ? start.getIndex() : 0;
      }
    }

    @Override
    public boolean hasNext() {
      while (range != null && index >= range.size()) {
        level++;
        range = level < zoomLevels.size() ? rasterizer.tileRange(model, zoomLevels.get(level)) : null;
        index = 0;
      }
      return range != null;
    }

    @Override
    public Tile next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return rasterizer.render(model, transformation, page, range.address(index++));
    }

    /**
     * @return the position of the next tile, from which a new sequence would resume
     */
    public TileCursor cursor() {
      return hasNext() ? new TileCursor(range.getZoom(), index) : null;
    }
  }
}
