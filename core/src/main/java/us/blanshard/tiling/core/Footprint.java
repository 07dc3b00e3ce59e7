/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.tiling.core;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;

import javax.annotation.concurrent.Immutable;

/**
 * A 4x4-aligned region of a landscape, the place one tile can go.  Rows and
 * columns count footprints, not cells; footprints sort in row-major order.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Footprint implements Comparable<Footprint> {

  /** The footprint row, counting from zero. */
  public final int row;

  /** The footprint column, counting from zero. */
  public final int column;

  public static Footprint of(int row, int column) {
    return new Footprint(row, column);
  }

  private Footprint(int row, int column) {
    checkArgument(row >= 0 && column >= 0, "Negative footprint position (%s, %s)", row, column);
    this.row = row;
    this.column = column;
  }

  /** The landscape row of this footprint's top-left cell. */
  public int anchorRow() {
    return row * Tile.SIZE;
  }

  /** The landscape column of this footprint's top-left cell. */
  public int anchorColumn() {
    return column * Tile.SIZE;
  }

  /**
   * Returns all the footprints of a landscape, in row-major order.  The
   * landscape's dimensions must be multiples of the footprint size.
   */
  public static ImmutableList<Footprint> all(Landscape landscape) {
    checkArgument(landscape.isTileable());
    ImmutableList.Builder<Footprint> builder = ImmutableList.builder();
    for (int r = 0; r < landscape.getHeight() / Tile.SIZE; ++r)
      for (int c = 0; c < landscape.getWidth() / Tile.SIZE; ++c)
        builder.add(of(r, c));
    return builder.build();
  }

  /**
   * Returns the number of bushes of the given color that the given tile would
   * leave showing in this footprint of the given landscape.
   */
  public int visible(Landscape landscape, Tile tile, Color color) {
    int answer = 0;
    for (int r = 0; r < Tile.SIZE; ++r)
      for (int c = 0; c < Tile.SIZE; ++c)
        if (!tile.covers(r, c) && landscape.get(anchorRow() + r, anchorColumn() + c) == color)
          ++answer;
    return answer;
  }

  @Override public int compareTo(Footprint that) {
    if (this.row != that.row) return this.row < that.row ? -1 : 1;
    return Integer.compare(this.column, that.column);
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Footprint)) return false;
    Footprint that = (Footprint) o;
    return this.row == that.row && this.column == that.column;
  }

  @Override public int hashCode() {
    return row * 1031 + column;
  }

  @Override public String toString() {
    return String.format("(%d, %d)", row, column);
  }
}
