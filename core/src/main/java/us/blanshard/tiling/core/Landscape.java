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
import static com.google.common.base.Preconditions.checkElementIndex;
import static us.blanshard.tiling.core.Color.color;

import java.util.Arrays;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * An immutable bush landscape: a rectangle of cells, each holding a bush of
 * some {@link Color} or nothing.  The nested Builder class is a mutable
 * version of the landscape.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Landscape {

  private final int height;
  private final int width;
  private final byte[] cells;

  private Landscape(int height, int width, byte[] cells) {
    this.height = height;
    this.width = width;
    this.cells = cells;
  }

  /** Returns a new Builder for an empty landscape of the given size. */
  public static Builder builder(int height, int width) {
    checkArgument(height > 0 && width > 0, "Landscape must not be empty: %s x %s", height, width);
    return new Builder(new Landscape(height, width, new byte[height * width]));
  }

  /**
   * Makes a landscape from rows of color numbers, zero meaning no bush.  All
   * rows must have the same length.
   */
  public static Landscape fromRows(int[][] rows) {
    checkArgument(rows.length > 0, "No rows");
    Builder builder = builder(rows.length, rows[0].length);
    for (int r = 0; r < rows.length; ++r) {
      checkArgument(rows[r].length == rows[0].length, "Row %s has length %s, expected %s",
                    r, rows[r].length, rows[0].length);
      for (int c = 0; c < rows[r].length; ++c) {
        int number = rows[r][c];
        checkArgument(number == 0 || Color.isColor(number),
                      "Invalid color %s at (%s, %s)", number, r, c);
        builder.set(r, c, color(number));
      }
    }
    return builder.build();
  }

  /** Returns a mutable version of this landscape. */
  public Builder asBuilder() {
    return new Builder(this);
  }

  @NotThreadSafe
  public static final class Builder {
    private Landscape landscape;
    private boolean built;

    private Builder(Landscape landscape) {
      this.landscape = landscape;
      this.built = true;
    }

    private Landscape landscape() {
      if (built) {
        Landscape copy = new Landscape(landscape.height, landscape.width, landscape.cells.clone());
        this.landscape = copy;
        this.built = false;
      }
      return this.landscape;
    }

    /** Returns an immutable snapshot of this landscape. */
    public Landscape build() {
      built = true;
      return landscape;
    }

    /** Puts a bush of the given color, or no bush, at the given cell. */
    public Builder set(int row, int column, @Nullable Color color) {
      landscape().cells[landscape.index(row, column)] = (byte) Color.number(color);
      return this;
    }

    @Nullable public Color get(int row, int column) {
      return landscape.get(row, column);
    }
  }

  public int getHeight() {
    return height;
  }

  public int getWidth() {
    return width;
  }

  /** Returns the color of the bush at the given cell, or null if there is none. */
  @Nullable public Color get(int row, int column) {
    return color(cells[index(row, column)]);
  }

  /** Returns the number of bushes of the given color. */
  public int count(Color color) {
    int answer = 0;
    for (byte cell : cells)
      if (cell == color.number) ++answer;
    return answer;
  }

  /** Returns the total number of bushes. */
  public int countBushes() {
    int answer = 0;
    for (byte cell : cells)
      if (cell != 0) ++answer;
    return answer;
  }

  /** Tells whether both dimensions are whole numbers of footprints. */
  public boolean isTileable() {
    return height % Tile.SIZE == 0 && width % Tile.SIZE == 0;
  }

  private int index(int row, int column) {
    checkElementIndex(row, height, "row");
    checkElementIndex(column, width, "column");
    return row * width + column;
  }

  @Override public boolean equals(Object object) {
    if (this == object) return true;
    if (!(object instanceof Landscape)) return false;
    Landscape that = (Landscape) object;
    return this.height == that.height && this.width == that.width
        && Arrays.equals(this.cells, that.cells);
  }

  @Override public int hashCode() {
    return Arrays.hashCode(cells) * 31 + width;
  }

  /** Renders the landscape as rows of color digits. */
  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    for (int r = 0; r < height; ++r) {
      for (int c = 0; c < width; ++c) {
        if (c > 0) sb.append(' ');
        sb.append(cells[r * width + c]);
      }
      sb.append('\n');
    }
    return sb.toString();
  }
}
