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

import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import javax.annotation.Nullable;

/**
 * The things that can go in a {@link Footprint}: nothing, or one of the tile
 * shapes in a particular orientation.  An EL tile covers one full edge row and
 * one full edge column of its footprint; the four EL values are named for the
 * corner where those two sides meet.
 *
 * <p> Each tile has a cover mask over the 16 cells of its footprint, bit
 * {@code 4 * row + column} standing for the cell at that offset from the
 * footprint's anchor.
 *
 * @author Luke Blanshard
 */
public enum Tile {
  NO_TILE(null, "--", 0),
  FULL_BLOCK(Shape.FULL_BLOCK, "FB", 0xFFFF),
  OUTER_BOUNDARY(Shape.OUTER_BOUNDARY, "OB", row(0) | row(3) | column(0) | column(3)),
  EL_TOP_LEFT(Shape.EL_SHAPE, "TL", row(0) | column(0)),
  EL_TOP_RIGHT(Shape.EL_SHAPE, "TR", row(0) | column(3)),
  EL_BOTTOM_RIGHT(Shape.EL_SHAPE, "BR", row(3) | column(3)),
  EL_BOTTOM_LEFT(Shape.EL_SHAPE, "BL", row(3) | column(0));

  /** The number of tiles, counting {@link #NO_TILE}. */
  public static final int COUNT = 7;

  /** The width and height of a footprint. */
  public static final int SIZE = 4;

  /** The shape this tile uses up, or null for {@link #NO_TILE}. */
  @Nullable public final Shape shape;

  /** A short code for text output. */
  public final String code;

  /** The cells covered, as a bit set. */
  public final int coverMask;

  /** The bit corresponding to this tile, 1 &lt;&lt; ordinal. */
  public final int bit;

  private Tile(@Nullable Shape shape, String code, int coverMask) {
    this.shape = shape;
    this.code = code;
    this.coverMask = coverMask;
    this.bit = 1 << ordinal();
  }

  public static Tile ofIndex(int index) {
    return instances[index];
  }

  /** Tells whether this tile covers the cell at the given footprint offset. */
  public boolean covers(int rowOffset, int columnOffset) {
    return (coverMask & (1 << (rowOffset * SIZE + columnOffset))) != 0;
  }

  /** Tells whether this tile uses up one of the given shape. */
  public boolean uses(Shape shape) {
    return this.shape == shape;
  }

  /** The tiles of the given shape, in order. */
  public static List<Tile> ofShape(Shape shape) {
    return BY_SHAPE.get(shape.ordinal());
  }

  public TileSet asSet() {
    return TileSet.ofBits(bit);
  }

  /** All the tiles. */
  public static final List<Tile> ALL;

  private static int row(int row) {
    return 0xF << (row * SIZE);
  }

  private static int column(int column) {
    return 0x1111 << column;
  }

  private static final Tile[] instances = values();
  private static final ImmutableList<ImmutableList<Tile>> BY_SHAPE = ImmutableList.of(
      ImmutableList.of(FULL_BLOCK),
      ImmutableList.of(OUTER_BOUNDARY),
      ImmutableList.of(EL_TOP_LEFT, EL_TOP_RIGHT, EL_BOTTOM_RIGHT, EL_BOTTOM_LEFT));
  static {
    ALL = Collections.unmodifiableList(Arrays.asList(instances));
  }
}
