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

import java.util.AbstractSet;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

/**
 * An immutable set of Tiles, usually used to hold the values still possible
 * for a given footprint.  There is one cached instance per bit pattern.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class TileSet extends AbstractSet<Tile> implements Set<Tile> {

  /** The bits for all tiles. */
  public static final int ALL_BITS = (1 << Tile.COUNT) - 1;

  /** The tiles in this set expressed as a bit set, bit {@code i} for ordinal {@code i}. */
  public final int bits;

  private final int size;

  private TileSet(int bits) {
    this.bits = bits;
    this.size = Integer.bitCount(bits);
  }

  /** Returns the set corresponding to the given bit set. */
  public static TileSet ofBits(int bits) {
    return instances[bits];
  }

  /** Returns the set containing the given tiles. */
  public static TileSet of(Tile... tiles) {
    return copyOf(Arrays.asList(tiles));
  }

  /** Returns the set containing all the given tiles. */
  public static TileSet copyOf(Iterable<Tile> tiles) {
    int bits = 0;
    for (Tile t : tiles)
      bits |= t.bit;
    return instances[bits];
  }

  public boolean contains(Tile tile) {
    return (bits & tile.bit) != 0;
  }

  @Override public boolean contains(Object o) {
    return o instanceof Tile && contains((Tile) o);
  }

  /** Iterates in tile order, lowest ordinal first. */
  @Override public Iterator<Tile> iterator() {
    return new Iterator<Tile>() {
      private int remaining = bits;

      @Override public boolean hasNext() {
        return remaining != 0;
      }

      @Override public Tile next() {
        if (remaining == 0) throw new NoSuchElementException();
        int index = Integer.numberOfTrailingZeros(remaining);
        remaining &= remaining - 1;
        return Tile.ofIndex(index);
      }
    };
  }

  @Override public int size() {
    return size;
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (o instanceof TileSet) return bits == ((TileSet) o).bits;
    return super.equals(o);
  }

  @Override public int hashCode() {
    return super.hashCode();
  }

  private static final TileSet[] instances = new TileSet[ALL_BITS + 1];
  static {
    for (int i = 0; i < instances.length; ++i)
      instances[i] = new TileSet(i);
  }
}
