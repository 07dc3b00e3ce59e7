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

import com.google.common.base.Joiner;
import com.google.common.collect.Maps;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import javax.annotation.concurrent.Immutable;

/**
 * The number of tiles of each {@link Shape} available to a problem.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Inventory {

  private final int[] counts;

  private Inventory(int[] counts) {
    this.counts = counts;
  }

  public static Inventory of(int fullBlocks, int outerBoundaries, int elShapes) {
    return new Inventory(check(new int[] {fullBlocks, outerBoundaries, elShapes}));
  }

  /** Makes an inventory from a map; missing shapes get zero. */
  public static Inventory of(Map<Shape, Integer> counts) {
    int[] array = new int[Shape.COUNT];
    for (Map.Entry<Shape, Integer> e : counts.entrySet())
      array[e.getKey().ordinal()] = e.getValue();
    return new Inventory(check(array));
  }

  private static int[] check(int[] counts) {
    for (int i = 0; i < counts.length; ++i)
      checkArgument(counts[i] >= 0, "Negative count for %s", Shape.values()[i]);
    return counts;
  }

  /** Returns the number of tiles available of the given shape. */
  public int count(Shape shape) {
    return counts[shape.ordinal()];
  }

  /** Returns the total number of tiles, of all shapes. */
  public int total() {
    int answer = 0;
    for (int count : counts) answer += count;
    return answer;
  }

  /** Returns the counts as an ordered map. */
  public Map<Shape, Integer> asMap() {
    Map<Shape, Integer> answer = Maps.newEnumMap(Shape.class);
    for (Shape shape : Shape.values())
      answer.put(shape, count(shape));
    return Collections.unmodifiableMap(answer);
  }

  @Override public boolean equals(Object o) {
    return o instanceof Inventory && Arrays.equals(counts, ((Inventory) o).counts);
  }

  @Override public int hashCode() {
    return Arrays.hashCode(counts);
  }

  @Override public String toString() {
    return "{" + Joiner.on(", ").withKeyValueSeparator("=").join(asMap()) + "}";
  }
}
