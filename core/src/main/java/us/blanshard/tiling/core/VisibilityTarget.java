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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSortedMap;

import java.util.Map;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

/**
 * The number of bushes of each color that must remain visible.  Colors
 * without an entry are unconstrained.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class VisibilityTarget {

  private final ImmutableSortedMap<Color, Integer> counts;

  private VisibilityTarget(ImmutableSortedMap<Color, Integer> counts) {
    this.counts = counts;
  }

  public static VisibilityTarget of(Map<Color, Integer> counts) {
    for (Map.Entry<Color, Integer> e : counts.entrySet())
      checkArgument(checkNotNull(e.getValue()) >= 0, "Negative target for color %s", e.getKey());
    return new VisibilityTarget(ImmutableSortedMap.copyOf(counts));
  }

  /** A target for a single color. */
  public static VisibilityTarget of(Color color, int count) {
    return of(ImmutableSortedMap.of(color, count));
  }

  /** Tells whether the given color has a target. */
  public boolean constrains(Color color) {
    return counts.containsKey(color);
  }

  /**
   * Returns the target count for the given color, or -1 if the color is
   * unconstrained.
   */
  public int get(Color color) {
    Integer count = counts.get(color);
    return count == null ? -1 : count;
  }

  /** The colors that have targets, in order. */
  public Set<Color> colors() {
    return counts.keySet();
  }

  public Map<Color, Integer> asMap() {
    return counts;
  }

  @Override public boolean equals(Object o) {
    return o instanceof VisibilityTarget && counts.equals(((VisibilityTarget) o).counts);
  }

  @Override public int hashCode() {
    return counts.hashCode();
  }

  @Override public String toString() {
    return counts.toString();
  }
}
