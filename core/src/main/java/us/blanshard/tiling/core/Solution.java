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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;

import java.util.Map;

import javax.annotation.concurrent.Immutable;

/**
 * A complete placement of tiles on a landscape: every footprint mapped to a
 * tile, possibly {@link Tile#NO_TILE}.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Solution {
  public final Landscape landscape;
  private final ImmutableSortedMap<Footprint, Tile> placements;

  public Solution(Landscape landscape, Map<Footprint, Tile> placements) {
    this.landscape = checkNotNull(landscape);
    this.placements = ImmutableSortedMap.copyOf(placements);
    checkArgument(this.placements.keySet().equals(ImmutableSet.copyOf(Footprint.all(landscape))),
                  "Placements must cover exactly the landscape's footprints");
  }

  /** The tile for each footprint, in row-major order. */
  public ImmutableSortedMap<Footprint, Tile> getPlacements() {
    return placements;
  }

  public Tile get(Footprint footprint) {
    return checkNotNull(placements.get(footprint), "No such footprint: %s", footprint);
  }

  /** Returns the number of bushes of the given color left visible. */
  public int visible(Color color) {
    int answer = 0;
    for (Map.Entry<Footprint, Tile> e : placements.entrySet())
      answer += e.getKey().visible(landscape, e.getValue(), color);
    return answer;
  }

  /** Returns the number of tiles of the given shape used. */
  public int used(Shape shape) {
    int answer = 0;
    for (Tile tile : placements.values())
      if (tile.uses(shape)) ++answer;
    return answer;
  }

  /** Tells whether this placement meets all the given problem's constraints. */
  public boolean satisfies(Problem problem) {
    if (!problem.landscape.equals(landscape)) return false;
    for (Shape shape : Shape.values())
      if (used(shape) > problem.inventory.count(shape)) return false;
    for (Color color : problem.target.colors())
      if (visible(color) != problem.target.get(color)) return false;
    return true;
  }

  /** Tells whether the given cell is covered by a tile. */
  public boolean isCovered(int row, int column) {
    Footprint footprint = Footprint.of(row / Tile.SIZE, column / Tile.SIZE);
    return get(footprint).covers(row % Tile.SIZE, column % Tile.SIZE);
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Solution)) return false;
    Solution that = (Solution) o;
    return this.landscape.equals(that.landscape) && this.placements.equals(that.placements);
  }

  @Override public int hashCode() {
    return placements.hashCode();
  }

  @Override public String toString() {
    return placements.toString();
  }
}
