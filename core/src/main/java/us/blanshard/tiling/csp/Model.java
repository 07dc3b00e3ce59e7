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
package us.blanshard.tiling.csp;

import us.blanshard.tiling.core.Color;
import us.blanshard.tiling.core.Footprint;
import us.blanshard.tiling.core.Problem;
import us.blanshard.tiling.core.Shape;
import us.blanshard.tiling.core.Tile;
import us.blanshard.tiling.core.TileSet;

import com.google.common.collect.ImmutableList;

import javax.annotation.concurrent.Immutable;

/**
 * A problem compiled into CSP form: one variable per footprint, numbered in
 * row-major order, each with its initial domain, plus a table of how many
 * bushes of each color every value of every variable leaves visible.
 * Produced by {@link DomainBuilder}.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Model {

  private final Problem problem;
  private final ImmutableList<Footprint> footprints;
  private final int[] initialDomains;
  private final int[] visible;
  private final int[] inventory;
  private final int[] targets;
  private final int[] constrainedColors;

  Model(Problem problem, ImmutableList<Footprint> footprints, int[] initialDomains, int[] visible) {
    this.problem = problem;
    this.footprints = footprints;
    this.initialDomains = initialDomains;
    this.visible = visible;
    this.inventory = new int[Shape.COUNT];
    for (Shape shape : Shape.values())
      inventory[shape.ordinal()] = problem.inventory.count(shape);
    this.targets = new int[Color.COUNT];
    int count = 0;
    for (Color color : Color.ALL) {
      targets[color.index] = problem.target.get(color);
      if (targets[color.index] >= 0) ++count;
    }
    this.constrainedColors = new int[count];
    count = 0;
    for (Color color : problem.target.colors())
      constrainedColors[count++] = color.index;
  }

  public Problem getProblem() {
    return problem;
  }

  /** The number of variables. */
  public int size() {
    return footprints.size();
  }

  public Footprint footprint(int var) {
    return footprints.get(var);
  }

  public ImmutableList<Footprint> footprints() {
    return footprints;
  }

  public TileSet initialDomain(int var) {
    return TileSet.ofBits(initialDomains[var]);
  }

  /**
   * Returns the number of bushes of the color with the given index that the
   * given tile leaves visible in the given variable's footprint.
   */
  public int visible(int var, Tile tile, int colorIndex) {
    return visible[index(var, tile.ordinal(), colorIndex)];
  }

  /** Like {@link #visible(int, Tile, int)}, with the tile given by ordinal. */
  public int visible(int var, int tileIndex, int colorIndex) {
    return visible[index(var, tileIndex, colorIndex)];
  }

  /** Returns the number of tiles available of the shape with the given ordinal. */
  public int inventory(int shapeIndex) {
    return inventory[shapeIndex];
  }

  /**
   * Returns the target for the color with the given index, or -1 if that
   * color is unconstrained.
   */
  public int target(int colorIndex) {
    return targets[colorIndex];
  }

  /** The indices of the colors with targets, ascending. */
  public int[] constrainedColors() {
    return constrainedColors.clone();
  }

  int constrainedColorCount() {
    return constrainedColors.length;
  }

  int constrainedColor(int i) {
    return constrainedColors[i];
  }

  static int index(int var, int tileIndex, int colorIndex) {
    return (var * Tile.COUNT + tileIndex) * Color.COUNT + colorIndex;
  }
}
