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
import us.blanshard.tiling.core.InvalidProblemException;
import us.blanshard.tiling.core.Shape;
import us.blanshard.tiling.core.Tile;

import java.util.Arrays;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * The constraints of a {@link Model}, as predicates over a {@link Domains}.
 *
 * <p> Inventory and visibility are global counting constraints.  For AC-3
 * they are decomposed into binary arcs between every pair of variables that
 * could together overrun a shared limit: both able to take a scarce shape
 * (one with fewer tiles than variables that could use it), or both able to
 * show a scarce color (one whose target is below what could be left
 * visible).  The pairwise relation charges the two values against the limits
 * left over by the rest of the current assignment.
 *
 * <p> Partial states are also checked against global bounds, and complete
 * ones against the exact targets.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class ConstraintSet {

  private final Model model;
  private final int[][] neighbors;
  private final int arcCount;

  public ConstraintSet(Model model) {
    this.model = model;
    int n = model.size();

    boolean[] scarceShape = new boolean[Shape.COUNT];
    for (Shape shape : Shape.values()) {
      int takers = 0;
      for (int var = 0; var < n; ++var)
        if (canTake(model, var, shape)) ++takers;
      scarceShape[shape.ordinal()] = model.inventory(shape.ordinal()) < takers;
    }
    boolean[] scarceColor = new boolean[Color.COUNT];
    for (int c : model.constrainedColors()) {
      int max = 0;
      for (int var = 0; var < n; ++var)
        max += maxVisible(model, var, c);
      scarceColor[c] = model.target(c) < max;
    }

    int[][] neighbors = new int[n][];
    int arcs = 0;
    int[] scratch = new int[n];
    for (int x = 0; x < n; ++x) {
      int count = 0;
      for (int y = 0; y < n; ++y) {
        if (x != y && coupled(model, x, y, scarceShape, scarceColor))
          scratch[count++] = y;
      }
      neighbors[x] = Arrays.copyOf(scratch, count);
      arcs += count;
    }
    this.neighbors = neighbors;
    this.arcCount = arcs;
  }

  public Model getModel() {
    return model;
  }

  /**
   * Makes sure the targets are within reach before any search: no target may
   * exceed the bushes of its color, nor fall below what must stay visible
   * whatever the placement.
   */
  public static void checkTargets(Model model) throws InvalidProblemException {
    for (int c : model.constrainedColors()) {
      Color color = Color.ofIndex(c);
      int target = model.target(c);
      int bushes = model.getProblem().landscape.count(color);
      if (target > bushes) {
        throw new InvalidProblemException(String.format(
            "Target of %d visible bushes of color %s exceeds the %d there are",
            target, color, bushes));
      }
      int min = 0;
      for (int var = 0; var < model.size(); ++var) {
        int least = Integer.MAX_VALUE;
        for (Tile tile : model.initialDomain(var))
          least = Math.min(least, model.visible(var, tile, c));
        min += least;
      }
      if (target < min) {
        throw new InvalidProblemException(String.format(
            "Target of %d visible bushes of color %s is below the %d that must show",
            target, color, min));
      }
    }
  }

  /** The variables sharing an arc with the given one, ascending. */
  public int[] neighbors(int var) {
    return neighbors[var];
  }

  /** The total number of arcs, counting each direction. */
  public int arcCount() {
    return arcCount;
  }

  public boolean isCoupled(int x, int y) {
    return Arrays.binarySearch(neighbors[x], y) >= 0;
  }

  /**
   * The binary relation between two variables: tells whether {@code x = vx}
   * and {@code y = vy} fit together within the limits left after the other
   * assigned variables.
   */
  public boolean allows(Domains domains, int x, Tile vx, int y, Tile vy) {
    Tile ax = domains.getAssigned(x);
    Tile ay = domains.getAssigned(y);
    for (int s = 0; s < Shape.COUNT; ++s) {
      int count = domains.used(s) - uses(ax, s) - uses(ay, s) + uses(vx, s) + uses(vy, s);
      if (count > model.inventory(s)) return false;
    }
    for (int i = 0; i < model.constrainedColorCount(); ++i) {
      int c = model.constrainedColor(i);
      int count = domains.assignedVisible(c)
          - (ax == null ? 0 : model.visible(x, ax, c))
          - (ay == null ? 0 : model.visible(y, ay, c))
          + model.visible(x, vx, c) + model.visible(y, vy, c);
      if (count > model.target(c)) return false;
    }
    return true;
  }

  /**
   * Tells whether the given unassigned variable could take the given tile
   * without overrunning the inventory or any target, given the current
   * assignment.
   */
  public boolean canAssign(Domains domains, int var, Tile tile) {
    if (tile.shape != null && domains.used(tile.shape) >= model.inventory(tile.shape.ordinal()))
      return false;
    for (int i = 0; i < model.constrainedColorCount(); ++i) {
      int c = model.constrainedColor(i);
      if (domains.assignedVisible(c) + model.visible(var, tile, c) > model.target(c))
        return false;
    }
    return true;
  }

  /**
   * Tells whether the current domains could still produce a solution as far
   * as the global counts can tell: every target between the fewest and the
   * most bushes the remaining values could leave visible, and no shape forced
   * on more variables than there are tiles.
   */
  public boolean isFeasible(Domains domains) {
    for (int s = 0; s < Shape.COUNT; ++s)
      if (domains.forced(s) > model.inventory(s)) return false;
    for (int i = 0; i < model.constrainedColorCount(); ++i) {
      int c = model.constrainedColor(i);
      if (domains.minVisible(c) > model.target(c) || domains.maxVisible(c) < model.target(c))
        return false;
    }
    return true;
  }

  /**
   * Tells whether the domains hold a complete assignment that meets every
   * target exactly and stays within the inventory.
   */
  public boolean isSatisfied(Domains domains) {
    if (!domains.isComplete()) return false;
    for (int s = 0; s < Shape.COUNT; ++s)
      if (domains.used(s) > model.inventory(s)) return false;
    for (int i = 0; i < model.constrainedColorCount(); ++i) {
      int c = model.constrainedColor(i);
      if (domains.assignedVisible(c) != model.target(c)) return false;
    }
    return true;
  }

  private static int uses(@Nullable Tile tile, int shapeIndex) {
    return tile != null && tile.shape != null && tile.shape.ordinal() == shapeIndex ? 1 : 0;
  }

  private static boolean canTake(Model model, int var, Shape shape) {
    for (Tile tile : model.initialDomain(var))
      if (tile.shape == shape) return true;
    return false;
  }

  private static int maxVisible(Model model, int var, int colorIndex) {
    int max = 0;
    for (Tile tile : model.initialDomain(var))
      max = Math.max(max, model.visible(var, tile, colorIndex));
    return max;
  }

  private static boolean showsColor(Model model, int var, int colorIndex) {
    return maxVisible(model, var, colorIndex) > 0;
  }

  private static boolean coupled(
      Model model, int x, int y, boolean[] scarceShape, boolean[] scarceColor) {
    for (Shape shape : Shape.values())
      if (scarceShape[shape.ordinal()] && canTake(model, x, shape) && canTake(model, y, shape))
        return true;
    for (int c : model.constrainedColors())
      if (scarceColor[c] && showsColor(model, x, c) && showsColor(model, y, c))
        return true;
    return false;
  }
}
