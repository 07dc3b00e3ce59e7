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
package us.blanshard.tiling.io;

import static com.google.common.base.Preconditions.checkArgument;

import us.blanshard.tiling.core.Color;
import us.blanshard.tiling.core.Footprint;
import us.blanshard.tiling.core.Landscape;
import us.blanshard.tiling.core.Problem;
import us.blanshard.tiling.core.Shape;
import us.blanshard.tiling.core.Solution;
import us.blanshard.tiling.core.Tile;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import java.util.List;

/**
 * Renders solutions as text: the landscape with covered cells blacked out, a
 * grid of tile codes, the tiles used, and the bushes left showing.
 *
 * @author Luke Blanshard
 */
public final class SolutionRenderer {
  private static final Joiner SPACE_JOINER = Joiner.on(' ');

  /** Stands for a cell under a tile. */
  public static final char COVERED = '#';

  /** Stands for an uncovered cell with no bush. */
  public static final char EMPTY = '.';

  private SolutionRenderer() {}

  /** Renders everything about the solution to the given problem. */
  public static String render(Problem problem, Solution solution) {
    checkArgument(problem.landscape.equals(solution.landscape), "Solution is for another landscape");
    StringBuilder sb = new StringBuilder();
    sb.append("Tile placement:\n");
    sb.append(renderCells(solution));
    sb.append("\nTiles (").append(legend()).append("):\n");
    sb.append(renderCodes(solution));
    sb.append("\nTile usage:\n");
    for (Shape shape : Shape.values()) {
      sb.append(String.format("%s: %d/%d used\n",
          shape.getDisplayName(), solution.used(shape), problem.inventory.count(shape)));
    }
    sb.append("\nVisible bushes:\n");
    for (Color color : Color.ALL) {
      sb.append(String.format("Color %s: %d", color, solution.visible(color)));
      if (problem.target.constrains(color))
        sb.append(String.format(" (target %d)", problem.target.get(color)));
      sb.append('\n');
    }
    return sb.toString();
  }

  /**
   * Renders the landscape cell by cell: covered cells as {@link #COVERED},
   * visible bushes as their color numbers, and the rest as {@link #EMPTY}.
   * Footprints are separated by spaces.
   */
  public static String renderCells(Solution solution) {
    Landscape landscape = solution.landscape;
    StringBuilder sb = new StringBuilder();
    for (int r = 0; r < landscape.getHeight(); ++r) {
      for (int c = 0; c < landscape.getWidth(); ++c) {
        if (c > 0 && c % Tile.SIZE == 0) sb.append(' ');
        if (solution.isCovered(r, c)) {
          sb.append(COVERED);
        } else {
          Color color = landscape.get(r, c);
          sb.append(color == null ? EMPTY : Character.forDigit(color.number, 10));
        }
      }
      sb.append('\n');
    }
    return sb.toString();
  }

  /** Renders one tile code per footprint. */
  public static String renderCodes(Solution solution) {
    StringBuilder sb = new StringBuilder();
    List<String> codes = Lists.newArrayList();
    int row = 0;
    for (Footprint footprint : solution.getPlacements().keySet()) {
      if (footprint.row != row) {
        sb.append(SPACE_JOINER.join(codes)).append('\n');
        codes.clear();
        row = footprint.row;
      }
      codes.add(solution.get(footprint).code);
    }
    sb.append(SPACE_JOINER.join(codes)).append('\n');
    return sb.toString();
  }

  private static String legend() {
    List<String> entries = Lists.newArrayList();
    for (Tile tile : Tile.ALL)
      entries.add(tile.code + " = " + tile.name());
    return Joiner.on(", ").join(entries);
  }
}
