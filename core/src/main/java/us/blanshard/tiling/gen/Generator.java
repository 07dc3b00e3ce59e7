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
package us.blanshard.tiling.gen;

import static com.google.common.base.Preconditions.checkArgument;

import us.blanshard.tiling.core.Color;
import us.blanshard.tiling.core.Footprint;
import us.blanshard.tiling.core.Inventory;
import us.blanshard.tiling.core.Landscape;
import us.blanshard.tiling.core.Problem;
import us.blanshard.tiling.core.Shape;
import us.blanshard.tiling.core.Solution;
import us.blanshard.tiling.core.Tile;
import us.blanshard.tiling.core.VisibilityTarget;

import com.google.common.collect.Maps;

import java.util.Map;
import java.util.Random;

/**
 * Generates random problems that are known to have a solution: a random
 * landscape, a random tile planted in every footprint, and the inventory and
 * targets read back off that planted placement.  The inventory gets a little
 * random slack on top, so the planted placement need not be the only answer.
 *
 * @author Luke Blanshard
 */
public final class Generator {

  /** A generated problem, with the placement it was built around. */
  public static final class Planted {
    public final Problem problem;
    public final Solution solution;

    Planted(Problem problem, Solution solution) {
      this.problem = problem;
      this.solution = solution;
    }
  }

  private final int footprintRows;
  private final int footprintColumns;
  private final double density;
  private final int maxSlack;

  /**
   * @param footprintRows the landscape height, in footprints
   * @param footprintColumns the landscape width, in footprints
   * @param density the chance of any given cell having a bush
   * @param maxSlack the most spare tiles to add to each shape's stock
   */
  public Generator(int footprintRows, int footprintColumns, double density, int maxSlack) {
    checkArgument(footprintRows > 0 && footprintColumns > 0, "Empty landscape");
    checkArgument(density >= 0 && density <= 1, "Density %s out of range", density);
    checkArgument(maxSlack >= 0, "Negative slack");
    this.footprintRows = footprintRows;
    this.footprintColumns = footprintColumns;
    this.density = density;
    this.maxSlack = maxSlack;
  }

  public Planted generate(Random random) {
    Landscape landscape = randomLandscape(random);

    Map<Footprint, Tile> placements = Maps.newHashMap();
    for (Footprint footprint : Footprint.all(landscape))
      placements.put(footprint, Tile.ofIndex(random.nextInt(Tile.COUNT)));
    Solution solution = new Solution(landscape, placements);

    Map<Shape, Integer> stock = Maps.newEnumMap(Shape.class);
    for (Shape shape : Shape.values())
      stock.put(shape, solution.used(shape) + random.nextInt(maxSlack + 1));

    Map<Color, Integer> targets = Maps.newHashMap();
    for (Color color : Color.ALL)
      targets.put(color, solution.visible(color));

    Problem problem = new Problem(landscape, Inventory.of(stock), VisibilityTarget.of(targets));
    return new Planted(problem, solution);
  }

  private Landscape randomLandscape(Random random) {
    Landscape.Builder builder = Landscape.builder(
        footprintRows * Tile.SIZE, footprintColumns * Tile.SIZE);
    for (int r = 0; r < footprintRows * Tile.SIZE; ++r)
      for (int c = 0; c < footprintColumns * Tile.SIZE; ++c)
        if (random.nextDouble() < density)
          builder.set(r, c, Color.ofIndex(random.nextInt(Color.COUNT)));
    return builder.build();
  }
}
