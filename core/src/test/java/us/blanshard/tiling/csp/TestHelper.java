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
import us.blanshard.tiling.core.Inventory;
import us.blanshard.tiling.core.Landscape;
import us.blanshard.tiling.core.Problem;
import us.blanshard.tiling.core.Solution;
import us.blanshard.tiling.core.Tile;
import us.blanshard.tiling.core.VisibilityTarget;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import java.util.List;
import java.util.Map;

public class TestHelper {

  /**
   * An 8x8 landscape with 16 bushes of color 1: a ring around the border of
   * footprint (0, 0), and the inner 2x2 block of footprint (0, 1).
   */
  public static final Landscape RING_AND_CENTER = Landscape.fromRows(new int[][] {
      {1, 1, 1, 1, 0, 0, 0, 0},
      {1, 0, 0, 1, 0, 1, 1, 0},
      {1, 0, 0, 1, 0, 1, 1, 0},
      {1, 1, 1, 1, 0, 0, 0, 0},
      {0, 0, 0, 0, 0, 0, 0, 0},
      {0, 0, 0, 0, 0, 0, 0, 0},
      {0, 0, 0, 0, 0, 0, 0, 0},
      {0, 0, 0, 0, 0, 0, 0, 0},
  });

  /**
   * An 8x8 landscape with a single bush of color 2 in each of footprints
   * (0, 1) and (1, 1).
   */
  public static final Landscape RIGHT_SIDE = Landscape.builder(8, 8)
      .set(0, 4, Color.of(2))
      .set(4, 4, Color.of(2))
      .build();

  public static Color c(int number) { return Color.of(number); }
  public static Inventory inv(int full, int outer, int el) { return Inventory.of(full, outer, el); }
  public static VisibilityTarget target(int color, int count) { return VisibilityTarget.of(c(color), count); }
  public static Problem p(Landscape l, Inventory i, VisibilityTarget t) { return new Problem(l, i, t); }
  public static Problem ringProblem(Inventory i, int count) { return p(RING_AND_CENTER, i, target(1, count)); }

  public static Model model(Problem problem) {
    try {
      return DomainBuilder.build(problem);
    } catch (Exception e) {
      throw new AssertionError(e);
    }
  }

  /** Finds every solution by trying every combination of initial domain values. */
  public static List<Solution> bruteForce(Model model) {
    List<Solution> answer = Lists.newArrayList();
    Tile[] current = new Tile[model.size()];
    enumerate(model, 0, current, answer);
    return answer;
  }

  private static void enumerate(Model model, int var, Tile[] current, List<Solution> answer) {
    if (var == model.size()) {
      Map<Footprint, Tile> placements = Maps.newHashMap();
      for (int i = 0; i < current.length; ++i)
        placements.put(model.footprint(i), current[i]);
      Solution solution = new Solution(model.getProblem().landscape, placements);
      if (solution.satisfies(model.getProblem()))
        answer.add(solution);
      return;
    }
    for (Tile tile : model.initialDomain(var)) {
      current[var] = tile;
      enumerate(model, var + 1, current, answer);
    }
  }
}
