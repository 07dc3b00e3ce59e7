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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static us.blanshard.tiling.core.Tile.EL_BOTTOM_LEFT;
import static us.blanshard.tiling.core.Tile.EL_BOTTOM_RIGHT;
import static us.blanshard.tiling.core.Tile.EL_TOP_LEFT;
import static us.blanshard.tiling.core.Tile.EL_TOP_RIGHT;
import static us.blanshard.tiling.core.Tile.FULL_BLOCK;
import static us.blanshard.tiling.core.Tile.NO_TILE;
import static us.blanshard.tiling.core.Tile.OUTER_BOUNDARY;
import static us.blanshard.tiling.csp.TestHelper.RIGHT_SIDE;
import static us.blanshard.tiling.csp.TestHelper.inv;
import static us.blanshard.tiling.csp.TestHelper.model;
import static us.blanshard.tiling.csp.TestHelper.p;
import static us.blanshard.tiling.csp.TestHelper.ringProblem;
import static us.blanshard.tiling.csp.TestHelper.target;

import us.blanshard.tiling.core.Tile;
import us.blanshard.tiling.core.TileSet;

import org.junit.Test;

public class HeuristicsTest {

  @Test public void fewestValuesFirst() {
    Model model = model(ringProblem(inv(1, 1, 2), 4));
    Heuristics heuristics = new Heuristics(new ConstraintSet(model));
    Domains domains = new Domains(model);

    assertEquals(0, heuristics.selectVariable(domains));
    domains.remove(2, TileSet.of(NO_TILE, FULL_BLOCK));
    assertEquals(2, heuristics.selectVariable(domains));
    domains.assign(2, OUTER_BOUNDARY);
    assertEquals(0, heuristics.selectVariable(domains));
  }

  @Test public void degreeBreaksTies() {
    Model model = model(p(RIGHT_SIDE, inv(4, 4, 4), target(2, 1)));
    Heuristics heuristics = new Heuristics(new ConstraintSet(model));
    Domains domains = new Domains(model);

    assertEquals(0, heuristics.degree(domains, 0));
    assertEquals(1, heuristics.degree(domains, 1));
    assertEquals(1, heuristics.selectVariable(domains));

    domains.assign(3, NO_TILE);
    assertEquals(0, heuristics.degree(domains, 1));
    assertEquals(0, heuristics.selectVariable(domains));
  }

  @Test public void allAssigned() {
    Model model = model(ringProblem(inv(0, 0, 0), 16));
    Heuristics heuristics = new Heuristics(new ConstraintSet(model));
    Domains domains = new Domains(model);
    for (int var = 0; var < domains.size(); ++var)
      domains.assign(var, NO_TILE);
    assertEquals(-1, heuristics.selectVariable(domains));
  }

  @Test public void leastConstrainingValueFirst() {
    Model model = model(ringProblem(inv(1, 1, 2), 4));
    Heuristics heuristics = new Heuristics(new ConstraintSet(model));
    Domains domains = new Domains(model);

    // Each scarce block rules out the same block elsewhere; leaving 5 or 12
    // bushes of the ring showing rules out everything.
    assertEquals(3, heuristics.eliminations(domains, 0, FULL_BLOCK));
    assertEquals(3, heuristics.eliminations(domains, 0, OUTER_BOUNDARY));
    assertEquals(21, heuristics.eliminations(domains, 0, NO_TILE));
    assertEquals(21, heuristics.eliminations(domains, 0, EL_TOP_LEFT));
    assertArrayEquals(
        new Tile[] {FULL_BLOCK, OUTER_BOUNDARY, NO_TILE,
                    EL_TOP_LEFT, EL_TOP_RIGHT, EL_BOTTOM_RIGHT, EL_BOTTOM_LEFT},
        heuristics.orderValues(domains, 0));
  }

  @Test public void orderSkipsAssignedNeighbors() {
    Model model = model(ringProblem(inv(1, 1, 2), 4));
    Heuristics heuristics = new Heuristics(new ConstraintSet(model));
    Domains domains = new Domains(model);

    domains.assign(0, FULL_BLOCK);
    // The full blocks left in 2 and 3 are already ruled out by 0.
    assertEquals(2, heuristics.eliminations(domains, 1, NO_TILE));
    assertEquals(4, heuristics.eliminations(domains, 1, OUTER_BOUNDARY));
    assertEquals(14, heuristics.eliminations(domains, 1, FULL_BLOCK));
    assertEquals(NO_TILE, heuristics.orderValues(domains, 1)[0]);
  }
}
