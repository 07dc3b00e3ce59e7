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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static us.blanshard.tiling.csp.TestHelper.inv;
import static us.blanshard.tiling.csp.TestHelper.model;
import static us.blanshard.tiling.csp.TestHelper.p;
import static us.blanshard.tiling.csp.TestHelper.ringProblem;
import static us.blanshard.tiling.csp.TestHelper.target;

import us.blanshard.tiling.core.Footprint;
import us.blanshard.tiling.core.InvalidProblemException;
import us.blanshard.tiling.core.Landscape;
import us.blanshard.tiling.core.Problem;
import us.blanshard.tiling.core.Tile;

import org.junit.Test;

public class SolverTest {

  @Test public void solves() throws Exception {
    Problem problem = ringProblem(inv(1, 1, 2), 4);
    Solver.Result result = Solver.solve(problem);

    assertEquals(Solver.State.SUCCESS, result.state);
    assertTrue(result.isSolved());
    assertTrue(result.solution.satisfies(problem));
    assertEquals(4, result.solution.visible(TestHelper.c(1)));
    assertTrue(result.numNodes >= 4);
    // The first solution in search order blocks out the ring and leaves the rest bare.
    assertEquals(Tile.FULL_BLOCK, result.solution.get(Footprint.of(0, 0)));
    assertEquals(Tile.NO_TILE, result.solution.get(Footprint.of(0, 1)));
  }

  @Test public void singleFootprint() throws Exception {
    Landscape ring = Landscape.fromRows(new int[][] {
        {1, 1, 1, 1},
        {1, 0, 0, 1},
        {1, 0, 0, 1},
        {1, 1, 1, 1},
    });
    Solver.Result result = Solver.solve(p(ring, inv(0, 1, 0), target(1, 0)));
    assertEquals(Solver.State.SUCCESS, result.state);
    assertEquals(Tile.OUTER_BOUNDARY, result.solution.get(Footprint.of(0, 0)));
    assertEquals(0, result.numBacktracks);
  }

  @Test public void noTilesLeavesEverythingShowing() throws Exception {
    Solver.Result result = Solver.solve(ringProblem(inv(0, 0, 0), 16));
    assertEquals(Solver.State.SUCCESS, result.state);
    for (Tile tile : result.solution.getPlacements().values())
      assertEquals(Tile.NO_TILE, tile);
  }

  @Test public void unconstrainedColorsAreIgnored() throws Exception {
    // Color 3 has no bushes at all, so any placement within stock will do.
    Problem problem = p(TestHelper.RING_AND_CENTER, inv(1, 0, 0), target(3, 0));
    Solver.Result result = Solver.solve(problem);
    assertEquals(Solver.State.SUCCESS, result.state);
    assertTrue(result.solution.satisfies(problem));
  }

  @Test(expected = InvalidProblemException.class) public void targetTooHigh() throws Exception {
    Solver.solve(ringProblem(inv(1, 1, 2), 100));
  }

  @Test(expected = InvalidProblemException.class) public void targetTooLow() throws Exception {
    Solver.solve(ringProblem(inv(0, 0, 0), 3));
  }

  @Test(expected = InvalidProblemException.class) public void untileable() throws Exception {
    Solver.solve(p(Landscape.builder(6, 8).build(), inv(1, 1, 1), target(1, 0)));
  }

  @Test public void noSolution() throws Exception {
    // Within the static bounds, but the single EL tile can only reach 9 or 16.
    Solver.Result result = Solver.solve(ringProblem(inv(0, 0, 1), 10));
    assertEquals(Solver.State.FAILURE, result.state);
    assertNull(result.solution);
  }

  @Test public void unreachableTarget() throws Exception {
    // Without EL tiles every placement leaves a multiple of 4 showing.
    Solver.Result result = Solver.solve(ringProblem(inv(1, 1, 0), 1));
    assertEquals(Solver.State.FAILURE, result.state);
    assertNull(result.solution);
  }

  @Test public void nodeLimit() throws Exception {
    Solver.Result result = Solver.solve(ringProblem(inv(1, 1, 2), 4), SearchLimits.maxNodes(2));
    assertEquals(Solver.State.ABORTED, result.state);
    assertEquals(2, result.numNodes);
    assertNull(result.solution);
  }

  @Test public void depthLimit() throws Exception {
    Solver.Result result = Solver.solve(
        ringProblem(inv(1, 1, 2), 4), SearchLimits.NONE.withMaxDepth(2));
    assertEquals(Solver.State.ABORTED, result.state);
  }

  @Test public void generousLimits() throws Exception {
    Solver.Result result = Solver.solve(
        ringProblem(inv(1, 1, 2), 4), SearchLimits.maxNodes(1000).withMaxDepth(4));
    assertEquals(Solver.State.SUCCESS, result.state);
  }

  @Test(expected = IllegalStateException.class) public void runsOnce() {
    Solver solver = new Solver(model(ringProblem(inv(1, 1, 2), 4)), SearchLimits.NONE);
    solver.run();
    assertEquals(Solver.State.SUCCESS, solver.getState());
    solver.run();
  }
}
