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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static us.blanshard.tiling.csp.TestHelper.inv;
import static us.blanshard.tiling.csp.TestHelper.p;
import static us.blanshard.tiling.csp.TestHelper.ringProblem;
import static us.blanshard.tiling.csp.TestHelper.target;

import us.blanshard.tiling.core.Footprint;
import us.blanshard.tiling.core.Inventory;
import us.blanshard.tiling.core.Landscape;
import us.blanshard.tiling.core.Problem;
import us.blanshard.tiling.core.Solution;
import us.blanshard.tiling.core.Tile;

import com.google.common.collect.ImmutableMap;

import org.junit.Test;

public class ProblemJsonTest {

  @Test public void problemToJson() {
    Problem problem = p(Landscape.fromRows(new int[][] {{1, 0}, {0, 3}}), inv(1, 0, 2), target(1, 1));
    assertEquals(
        "{\"landscape\":[[1,0],[0,3]],"
            + "\"tiles\":{\"FULL_BLOCK\":1,\"OUTER_BOUNDARY\":0,\"EL_SHAPE\":2},"
            + "\"targets\":{\"1\":1}}",
        ProblemJson.toJson(problem));
  }

  @Test public void problemFromJson() throws Exception {
    Problem problem = ringProblem(inv(1, 1, 2), 4);
    assertEquals(problem, ProblemJson.problemFromJson(ProblemJson.toJson(problem)));

    Problem sparse = ProblemJson.problemFromJson(
        "{\"landscape\":[[2,2]],\"tiles\":{\"EL_SHAPE\":1},\"extra\":[1,2]}");
    assertEquals(Inventory.of(0, 0, 1), sparse.inventory);
    assertTrue(sparse.target.colors().isEmpty());
  }

  @Test public void solutionJson() throws Exception {
    Landscape landscape = Landscape.builder(4, 8).build();
    Solution solution = new Solution(landscape, ImmutableMap.of(
        Footprint.of(0, 0), Tile.EL_BOTTOM_LEFT,
        Footprint.of(0, 1), Tile.NO_TILE));
    String json = ProblemJson.toJson(solution);
    assertTrue(json, json.contains("{\"row\":0,\"column\":0,\"tile\":\"EL_BOTTOM_LEFT\"}"));
    assertEquals(solution, ProblemJson.solutionFromJson(json));
  }

  @Test public void badProblems() {
    assertProblemError("");
    assertProblemError("[1, 2]");
    assertProblemError("{\"tiles\":{}}");
    assertProblemError("{\"landscape\":[[0,9]]}");
    assertProblemError("{\"landscape\":[[0,1],[1]]}");
    assertProblemError("{\"landscape\":[[0]],\"tiles\":{\"SQUARE\":1}}");
    assertProblemError("{\"landscape\":[[0]],\"tiles\":{\"FULL_BLOCK\":-1}}");
    assertProblemError("{\"landscape\":[[0]],\"targets\":{\"5\":1}}");
    assertProblemError("{\"landscape\":[[1.5,0,0,0]]}");
    assertProblemError("{\"landscape\":[[99999999999]]}");
    assertProblemError("{\"landscape\":[[0]],\"tiles\":{\"EL_SHAPE\":2.5}}");
  }

  @Test public void badSolutions() {
    assertSolutionError("{\"landscape\":[[0,0,0,0]]}");
    assertSolutionError("{\"landscape\":[[0,0,0,0],[0,0,0,0],[0,0,0,0],[0,0,0,0]],"
        + "\"placements\":[{\"row\":0,\"column\":0,\"tile\":\"SQUARE\"}]}");
    assertSolutionError("{\"landscape\":[[0,0,0,0],[0,0,0,0],[0,0,0,0],[0,0,0,0]],"
        + "\"placements\":[{\"row\":0,\"tile\":\"NO_TILE\"}]}");
    assertSolutionError("{\"landscape\":[[0,0,0,0],[0,0,0,0],[0,0,0,0],[0,0,0,0]],"
        + "\"placements\":[{\"row\":0.5,\"column\":0,\"tile\":\"NO_TILE\"}]}");
  }

  private static void assertProblemError(String json) {
    try {
      ProblemJson.problemFromJson(json);
      fail("Parsed " + json);
    } catch (ProblemFormatException e) {
      // expected
    }
  }

  private static void assertSolutionError(String json) {
    try {
      ProblemJson.solutionFromJson(json);
      fail("Parsed " + json);
    } catch (ProblemFormatException e) {
      // expected
    }
  }
}
