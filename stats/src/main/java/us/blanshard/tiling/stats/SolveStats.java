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
package us.blanshard.tiling.stats;

import static java.util.concurrent.TimeUnit.MICROSECONDS;

import us.blanshard.tiling.core.InvalidProblemException;
import us.blanshard.tiling.csp.Solver;
import us.blanshard.tiling.gen.Generator;

import com.google.common.base.Stopwatch;

import java.io.PrintStream;
import java.util.Random;

import javax.annotation.Nullable;

/**
 * Generates random solvable tile placement problems of a few sizes, and spits
 * out statistics about how hard the solver works on them.
 *
 * @author Luke Blanshard
 */
public class SolveStats {

  /** Landscape sizes to try, in footprints: rows, columns. */
  private static final int[][] SIZES = {{2, 2}, {2, 3}, {3, 3}};

  public static void main(String[] args) {
    LoggingSetup.configure();
    if (args.length < 1 || args.length > 2) exitWithUsage();
    int count;
    long seed;
    try {
      count = Integer.decode(args[0]);
      seed = args.length > 1 ? Long.decode(args[1]) : System.currentTimeMillis();
    } catch (NumberFormatException e) {
      exitWithUsage();
      return;  // Convince the compiler.
    }

    System.out.printf("Solving %d problems per size from seed %#x%n", count, seed);

    // Start with a few rounds with a fixed seed and no printing, to get all the
    // machinery warmed up.
    generate(3, 0, SIZES, null);

    // Then do the real work.
    generate(count, seed, SIZES, System.out);
  }

  private static void exitWithUsage() {
    System.err.println("Usage: SolveStats <count> [<seed>]");
    System.exit(1);
  }

  /**
   * Solves {@code count} planted problems of each of the given sizes, printing
   * a row per problem to {@code out} when it isn't null.
   */
  static void generate(int count, long seed, int[][] sizes, @Nullable PrintStream out) {
    if (out != null) out.println("Size\tSeed\tState\tNodes\tBacktracks\tMicros");
    Random random = new Random(seed);
    while (count-- > 0) {
      for (int[] size : sizes) {
        long genSeed = random.nextLong();
        Generator generator = new Generator(size[0], size[1], 0.5, 1);
        Generator.Planted planted = generator.generate(new Random(genSeed));

        Stopwatch stopwatch = Stopwatch.createStarted();
        Solver.Result result;
        try {
          result = Solver.solve(planted.problem);
        } catch (InvalidProblemException e) {
          // Planted problems always have a solution.
          throw new IllegalStateException(e);
        }
        stopwatch.stop();

        if (out != null) {
          out.printf("%dx%d\t%#x\t%s\t%d\t%d\t%d%n", size[0], size[1], genSeed, result.state,
                     result.numNodes, result.numBacktracks, stopwatch.elapsed(MICROSECONDS));
        }
      }
    }
  }
}
