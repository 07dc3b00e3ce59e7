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

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import us.blanshard.tiling.core.InvalidProblemException;
import us.blanshard.tiling.core.Problem;
import us.blanshard.tiling.csp.SearchLimits;
import us.blanshard.tiling.csp.Solver;
import us.blanshard.tiling.io.ProblemFormatException;
import us.blanshard.tiling.io.ProblemJson;
import us.blanshard.tiling.io.ProblemParser;
import us.blanshard.tiling.io.SolutionRenderer;

import com.google.common.base.Stopwatch;
import com.google.common.io.Files;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Solves the tile placement problem in a file, and prints the solution.
 * Files whose names end in ".json" are read as json, others as text.
 *
 * @author Luke Blanshard
 */
public class SolveFile {
  private static final Logger logger = Logger.getLogger(SolveFile.class.getName());

  static final int OK = 0;
  static final int USAGE = 1;
  static final int INVALID = 2;
  static final int NO_SOLUTION = 3;
  static final int ABORTED = 4;

  public static void main(String[] args) {
    LoggingSetup.configure();
    System.exit(run(args, System.out, System.err));
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    String fileName = null;
    boolean json = false;
    SearchLimits limits = SearchLimits.NONE;
    for (int i = 0; i < args.length; ++i) {
      if (args[i].equals("--json")) {
        json = true;
      } else if (args[i].equals("--max-nodes") && i + 1 < args.length) {
        try {
          limits = SearchLimits.maxNodes(Long.decode(args[++i]));
        } catch (IllegalArgumentException e) {
          return usage(err);
        }
      } else if (fileName == null && !args[i].startsWith("--")) {
        fileName = args[i];
      } else {
        return usage(err);
      }
    }
    if (fileName == null) return usage(err);

    Problem problem;
    try {
      problem = read(new File(fileName));
    } catch (IOException e) {
      logger.log(Level.FINE, "Unable to read " + fileName, e);
      err.println("Error: can't read input file '" + fileName + "': " + e.getMessage());
      return USAGE;
    } catch (ProblemFormatException e) {
      err.println("Error: " + e.getMessage());
      return USAGE;
    }

    Stopwatch stopwatch = Stopwatch.createStarted();
    Solver.Result result;
    try {
      result = Solver.solve(problem, limits);
    } catch (InvalidProblemException e) {
      err.println("Invalid problem: " + e.getMessage());
      return INVALID;
    }
    stopwatch.stop();
    logger.info("Search took " + stopwatch.elapsed(MILLISECONDS) + " ms, "
        + result.numNodes + " nodes, " + result.numBacktracks + " backtracks");

    switch (result.state) {
      case SUCCESS:
        if (json) {
          out.println(ProblemJson.toJson(result.solution));
        } else {
          out.println("Solution found!");
          out.print(SolutionRenderer.render(problem, result.solution));
        }
        return OK;
      case ABORTED:
        out.println("Search aborted after " + result.numNodes + " nodes");
        return ABORTED;
      default:
        out.println("No solution found");
        return NO_SOLUTION;
    }
  }

  static Problem read(File file) throws IOException, ProblemFormatException {
    String text = Files.asCharSource(file, StandardCharsets.UTF_8).read();
    if (file.getName().endsWith(".json"))
      return ProblemJson.problemFromJson(text);
    return ProblemParser.parse(text);
  }

  private static int usage(PrintStream err) {
    err.println("Usage: SolveFile <input-file> [--json] [--max-nodes <count>]");
    return USAGE;
  }
}
