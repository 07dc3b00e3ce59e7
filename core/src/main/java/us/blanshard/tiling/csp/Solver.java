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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import us.blanshard.tiling.core.Footprint;
import us.blanshard.tiling.core.InvalidProblemException;
import us.blanshard.tiling.core.Problem;
import us.blanshard.tiling.core.Solution;
import us.blanshard.tiling.core.Tile;

import com.google.common.base.MoreObjects;
import com.google.common.collect.Maps;

import java.util.ArrayDeque;
import java.util.Map;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * A depth-first, worklist-based tile placement solver: backtracking search
 * with arc consistency maintained after every assignment, returning the
 * first solution found.
 *
 * <p> The search keeps its own stack of frames instead of recursing.  Each
 * frame holds a variable, its values in the order to try them, and the undo
 * mark taken before its current tentative assignment; moving on to the next
 * value, or popping the frame, first undoes back to that mark.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Solver {
  private static final Logger logger = Logger.getLogger(Solver.class.getName());

  /**
   * Solves the given problem, returns a summary of the result.
   *
   * @throws InvalidProblemException if the landscape doesn't divide into
   *     footprints or a target is out of reach
   */
  public static Result solve(Problem problem) throws InvalidProblemException {
    return solve(problem, SearchLimits.NONE);
  }

  /**
   * Solves the given problem within the given limits, returns a summary of
   * the result.
   */
  public static Result solve(Problem problem, SearchLimits limits) throws InvalidProblemException {
    Model model = DomainBuilder.build(problem);
    ConstraintSet.checkTargets(model);
    return new Solver(model, limits).run();
  }

  /** The states of a search. */
  public enum State {
    ACTIVE,
    SUCCESS,
    FAILURE,
    ABORTED;
  }

  /**
   * A summary of a solver's work.
   */
  @Immutable
  public static final class Result {
    public final State state;
    @Nullable public final Solution solution;  // Not null when state is SUCCESS
    public final long numNodes;  // Tentative assignments made
    public final long numBacktracks;  // Frames exhausted without a solution

    Result(State state, @Nullable Solution solution, long numNodes, long numBacktracks) {
      checkState(state != State.ACTIVE);
      checkState((state == State.SUCCESS) == (solution != null));
      this.state = state;
      this.solution = solution;
      this.numNodes = numNodes;
      this.numBacktracks = numBacktracks;
    }

    public boolean isSolved() {
      return state == State.SUCCESS;
    }

    @Override public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("state", state)
          .add("numNodes", numNodes)
          .add("numBacktracks", numBacktracks)
          .add("solution", solution)
          .toString();
    }
  }

  private final Model model;
  private final SearchLimits limits;
  private final ConstraintSet constraints;
  private final ArcConsistency arcConsistency;
  private final Heuristics heuristics;
  private final Domains domains;
  private State state = State.ACTIVE;
  private long numNodes;
  private long numBacktracks;

  public Solver(Model model, SearchLimits limits) {
    this.model = checkNotNull(model);
    this.limits = checkNotNull(limits);
    this.constraints = new ConstraintSet(model);
    this.arcConsistency = new ArcConsistency(constraints);
    this.heuristics = new Heuristics(constraints);
    this.domains = new Domains(model);
  }

  public State getState() {
    return state;
  }

  /** Runs the search to completion.  May only be called once. */
  public Result run() {
    checkState(state == State.ACTIVE, "Already run");

    if (!arcConsistency.propagate(domains) || !constraints.isFeasible(domains)) {
      logger.fine("Contradiction before search");
      return finish(State.FAILURE);
    }

    ArrayDeque<Frame> stack = new ArrayDeque<Frame>();
    stack.push(newFrame());
    while (!stack.isEmpty()) {
      if (stack.size() > limits.maxDepth)
        return finish(State.ABORTED);

      Frame frame = stack.peek();
      if (frame.mark >= 0) {
        domains.undoTo(frame.mark);
        frame.mark = -1;
      }
      if (frame.next == frame.values.length) {
        stack.pop();
        ++numBacktracks;
        continue;
      }

      Tile value = frame.values[frame.next++];
      if (!constraints.canAssign(domains, frame.var, value))
        continue;
      if (numNodes >= limits.maxNodes)
        return finish(State.ABORTED);

      ++numNodes;
      frame.mark = domains.mark();
      domains.assign(frame.var, value);
      if (!arcConsistency.propagateFrom(domains, frame.var) || !constraints.isFeasible(domains))
        continue;
      if (domains.isComplete()) {
        if (constraints.isSatisfied(domains))
          return finish(State.SUCCESS);
        continue;
      }
      stack.push(newFrame());
    }
    return finish(State.FAILURE);
  }

  private Frame newFrame() {
    int var = heuristics.selectVariable(domains);
    return new Frame(var, heuristics.orderValues(domains, var));
  }

  private Result finish(State state) {
    this.state = state;
    Solution solution = state == State.SUCCESS ? toSolution() : null;
    logger.fine(state + " after " + numNodes + " nodes and " + numBacktracks + " backtracks");
    return new Result(state, solution, numNodes, numBacktracks);
  }

  private Solution toSolution() {
    Map<Footprint, Tile> placements = Maps.newHashMap();
    for (int var = 0; var < model.size(); ++var)
      placements.put(model.footprint(var), checkNotNull(domains.getAssigned(var)));
    return new Solution(model.getProblem().landscape, placements);
  }

  /** One decision point of the search. */
  private static final class Frame {
    final int var;
    final Tile[] values;
    int next;
    int mark = -1;

    Frame(int var, Tile[] values) {
      this.var = var;
      this.values = values;
    }
  }
}
