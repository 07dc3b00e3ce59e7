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

import us.blanshard.tiling.core.Tile;
import us.blanshard.tiling.core.TileSet;

import java.util.ArrayDeque;
import java.util.BitSet;

import javax.annotation.concurrent.Immutable;

/**
 * The AC-3 arc consistency algorithm over the arcs of a {@link
 * ConstraintSet}.  Every value it removes goes through {@link
 * Domains#remove}, so the pruning is undone along with everything else when
 * the search backs up.
 *
 * <p> Both entry points return false when some domain empties: a
 * contradiction.  The domains are then left partly pruned, and it's up to the
 * caller to undo back to a mark taken beforehand.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class ArcConsistency {

  private final ConstraintSet constraints;

  public ArcConsistency(ConstraintSet constraints) {
    this.constraints = constraints;
  }

  /** Makes every arc consistent, starting from the full set of arcs. */
  public boolean propagate(Domains domains) {
    Worklist worklist = new Worklist(domains.size());
    for (int x = 0; x < domains.size(); ++x)
      for (int y : constraints.neighbors(x))
        worklist.add(x, y);
    return run(domains, worklist);
  }

  /**
   * Restores arc consistency after the given variable has been assigned,
   * starting from the arcs that point at it from its unassigned neighbors.
   */
  public boolean propagateFrom(Domains domains, int var) {
    if (domains.isEmpty(var)) return false;
    Worklist worklist = new Worklist(domains.size());
    for (int z : constraints.neighbors(var))
      if (!domains.isAssigned(z))
        worklist.add(z, var);
    return run(domains, worklist);
  }

  private boolean run(Domains domains, Worklist worklist) {
    while (!worklist.isEmpty()) {
      int arc = worklist.remove();
      int x = arc / domains.size();
      int y = arc % domains.size();
      if (revise(domains, x, y)) {
        if (domains.isEmpty(x)) return false;
        for (int z : constraints.neighbors(x))
          if (z != y)
            worklist.add(z, x);
      }
    }
    return true;
  }

  /**
   * Removes the values of x that no value of y supports.  Returns true if x's
   * domain changed.
   */
  boolean revise(Domains domains, int x, int y) {
    TileSet xs = domains.get(x);
    TileSet ys = domains.get(y);
    int unsupported = 0;
    for (Tile vx : xs) {
      boolean supported = false;
      for (Tile vy : ys) {
        if (constraints.allows(domains, x, vx, y, vy)) {
          supported = true;
          break;
        }
      }
      if (!supported) unsupported |= vx.bit;
    }
    return domains.remove(x, TileSet.ofBits(unsupported));
  }

  /** A FIFO queue of arcs that ignores arcs already queued. */
  private static final class Worklist {
    private final int size;
    private final ArrayDeque<Integer> queue = new ArrayDeque<Integer>();
    private final BitSet queued = new BitSet();

    Worklist(int size) {
      this.size = size;
    }

    void add(int x, int y) {
      int arc = x * size + y;
      if (!queued.get(arc)) {
        queued.set(arc);
        queue.addLast(arc);
      }
    }

    boolean isEmpty() {
      return queue.isEmpty();
    }

    int remove() {
      int arc = queue.removeFirst();
      queued.clear(arc);
      return arc;
    }
  }
}
