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

import com.google.common.primitives.Ints;

import java.util.Arrays;
import java.util.Comparator;

import javax.annotation.concurrent.Immutable;

/**
 * Chooses what the search tries next: the variable with the fewest values
 * left (MRV), ties going to the one with the most unassigned neighbors
 * (degree) and then to the earliest in row-major order; and, for that
 * variable, its values ordered least constraining first (LCV).
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Heuristics {

  private final ConstraintSet constraints;

  public Heuristics(ConstraintSet constraints) {
    this.constraints = constraints;
  }

  /** Returns the next variable to assign, or -1 if all are assigned. */
  public int selectVariable(Domains domains) {
    int best = -1;
    int bestSize = Integer.MAX_VALUE;
    int bestDegree = -1;
    for (int var = 0; var < domains.size(); ++var) {
      if (domains.isAssigned(var)) continue;
      int size = domains.domainSize(var);
      if (size > bestSize) continue;
      int degree = degree(domains, var);
      if (size < bestSize || degree > bestDegree) {
        best = var;
        bestSize = size;
        bestDegree = degree;
      }
    }
    return best;
  }

  /** The number of unassigned variables sharing an arc with the given one. */
  public int degree(Domains domains, int var) {
    int answer = 0;
    for (int z : constraints.neighbors(var))
      if (!domains.isAssigned(z)) ++answer;
    return answer;
  }

  /**
   * Returns the values remaining for the given variable, ordered by how many
   * values each would knock out of the unassigned neighbors' domains, fewest
   * first.  Ties keep tile order.
   */
  public Tile[] orderValues(Domains domains, int var) {
    TileSet values = domains.get(var);
    Tile[] answer = values.toArray(new Tile[values.size()]);
    final int[] costs = new int[Tile.COUNT];
    for (Tile value : answer)
      costs[value.ordinal()] = eliminations(domains, var, value);
    Arrays.sort(answer, new Comparator<Tile>() {
      @Override public int compare(Tile a, Tile b) {
        return Ints.compare(costs[a.ordinal()], costs[b.ordinal()]);
      }
    });
    return answer;
  }

  /**
   * Counts the values of unassigned neighbors that the given value would rule
   * out if the given variable took it.
   */
  public int eliminations(Domains domains, int var, Tile value) {
    int answer = 0;
    for (int z : constraints.neighbors(var)) {
      if (domains.isAssigned(z)) continue;
      for (Tile vz : domains.get(z))
        if (!constraints.allows(domains, z, vz, var, value)) ++answer;
    }
    return answer;
  }
}
