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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkPositionIndex;
import static com.google.common.base.Preconditions.checkState;

import us.blanshard.tiling.core.Color;
import us.blanshard.tiling.core.Shape;
import us.blanshard.tiling.core.Tile;
import us.blanshard.tiling.core.TileSet;

import java.util.Arrays;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * The mutable state of a search: the remaining domain of every variable, the
 * variables assigned so far, and running totals derived from both.  Every
 * change goes on an undo log, so the state at any {@link #mark} can be
 * restored exactly with {@link #undoTo}.
 *
 * <p> The running totals are: tiles of each shape used by assigned
 * variables; bushes of each color left visible by assigned variables; for
 * each color, the sums over all variables of the fewest and the most bushes
 * any remaining value would leave visible; and for each shape, the number of
 * variables whose remaining values all use that shape.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Domains {

  private static final int[] SHAPE_BITS = new int[Shape.COUNT];
  static {
    for (Shape shape : Shape.values())
      SHAPE_BITS[shape.ordinal()] = TileSet.copyOf(Tile.ofShape(shape)).bits;
  }

  private final Model model;
  private final int[] bits;
  private final byte[] assigned;
  private int assignedCount;

  private final int[] used = new int[Shape.COUNT];
  private final int[] assignedVisible = new int[Color.COUNT];
  private final int[] minVisible = new int[Color.COUNT];
  private final int[] maxVisible = new int[Color.COUNT];
  private final int[] forced = new int[Shape.COUNT];

  // Pairs of ints: (var << 1, removed bits) or ((var << 1) | 1, tile index).
  private int[] log = new int[64];
  private int logSize;

  public Domains(Model model) {
    this.model = model;
    this.bits = new int[model.size()];
    this.assigned = new byte[model.size()];
    Arrays.fill(assigned, (byte) -1);
    for (int var = 0; var < bits.length; ++var) {
      bits[var] = model.initialDomain(var).bits;
      account(var, bits[var], 1);
    }
  }

  public Model getModel() {
    return model;
  }

  /** The number of variables. */
  public int size() {
    return bits.length;
  }

  /** Returns the values remaining for the given variable. */
  public TileSet get(int var) {
    return TileSet.ofBits(bits[var]);
  }

  /** Returns the number of values remaining for the given variable. */
  public int domainSize(int var) {
    return Integer.bitCount(bits[var]);
  }

  public boolean isEmpty(int var) {
    return bits[var] == 0;
  }

  public boolean isAssigned(int var) {
    return assigned[var] >= 0;
  }

  /** Returns the tile assigned to the given variable, or null. */
  @Nullable public Tile getAssigned(int var) {
    return assigned[var] < 0 ? null : Tile.ofIndex(assigned[var]);
  }

  public int assignedCount() {
    return assignedCount;
  }

  /** Tells whether every variable has been assigned. */
  public boolean isComplete() {
    return assignedCount == bits.length;
  }

  /** The number of tiles of the given shape used by assigned variables. */
  public int used(int shapeIndex) {
    return used[shapeIndex];
  }

  public int used(Shape shape) {
    return used[shape.ordinal()];
  }

  /** The number of bushes of the given color left visible by assigned variables. */
  public int assignedVisible(int colorIndex) {
    return assignedVisible[colorIndex];
  }

  /** The fewest bushes of the given color that the remaining values could leave visible. */
  public int minVisible(int colorIndex) {
    return minVisible[colorIndex];
  }

  /** The most bushes of the given color that the remaining values could leave visible. */
  public int maxVisible(int colorIndex) {
    return maxVisible[colorIndex];
  }

  /** The number of variables that can only take tiles of the given shape. */
  public int forced(int shapeIndex) {
    return forced[shapeIndex];
  }

  /**
   * Removes the given values from a variable's domain.  Returns true if the
   * domain changed.
   */
  public boolean remove(int var, TileSet values) {
    int removed = bits[var] & values.bits;
    if (removed == 0) return false;
    checkState(!isAssigned(var) || (removed & Tile.ofIndex(assigned[var]).bit) == 0,
               "Can't remove the assigned value of variable %s", var);
    setBits(var, bits[var] & ~removed);
    push(var << 1, removed);
    return true;
  }

  /**
   * Assigns the given tile to the given variable, narrowing its domain to
   * just that tile.
   */
  public void assign(int var, Tile tile) {
    checkState(!isAssigned(var), "Variable %s is already assigned", var);
    checkArgument((bits[var] & tile.bit) != 0, "%s is not in the domain of %s", tile, var);
    int removed = bits[var] & ~tile.bit;
    if (removed != 0) {
      setBits(var, tile.bit);
      push(var << 1, removed);
    }
    setAssigned(var, tile, 1);
    push((var << 1) | 1, tile.ordinal());
  }

  /** Returns a marker for the current state, for use with {@link #undoTo}. */
  public int mark() {
    return logSize;
  }

  /** Undoes every change made since the given mark was taken. */
  public void undoTo(int mark) {
    checkPositionIndex(mark, logSize);
    while (logSize > mark) {
      int payload = log[--logSize];
      int code = log[--logSize];
      int var = code >> 1;
      if ((code & 1) != 0) {
        setAssigned(var, Tile.ofIndex(payload), -1);
      } else {
        setBits(var, bits[var] | payload);
      }
    }
  }

  /** Captures the complete current state. */
  public Snapshot snapshot() {
    return new Snapshot(this);
  }

  private void push(int code, int payload) {
    if (logSize + 2 > log.length)
      log = Arrays.copyOf(log, log.length * 2);
    log[logSize++] = code;
    log[logSize++] = payload;
  }

  private void setBits(int var, int newBits) {
    account(var, bits[var], -1);
    bits[var] = newBits;
    account(var, newBits, 1);
  }

  private void setAssigned(int var, Tile tile, int sign) {
    assigned[var] = sign > 0 ? (byte) tile.ordinal() : (byte) -1;
    assignedCount += sign;
    if (tile.shape != null)
      used[tile.shape.ordinal()] += sign;
    for (int c = 0; c < Color.COUNT; ++c)
      assignedVisible[c] += sign * model.visible(var, tile, c);
  }

  /** Adds or subtracts a variable's contribution to the domain-wide totals. */
  private void account(int var, int domainBits, int sign) {
    if (domainBits == 0) return;
    for (int c = 0; c < Color.COUNT; ++c) {
      int min = Integer.MAX_VALUE, max = 0;
      for (int t = 0; t < Tile.COUNT; ++t) {
        if ((domainBits & (1 << t)) == 0) continue;
        int v = model.visible(var, t, c);
        if (v < min) min = v;
        if (v > max) max = v;
      }
      minVisible[c] += sign * min;
      maxVisible[c] += sign * max;
    }
    for (int s = 0; s < Shape.COUNT; ++s)
      if ((domainBits & ~SHAPE_BITS[s]) == 0)
        forced[s] += sign;
  }

  /**
   * An immutable copy of the complete state of a {@link Domains}, comparable
   * with {@link #equals}.
   */
  @Immutable
  public static final class Snapshot {
    private final int[] bits;
    private final byte[] assigned;
    private final int[] totals;

    private Snapshot(Domains domains) {
      this.bits = domains.bits.clone();
      this.assigned = domains.assigned.clone();
      int[] totals = new int[1 + 2 * Shape.COUNT + 3 * Color.COUNT];
      int i = 0;
      totals[i++] = domains.assignedCount;
      for (int s = 0; s < Shape.COUNT; ++s) {
        totals[i++] = domains.used[s];
        totals[i++] = domains.forced[s];
      }
      for (int c = 0; c < Color.COUNT; ++c) {
        totals[i++] = domains.assignedVisible[c];
        totals[i++] = domains.minVisible[c];
        totals[i++] = domains.maxVisible[c];
      }
      this.totals = totals;
    }

    @Override public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof Snapshot)) return false;
      Snapshot that = (Snapshot) o;
      return Arrays.equals(this.bits, that.bits)
          && Arrays.equals(this.assigned, that.assigned)
          && Arrays.equals(this.totals, that.totals);
    }

    @Override public int hashCode() {
      return Arrays.hashCode(bits) * 31 + Arrays.hashCode(assigned);
    }

    @Override public String toString() {
      StringBuilder sb = new StringBuilder("[");
      for (int var = 0; var < bits.length; ++var) {
        if (var > 0) sb.append(", ");
        sb.append(TileSet.ofBits(bits[var]));
        if (assigned[var] >= 0) sb.append('=').append(Tile.ofIndex(assigned[var]));
      }
      return sb.append(']').toString();
    }
  }
}
