// Copyright 2014 The Bazel Authors. All rights reserved.
// Copyright 2021 Jonathan Bluett-Duncan. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package io.graphstuff.graph;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSortedSet;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Comparator;
import javax.annotation.Nullable;

/**
 * A square boolean matrix where cell {@code (i, j)} is true iff node {@code j} is reachable from
 * node {@code i}. Every node is reachable from itself, so the diagonal is always true.
 *
 * <p>Instances are immutable. Rows may be shared between nodes with identical reachability.
 */
public final class ReachabilityMatrix {

  private final BitSet[] rows;

  /** Takes ownership of {@code rows}; callers must not modify them afterwards. */
  ReachabilityMatrix(BitSet[] rows) {
    this.rows = rows;
  }

  /** Returns a matrix with the given cells, which must be square. */
  public static ReachabilityMatrix copyOf(boolean[][] cells) {
    checkNotNull(cells, "cells");
    BitSet[] rows = new BitSet[cells.length];
    for (int i = 0; i < cells.length; i++) {
      checkArgument(
          cells[i].length == cells.length,
          "row %s has %s cells, expected %s",
          i,
          cells[i].length,
          cells.length);
      rows[i] = new BitSet(cells.length);
      for (int j = 0; j < cells.length; j++) {
        rows[i].set(j, cells[i][j]);
      }
    }
    return new ReachabilityMatrix(rows);
  }

  /** Returns the number of rows (and columns). */
  public int size() {
    return rows.length;
  }

  /** Returns true iff {@code to} is reachable from {@code from}. */
  public boolean get(int from, int to) {
    checkElementIndex(from, rows.length, "from");
    checkElementIndex(to, rows.length, "to");
    return rows[from].get(to);
  }

  /** Returns the nodes reachable from {@code from}, in ascending order. */
  public ImmutableSortedSet<Integer> row(int from) {
    checkElementIndex(from, rows.length, "from");
    return rows[from].stream()
        .boxed()
        .collect(ImmutableSortedSet.toImmutableSortedSet(Comparator.naturalOrder()));
  }

  /** Returns the number of true cells. */
  public long cardinality() {
    long count = 0;
    for (BitSet row : rows) {
      count += row.cardinality();
    }
    return count;
  }

  /** Returns a fresh copy of the cells, indexable as {@code [from][to]}. */
  public boolean[][] toArray() {
    boolean[][] cells = new boolean[rows.length][rows.length];
    for (int i = 0; i < rows.length; i++) {
      for (int j = rows[i].nextSetBit(0); j >= 0; j = rows[i].nextSetBit(j + 1)) {
        cells[i][j] = true;
      }
    }
    return cells;
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    return obj instanceof ReachabilityMatrix
        && Arrays.equals(rows, ((ReachabilityMatrix) obj).rows);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(rows);
  }

  /** Returns the matrix one row per line, {@code 1} for reachable and {@code 0} otherwise. */
  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder();
    for (BitSet row : rows) {
      for (int j = 0; j < rows.length; j++) {
        builder.append(row.get(j) ? '1' : '0');
      }
      builder.append('\n');
    }
    return builder.toString();
  }
}
