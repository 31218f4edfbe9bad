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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableIntArray;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import javax.annotation.Nullable;

/**
 * An adjacency-matrix graph: an {@code N x N} matrix of non-negative integer edge weights, stored
 * flattened in row-major order, where 0 means "no edge". Suited to dense graphs; edge lookup is
 * O(1).
 *
 * <p>Some invariants:
 *
 * <ul>
 *   <li>Node indices are the contiguous range {@code [0, nodeCount())}; nodes are never removed.
 *   <li>Adding a node leaves every stored cell unchanged and adds a row and a column of zeros. The
 *       backing array grows geometrically, so the cost is O(N) amortized per node.
 *   <li>Re-adding an edge overwrites its weight. Self-edges are permitted.
 *   <li>An edge of weight 0 cannot be represented: 0 is reserved for absence, and every algorithm
 *       treats only positive cells as edges.
 * </ul>
 *
 * <p>Each node also carries a value; {@link #indexOf} maps values back to indices. Adding a value
 * equal to an existing one re-points the mapping to the new node, but the old node stays.
 *
 * <p>Directedness and weightedness are fixed by the concrete class, which exposes the matching
 * {@code addEdge}: {@link DirectedMatrixGraph}, {@link UndirectedMatrixGraph}, {@link
 * DirectedWeightedMatrixGraph} and {@link UndirectedWeightedMatrixGraph}.
 *
 * @param <V> the node value type; values must have consistent {@code equals} and {@code hashCode}
 */
public abstract class MatrixGraph<V> implements IndexedGraph {

  private static final int MIN_CAPACITY = 4;

  /** The largest capacity whose square still fits in an int. */
  static final int MAX_CAPACITY = 46340;

  /** Row-major cells; row {@code x} starts at {@code x * capacity}. */
  private int[] cells = new int[0];

  private int capacity;

  private int n;

  private final List<V> values = new ArrayList<>();

  private final Map<V, Integer> indexByValue = new HashMap<>();

  MatrixGraph() {}

  /**
   * Adds a node carrying {@code value} and returns its index. Indices are issued sequentially from
   * 0. The null pointer is not a valid value.
   *
   * @throws IllegalStateException if the graph already holds {@link #MAX_CAPACITY} nodes
   */
  public int addNode(V value) {
    checkNotNull(value, "value");
    if (n == capacity) {
      grow();
    }
    int index = n++;
    values.add(value);
    indexByValue.put(value, index);
    return index;
  }

  // Cells past the current node count are always zero, so only the used rows are copied.
  private void grow() {
    int newCapacity = nextCapacity(capacity);
    int[] newCells = new int[newCapacity * newCapacity];
    for (int row = 0; row < n; row++) {
      System.arraycopy(cells, row * capacity, newCells, row * newCapacity, n);
    }
    cells = newCells;
    capacity = newCapacity;
  }

  /**
   * Returns the capacity to grow to from {@code capacity}: double it, but no further than {@link
   * #MAX_CAPACITY}.
   *
   * @throws IllegalStateException if {@code capacity} is already {@link #MAX_CAPACITY}
   */
  static int nextCapacity(int capacity) {
    checkState(capacity < MAX_CAPACITY, "a matrix graph holds at most %s nodes", MAX_CAPACITY);
    return Math.max(MIN_CAPACITY, (int) Math.min(MAX_CAPACITY, capacity * 2L));
  }

  /** Sets the weight of the cell {@code (x, y)}; both nodes must exist. */
  final void setWeight(int x, int y, int weight) {
    checkArgument(weight > 0, "weight must be positive (0 means no edge): %s", weight);
    cells[offset(x, y)] = weight;
  }

  /** Returns the raw weight of the cell {@code (x, y)}, 0 if there is no edge. */
  final int weight(int x, int y) {
    return cells[offset(x, y)];
  }

  private int offset(int x, int y) {
    checkElementIndex(x, n, "x");
    checkElementIndex(y, n, "y");
    return x * capacity + y;
  }

  @Override
  public int nodeCount() {
    return n;
  }

  public V nodeValue(int node) {
    checkElementIndex(node, n, "node");
    return values.get(node);
  }

  /** Returns the index of the most recently added node carrying {@code value}, if any. */
  public OptionalInt indexOf(V value) {
    Integer index = indexByValue.get(checkNotNull(value, "value"));
    return index == null ? OptionalInt.empty() : OptionalInt.of(index);
  }

  public boolean hasEdge(int x, int y) {
    return weight(x, y) > 0;
  }

  /**
   * Returns row {@code node} of the matrix: the weight of the edge to every node, in index order,
   * with 0 where there is no edge.
   */
  public ImmutableIntArray edges(int node) {
    checkElementIndex(node, n, "node");
    int start = node * capacity;
    return ImmutableIntArray.copyOf(Arrays.copyOfRange(cells, start, start + n));
  }

  @Override
  public ImmutableList<Integer> neighbors(int node) {
    checkElementIndex(node, n, "node");
    ImmutableList.Builder<Integer> neighbors = ImmutableList.builder();
    int start = node * capacity;
    for (int y = 0; y < n; y++) {
      if (cells[start + y] > 0) {
        neighbors.add(y);
      }
    }
    return neighbors.build();
  }

  /**
   * Reverses every edge in place by swapping cell {@code (x, y)} with {@code (y, x)}. Applying it
   * twice restores the graph; on an undirected graph it changes nothing. Time: O(N^2).
   */
  public void transpose() {
    for (int y = 0; y < n; y++) {
      for (int x = y + 1; x < n; x++) {
        int a = x * capacity + y;
        int b = y * capacity + x;
        int tmp = cells[a];
        cells[a] = cells[b];
        cells[b] = tmp;
      }
    }
  }

  /** Equivalent to {@code dijkstra(start, null, null)}. */
  public ShortestPaths dijkstra(int start) {
    return dijkstra(start, null, null);
  }

  /**
   * Runs Dijkstra's algorithm from {@code start} over the positive-weight edges.
   *
   * @param maxCost if non-null, nodes whose cheapest path costs more than this are not discovered
   * @param target if non-null, the search stops as soon as this node is settled
   * @return the predecessor map built so far, with the cost of each discovered node
   */
  public ShortestPaths dijkstra(int start, @Nullable Long maxCost, @Nullable Integer target) {
    return Dijkstra.search(this, start, maxCost, target);
  }

  /**
   * Finds a cheapest path from {@code start} to {@code target}. The path is returned as an ordered
   * list of nodes, including both endpoints. Returns null if there is no path.
   */
  @Nullable
  public List<Integer> pathTo(int start, int target) {
    return dijkstra(start, null, target).pathTo(target);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + n + " nodes]";
  }
}
