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

import com.google.common.collect.ImmutableList;
import com.google.common.graph.Graph;
import java.util.Iterator;

/**
 * A read-only view of a graph whose nodes are identified by dense, zero-based indices.
 *
 * <p>Node indices are issued in insertion order and are never reused: the nodes of a graph with
 * {@link #nodeCount()} {@code N} are exactly {@code 0..N-1}. Both the adjacency-list and the
 * adjacency-matrix representations implement this interface, and every algorithm in this package
 * is written against it.
 *
 * <p>Clients should not mutate a graph while an iterator or result derived from it is in use.
 */
public interface IndexedGraph {

  /** Returns the number of nodes; valid indices are {@code 0..nodeCount()-1}. */
  int nodeCount();

  /**
   * Returns the destinations of the outgoing edges of {@code node}.
   *
   * <p>The list form returns them in edge-insertion order (including duplicates, if the same edge
   * was added twice); the matrix form returns them in ascending index order.
   *
   * @throws IndexOutOfBoundsException if {@code node} is not a node of this graph
   */
  ImmutableList<Integer> neighbors(int node);

  /** Returns true iff every edge insertion on this graph is one-way. */
  boolean isDirected();

  /**
   * Returns a lazy breadth-first visitation starting at {@code start}. Each reachable node is
   * returned exactly once, in non-decreasing distance from {@code start}.
   */
  default Iterator<Integer> bfs(int start) {
    return Traversal.breadthFirst(this, start);
  }

  /**
   * Returns a lazy depth-first (pre-order) visitation starting at {@code start}. Each reachable
   * node is returned exactly once.
   */
  default Iterator<Integer> dfs(int start) {
    return Traversal.depthFirst(this, start);
  }

  /**
   * Returns an unmodifiable Guava {@link Graph} view of this graph over its node indices. Parallel
   * edges collapse to one. The view tracks later mutations of this graph.
   */
  default Graph<Integer> asGraph() {
    return new IndexedGraphView(this);
  }
}
