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

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.AbstractIterator;
import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.Iterator;

/**
 * Lazy, single-pass visitations of the nodes reachable from a start node.
 *
 * <p>Each instance keeps its own visited set and frontier, so every call to {@link
 * #breadthFirst} or {@link #depthFirst} starts a fresh visitation. A node already visited is never
 * put back on the frontier; each visitation therefore returns at most {@code nodeCount()} nodes and
 * always terminates. Fully consuming a visitation from {@code S} yields exactly the set of nodes
 * reachable from {@code S} (including {@code S} itself).
 *
 * <p>Neighbors are expanded in the order given by {@link IndexedGraph#neighbors}: edge-insertion
 * order for the list form, ascending index order for the matrix form.
 */
abstract class Traversal extends AbstractIterator<Integer> {

  final IndexedGraph graph;

  private final BitSet visited = new BitSet();

  private Traversal(IndexedGraph graph, int start) {
    this.graph = checkNotNull(graph, "graph");
    checkElementIndex(start, graph.nodeCount(), "start");
  }

  /** Returns a breadth-first visitation, using a first-in-first-out frontier. */
  static Iterator<Integer> breadthFirst(IndexedGraph graph, int start) {
    return new BreadthFirst(graph, start);
  }

  /**
   * Returns a depth-first pre-order visitation. The order is that of the recursive algorithm, but
   * the recursion is kept on an explicit stack bounded by the number of nodes.
   */
  static Iterator<Integer> depthFirst(IndexedGraph graph, int start) {
    return new DepthFirst(graph, start);
  }

  /** Marks {@code node} as visited, returning true iff it had not been visited before. */
  final boolean mark(int node) {
    if (visited.get(node)) {
      return false;
    }
    visited.set(node);
    return true;
  }

  final boolean isVisited(int node) {
    return visited.get(node);
  }

  private static final class BreadthFirst extends Traversal {

    private final Deque<Integer> frontier = new ArrayDeque<>();

    BreadthFirst(IndexedGraph graph, int start) {
      super(graph, start);
      mark(start);
      frontier.add(start);
    }

    @Override
    protected Integer computeNext() {
      Integer next = frontier.poll();
      if (next == null) {
        return endOfData();
      }
      for (int neighbor : graph.neighbors(next)) {
        if (mark(neighbor)) {
          frontier.addLast(neighbor);
        }
      }
      return next;
    }
  }

  private static final class DepthFirst extends Traversal {

    /** One frame per node on the current path, holding where its successor scan resumes. */
    private final Deque<Iterator<Integer>> stack = new ArrayDeque<>();

    private final int start;
    private boolean started;

    DepthFirst(IndexedGraph graph, int start) {
      super(graph, start);
      this.start = start;
    }

    @Override
    protected Integer computeNext() {
      if (!started) {
        started = true;
        return enter(start);
      }
      while (!stack.isEmpty()) {
        Iterator<Integer> successors = stack.peek();
        while (successors.hasNext()) {
          int next = successors.next();
          if (!isVisited(next)) {
            return enter(next);
          }
        }
        stack.pop();
      }
      return endOfData();
    }

    private int enter(int node) {
      mark(node);
      stack.push(graph.neighbors(node).iterator());
      return node;
    }
  }
}
