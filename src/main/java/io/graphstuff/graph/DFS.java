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

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.Iterator;

/**
 * The DFS class encapsulates a depth-first post-order visitation: each node is reported to the
 * visitor after all of its successors, and the nodes that have been seen already are remembered.
 *
 * <p>Successive calls to {@link #visit} share the set of marked nodes, so a node is reported at
 * most once per DFS instance. The search keeps its own stack of frames instead of recursing, so its
 * memory is bounded by the number of nodes rather than by the call stack.
 *
 * <p>Clients should not modify the graph while a traversal is in progress.
 */
final class DFS {

  private final IndexedGraph graph;

  private final BitSet marked = new BitSet();

  /**
   * Constructs a DFS instance for searching over {@code graph}; successors are visited in the order
   * of {@link IndexedGraph#neighbors}.
   */
  DFS(IndexedGraph graph) {
    this.graph = checkNotNull(graph, "graph");
  }

  void visit(int node, GraphVisitor visitor) {
    checkElementIndex(node, graph.nodeCount(), "node");
    if (marked.get(node)) {
      return;
    }

    marked.set(node);
    Deque<Frame> stack = new ArrayDeque<>();
    stack.push(new Frame(node));
    while (!stack.isEmpty()) {
      Frame frame = stack.peek();
      if (frame.successors.hasNext()) {
        int next = frame.successors.next();
        if (!marked.get(next)) {
          marked.set(next);
          stack.push(new Frame(next));
        }
      } else {
        stack.pop();
        visitor.visitNode(frame.node);
      }
    }
  }

  private final class Frame {
    final int node;
    final Iterator<Integer> successors;

    Frame(int node) {
      this.node = node;
      this.successors = graph.neighbors(node).iterator();
    }
  }
}
