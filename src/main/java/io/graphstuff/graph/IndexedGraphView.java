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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ContiguousSet;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.common.graph.AbstractGraph;
import com.google.common.graph.ElementOrder;
import java.util.AbstractSet;
import java.util.Iterator;
import java.util.Set;

/**
 * Adapts an {@link IndexedGraph} to Guava's {@link com.google.common.graph.Graph} interface, so
 * that the utilities of {@link com.google.common.graph.Graphs} can be applied to it.
 *
 * <p>The view is unmodifiable but not immutable: its sets are computed from the underlying graph
 * on each access.
 */
final class IndexedGraphView extends AbstractGraph<Integer> {

  private final IndexedGraph graph;

  IndexedGraphView(IndexedGraph graph) {
    this.graph = checkNotNull(graph, "graph");
  }

  @Override
  public Set<Integer> nodes() {
    return ContiguousSet.closedOpen(0, graph.nodeCount());
  }

  @Override
  public Set<Integer> adjacentNodes(Integer node) {
    return Sets.union(predecessors(node), successors(node));
  }

  @Override
  public Set<Integer> predecessors(Integer node) {
    checkNode(node);
    if (!graph.isDirected()) {
      return successors(node);
    }

    return new AbstractSet<Integer>() {
      @Override
      public Iterator<Integer> iterator() {
        return collectPredecessors(node).iterator();
      }

      @Override
      public int size() {
        return collectPredecessors(node).size();
      }
    };
  }

  @Override
  public Set<Integer> successors(Integer node) {
    checkNode(node);

    return new AbstractSet<Integer>() {
      @Override
      public Iterator<Integer> iterator() {
        return ImmutableSet.copyOf(graph.neighbors(node)).iterator();
      }

      @Override
      public int size() {
        return ImmutableSet.copyOf(graph.neighbors(node)).size();
      }
    };
  }

  // O(V + E): neither representation stores incoming edges.
  private ImmutableSet<Integer> collectPredecessors(int node) {
    ImmutableSet.Builder<Integer> predecessors = ImmutableSet.builder();
    for (int from = 0; from < graph.nodeCount(); from++) {
      if (graph.neighbors(from).contains(node)) {
        predecessors.add(from);
      }
    }
    return predecessors.build();
  }

  private void checkNode(Integer node) {
    checkNotNull(node, "node");
    checkArgument(nodes().contains(node), "'node' must be a node of the graph");
  }

  @Override
  public boolean isDirected() {
    return graph.isDirected();
  }

  @Override
  public boolean allowsSelfLoops() {
    return true;
  }

  @Override
  public ElementOrder<Integer> nodeOrder() {
    return ElementOrder.natural();
  }

  @Override
  public String toString() {
    return "IndexedGraphView[" + graph.nodeCount() + " nodes]";
  }
}
