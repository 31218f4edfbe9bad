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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Topological ordering of acyclic graphs.
 *
 * <p>A topological order is one such that, if (u, v) is a path in acyclic graph G, then u is before
 * v in the topological order. In other words "tails before heads" or "roots before leaves".
 */
public final class TopologicalSort {

  private TopologicalSort() {}

  /**
   * Returns the nodes of an acyclic graph in topological order [a.k.a "reverse post-order" of
   * depth-first search]. The search starts from the nodes in ascending index order and follows
   * edges in {@link IndexedGraph#neighbors} order, so the result is deterministic. Self-edges are
   * ignored.
   *
   * @throws IllegalArgumentException if the graph has a cycle of two or more nodes
   */
  public static ImmutableList<Integer> of(IndexedGraph graph) {
    checkNotNull(graph, "graph");
    List<Integer> postorder = new ArrayList<>(graph.nodeCount());
    DFS visitation = new DFS(graph);
    for (int node = 0; node < graph.nodeCount(); node++) {
      visitation.visit(node, postorder::add);
    }

    ImmutableList<Integer> order = ImmutableList.copyOf(postorder).reverse();
    checkAcyclic(graph, order);
    return order;
  }

  private static void checkAcyclic(IndexedGraph graph, ImmutableList<Integer> order) {
    int[] position = new int[order.size()];
    for (int i = 0; i < order.size(); i++) {
      position[order.get(i)] = i;
    }
    for (int from = 0; from < graph.nodeCount(); from++) {
      for (int to : graph.neighbors(from)) {
        if (from != to && position[from] > position[to]) {
          throw new IllegalArgumentException(
              "Graph is cyclic: edge " + from + " -> " + to + " closes a cycle");
        }
      }
    }
  }
}
