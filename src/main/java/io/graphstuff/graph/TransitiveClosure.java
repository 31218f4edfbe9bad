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
import com.google.common.collect.ImmutableSet;
import java.util.BitSet;
import java.util.Iterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the {@link ReachabilityMatrix} of a graph. The two methods always agree; they differ
 * only in cost.
 */
public final class TransitiveClosure {

  private static final Logger logger = LoggerFactory.getLogger(TransitiveClosure.class);

  private TransitiveClosure() {}

  /**
   * Computes the closure with one breadth-first search per node. Time: O(V * (V + E)) for the list
   * form, O(V^3) for the matrix form.
   */
  public static ReachabilityMatrix byTraversal(IndexedGraph graph) {
    checkNotNull(graph, "graph");
    int n = graph.nodeCount();
    BitSet[] rows = new BitSet[n];
    for (int from = 0; from < n; from++) {
      BitSet row = new BitSet(n);
      for (Iterator<Integer> it = graph.bfs(from); it.hasNext(); ) {
        row.set(it.next());
      }
      rows[from] = row;
    }
    ReachabilityMatrix closure = new ReachabilityMatrix(rows);
    if (logger.isDebugEnabled()) {
      logger.debug("Closure of {} nodes by traversal has {} cells set", n, closure.cardinality());
    }
    return closure;
  }

  /**
   * Computes the closure with Purdom's algorithm, which pays off on graphs with many nodes but few
   * strongly connected components. Time: O(E + μV), where μ is the number of components.
   *
   * <ol>
   *   <li>Find the strongly connected components and fuse each into a single node, dropping the
   *       edges inside components (the {@link Condensation}).
   *   <li>Sort the acyclic condensed graph topologically.
   *   <li>Walking the topological order from last to first, the nodes reachable from a condensed
   *       node are itself plus everything reachable from its direct successors, which are already
   *       done.
   *   <li>Expand back: each original node gets the row of its component, with every member of every
   *       reachable component set. Members of one component reach each other.
   * </ol>
   */
  public static ReachabilityMatrix byCondensation(IndexedGraph graph) {
    checkNotNull(graph, "graph");
    Condensation condensation = Condensation.of(graph);
    DirectedMatrixGraph<Integer> condensed = condensation.graph();
    ImmutableList<Integer> order = TopologicalSort.of(condensed);
    logger.debug(
        "Condensed {} nodes into {} components", graph.nodeCount(), condensed.nodeCount());

    int components = condensed.nodeCount();
    BitSet[] reach = new BitSet[components];
    for (int i = order.size() - 1; i >= 0; i--) {
      int component = order.get(i);
      BitSet reachable = new BitSet(components);
      reachable.set(component);
      for (int successor : condensed.neighbors(component)) {
        reachable.or(reach[successor]);
      }
      reach[component] = reachable;
    }

    int n = graph.nodeCount();
    ImmutableList<ImmutableSet<Integer>> members = condensation.components().components();
    BitSet[] expanded = new BitSet[components];
    for (int component = 0; component < components; component++) {
      BitSet row = new BitSet(n);
      BitSet reachable = reach[component];
      for (int c = reachable.nextSetBit(0); c >= 0; c = reachable.nextSetBit(c + 1)) {
        for (int node : members.get(c)) {
          row.set(node);
        }
      }
      expanded[component] = row;
    }

    BitSet[] rows = new BitSet[n];
    for (int node = 0; node < n; node++) {
      rows[node] = expanded[condensation.imageOf(node)];
    }
    ReachabilityMatrix closure = new ReachabilityMatrix(rows);
    if (logger.isDebugEnabled()) {
      logger.debug(
          "Closure of {} nodes by condensation has {} cells set", n, closure.cardinality());
    }
    return closure;
  }
}
