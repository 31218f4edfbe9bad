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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import javax.annotation.Nullable;

/**
 * The result of a {@link MatrixGraph#dijkstra Dijkstra} search: for every node discovered, the node
 * it was last reached from on a cheapest known path and the cost of that path.
 *
 * <p>If the search stopped early at a target, nodes that were discovered but not yet settled carry
 * tentative costs; the target itself, and every node on its path, are settled.
 */
public final class ShortestPaths {

  private final int start;

  /** Maps each discovered node other than the start to its parent in the shortest-path tree. */
  private final ImmutableMap<Integer, Integer> tree;

  private final ImmutableMap<Integer, Long> costs;

  ShortestPaths(int start, Map<Integer, Integer> tree, Map<Integer, Long> costs) {
    this.start = start;
    this.tree = ImmutableMap.copyOf(tree);
    this.costs = ImmutableMap.copyOf(costs);
  }

  public int start() {
    return start;
  }

  /** Returns true iff the search discovered {@code node}. The start node is always discovered. */
  public boolean contains(int node) {
    return costs.containsKey(node);
  }

  /** Returns the discovered nodes, in ascending index order. */
  public ImmutableSortedSet<Integer> discovered() {
    return ImmutableSortedSet.copyOf(costs.keySet());
  }

  /**
   * Returns the node {@code node} was reached from; empty for the start node and for nodes that
   * were not discovered.
   */
  public OptionalInt predecessor(int node) {
    Integer parent = tree.get(node);
    return parent == null ? OptionalInt.empty() : OptionalInt.of(parent);
  }

  /**
   * Returns the whole predecessor map: every discovered node mapped to the node it was reached
   * from, the start node mapped to {@link Optional#empty()}.
   */
  public ImmutableMap<Integer, Optional<Integer>> predecessors() {
    ImmutableMap.Builder<Integer, Optional<Integer>> predecessors = ImmutableMap.builder();
    predecessors.put(start, Optional.empty());
    for (Map.Entry<Integer, Integer> entry : tree.entrySet()) {
      predecessors.put(entry.getKey(), Optional.of(entry.getValue()));
    }
    return predecessors.buildOrThrow();
  }

  /** Returns the cost of the cheapest path found to {@code node}, if it was discovered. */
  public OptionalLong cost(int node) {
    Long cost = costs.get(node);
    return cost == null ? OptionalLong.empty() : OptionalLong.of(cost);
  }

  /**
   * Returns the path from the start node to {@code target} as a list, including both endpoints, or
   * null if {@code target} was not discovered.
   */
  @Nullable
  public List<Integer> pathTo(int target) {
    if (!costs.containsKey(target)) {
      return null;
    }
    ImmutableList.Builder<Integer> reversed = ImmutableList.builder();
    int node = target;
    reversed.add(node);
    while (node != start) {
      node = tree.get(node);
      reversed.add(node);
    }
    return reversed.build().reverse();
  }

  @Override
  public String toString() {
    return "ShortestPaths[start=" + start + ", " + costs.size() + " nodes discovered]";
  }
}
