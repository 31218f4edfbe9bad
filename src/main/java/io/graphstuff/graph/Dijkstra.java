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
import static java.util.Comparator.comparingLong;

import java.util.HashMap;
import java.util.Map;
import java.util.PriorityQueue;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dijkstra's single-source shortest path search over the positive-weight cells of a {@link
 * MatrixGraph}. Scanning a full row per settled node makes a complete search O(N^2 log N).
 */
final class Dijkstra {

  private static final Logger logger = LoggerFactory.getLogger(Dijkstra.class);

  private Dijkstra() {}

  /** A frontier entry; entries made stale by a later, cheaper relaxation are skipped on removal. */
  private static final class Candidate {
    final int node;
    final long cost;

    Candidate(int node, long cost) {
      this.node = node;
      this.cost = cost;
    }
  }

  static ShortestPaths search(
      MatrixGraph<?> graph, int start, @Nullable Long maxCost, @Nullable Integer target) {
    int n = graph.nodeCount();
    checkElementIndex(start, n, "start");
    if (target != null) {
      checkElementIndex(target, n, "target");
    }
    if (maxCost != null) {
      checkArgument(maxCost >= 0, "maxCost must be non-negative: %s", maxCost);
    }

    Map<Integer, Integer> predecessors = new HashMap<>();
    Map<Integer, Long> costs = new HashMap<>();
    costs.put(start, 0L);

    // Ties are broken arbitrarily.
    PriorityQueue<Candidate> frontier = new PriorityQueue<>(comparingLong(c -> c.cost));
    frontier.add(new Candidate(start, 0));

    while (!frontier.isEmpty()) {
      Candidate current = frontier.poll();
      if (current.cost > costs.get(current.node)) {
        continue;
      }
      if (target != null && current.node == target) {
        logger.debug("Settled target {} at cost {}; stopping early", target, current.cost);
        break;
      }

      for (int next = 0; next < n; next++) {
        int weight = graph.weight(current.node, next);
        if (weight == 0) {
          continue;
        }
        long newCost = current.cost + weight;
        if (maxCost != null && newCost > maxCost) {
          continue;
        }
        Long known = costs.get(next);
        if (known == null || newCost < known) {
          costs.put(next, newCost);
          predecessors.put(next, current.node);
          frontier.add(new Candidate(next, newCost));
        }
      }
    }

    return new ShortestPaths(start, predecessors, costs);
  }
}
