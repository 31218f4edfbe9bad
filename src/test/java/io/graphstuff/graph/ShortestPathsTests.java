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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Optional;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Test for {@link MatrixGraph#dijkstra} and {@link ShortestPaths}. */
class ShortestPathsTests {

  private DirectedWeightedMatrixGraph<String> graph;

  @BeforeEach
  void setup() {
    graph = new DirectedWeightedMatrixGraph<>();
    //   a --4--> b --1--> d --3--> e
    //   |        ^        ^
    //   1        2        |
    //   v        |        |
    //   c -------+---5----+
    //
    //   f (isolated)
    int a = graph.addNode("a");
    int b = graph.addNode("b");
    int c = graph.addNode("c");
    int d = graph.addNode("d");
    int e = graph.addNode("e");
    graph.addNode("f");
    graph.addEdge(a, b, 4);
    graph.addEdge(a, c, 1);
    graph.addEdge(c, b, 2);
    graph.addEdge(b, d, 1);
    graph.addEdge(c, d, 5);
    graph.addEdge(d, e, 3);
  }

  private int node(String value) {
    return graph.indexOf(value).getAsInt();
  }

  @Test
  void testFullSearch() {
    ShortestPaths paths = graph.dijkstra(node("a"));

    assertThat(paths.start()).isEqualTo(node("a"));
    assertThat(paths.discovered())
        .containsExactly(node("a"), node("b"), node("c"), node("d"), node("e"))
        .inOrder();
    assertThat(paths.cost(node("a")).getAsLong()).isEqualTo(0);
    assertThat(paths.cost(node("c")).getAsLong()).isEqualTo(1);
    assertThat(paths.cost(node("b")).getAsLong()).isEqualTo(3);
    assertThat(paths.cost(node("d")).getAsLong()).isEqualTo(4);
    assertThat(paths.cost(node("e")).getAsLong()).isEqualTo(7);
    assertThat(paths.cost(node("f")).isPresent()).isFalse();

    assertThat(paths.predecessor(node("a")).isPresent()).isFalse();
    assertThat(paths.predecessor(node("b")).getAsInt()).isEqualTo(node("c"));
    assertThat(paths.predecessors()).containsEntry(node("a"), Optional.empty());
    assertThat(paths.predecessors()).containsEntry(node("d"), Optional.of(node("b")));
    assertThat(paths.predecessors()).doesNotContainKey(node("f"));
  }

  @Test
  void testPathTo() {
    assertThat(graph.pathTo(node("a"), node("e")))
        .containsExactly(node("a"), node("c"), node("b"), node("d"), node("e"))
        .inOrder();
    assertThat(graph.pathTo(node("a"), node("a"))).containsExactly(node("a"));
    assertThat(graph.pathTo(node("a"), node("b")))
        .containsExactly(node("a"), node("c"), node("b"))
        .inOrder();
    List<Integer> path = graph.pathTo(node("a"), node("d"));
    assertThrows(UnsupportedOperationException.class, () -> path.add(node("e")));
  }

  @Test
  void testMissingPathIsNull() {
    assertThat(graph.pathTo(node("a"), node("f"))).isNull();
    assertThat(graph.pathTo(node("e"), node("a"))).isNull();
    assertThat(graph.dijkstra(node("a")).pathTo(node("f"))).isNull();
  }

  @Test
  void testMaxCostBoundsTheSearch() {
    ShortestPaths paths = graph.dijkstra(node("a"), 3L, null);

    assertThat(paths.discovered()).containsExactly(node("a"), node("b"), node("c"));
    assertThat(paths.contains(node("d"))).isFalse();
    assertThat(paths.pathTo(node("d"))).isNull();
    assertThat(paths.pathTo(node("b"))).containsExactly(node("a"), node("c"), node("b")).inOrder();

    assertThat(graph.dijkstra(node("a"), 0L, null).discovered()).containsExactly(node("a"));
    assertThat(graph.dijkstra(node("a"), 7L, null).contains(node("e"))).isTrue();
  }

  @Test
  void testTargetStopsEarly() {
    ShortestPaths paths = graph.dijkstra(node("a"), null, node("d"));

    // d is settled before it is expanded, so e is never reached.
    assertThat(paths.contains(node("e"))).isFalse();
    assertThat(paths.cost(node("d")).getAsLong()).isEqualTo(4);
    assertThat(paths.pathTo(node("d")))
        .containsExactly(node("a"), node("c"), node("b"), node("d"))
        .inOrder();
  }

  @Test
  void testInvalidArgumentsFail() {
    assertThrows(IndexOutOfBoundsException.class, () -> graph.dijkstra(6));
    assertThrows(IndexOutOfBoundsException.class, () -> graph.dijkstra(0, null, 6));
    assertThrows(IndexOutOfBoundsException.class, () -> graph.pathTo(0, -1));
    assertThrows(IllegalArgumentException.class, () -> graph.dijkstra(0, -1L, null));
  }

  @Test
  void testUndirectedSearch() {
    UndirectedWeightedMatrixGraph<Integer> ring = new UndirectedWeightedMatrixGraph<>();
    for (int i = 0; i < 6; i++) {
      ring.addNode(i);
    }
    for (int i = 0; i < 6; i++) {
      ring.addEdge(i, (i + 1) % 6, 1);
    }
    ring.addEdge(0, 3, 10);

    assertThat(ring.dijkstra(0).cost(3).getAsLong()).isEqualTo(3);
    assertThat(ring.pathTo(0, 4)).containsExactly(0, 5, 4).inOrder();
  }

  @Test
  void testTargetedPathsCostTheMinimum() {
    Random random = new Random(99);
    for (int round = 0; round < 20; round++) {
      int size = 2 + random.nextInt(25);
      DirectedWeightedMatrixGraph<Integer> g = new DirectedWeightedMatrixGraph<>();
      for (int i = 0; i < size; i++) {
        g.addNode(i);
      }
      for (int i = 0; i < size * 3; i++) {
        g.addEdge(random.nextInt(size), random.nextInt(size), 1 + random.nextInt(10));
      }

      ShortestPaths full = g.dijkstra(0);
      for (int target = 0; target < size; target++) {
        List<Integer> path = g.pathTo(0, target);
        if (!full.contains(target)) {
          assertThat(path).isNull();
          continue;
        }
        assertThat(path.get(0)).isEqualTo(0);
        assertThat(path.get(path.size() - 1)).isEqualTo(target);
        long cost = 0;
        for (int i = 0; i + 1 < path.size(); i++) {
          cost += g.edgeWeight(path.get(i), path.get(i + 1));
        }
        assertThat(cost).isEqualTo(full.cost(target).getAsLong());

        // Cutting the search radius just below the minimum excludes the target.
        long min = full.cost(target).getAsLong();
        if (min > 0) {
          assertThat(g.dijkstra(0, min - 1, null).contains(target)).isFalse();
        }
      }
    }
  }
}
