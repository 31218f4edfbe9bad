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

import com.google.common.collect.ImmutableSet;
import com.google.common.graph.Graph;
import com.google.common.graph.Graphs;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

/** Test for {@link StronglyConnectedComponents}. */
class StronglyConnectedComponentsTests {

  @Test
  void testThreeComponents() {
    //   b -> a -> c -> b
    //        a -> d -> e
    DirectedListGraph<String, Integer> graph = new DirectedListGraph<>();
    int a = graph.addNode("a");
    int b = graph.addNode("b");
    int c = graph.addNode("c");
    int d = graph.addNode("d");
    int e = graph.addNode("e");
    graph.addEdge(b, a, 1);
    graph.addEdge(a, c, 1);
    graph.addEdge(c, b, 1);
    graph.addEdge(a, d, 1);
    graph.addEdge(d, e, 1);

    StronglyConnectedComponents sccs = StronglyConnectedComponents.of(graph);

    assertThat(ImmutableSet.copyOf(sccs.labels().asList())).hasSize(3);
    assertThat(sccs.componentCount()).isEqualTo(3);
    assertThat(sccs.label(a)).isEqualTo(sccs.label(b));
    assertThat(sccs.label(a)).isEqualTo(sccs.label(c));
    assertThat(sccs.label(d)).isNotEqualTo(sccs.label(a));
    assertThat(sccs.label(e)).isNotEqualTo(sccs.label(a));
    assertThat(sccs.label(e)).isNotEqualTo(sccs.label(d));
    assertThat(sccs.inSameComponent(b, c)).isTrue();
    assertThat(sccs.inSameComponent(d, e)).isFalse();

    // The search starts at a, so a roots its component with discovery index 0.
    assertThat(sccs.label(a)).isEqualTo(0);
    assertThat(sccs.representative(b)).isEqualTo(a);
    assertThat(sccs.representative(e)).isEqualTo(e);

    // Components complete sinks first.
    assertThat(sccs.components())
        .containsExactly(ImmutableSet.of(e), ImmutableSet.of(d), ImmutableSet.of(a, b, c))
        .inOrder();
    assertThat(sccs.componentOf(e)).isEqualTo(0);
    assertThat(sccs.componentOf(c)).isEqualTo(2);
  }

  @Test
  void testSameComponentsOverMatrix() {
    DirectedMatrixGraph<String> graph = new DirectedMatrixGraph<>();
    int a = graph.addNode("a");
    int b = graph.addNode("b");
    int c = graph.addNode("c");
    int d = graph.addNode("d");
    int e = graph.addNode("e");
    graph.addEdge(b, a);
    graph.addEdge(a, c);
    graph.addEdge(c, b);
    graph.addEdge(a, d);
    graph.addEdge(d, e);

    StronglyConnectedComponents sccs = StronglyConnectedComponents.of(graph);

    assertThat(sccs.componentCount()).isEqualTo(3);
    assertThat(sccs.components()).contains(ImmutableSet.of(a, b, c));
  }

  @Test
  void testUndirectedComponentsAreConnectedComponents() {
    UndirectedMatrixGraph<Integer> graph = new UndirectedMatrixGraph<>();
    for (int i = 0; i < 6; i++) {
      graph.addNode(i);
    }
    graph.addEdge(0, 4);
    graph.addEdge(4, 2);
    graph.addEdge(1, 5);

    StronglyConnectedComponents sccs = StronglyConnectedComponents.of(graph);

    assertThat(sccs.components())
        .containsExactly(ImmutableSet.of(0, 2, 4), ImmutableSet.of(1, 5), ImmutableSet.of(3));
  }

  @Test
  void testEmptyGraph() {
    StronglyConnectedComponents sccs =
        StronglyConnectedComponents.of(new DirectedListGraph<String, Integer>());

    assertThat(sccs.componentCount()).isEqualTo(0);
    assertThat(sccs.labels().isEmpty()).isTrue();
  }

  @Test
  void testLabelsMatchMutualReachability() {
    Random random = new Random(2021);
    for (int size = 1; size <= 40; size++) {
      RandomGraphs graphs = RandomGraphs.create(random, size, 2.0 / size);
      Graph<Integer> view = graphs.list.asGraph();
      StronglyConnectedComponents sccs = StronglyConnectedComponents.of(graphs.list);
      StronglyConnectedComponents matrixSccs = StronglyConnectedComponents.of(graphs.matrix);

      Set<Integer> labels = new HashSet<>();
      for (int x = 0; x < size; x++) {
        labels.add(sccs.label(x));
        Set<Integer> fromX = Graphs.reachableNodes(view, x);
        for (int y = 0; y < size; y++) {
          boolean mutual = fromX.contains(y) && Graphs.reachableNodes(view, y).contains(x);
          assertThat(sccs.inSameComponent(x, y)).isEqualTo(mutual);
          assertThat(matrixSccs.inSameComponent(x, y)).isEqualTo(mutual);
        }
      }
      assertThat(labels).hasSize(sccs.componentCount());
    }
  }

  @Test
  void testDeepCycleDoesNotOverflowTheStack() {
    int n = 200_000;
    DirectedListGraph<Integer, Integer> graph = new DirectedListGraph<>();
    for (int i = 0; i < n; i++) {
      graph.addNode(i);
    }
    for (int i = 0; i < n; i++) {
      graph.addEdge(i, (i + 1) % n, 1);
    }

    StronglyConnectedComponents sccs = StronglyConnectedComponents.of(graph);

    assertThat(sccs.componentCount()).isEqualTo(1);
    assertThat(sccs.label(n - 1)).isEqualTo(0);
    assertThat(sccs.representative(n / 2)).isEqualTo(0);
  }
}
