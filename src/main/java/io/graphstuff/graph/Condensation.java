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

import com.google.common.collect.ImmutableSet;

/**
 * The strong component graph of a graph: a new acyclic graph in which every strongly connected
 * component of the original has been fused into a single node, and edges inside a component have
 * been dropped.
 *
 * <p>Node {@code c} of the condensed graph is component {@code c} as numbered by {@link
 * StronglyConnectedComponents#componentOf}; its value is the component's representative node in
 * the original graph. The original graph is not modified.
 */
public final class Condensation {

  private final StronglyConnectedComponents components;
  private final DirectedMatrixGraph<Integer> graph;

  private Condensation(StronglyConnectedComponents components, DirectedMatrixGraph<Integer> graph) {
    this.components = components;
    this.graph = graph;
  }

  public static Condensation of(IndexedGraph graph) {
    checkNotNull(graph, "graph");
    return of(graph, StronglyConnectedComponents.of(graph));
  }

  static Condensation of(IndexedGraph graph, StronglyConnectedComponents components) {
    DirectedMatrixGraph<Integer> condensed = new DirectedMatrixGraph<>();
    for (ImmutableSet<Integer> component : components.components()) {
      condensed.addNode(components.representative(component.iterator().next()));
    }

    for (int from = 0; from < graph.nodeCount(); from++) {
      int fromImage = components.componentOf(from);
      for (int to : graph.neighbors(from)) {
        int toImage = components.componentOf(to);
        if (fromImage != toImage) {
          condensed.addEdge(fromImage, toImage);
        }
      }
    }
    return new Condensation(components, condensed);
  }

  /** Returns the condensed graph. Each call returns the same, caller-owned instance. */
  public DirectedMatrixGraph<Integer> graph() {
    return graph;
  }

  public StronglyConnectedComponents components() {
    return components;
  }

  /** Returns the node of the condensed graph that {@code node} of the original graph maps to. */
  public int imageOf(int node) {
    return components.componentOf(node);
  }

  @Override
  public String toString() {
    return "Condensation[" + graph.nodeCount() + " components]";
  }
}
