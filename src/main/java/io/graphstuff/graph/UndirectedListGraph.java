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

/**
 * An adjacency-list graph whose edges are two-way: every insertion stores the edge in both
 * directions with the same weight.
 */
public final class UndirectedListGraph<V, E> extends ListGraph<V, E> {

  public UndirectedListGraph() {}

  /**
   * Adds an edge between {@code a} and {@code b}, stored as {@code a -> b} and {@code b -> a}. A
   * self-edge is stored twice on its node.
   *
   * @throws IndexOutOfBoundsException if either node does not exist
   */
  public void addEdge(int a, int b, E weight) {
    // Validate both endpoints up front so a failed insertion leaves no half-edge.
    checkElementIndex(a, nodeCount(), "a");
    checkElementIndex(b, nodeCount(), "b");
    appendEdge(a, b, weight);
    appendEdge(b, a, weight);
  }

  @Override
  public boolean isDirected() {
    return false;
  }
}
