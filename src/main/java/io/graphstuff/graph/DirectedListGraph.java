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

/** An adjacency-list graph whose edges are one-way. */
public final class DirectedListGraph<V, E> extends ListGraph<V, E> {

  public DirectedListGraph() {}

  /**
   * Adds an edge from {@code from} to {@code to}.
   *
   * @throws IndexOutOfBoundsException if either node does not exist
   */
  public void addEdge(int from, int to, E weight) {
    appendEdge(from, to, weight);
  }

  @Override
  public boolean isDirected() {
    return true;
  }
}
