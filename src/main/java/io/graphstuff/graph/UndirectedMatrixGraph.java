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

/** A matrix graph with two-way, unweighted edges. */
public final class UndirectedMatrixGraph<V> extends MatrixGraph<V> {

  public UndirectedMatrixGraph() {}

  /** Adds the edge between {@code x} and {@code y}, setting both symmetric cells. */
  public void addEdge(int x, int y) {
    checkElementIndex(y, nodeCount(), "y");
    setWeight(x, y, 1);
    setWeight(y, x, 1);
  }

  @Override
  public boolean isDirected() {
    return false;
  }
}
