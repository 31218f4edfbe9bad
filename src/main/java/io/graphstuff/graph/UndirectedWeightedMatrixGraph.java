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

/** A matrix graph with two-way, weighted edges. */
public final class UndirectedWeightedMatrixGraph<V> extends WeightedMatrixGraph<V> {

  public UndirectedWeightedMatrixGraph() {}

  /**
   * Adds the edge between {@code x} and {@code y} with the same weight in both directions,
   * replacing the weight of any existing one.
   *
   * @throws IllegalArgumentException if {@code weight} is not positive
   */
  public void addEdge(int x, int y, int weight) {
    checkElementIndex(y, nodeCount(), "y");
    checkArgument(weight > 0, "weight must be positive (0 means no edge): %s", weight);
    setWeight(x, y, weight);
    setWeight(y, x, weight);
  }

  @Override
  public boolean isDirected() {
    return false;
  }
}
