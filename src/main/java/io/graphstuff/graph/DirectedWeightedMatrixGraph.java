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

/** A matrix graph with one-way, weighted edges. */
public final class DirectedWeightedMatrixGraph<V> extends WeightedMatrixGraph<V> {

  public DirectedWeightedMatrixGraph() {}

  /**
   * Adds the edge {@code x -> y}, replacing the weight of any existing one.
   *
   * @throws IllegalArgumentException if {@code weight} is not positive
   */
  public void addEdge(int x, int y, int weight) {
    setWeight(x, y, weight);
  }

  @Override
  public boolean isDirected() {
    return true;
  }
}
