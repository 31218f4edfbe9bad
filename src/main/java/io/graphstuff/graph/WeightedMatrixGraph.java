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

/**
 * A matrix graph whose edges carry explicit positive weights. Only weighted graphs expose {@link
 * #edgeWeight}; unweighted graphs store every edge with weight 1.
 */
public abstract class WeightedMatrixGraph<V> extends MatrixGraph<V> {

  WeightedMatrixGraph() {}

  /** Returns the weight of the edge {@code x -> y}, or 0 if there is none. */
  public int edgeWeight(int x, int y) {
    return weight(x, y);
  }
}
