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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import javax.annotation.Nullable;

/** An outgoing edge of an adjacency-list node: a weight and the index of the node it leads to. */
public final class Edge<E> {

  private final E weight;
  private final int target;

  Edge(E weight, int target) {
    this.weight = checkNotNull(weight, "weight");
    this.target = target;
  }

  public E weight() {
    return weight;
  }

  /** Returns the index of the destination node. */
  public int target() {
    return target;
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Edge)) {
      return false;
    }
    Edge<?> that = (Edge<?>) obj;
    return target == that.target && weight.equals(that.weight);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(weight, target);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("weight", weight).add("target", target).toString();
  }
}
