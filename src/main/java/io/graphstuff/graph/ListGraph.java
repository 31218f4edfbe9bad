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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An adjacency-list graph: each node owns a payload value and a growing, ordered list of outgoing
 * {@link Edge edges}. Suited to sparse graphs; adding a node is O(1) amortized.
 *
 * <p>Nodes are never removed. Self-edges are permitted. Adding the same edge twice stores two edge
 * records; {@link #neighbors} then reports the destination twice, while traversals still visit it
 * once.
 *
 * <p>Whether edges are directed is fixed by the concrete class: see {@link DirectedListGraph} and
 * {@link UndirectedListGraph}, which expose the matching {@code addEdge}.
 *
 * @param <V> the node payload type
 * @param <E> the edge weight type
 */
public abstract class ListGraph<V, E> implements IndexedGraph {

  /** A node of a list graph: its payload and its outgoing edges, in insertion order. */
  public static final class Node<V, E> {
    private final V value;
    private final List<Edge<E>> edges = new ArrayList<>();

    private Node(V value) {
      this.value = value;
    }

    public V value() {
      return value;
    }

    /** Returns an unmodifiable view of the outgoing edges. */
    public List<Edge<E>> edges() {
      return Collections.unmodifiableList(edges);
    }

    @Override
    public String toString() {
      return "Node[" + value + ", " + edges.size() + " edges]";
    }
  }

  private final List<Node<V, E>> nodes = new ArrayList<>();
  private int edgeCount;

  ListGraph() {}

  /**
   * Adds a node carrying {@code value} and returns its index. Indices are issued sequentially from
   * 0. The null pointer is not a valid value.
   */
  public int addNode(V value) {
    nodes.add(new Node<>(checkNotNull(value, "value")));
    return nodes.size() - 1;
  }

  /** Appends a one-way edge record; both endpoints must already exist. */
  final void appendEdge(int from, int to, E weight) {
    checkElementIndex(from, nodes.size(), "from");
    checkElementIndex(to, nodes.size(), "to");
    getNode(from).edges.add(new Edge<>(checkNotNull(weight, "weight"), to));
    edgeCount++;
  }

  private Node<V, E> getNode(int node) {
    checkElementIndex(node, nodes.size(), "node");
    return nodes.get(node);
  }

  /** Returns an unmodifiable view of the nodes, in index order. */
  public List<Node<V, E>> nodes() {
    return Collections.unmodifiableList(nodes);
  }

  public V nodeValue(int node) {
    return getNode(node).value;
  }

  /** Returns the outgoing edges of {@code node}, in insertion order. */
  public List<Edge<E>> edges(int node) {
    return getNode(node).edges();
  }

  @Override
  public ImmutableList<Integer> neighbors(int node) {
    return ImmutableList.copyOf(Lists.transform(getNode(node).edges, Edge::target));
  }

  @Override
  public int nodeCount() {
    return nodes.size();
  }

  /** Returns the number of stored edge records; an undirected insertion stores two. */
  public int edgeCount() {
    return edgeCount;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + nodeCount() + " nodes, " + edgeCount + " edges]";
  }
}
