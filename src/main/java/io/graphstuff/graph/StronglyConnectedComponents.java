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
import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.ImmutableIntArray;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;
import java.util.Iterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The strongly connected components of a graph, found with Tarjan's algorithm in a single
 * depth-first pass. Time: O(V + E) for the list form, O(V^2) for the matrix form.
 *
 * <p>Each node is labelled with the low-link value its component settled on, which is the discovery
 * index of the component's root (the first node of the component the search reached). Labels are
 * therefore not consecutive: two nodes are in the same component iff their labels are equal. The
 * root itself is available as {@link #representative}, and {@link #componentOf} gives consecutive
 * component numbers in the order the components were completed, which is a reverse topological
 * order of the condensed graph.
 */
public final class StronglyConnectedComponents {

  private static final Logger logger = LoggerFactory.getLogger(StronglyConnectedComponents.class);

  private final ImmutableIntArray labels;
  private final ImmutableIntArray representatives;
  private final ImmutableIntArray componentOf;
  private final ImmutableList<ImmutableSet<Integer>> components;

  private StronglyConnectedComponents(
      int[] labels,
      int[] representatives,
      int[] componentOf,
      ImmutableList<ImmutableSet<Integer>> components) {
    this.labels = ImmutableIntArray.copyOf(labels);
    this.representatives = ImmutableIntArray.copyOf(representatives);
    this.componentOf = ImmutableIntArray.copyOf(componentOf);
    this.components = components;
  }

  /** Computes the strongly connected components of {@code graph}. */
  public static StronglyConnectedComponents of(IndexedGraph graph) {
    StronglyConnectedComponents sccs = new SccVisitor(checkNotNull(graph, "graph")).run();
    logger.debug(
        "Found {} strongly connected components among {} nodes",
        sccs.componentCount(),
        graph.nodeCount());
    return sccs;
  }

  /** Returns the component label of every node, indexed by node. */
  public ImmutableIntArray labels() {
    return labels;
  }

  public int label(int node) {
    checkElementIndex(node, labels.length(), "node");
    return labels.get(node);
  }

  /** Returns the root node of the component containing {@code node}. */
  public int representative(int node) {
    checkElementIndex(node, representatives.length(), "node");
    return representatives.get(node);
  }

  /** Returns the number, in {@code [0, componentCount())}, of the component of {@code node}. */
  public int componentOf(int node) {
    checkElementIndex(node, componentOf.length(), "node");
    return componentOf.get(node);
  }

  public boolean inSameComponent(int a, int b) {
    return label(a) == label(b);
  }

  public int componentCount() {
    return components.size();
  }

  /** Returns the components, each as a set of node indices, in the order they were completed. */
  public ImmutableList<ImmutableSet<Integer>> components() {
    return components;
  }

  @Override
  public String toString() {
    return "StronglyConnectedComponents" + components;
  }

  /**
   * Tarjan's algorithm with the recursion unrolled onto an explicit stack of frames, so that deep
   * graphs cannot overflow the call stack.
   *
   * <p>Per node it tracks the discovery index (-1 while unvisited), the low-link value, and whether
   * the node is on the stack of nodes whose component is still open. When a node finishes with its
   * low-link equal to its discovery index it is the root of a component, which is popped off that
   * stack down to and including the root.
   */
  private static final class SccVisitor {

    private final IndexedGraph graph;
    private final int[] index;
    private final int[] low;
    private final int[] representatives;
    private final int[] componentOf;
    private final BitSet onStack = new BitSet();
    private final Deque<Integer> open = new ArrayDeque<>();
    private final Deque<Frame> frames = new ArrayDeque<>();
    private final ImmutableList.Builder<ImmutableSet<Integer>> components = ImmutableList.builder();
    private int counter = 0;
    private int componentCount = 0;

    SccVisitor(IndexedGraph graph) {
      this.graph = graph;
      int n = graph.nodeCount();
      this.index = new int[n];
      this.low = new int[n];
      this.representatives = new int[n];
      this.componentOf = new int[n];
      Arrays.fill(index, -1);
    }

    StronglyConnectedComponents run() {
      for (int node = 0; node < index.length; node++) {
        if (index[node] == -1) {
          visit(node);
        }
      }
      return new StronglyConnectedComponents(low, representatives, componentOf, components.build());
    }

    private void visit(int root) {
      enter(root);
      while (!frames.isEmpty()) {
        Frame frame = frames.peek();
        int at = frame.node;
        if (frame.successors.hasNext()) {
          int next = frame.successors.next();
          if (index[next] == -1) {
            enter(next);
          } else if (onStack.get(next)) {
            low[at] = Math.min(low[at], index[next]);
          }
          continue;
        }

        frames.pop();
        if (low[at] == index[at]) {
          collect(at);
        }
        if (!frames.isEmpty()) {
          int parent = frames.peek().node;
          low[parent] = Math.min(low[parent], low[at]);
        }
      }
    }

    private void enter(int node) {
      index[node] = counter;
      low[node] = counter;
      counter++;
      open.push(node);
      onStack.set(node);
      frames.push(new Frame(node, graph.neighbors(node).iterator()));
    }

    private void collect(int root) {
      ImmutableSet.Builder<Integer> component = ImmutableSet.builder();
      int node;
      do {
        node = open.pop();
        onStack.clear(node);
        low[node] = index[root];
        representatives[node] = root;
        componentOf[node] = componentCount;
        component.add(node);
      } while (node != root);
      componentCount++;
      components.add(component.build());
    }
  }

  private static final class Frame {
    final int node;
    final Iterator<Integer> successors;

    Frame(int node, Iterator<Integer> successors) {
      this.node = node;
      this.successors = successors;
    }
  }
}
