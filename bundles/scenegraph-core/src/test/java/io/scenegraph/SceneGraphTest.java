/*
 * Copyright (c) 2026, The scenegraph authors
 *
 * Redistribution and use in source and binary forms, with or without modification, are permitted
 * provided that the following conditions are met:
 *   * Redistributions of source code must retain the above copyright notice, this list of
 *     conditions and the following disclaimer.
 *   * Redistributions in binary form must reproduce the above copyright notice, this list of
 *     conditions and the following disclaimer in the documentation and/or other materials
 *     provided with the distribution.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND ANY EXPRESS OR
 * IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND
 * FITNESS FOR A PARTICULAR PURPOSE ARE DISCLAIMED.
 */

package io.scenegraph;

import io.scenegraph.axis.DetachAxis;
import io.scenegraph.axis.Edge;
import io.scenegraph.exception.NodeNotFoundException;
import io.scenegraph.exception.ParentNotFoundException;
import io.scenegraph.exception.SceneGraphException;
import io.scenegraph.exception.SceneGraphUsageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SceneGraphTest {

  private TestHelper sample;

  private SceneGraph<String> graph;

  @BeforeEach
  void setUp() {
    sample = TestHelper.createSampleGraph();
    graph = sample.graph;
  }

  private Node<String> node(final NodeIndex index) {
    return graph.get(index).orElseThrow();
  }

  @Nested
  @DisplayName("Attaching")
  class Attaching {

    @Test
    void testAttachBuildsPreorder() {
      assertEquals(TestHelper.PREORDER, TestHelper.values(graph));
      assertEquals(7, graph.len());
      assertFalse(graph.isEmpty());
      assertEquals("root", graph.root());
    }

    @Test
    void testFreshGraphIsEmpty() {
      final SceneGraph<Integer> empty = new SceneGraph<>(0);

      assertTrue(empty.isEmpty());
      assertEquals(0, empty.len());
      assertFalse(empty.iter().hasNext());
      assertTrue(empty.contains(NodeIndex.ROOT));
    }

    @Test
    void testSiblingLinks() {
      final Node<String> a1 = node(sample.a1);
      final Node<String> a2 = node(sample.a2);
      final Node<String> a = node(sample.a);

      assertEquals(sample.a2.getHandle(), a1.getRightSibling());
      assertEquals(sample.a1.getHandle(), a2.getLeftSibling());
      assertFalse(a1.hasLeftSibling());
      assertFalse(a2.hasRightSibling());
      assertEquals(sample.a1.getHandle(), a.getFirstChild());
      assertEquals(sample.a2.getHandle(), a.getLastChild());
      assertEquals(2, a.getChildCount());
      assertEquals(sample.a, a1.getParent());
      assertEquals(NodeIndex.ROOT, a.getParent());
    }

    @Test
    void testAttachToMissingParent() throws ParentNotFoundException {
      final NodeIndex stale = sample.b;
      graph.remove(stale);
      final long modifications = graph.getModificationCount();

      final ParentNotFoundException e =
          assertThrows(ParentNotFoundException.class, () -> graph.attach(stale, "X"));

      assertEquals(stale, e.getParent());
      assertEquals(6, graph.len());
      assertEquals(modifications, graph.getModificationCount());
    }

    @Test
    void testNullValueIsRejected() {
      assertThrows(NullPointerException.class, () -> graph.attachAtRoot(null));
      assertThrows(NullPointerException.class, () -> graph.attach(sample.a, null));
    }

    @Test
    void testStaleIndexDoesNotResolveToReusedSlot() {
      graph.remove(sample.b);
      final NodeIndex fresh = graph.attachAtRoot("D");

      assertEquals(sample.b.getHandle().getSlot(), fresh.getHandle().getSlot());
      assertFalse(graph.contains(sample.b));
      assertTrue(graph.get(sample.b).isEmpty());
      assertEquals("D", node(fresh).getValue());
    }
  }

  @Nested
  @DisplayName("Lookup")
  class Lookup {

    @Test
    void testGetRootIsEmpty() {
      assertTrue(graph.get(NodeIndex.ROOT).isEmpty());
      assertTrue(graph.parent(NodeIndex.ROOT).isEmpty());
    }

    @Test
    void testParent() {
      assertEquals(Optional.of(sample.a2), graph.parent(sample.a21));
      assertEquals(Optional.of(NodeIndex.ROOT), graph.parent(sample.c));
    }

    @Test
    void testSetValues() {
      assertEquals("A1", node(sample.a1).setValue("a1"));
      assertEquals("root", graph.setRoot("ROOT"));

      assertEquals("a1", node(sample.a1).getValue());
      assertEquals("ROOT", graph.root());
    }
  }

  @Nested
  @DisplayName("Removing")
  class Removing {

    @Test
    void testRemoveMiddleChild() throws ParentNotFoundException {
      final NodeIndex x = graph.attach(sample.a, "X");
      final NodeIndex y = graph.attach(sample.a, "Y");

      graph.remove(sample.a2);

      assertEquals(List.of("A", "A1", "X", "Y", "B", "C", "C1"), TestHelper.values(graph));
      assertEquals(x.getHandle(), node(sample.a1).getRightSibling());
      assertEquals(sample.a1.getHandle(), node(x).getLeftSibling());
      assertEquals(y.getHandle(), node(sample.a).getLastChild());
      assertEquals(3, node(sample.a).getChildCount());
      assertFalse(graph.contains(sample.a21));
    }

    @Test
    void testRemoveFirstAndLastChild() {
      graph.remove(sample.a);
      assertEquals(sample.b.getHandle(), graph.getRootNode().getFirstChild());
      assertFalse(node(sample.b).hasLeftSibling());

      graph.remove(sample.c);
      assertEquals(sample.b.getHandle(), graph.getRootNode().getLastChild());
      assertFalse(node(sample.b).hasRightSibling());
      assertEquals(List.of("B"), TestHelper.values(graph));
    }

    @Test
    void testRemoveOnlyChild() {
      graph.remove(sample.c1);

      assertFalse(node(sample.c).hasChildren());
      assertEquals(0, node(sample.c).getChildCount());
    }

    @Test
    void testRemoveMissingNodeIsNoOp() {
      graph.remove(sample.a2);
      final long modifications = graph.getModificationCount();

      graph.remove(sample.a21);
      graph.remove(sample.a2);

      assertEquals(5, graph.len());
      assertEquals(modifications, graph.getModificationCount());
    }

    @Test
    void testRemoveRootIsRejected() {
      assertThrows(SceneGraphUsageException.class, () -> graph.remove(NodeIndex.ROOT));
      assertEquals(7, graph.len());
    }

    @Test
    void testClear() {
      graph.clear();

      assertTrue(graph.isEmpty());
      assertEquals(0, graph.len());
      assertEquals("root", graph.root());
      assertFalse(graph.contains(sample.a));

      final NodeIndex again = graph.attachAtRoot("again");
      assertEquals(List.of("again"), TestHelper.values(graph));
      assertTrue(graph.contains(again));
    }

    @Test
    void testClearManyNodes() {
      final SceneGraph<Integer> wide = new SceneGraph<>(-1);
      for (int i = 0; i < 50_000; i++) {
        wide.attachAtRoot(i);
      }
      wide.clear();

      assertTrue(wide.isEmpty());
      assertEquals(0, wide.len());
    }

    @Test
    void testRemoveDeepChain() throws ParentNotFoundException {
      final SceneGraph<Integer> deep = new SceneGraph<>(-1);
      final NodeIndex top = deep.attachAtRoot(0);
      NodeIndex current = top;
      for (int i = 1; i < 50_000; i++) {
        current = deep.attach(current, i);
      }
      assertEquals(50_000, deep.len());

      deep.remove(top);

      assertTrue(deep.isEmpty());
      assertEquals(0, deep.len());
    }
  }

  @Nested
  @DisplayName("Detaching and attaching graphs")
  class Detaching {

    @Test
    void testDetachSubtree() {
      final SceneGraph<String> detached = graph.detach(sample.a).orElseThrow();

      assertEquals("A", detached.root());
      assertEquals(List.of("A1", "A2", "A21"), TestHelper.values(detached));
      assertEquals(List.of("B", "C", "C1"), TestHelper.values(graph));
      assertEquals(3, detached.len());
      assertEquals(3, graph.len());
      assertFalse(graph.contains(sample.a1));
    }

    @Test
    void testDetachRootOrMissing() {
      assertTrue(graph.detach(NodeIndex.ROOT).isEmpty());
      graph.remove(sample.b);
      assertTrue(graph.detach(sample.b).isEmpty());
    }

    @Test
    void testDetachLeaf() {
      final SceneGraph<String> detached = graph.detach(sample.c1).orElseThrow();

      assertEquals("C1", detached.root());
      assertTrue(detached.isEmpty());
    }

    @Test
    void testAttachGraph() throws ParentNotFoundException {
      final SceneGraph<String> other = new SceneGraph<>("X");
      final NodeIndex x1 = other.attachAtRoot("X1");
      other.attach(x1, "X11");
      other.attachAtRoot("X2");

      final NodeIndex x = graph.attachGraph(sample.b, other);

      assertEquals("X", node(x).getValue());
      assertEquals(Optional.of(sample.b), graph.parent(x));
      assertEquals(List.of("A", "A1", "A2", "A21", "B", "X", "X1", "X11", "X2", "C", "C1"),
          TestHelper.values(graph));
      assertTrue(other.isEmpty());
      assertEquals(0, other.len());
      assertEquals("X", other.root());
    }

    @Test
    void testAttachGraphToMissingParent() {
      final SceneGraph<String> other = new SceneGraph<>("X");
      other.attachAtRoot("X1");
      graph.remove(sample.b);

      assertThrows(ParentNotFoundException.class, () -> graph.attachGraph(sample.b, other));
      assertEquals(1, other.len());
      assertEquals(6, graph.len());
    }

    @Test
    void testAttachGraphToItself() {
      assertThrows(IllegalArgumentException.class, () -> graph.attachGraph(sample.a, graph));
    }

    @Test
    void testDetachAndReattachRoundTrip() throws ParentNotFoundException {
      final SceneGraph<String> detached = graph.detach(sample.a).orElseThrow();
      final NodeIndex a = graph.attachGraph(NodeIndex.ROOT, detached);

      assertEquals(List.of("B", "C", "C1", "A", "A1", "A2", "A21"), TestHelper.values(graph));
      assertEquals(7, graph.len());
      assertEquals(2, node(a).getChildCount());
    }
  }

  @Nested
  @DisplayName("Moving")
  class Moving {

    @Test
    void testMoveNode() throws NodeNotFoundException {
      graph.moveNode(sample.a2, sample.b);

      assertEquals(List.of("A", "A1", "B", "A2", "A21", "C", "C1"), TestHelper.values(graph));
      assertEquals(Optional.of(sample.b), graph.parent(sample.a2));
      assertEquals("A2", node(sample.a2).getValue());
      assertEquals(1, node(sample.a).getChildCount());
      assertFalse(node(sample.a1).hasRightSibling());
    }

    @Test
    void testMoveToRoot() throws NodeNotFoundException {
      graph.moveNode(sample.a21, NodeIndex.ROOT);

      assertEquals(List.of("A", "A1", "A2", "B", "C", "C1", "A21"), TestHelper.values(graph));
      assertFalse(node(sample.a2).hasChildren());
    }

    @Test
    void testMoveToSameParentAppends() throws NodeNotFoundException {
      graph.moveNode(sample.a, NodeIndex.ROOT);

      assertEquals(List.of("B", "C", "C1", "A", "A1", "A2", "A21"), TestHelper.values(graph));
    }

    @Test
    void testMoveMissing() {
      graph.remove(sample.b);

      assertEquals(sample.b,
          assertThrows(NodeNotFoundException.class, () -> graph.moveNode(sample.b, sample.a)).getNode());
      assertEquals(sample.b,
          assertThrows(NodeNotFoundException.class, () -> graph.moveNode(sample.a, sample.b)).getNode());
      assertThrows(NodeNotFoundException.class, () -> graph.moveNode(NodeIndex.ROOT, sample.a));
      assertEquals(List.of("A", "A1", "A2", "A21", "C", "C1"), TestHelper.values(graph));
    }

    @Test
    void testMoveBelowDescendantIsRejected() {
      final long modifications = graph.getModificationCount();

      assertThrows(SceneGraphUsageException.class, () -> graph.moveNode(sample.a, sample.a21));
      assertThrows(SceneGraphUsageException.class, () -> graph.moveNode(sample.a, sample.a));

      assertEquals(TestHelper.PREORDER, TestHelper.values(graph));
      assertEquals(modifications, graph.getModificationCount());
    }
  }

  @Nested
  @DisplayName("Traversal bookkeeping")
  class Traversal {

    @Test
    void testIterableInForEach() {
      final List<String> parents = new ArrayList<>();
      for (final Edge<String> edge : graph) {
        parents.add(edge.parent());
      }
      assertEquals(List.of("root", "A", "A", "A2", "root", "root", "C"), parents);
    }

    @Test
    void testModificationDuringTraversalFailsFast() {
      final Iterator<Edge<String>> axis = graph.iter();
      axis.next();
      graph.attachAtRoot("D");

      assertThrows(ConcurrentModificationException.class, axis::next);
    }

    @Test
    void testValueChangesDoNotInvalidateTraversals() {
      final Iterator<Edge<String>> axis = graph.iter();
      axis.next();
      node(sample.b).setValue("b");

      axis.forEachRemaining(edge -> { });
    }

    @Test
    void testOutOfOrderVisitsEveryNode() {
      final Map<NodeIndex, String> seen = new HashMap<>();
      graph.iterOutOfOrder().forEachRemaining(entry -> seen.put(entry.getKey(), entry.getValue()));

      assertEquals(7, seen.size());
      assertEquals("A21", seen.get(sample.a21));
      assertFalse(seen.containsKey(NodeIndex.ROOT));
    }

    @Test
    void testAbandonedDetachIsSettled() throws NodeNotFoundException {
      final DetachAxis<String> axis = graph.iterDetach(sample.a);
      axis.next();

      assertEquals(4, graph.len());
      assertFalse(axis.hasNext());
      assertFalse(node(sample.a).hasChildren());
      SceneGraphVerifier.verify(graph);
    }

    @Test
    void testIterChildrenOfNode() {
      final List<String> children = new ArrayList<>();
      node(sample.a).iterChildren(graph).forEachRemaining(children::add);

      assertEquals(List.of("A1", "A2"), children);
    }
  }

  @Nested
  @DisplayName("Records held after their node left the graph")
  class StaleRecords {

    private List<String> children(final Node<String> node) {
      final List<String> children = new ArrayList<>();
      node.iterChildren(graph).forEachRemaining(children::add);
      return children;
    }

    @Test
    void testIterChildrenAfterRemove() {
      final Node<String> a = node(sample.a);
      final Node<String> a2 = node(sample.a2);

      graph.remove(sample.a);

      assertEquals(List.of(), children(a));
      assertEquals(List.of(), children(a2));
      assertFalse(a.hasChildren());
      assertFalse(a.hasRightSibling());
      assertEquals(0, a2.getChildCount());
      SceneGraphVerifier.verify(graph);
    }

    @Test
    void testIterChildrenAfterDetach() {
      final Node<String> a = node(sample.a);
      final Node<String> a2 = node(sample.a2);

      graph.detach(sample.a).orElseThrow();

      assertEquals(List.of(), children(a));
      assertEquals(List.of(), children(a2));
    }

    @Test
    void testIterChildrenAfterDetachingTraversal() throws NodeNotFoundException {
      final Node<String> a2 = node(sample.a2);

      graph.iterDetach(sample.a).forEachRemaining(detached -> { });

      assertEquals(List.of(), children(a2));
      assertFalse(a2.hasLeftSibling());
    }

    @Test
    void testIterChildrenAfterClear() {
      final Node<String> c = node(sample.c);

      graph.clear();

      assertEquals(List.of(), children(c));
      assertFalse(c.hasLeftSibling());
    }
  }

  @Test
  @DisplayName("Random operations keep the graph consistent")
  void testRandomOperations() throws SceneGraphException {
    final Random random = new Random(42L);
    final SceneGraph<Integer> randomGraph = new SceneGraph<>(0);
    final List<NodeIndex> indexes = new ArrayList<>();
    indexes.add(NodeIndex.ROOT);

    for (int step = 0; step < 2_000; step++) {
      final NodeIndex target = indexes.get(random.nextInt(indexes.size()));
      final int operation = random.nextInt(10);
      if (operation < 5 || indexes.size() < 3) {
        if (randomGraph.contains(target)) {
          indexes.add(randomGraph.attach(target, step));
        }
      } else if (operation < 7) {
        if (!target.isRoot()) {
          randomGraph.remove(target);
        }
      } else if (operation < 9) {
        final NodeIndex newParent = indexes.get(random.nextInt(indexes.size()));
        if (randomGraph.contains(target) && randomGraph.contains(newParent) && !target.isRoot()
            && !isAncestorOrSelf(randomGraph, target, newParent)) {
          randomGraph.moveNode(target, newParent);
        }
      } else {
        final Optional<SceneGraph<Integer>> detached = randomGraph.detach(target);
        if (detached.isPresent()) {
          indexes.add(randomGraph.attachGraph(NodeIndex.ROOT, detached.get()));
        }
      }
      indexes.removeIf(index -> !randomGraph.contains(index));
      SceneGraphVerifier.verify(randomGraph);
    }

    int count = 0;
    for (final Edge<Integer> ignored : randomGraph) {
      count++;
    }
    assertEquals(randomGraph.len(), count);
    assertNotEquals(0L, randomGraph.getModificationCount());
  }

  private static boolean isAncestorOrSelf(final SceneGraph<?> graph, final NodeIndex ancestor, final NodeIndex node) {
    for (NodeIndex current = node; !current.isRoot(); current = graph.parent(current).orElseThrow()) {
      if (current.equals(ancestor)) {
        return true;
      }
    }
    return false;
  }

  @Test
  void testToString() {
    assertTrue(graph.toString().contains("len=7"));
  }
}
