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

package io.scenegraph.axis;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.testing.IteratorFeature;
import com.google.common.collect.testing.IteratorTester;
import io.scenegraph.NodeIndex;
import io.scenegraph.SceneGraph;
import io.scenegraph.TestHelper;
import io.scenegraph.exception.NodeNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DescendantAxisTest {

  private static final int ITERATIONS = 5;

  private TestHelper sample;

  private SceneGraph<String> graph;

  @BeforeEach
  void setUp() {
    sample = TestHelper.createSampleGraph();
    graph = sample.graph;
  }

  @Test
  void testIterate() {
    final ImmutableList<Edge<String>> expected = ImmutableList.of(
        new Edge<>(NodeIndex.ROOT, "root", sample.a, "A"),
        new Edge<>(sample.a, "A", sample.a1, "A1"),
        new Edge<>(sample.a, "A", sample.a2, "A2"),
        new Edge<>(sample.a2, "A2", sample.a21, "A21"),
        new Edge<>(NodeIndex.ROOT, "root", sample.b, "B"),
        new Edge<>(NodeIndex.ROOT, "root", sample.c, "C"),
        new Edge<>(sample.c, "C", sample.c1, "C1"));

    new IteratorTester<>(ITERATIONS, IteratorFeature.UNMODIFIABLE, expected, IteratorTester.KnownOrder.KNOWN_ORDER) {
      @Override
      protected Iterator<Edge<String>> newTargetIterator() {
        return graph.iter();
      }
    }.test();
  }

  @Test
  void testIterateFromNode() {
    final ImmutableList<Edge<String>> expected = ImmutableList.of(
        new Edge<>(sample.a, "A", sample.a1, "A1"),
        new Edge<>(sample.a, "A", sample.a2, "A2"),
        new Edge<>(sample.a2, "A2", sample.a21, "A21"));

    new IteratorTester<>(ITERATIONS, IteratorFeature.UNMODIFIABLE, expected, IteratorTester.KnownOrder.KNOWN_ORDER) {
      @Override
      protected Iterator<Edge<String>> newTargetIterator() {
        try {
          return graph.iterFromNode(sample.a);
        } catch (final NodeNotFoundException e) {
          throw new AssertionError(e);
        }
      }
    }.test();
  }

  @Test
  void testIterateFromLeaf() throws NodeNotFoundException {
    final DescendantAxis<String> axis = graph.iterFromNode(sample.b);

    assertFalse(axis.hasNext());
    assertThrows(NoSuchElementException.class, axis::next);
  }

  @Test
  void testIterateFromMissingNode() {
    graph.remove(sample.c);

    assertEquals(sample.c1,
        assertThrows(NodeNotFoundException.class, () -> graph.iterFromNode(sample.c1)).getNode());
  }

  @Test
  void testPeek() {
    final DescendantAxis<String> axis = graph.iter();

    assertEquals("A", axis.peek().child());
    assertEquals("A", axis.next().child());
    assertEquals("A1", axis.peek().child());
  }

  @Test
  void testDeepChainDoesNotOverflow() throws Exception {
    final SceneGraph<Integer> deep = new SceneGraph<>(-1);
    NodeIndex current = NodeIndex.ROOT;
    for (int i = 0; i < 100_000; i++) {
      current = deep.attach(current, i);
    }

    int expected = 0;
    for (final Edge<Integer> edge : deep) {
      assertEquals(expected - 1, edge.parent());
      assertEquals(expected++, edge.child());
    }
    assertEquals(100_000, expected);
  }
}
