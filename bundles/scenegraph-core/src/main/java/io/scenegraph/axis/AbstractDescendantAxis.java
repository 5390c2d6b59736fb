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

import io.scenegraph.Node;
import io.scenegraph.NodeIndex;
import io.scenegraph.arena.Handle;

import java.util.ArrayDeque;
import java.util.Deque;

import static java.util.Objects.requireNonNull;

/**
 * Iterate over all descendants of a start node in preorder: a node comes before its children, a
 * node's whole subtree before its right sibling and siblings in insertion order. The start node
 * itself is not included.
 *
 * <p>
 * The traversal keeps an explicit stack instead of recursing, so the call depth does not depend on
 * the depth of the tree. For each visited node its right sibling is pushed first and its first
 * child on top of it, thus the children are popped before the remaining siblings.
 * </p>
 *
 * @param <T> value type of the graph
 * @param <E> element type yielded
 */
public abstract class AbstractDescendantAxis<T, E> extends AbstractAxis<E> {

  /** Pending (parent, node) pairs. */
  private final Deque<Frame> stack;

  /** The graph's nodes. */
  private final NodeStore<T> store;

  /** Structural modification count of the graph at creation time. */
  private final long expectedModificationCount;

  /**
   * Constructor initializing internal state.
   *
   * @param store the graph's nodes
   * @param start the node whose descendants are visited
   */
  protected AbstractDescendantAxis(final NodeStore<T> store, final NodeIndex start) {
    this.store = requireNonNull(store);
    expectedModificationCount = store.getModificationCount();
    stack = new ArrayDeque<>();
    final Handle firstChild = store.getNode(requireNonNull(start)).getFirstChild();
    if (firstChild != null) {
      stack.push(new Frame(start, firstChild));
    }
  }

  @Override
  protected final E nextNode() {
    checkForComodification(store, expectedModificationCount);

    final Frame frame = stack.poll();
    if (frame == null) {
      return done();
    }

    final NodeIndex index = NodeIndex.branch(frame.node());
    final Node<T> node = store.getNode(index);

    // Remaining siblings are visited after the subtree of the current node.
    final Handle rightSibling = node.getRightSibling();
    if (rightSibling != null) {
      stack.push(new Frame(frame.parent(), rightSibling));
    }

    final Handle firstChild = node.getFirstChild();
    if (firstChild != null) {
      stack.push(new Frame(index, firstChild));
    }

    return toElement(frame.parent(), index, node);
  }

  /**
   * Create the element yielded for a visited node.
   *
   * @param parentIndex index of the parent
   * @param index index of the visited node
   * @param node the visited node
   * @return the element
   */
  protected abstract E toElement(NodeIndex parentIndex, NodeIndex index, Node<T> node);

  protected final NodeStore<T> getStore() {
    return store;
  }

  private record Frame(NodeIndex parent, Handle node) {
  }
}
