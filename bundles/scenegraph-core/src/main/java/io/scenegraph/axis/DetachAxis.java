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
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

import static java.util.Objects.requireNonNull;

/**
 * Depth first traversal which removes every node it visits from the graph and yields it as a
 * {@link DetachedNode}. The order is the same preorder as the one of {@link DescendantAxis}.
 *
 * <p>
 * The subtree must already be unlinked from its parent when the axis is created, it is handed in
 * as the handle of its first top-level node. A node is taken out of the arena and unlinked as soon as
 * it is scheduled, so the stack keeps the links still to be followed.
 * </p>
 *
 * <p>
 * A detaching traversal which is abandoned early still removes its whole subtree: {@link #close()}
 * drains the remaining nodes, and the owning graph drains a still open axis before it performs any
 * other operation. Use it in a try-with-resources block when not consuming it completely.
 * </p>
 *
 * @param <T> value type
 */
public final class DetachAxis<T> extends AbstractAxis<DetachedNode<T>> implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(DetachAxis.class);

  /** The graph's nodes. */
  private final NodeStore<T> store;

  /** Pending removed records with their former parents. */
  private final Deque<Frame<T>> stack;

  /** Whether the store has been told that the subtree is gone. */
  private boolean finished;

  /**
   * Constructor initializing internal state.
   *
   * @param store the graph's nodes
   * @param parent former parent of the subtree's top-level nodes
   * @param firstChild first top-level node of the subtree, {@code null} for an empty subtree
   */
  public DetachAxis(final NodeStore<T> store, final NodeIndex parent, final @Nullable Handle firstChild) {
    this.store = requireNonNull(store);
    requireNonNull(parent);
    stack = new ArrayDeque<>();
    if (firstChild != null) {
      schedule(parent, firstChild);
    }
  }

  @Override
  protected DetachedNode<T> nextNode() {
    final Frame<T> frame = stack.poll();
    if (frame == null) {
      finish();
      return done();
    }

    final NodeIndex index = NodeIndex.branch(frame.handle());

    // If there's a sibling, push it onto the to do list.
    if (frame.rightSibling() != null) {
      schedule(frame.parent(), frame.rightSibling());
    }

    // Children are pushed last, so they are detached before the remaining siblings.
    if (frame.firstChild() != null) {
      schedule(index, frame.firstChild());
    }

    return new DetachedNode<>(frame.parent(), index, frame.value());
  }

  private void schedule(final NodeIndex parent, final Handle handle) {
    // Links are read first, the store unlinks the record when removing it.
    final Node<T> node = store.getNode(NodeIndex.branch(handle));
    final Handle rightSibling = node.getRightSibling();
    final Handle firstChild = node.getFirstChild();
    store.removeNode(handle);
    stack.push(new Frame<>(parent, handle, node.getValue(), rightSibling, firstChild));
  }

  /**
   * Removes all nodes not yet yielded.
   */
  public void drain() {
    if (!stack.isEmpty()) {
      LOGGER.debug("Draining abandoned detaching traversal, {} pending frames", stack.size());
    }
    while (hasNext()) {
      next();
    }
  }

  private void finish() {
    if (!finished) {
      finished = true;
      store.detachFinished(this);
    }
  }

  /**
   * Drains the traversal, removing every node of the subtree which has not been yielded yet.
   */
  @Override
  public void close() {
    drain();
  }

  private record Frame<T>(NodeIndex parent, Handle handle, T value, @Nullable Handle rightSibling,
      @Nullable Handle firstChild) {
  }
}
