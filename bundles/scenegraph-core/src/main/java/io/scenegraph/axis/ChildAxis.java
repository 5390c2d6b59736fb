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

import static java.util.Objects.requireNonNull;

/**
 * Iterate over the values of all children starting at the first child of a node. Grandchildren
 * are not visited, self is not included.
 *
 * @param <T> value type
 */
public final class ChildAxis<T> extends AbstractAxis<T> {

  /** The graph's nodes. */
  private final NodeStore<T> store;

  /** Structural modification count of the graph at creation time. */
  private final long expectedModificationCount;

  /** The next child to visit. */
  private @Nullable Handle nextChild;

  /**
   * Constructor initializing internal state.
   *
   * @param store the graph's nodes
   * @param firstChild first child of the parent, {@code null} if it has none
   */
  public ChildAxis(final NodeStore<T> store, final @Nullable Handle firstChild) {
    this.store = requireNonNull(store);
    expectedModificationCount = store.getModificationCount();
    nextChild = firstChild;
  }

  @Override
  protected T nextNode() {
    checkForComodification(store, expectedModificationCount);
    if (nextChild == null) {
      return done();
    }
    final Node<T> child = store.getNode(NodeIndex.branch(nextChild));
    nextChild = child.getRightSibling();
    return child.getValue();
  }
}
