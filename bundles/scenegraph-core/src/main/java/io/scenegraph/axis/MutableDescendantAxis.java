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
import io.scenegraph.utils.Pair;

/**
 * Depth first traversal yielding a {@link MutableEdge} per descendant of the start node, through
 * which both the node's and its parent's value can be replaced.
 *
 * <p>
 * Parent and child of an edge are always two distinct records: for branch parents they are
 * resolved with {@link NodeStore#getNodePair}, which rejects equal handles. No node is yielded as
 * a child more than once per traversal. Replacing values is not a structural modification, any
 * attach, detach, move or remove during the traversal makes it fail fast.
 * </p>
 *
 * @param <T> value type
 */
public final class MutableDescendantAxis<T> extends AbstractDescendantAxis<T, MutableEdge<T>> {

  /**
   * Constructor initializing internal state.
   *
   * @param store the graph's nodes
   * @param start the node whose descendants are visited
   */
  public MutableDescendantAxis(final NodeStore<T> store, final NodeIndex start) {
    super(store, start);
  }

  @Override
  protected MutableEdge<T> toElement(final NodeIndex parentIndex, final NodeIndex index, final Node<T> node) {
    if (parentIndex.isRoot()) {
      return new MutableEdge<>(parentIndex, getStore().getNode(parentIndex), index, node);
    }
    final Pair<Node<T>, Node<T>> pair = getStore().getNodePair(parentIndex.getHandle(), index.getHandle());
    return new MutableEdge<>(parentIndex, pair.getFirst(), index, pair.getSecond());
  }
}
