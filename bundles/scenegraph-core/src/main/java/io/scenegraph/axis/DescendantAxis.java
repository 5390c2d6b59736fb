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

/**
 * Read-only depth first traversal yielding each descendant of the start node with the value of its
 * parent.
 *
 * @param <T> value type
 */
public final class DescendantAxis<T> extends AbstractDescendantAxis<T, Edge<T>> {

  /**
   * Constructor initializing internal state.
   *
   * @param store the graph's nodes
   * @param start the node whose descendants are visited
   */
  public DescendantAxis(final NodeStore<T> store, final NodeIndex start) {
    super(store, start);
  }

  @Override
  protected Edge<T> toElement(final NodeIndex parentIndex, final NodeIndex index, final Node<T> node) {
    final Node<T> parent = getStore().getNode(parentIndex);
    return new Edge<>(parentIndex, parent.getValue(), index, node.getValue());
  }
}
