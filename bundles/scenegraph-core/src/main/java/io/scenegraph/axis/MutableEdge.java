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

import com.google.common.base.MoreObjects;
import io.scenegraph.Node;
import io.scenegraph.NodeIndex;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A node yielded by a mutable traversal. Both the node's and its parent's value can be replaced;
 * the changes are written straight into the graph.
 *
 * @param <T> value type
 */
public final class MutableEdge<T> {

  private final NodeIndex parentIndex;

  private final Node<T> parent;

  private final NodeIndex index;

  private final Node<T> child;

  MutableEdge(final NodeIndex parentIndex, final Node<T> parent, final NodeIndex index, final Node<T> child) {
    checkArgument(parent != child, "parent and child must be distinct nodes");
    this.parentIndex = parentIndex;
    this.parent = parent;
    this.index = index;
    this.child = child;
  }

  public NodeIndex getParentIndex() {
    return parentIndex;
  }

  public NodeIndex getIndex() {
    return index;
  }

  public T getParent() {
    return parent.getValue();
  }

  public T getChild() {
    return child.getValue();
  }

  /**
   * Replace the value of the parent.
   *
   * @param value the new value
   * @return the previous value
   */
  public T setParent(final T value) {
    return parent.setValue(value);
  }

  /**
   * Replace the value of the node.
   *
   * @param value the new value
   * @return the previous value
   */
  public T setChild(final T value) {
    return child.setValue(value);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("parentIndex", parentIndex).add("index", index).toString();
  }
}
