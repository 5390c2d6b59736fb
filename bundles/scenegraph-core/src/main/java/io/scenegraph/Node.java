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

import com.google.common.base.MoreObjects;
import io.scenegraph.arena.Handle;
import io.scenegraph.axis.ChildAxis;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A node of a {@link SceneGraph}: the value placed into the graph together with the links to its
 * parent, its first and last child and its left and right sibling.
 *
 * <p>
 * Children of a node form a doubly linked list in insertion order. The first child has no left
 * sibling, the last child has no right sibling. First and last child are either both set or both
 * unset. The links are maintained by the owning graph only; the value can be replaced freely.
 * </p>
 *
 * @param <T> value type
 */
public final class Node<T> {

  /** The value contained within the node. */
  private T value;

  /** Parent of this node, {@code null} only for the record holding the root. */
  private @Nullable NodeIndex parent;

  /** Pointer to the first child of the current node. */
  private @Nullable Handle firstChild;

  /** Pointer to the last child of the current node. */
  private @Nullable Handle lastChild;

  /** Pointer to the left sibling of the current node. */
  private @Nullable Handle leftSibling;

  /** Pointer to the right sibling of the current node. */
  private @Nullable Handle rightSibling;

  /** Number of children. */
  private int childCount;

  Node(final T value, final @Nullable NodeIndex parent) {
    this.value = requireNonNull(value);
    this.parent = parent;
  }

  public T getValue() {
    return value;
  }

  /**
   * Replaces the value of this node.
   *
   * @param value the new value
   * @return the previous value
   */
  public T setValue(final T value) {
    final T previous = this.value;
    this.value = requireNonNull(value);
    return previous;
  }

  /**
   * Returns the index of the parent.
   *
   * @return the parent index
   */
  public NodeIndex getParent() {
    return requireNonNull(parent, "The root has no parent.");
  }

  public boolean hasChildren() {
    return firstChild != null;
  }

  public @NonNegative int getChildCount() {
    return childCount;
  }

  public @Nullable Handle getFirstChild() {
    return firstChild;
  }

  public @Nullable Handle getLastChild() {
    return lastChild;
  }

  public @Nullable Handle getLeftSibling() {
    return leftSibling;
  }

  public @Nullable Handle getRightSibling() {
    return rightSibling;
  }

  public boolean hasLeftSibling() {
    return leftSibling != null;
  }

  public boolean hasRightSibling() {
    return rightSibling != null;
  }

  /**
   * Iterate over the direct children of this node. Descendants further down are not visited, use
   * {@link SceneGraph#iterFromNode(NodeIndex)} for a depth first traversal.
   *
   * <p>
   * The graph must be the one this node belongs to.
   * </p>
   *
   * @param graph the graph owning this node
   * @return iterator over the values of the children
   */
  public ChildAxis<T> iterChildren(final SceneGraph<T> graph) {
    return graph.childAxis(this);
  }

  void setParent(final NodeIndex parent) {
    this.parent = parent;
  }

  void setFirstChild(final @Nullable Handle firstChild) {
    this.firstChild = firstChild;
  }

  void setLastChild(final @Nullable Handle lastChild) {
    this.lastChild = lastChild;
  }

  void setLeftSibling(final @Nullable Handle leftSibling) {
    this.leftSibling = leftSibling;
  }

  void setRightSibling(final @Nullable Handle rightSibling) {
    this.rightSibling = rightSibling;
  }

  void incrementChildCount() {
    childCount++;
  }

  void decrementChildCount() {
    childCount--;
  }

  void clearChildren() {
    firstChild = null;
    lastChild = null;
    childCount = 0;
  }

  /**
   * Clear all sibling and child links of a record which leaves the graph.
   */
  void unlink() {
    leftSibling = null;
    rightSibling = null;
    clearChildren();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("parent", parent)
                      .add("firstChild", firstChild)
                      .add("lastChild", lastChild)
                      .add("leftSibling", leftSibling)
                      .add("rightSibling", rightSibling)
                      .add("childCount", childCount)
                      .toString();
  }
}
