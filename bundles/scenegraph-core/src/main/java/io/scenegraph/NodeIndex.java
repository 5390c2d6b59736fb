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
import org.checkerframework.checker.nullness.qual.Nullable;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Index of a node in a {@link SceneGraph}: either the implicit {@link #ROOT} or a branch node,
 * which is identified by its arena {@link Handle}.
 *
 * <p>
 * Two indexes are equal if they are both the root or refer to the same handle. The root sorts
 * before every branch; branches are ordered by their handles.
 * </p>
 */
public final class NodeIndex implements Comparable<NodeIndex> {

  /** The root of every scene graph. It always exists and can never be removed. */
  public static final NodeIndex ROOT = new NodeIndex(null);

  /** Handle of a branch node, {@code null} for the root. */
  private final @Nullable Handle handle;

  private NodeIndex(final @Nullable Handle handle) {
    this.handle = handle;
  }

  /**
   * Get the index of a branch node.
   *
   * @param handle the arena handle of the node
   * @return the branch index
   */
  public static NodeIndex branch(final Handle handle) {
    return new NodeIndex(requireNonNull(handle));
  }

  public boolean isRoot() {
    return handle == null;
  }

  /**
   * Get the arena handle of a branch node.
   *
   * @return the handle
   * @throws IllegalStateException if this is the root
   */
  public Handle getHandle() {
    checkState(handle != null, "The root has no handle.");
    return handle;
  }

  @Override
  public int compareTo(final NodeIndex other) {
    if (handle == null) {
      return other.handle == null ? 0 : -1;
    }
    return other.handle == null ? 1 : handle.compareTo(other.handle);
  }

  @Override
  public boolean equals(final @Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof NodeIndex other)) {
      return false;
    }
    return handle == null ? other.handle == null : handle.equals(other.handle);
  }

  @Override
  public int hashCode() {
    return handle == null ? 0 : handle.hashCode() + 1;
  }

  @Override
  public String toString() {
    if (handle == null) {
      return "NodeIndex{Root}";
    }
    return MoreObjects.toStringHelper(this).add("branch", handle).toString();
  }
}
