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
import io.scenegraph.exception.SceneGraphCorruptionException;
import io.scenegraph.utils.Pair;

/**
 * The view of a scene graph's node records the axes traverse. Implemented by the graph itself and
 * never handed out to callers.
 *
 * @param <T> value type
 */
public interface NodeStore<T> {

  /**
   * Resolve a node record; the root record for {@link NodeIndex#ROOT}.
   *
   * @param index the node index
   * @return the node record
   * @throws SceneGraphCorruptionException if a linked node does not exist
   */
  Node<T> getNode(NodeIndex index);

  /**
   * Resolve two distinct branch records at once.
   *
   * @param first handle of the first node
   * @param second handle of the second node
   * @return both records, neither {@code null}
   * @throws IllegalArgumentException if both handles are equal
   * @throws SceneGraphCorruptionException if a linked node does not exist
   */
  Pair<Node<T>, Node<T>> getNodePair(Handle first, Handle second);

  /**
   * Remove a branch record from the arena and clear its own links. The links of other records
   * are not touched.
   *
   * @param handle the handle of the node
   * @return the removed record
   * @throws SceneGraphCorruptionException if the node does not exist
   */
  Node<T> removeNode(Handle handle);

  /**
   * Counter which changes with every structural modification.
   *
   * @return the modification count
   */
  long getModificationCount();

  /**
   * Called once by a {@link DetachAxis} which has removed its whole subtree.
   *
   * @param axis the finished axis
   */
  void detachFinished(DetachAxis<T> axis);
}
