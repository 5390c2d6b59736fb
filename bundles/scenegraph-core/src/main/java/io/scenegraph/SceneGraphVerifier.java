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

import io.scenegraph.arena.Arena;
import io.scenegraph.arena.Handle;
import io.scenegraph.exception.SceneGraphCorruptionException;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Checks the linkage of a scene graph. Walks the whole tree iteratively, so it is O(n) and meant
 * for tests and debugging sessions only.
 *
 * <p>
 * A graph is consistent if for every node
 * </p>
 * <ul>
 * <li>first and last child are either both set or both unset,</li>
 * <li>following right siblings from the first child ends at the last child,</li>
 * <li>the left sibling of every child is its predecessor in that list,</li>
 * <li>every child names the node as its parent,</li>
 * <li>the child count equals the length of the child list,</li>
 * </ul>
 * <p>
 * and every node in the arena is reachable from the root exactly once.
 * </p>
 */
public final class SceneGraphVerifier {

  private SceneGraphVerifier() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Verifies a scene graph. A detaching traversal still open on the graph is drained first.
   *
   * @param graph the graph to check
   * @throws SceneGraphCorruptionException on the first inconsistency found
   */
  public static void verify(final SceneGraph<?> graph) {
    graph.settle();
    check(graph);
  }

  private static <T> void check(final SceneGraph<T> graph) {
    final Arena<Node<T>> arena = graph.getArena();
    final LongOpenHashSet visited = new LongOpenHashSet(arena.size());
    final Deque<NodeIndex> parents = new ArrayDeque<>();
    parents.push(NodeIndex.ROOT);

    while (!parents.isEmpty()) {
      final NodeIndex parentIndex = parents.pop();
      final Node<T> parent = parentIndex.isRoot() ? graph.getRootNode() : arena.get(parentIndex.getHandle());
      if (parent == null) {
        throw new SceneGraphCorruptionException(parentIndex, "node vanished during verification");
      }

      final Handle firstChild = parent.getFirstChild();
      final Handle lastChild = parent.getLastChild();
      if ((firstChild == null) != (lastChild == null)) {
        throw new SceneGraphCorruptionException(parentIndex, "only one of first and last child is set");
      }

      int count = 0;
      @Nullable Handle previous = null;
      for (Handle current = firstChild; current != null; ) {
        final NodeIndex index = NodeIndex.branch(current);
        final Node<T> node = arena.get(current);
        if (node == null) {
          throw new SceneGraphCorruptionException(index, "child of " + parentIndex + " does not exist");
        }
        if (!visited.add(current.asLong())) {
          throw new SceneGraphCorruptionException(index, "node is linked more than once");
        }
        if (!parentIndex.equals(node.getParent())) {
          throw new SceneGraphCorruptionException(index,
              "parent link " + node.getParent() + " does not match " + parentIndex);
        }
        if (!Objects.equals(previous, node.getLeftSibling())) {
          throw new SceneGraphCorruptionException(index, "left sibling does not match the preceding child");
        }
        count++;
        parents.push(index);
        previous = current;
        current = node.getRightSibling();
      }

      if (!Objects.equals(lastChild, previous)) {
        throw new SceneGraphCorruptionException(parentIndex, "last child is not the end of the sibling list");
      }
      if (count != parent.getChildCount()) {
        throw new SceneGraphCorruptionException(parentIndex,
            "child count " + parent.getChildCount() + " but " + count + " children linked");
      }
    }

    if (visited.size() != arena.size()) {
      throw new SceneGraphCorruptionException(null,
          (arena.size() - visited.size()) + " nodes are not reachable from the root");
    }
  }
}
