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
import com.google.common.collect.Iterators;
import com.google.common.collect.Maps;
import io.scenegraph.arena.Arena;
import io.scenegraph.arena.Handle;
import io.scenegraph.axis.ChildAxis;
import io.scenegraph.axis.DescendantAxis;
import io.scenegraph.axis.DetachAxis;
import io.scenegraph.axis.DetachedNode;
import io.scenegraph.axis.Edge;
import io.scenegraph.axis.MutableDescendantAxis;
import io.scenegraph.axis.NodeStore;
import io.scenegraph.exception.NodeNotFoundException;
import io.scenegraph.exception.ParentNotFoundException;
import io.scenegraph.exception.SceneGraphCorruptionException;
import io.scenegraph.exception.SceneGraphUsageException;
import io.scenegraph.settings.GraphSettings;
import io.scenegraph.utils.Pair;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A rose tree, similar to a genealogical tree: one root with an ordered list of children, each of
 * which may have ordered children of its own. Siblings are ordered by insertion.
 *
 * <p>
 * Every node except the root lives in a generational {@link Arena} and is addressed by a
 * {@link NodeIndex}, which stays valid until the node is detached or removed. Attaching, moving
 * and unlinking a subtree are O(1): the children of a node form a doubly linked list, so a node is
 * spliced in or out by relinking its direct neighbours only. A move additionally checks the new
 * parent's ancestors, which is O(depth). Detaching or removing a subtree frees
 * it iteratively, with no recursion, so arbitrarily deep trees are fine.
 * </p>
 *
 * <p>
 * The graph can be traversed depth first with {@link #iter()} or {@link #iterFromNode(NodeIndex)},
 * mutably with {@link #iterMut()}, over direct children with
 * {@link #iterDirectChildren(NodeIndex)}, and while taking it apart with
 * {@link #iterDetach(NodeIndex)}. There is no upward traversal, use {@link #parent(NodeIndex)}.
 * Traversals fail fast with a {@link java.util.ConcurrentModificationException} if the graph is
 * structurally modified while they are open.
 * </p>
 *
 * <p>
 * Values must not be {@code null}. A scene graph is not thread-safe.
 * </p>
 *
 * @param <T> value type
 */
public final class SceneGraph<T> implements Iterable<Edge<T>> {

  private static final Logger LOGGER = LoggerFactory.getLogger(SceneGraph.class);

  /** Storage of all non-root nodes. */
  private final Arena<Node<T>> arena;

  /** Record holding the root value and the root's children. It never enters the arena. */
  private final Node<T> root;

  /** The view handed to the axes. */
  private final NodeStore<T> store;

  /** Incremented on every structural modification. */
  private long modificationCount;

  /** A detaching traversal handed out to a caller which has not finished yet. */
  private @Nullable DetachAxis<T> pendingDetach;

  /**
   * Creates a new scene graph with the default arena capacity.
   *
   * @param rootValue value of the root
   */
  public SceneGraph(final T rootValue) {
    this(rootValue, GraphSettings.getInitialCapacity());
  }

  /**
   * Creates a new scene graph.
   *
   * @param rootValue value of the root
   * @param initialCapacity number of non-root nodes the graph can hold before growing
   */
  public SceneGraph(final T rootValue, final @NonNegative int initialCapacity) {
    arena = new Arena<>(initialCapacity);
    root = new Node<>(rootValue, null);
    store = new Store();
  }

  // ////////////////////////////////////////////////////////////
  // lookup
  // ////////////////////////////////////////////////////////////

  /**
   * Returns the number of non-root nodes in the graph.
   *
   * @return number of nodes, excluding the root
   */
  public int len() {
    settle();
    return arena.size();
  }

  /**
   * Checks if the graph contains only the root.
   *
   * @return {@code true} if the root has no children
   */
  public boolean isEmpty() {
    settle();
    return !root.hasChildren();
  }

  /**
   * Returns {@code true} if the given index refers to a node of this graph. The root is always
   * contained.
   *
   * @param index the node index
   * @return whether the node exists
   */
  public boolean contains(final NodeIndex index) {
    settle();
    return index.isRoot() || arena.contains(index.getHandle());
  }

  /**
   * Gets a node. The root is not a true node, so {@link NodeIndex#ROOT} always yields an empty
   * result; use {@link #root()} and {@link #iterDirectChildren(NodeIndex)} instead.
   *
   * <p>
   * The value of the returned node can be replaced with {@link Node#setValue(Object)}.
   * </p>
   *
   * @param index the node index
   * @return the node, empty for the root or a node which doesn't exist
   */
  public Optional<Node<T>> get(final NodeIndex index) {
    settle();
    if (index.isRoot()) {
      return Optional.empty();
    }
    return Optional.ofNullable(arena.get(index.getHandle()));
  }

  /**
   * Gets the root value.
   *
   * @return the root value
   */
  public T root() {
    return root.getValue();
  }

  /**
   * Replaces the root value.
   *
   * @param value the new root value
   * @return the previous root value
   */
  public T setRoot(final T value) {
    return root.setValue(value);
  }

  /**
   * Returns the parent of a node in O(1).
   *
   * @param index the node index
   * @return the parent index, empty for the root or a node which doesn't exist
   */
  public Optional<NodeIndex> parent(final NodeIndex index) {
    return get(index).map(Node::getParent);
  }

  /**
   * Counter which changes with every structural modification, that is every attach, detach,
   * move, remove and clear. Replacing values does not change it.
   *
   * @return the modification count
   */
  public long getModificationCount() {
    return modificationCount;
  }

  // ////////////////////////////////////////////////////////////
  // mutation
  // ////////////////////////////////////////////////////////////

  /**
   * Removes all nodes, leaving only the root in place. The arena keeps its capacity, so later
   * attaches don't have to grow it again.
   */
  public void clear() {
    settle();
    final int removed = arena.size();
    arena.handles().forEachRemaining(handle -> existingNode(handle).unlink());
    arena.clear();
    root.clearChildren();
    modificationCount++;
    if (GraphSettings.isMutationTracingEnabled()) {
      LOGGER.debug("Cleared {} nodes", removed);
    }
    verifyIfEnabled();
  }

  /**
   * Attaches a value as the last child of the root. This never fails.
   *
   * @param value the value
   * @return index of the new node
   */
  public NodeIndex attachAtRoot(final T value) {
    requireNonNull(value);
    settle();
    final NodeIndex index = insertBelow(NodeIndex.ROOT, root, value);
    afterAttach(NodeIndex.ROOT, index);
    return index;
  }

  /**
   * Attaches a value as the last child of a parent node.
   *
   * @param parent index of the parent
   * @param value the value
   * @return index of the new node
   * @throws ParentNotFoundException if the parent doesn't exist; the graph is unchanged
   */
  public NodeIndex attach(final NodeIndex parent, final T value) throws ParentNotFoundException {
    requireNonNull(parent);
    requireNonNull(value);
    settle();
    final Node<T> parentNode = lookup(parent);
    if (parentNode == null) {
      throw new ParentNotFoundException(parent);
    }
    final NodeIndex index = insertBelow(parent, parentNode, value);
    afterAttach(parent, index);
    return index;
  }

  private void afterAttach(final NodeIndex parent, final NodeIndex index) {
    modificationCount++;
    if (GraphSettings.isMutationTracingEnabled()) {
      LOGGER.debug("Attached {} below {}", index, parent);
    }
    verifyIfEnabled();
  }

  /**
   * Attaches a whole other graph below a parent node. The other root's value becomes a new node
   * at the returned index, the other graph's nodes are rebuilt below it in the same order. The
   * other graph is consumed: afterwards it only consists of its root.
   *
   * @param parent index of the parent
   * @param other the graph to attach
   * @return index of the node holding the other graph's root value
   * @throws ParentNotFoundException if the parent doesn't exist; neither graph is changed
   */
  public NodeIndex attachGraph(final NodeIndex parent, final SceneGraph<T> other)
      throws ParentNotFoundException {
    requireNonNull(parent);
    requireNonNull(other);
    checkArgument(other != this, "A scene graph can't be attached to itself.");
    settle();
    other.settle();
    final Node<T> parentNode = lookup(parent);
    if (parentNode == null) {
      throw new ParentNotFoundException(parent);
    }

    final NodeIndex newTop = insertBelow(parent, parentNode, other.root.getValue());
    final int attached = replay(other.detachChildren(NodeIndex.ROOT, other.root), NodeIndex.ROOT, newTop);

    modificationCount++;
    if (GraphSettings.isMutationTracingEnabled()) {
      LOGGER.debug("Attached graph of {} nodes at {} below {}", attached + 1, newTop, parent);
    }
    verifyIfEnabled();
    other.verifyIfEnabled();
    return newTop;
  }

  /**
   * Removes a node and its whole subtree, returning them as a new scene graph in which the
   * node's value is the root. The new graph has fresh indexes; the old ones are stale.
   *
   * @param index the node to detach
   * @return the detached subtree, empty if the index is the root or the node doesn't exist
   */
  public Optional<SceneGraph<T>> detach(final NodeIndex index) {
    requireNonNull(index);
    settle();
    if (index.isRoot()) {
      return Optional.empty();
    }

    final Handle handle = index.getHandle();
    final Node<T> node = arena.remove(handle);
    if (node == null) {
      return Optional.empty();
    }

    final SceneGraph<T> detached = new SceneGraph<>(node.getValue());
    final int descendants =
        detached.replay(new DetachAxis<>(store, index, node.getFirstChild()), index, NodeIndex.ROOT);
    adaptForRemove(node, handle);
    node.unlink();

    modificationCount++;
    if (GraphSettings.isMutationTracingEnabled()) {
      LOGGER.debug("Detached {} with {} descendants", index, descendants);
    }
    verifyIfEnabled();
    detached.verifyIfEnabled();
    return Optional.of(detached);
  }

  /**
   * Moves a node, together with its subtree, to become the last child of another parent. The
   * node keeps its index and value. If this method throws, nothing has happened to the node.
   *
   * <p>
   * Relinking is O(1), but checking that the new parent is not below the node walks up from the
   * new parent, so a move costs O(depth of the new parent) overall.
   * </p>
   *
   * @param index the node to move
   * @param newParent the new parent
   * @throws NodeNotFoundException if the node is the root or doesn't exist, or the new parent
   *         doesn't exist
   * @throws SceneGraphUsageException if the new parent is the node itself or one of its
   *         descendants
   */
  public void moveNode(final NodeIndex index, final NodeIndex newParent) throws NodeNotFoundException {
    requireNonNull(index);
    requireNonNull(newParent);
    settle();
    if (index.isRoot()) {
      throw new NodeNotFoundException(index);
    }
    final Handle handle = index.getHandle();
    final Node<T> node = arena.get(handle);
    if (node == null) {
      throw new NodeNotFoundException(index);
    }
    final Node<T> newParentNode = lookup(newParent);
    if (newParentNode == null) {
      throw new NodeNotFoundException(newParent);
    }
    checkAncestors(index, newParent);

    final NodeIndex oldParent = node.getParent();
    adaptForRemove(node, handle);
    node.setParent(newParent);
    adaptForInsert(newParentNode, handle, node);

    modificationCount++;
    if (GraphSettings.isMutationTracingEnabled()) {
      LOGGER.debug("Moved {} from {} to {}", index, oldParent, newParent);
    }
    verifyIfEnabled();
  }

  /**
   * Check that the new parent is not the moved node or one of its descendants. Walks the parent
   * links from the new parent up to the root, so this costs O(depth of the new parent).
   *
   * @param index the node to move
   * @param newParent the new parent
   */
  private void checkAncestors(final NodeIndex index, final NodeIndex newParent) {
    for (NodeIndex current = newParent; !current.isRoot(); current = existingNode(current).getParent()) {
      if (current.equals(index)) {
        throw new SceneGraphUsageException("Moving %s below itself or one of its descendants is not permitted!",
            index);
      }
    }
  }

  /**
   * Removes a node and its whole subtree without returning anything. Cheaper than
   * {@link #detach(NodeIndex)}. Removing a node which doesn't exist does nothing.
   *
   * @param index the node to remove
   * @throws SceneGraphUsageException if the index is the root, which can never be removed
   */
  public void remove(final NodeIndex index) {
    requireNonNull(index);
    if (index.isRoot()) {
      throw new SceneGraphUsageException("The root can not be removed.");
    }
    settle();

    final Handle handle = index.getHandle();
    final Node<T> node = arena.remove(handle);
    if (node == null) {
      return;
    }

    new DetachAxis<>(store, index, node.getFirstChild()).drain();
    adaptForRemove(node, handle);
    node.unlink();

    modificationCount++;
    if (GraphSettings.isMutationTracingEnabled()) {
      LOGGER.debug("Removed {}", index);
    }
    verifyIfEnabled();
  }

  // ////////////////////////////////////////////////////////////
  // traversal
  // ////////////////////////////////////////////////////////////

  /**
   * Iterate over the whole graph depth first, yielding each node with its parent's value.
   *
   * @return the traversal
   */
  public DescendantAxis<T> iter() {
    settle();
    return new DescendantAxis<>(store, NodeIndex.ROOT);
  }

  @Override
  public Iterator<Edge<T>> iterator() {
    return iter();
  }

  /**
   * Iterate depth first over the descendants of a node. The node itself is not included.
   *
   * @param index the start node
   * @return the traversal
   * @throws NodeNotFoundException if the node doesn't exist
   */
  public DescendantAxis<T> iterFromNode(final NodeIndex index) throws NodeNotFoundException {
    checkExists(index);
    return new DescendantAxis<>(store, index);
  }

  /**
   * Iterate mutably over the whole graph depth first.
   *
   * @return the traversal
   */
  public MutableDescendantAxis<T> iterMut() {
    settle();
    return new MutableDescendantAxis<>(store, NodeIndex.ROOT);
  }

  /**
   * Iterate mutably depth first over the descendants of a node. The node itself is not included.
   *
   * @param index the start node
   * @return the traversal
   * @throws NodeNotFoundException if the node doesn't exist
   */
  public MutableDescendantAxis<T> iterMutFromNode(final NodeIndex index) throws NodeNotFoundException {
    checkExists(index);
    return new MutableDescendantAxis<>(store, index);
  }

  /**
   * Iterate over only the direct children of a node.
   *
   * <p>
   * For example, given a graph:
   * </p>
   *
   * <pre>
   * ROOT
   *   A
   *     B
   *     C
   *       D
   * </pre>
   *
   * <p>
   * iterating over the direct children of {@code A} yields {@code B} and {@code C}, but not
   * {@code D}.
   * </p>
   *
   * @param parent the parent node
   * @return the traversal
   * @throws NodeNotFoundException if the node doesn't exist
   */
  public ChildAxis<T> iterDirectChildren(final NodeIndex parent) throws NodeNotFoundException {
    checkExists(parent);
    return new ChildAxis<>(store, existingNode(parent).getFirstChild());
  }

  ChildAxis<T> childAxis(final Node<T> parent) {
    settle();
    return new ChildAxis<>(store, parent.getFirstChild());
  }

  /**
   * Iterate over the graph while detaching every node. The root stays in place.
   *
   * @return the detaching traversal
   * @see #iterDetach(NodeIndex)
   */
  public DetachAxis<T> iterDetachFromRoot() {
    settle();
    return registerDetach(detachChildren(NodeIndex.ROOT, root));
  }

  /**
   * Iterate over the descendants of a node while detaching them. The node itself stays in place,
   * without children.
   *
   * <p>
   * All descendants are unlinked immediately. If the traversal is not consumed completely, the
   * remaining nodes are removed when it is closed or before the next operation on this graph.
   * </p>
   *
   * @param index the node whose descendants are detached
   * @return the detaching traversal
   * @throws NodeNotFoundException if the node doesn't exist
   */
  public DetachAxis<T> iterDetach(final NodeIndex index) throws NodeNotFoundException {
    checkExists(index);
    return registerDetach(detachChildren(index, existingNode(index)));
  }

  /**
   * Iterate over all non-root nodes in storage order rather than tree order. This is the fastest
   * way to visit every value. The graph must not be structurally modified while iterating.
   *
   * @return iterator over index/value entries
   */
  public Iterator<Map.Entry<NodeIndex, T>> iterOutOfOrder() {
    settle();
    return Iterators.transform(arena.handles(),
        handle -> Maps.immutableEntry(NodeIndex.branch(handle), existingNode(handle).getValue()));
  }

  // ////////////////////////////////////////////////////////////
  // internal linkage
  // ////////////////////////////////////////////////////////////

  /**
   * Inserts a node into the arena and places it as the last child of its parent.
   */
  private NodeIndex insertBelow(final NodeIndex parent, final Node<T> parentNode, final T value) {
    final Node<T> node = new Node<>(value, parent);
    final Handle handle = arena.insert(node);
    adaptForInsert(parentNode, handle, node);
    return NodeIndex.branch(handle);
  }

  /**
   * Adapting the links for insert operations: the node becomes the new last child.
   *
   * @param parent the parent record
   * @param handle handle of the node to place
   * @param node the node to place, without siblings
   */
  private void adaptForInsert(final Node<T> parent, final Handle handle, final Node<T> node) {
    final Handle oldLast = parent.getLastChild();
    if (oldLast == null) {
      parent.setFirstChild(handle);
    } else {
      existingNode(oldLast).setRightSibling(handle);
      node.setLeftSibling(oldLast);
    }
    parent.setLastChild(handle);
    parent.incrementChildCount();
  }

  /**
   * Adapting the links for remove and move operations: splice the node out of its parent's child
   * list by linking its former neighbours to each other. The node's own sibling links are reset,
   * its children are left alone.
   *
   * @param node the node which is unlinked
   * @param handle handle the node had or still has
   */
  private void adaptForRemove(final Node<T> node, final Handle handle) {
    final Node<T> parent = existingNode(node.getParent());
    final Handle leftSibling = node.getLeftSibling();
    final Handle rightSibling = node.getRightSibling();

    if (leftSibling == null && rightSibling == null) {
      // Only child.
      if (!handle.equals(parent.getFirstChild()) || !handle.equals(parent.getLastChild())) {
        throw new SceneGraphCorruptionException(NodeIndex.branch(handle), "node without siblings is not the only child");
      }
      parent.clearChildren();
    } else {
      if (handle.equals(parent.getFirstChild())) {
        parent.setFirstChild(rightSibling);
      }
      if (handle.equals(parent.getLastChild())) {
        parent.setLastChild(leftSibling);
      }
      if (leftSibling != null) {
        existingNode(leftSibling).setRightSibling(rightSibling);
      }
      if (rightSibling != null) {
        existingNode(rightSibling).setLeftSibling(leftSibling);
      }
      parent.decrementChildCount();
    }

    node.setLeftSibling(null);
    node.setRightSibling(null);
  }

  /**
   * Unlinks all children of a node and returns a traversal removing them.
   */
  private DetachAxis<T> detachChildren(final NodeIndex index, final Node<T> node) {
    final Handle firstChild = node.getFirstChild();
    node.clearChildren();
    modificationCount++;
    return new DetachAxis<>(store, index, firstChild);
  }

  private DetachAxis<T> registerDetach(final DetachAxis<T> axis) {
    pendingDetach = axis;
    return axis;
  }

  /**
   * Rebuilds the nodes of a detaching traversal in this graph. Each detached node is attached
   * below the node its former parent has become, looked up in a table from old to new handles.
   *
   * @param axis traversal over the nodes of another graph
   * @param sourceTop the former parent of the traversal's top-level nodes
   * @param targetTop the node in this graph which takes the place of {@code sourceTop}
   * @return the number of nodes rebuilt
   */
  private int replay(final DetachAxis<T> axis, final NodeIndex sourceTop, final NodeIndex targetTop) {
    final Long2ObjectOpenHashMap<NodeIndex> remapped = new Long2ObjectOpenHashMap<>();
    int count = 0;
    while (axis.hasNext()) {
      final DetachedNode<T> detached = axis.next();
      final NodeIndex parent = detached.parentIndex().equals(sourceTop)
          ? targetTop
          : remapped.get(detached.parentIndex().getHandle().asLong());
      if (parent == null) {
        throw new SceneGraphCorruptionException(detached.parentIndex(), "parent was not detached before its child");
      }
      final NodeIndex newIndex = insertBelow(parent, existingNode(parent), detached.value());
      remapped.put(detached.nodeIndex().getHandle().asLong(), newIndex);
      count++;
    }
    return count;
  }

  private void checkExists(final NodeIndex index) throws NodeNotFoundException {
    requireNonNull(index);
    settle();
    if (lookup(index) == null) {
      throw new NodeNotFoundException(index);
    }
  }

  private @Nullable Node<T> lookup(final NodeIndex index) {
    return index.isRoot() ? root : arena.get(index.getHandle());
  }

  private Node<T> existingNode(final NodeIndex index) {
    return index.isRoot() ? root : existingNode(index.getHandle());
  }

  private Node<T> existingNode(final Handle handle) {
    final Node<T> node = arena.get(handle);
    if (node == null) {
      throw new SceneGraphCorruptionException(NodeIndex.branch(handle), "linked node does not exist");
    }
    return node;
  }

  /**
   * Finishes a detaching traversal which has been handed out but not consumed completely.
   */
  void settle() {
    final DetachAxis<T> pending = pendingDetach;
    if (pending != null) {
      pendingDetach = null;
      pending.drain();
    }
  }

  private void verifyIfEnabled() {
    if (GraphSettings.isInvariantVerificationEnabled()) {
      SceneGraphVerifier.verify(this);
    }
  }

  Arena<Node<T>> getArena() {
    return arena;
  }

  Node<T> getRootNode() {
    return root;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("root", root.getValue()).add("len", arena.size()).toString();
  }

  /**
   * The node store the axes of this graph read from and remove from.
   */
  private final class Store implements NodeStore<T> {

    @Override
    public Node<T> getNode(final NodeIndex index) {
      return existingNode(index);
    }

    @Override
    public Pair<Node<T>, Node<T>> getNodePair(final Handle first, final Handle second) {
      final Pair<Node<T>, Node<T>> pair = arena.getPair(first, second);
      if (pair.getFirst() == null) {
        throw new SceneGraphCorruptionException(NodeIndex.branch(first), "linked node does not exist");
      }
      if (pair.getSecond() == null) {
        throw new SceneGraphCorruptionException(NodeIndex.branch(second), "linked node does not exist");
      }
      return pair;
    }

    @Override
    public Node<T> removeNode(final Handle handle) {
      final Node<T> node = arena.remove(handle);
      if (node == null) {
        throw new SceneGraphCorruptionException(NodeIndex.branch(handle), "linked node does not exist");
      }
      node.unlink();
      return node;
    }

    @Override
    public long getModificationCount() {
      return modificationCount;
    }

    @Override
    public void detachFinished(final DetachAxis<T> axis) {
      if (pendingDetach == axis) {
        pendingDetach = null;
      }
    }
  }
}
