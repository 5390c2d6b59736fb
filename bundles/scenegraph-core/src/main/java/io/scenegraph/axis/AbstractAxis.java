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

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;

import static com.google.common.base.Preconditions.checkState;

/**
 * Provide standard Java iterator capability compatible with the enhanced for loop. Override the
 * "template method" {@code nextNode()} to implement an axis. Return {@code done()} if the axis has
 * no more "elements".
 *
 * <p>
 * Axes are lazy, finite and not restartable: create a new one to traverse again.
 * </p>
 *
 * @param <E> type of the elements the axis yields
 */
public abstract class AbstractAxis<E> implements Iterator<E>, Iterable<E> {

  /**
   * The element computed by the last call to {@link #nextNode()}.
   */
  private E next;

  /**
   * Current state.
   */
  private State state = State.NOT_READY;

  /**
   * State of the iterator.
   */
  private enum State {
    /**
     * We have computed the next element and haven't returned it yet.
     */
    READY,

    /**
     * We haven't yet computed or have already returned the element.
     */
    NOT_READY,

    /**
     * We have reached the end of the data and are finished.
     */
    DONE,

    /**
     * We've suffered an exception and are kaput.
     */
    FAILED,
  }

  @Override
  public final Iterator<E> iterator() {
    return this;
  }

  /**
   * Signals that axis traversal is done, that is {@code hasNext()} must return false. Is callable
   * from subclasses which implement {@link #nextNode()} to signal that the axis-traversal is done and
   * {@link #hasNext()} must return false.
   *
   * @return {@code null} to indicate that the traversal is done
   */
  protected final E done() {
    state = State.DONE;
    return null;
  }

  @Override
  public final boolean hasNext() {
    // First check the state.
    checkState(state != State.FAILED);
    switch (state) {
      case DONE:
        return false;
      case READY:
        return true;
      case FAILED:
      case NOT_READY:
      default:
    }

    return tryToComputeNext();
  }

  /**
   * Try to compute the next element.
   *
   * @return {@code true} if a next element exists, {@code false} otherwise
   */
  private boolean tryToComputeNext() {
    state = State.FAILED; // temporary pessimism
    // Template method.
    next = nextNode();
    if (state == State.DONE) {
      return false;
    }
    state = State.READY;
    return true;
  }

  /**
   * Returns the next element. <strong>Note:</strong> the implementation must call {@link #done()}
   * when there are no elements left in the iteration.
   *
   * <p>
   * The initial invocation of {@link #hasNext()} or {@link #next()} calls this method, as does the
   * first invocation of {@code hasNext} or {@code next} following each successful call to
   * {@code next}. Once the implementation either invokes {@link #done()} or throws an exception,
   * {@code nextNode()} is guaranteed to never be called again.
   * </p>
   *
   * <p>
   * If this method throws an exception, it will propagate outward to the {@code hasNext} or
   * {@code next} invocation that invoked this method. Any further attempts to use the iterator will
   * result in an {@link IllegalStateException}.
   * </p>
   *
   * @return the next element
   */
  protected abstract E nextNode();

  @Override
  public final E next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    state = State.NOT_READY;
    final E result = next;
    next = null;
    return result;
  }

  /**
   * Remove is not supported.
   */
  @Override
  public final void remove() {
    throw new UnsupportedOperationException();
  }

  /**
   * Returns the next element without advancing.
   *
   * @return the next element
   * @throws NoSuchElementException if the axis is exhausted
   */
  public final E peek() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    return next;
  }

  /**
   * Fails fast if the structure of the graph changed since the axis was created.
   *
   * @param store the node store the axis reads from
   * @param expectedModificationCount modification count when the axis was created
   */
  protected static void checkForComodification(final NodeStore<?> store, final long expectedModificationCount) {
    if (store.getModificationCount() != expectedModificationCount) {
      throw new ConcurrentModificationException("The scene graph was structurally modified during traversal.");
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("state", state).toString();
  }
}
