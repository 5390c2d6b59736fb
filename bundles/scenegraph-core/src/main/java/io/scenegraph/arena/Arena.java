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

package io.scenegraph.arena;

import com.google.common.base.MoreObjects;
import com.google.common.collect.AbstractIterator;
import io.scenegraph.utils.Pair;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.Iterator;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A generational arena: a growable array of slots handing out {@link Handle}s which stay valid
 * until their entry is removed. Freed slots are reused, but each reuse bumps the slot's
 * generation, so stale handles are detected instead of silently resolving to a new entry.
 *
 * <p>
 * Insert, remove and lookup are O(1) (insert amortized). The arena does not accept {@code null}
 * entries. It is not thread-safe.
 * </p>
 *
 * @param <E> entry type
 */
public final class Arena<E> {

  /** Maximum array size. */
  private static final int MAX_SIZE = Integer.MAX_VALUE - 8;

  /** Default factor for resizing the slot arrays. */
  private static final double RESIZE_FACTOR = 1.5;

  /** Entries, {@code null} for free slots. */
  private Object[] entries;

  /** Current generation of each slot. */
  private int[] generations;

  /** Free slots below {@link #highWaterMark}, reused LIFO. */
  private final IntArrayList freeSlots;

  /** Number of slots which have ever been handed out. */
  private int highWaterMark;

  /** Number of live entries. */
  private int size;

  /**
   * Constructor.
   *
   * @param capacity initial number of slots
   */
  public Arena(final @NonNegative int capacity) {
    checkArgument(capacity >= 0, "capacity must be >= 0!");
    entries = new Object[capacity];
    generations = new int[capacity];
    freeSlots = new IntArrayList();
  }

  /**
   * Inserts an entry.
   *
   * @param entry the entry, not {@code null}
   * @return handle to the entry
   */
  public Handle insert(final E entry) {
    requireNonNull(entry);
    final int slot;
    if (!freeSlots.isEmpty()) {
      slot = freeSlots.popInt();
    } else {
      if (highWaterMark == entries.length) {
        grow();
      }
      slot = highWaterMark++;
    }
    entries[slot] = entry;
    size++;
    return new Handle(slot, generations[slot]);
  }

  /**
   * Removes the entry a handle refers to.
   *
   * @param handle the handle
   * @return the removed entry or {@code null} if the handle is stale or was never valid
   */
  public @Nullable E remove(final Handle handle) {
    final E entry = get(handle);
    if (entry == null) {
      return null;
    }
    final int slot = handle.getSlot();
    entries[slot] = null;
    bumpGeneration(slot);
    freeSlots.push(slot);
    size--;
    return entry;
  }

  /**
   * Get the entry a handle refers to.
   *
   * @param handle the handle
   * @return the entry or {@code null} if the handle is stale or was never valid
   */
  @SuppressWarnings("unchecked")
  public @Nullable E get(final Handle handle) {
    final int slot = handle.getSlot();
    if (slot >= highWaterMark || generations[slot] != handle.getGeneration()) {
      return null;
    }
    return (E) entries[slot];
  }

  /**
   * Get two distinct entries at once. The handles must differ; this is what allows a caller to
   * hand out both entries for modification without them ever being the same object.
   *
   * @param first handle of the first entry
   * @param second handle of the second entry
   * @return the pair of entries, each {@code null} if its handle is stale
   * @throws IllegalArgumentException if both handles are equal
   */
  public Pair<E, E> getPair(final Handle first, final Handle second) {
    checkArgument(!first.equals(second), "Both handles refer to the same entry: %s", first);
    return new Pair<>(get(first), get(second));
  }

  public boolean contains(final Handle handle) {
    return get(handle) != null;
  }

  /**
   * Number of live entries.
   *
   * @return the number of entries
   */
  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  /**
   * Number of slots currently allocated.
   *
   * @return the capacity
   */
  public int capacity() {
    return entries.length;
  }

  /**
   * Removes all entries. The slot arrays keep their capacity, every outstanding handle becomes
   * stale.
   */
  public void clear() {
    freeSlots.clear();
    for (int slot = highWaterMark - 1; slot >= 0; slot--) {
      if (entries[slot] != null) {
        entries[slot] = null;
        bumpGeneration(slot);
      }
      freeSlots.add(slot);
    }
    size = 0;
  }

  /**
   * Iterates over the handles of all live entries in slot order.
   *
   * @return handle iterator
   */
  public Iterator<Handle> handles() {
    return new AbstractIterator<>() {
      private int slot;

      @Override
      protected Handle computeNext() {
        while (slot < highWaterMark) {
          final int current = slot++;
          if (entries[current] != null) {
            return new Handle(current, generations[current]);
          }
        }
        return endOfData();
      }
    };
  }

  private void bumpGeneration(final int slot) {
    // Wraps around after 2^31 reuses of one slot, handles keep a non-negative generation.
    generations[slot] = (generations[slot] + 1) & Integer.MAX_VALUE;
  }

  private void grow() {
    if (entries.length >= MAX_SIZE) {
      throw new IllegalStateException("Maximum arena size reached.");
    }
    final int newCapacity = (int) Math.min(MAX_SIZE, Math.max(entries.length + 1L, (long) (entries.length * RESIZE_FACTOR) + 1));
    entries = Arrays.copyOf(entries, newCapacity);
    generations = Arrays.copyOf(generations, newCapacity);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("size", size).add("capacity", entries.length).toString();
  }
}
