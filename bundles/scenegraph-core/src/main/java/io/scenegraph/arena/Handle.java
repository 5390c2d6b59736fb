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
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A generation-checked reference into an {@link Arena}. A handle stays valid until the entry it
 * refers to is removed; afterwards the slot may be reused, but with a higher generation, so the
 * old handle never resolves to the new entry.
 */
public final class Handle implements Comparable<Handle> {

  /** Slot in the arena. */
  private final int slot;

  /** Generation of the slot at the time the entry was inserted. */
  private final int generation;

  Handle(final @NonNegative int slot, final @NonNegative int generation) {
    checkArgument(slot >= 0, "slot must be >= 0!");
    checkArgument(generation >= 0, "generation must be >= 0!");
    this.slot = slot;
    this.generation = generation;
  }

  /**
   * Reconstruct a handle from its {@link #asLong()} representation.
   *
   * @param key packed handle
   * @return the handle
   */
  public static Handle fromLong(final long key) {
    return new Handle((int) key, (int) (key >>> 32));
  }

  public int getSlot() {
    return slot;
  }

  public int getGeneration() {
    return generation;
  }

  /**
   * Packs this handle into a single non-negative {@code long}, generation in the upper half.
   *
   * @return the packed handle
   */
  public long asLong() {
    return ((long) generation << 32) | (slot & 0xFFFFFFFFL);
  }

  @Override
  public int compareTo(final Handle other) {
    final int bySlot = Integer.compare(slot, other.slot);
    return bySlot != 0 ? bySlot : Integer.compare(generation, other.generation);
  }

  @Override
  public boolean equals(final @Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Handle other)) {
      return false;
    }
    return slot == other.slot && generation == other.generation;
  }

  @Override
  public int hashCode() {
    return 31 * slot + generation;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("slot", slot).add("generation", generation).toString();
  }
}
