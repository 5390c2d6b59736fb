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

package io.scenegraph.utils;

import com.google.common.base.MoreObjects;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * A pair of references, either of which may be {@code null}.
 *
 * @param <U> first reference
 * @param <V> second reference
 */
public final class Pair<U, V> {
  /** The first reference. */
  private final @Nullable U first;

  /** The second reference. */
  private final @Nullable V second;

  /**
   * Constructs the pair.
   *
   * @param first first reference
   * @param second second reference
   */
  public Pair(final @Nullable U first, final @Nullable V second) {
    this.first = first;
    this.second = second;
  }

  public @Nullable U getFirst() {
    return first;
  }

  public @Nullable V getSecond() {
    return second;
  }

  @Override
  public int hashCode() {
    return Objects.hash(first, second);
  }

  @Override
  public boolean equals(final @Nullable Object other) {
    if (!(other instanceof Pair<?, ?> otherPair)) {
      return false;
    }
    return Objects.equals(first, otherPair.first) && Objects.equals(second, otherPair.second);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("first", first).add("second", second).toString();
  }
}
