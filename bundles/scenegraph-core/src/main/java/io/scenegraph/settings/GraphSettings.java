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

package io.scenegraph.settings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized diagnostic and sizing settings for scene graphs.
 * <p>
 * All settings are read from system properties once, when this class is initialized. Diagnostic
 * features are disabled by default.
 * <p>
 * <b>Available System Properties:</b>
 * <ul>
 *   <li>{@code scenegraph.debug.verify.invariants} - Verify the tree linkage after every structural
 *   mutation</li>
 *   <li>{@code scenegraph.debug.trace.mutations} - Log every structural mutation at DEBUG level</li>
 *   <li>{@code scenegraph.arena.initial.capacity} - Default number of arena slots of a new graph</li>
 * </ul>
 * <p>
 * <b>Example Usage:</b>
 * <pre>{@code
 * java -Dscenegraph.debug.verify.invariants=true -jar app.jar
 * }</pre>
 */
public final class GraphSettings {

  private static final Logger LOGGER = LoggerFactory.getLogger(GraphSettings.class);

  /** Default arena capacity if the property is not set. */
  public static final int DEFAULT_INITIAL_CAPACITY = 16;

  /**
   * Run the invariant verifier after every attach, detach, move, remove and clear.
   * <p>
   * <b>Performance Impact:</b> every mutation becomes O(n). Use for debugging and tests only.
   * <p>
   * <b>System Property:</b> {@code scenegraph.debug.verify.invariants}
   */
  public static final boolean VERIFY_INVARIANTS = Boolean.getBoolean("scenegraph.debug.verify.invariants");

  /**
   * Log structural mutations.
   * <p>
   * <b>System Property:</b> {@code scenegraph.debug.trace.mutations}
   */
  public static final boolean TRACE_MUTATIONS = Boolean.getBoolean("scenegraph.debug.trace.mutations");

  /**
   * Initial number of arena slots of a graph created without an explicit capacity.
   * <p>
   * <b>System Property:</b> {@code scenegraph.arena.initial.capacity}
   */
  public static final int INITIAL_CAPACITY = readInitialCapacity();

  static {
    if (VERIFY_INVARIANTS || TRACE_MUTATIONS) {
      LOGGER.info("Scene graph diagnostic settings active:");
      if (VERIFY_INVARIANTS) {
        LOGGER.info("  - Invariant verification ENABLED (scenegraph.debug.verify.invariants)");
      }
      if (TRACE_MUTATIONS) {
        LOGGER.info("  - Mutation tracing ENABLED (scenegraph.debug.trace.mutations)");
      }
      LOGGER.info("Diagnostic features add overhead. Disable for production use.");
    }
  }

  private static int readInitialCapacity() {
    final int capacity = Integer.getInteger("scenegraph.arena.initial.capacity", DEFAULT_INITIAL_CAPACITY);
    if (capacity < 1) {
      LOGGER.warn("Ignoring scenegraph.arena.initial.capacity={}, falling back to {}", capacity,
          DEFAULT_INITIAL_CAPACITY);
      return DEFAULT_INITIAL_CAPACITY;
    }
    return capacity;
  }

  /**
   * Check if invariant verification is enabled.
   *
   * @return true if every mutation is verified
   */
  public static boolean isInvariantVerificationEnabled() {
    return VERIFY_INVARIANTS;
  }

  /**
   * Check if mutation tracing is enabled.
   *
   * @return true if mutations are logged
   */
  public static boolean isMutationTracingEnabled() {
    return TRACE_MUTATIONS;
  }

  public static int getInitialCapacity() {
    return INITIAL_CAPACITY;
  }

  private GraphSettings() {
    throw new AssertionError("Utility class - do not instantiate");
  }
}
