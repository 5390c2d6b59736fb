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

package io.scenegraph.exception;

import io.scenegraph.NodeIndex;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exception thrown when the linkage of a scene graph is found to be inconsistent.
 *
 * <p>
 * This indicates a dangling child or sibling link, a node which is reachable twice, a wrong
 * parent pointer or an arena slot which is not reachable from the root. A corrupted graph cannot
 * be repaired; the exception is logged at ERROR level when it is created.
 * </p>
 */
public final class SceneGraphCorruptionException extends SceneGraphRuntimeException {

  private static final Logger LOGGER = LoggerFactory.getLogger(SceneGraphCorruptionException.class);

  private static final long serialVersionUID = 1L;

  /**
   * The node where the corruption was detected, {@code null} if not attributable to one node.
   */
  private final @Nullable NodeIndex node;

  /**
   * Create a new corruption exception.
   *
   * @param node the node at which the inconsistency was found, may be {@code null}
   * @param message description of the violated invariant
   */
  public SceneGraphCorruptionException(final @Nullable NodeIndex node, final String message) {
    super(buildMessage(node, message));
    this.node = node;

    LOGGER.error("SCENE GRAPH CORRUPTION DETECTED: node={}, message={}", node, message);
  }

  private static String buildMessage(final @Nullable NodeIndex node, final String message) {
    return node == null
        ? String.format("Scene graph corruption detected: %s", message)
        : String.format("Scene graph corruption detected at %s: %s", node, message);
  }

  /**
   * Get the node at which the corruption was detected.
   *
   * @return the node index or {@code null}
   */
  public @Nullable NodeIndex getNode() {
    return node;
  }
}
