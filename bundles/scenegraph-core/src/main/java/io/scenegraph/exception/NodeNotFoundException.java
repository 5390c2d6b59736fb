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

/**
 * Thrown if a node an operation refers to does not exist, or if the root is passed where only a
 * branch node is allowed.
 */
public final class NodeNotFoundException extends SceneGraphException {

  private static final long serialVersionUID = 1L;

  /** The index which could not be resolved. */
  private final NodeIndex node;

  /**
   * Constructor.
   *
   * @param node the index of the missing node
   */
  public NodeNotFoundException(final NodeIndex node) {
    super("Node does not exist: %s", node);
    this.node = node;
  }

  public NodeIndex getNode() {
    return node;
  }
}
