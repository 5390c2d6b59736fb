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
 * Thrown if a node should be attached below a parent which is not (or no longer) part of the
 * graph.
 */
public final class ParentNotFoundException extends SceneGraphException {

  private static final long serialVersionUID = 1L;

  /** The parent which could not be found. */
  private final NodeIndex parent;

  /**
   * Constructor.
   *
   * @param parent the index of the missing parent
   */
  public ParentNotFoundException(final NodeIndex parent) {
    super("Parent node not found: %s", parent);
    this.parent = parent;
  }

  public NodeIndex getParent() {
    return parent;
  }
}
