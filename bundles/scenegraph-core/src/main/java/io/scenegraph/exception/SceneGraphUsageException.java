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

/**
 * Signals a violated caller contract, for instance an attempt to remove the root or to move a
 * node below one of its own descendants. The graph is left unchanged.
 */
public final class SceneGraphUsageException extends SceneGraphRuntimeException {

  private static final long serialVersionUID = 1L;

  public SceneGraphUsageException(final String message) {
    super(message);
  }

  public SceneGraphUsageException(final String message, final Object... args) {
    super(String.format(message, args));
  }
}
