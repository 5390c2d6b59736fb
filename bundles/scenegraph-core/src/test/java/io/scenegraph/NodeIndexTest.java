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

import io.scenegraph.arena.Handle;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NodeIndexTest {

  @Test
  void testRoot() {
    assertTrue(NodeIndex.ROOT.isRoot());
    assertThrows(IllegalStateException.class, NodeIndex.ROOT::getHandle);
    assertEquals("NodeIndex{Root}", NodeIndex.ROOT.toString());
  }

  @Test
  void testBranchEquality() {
    final NodeIndex first = NodeIndex.branch(Handle.fromLong(3L));
    final NodeIndex same = NodeIndex.branch(Handle.fromLong(3L));
    final NodeIndex newerGeneration = NodeIndex.branch(Handle.fromLong((1L << 32) | 3L));

    assertFalse(first.isRoot());
    assertEquals(first, same);
    assertEquals(first.hashCode(), same.hashCode());
    assertNotEquals(first, newerGeneration);
    assertNotEquals(NodeIndex.ROOT, first);
  }

  @Test
  void testRootSortsFirst() {
    final NodeIndex branch = NodeIndex.branch(Handle.fromLong(0L));

    assertTrue(NodeIndex.ROOT.compareTo(branch) < 0);
    assertTrue(branch.compareTo(NodeIndex.ROOT) > 0);
    assertEquals(0, NodeIndex.ROOT.compareTo(NodeIndex.ROOT));
  }
}
