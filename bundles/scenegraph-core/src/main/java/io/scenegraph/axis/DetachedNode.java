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

import io.scenegraph.NodeIndex;

/**
 * A node removed by a {@link DetachAxis}. The indexes refer to the graph the node was removed
 * from and are stale once the node has been yielded, they are only useful to rebuild the
 * parent/child relation elsewhere.
 *
 * @param parentIndex former index of the parent
 * @param nodeIndex former index of the node
 * @param value the value of the node
 * @param <T> value type
 */
public record DetachedNode<T>(NodeIndex parentIndex, NodeIndex nodeIndex, T value) {
}
