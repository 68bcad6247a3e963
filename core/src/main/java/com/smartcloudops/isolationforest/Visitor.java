/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.smartcloudops.isolationforest;

import com.smartcloudops.isolationforest.tree.INodeView;

/**
 * Collects a result along the path of one point through a partition tree.
 * {@link com.smartcloudops.isolationforest.tree.PartitionTree#traverse(double[], Visitor)}
 * calls the visitor top-down: {@link #acceptInternal} once for every internal
 * node on the path, starting at the root with depth 0 and increasing the depth
 * by one per level, then {@link #acceptLeaf} exactly once for the leaf the
 * point lands in, with a depth one greater than that of the last internal
 * node. {@link #getResult} is called last.
 *
 * @param <R> the result type
 */
public interface Visitor<R> {

    /**
     * Visits an internal node on the path. Does nothing unless overridden.
     *
     * @param node  the node, valid only during the call
     * @param depth the number of edges between the root and the node
     */
    default void acceptInternal(INodeView node, int depth) {
    }

    /**
     * Visits the leaf that ends the path.
     *
     * @param leaf  the leaf, valid only during the call
     * @param depth the number of edges between the root and the leaf
     */
    void acceptLeaf(INodeView leaf, int depth);

    R getResult();
}
