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

package com.smartcloudops.isolationforest.tree;

/**
 * A read-only view of a node in a partition tree, as seen by a visitor.
 */
public interface INodeView {

    boolean isLeaf();

    /**
     * @return the number of training points that ended in this leaf; 0 for an
     *         internal node
     */
    int getLeafSize();

    /**
     * @return the feature index the node splits on; -1 for a leaf
     */
    int getCutFeature();

    /**
     * @return the split value; points strictly below it go left
     */
    double getCutValue();
}
