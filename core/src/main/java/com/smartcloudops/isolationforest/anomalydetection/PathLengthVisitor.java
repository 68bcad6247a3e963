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

package com.smartcloudops.isolationforest.anomalydetection;

import static com.smartcloudops.isolationforest.CommonUtils.averagePathLength;

import com.smartcloudops.isolationforest.Visitor;
import com.smartcloudops.isolationforest.tree.INodeView;

/**
 * Computes the isolation path length h(x) of a point in one tree: the depth of
 * the leaf the point reaches, plus the expected remaining depth c(size) when
 * the leaf was closed early and still holds several training points.
 */
public class PathLengthVisitor implements Visitor<Double> {

    private double pathLength;

    private boolean converged;

    @Override
    public void acceptLeaf(INodeView leaf, int depth) {
        pathLength = depth + averagePathLength(leaf.getLeafSize());
        converged = true;
    }

    /**
     * @return the path length; only meaningful once a leaf was reached
     */
    @Override
    public Double getResult() {
        return pathLength;
    }

    public boolean isConverged() {
        return converged;
    }
}
