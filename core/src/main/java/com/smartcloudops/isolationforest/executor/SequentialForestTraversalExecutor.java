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

package com.smartcloudops.isolationforest.executor;

import java.util.List;
import java.util.function.BinaryOperator;
import java.util.function.Function;

import com.smartcloudops.isolationforest.VisitorFactory;
import com.smartcloudops.isolationforest.tree.PartitionTree;
import com.smartcloudops.isolationforest.util.Deadline;

/**
 * Traverse the trees in a forest sequentially on the calling thread.
 */
public class SequentialForestTraversalExecutor extends AbstractForestTraversalExecutor {

    public SequentialForestTraversalExecutor(List<PartitionTree> trees) {
        super(trees);
    }

    @Override
    public <R, S> S traverseForest(double[] point, VisitorFactory<R> visitorFactory, BinaryOperator<R> accumulator,
            Function<R, S> finisher, Deadline deadline) {

        R result = null;
        for (PartitionTree tree : trees) {
            deadline.checkNotExpired("forest traversal");
            R treeResult = tree.traverse(point, visitorFactory.newVisitor(tree, point));
            result = (result == null) ? treeResult : accumulator.apply(result, treeResult);
        }
        return finisher.apply(result);
    }
}
