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

import static com.smartcloudops.isolationforest.CommonUtils.checkArgument;
import static com.smartcloudops.isolationforest.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.List;
import java.util.function.BinaryOperator;
import java.util.function.Function;

import com.smartcloudops.isolationforest.VisitorFactory;
import com.smartcloudops.isolationforest.tree.PartitionTree;
import com.smartcloudops.isolationforest.util.Deadline;

public abstract class AbstractForestTraversalExecutor {

    protected final List<PartitionTree> trees;

    protected AbstractForestTraversalExecutor(List<PartitionTree> trees) {
        checkNotNull(trees, "trees must not be null");
        checkArgument(!trees.isEmpty(), "trees must not be empty");
        this.trees = Collections.unmodifiableList(trees);
    }

    /**
     * Visit each of the trees in the forest and combine the individual results into
     * an aggregate result. A visitor is constructed for each tree using the visitor
     * factory, and then submitted to a tree. The results from all the trees are
     * combined using the accumulator and then transformed using the finisher before
     * being returned.
     * <p>
     * The deadline is checked between tree evaluations, never inside a single
     * tree. If it has passed, the traversal stops and no result is produced.
     *
     * @param point          The point that defines the traversal path.
     * @param visitorFactory A factory method which is invoked for each tree to
     *                       construct a visitor.
     * @param accumulator    A function that combines the results from individual
     *                       trees into an aggregate result.
     * @param finisher       A function called on the aggregate result in order to
     *                       produce the final result.
     * @param deadline       The time after which the traversal is abandoned.
     * @param <R>            The visitor result type. This is the type that will be
     *                       returned after traversing each individual tree.
     * @param <S>            The final type, after any final normalization at the
     *                       forest level.
     * @return The aggregated and finalized result after sending a visitor through
     *         each tree in the forest.
     * @throws com.smartcloudops.isolationforest.exception.ScoringTimeoutException
     *         if the deadline passes before every tree has been visited
     */
    public abstract <R, S> S traverseForest(double[] point, VisitorFactory<R> visitorFactory,
            BinaryOperator<R> accumulator, Function<R, S> finisher, Deadline deadline);

    public int size() {
        return trees.size();
    }
}
