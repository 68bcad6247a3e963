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

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.function.BinaryOperator;
import java.util.function.Function;

import com.smartcloudops.isolationforest.VisitorFactory;
import com.smartcloudops.isolationforest.tree.PartitionTree;
import com.smartcloudops.isolationforest.util.Deadline;

/**
 * An implementation of forest traversal methods that uses a private thread pool
 * to visit trees in parallel. Trees are visited in batches of
 * {@code threadPoolSize} and the deadline is checked before every batch.
 */
public class ParallelForestTraversalExecutor extends AbstractForestTraversalExecutor {

    private final ForkJoinPool forkJoinPool;

    private final int threadPoolSize;

    public ParallelForestTraversalExecutor(List<PartitionTree> trees, int threadPoolSize) {
        super(trees);
        checkArgument(threadPoolSize > 0, "threadPoolSize must be positive");
        this.threadPoolSize = threadPoolSize;
        forkJoinPool = new ForkJoinPool(threadPoolSize);
    }

    @Override
    public <R, S> S traverseForest(double[] point, VisitorFactory<R> visitorFactory, BinaryOperator<R> accumulator,
            Function<R, S> finisher, Deadline deadline) {

        R result = null;
        for (int i = 0; i < trees.size(); i += threadPoolSize) {
            deadline.checkNotExpired("forest traversal");
            final int start = i;
            final int end = Math.min(start + threadPoolSize, trees.size());

            R batch = submitAndJoin(() -> trees.subList(start, end).parallelStream()
                    .map(tree -> tree.traverse(point, visitorFactory.newVisitor(tree, point))).reduce(accumulator))
                            .orElseThrow(() -> new IllegalStateException("accumulator returned an empty result"));
            result = (result == null) ? batch : accumulator.apply(result, batch);
        }
        return finisher.apply(result);
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        return forkJoinPool.submit(callable).join();
    }
}
