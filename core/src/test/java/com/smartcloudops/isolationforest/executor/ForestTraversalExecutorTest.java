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

import static com.smartcloudops.isolationforest.TestUtils.EPSILON;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.AdditionalMatchers.aryEq;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.ArgumentsProvider;
import org.junit.jupiter.params.provider.ArgumentsSource;

import com.smartcloudops.isolationforest.Visitor;
import com.smartcloudops.isolationforest.VisitorFactory;
import com.smartcloudops.isolationforest.exception.ScoringTimeoutException;
import com.smartcloudops.isolationforest.tree.INodeView;
import com.smartcloudops.isolationforest.tree.PartitionTree;
import com.smartcloudops.isolationforest.util.Deadline;

public class ForestTraversalExecutorTest {

    private static final int numberOfTrees = 10;
    private static final int threadPoolSize = 2;

    private static final VisitorFactory<Double> DUMMY_VISITOR_FACTORY = (tree, point) -> new Visitor<Double>() {
        @Override
        public void acceptLeaf(INodeView leaf, int depth) {
        }

        @Override
        public Double getResult() {
            return 0.0;
        }
    };

    private static class TestExecutorProvider implements ArgumentsProvider {
        @Override
        public Stream<? extends Arguments> provideArguments(ExtensionContext context) {
            return Stream.of(new SequentialForestTraversalExecutor(mockTrees()),
                    new ParallelForestTraversalExecutor(mockTrees(), threadPoolSize)).map(Arguments::of);
        }
    }

    private static List<PartitionTree> mockTrees() {
        List<PartitionTree> trees = new ArrayList<>();
        for (int i = 0; i < numberOfTrees; i++) {
            trees.add(mock(PartitionTree.class));
        }
        return trees;
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testTraverseForestBinaryAccumulator(AbstractForestTraversalExecutor executor) {
        double[] point = new double[] { 1.2, -3.4 };
        double expectedResult = 0.0;

        for (int i = 0; i < numberOfTrees; i++) {
            double treeResult = i * 0.25 + 1.0;
            when(executor.trees.get(i).traverse(aryEq(point), any())).thenReturn(treeResult);
            expectedResult += treeResult;
        }
        expectedResult /= numberOfTrees;

        double result = executor.traverseForest(point, DUMMY_VISITOR_FACTORY, Double::sum, x -> x / numberOfTrees,
                Deadline.none());

        for (PartitionTree tree : executor.trees) {
            verify(tree, times(1)).traverse(aryEq(point), any());
        }
        assertEquals(expectedResult, result, EPSILON);
        assertEquals(numberOfTrees, executor.size());
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testExpiredDeadlineVisitsNoTree(AbstractForestTraversalExecutor executor) {
        double[] point = new double[] { 0.5, 0.5 };
        assertThrows(ScoringTimeoutException.class, () -> executor.traverseForest(point, DUMMY_VISITOR_FACTORY,
                Double::sum, x -> x, Deadline.after(Duration.ofMillis(-1))));
        for (PartitionTree tree : executor.trees) {
            verify(tree, never()).traverse(any(), any());
        }
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testDeadlineStopsTraversalBetweenTrees(AbstractForestTraversalExecutor executor) {
        double[] point = new double[] { 0.5, 0.5 };
        AtomicLong nanos = new AtomicLong();
        Deadline deadline = Deadline.after(Duration.ofNanos(3), nanos::get);
        for (PartitionTree tree : executor.trees) {
            // every tree visit takes one nanosecond of the fake clock
            when(tree.traverse(aryEq(point), any())).thenAnswer(invocation -> {
                nanos.incrementAndGet();
                return 1.0;
            });
        }

        assertThrows(ScoringTimeoutException.class,
                () -> executor.traverseForest(point, DUMMY_VISITOR_FACTORY, Double::sum, x -> x, deadline));
        verify(executor.trees.get(0), times(1)).traverse(aryEq(point), any());
        verify(executor.trees.get(numberOfTrees - 1), never()).traverse(any(), any());
    }

    @Test
    public void testConstructorRejectsEmptyForest() {
        assertThrows(IllegalArgumentException.class,
                () -> new SequentialForestTraversalExecutor(Collections.emptyList()));
        assertThrows(IllegalArgumentException.class, () -> new ParallelForestTraversalExecutor(mockTrees(), 0));
    }

    @Test
    public void testParallelExecutorReportsThreadPoolSize() {
        assertEquals(threadPoolSize, new ParallelForestTraversalExecutor(mockTrees(), threadPoolSize).getThreadPoolSize());
    }
}
