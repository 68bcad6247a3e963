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

import static com.smartcloudops.isolationforest.TestUtils.EPSILON;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.smartcloudops.isolationforest.CommonUtils;
import com.smartcloudops.isolationforest.Visitor;
import com.smartcloudops.isolationforest.testutils.ClusterTestData;

public class PartitionTreeTest {

    private double[][] points;

    private PartitionTree tree;

    @BeforeEach
    public void setUp() {
        points = new ClusterTestData().generateNormal(256, 3, 42);
        tree = PartitionTree.build(points, CommonUtils.maximumDepth(256), new Random(7));
    }

    @Test
    public void testMassIsPreserved() {
        assertEquals(256, tree.getMass());
        assertTrue(tree.getNumberOfNodes() <= 2 * 256 - 1);
    }

    @Test
    public void testSplitsAreStrictlyInsideTheRange() {
        int[] feature = tree.getCutFeature();
        double[] value = tree.getCutValue();
        for (int node = 0; node < feature.length; node++) {
            if (feature[node] != PartitionTree.LEAF) {
                double min = Double.POSITIVE_INFINITY;
                double max = Double.NEGATIVE_INFINITY;
                for (double[] point : points) {
                    min = Math.min(min, point[feature[node]]);
                    max = Math.max(max, point[feature[node]]);
                }
                assertTrue(value[node] > min && value[node] < max);
            }
        }
    }

    @Test
    public void testDepthIsBounded() {
        for (double[] point : points) {
            int[] depth = new int[1];
            tree.traverse(point, new Visitor<Integer>() {
                @Override
                public void acceptLeaf(INodeView leaf, int depthOfLeaf) {
                    assertTrue(leaf.isLeaf());
                    assertTrue(leaf.getLeafSize() >= 1);
                    depth[0] = depthOfLeaf;
                }

                @Override
                public Integer getResult() {
                    return depth[0];
                }
            });
            assertTrue(depth[0] <= 8);
        }
    }

    @Test
    public void testVisitorSeesEveryNodeOnThePath() {
        Visitor<Double> visitor = mock(Visitor.class);
        double[] point = points[0];
        tree.traverse(point, visitor);
        verify(visitor, times(1)).acceptLeaf(any(), anyInt());
        verify(visitor, times(1)).getResult();
    }

    @Test
    public void testTraversalVisitsInternalNodesTopDownThenTheLeafOnce() {
        for (double[] point : points) {
            List<Integer> internalDepths = new ArrayList<>();
            List<Integer> leafDepths = new ArrayList<>();
            tree.traverse(point, new Visitor<Void>() {
                @Override
                public void acceptInternal(INodeView node, int depth) {
                    assertFalse(node.isLeaf());
                    assertTrue(leafDepths.isEmpty());
                    internalDepths.add(depth);
                }

                @Override
                public void acceptLeaf(INodeView leaf, int depth) {
                    assertTrue(leaf.isLeaf());
                    leafDepths.add(depth);
                }

                @Override
                public Void getResult() {
                    return null;
                }
            });

            for (int i = 0; i < internalDepths.size(); i++) {
                assertEquals(i, internalDepths.get(i).intValue());
            }
            assertEquals(List.of(internalDepths.size()), leafDepths);
            int leafSize = tree.getLeafSize()[leafOf(point)];
            assertEquals(internalDepths.size() + CommonUtils.averagePathLength(leafSize), tree.getPathLength(point),
                    EPSILON);
        }
    }

    private int leafOf(double[] point) {
        int[] feature = tree.getCutFeature();
        double[] value = tree.getCutValue();
        int[] left = tree.getLeftChild();
        int[] right = tree.getRightChild();
        int node = 0;
        while (feature[node] != PartitionTree.LEAF) {
            node = point[feature[node]] < value[node] ? left[node] : right[node];
        }
        return node;
    }

    @Test
    public void testSinglePointIsALeaf() {
        PartitionTree single = PartitionTree.build(new double[][] { { 1.0, 2.0 } }, 5, new Random(0));
        assertEquals(1, single.getNumberOfNodes());
        assertEquals(0.0, single.getPathLength(new double[] { 100.0, -3.0 }), EPSILON);
    }

    @Test
    public void testConstantPointsStayInOneLeaf() {
        double[][] constant = new double[10][];
        for (int i = 0; i < constant.length; i++) {
            constant[i] = new double[] { 0.5, 0.5 };
        }
        PartitionTree leaf = PartitionTree.build(constant, 4, new Random(0));
        assertEquals(1, leaf.getNumberOfNodes());
        assertEquals(CommonUtils.averagePathLength(10), leaf.getPathLength(new double[] { 0.5, 0.5 }), EPSILON);
    }

    @Test
    public void testZeroDepthGivesSingleLeaf() {
        PartitionTree leaf = PartitionTree.build(points, 0, new Random(0));
        assertEquals(1, leaf.getNumberOfNodes());
        assertEquals(256, leaf.getMass());
    }

    @Test
    public void testOutlierHasShorterPathOnAverage() {
        Random random = new Random(11);
        double inlier = 0;
        double outlier = 0;
        int trees = 50;
        for (int t = 0; t < trees; t++) {
            PartitionTree next = PartitionTree.build(points, CommonUtils.maximumDepth(256), random);
            for (double[] point : points) {
                inlier += next.getPathLength(point) / points.length;
            }
            outlier += next.getPathLength(new double[] { 0.9, 0.9, 0.9 });
        }
        assertTrue(outlier / trees < inlier / trees);
    }

    @Test
    public void testSameSeedBuildsSameTree() {
        PartitionTree other = PartitionTree.build(points, CommonUtils.maximumDepth(256), new Random(7));
        for (double[] point : points) {
            assertEquals(tree.getPathLength(point), other.getPathLength(point), EPSILON);
        }
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> PartitionTree.build(new double[0][], 3, new Random()));
        assertThrows(IllegalArgumentException.class,
                () -> PartitionTree.build(new double[][] { { 1.0 }, { 1.0, 2.0 } }, 3, new Random()));
        assertThrows(IllegalArgumentException.class, () -> new PartitionTree(new int[] { 0 }, new double[] { 0.5 },
                new int[] { 5 }, new int[] { 6 }, new int[] { 0 }, 1));
    }
}
