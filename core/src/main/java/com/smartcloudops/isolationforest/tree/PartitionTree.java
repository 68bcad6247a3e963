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

import static com.smartcloudops.isolationforest.CommonUtils.checkArgument;
import static com.smartcloudops.isolationforest.CommonUtils.checkNotNull;
import static com.smartcloudops.isolationforest.CommonUtils.checkState;

import java.util.Arrays;
import java.util.Random;

import com.smartcloudops.isolationforest.Visitor;
import com.smartcloudops.isolationforest.anomalydetection.PathLengthVisitor;

/**
 * A randomized binary partition tree built over a subsample of training
 * points. Every internal node splits on a random feature at a random value
 * strictly inside the range that feature spans over the points reaching the
 * node; every leaf records how many points it holds. The tree is stored as
 * parallel arrays indexed by node number, with the root at index 0, and is
 * never modified after construction.
 */
public class PartitionTree {

    public static final int LEAF = -1;

    private final int[] cutFeature;

    private final double[] cutValue;

    private final int[] leftChild;

    private final int[] rightChild;

    private final int[] leafSize;

    private final int maxDepth;

    /**
     * Creates a tree from its node arrays, as produced by {@link #build} or
     * restored from a saved state.
     */
    public PartitionTree(int[] cutFeature, double[] cutValue, int[] leftChild, int[] rightChild, int[] leafSize,
            int maxDepth) {
        checkNotNull(cutFeature, "cutFeature must not be null");
        checkNotNull(cutValue, "cutValue must not be null");
        checkNotNull(leftChild, "leftChild must not be null");
        checkNotNull(rightChild, "rightChild must not be null");
        checkNotNull(leafSize, "leafSize must not be null");
        int nodes = cutFeature.length;
        checkArgument(nodes > 0, "a tree needs at least one node");
        checkArgument(cutValue.length == nodes && leftChild.length == nodes && rightChild.length == nodes
                && leafSize.length == nodes, "node arrays must have equal length");
        checkArgument(maxDepth >= 0, "maxDepth must be non-negative");
        for (int i = 0; i < nodes; i++) {
            if (cutFeature[i] != LEAF) {
                checkArgument(leftChild[i] > i && leftChild[i] < nodes && rightChild[i] > i && rightChild[i] < nodes,
                        "invalid child reference at node " + i);
            }
        }
        this.cutFeature = cutFeature.clone();
        this.cutValue = cutValue.clone();
        this.leftChild = leftChild.clone();
        this.rightChild = rightChild.clone();
        this.leafSize = leafSize.clone();
        this.maxDepth = maxDepth;
    }

    /**
     * Builds a tree over the given points.
     *
     * @param points   the subsample, one row per point; rows are not modified
     * @param maxDepth depth at which a branch is closed regardless of its size
     * @param random   source of the feature and split choices
     * @return the tree
     */
    public static PartitionTree build(double[][] points, int maxDepth, Random random) {
        checkNotNull(points, "points must not be null");
        checkNotNull(random, "random must not be null");
        checkArgument(points.length > 0, "cannot build a tree without points");
        checkArgument(maxDepth >= 0, "maxDepth must be non-negative");
        return new Builder(points, random, maxDepth).build();
    }

    /**
     * Sends a visitor from the root to the leaf that the point falls into.
     * Points strictly below a node's split value go left, all others go right.
     *
     * @param point   the point defining the path
     * @param visitor the visitor to invoke on each node of the path
     * @param <R>     visitor result type
     * @return the visitor's result
     */
    public <R> R traverse(double[] point, Visitor<R> visitor) {
        checkNotNull(point, "point must not be null");
        checkNotNull(visitor, "visitor must not be null");
        NodeView view = new NodeView();
        int node = 0;
        int depth = 0;
        while (cutFeature[node] != LEAF) {
            view.node = node;
            visitor.acceptInternal(view, depth);
            node = (point[cutFeature[node]] < cutValue[node]) ? leftChild[node] : rightChild[node];
            ++depth;
        }
        view.node = node;
        visitor.acceptLeaf(view, depth);
        return visitor.getResult();
    }

    /**
     * @param point a point with as many values as the training points
     * @return the isolation path length of the point in this tree
     */
    public double getPathLength(double[] point) {
        return traverse(point, new PathLengthVisitor());
    }

    public int getNumberOfNodes() {
        return cutFeature.length;
    }

    /**
     * @return the number of training points this tree was built from
     */
    public int getMass() {
        int mass = 0;
        for (int size : leafSize) {
            mass += size;
        }
        return mass;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int[] getCutFeature() {
        return cutFeature.clone();
    }

    public double[] getCutValue() {
        return cutValue.clone();
    }

    public int[] getLeftChild() {
        return leftChild.clone();
    }

    public int[] getRightChild() {
        return rightChild.clone();
    }

    public int[] getLeafSize() {
        return leafSize.clone();
    }

    class NodeView implements INodeView {

        int node;

        @Override
        public boolean isLeaf() {
            return cutFeature[node] == LEAF;
        }

        @Override
        public int getLeafSize() {
            return leafSize[node];
        }

        @Override
        public int getCutFeature() {
            return cutFeature[node];
        }

        @Override
        public double getCutValue() {
            return cutValue[node];
        }
    }

    /**
     * Recursive construction over an index permutation of the points; each node
     * owns a contiguous range of the permutation, which is partitioned in place
     * at every split.
     */
    static class Builder {

        private static final int MAX_SPLIT_ATTEMPTS = 16;

        private final double[][] points;

        private final Random random;

        private final int maxDepth;

        private final int[] order;

        private final int[] featureBuffer;

        private int[] cutFeature;

        private double[] cutValue;

        private int[] leftChild;

        private int[] rightChild;

        private int[] leafSize;

        private int size;

        Builder(double[][] points, Random random, int maxDepth) {
            this.points = points;
            this.random = random;
            this.maxDepth = maxDepth;
            int dimensions = points[0].length;
            checkArgument(dimensions > 0, "points must have at least one feature");
            for (double[] point : points) {
                checkArgument(point != null && point.length == dimensions, "points must have equal dimensions");
            }
            this.order = new int[points.length];
            for (int i = 0; i < order.length; i++) {
                order[i] = i;
            }
            this.featureBuffer = new int[dimensions];
            // a binary tree with n leaves has 2n - 1 nodes
            int capacity = 2 * points.length - 1;
            cutFeature = new int[capacity];
            cutValue = new double[capacity];
            leftChild = new int[capacity];
            rightChild = new int[capacity];
            leafSize = new int[capacity];
        }

        PartitionTree build() {
            buildNode(0, points.length, 0);
            return new PartitionTree(Arrays.copyOf(cutFeature, size), Arrays.copyOf(cutValue, size),
                    Arrays.copyOf(leftChild, size), Arrays.copyOf(rightChild, size), Arrays.copyOf(leafSize, size),
                    maxDepth);
        }

        private int buildNode(int from, int to, int depth) {
            int node = size++;
            checkState(node < cutFeature.length, "node capacity exceeded");
            int count = to - from;
            if (count <= 1 || depth >= maxDepth) {
                return leaf(node, count);
            }

            // only features that still vary over this node admit a strict split
            int candidates = 0;
            for (int feature = 0; feature < featureBuffer.length; feature++) {
                if (Math.nextUp(min(from, to, feature)) < max(from, to, feature)) {
                    featureBuffer[candidates++] = feature;
                }
            }
            if (candidates == 0) {
                return leaf(node, count);
            }

            int feature = featureBuffer[random.nextInt(candidates)];
            double low = min(from, to, feature);
            double high = max(from, to, feature);
            double split = chooseSplit(low, high);

            int boundary = partition(from, to, feature, split);
            cutFeature[node] = feature;
            cutValue[node] = split;
            leafSize[node] = 0;
            leftChild[node] = buildNode(from, boundary, depth + 1);
            rightChild[node] = buildNode(boundary, to, depth + 1);
            return node;
        }

        /**
         * A uniform value strictly inside (low, high); the caller guarantees at
         * least one double lies between the bounds.
         */
        private double chooseSplit(double low, double high) {
            for (int attempt = 0; attempt < MAX_SPLIT_ATTEMPTS; attempt++) {
                double split = low + random.nextDouble() * (high - low);
                if (split > low && split < high) {
                    return split;
                }
            }
            double middle = low + (high - low) / 2;
            return (middle > low && middle < high) ? middle : Math.nextUp(low);
        }

        private int leaf(int node, int count) {
            cutFeature[node] = LEAF;
            cutValue[node] = 0.0;
            leftChild[node] = LEAF;
            rightChild[node] = LEAF;
            leafSize[node] = count;
            return node;
        }

        /**
         * Moves points strictly below the split to the front of the range.
         *
         * @return the first index of the right partition
         */
        private int partition(int from, int to, int feature, double split) {
            int boundary = from;
            for (int i = from; i < to; i++) {
                if (points[order[i]][feature] < split) {
                    int swap = order[boundary];
                    order[boundary] = order[i];
                    order[i] = swap;
                    ++boundary;
                }
            }
            return boundary;
        }

        private double min(int from, int to, int feature) {
            double result = Double.POSITIVE_INFINITY;
            for (int i = from; i < to; i++) {
                result = Math.min(result, points[order[i]][feature]);
            }
            return result;
        }

        private double max(int from, int to, int feature) {
            double result = Double.NEGATIVE_INFINITY;
            for (int i = from; i < to; i++) {
                result = Math.max(result, points[order[i]][feature]);
            }
            return result;
        }
    }
}
