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

import static com.smartcloudops.isolationforest.CommonUtils.checkArgument;
import static com.smartcloudops.isolationforest.CommonUtils.checkNotNull;
import static com.smartcloudops.isolationforest.CommonUtils.isolationScore;
import static com.smartcloudops.isolationforest.CommonUtils.maximumDepth;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import lombok.AccessLevel;
import lombok.Getter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.smartcloudops.isolationforest.anomalydetection.PathLengthVisitor;
import com.smartcloudops.isolationforest.exception.InvalidTrainingDataException;
import com.smartcloudops.isolationforest.executor.AbstractForestTraversalExecutor;
import com.smartcloudops.isolationforest.executor.ParallelForestTraversalExecutor;
import com.smartcloudops.isolationforest.executor.SequentialForestTraversalExecutor;
import com.smartcloudops.isolationforest.tree.PartitionTree;
import com.smartcloudops.isolationforest.util.Deadline;

/**
 * The IsolationForest class is the scoring artifact of this package: an
 * ensemble of randomized partition trees, each built over a subsample of the
 * training vectors drawn without replacement. A point that is separated from
 * the rest of the data after few random splits is unusual; the anomaly score
 * turns the average isolation path length into a value in [0,1], where values
 * close to 1 mark anomalies.
 * <p>
 * A trained forest is immutable. Scoring performs no mutation and may be called
 * from any number of threads concurrently. The random seed used for training is
 * kept with the artifact so that retraining on the same data reproduces it.
 */
@Getter
public class IsolationForest {

    private static final Logger logger = LogManager.getLogger(IsolationForest.class);

    /**
     * Default number of trees in the ensemble.
     */
    public static final int DEFAULT_NUMBER_OF_TREES = 100;

    /**
     * Default number of training points used to build each tree.
     */
    public static final int DEFAULT_SUBSAMPLE_SIZE = 256;

    /**
     * Parallel traversal is off by default; the serving layer parallelizes across
     * requests instead.
     */
    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    private final FeatureSchema schema;

    private final int numberOfTrees;

    private final int subsampleSize;

    private final long randomSeed;

    private final boolean parallelExecutionEnabled;

    private final int threadPoolSize;

    private final List<PartitionTree> trees;

    @Getter(AccessLevel.NONE)
    private final AbstractForestTraversalExecutor traversalExecutor;

    /**
     * Assembles a forest from already built trees, for instance when restoring a
     * saved state.
     *
     * @param builder the configuration; its schema and seed must be set
     * @param trees   the trees of the ensemble
     */
    public IsolationForest(Builder<?> builder, List<PartitionTree> trees) {
        checkNotNull(builder, "builder must not be null");
        checkNotNull(trees, "trees must not be null");
        checkArgument(builder.schema.isPresent(), "schema must be set");
        checkArgument(trees.size() == builder.numberOfTrees, "number of trees does not match configuration");
        checkArgument(builder.subsampleSize > 0, "subsampleSize must be positive");
        this.schema = builder.schema.get();
        this.numberOfTrees = builder.numberOfTrees;
        this.subsampleSize = builder.subsampleSize;
        this.randomSeed = builder.randomSeed.orElse(0L);
        this.parallelExecutionEnabled = builder.parallelExecutionEnabled;
        this.threadPoolSize = builder.threadPoolSize.orElse(Runtime.getRuntime().availableProcessors());
        this.trees = Collections.unmodifiableList(new ArrayList<>(trees));
        if (parallelExecutionEnabled) {
            traversalExecutor = new ParallelForestTraversalExecutor(this.trees, threadPoolSize);
        } else {
            traversalExecutor = new SequentialForestTraversalExecutor(this.trees);
        }
    }

    /**
     * @return a new builder.
     */
    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * Train a sequential forest with the given parameters.
     *
     * @param samples       training vectors, all with the same schema
     * @param treeCount     number of trees
     * @param subsampleSize number of vectors drawn for each tree
     * @param seed          seed of the random generator used for subsampling and
     *                      splitting
     * @return the trained forest
     * @throws InvalidTrainingDataException if the samples are empty or fewer than
     *                                      the subsample size
     */
    public static IsolationForest train(List<FeatureVector> samples, int treeCount, int subsampleSize, long seed) {
        return builder().numberOfTrees(treeCount).subsampleSize(subsampleSize).randomSeed(seed).train(samples);
    }

    /**
     * Score a point using the default scoring method. The scoring method is
     * deterministic for a given forest and point.
     *
     * @param vector a vector with the schema this forest was trained with
     * @return anomaly score in [0,1]; higher is more anomalous
     * @throws com.smartcloudops.isolationforest.exception.MalformedFeatureVectorException
     *         if the vector has another schema
     */
    public double getAnomalyScore(FeatureVector vector) {
        return getAnomalyScore(vector, Deadline.none());
    }

    /**
     * Score a point, abandoning the computation when the deadline passes. The
     * deadline is checked between trees.
     *
     * @param vector   a vector with the schema this forest was trained with
     * @param deadline the time after which scoring is abandoned
     * @return anomaly score in [0,1]; higher is more anomalous
     * @throws com.smartcloudops.isolationforest.exception.ScoringTimeoutException
     *         if the deadline passes before every tree was visited
     */
    public double getAnomalyScore(FeatureVector vector, Deadline deadline) {
        double averagePathLength = getAveragePathLength(vector, deadline);
        return isolationScore(averagePathLength, subsampleSize);
    }

    /**
     * @param vector   a vector with the schema this forest was trained with
     * @param deadline the time after which scoring is abandoned
     * @return E[h(x)], the path length averaged over all trees
     */
    public double getAveragePathLength(FeatureVector vector, Deadline deadline) {
        checkNotNull(vector, "vector must not be null");
        checkNotNull(deadline, "deadline must not be null");
        vector.checkConformsTo(schema);
        double[] point = vector.toArray();
        return traversalExecutor.traverseForest(point, (tree, x) -> new PathLengthVisitor(), Double::sum,
                sum -> sum / numberOfTrees, deadline);
    }

    public int getDimensions() {
        return schema.size();
    }

    public static class Builder<T extends Builder<T>> {

        // We use Optional types for optional fields when it doesn't make
        // sense to use a constant default.

        private Optional<FeatureSchema> schema = Optional.empty();
        private int numberOfTrees = DEFAULT_NUMBER_OF_TREES;
        private int subsampleSize = DEFAULT_SUBSAMPLE_SIZE;
        private Optional<Long> randomSeed = Optional.empty();
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();

        public T schema(FeatureSchema schema) {
            this.schema = Optional.of(schema);
            return (T) this;
        }

        public T numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return (T) this;
        }

        public T subsampleSize(int subsampleSize) {
            this.subsampleSize = subsampleSize;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }

        /**
         * Builds the trees of the forest over the samples. When no seed was given,
         * one is drawn and recorded on the trained forest.
         *
         * @param samples training vectors, all with the same schema
         * @return the trained forest
         * @throws InvalidTrainingDataException if the samples cannot train a forest
         *                                      with this configuration
         */
        public IsolationForest train(List<FeatureVector> samples) {
            if (samples == null || samples.isEmpty()) {
                throw new InvalidTrainingDataException("training requires at least one sample");
            }
            if (numberOfTrees < 1) {
                throw new InvalidTrainingDataException("numberOfTrees must be at least 1, got " + numberOfTrees);
            }
            if (subsampleSize < 1 || subsampleSize > samples.size()) {
                throw new InvalidTrainingDataException(String.format(
                        "subsampleSize must be between 1 and the number of samples %d, got %d", samples.size(),
                        subsampleSize));
            }
            checkArgument(!threadPoolSize.isPresent() || threadPoolSize.get() > 0, "threadPoolSize must be positive");
            FeatureSchema trainingSchema = schema.orElse(samples.get(0).getSchema());
            double[][] data = new double[samples.size()][];
            for (int i = 0; i < data.length; i++) {
                FeatureVector sample = samples.get(i);
                if (sample == null || !sample.conformsTo(trainingSchema)) {
                    throw new InvalidTrainingDataException(
                            "sample " + i + " does not match the training schema " + trainingSchema);
                }
                data[i] = sample.toArray();
            }

            long seed = randomSeed.orElseGet(() -> new Random().nextLong());
            Random random = new Random(seed);
            int maxDepth = maximumDepth(subsampleSize);
            List<PartitionTree> trees = new ArrayList<>(numberOfTrees);
            for (int i = 0; i < numberOfTrees; i++) {
                trees.add(PartitionTree.build(subsample(data, subsampleSize, random), maxDepth, random));
            }
            logger.debug("trained {} trees of depth at most {} over {} samples with seed {}", numberOfTrees, maxDepth,
                    data.length, seed);

            schema = Optional.of(trainingSchema);
            randomSeed = Optional.of(seed);
            return new IsolationForest(this, trees);
        }

        /**
         * Draws {@code size} distinct rows with a partial Fisher-Yates shuffle.
         */
        static double[][] subsample(double[][] data, int size, Random random) {
            int[] indices = new int[data.length];
            for (int i = 0; i < indices.length; i++) {
                indices[i] = i;
            }
            double[][] sample = new double[size][];
            for (int i = 0; i < size; i++) {
                int j = i + random.nextInt(data.length - i);
                int swap = indices[i];
                indices[i] = indices[j];
                indices[j] = swap;
                sample[i] = data[indices[i]];
            }
            return sample;
        }
    }
}
