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

package com.smartcloudops.isolationforest.serving.threshold;

import static com.smartcloudops.isolationforest.CommonUtils.checkArgument;
import static com.smartcloudops.isolationforest.CommonUtils.checkNotNull;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.smartcloudops.isolationforest.IsolationForest;
import com.smartcloudops.isolationforest.exception.EmptyValidationSetException;

/**
 * Selects the decision threshold that turns anomaly scores into labels. The
 * validation set is scored once, then every threshold on a regular grid over
 * the observed score range is evaluated and ranked by a caller supplied
 * {@link ThresholdPolicy}. A point is labeled anomalous when its score is at
 * least the threshold.
 */
public class ThresholdOptimizer {

    private static final Logger logger = LogManager.getLogger(ThresholdOptimizer.class);

    public static final double DEFAULT_STEP = 0.01;

    /** upper bound on the number of grid points between the extreme scores */
    public static final long MAX_CANDIDATES = 1_000_000L;

    private final double step;

    public ThresholdOptimizer() {
        this(new Builder());
    }

    protected ThresholdOptimizer(Builder builder) {
        checkArgument(builder.step > 0 && Double.isFinite(builder.step), "step must be positive");
        this.step = builder.step;
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getStep() {
        return step;
    }

    /**
     * Scores the validation set with the forest and selects a threshold.
     *
     * @param forest     the scorer
     * @param validation labeled vectors with the forest's schema
     * @param policy     ranks the candidates
     * @return the winning threshold and the metrics it achieves
     * @throws EmptyValidationSetException if the set does not hold both labels
     */
    public ThresholdResult optimize(IsolationForest forest, List<LabeledVector> validation, ThresholdPolicy policy) {
        checkNotNull(forest, "forest must not be null");
        checkNotNull(validation, "validation must not be null");
        double[] scores = new double[validation.size()];
        int[] labels = new int[validation.size()];
        for (int i = 0; i < scores.length; i++) {
            labels[i] = validation.get(i).getLabel();
        }
        checkBothLabels(labels);
        for (int i = 0; i < scores.length; i++) {
            scores[i] = forest.getAnomalyScore(validation.get(i).getVector());
        }
        return optimize(scores, labels, policy);
    }

    /**
     * Selects a threshold for precomputed scores. Candidates run from the
     * smallest to the largest score in increments of the step, and the largest
     * score is always a candidate. When several candidates reach the best
     * objective, the lowest of them is kept. The grid may hold at most
     * {@link #MAX_CANDIDATES} points.
     *
     * @param scores anomaly scores
     * @param labels 0/1 labels aligned with the scores
     * @param policy ranks the candidates
     * @return the winning threshold and the metrics it achieves
     * @throws EmptyValidationSetException if the labels do not contain both 0
     *                                     and 1
     * @throws IllegalArgumentException    if the step is too small for the
     *                                     range of the scores
     */
    public ThresholdResult optimize(double[] scores, int[] labels, ThresholdPolicy policy) {
        checkNotNull(scores, "scores must not be null");
        checkNotNull(labels, "labels must not be null");
        checkNotNull(policy, "policy must not be null");
        checkArgument(scores.length == labels.length, "scores and labels must have the same length");
        checkBothLabels(labels);

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double score : scores) {
            checkArgument(Double.isFinite(score), "scores must be finite");
            min = Math.min(min, score);
            max = Math.max(max, score);
        }
        double gridSize = Math.ceil((max - min) / step);
        checkArgument(gridSize <= MAX_CANDIDATES, "step " + step + " yields more than " + MAX_CANDIDATES
                + " candidates over the score range [" + min + ", " + max + "]");
        long lastIndex = (long) gridSize;
        double auc = Auc.compute(scores, labels);

        double bestThreshold = Double.NaN;
        ClassificationMetrics bestMetrics = null;
        double bestObjective = Double.NEGATIVE_INFINITY;
        int candidates = 0;
        for (long k = 0;; k++) {
            // multiply instead of accumulating so the grid does not drift
            double threshold = k >= lastIndex ? max : Math.min(min + k * step, max);
            ClassificationMetrics metrics = evaluate(scores, labels, threshold, auc);
            double objective = policy.objective(metrics);
            candidates++;
            if (bestMetrics == null || objective > bestObjective) {
                bestThreshold = threshold;
                bestMetrics = metrics;
                bestObjective = objective;
            }
            if (threshold >= max) {
                break;
            }
        }
        logger.debug("selected threshold {} out of {} candidates in [{}, {}] with objective {}", bestThreshold,
                candidates, min, max, bestObjective);
        return new ThresholdResult(bestThreshold, bestMetrics);
    }

    /**
     * @return the metrics of labeling every score at or above the threshold as
     *         an anomaly
     */
    public static ClassificationMetrics evaluate(double[] scores, int[] labels, double threshold, double auc) {
        ConfusionMatrix matrix = new ConfusionMatrix();
        for (int i = 0; i < scores.length; i++) {
            matrix.add(scores[i] >= threshold ? 1 : 0, labels[i]);
        }
        return ClassificationMetrics.of(matrix, auc);
    }

    private static void checkBothLabels(int[] labels) {
        boolean normal = false;
        boolean anomaly = false;
        for (int label : labels) {
            checkArgument(label == 0 || label == 1, "labels must be 0 or 1, got " + label);
            normal |= label == 0;
            anomaly |= label == 1;
        }
        if (!normal || !anomaly) {
            throw new EmptyValidationSetException(
                    "validation set of size " + labels.length + " must contain both normal and anomalous labels");
        }
    }

    public static class Builder {

        private double step = DEFAULT_STEP;

        public Builder step(double step) {
            this.step = step;
            return this;
        }

        public ThresholdOptimizer build() {
            return new ThresholdOptimizer(this);
        }
    }
}
