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

package com.smartcloudops.isolationforest.serving.training;

import static com.smartcloudops.isolationforest.CommonUtils.checkArgument;
import static com.smartcloudops.isolationforest.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.Getter;

import com.smartcloudops.isolationforest.IsolationForest;
import com.smartcloudops.isolationforest.serving.registry.Algorithm;
import com.smartcloudops.isolationforest.serving.threshold.LabeledVector;
import com.smartcloudops.isolationforest.serving.threshold.ThresholdPolicies;
import com.smartcloudops.isolationforest.serving.threshold.ThresholdPolicy;

/**
 * Everything needed to train, evaluate and register one model.
 */
@Getter
public class TrainingRequest {

    public static final double DEFAULT_VALIDATION_FRACTION = 0.2;

    /**
     * Used when the caller does not choose a policy: count the metrics reaching
     * 0.95, then prefer the larger metric sum.
     */
    public static final ThresholdPolicy DEFAULT_POLICY = ThresholdPolicies.targetCount(0.95, 0.95, 0.95, 0.95);

    private final List<LabeledVector> samples;

    private final Algorithm algorithm;

    private final Optional<String> version;

    private final int numberOfTrees;

    private final int subsampleSize;

    private final Optional<Long> randomSeed;

    private final double validationFraction;

    private final ThresholdPolicy policy;

    protected TrainingRequest(Builder builder) {
        checkNotNull(builder.samples, "samples must not be null");
        checkNotNull(builder.algorithm, "algorithm must not be null");
        checkNotNull(builder.policy, "policy must not be null");
        checkArgument(builder.validationFraction > 0 && builder.validationFraction < 1,
                "validationFraction must be in (0,1)");
        samples = Collections.unmodifiableList(new ArrayList<>(builder.samples));
        algorithm = builder.algorithm;
        version = builder.version;
        numberOfTrees = builder.numberOfTrees;
        subsampleSize = builder.subsampleSize;
        randomSeed = builder.randomSeed;
        validationFraction = builder.validationFraction;
        policy = builder.policy;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private List<LabeledVector> samples;
        private Algorithm algorithm = Algorithm.ISOLATION_FOREST;
        private Optional<String> version = Optional.empty();
        private int numberOfTrees = IsolationForest.DEFAULT_NUMBER_OF_TREES;
        private int subsampleSize = IsolationForest.DEFAULT_SUBSAMPLE_SIZE;
        private Optional<Long> randomSeed = Optional.empty();
        private double validationFraction = DEFAULT_VALIDATION_FRACTION;
        private ThresholdPolicy policy = DEFAULT_POLICY;

        public Builder samples(List<LabeledVector> samples) {
            this.samples = samples;
            return this;
        }

        public Builder algorithm(Algorithm algorithm) {
            this.algorithm = algorithm;
            return this;
        }

        public Builder version(String version) {
            this.version = Optional.of(version);
            return this;
        }

        public Builder numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return this;
        }

        /**
         * Capped at the number of training samples.
         */
        public Builder subsampleSize(int subsampleSize) {
            this.subsampleSize = subsampleSize;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return this;
        }

        public Builder validationFraction(double validationFraction) {
            this.validationFraction = validationFraction;
            return this;
        }

        public Builder policy(ThresholdPolicy policy) {
            this.policy = policy;
            return this;
        }

        public TrainingRequest build() {
            return new TrainingRequest(this);
        }
    }
}
