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

package com.smartcloudops.isolationforest.serving.prediction;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import lombok.Getter;
import lombok.ToString;

/**
 * The answer to one prediction request. Created per request and never stored
 * by the service.
 */
@Getter
@ToString
public final class PredictionResult {

    /** 1 for an anomaly, 0 for normal */
    private final int classification;

    private final double confidence;

    private final String modelVersion;

    private final double score;

    private final double threshold;

    private final Instant timestamp;

    private final Map<String, Double> inputFeatures;

    /** the A/B test that chose the model, if any */
    private final Optional<String> testId;

    public PredictionResult(int classification, double confidence, String modelVersion, double score,
            double threshold, Instant timestamp, Map<String, Double> inputFeatures, Optional<String> testId) {
        this.classification = classification;
        this.confidence = confidence;
        this.modelVersion = modelVersion;
        this.score = score;
        this.threshold = threshold;
        this.timestamp = timestamp;
        this.inputFeatures = inputFeatures;
        this.testId = testId;
    }

    public boolean isAnomaly() {
        return classification == 1;
    }
}
