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

package com.smartcloudops.isolationforest.serving.abtest;

import static com.smartcloudops.isolationforest.CommonUtils.checkArgument;
import static com.smartcloudops.isolationforest.CommonUtils.checkNotNull;

import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

/**
 * One record of a test: either a prediction served by an arm, possibly with
 * the ground truth already known, or ground truth that arrived later for an
 * earlier prediction. Only served predictions count towards the operational
 * figures of an arm. Outcomes are appended and aggregated, never changed.
 */
@Getter
@ToString
public final class ABTestOutcome {

    private final String testId;

    private final String assignedVersion;

    private final int prediction;

    @Getter(AccessLevel.NONE)
    private final Integer actualLabel;

    private final double confidence;

    @Getter(AccessLevel.NONE)
    private final Double latencyMillis;

    private final Instant timestamp;

    /** set for ground truth recorded after the prediction was served */
    private final boolean groundTruth;

    public ABTestOutcome(String testId, String assignedVersion, int prediction, Optional<Integer> actualLabel,
            double confidence, OptionalDouble latencyMillis, Instant timestamp) {
        this(testId, assignedVersion, prediction, actualLabel, confidence, latencyMillis, timestamp, false);
    }

    private ABTestOutcome(String testId, String assignedVersion, int prediction, Optional<Integer> actualLabel,
            double confidence, OptionalDouble latencyMillis, Instant timestamp, boolean groundTruth) {
        checkNotNull(actualLabel, "actualLabel must not be null");
        checkNotNull(latencyMillis, "latencyMillis must not be null");
        checkArgument(prediction == 0 || prediction == 1, "prediction must be 0 or 1");
        checkArgument(!actualLabel.isPresent() || actualLabel.get() == 0 || actualLabel.get() == 1,
                "actualLabel must be 0 or 1");
        this.testId = checkNotNull(testId, "testId must not be null");
        this.assignedVersion = checkNotNull(assignedVersion, "assignedVersion must not be null");
        this.prediction = prediction;
        this.actualLabel = actualLabel.orElse(null);
        this.confidence = confidence;
        this.latencyMillis = latencyMillis.isPresent() ? latencyMillis.getAsDouble() : null;
        this.timestamp = checkNotNull(timestamp, "timestamp must not be null");
        this.groundTruth = groundTruth;
    }

    /**
     * @param prediction  the label predicted when the request was served
     * @param actualLabel the label observed afterwards
     * @return a record that feeds the confusion matrix of its arm only
     */
    public static ABTestOutcome groundTruth(String testId, String assignedVersion, int prediction, int actualLabel,
            Instant timestamp) {
        return new ABTestOutcome(testId, assignedVersion, prediction, Optional.of(actualLabel), Double.NaN,
                OptionalDouble.empty(), timestamp, true);
    }

    public Optional<Integer> getActualLabel() {
        return Optional.ofNullable(actualLabel);
    }

    public OptionalDouble getLatencyMillis() {
        return latencyMillis == null ? OptionalDouble.empty() : OptionalDouble.of(latencyMillis);
    }

    public boolean isLabeled() {
        return actualLabel != null;
    }
}
