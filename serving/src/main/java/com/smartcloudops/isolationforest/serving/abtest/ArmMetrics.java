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

import lombok.Getter;
import lombok.ToString;

/**
 * Aggregates of the outcomes of one arm. Accuracy, precision, recall and F1
 * only count outcomes that carry ground truth; the operational figures count
 * every outcome.
 */
@Getter
@ToString
public final class ArmMetrics {

    private final String version;

    private final long totalPredictions;

    private final long labeledCount;

    private final double accuracy;

    private final double precision;

    private final double recall;

    private final double f1;

    /** share of all outcomes predicted anomalous */
    private final double anomalyRate;

    /** mean over outcomes with a recorded latency, 0 when there are none */
    private final double averageLatencyMillis;

    public ArmMetrics(String version, long totalPredictions, long labeledCount, double accuracy, double precision,
            double recall, double f1, double anomalyRate, double averageLatencyMillis) {
        this.version = version;
        this.totalPredictions = totalPredictions;
        this.labeledCount = labeledCount;
        this.accuracy = accuracy;
        this.precision = precision;
        this.recall = recall;
        this.f1 = f1;
        this.anomalyRate = anomalyRate;
        this.averageLatencyMillis = averageLatencyMillis;
    }
}
