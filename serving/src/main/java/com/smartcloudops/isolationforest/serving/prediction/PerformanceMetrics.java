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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A snapshot of serving performance. Latency and anomaly figures cover the
 * recent window; the counts and the error rate cover the service's lifetime.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class PerformanceMetrics {

    private final double averageLatencyMillis;

    private final double p95LatencyMillis;

    private final double anomalyRate;

    /** errors per successful prediction */
    private final double errorRate;

    private final long totalPredictions;

    private final long totalErrors;

    public PerformanceMetrics(double averageLatencyMillis, double p95LatencyMillis, double anomalyRate,
            double errorRate, long totalPredictions, long totalErrors) {
        this.averageLatencyMillis = averageLatencyMillis;
        this.p95LatencyMillis = p95LatencyMillis;
        this.anomalyRate = anomalyRate;
        this.errorRate = errorRate;
        this.totalPredictions = totalPredictions;
        this.totalErrors = totalErrors;
    }
}
