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

import static com.smartcloudops.isolationforest.CommonUtils.checkArgument;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Tracks latency and anomaly flags of the most recent predictions in a sliding
 * window, and lifetime counts of predictions and errors. All methods are
 * thread-safe.
 */
public class PerformanceMonitor {

    private final int windowSize;

    private final Deque<Double> latencies = new ArrayDeque<>();

    private final Deque<Boolean> anomalies = new ArrayDeque<>();

    private long totalPredictions;

    private long totalErrors;

    public PerformanceMonitor(int windowSize) {
        checkArgument(windowSize > 0, "windowSize must be positive");
        this.windowSize = windowSize;
    }

    public synchronized void recordPrediction(double latencyMillis, boolean anomaly) {
        latencies.addLast(latencyMillis);
        anomalies.addLast(anomaly);
        if (latencies.size() > windowSize) {
            latencies.removeFirst();
            anomalies.removeFirst();
        }
        totalPredictions++;
    }

    public synchronized void recordError() {
        totalErrors++;
    }

    public synchronized PerformanceMetrics getMetrics() {
        double errorRate = (double) totalErrors / Math.max(totalPredictions, 1);
        if (latencies.isEmpty()) {
            return new PerformanceMetrics(0, 0, 0, errorRate, totalPredictions, totalErrors);
        }
        double[] sorted = latencies.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);
        double sum = 0;
        for (double latency : sorted) {
            sum += latency;
        }
        long flagged = anomalies.stream().filter(Boolean::booleanValue).count();
        return new PerformanceMetrics(sum / sorted.length, percentile(sorted, 0.95),
                (double) flagged / anomalies.size(), errorRate, totalPredictions, totalErrors);
    }

    public int getWindowSize() {
        return windowSize;
    }

    /**
     * Percentile of sorted values with linear interpolation between the closest
     * ranks.
     */
    static double percentile(double[] sorted, double fraction) {
        double position = fraction * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
    }
}
