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

import java.util.function.ToDoubleFunction;

/**
 * Factory methods for common threshold policies.
 */
public class ThresholdPolicies {

    private ThresholdPolicies() {
    }

    /**
     * Prefers candidates meeting more of the four cutoffs; among candidates
     * meeting the same number, prefers the larger sum of the four metrics.
     *
     * @param accuracyMin  accuracy cutoff
     * @param precisionMin precision cutoff
     * @param recallMin    recall cutoff
     * @param f1Min        F1 cutoff
     * @return the policy
     */
    public static ThresholdPolicy targetCount(double accuracyMin, double precisionMin, double recallMin,
            double f1Min) {
        return metrics -> {
            int met = 0;
            met += metrics.getAccuracy() >= accuracyMin ? 1 : 0;
            met += metrics.getPrecision() >= precisionMin ? 1 : 0;
            met += metrics.getRecall() >= recallMin ? 1 : 0;
            met += metrics.getF1() >= f1Min ? 1 : 0;
            // the sum of four ratios is at most 4, so one more cutoff always outweighs it
            return 10.0 * met + metrics.sum();
        };
    }

    /**
     * Maximizes recall among candidates whose precision reaches the floor, with
     * precision breaking ties. Candidates below the floor rank below every
     * candidate above it and among themselves by precision.
     *
     * @param precisionFloor the minimum precision, in [0,1]
     * @return the policy
     */
    public static ThresholdPolicy recallWithPrecisionFloor(double precisionFloor) {
        checkArgument(precisionFloor >= 0 && precisionFloor <= 1, "precisionFloor must be in [0,1]");
        return metrics -> {
            if (metrics.getPrecision() < precisionFloor) {
                return metrics.getPrecision() - 2.0;
            }
            // recall differs by at least 1/positives, far above the precision term
            return 2.0 + metrics.getRecall() + 1e-9 * metrics.getPrecision();
        };
    }

    public static ThresholdPolicy maximize(ToDoubleFunction<ClassificationMetrics> metric) {
        checkNotNull(metric, "metric must not be null");
        return metric::applyAsDouble;
    }

    public static ThresholdPolicy weighted(double accuracyWeight, double precisionWeight, double recallWeight,
            double f1Weight) {
        return metrics -> accuracyWeight * metrics.getAccuracy() + precisionWeight * metrics.getPrecision()
                + recallWeight * metrics.getRecall() + f1Weight * metrics.getF1();
    }
}
