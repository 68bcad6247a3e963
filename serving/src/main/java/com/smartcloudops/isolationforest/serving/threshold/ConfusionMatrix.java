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

import lombok.Getter;

/**
 * Counts of predicted versus actual labels, with the anomaly label as the
 * positive class. Ratios whose denominator is zero are reported as 0.
 * Instances are not thread-safe.
 */
@Getter
public class ConfusionMatrix {

    private long truePositives;

    private long falsePositives;

    private long trueNegatives;

    private long falseNegatives;

    /**
     * @param predicted predicted label, 0 or 1
     * @param actual    ground truth, 0 or 1
     */
    public void add(int predicted, int actual) {
        checkArgument(predicted == 0 || predicted == 1, "predicted label must be 0 or 1");
        checkArgument(actual == 0 || actual == 1, "actual label must be 0 or 1");
        if (predicted == 1) {
            if (actual == 1) {
                truePositives++;
            } else {
                falsePositives++;
            }
        } else if (actual == 1) {
            falseNegatives++;
        } else {
            trueNegatives++;
        }
    }

    public long getTotal() {
        return truePositives + falsePositives + trueNegatives + falseNegatives;
    }

    public double accuracy() {
        return ratio(truePositives + trueNegatives, getTotal());
    }

    public double precision() {
        return ratio(truePositives, truePositives + falsePositives);
    }

    public double recall() {
        return ratio(truePositives, truePositives + falseNegatives);
    }

    public double f1() {
        double precision = precision();
        double recall = recall();
        if (precision + recall == 0) {
            return 0.0;
        }
        return 2 * precision * recall / (precision + recall);
    }

    private static double ratio(long numerator, long denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }
}
