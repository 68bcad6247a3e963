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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The evaluation of one decision threshold: the threshold dependent ratios,
 * the threshold independent AUC of the scores they came from, and the
 * confusion counts behind them.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ClassificationMetrics {

    private final double accuracy;

    private final double precision;

    private final double recall;

    private final double f1;

    private final double auc;

    private final long truePositives;

    private final long falsePositives;

    private final long trueNegatives;

    private final long falseNegatives;

    public ClassificationMetrics(double accuracy, double precision, double recall, double f1, double auc,
            long truePositives, long falsePositives, long trueNegatives, long falseNegatives) {
        this.accuracy = accuracy;
        this.precision = precision;
        this.recall = recall;
        this.f1 = f1;
        this.auc = auc;
        this.truePositives = truePositives;
        this.falsePositives = falsePositives;
        this.trueNegatives = trueNegatives;
        this.falseNegatives = falseNegatives;
    }

    public static ClassificationMetrics of(ConfusionMatrix matrix, double auc) {
        return new ClassificationMetrics(matrix.accuracy(), matrix.precision(), matrix.recall(), matrix.f1(), auc,
                matrix.getTruePositives(), matrix.getFalsePositives(), matrix.getTrueNegatives(),
                matrix.getFalseNegatives());
    }

    /**
     * @return accuracy + precision + recall + F1
     */
    public double sum() {
        return accuracy + precision + recall + f1;
    }
}
