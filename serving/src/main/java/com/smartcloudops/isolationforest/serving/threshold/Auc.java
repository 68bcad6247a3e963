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

import java.util.Arrays;
import java.util.Comparator;

/**
 * Area under the ROC curve computed from ranks (the Mann-Whitney U statistic),
 * which is independent of any threshold. Tied scores share the average of the
 * ranks they span.
 */
public class Auc {

    private Auc() {
    }

    /**
     * @param scores anomaly scores, higher is more anomalous
     * @param labels 0/1 labels aligned with the scores
     * @return the probability that a random anomaly scores above a random normal
     *         point, counting ties as one half
     * @throws IllegalArgumentException if the arrays differ in length or one of
     *                                  the labels is missing
     */
    public static double compute(double[] scores, int[] labels) {
        checkNotNull(scores, "scores must not be null");
        checkNotNull(labels, "labels must not be null");
        checkArgument(scores.length == labels.length, "scores and labels must have the same length");

        Integer[] order = new Integer[scores.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble(i -> scores[i]));

        long positives = 0;
        double positiveRankSum = 0;
        int i = 0;
        while (i < order.length) {
            int j = i;
            while (j + 1 < order.length && scores[order[j + 1]] == scores[order[i]]) {
                j++;
            }
            // ranks are 1-based; the tie group i..j shares their mean
            double rank = (i + j) / 2.0 + 1;
            for (int k = i; k <= j; k++) {
                if (labels[order[k]] == 1) {
                    positives++;
                    positiveRankSum += rank;
                }
            }
            i = j + 1;
        }
        long negatives = scores.length - positives;
        checkArgument(positives > 0 && negatives > 0, "AUC needs both labels");
        return (positiveRankSum - positives * (positives + 1) / 2.0) / ((double) positives * negatives);
    }
}
