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

package com.smartcloudops.isolationforest.testutils;

import java.util.Arrays;

/**
 * Rows of synthetic feature values together with a 0/1 label per row, where 1
 * marks an anomaly.
 */
public class LabeledData {

    public final double[][] data;

    public final int[] labels;

    public LabeledData(double[][] data, int[] labels) {
        if (data.length != labels.length) {
            throw new IllegalArgumentException("every row needs a label");
        }
        this.data = data;
        this.labels = labels;
    }

    public int size() {
        return data.length;
    }

    /**
     * @param label the label to keep
     * @return the rows carrying the label, in their original order
     */
    public double[][] rowsWithLabel(int label) {
        return Arrays.stream(indicesWithLabel(label)).mapToObj(i -> data[i]).toArray(double[][]::new);
    }

    public int[] indicesWithLabel(int label) {
        int[] result = new int[labels.length];
        int count = 0;
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] == label) {
                result[count++] = i;
            }
        }
        return Arrays.copyOf(result, count);
    }
}
