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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.smartcloudops.isolationforest.FeatureVector;

/**
 * A feature vector with its ground truth: 1 for an anomaly, 0 for normal
 * behavior.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class LabeledVector {

    public static final int NORMAL = 0;

    public static final int ANOMALY = 1;

    private final FeatureVector vector;

    private final int label;

    public LabeledVector(FeatureVector vector, int label) {
        checkNotNull(vector, "vector must not be null");
        checkArgument(label == NORMAL || label == ANOMALY, "label must be 0 or 1, got " + label);
        this.vector = vector;
        this.label = label;
    }

    public boolean isAnomaly() {
        return label == ANOMALY;
    }
}
