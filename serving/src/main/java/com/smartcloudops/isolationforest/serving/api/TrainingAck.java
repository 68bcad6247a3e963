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

package com.smartcloudops.isolationforest.serving.api;

import lombok.Getter;
import lombok.ToString;

import com.smartcloudops.isolationforest.serving.threshold.ClassificationMetrics;

@Getter
@ToString
public final class TrainingAck {

    private final boolean ok;

    private final String version;

    private final double threshold;

    private final ClassificationMetrics metrics;

    public TrainingAck(boolean ok, String version, double threshold, ClassificationMetrics metrics) {
        this.ok = ok;
        this.version = version;
        this.threshold = threshold;
        this.metrics = metrics;
    }
}
