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

import java.time.Instant;

import lombok.Getter;
import lombok.ToString;

import com.smartcloudops.isolationforest.serving.registry.ModelMetadata;

/**
 * The registry listing entry exposed to callers.
 */
@Getter
@ToString
public final class ModelSummary {

    private final String version;

    private final String algorithm;

    private final Instant createdAt;

    private final double accuracy;

    private final double f1Score;

    private final double precision;

    private final double recall;

    private final boolean isActive;

    private final boolean isProduction;

    public ModelSummary(String version, String algorithm, Instant createdAt, double accuracy, double f1Score,
            double precision, double recall, boolean isActive, boolean isProduction) {
        this.version = version;
        this.algorithm = algorithm;
        this.createdAt = createdAt;
        this.accuracy = accuracy;
        this.f1Score = f1Score;
        this.precision = precision;
        this.recall = recall;
        this.isActive = isActive;
        this.isProduction = isProduction;
    }

    public static ModelSummary of(ModelMetadata metadata) {
        return new ModelSummary(metadata.getVersion(), metadata.getAlgorithm().getDisplayName(),
                metadata.getCreatedAt(), metadata.getMetrics().getAccuracy(), metadata.getMetrics().getF1(),
                metadata.getMetrics().getPrecision(), metadata.getMetrics().getRecall(), metadata.isActive(),
                metadata.isProduction());
    }
}
