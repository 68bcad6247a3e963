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

import java.util.Optional;

import lombok.Getter;
import lombok.ToString;

/**
 * Whether the service can answer requests, and what it would answer them with.
 */
@Getter
@ToString
public final class HealthStatus {

    /** true when a production or active model can serve requests */
    private final boolean healthy;

    private final Optional<String> currentModelVersion;

    private final int registeredModels;

    private final int activeABTests;

    private final PerformanceMetrics performance;

    public HealthStatus(boolean healthy, Optional<String> currentModelVersion, int registeredModels,
            int activeABTests, PerformanceMetrics performance) {
        this.healthy = healthy;
        this.currentModelVersion = currentModelVersion;
        this.registeredModels = registeredModels;
        this.activeABTests = activeABTests;
        this.performance = performance;
    }
}
