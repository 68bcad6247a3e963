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

package com.smartcloudops.isolationforest.serving.state;

import static com.smartcloudops.isolationforest.state.Version.V1_0;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import lombok.Data;

import com.smartcloudops.isolationforest.state.IsolationForestState;

/**
 * A class that encapsulates the complete state of a registry entry: the
 * metadata fields and the artifact payload selected by {@code algorithm}.
 */
@Data
public class RegistryEntryState {

    private String version = V1_0;

    private String modelVersion;

    private String algorithm;

    private Instant createdAt;

    private ClassificationMetricsState metrics;

    private double threshold;

    private List<String> featureNames;

    private long trainingDataSize;

    private Map<String, Object> hyperparameters;

    private boolean active;

    private boolean production;

    private IsolationForestState isolationForest;
}
