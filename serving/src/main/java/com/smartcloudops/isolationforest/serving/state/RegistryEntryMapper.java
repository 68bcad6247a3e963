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

import static com.smartcloudops.isolationforest.CommonUtils.checkArgument;
import static com.smartcloudops.isolationforest.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;

import lombok.Getter;
import lombok.Setter;

import com.smartcloudops.isolationforest.FeatureSchema;
import com.smartcloudops.isolationforest.serving.registry.Algorithm;
import com.smartcloudops.isolationforest.serving.registry.ModelMetadata;
import com.smartcloudops.isolationforest.serving.registry.RegistryEntry;
import com.smartcloudops.isolationforest.serving.registry.ScorerArtifact;
import com.smartcloudops.isolationforest.serving.threshold.ClassificationMetrics;
import com.smartcloudops.isolationforest.state.IStateMapper;
import com.smartcloudops.isolationforest.state.IsolationForestMapper;

/**
 * Maps a {@link RegistryEntry} to a {@link RegistryEntryState} and back. The
 * active and production flags are carried over as stored; repairing them is
 * left to the registry.
 */
@Getter
@Setter
public class RegistryEntryMapper implements IStateMapper<RegistryEntry, RegistryEntryState> {

    private IsolationForestMapper forestMapper = new IsolationForestMapper();

    @Override
    public RegistryEntryState toState(RegistryEntry model) {
        checkNotNull(model, "model must not be null");
        ModelMetadata metadata = model.getMetadata();
        RegistryEntryState state = new RegistryEntryState();
        state.setModelVersion(metadata.getVersion());
        state.setAlgorithm(metadata.getAlgorithm().name());
        state.setCreatedAt(metadata.getCreatedAt());
        state.setMetrics(toState(metadata.getMetrics()));
        state.setThreshold(metadata.getThreshold());
        state.setFeatureNames(new ArrayList<>(metadata.getSchema().getFieldNames()));
        state.setTrainingDataSize(metadata.getTrainingDataSize());
        state.setHyperparameters(new LinkedHashMap<>(metadata.getHyperparameters()));
        state.setActive(metadata.isActive());
        state.setProduction(metadata.isProduction());
        if (model.getArtifact().getAlgorithm() == Algorithm.ISOLATION_FOREST) {
            state.setIsolationForest(forestMapper.toState(model.getArtifact().getIsolationForest()));
        }
        return state;
    }

    @Override
    public RegistryEntry toModel(RegistryEntryState state) {
        checkNotNull(state, "state must not be null");
        checkNotNull(state.getModelVersion(), "state has no model version");
        checkNotNull(state.getAlgorithm(), "state has no algorithm");
        Algorithm algorithm = Algorithm.valueOf(state.getAlgorithm());

        ScorerArtifact artifact;
        switch (algorithm) {
        case ISOLATION_FOREST:
            checkNotNull(state.getIsolationForest(), "state has no forest");
            artifact = ScorerArtifact.isolationForest(forestMapper.toModel(state.getIsolationForest()));
            break;
        default:
            throw new IllegalArgumentException("unsupported algorithm " + algorithm);
        }

        FeatureSchema schema = new FeatureSchema(state.getFeatureNames());
        checkArgument(schema.equals(artifact.getSchema()), "stored schema does not match the stored artifact");
        ModelMetadata metadata = ModelMetadata.builder().version(state.getModelVersion()).algorithm(algorithm)
                .createdAt(state.getCreatedAt()).metrics(toModel(state.getMetrics()))
                .threshold(state.getThreshold()).schema(schema).trainingDataSize(state.getTrainingDataSize())
                .hyperparameters(state.getHyperparameters() == null ? new LinkedHashMap<>()
                        : state.getHyperparameters())
                .active(state.isActive()).production(state.isProduction()).build();
        return new RegistryEntry(artifact, metadata);
    }

    private static ClassificationMetricsState toState(ClassificationMetrics metrics) {
        ClassificationMetricsState state = new ClassificationMetricsState();
        state.setAccuracy(metrics.getAccuracy());
        state.setPrecision(metrics.getPrecision());
        state.setRecall(metrics.getRecall());
        state.setF1(metrics.getF1());
        state.setAuc(metrics.getAuc());
        state.setTruePositives(metrics.getTruePositives());
        state.setFalsePositives(metrics.getFalsePositives());
        state.setTrueNegatives(metrics.getTrueNegatives());
        state.setFalseNegatives(metrics.getFalseNegatives());
        return state;
    }

    private static ClassificationMetrics toModel(ClassificationMetricsState state) {
        checkNotNull(state, "state has no metrics");
        return new ClassificationMetrics(state.getAccuracy(), state.getPrecision(), state.getRecall(), state.getF1(),
                state.getAuc(), state.getTruePositives(), state.getFalsePositives(), state.getTrueNegatives(),
                state.getFalseNegatives());
    }
}
