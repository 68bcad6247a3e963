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

import static com.smartcloudops.isolationforest.CommonUtils.checkNotNull;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.smartcloudops.isolationforest.serving.abtest.ABTestController;
import com.smartcloudops.isolationforest.serving.abtest.ABTestMetrics;
import com.smartcloudops.isolationforest.serving.prediction.HealthStatus;
import com.smartcloudops.isolationforest.serving.prediction.PredictionResult;
import com.smartcloudops.isolationforest.serving.prediction.PredictionService;
import com.smartcloudops.isolationforest.serving.registry.Algorithm;
import com.smartcloudops.isolationforest.serving.registry.ModelRegistry;
import com.smartcloudops.isolationforest.serving.registry.RegistryEntry;
import com.smartcloudops.isolationforest.serving.threshold.LabeledVector;
import com.smartcloudops.isolationforest.serving.training.ModelTrainer;
import com.smartcloudops.isolationforest.serving.training.TrainingRequest;

/**
 * The operations offered to the layer that fronts the service, for instance an
 * HTTP router. Failures are thrown as
 * {@link com.smartcloudops.isolationforest.exception.IsolationForestException}
 * subclasses whose {@code ErrorCode} the calling layer maps onto its transport;
 * authentication and authorization are that layer's concern.
 */
public class AnomalyDetectionOperations {

    private static final Logger logger = LogManager.getLogger(AnomalyDetectionOperations.class);

    private final ModelRegistry registry;

    private final ABTestController abTestController;

    private final PredictionService predictionService;

    private final ModelTrainer trainer;

    public AnomalyDetectionOperations(ModelRegistry registry, ABTestController abTestController,
            PredictionService predictionService, ModelTrainer trainer) {
        this.registry = checkNotNull(registry, "registry must not be null");
        this.abTestController = checkNotNull(abTestController, "abTestController must not be null");
        this.predictionService = checkNotNull(predictionService, "predictionService must not be null");
        this.trainer = checkNotNull(trainer, "trainer must not be null");
    }

    /**
     * Error codes: {@code MISSING_FEATURES}, {@code NO_MODEL_AVAILABLE},
     * {@code SCORING_TIMEOUT}.
     */
    public PredictionResult predict(Map<String, Double> features, Optional<String> testId) {
        return predictionService.predict(features, testId);
    }

    public List<ModelSummary> listModels() {
        return registry.listModels().stream().map(ModelSummary::of).collect(Collectors.toList());
    }

    /**
     * Error code: {@code MODEL_NOT_FOUND}.
     */
    public OperationAck promoteModel(String version, boolean toProduction) {
        registry.promote(version, toProduction);
        return OperationAck.ok("model " + version + " promoted to " + (toProduction ? "production" : "active"));
    }

    /**
     * Trains with the default settings and threshold policy and registers the
     * result. Error code: {@code TRAINING_FAILED}.
     */
    public TrainingAck trainModel(List<LabeledVector> samples, Algorithm algorithm) {
        RegistryEntry entry = trainer
                .train(TrainingRequest.builder().samples(samples).algorithm(algorithm).build());
        logger.info("trained model {} through the operations API", entry.getVersion());
        return new TrainingAck(true, entry.getVersion(), entry.getMetadata().getThreshold(),
                entry.getMetadata().getMetrics());
    }

    /**
     * Error codes: {@code DUPLICATE_TEST_ID}, {@code MODEL_NOT_FOUND}.
     */
    public OperationAck startABTest(String testId, String versionA, String versionB, double split,
            long durationSeconds) {
        abTestController.startTest(testId, versionA, versionB, split, Duration.ofSeconds(durationSeconds));
        return OperationAck.ok("test " + testId + " started");
    }

    /**
     * Error code: {@code UNKNOWN_TEST}.
     */
    public OperationAck stopABTest(String testId) {
        abTestController.stopTest(testId);
        return OperationAck.ok("test " + testId + " stopped");
    }

    /**
     * Error code: {@code UNKNOWN_TEST}.
     */
    public ABTestMetrics getABTestResults(String testId) {
        return abTestController.computeMetrics(testId);
    }

    public HealthStatus getHealthStatus() {
        return predictionService.getHealthStatus();
    }
}
