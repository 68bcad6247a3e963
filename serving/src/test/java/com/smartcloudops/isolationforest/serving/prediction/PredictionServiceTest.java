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

import static com.smartcloudops.isolationforest.serving.ServingTestUtils.EPOCH;
import static com.smartcloudops.isolationforest.serving.ServingTestUtils.SCHEMA;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.smartcloudops.isolationforest.FeatureVector;
import com.smartcloudops.isolationforest.exception.ErrorCode;
import com.smartcloudops.isolationforest.exception.MalformedFeatureVectorException;
import com.smartcloudops.isolationforest.exception.ScoringTimeoutException;
import com.smartcloudops.isolationforest.serving.MutableClock;
import com.smartcloudops.isolationforest.serving.ServingTestUtils;
import com.smartcloudops.isolationforest.serving.abtest.ABTestController;
import com.smartcloudops.isolationforest.serving.abtest.ArmMetrics;
import com.smartcloudops.isolationforest.serving.config.ServingConfig;
import com.smartcloudops.isolationforest.serving.exception.NoModelAvailableException;
import com.smartcloudops.isolationforest.serving.registry.ModelMetadata;
import com.smartcloudops.isolationforest.serving.registry.ModelRegistry;
import com.smartcloudops.isolationforest.serving.registry.RegistryEntry;
import com.smartcloudops.isolationforest.serving.registry.ScorerArtifact;
import com.smartcloudops.isolationforest.serving.threshold.ThresholdOptimizer;
import com.smartcloudops.isolationforest.serving.training.ModelTrainer;
import com.smartcloudops.isolationforest.serving.training.TrainingRequest;

public class PredictionServiceTest {

    private static RegistryEntry trained;

    private MutableClock clock;

    private ModelRegistry registry;

    private ABTestController abTestController;

    private PredictionService service;

    @BeforeAll
    public static void trainModel() {
        ModelTrainer trainer = new ModelTrainer(new ModelRegistry(), new ThresholdOptimizer(),
                new MutableClock(EPOCH));
        TrainingRequest request = TrainingRequest.builder().samples(ServingTestUtils.labeledSamples(400, 100, 5))
                .numberOfTrees(50).subsampleSize(128).randomSeed(5).version("v1").build();
        trained = trainer.train(request);
    }

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(EPOCH);
        registry = new ModelRegistry();
        abTestController = new ABTestController(registry, clock);
        service = new PredictionService(registry, abTestController,
                ServingConfig.builder().featureSchema(SCHEMA).threadPoolSize(2).clock(clock).build());
    }

    @AfterEach
    public void tearDown() {
        service.close();
    }

    @Test
    public void testEndToEndClassification() {
        register("v1");
        registry.promote("v1", true);

        PredictionResult anomaly = service.predict(ServingTestUtils.anomalyCentroid().toMap(), Optional.empty());
        assertEquals(1, anomaly.getClassification());
        assertTrue(anomaly.isAnomaly());
        assertEquals("v1", anomaly.getModelVersion());
        assertTrue(anomaly.getScore() >= anomaly.getThreshold());
        assertEquals(EPOCH, anomaly.getTimestamp());
        assertEquals(ServingTestUtils.anomalyCentroid().toMap(), anomaly.getInputFeatures());
        assertFalse(anomaly.getTestId().isPresent());

        PredictionResult normal = service.predict(ServingTestUtils.normalCentroid().toMap(), Optional.empty());
        assertEquals(0, normal.getClassification());
        assertTrue(normal.getScore() < normal.getThreshold());
        assertTrue(normal.getConfidence() > 0 && normal.getConfidence() <= 1);

        PerformanceMetrics metrics = service.getPerformanceMetrics();
        assertEquals(2, metrics.getTotalPredictions());
        assertEquals(0.5, metrics.getAnomalyRate(), 1e-12);
    }

    @Test
    public void testResolutionPrefersProductionOverActive() {
        register("v1");
        register("v2");
        FeatureVector point = ServingTestUtils.normalCentroid();

        NoModelAvailableException none = assertThrows(NoModelAvailableException.class,
                () -> service.predict(point, Optional.empty(), Duration.ofSeconds(5)));
        assertEquals(ErrorCode.NO_MODEL_AVAILABLE, none.getErrorCode());

        registry.promote("v2", false);
        assertEquals("v2", service.predict(point, Optional.empty(), Duration.ofSeconds(5)).getModelVersion());

        registry.promote("v1", true);
        registry.promote("v2", false);
        assertEquals("v1", service.predict(point, Optional.empty(), Duration.ofSeconds(5)).getModelVersion());
    }

    @Test
    public void testMissingFeatures() {
        register("v1");
        registry.promote("v1", true);
        Map<String, Double> features = new HashMap<>(ServingTestUtils.normalCentroid().toMap());
        features.remove("disk_usage");

        MalformedFeatureVectorException e = assertThrows(MalformedFeatureVectorException.class,
                () -> service.predict(features, Optional.empty()));
        assertEquals(ErrorCode.MISSING_FEATURES, e.getErrorCode());
        assertTrue(e.getMessage().contains("disk_usage"));
        assertEquals(1, service.getPerformanceMetrics().getTotalErrors());
    }

    @Test
    public void testModelSchemaIsUsedWithoutConfiguredSchema() {
        register("v1");
        registry.promote("v1", true);
        try (PredictionService unconfigured = new PredictionService(registry, abTestController,
                ServingConfig.builder().threadPoolSize(1).clock(clock).build())) {
            PredictionResult result = unconfigured.predict(ServingTestUtils.anomalyCentroid().toMap(),
                    Optional.empty());
            assertEquals(1, result.getClassification());

            Map<String, Double> extra = new HashMap<>(ServingTestUtils.normalCentroid().toMap());
            extra.put("gpu_usage", 0.1);
            assertThrows(MalformedFeatureVectorException.class, () -> unconfigured.predict(extra, Optional.empty()));
        }
    }

    @Test
    public void testZeroTimeoutFails() {
        register("v1");
        registry.promote("v1", true);

        ScoringTimeoutException e = assertThrows(ScoringTimeoutException.class,
                () -> service.predict(ServingTestUtils.normalCentroid(), Optional.empty(), Duration.ZERO));
        assertEquals(ErrorCode.SCORING_TIMEOUT, e.getErrorCode());
        assertTrue(e.getErrorCode().isRetryable());
        assertEquals(1, service.getPerformanceMetrics().getTotalErrors());
        assertEquals(0, service.getPerformanceMetrics().getTotalPredictions());
    }

    @Test
    public void testSlowScoringTimesOut() {
        ScorerArtifact slow = mock(ScorerArtifact.class);
        when(slow.getSchema()).thenReturn(SCHEMA);
        when(slow.score(any(), any())).thenAnswer(invocation -> {
            Thread.sleep(10_000);
            return 0.9;
        });
        ModelMetadata metadata = ServingTestUtils.metadata("slow", EPOCH, 0.6);
        ModelRegistry mockedRegistry = mock(ModelRegistry.class);
        when(mockedRegistry.findProduction()).thenReturn(Optional.of(new RegistryEntry(slow, metadata)));

        try (PredictionService slowService = new PredictionService(mockedRegistry,
                new ABTestController(mockedRegistry, clock), ServingConfig.builder().threadPoolSize(1).build())) {
            long start = System.nanoTime();
            assertThrows(ScoringTimeoutException.class, () -> slowService
                    .predict(ServingTestUtils.normalCentroid(), Optional.empty(), Duration.ofMillis(100)));
            assertTrue(System.nanoTime() - start < Duration.ofSeconds(5).toNanos());
        }
    }

    @Test
    public void testScorerFailureIsReported() {
        ScorerArtifact broken = mock(ScorerArtifact.class);
        when(broken.getSchema()).thenReturn(SCHEMA);
        when(broken.score(any(), any())).thenThrow(new ArithmeticException("boom"));
        ModelRegistry mockedRegistry = mock(ModelRegistry.class);
        when(mockedRegistry.findProduction())
                .thenReturn(Optional.of(new RegistryEntry(broken, ServingTestUtils.metadata("broken", EPOCH, 0.6))));

        try (PredictionService brokenService = new PredictionService(mockedRegistry,
                new ABTestController(mockedRegistry, clock), ServingConfig.builder().threadPoolSize(1).build())) {
            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> brokenService.predict(ServingTestUtils.normalCentroid(), Optional.empty(),
                            Duration.ofSeconds(5)));
            assertTrue(e.getCause() instanceof ArithmeticException);
            assertEquals(1, brokenService.getPerformanceMetrics().getTotalErrors());
        }
    }

    @Test
    public void testABTestRouting() {
        register("v1");
        register("v2");
        registry.promote("v1", true);
        abTestController.startTest("t1", "v1", "v2", 0.5, Duration.ofHours(1), 17L);

        int routed = 20;
        for (int i = 0; i < routed; i++) {
            PredictionResult result = service.predict(ServingTestUtils.normalCentroid(), Optional.of("t1"),
                    Duration.ofSeconds(5));
            assertEquals(Optional.of("t1"), result.getTestId());
            assertTrue(result.getModelVersion().equals("v1") || result.getModelVersion().equals("v2"));
        }

        ArmMetrics armA = abTestController.computeMetrics("t1").getArmA();
        ArmMetrics armB = abTestController.computeMetrics("t1").getArmB();
        assertEquals(routed, armA.getTotalPredictions() + armB.getTotalPredictions());
        assertEquals(0, armA.getLabeledCount() + armB.getLabeledCount());
        assertEquals(0.0, armA.getAnomalyRate());

        clock.advance(Duration.ofHours(2));
        PredictionResult fallback = service.predict(ServingTestUtils.normalCentroid(), Optional.of("t1"),
                Duration.ofSeconds(5));
        assertEquals("v1", fallback.getModelVersion());
        assertFalse(fallback.getTestId().isPresent());

        PredictionResult unknown = service.predict(ServingTestUtils.normalCentroid(), Optional.of("missing"),
                Duration.ofSeconds(5));
        assertEquals("v1", unknown.getModelVersion());
    }

    @Test
    public void testConfidence() {
        assertEquals(0.0, PredictionService.confidence(0.6, 0.6), 1e-12);
        assertEquals(0.5, PredictionService.confidence(0.3, 0.6), 1e-12);
        assertEquals(1.0, PredictionService.confidence(0.0, 0.6), 1e-12);
        assertEquals(0.5, PredictionService.confidence(0.8, 0.6), 1e-12);
        assertEquals(1.0, PredictionService.confidence(1.0, 0.6), 1e-12);
        assertEquals(1.0, PredictionService.confidence(1.0, 1.0), 1e-12);
        assertEquals(1.0, PredictionService.confidence(0.4, 0.0), 1e-12);
    }

    @Test
    public void testHealthStatus() {
        HealthStatus empty = service.getHealthStatus();
        assertFalse(empty.isHealthy());
        assertFalse(empty.getCurrentModelVersion().isPresent());
        assertEquals(0, empty.getRegisteredModels());

        register("v1");
        register("v2");
        registry.promote("v2", false);
        abTestController.startTest("t1", "v1", "v2", 0.5, Duration.ofMinutes(5));

        HealthStatus status = service.getHealthStatus();
        assertTrue(status.isHealthy());
        assertEquals(Optional.of("v2"), status.getCurrentModelVersion());
        assertEquals(2, status.getRegisteredModels());
        assertEquals(1, status.getActiveABTests());

        assertThrows(ScoringTimeoutException.class,
                () -> service.predict(ServingTestUtils.normalCentroid(), Optional.empty(), Duration.ZERO));
        assertEquals(1, service.getHealthStatus().getPerformance().getTotalErrors());
    }

    private void register(String version) {
        ModelMetadata metadata = trained.getMetadata().toBuilder().version(version).build();
        registry.register(trained.getArtifact(), metadata);
    }
}
