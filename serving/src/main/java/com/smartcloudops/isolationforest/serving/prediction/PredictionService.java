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

import static com.smartcloudops.isolationforest.CommonUtils.checkNotNull;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.smartcloudops.isolationforest.FeatureSchema;
import com.smartcloudops.isolationforest.FeatureVector;
import com.smartcloudops.isolationforest.exception.IsolationForestException;
import com.smartcloudops.isolationforest.exception.ScoringTimeoutException;
import com.smartcloudops.isolationforest.serving.abtest.ABTestController;
import com.smartcloudops.isolationforest.serving.config.ServingConfig;
import com.smartcloudops.isolationforest.serving.exception.NoModelAvailableException;
import com.smartcloudops.isolationforest.serving.registry.ModelMetadata;
import com.smartcloudops.isolationforest.serving.registry.ModelRegistry;
import com.smartcloudops.isolationforest.serving.registry.RegistryEntry;
import com.smartcloudops.isolationforest.util.Deadline;

/**
 * Answers prediction requests. A request is routed to the arm of an A/B test
 * when it names a running test, otherwise to the production model, otherwise
 * to the active model. Scoring runs on a fixed pool of worker threads and is
 * bounded by a deadline: a request either completes within its timeout or
 * fails with {@link ScoringTimeoutException}; no partial result is returned.
 * <p>
 * The service holds no durable state of its own. Close it to stop the worker
 * pool.
 */
public class PredictionService implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(PredictionService.class);

    private final ModelRegistry registry;

    private final ABTestController abTestController;

    private final ServingConfig config;

    private final ExecutorService workers;

    private final PerformanceMonitor monitor;

    public PredictionService(ModelRegistry registry, ABTestController abTestController, ServingConfig config) {
        this.registry = checkNotNull(registry, "registry must not be null");
        this.abTestController = checkNotNull(abTestController, "abTestController must not be null");
        this.config = checkNotNull(config, "config must not be null");
        this.monitor = new PerformanceMonitor(config.getMonitorWindowSize());
        this.workers = Executors.newFixedThreadPool(config.getThreadPoolSize(), new ScoringThreadFactory());
    }

    /**
     * Predicts with the configured default timeout.
     */
    public PredictionResult predict(Map<String, Double> features, Optional<String> testId) {
        return predict(features, testId, config.getDefaultTimeout());
    }

    /**
     * Converts named features with the configured schema, or with the schema of
     * the model chosen for the request when none is configured, and predicts.
     *
     * @throws com.smartcloudops.isolationforest.exception.MalformedFeatureVectorException
     *         if a field is missing, not finite or unknown
     */
    public PredictionResult predict(Map<String, Double> features, Optional<String> testId, Duration timeout) {
        checkNotNull(features, "features must not be null");
        Optional<FeatureSchema> schema = config.getFeatureSchema();
        if (schema.isPresent()) {
            return run(schema.get().toVector(features), null, testId, timeout);
        }
        return run(null, features, testId, timeout);
    }

    /**
     * Classifies a feature vector.
     *
     * @param features the vector, with the schema of the model that serves it
     * @param testId   an A/B test to route the request through, if any
     * @param timeout  time allowed for the whole call
     * @return the classification
     * @throws com.smartcloudops.isolationforest.exception.MalformedFeatureVectorException
     *         if the vector does not match the model's schema
     * @throws NoModelAvailableException if no model can serve the request
     * @throws ScoringTimeoutException   if the timeout elapses first
     */
    public PredictionResult predict(FeatureVector features, Optional<String> testId, Duration timeout) {
        checkNotNull(features, "features must not be null");
        return run(features, null, testId, timeout);
    }

    private PredictionResult run(FeatureVector vector, Map<String, Double> namedFeatures, Optional<String> testId,
            Duration timeout) {
        checkNotNull(testId, "testId must not be null");
        checkNotNull(timeout, "timeout must not be null");
        long start = System.nanoTime();
        Deadline deadline = Deadline.after(timeout);
        try {
            Optional<String> assigned = testId.flatMap(abTestController::assignVersion);
            if (testId.isPresent() && !assigned.isPresent()) {
                logger.warn("test {} is not running, falling back to the default model", testId.get());
            }
            RegistryEntry entry = resolve(assigned);
            ModelMetadata metadata = entry.getMetadata();
            FeatureVector features = vector != null ? vector : metadata.getSchema().toVector(namedFeatures);
            features.checkConformsTo(entry.getArtifact().getSchema());

            double score = score(entry, features, deadline);
            double threshold = metadata.getThreshold();
            int classification = score >= threshold ? 1 : 0;
            double confidence = confidence(score, threshold);
            double latencyMillis = (System.nanoTime() - start) / 1_000_000.0;

            if (assigned.isPresent()) {
                abTestController.recordOutcome(testId.get(), assigned.get(), classification, Optional.empty(),
                        confidence, OptionalDouble.of(latencyMillis));
            }
            monitor.recordPrediction(latencyMillis, classification == 1);
            return new PredictionResult(classification, confidence, metadata.getVersion(), score, threshold,
                    config.getClock().instant(), features.toMap(), assigned.isPresent() ? testId : Optional.empty());
        } catch (RuntimeException e) {
            monitor.recordError();
            throw e;
        }
    }

    private RegistryEntry resolve(Optional<String> assigned) {
        if (assigned.isPresent()) {
            return registry.get(assigned.get());
        }
        Optional<RegistryEntry> entry = registry.findProduction();
        if (!entry.isPresent()) {
            entry = registry.findActive();
        }
        return entry.orElseThrow(() -> new NoModelAvailableException("no production or active model is available"));
    }

    private double score(RegistryEntry entry, FeatureVector features, Deadline deadline) {
        deadline.checkNotExpired("prediction");
        Future<Double> future = workers.submit(() -> entry.getArtifact().score(features, deadline));
        double score;
        try {
            score = future.get(deadline.remaining().toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ScoringTimeoutException("prediction with model " + entry.getVersion() + " timed out", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ScoringTimeoutException("prediction was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IsolationForestException) {
                throw (IsolationForestException) cause;
            }
            logger.error("scoring with model {} failed", entry.getVersion(), cause);
            throw new IllegalStateException("scoring with model " + entry.getVersion() + " failed", cause);
        }
        deadline.checkNotExpired("prediction");
        return score;
    }

    /**
     * Distance between score and threshold relative to the room on the score's
     * side of the threshold, in [0,1]. A side without room gives 1.
     */
    static double confidence(double score, double threshold) {
        double room = score < threshold ? threshold : 1.0 - threshold;
        if (room <= 0) {
            return 1.0;
        }
        return Math.max(0.0, Math.min(1.0, Math.abs(score - threshold) / room));
    }

    public PerformanceMetrics getPerformanceMetrics() {
        return monitor.getMetrics();
    }

    public HealthStatus getHealthStatus() {
        Optional<RegistryEntry> current = registry.findProduction();
        if (!current.isPresent()) {
            current = registry.findActive();
        }
        return new HealthStatus(current.isPresent(), current.map(RegistryEntry::getVersion), registry.size(),
                abTestController.countActive(), monitor.getMetrics());
    }

    @Override
    public void close() {
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("scoring workers did not stop within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static class ScoringThreadFactory implements ThreadFactory {

        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "isolation-forest-scoring-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
