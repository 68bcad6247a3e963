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

package com.smartcloudops.isolationforest.serving.training;

import static com.smartcloudops.isolationforest.CommonUtils.checkNotNull;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.smartcloudops.isolationforest.FeatureVector;
import com.smartcloudops.isolationforest.IsolationForest;
import com.smartcloudops.isolationforest.exception.IsolationForestException;
import com.smartcloudops.isolationforest.serving.exception.DuplicateVersionException;
import com.smartcloudops.isolationforest.serving.exception.TrainingFailedException;
import com.smartcloudops.isolationforest.serving.registry.Algorithm;
import com.smartcloudops.isolationforest.serving.registry.ModelMetadata;
import com.smartcloudops.isolationforest.serving.registry.ModelRegistry;
import com.smartcloudops.isolationforest.serving.registry.RegistryEntry;
import com.smartcloudops.isolationforest.serving.registry.ScorerArtifact;
import com.smartcloudops.isolationforest.serving.threshold.LabeledVector;
import com.smartcloudops.isolationforest.serving.threshold.ThresholdOptimizer;
import com.smartcloudops.isolationforest.serving.threshold.ThresholdResult;

/**
 * The offline path that turns labeled samples into a registered model: train
 * a forest, select its threshold on held out samples, register both.
 * <p>
 * The forest is trained on the normal samples of the training split, so that
 * anything unlike normal behavior isolates quickly. The validation split is
 * drawn with the request's seed; when it would miss one of the labels, the
 * whole sample set is used for validation instead.
 */
public class ModelTrainer {

    private static final Logger logger = LogManager.getLogger(ModelTrainer.class);

    private static final DateTimeFormatter VERSION_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS")
            .withZone(ZoneOffset.UTC);

    private final ModelRegistry registry;

    private final ThresholdOptimizer optimizer;

    private final Clock clock;

    public ModelTrainer(ModelRegistry registry, ThresholdOptimizer optimizer, Clock clock) {
        this.registry = checkNotNull(registry, "registry must not be null");
        this.optimizer = checkNotNull(optimizer, "optimizer must not be null");
        this.clock = checkNotNull(clock, "clock must not be null");
    }

    /**
     * Trains, evaluates and registers a model. The new version is neither
     * active nor in production.
     *
     * @param request the samples and settings
     * @return the registered entry
     * @throws TrainingFailedException    if the samples cannot produce a model
     * @throws DuplicateVersionException if the requested version exists
     */
    public RegistryEntry train(TrainingRequest request) {
        checkNotNull(request, "request must not be null");
        List<LabeledVector> samples = request.getSamples();
        if (samples.isEmpty()) {
            throw new TrainingFailedException("training requires at least one sample");
        }
        if (request.getAlgorithm() != Algorithm.ISOLATION_FOREST) {
            throw new TrainingFailedException("unsupported algorithm " + request.getAlgorithm());
        }
        long normals = samples.stream().filter(s -> !s.isAnomaly()).count();
        if (normals == 0 || normals == samples.size()) {
            throw new TrainingFailedException("training requires both normal and anomalous samples");
        }

        long seed = request.getRandomSeed().orElseGet(() -> new Random().nextLong());
        List<LabeledVector> shuffled = new ArrayList<>(samples);
        Collections.shuffle(shuffled, new Random(seed));
        int validationSize = (int) Math.ceil(request.getValidationFraction() * shuffled.size());
        List<LabeledVector> validation = shuffled.subList(0, validationSize);
        List<LabeledVector> training = shuffled.subList(validationSize, shuffled.size());
        if (!hasBothLabels(validation)) {
            logger.warn("validation split of {} samples lacks a label, validating on all {} samples",
                    validation.size(), samples.size());
            validation = samples;
        }

        List<FeatureVector> forestSamples = normalVectors(training);
        if (forestSamples.isEmpty()) {
            forestSamples = normalVectors(samples);
        }
        int subsampleSize = Math.min(request.getSubsampleSize(), forestSamples.size());

        IsolationForest forest;
        ThresholdResult result;
        try {
            forest = IsolationForest.builder().numberOfTrees(request.getNumberOfTrees()).subsampleSize(subsampleSize)
                    .randomSeed(seed).train(forestSamples);
            result = optimizer.optimize(forest, validation, request.getPolicy());
        } catch (IsolationForestException | IllegalArgumentException e) {
            throw new TrainingFailedException("training failed: " + e.getMessage(), e);
        }
        logger.info("trained forest of {} trees on {} samples, threshold {} with {}", forest.getNumberOfTrees(),
                forestSamples.size(), result.getThreshold(), result.getMetrics());

        Map<String, Object> hyperparameters = new LinkedHashMap<>();
        hyperparameters.put("numberOfTrees", forest.getNumberOfTrees());
        hyperparameters.put("subsampleSize", forest.getSubsampleSize());
        hyperparameters.put("randomSeed", seed);
        hyperparameters.put("validationFraction", request.getValidationFraction());
        hyperparameters.put("validationSize", validation.size());

        Instant now = clock.instant();
        ModelMetadata.Builder metadata = ModelMetadata.builder().algorithm(Algorithm.ISOLATION_FOREST).createdAt(now)
                .metrics(result.getMetrics()).threshold(result.getThreshold()).schema(forest.getSchema())
                .trainingDataSize(samples.size()).hyperparameters(hyperparameters);
        ScorerArtifact artifact = ScorerArtifact.isolationForest(forest);

        if (request.getVersion().isPresent()) {
            return registry.register(artifact, metadata.version(request.getVersion().get()).build());
        }
        String base = "v" + VERSION_FORMAT.format(now);
        for (int suffix = 0;; suffix++) {
            String version = suffix == 0 ? base : base + "_" + suffix;
            if (registry.contains(version)) {
                continue;
            }
            try {
                return registry.register(artifact, metadata.version(version).build());
            } catch (DuplicateVersionException e) {
                // registered concurrently; try the next suffix
                logger.debug("version {} was taken concurrently", version);
            }
        }
    }

    private static boolean hasBothLabels(List<LabeledVector> samples) {
        boolean normal = false;
        boolean anomaly = false;
        for (LabeledVector sample : samples) {
            normal |= !sample.isAnomaly();
            anomaly |= sample.isAnomaly();
        }
        return normal && anomaly;
    }

    private static List<FeatureVector> normalVectors(List<LabeledVector> samples) {
        List<FeatureVector> result = new ArrayList<>();
        for (LabeledVector sample : samples) {
            if (!sample.isAnomaly()) {
                result.add(sample.getVector());
            }
        }
        return result;
    }
}
