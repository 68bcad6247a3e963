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

package com.smartcloudops.isolationforest.serving.registry;

import static com.smartcloudops.isolationforest.CommonUtils.checkArgument;
import static com.smartcloudops.isolationforest.CommonUtils.checkNotNull;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import com.smartcloudops.isolationforest.FeatureSchema;
import com.smartcloudops.isolationforest.serving.threshold.ClassificationMetrics;

/**
 * Describes a registered model. Everything except the active and production
 * flags is fixed at registration; the flags are only changed by
 * {@link ModelRegistry}, and callers always receive copies.
 */
@Getter
@ToString
public class ModelMetadata {

    private final String version;

    private final Algorithm algorithm;

    private final Instant createdAt;

    private final ClassificationMetrics metrics;

    private final double threshold;

    private final FeatureSchema schema;

    private final long trainingDataSize;

    private final Map<String, Object> hyperparameters;

    @Setter(AccessLevel.PACKAGE)
    private boolean active;

    @Setter(AccessLevel.PACKAGE)
    private boolean production;

    protected ModelMetadata(Builder builder) {
        checkNotNull(builder.version, "version must not be null");
        checkArgument(!builder.version.trim().isEmpty(), "version must not be blank");
        checkNotNull(builder.algorithm, "algorithm must not be null");
        checkNotNull(builder.createdAt, "createdAt must not be null");
        checkNotNull(builder.metrics, "metrics must not be null");
        checkNotNull(builder.schema, "schema must not be null");
        checkArgument(Double.isFinite(builder.threshold), "threshold must be finite");
        checkArgument(builder.trainingDataSize >= 0, "trainingDataSize must be non-negative");
        version = builder.version;
        algorithm = builder.algorithm;
        createdAt = builder.createdAt;
        metrics = builder.metrics;
        threshold = builder.threshold;
        schema = builder.schema;
        trainingDataSize = builder.trainingDataSize;
        hyperparameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.hyperparameters));
        active = builder.active;
        production = builder.production;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder holding the values of this metadata
     */
    public Builder toBuilder() {
        return new Builder().version(version).algorithm(algorithm).createdAt(createdAt).metrics(metrics)
                .threshold(threshold).schema(schema).trainingDataSize(trainingDataSize)
                .hyperparameters(hyperparameters).active(active).production(production);
    }

    ModelMetadata copy() {
        return toBuilder().build();
    }

    public static class Builder {

        private String version;
        private Algorithm algorithm = Algorithm.ISOLATION_FOREST;
        private Instant createdAt;
        private ClassificationMetrics metrics;
        private double threshold;
        private FeatureSchema schema;
        private long trainingDataSize;
        private Map<String, Object> hyperparameters = Collections.emptyMap();
        private boolean active;
        private boolean production;

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder algorithm(Algorithm algorithm) {
            this.algorithm = algorithm;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder metrics(ClassificationMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder schema(FeatureSchema schema) {
            this.schema = schema;
            return this;
        }

        public Builder trainingDataSize(long trainingDataSize) {
            this.trainingDataSize = trainingDataSize;
            return this;
        }

        public Builder hyperparameters(Map<String, Object> hyperparameters) {
            this.hyperparameters = checkNotNull(hyperparameters, "hyperparameters must not be null");
            return this;
        }

        /**
         * Only honored when restoring a saved registry; registration clears the
         * flag.
         */
        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        /**
         * Only honored when restoring a saved registry; registration clears the
         * flag.
         */
        public Builder production(boolean production) {
            this.production = production;
            return this;
        }

        public ModelMetadata build() {
            return new ModelMetadata(this);
        }
    }
}
