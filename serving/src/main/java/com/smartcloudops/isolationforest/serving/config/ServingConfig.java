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

package com.smartcloudops.isolationforest.serving.config;

import static com.smartcloudops.isolationforest.CommonUtils.checkArgument;
import static com.smartcloudops.isolationforest.CommonUtils.checkNotNull;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import java.util.Properties;
import java.util.stream.Collectors;

import lombok.Getter;

import com.smartcloudops.isolationforest.FeatureSchema;

/**
 * Settings of the prediction service. Values not given to the builder fall back
 * to the defaults below.
 */
@Getter
public class ServingConfig {

    public static final String RESOURCE_NAME = "isolation-forest.properties";

    public static final String FEATURE_SCHEMA_KEY = "isolation-forest.serving.feature-schema";

    public static final String THREAD_POOL_SIZE_KEY = "isolation-forest.serving.thread-pool-size";

    public static final String DEFAULT_TIMEOUT_KEY = "isolation-forest.serving.default-timeout-millis";

    public static final String MONITOR_WINDOW_SIZE_KEY = "isolation-forest.serving.monitor-window-size";

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(1);

    public static final int DEFAULT_MONITOR_WINDOW_SIZE = 1000;

    /**
     * used to convert named feature maps; when empty, the schema of the model
     * serving the request is used
     */
    private final Optional<FeatureSchema> featureSchema;

    private final int threadPoolSize;

    private final Duration defaultTimeout;

    private final int monitorWindowSize;

    private final Clock clock;

    protected ServingConfig(Builder builder) {
        checkArgument(builder.threadPoolSize > 0, "threadPoolSize must be positive");
        checkNotNull(builder.defaultTimeout, "defaultTimeout must not be null");
        checkArgument(!builder.defaultTimeout.isNegative() && !builder.defaultTimeout.isZero(),
                "defaultTimeout must be positive");
        checkArgument(builder.monitorWindowSize > 0, "monitorWindowSize must be positive");
        featureSchema = builder.featureSchema;
        threadPoolSize = builder.threadPoolSize;
        defaultTimeout = builder.defaultTimeout;
        monitorWindowSize = builder.monitorWindowSize;
        clock = checkNotNull(builder.clock, "clock must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the settings present in the properties; absent keys keep their
     * defaults. The feature schema is a comma separated list of field names.
     *
     * @param properties the source
     * @return the configuration
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static ServingConfig fromProperties(Properties properties) {
        checkNotNull(properties, "properties must not be null");
        Builder builder = builder();
        String schema = properties.getProperty(FEATURE_SCHEMA_KEY);
        if (schema != null && !schema.trim().isEmpty()) {
            builder.featureSchema(new FeatureSchema(
                    Arrays.stream(schema.split(",")).map(String::trim).collect(Collectors.toList())));
        }
        String threads = properties.getProperty(THREAD_POOL_SIZE_KEY);
        if (threads != null) {
            builder.threadPoolSize(parseInt(THREAD_POOL_SIZE_KEY, threads));
        }
        String timeout = properties.getProperty(DEFAULT_TIMEOUT_KEY);
        if (timeout != null) {
            builder.defaultTimeout(Duration.ofMillis(parseInt(DEFAULT_TIMEOUT_KEY, timeout)));
        }
        String window = properties.getProperty(MONITOR_WINDOW_SIZE_KEY);
        if (window != null) {
            builder.monitorWindowSize(parseInt(MONITOR_WINDOW_SIZE_KEY, window));
        }
        return builder.build();
    }

    /**
     * Loads {@value #RESOURCE_NAME} from the class path, or returns the defaults
     * when the resource does not exist.
     *
     * @return the configuration
     * @throws IOException if the resource exists but cannot be read
     */
    public static ServingConfig load() throws IOException {
        Properties properties = new Properties();
        try (InputStream in = ServingConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                properties.load(in);
            }
        }
        return fromProperties(properties);
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid value for " + key + ": " + value, e);
        }
    }

    public static class Builder {

        private Optional<FeatureSchema> featureSchema = Optional.empty();
        private int threadPoolSize = Runtime.getRuntime().availableProcessors();
        private Duration defaultTimeout = DEFAULT_TIMEOUT;
        private int monitorWindowSize = DEFAULT_MONITOR_WINDOW_SIZE;
        private Clock clock = Clock.systemUTC();

        public Builder featureSchema(FeatureSchema featureSchema) {
            this.featureSchema = Optional.of(featureSchema);
            return this;
        }

        public Builder threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = threadPoolSize;
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder monitorWindowSize(int monitorWindowSize) {
            this.monitorWindowSize = monitorWindowSize;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ServingConfig build() {
            return new ServingConfig(this);
        }
    }
}
