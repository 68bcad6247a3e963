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

package com.smartcloudops.isolationforest.exception;

/**
 * Stable error codes surfaced to the layer that calls into the scoring core.
 * The calling layer maps these codes onto its own transport; the core never
 * depends on how they are rendered.
 */
public enum ErrorCode {

    MISSING_FEATURES(Category.INPUT),

    INVALID_TRAINING_DATA(Category.INPUT),

    EMPTY_VALIDATION_SET(Category.INPUT),

    TRAINING_FAILED(Category.INPUT),

    MODEL_NOT_FOUND(Category.STATE),

    NO_ACTIVE_MODEL(Category.STATE),

    NO_PRODUCTION_MODEL(Category.STATE),

    NO_MODEL_AVAILABLE(Category.STATE),

    DUPLICATE_VERSION(Category.STATE),

    DUPLICATE_TEST_ID(Category.STATE),

    UNKNOWN_TEST(Category.STATE),

    SCORING_TIMEOUT(Category.RESOURCE),

    PERSISTENCE_FAILURE(Category.RESOURCE);

    /**
     * Input errors are the caller's data, state errors are the caller's
     * sequencing, resource errors may succeed on a retry with a fresh deadline.
     */
    public enum Category {
        INPUT, STATE, RESOURCE
    }

    private final Category category;

    ErrorCode(Category category) {
        this.category = category;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isRetryable() {
        return category == Category.RESOURCE;
    }
}
