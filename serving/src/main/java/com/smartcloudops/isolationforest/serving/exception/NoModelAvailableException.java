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

package com.smartcloudops.isolationforest.serving.exception;

import com.smartcloudops.isolationforest.exception.ErrorCode;
import com.smartcloudops.isolationforest.exception.IsolationForestException;

/**
 * Thrown when a prediction request cannot be routed to any model: no A/B arm
 * was assigned and neither a production nor an active model exists.
 */
public class NoModelAvailableException extends IsolationForestException {

    public NoModelAvailableException(String message) {
        super(ErrorCode.NO_MODEL_AVAILABLE, message);
    }
}
