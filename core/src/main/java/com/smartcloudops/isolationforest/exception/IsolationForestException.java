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

import static com.smartcloudops.isolationforest.CommonUtils.checkNotNull;

/**
 * Base exception for every typed failure raised by the scoring core and the
 * services built on top of it.
 */
public class IsolationForestException extends RuntimeException {

    private final ErrorCode errorCode;

    public IsolationForestException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = checkNotNull(errorCode, "errorCode must not be null");
    }

    public IsolationForestException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = checkNotNull(errorCode, "errorCode must not be null");
    }

    /**
     * Returns the code the calling layer should report.
     *
     * @return error code of this failure
     */
    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public ErrorCode.Category getCategory() {
        return errorCode.getCategory();
    }
}
