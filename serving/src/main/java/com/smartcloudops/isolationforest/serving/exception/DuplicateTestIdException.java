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
 * Thrown when an A/B test is started with an id that has been used before.
 * Ids are never reused, even after the earlier test ended.
 */
public class DuplicateTestIdException extends IsolationForestException {

    public DuplicateTestIdException(String message) {
        super(ErrorCode.DUPLICATE_TEST_ID, message);
    }
}
