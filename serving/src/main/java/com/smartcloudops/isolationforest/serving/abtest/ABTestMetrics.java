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

package com.smartcloudops.isolationforest.serving.abtest;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public final class ABTestMetrics {

    private final String testId;

    private final ABTestStatus status;

    private final ArmMetrics armA;

    private final ArmMetrics armB;

    public ABTestMetrics(String testId, ABTestStatus status, ArmMetrics armA, ArmMetrics armB) {
        this.testId = testId;
        this.status = status;
        this.armA = armA;
        this.armB = armB;
    }

    /**
     * @param version one of the two arm versions
     * @return the metrics of that arm
     */
    public ArmMetrics getArm(String version) {
        if (armA.getVersion().equals(version)) {
            return armA;
        }
        if (armB.getVersion().equals(version)) {
            return armB;
        }
        throw new IllegalArgumentException(version + " is not an arm of test " + testId);
    }
}
