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

package com.smartcloudops.isolationforest.state;

import static com.smartcloudops.isolationforest.state.Version.V1_0;

import lombok.Data;

@Data
public class PartitionTreeState {

    private String version = V1_0;

    private int maxDepth;

    private int[] cutFeature;

    private double[] cutValue;

    private int[] leftChild;

    private int[] rightChild;

    private int[] leafSize;
}
