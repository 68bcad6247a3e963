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

import static com.smartcloudops.isolationforest.CommonUtils.checkNotNull;

import com.smartcloudops.isolationforest.tree.PartitionTree;

public class PartitionTreeMapper implements IStateMapper<PartitionTree, PartitionTreeState> {

    @Override
    public PartitionTreeState toState(PartitionTree model) {
        checkNotNull(model, "model must not be null");
        PartitionTreeState state = new PartitionTreeState();
        state.setMaxDepth(model.getMaxDepth());
        state.setCutFeature(model.getCutFeature());
        state.setCutValue(model.getCutValue());
        state.setLeftChild(model.getLeftChild());
        state.setRightChild(model.getRightChild());
        state.setLeafSize(model.getLeafSize());
        return state;
    }

    @Override
    public PartitionTree toModel(PartitionTreeState state) {
        checkNotNull(state, "state must not be null");
        return new PartitionTree(state.getCutFeature(), state.getCutValue(), state.getLeftChild(),
                state.getRightChild(), state.getLeafSize(), state.getMaxDepth());
    }
}
