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

import static com.smartcloudops.isolationforest.CommonUtils.checkArgument;
import static com.smartcloudops.isolationforest.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import lombok.Setter;

import com.smartcloudops.isolationforest.FeatureSchema;
import com.smartcloudops.isolationforest.IsolationForest;
import com.smartcloudops.isolationforest.tree.PartitionTree;

/**
 * A utility class for creating an {@link IsolationForestState} instance from an
 * {@link IsolationForest} instance and vice versa. A restored forest has the
 * same trees and therefore produces the same scores as the original.
 */
@Getter
@Setter
public class IsolationForestMapper implements IStateMapper<IsolationForest, IsolationForestState> {

    /**
     * when false, restored forests always traverse sequentially, whatever the
     * saved configuration says
     */
    private boolean parallelExecutionAllowed = true;

    @Override
    public IsolationForestState toState(IsolationForest model) {
        checkNotNull(model, "model must not be null");
        IsolationForestState state = new IsolationForestState();
        state.setFeatureNames(new ArrayList<>(model.getSchema().getFieldNames()));
        state.setNumberOfTrees(model.getNumberOfTrees());
        state.setSubsampleSize(model.getSubsampleSize());
        state.setRandomSeed(model.getRandomSeed());
        state.setParallelExecutionEnabled(model.isParallelExecutionEnabled());
        state.setThreadPoolSize(model.getThreadPoolSize());

        PartitionTreeMapper treeMapper = new PartitionTreeMapper();
        List<PartitionTreeState> trees = new ArrayList<>(model.getTrees().size());
        for (PartitionTree tree : model.getTrees()) {
            trees.add(treeMapper.toState(tree));
        }
        state.setTrees(trees);
        return state;
    }

    @Override
    public IsolationForest toModel(IsolationForestState state) {
        checkNotNull(state, "state must not be null");
        checkNotNull(state.getTrees(), "state has no trees");
        checkArgument(state.getTrees().size() == state.getNumberOfTrees(), "state is inconsistent");

        PartitionTreeMapper treeMapper = new PartitionTreeMapper();
        List<PartitionTree> trees = new ArrayList<>(state.getTrees().size());
        for (PartitionTreeState treeState : state.getTrees()) {
            trees.add(treeMapper.toModel(treeState));
        }

        IsolationForest.Builder<?> builder = IsolationForest.builder()
                .schema(new FeatureSchema(state.getFeatureNames())).numberOfTrees(state.getNumberOfTrees())
                .subsampleSize(state.getSubsampleSize()).randomSeed(state.getRandomSeed())
                .parallelExecutionEnabled(parallelExecutionAllowed && state.isParallelExecutionEnabled());
        if (state.getThreadPoolSize() > 0) {
            builder.threadPoolSize(state.getThreadPoolSize());
        }
        return new IsolationForest(builder, trees);
    }
}
