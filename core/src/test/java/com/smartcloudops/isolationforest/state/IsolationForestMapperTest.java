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

import static com.smartcloudops.isolationforest.TestUtils.SCHEMA;
import static com.smartcloudops.isolationforest.TestUtils.toVectors;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartcloudops.isolationforest.FeatureVector;
import com.smartcloudops.isolationforest.IsolationForest;
import com.smartcloudops.isolationforest.testutils.ClusterTestData;
import com.smartcloudops.isolationforest.tree.PartitionTree;

public class IsolationForestMapperTest {

    private List<FeatureVector> samples;

    private IsolationForestMapper mapper;

    @BeforeEach
    public void setUp() {
        samples = toVectors(SCHEMA, new ClusterTestData().generate(200, 20, 4, 5).data);
        mapper = new IsolationForestMapper();
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    public void testRoundTripThroughJson(boolean parallel) throws Exception {
        IsolationForest forest = IsolationForest.builder().numberOfTrees(30).subsampleSize(128).randomSeed(99L)
                .parallelExecutionEnabled(parallel).threadPoolSize(2).train(samples);

        ObjectMapper jsonMapper = new ObjectMapper();
        String json = jsonMapper.writeValueAsString(mapper.toState(forest));
        IsolationForestState state = jsonMapper.readValue(json, IsolationForestState.class);
        IsolationForest restored = mapper.toModel(state);

        assertEquals(Version.V1_0, state.getVersion());
        assertEquals(forest.getSchema(), restored.getSchema());
        assertEquals(forest.getNumberOfTrees(), restored.getNumberOfTrees());
        assertEquals(forest.getSubsampleSize(), restored.getSubsampleSize());
        assertEquals(forest.getRandomSeed(), restored.getRandomSeed());
        assertEquals(parallel, restored.isParallelExecutionEnabled());
        for (FeatureVector point : samples) {
            assertEquals(forest.getAnomalyScore(point), restored.getAnomalyScore(point), 1e-12);
        }
    }

    @Test
    public void testParallelExecutionCanBeDisallowed() {
        IsolationForest forest = IsolationForest.builder().numberOfTrees(5).subsampleSize(16).randomSeed(1L)
                .parallelExecutionEnabled(true).threadPoolSize(2).train(samples);
        mapper.setParallelExecutionAllowed(false);
        IsolationForest restored = mapper.toModel(mapper.toState(forest));
        assertFalse(restored.isParallelExecutionEnabled());
        assertEquals(forest.getAnomalyScore(samples.get(0)), restored.getAnomalyScore(samples.get(0)), 1e-12);
    }

    @Test
    public void testRestoredForestTakesItsSeedFromTheState() {
        IsolationForest forest = IsolationForest.train(samples, 4, 32, 11L);
        IsolationForestState state = mapper.toState(forest);
        assertEquals(11L, state.getRandomSeed());
        state.setRandomSeed(12345L);

        IsolationForest restored = mapper.toModel(state);
        assertEquals(12345L, restored.getRandomSeed());
        assertEquals(forest.getAnomalyScore(samples.get(0)), restored.getAnomalyScore(samples.get(0)), 1e-12);
    }

    @Test
    public void testTreeStateDoesNotShareArrays() {
        IsolationForest forest = IsolationForest.train(samples, 1, 32, 3L);
        PartitionTree tree = forest.getTrees().get(0);
        PartitionTreeMapper treeMapper = new PartitionTreeMapper();
        PartitionTreeState state = treeMapper.toState(tree);
        double rootCut = tree.getCutValue()[0];
        state.getCutValue()[0] = Double.NaN;
        assertEquals(rootCut, tree.getCutValue()[0]);

        PartitionTree copy = treeMapper.toModel(treeMapper.toState(tree));
        assertArrayEquals(tree.getCutFeature(), copy.getCutFeature());
        assertArrayEquals(tree.getCutValue(), copy.getCutValue());
        assertArrayEquals(tree.getLeafSize(), copy.getLeafSize());
    }

    @Test
    public void testInconsistentStateIsRejected() {
        IsolationForest forest = IsolationForest.train(samples, 3, 16, 3L);
        IsolationForestState state = mapper.toState(forest);
        state.setNumberOfTrees(4);
        assertThrows(IllegalArgumentException.class, () -> mapper.toModel(state));

        PartitionTreeState treeState = state.getTrees().get(0);
        treeState.setLeftChild(new int[treeState.getLeftChild().length + 1]);
        assertThrows(IllegalArgumentException.class, () -> new PartitionTreeMapper().toModel(treeState));
    }
}
