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

package com.smartcloudops.isolationforest;

import static com.smartcloudops.isolationforest.TestUtils.EPSILON;
import static com.smartcloudops.isolationforest.TestUtils.SCHEMA;
import static com.smartcloudops.isolationforest.TestUtils.toVectors;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.smartcloudops.isolationforest.exception.ErrorCode;
import com.smartcloudops.isolationforest.exception.InvalidTrainingDataException;
import com.smartcloudops.isolationforest.exception.MalformedFeatureVectorException;
import com.smartcloudops.isolationforest.exception.ScoringTimeoutException;
import com.smartcloudops.isolationforest.testutils.ClusterTestData;
import com.smartcloudops.isolationforest.util.Deadline;

public class IsolationForestTest {

    private static final int DIMENSIONS = 4;

    private ClusterTestData testData;

    private List<FeatureVector> samples;

    private IsolationForest forest;

    @BeforeEach
    public void setUp() {
        testData = new ClusterTestData();
        samples = toVectors(SCHEMA, testData.generateNormal(500, DIMENSIONS, 17));
        forest = IsolationForest.train(samples, 100, 256, 42L);
    }

    @Test
    public void testConfigurationIsRecorded() {
        assertEquals(100, forest.getNumberOfTrees());
        assertEquals(100, forest.getTrees().size());
        assertEquals(256, forest.getSubsampleSize());
        assertEquals(42L, forest.getRandomSeed());
        assertEquals(SCHEMA, forest.getSchema());
        assertEquals(DIMENSIONS, forest.getDimensions());
        assertFalse(forest.isParallelExecutionEnabled());
        forest.getTrees().forEach(tree -> assertEquals(256, tree.getMass()));
    }

    @Test
    public void testScoreIsDeterministic() {
        FeatureVector point = FeatureVector.of(SCHEMA, 0.12, 0.08, 0.1, 0.11);
        double first = forest.getAnomalyScore(point);
        for (int i = 0; i < 10; i++) {
            assertEquals(first, forest.getAnomalyScore(point));
        }
    }

    @Test
    public void testSameSeedReproducesTheForest() {
        IsolationForest retrained = IsolationForest.train(samples, 100, 256, 42L);
        IsolationForest reseeded = IsolationForest.train(samples, 100, 256, 43L);
        FeatureVector point = FeatureVector.of(SCHEMA, 0.15, 0.05, 0.1, 0.1);
        assertEquals(forest.getAnomalyScore(point), retrained.getAnomalyScore(point));
        assertNotEquals(forest.getAnomalyScore(point), reseeded.getAnomalyScore(point));
    }

    @Test
    public void testUnseededTrainingRecordsItsSeed() {
        IsolationForest unseeded = IsolationForest.builder().numberOfTrees(10).subsampleSize(64).train(samples);
        IsolationForest replay = IsolationForest.builder().numberOfTrees(10).subsampleSize(64)
                .randomSeed(unseeded.getRandomSeed()).train(samples);
        FeatureVector point = samples.get(3);
        assertEquals(unseeded.getAnomalyScore(point), replay.getAnomalyScore(point));
    }

    @Test
    public void testScoresAreInUnitIntervalAndSeparateClusters() {
        double normal = forest.getAnomalyScore(new FeatureVector(SCHEMA, testData.normalCentroid(DIMENSIONS)));
        double anomaly = forest.getAnomalyScore(new FeatureVector(SCHEMA, testData.anomalyCentroid(DIMENSIONS)));
        assertTrue(normal >= 0 && normal <= 1);
        assertTrue(anomaly >= 0 && anomaly <= 1);
        assertTrue(anomaly > normal + 0.1, "anomaly " + anomaly + " normal " + normal);
        assertTrue(normal < 0.5);
    }

    @Test
    public void testScoreRejectsOtherSchema() {
        FeatureSchema other = FeatureSchema.of("a", "b", "c", "d");
        MalformedFeatureVectorException e = assertThrows(MalformedFeatureVectorException.class,
                () -> forest.getAnomalyScore(FeatureVector.of(other, 0.1, 0.1, 0.1, 0.1)));
        assertEquals(ErrorCode.MISSING_FEATURES, e.getErrorCode());
    }

    @Test
    public void testInvalidTrainingData() {
        assertThrows(InvalidTrainingDataException.class,
                () -> IsolationForest.train(Collections.emptyList(), 10, 1, 0L));
        assertThrows(InvalidTrainingDataException.class, () -> IsolationForest.train(null, 10, 1, 0L));
        assertThrows(InvalidTrainingDataException.class, () -> IsolationForest.train(samples, 10, 501, 0L));
        assertThrows(InvalidTrainingDataException.class, () -> IsolationForest.train(samples, 10, 0, 0L));
        assertThrows(InvalidTrainingDataException.class, () -> IsolationForest.train(samples, 0, 10, 0L));

        List<FeatureVector> mixed = new ArrayList<>(samples.subList(0, 10));
        mixed.add(FeatureVector.of(FeatureSchema.of("a", "b", "c", "d"), 1, 2, 3, 4));
        InvalidTrainingDataException e = assertThrows(InvalidTrainingDataException.class,
                () -> IsolationForest.train(mixed, 10, 5, 0L));
        assertEquals(ErrorCode.INVALID_TRAINING_DATA, e.getErrorCode());
    }

    @Test
    public void testSubsampleEqualToSampleCount() {
        IsolationForest whole = IsolationForest.train(samples.subList(0, 32), 5, 32, 1L);
        whole.getTrees().forEach(tree -> assertEquals(32, tree.getMass()));
    }

    @Test
    public void testSingleSampleForest() {
        IsolationForest single = IsolationForest.train(samples.subList(0, 1), 3, 1, 1L);
        assertEquals(0.5, single.getAnomalyScore(samples.get(0)), EPSILON);
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 2, 4 })
    public void testParallelTraversalAgreesWithSequential(int threads) {
        IsolationForest parallel = IsolationForest.builder().numberOfTrees(100).subsampleSize(256).randomSeed(42L)
                .parallelExecutionEnabled(true).threadPoolSize(threads).train(samples);
        for (FeatureVector point : samples.subList(0, 20)) {
            assertEquals(forest.getAnomalyScore(point), parallel.getAnomalyScore(point), EPSILON);
        }
    }

    @Test
    public void testExpiredDeadlineAbandonsScoring() {
        Deadline expired = Deadline.after(Duration.ZERO);
        ScoringTimeoutException e = assertThrows(ScoringTimeoutException.class,
                () -> forest.getAnomalyScore(samples.get(0), expired));
        assertEquals(ErrorCode.SCORING_TIMEOUT, e.getErrorCode());
        assertTrue(e.getErrorCode().isRetryable());
    }

    @Test
    public void testConcurrentScoringMatchesSingleThreaded() throws Exception {
        double[] expected = new double[50];
        for (int i = 0; i < expected.length; i++) {
            expected[i] = forest.getAnomalyScore(samples.get(i));
        }
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Double>> futures = new ArrayList<>();
            for (int round = 0; round < 4; round++) {
                for (int i = 0; i < expected.length; i++) {
                    FeatureVector point = samples.get(i);
                    futures.add(pool.submit(() -> forest.getAnomalyScore(point)));
                }
            }
            for (int i = 0; i < futures.size(); i++) {
                assertEquals(expected[i % expected.length], futures.get(i).get());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
