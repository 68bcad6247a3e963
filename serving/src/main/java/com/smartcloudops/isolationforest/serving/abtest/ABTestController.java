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

import static com.smartcloudops.isolationforest.CommonUtils.checkArgument;
import static com.smartcloudops.isolationforest.CommonUtils.checkNotNull;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.smartcloudops.isolationforest.serving.exception.DuplicateTestIdException;
import com.smartcloudops.isolationforest.serving.exception.ModelNotFoundException;
import com.smartcloudops.isolationforest.serving.exception.UnknownTestException;
import com.smartcloudops.isolationforest.serving.registry.ModelRegistry;
import com.smartcloudops.isolationforest.serving.threshold.ConfusionMatrix;

/**
 * Runs time-bounded comparisons between two registered model versions. Tests
 * expire lazily: every call that depends on whether a test is running compares
 * the clock with the test's end time, so no background sweeper is needed.
 * <p>
 * Each test keeps its outcomes behind its own lock, so recording outcomes for
 * one test never blocks readers of another. Test ids are never reused: a
 * stopped or expired test stays known to the controller.
 */
public class ABTestController {

    private static final Logger logger = LogManager.getLogger(ABTestController.class);

    private final ModelRegistry registry;

    private final Clock clock;

    private final ConcurrentHashMap<String, TestRecord> tests = new ConcurrentHashMap<>();

    // serializes creation so the duplicate check and the registry lookups are atomic
    private final ReentrantLock creationLock = new ReentrantLock();

    public ABTestController(ModelRegistry registry, Clock clock) {
        this.registry = checkNotNull(registry, "registry must not be null");
        this.clock = checkNotNull(clock, "clock must not be null");
    }

    /**
     * Starts a test whose assignments are not reproducible across restarts.
     *
     * @see #startTest(String, String, String, double, Duration, long)
     */
    public ABTest startTest(String testId, String versionA, String versionB, double split, Duration duration) {
        return start(testId, versionA, versionB, split, duration, null);
    }

    /**
     * Starts a test. With a seed, the sequence of assignments is reproducible
     * for the same sequence of {@link #assignVersion} calls.
     *
     * @param testId   a new id
     * @param versionA the version chosen with probability {@code split}
     * @param versionB the other version
     * @param split    share of traffic for arm A, in (0,1)
     * @param duration how long the test runs, positive
     * @param seed     seed of the assignment generator
     * @return the test definition
     * @throws DuplicateTestIdException if the id was used before
     * @throws ModelNotFoundException   if either version is not registered
     */
    public ABTest startTest(String testId, String versionA, String versionB, double split, Duration duration,
            long seed) {
        return start(testId, versionA, versionB, split, duration, seed);
    }

    private ABTest start(String testId, String versionA, String versionB, double split, Duration duration,
            Long seed) {
        checkNotNull(testId, "testId must not be null");
        checkNotNull(versionA, "versionA must not be null");
        checkNotNull(versionB, "versionB must not be null");
        checkNotNull(duration, "duration must not be null");
        checkArgument(!duration.isNegative() && !duration.isZero(), "duration must be positive");
        checkArgument(split > 0 && split < 1, "split must be in (0,1), got " + split);
        checkArgument(!versionA.equals(versionB), "the two arms must use different versions");

        creationLock.lock();
        try {
            if (tests.containsKey(testId)) {
                throw new DuplicateTestIdException("test id " + testId + " has already been used");
            }
            for (String version : new String[] { versionA, versionB }) {
                if (!registry.contains(version)) {
                    throw new ModelNotFoundException("model version " + version + " is not registered");
                }
            }
            Instant now = clock.instant();
            ABTest test = new ABTest(testId, versionA, versionB, split, now, now.plus(duration), seed);
            tests.put(testId, new TestRecord(test));
            logger.info("started A/B test {}: {} ({}) vs {} until {}", testId, versionA, split, versionB,
                    test.getEndTime());
            return test;
        } finally {
            creationLock.unlock();
        }
    }

    /**
     * Draws the arm for one request.
     *
     * @param testId the test
     * @return the assigned version, or empty if the test is unknown, stopped or
     *         past its end time
     */
    public Optional<String> assignVersion(String testId) {
        checkNotNull(testId, "testId must not be null");
        TestRecord record = tests.get(testId);
        if (record == null || record.statusAt(clock.instant()) != ABTestStatus.ACTIVE) {
            return Optional.empty();
        }
        ABTest test = record.test;
        String version = record.random.nextDouble() < test.getSplit() ? test.getVersionA() : test.getVersionB();
        logger.debug("test {} assigned {}", testId, version);
        return Optional.of(version);
    }

    /**
     * Appends an outcome without latency.
     *
     * @see #recordOutcome(String, String, int, Optional, double, OptionalDouble)
     */
    public void recordOutcome(String testId, String version, int prediction, Optional<Integer> actualLabel,
            double confidence) {
        recordOutcome(testId, version, prediction, actualLabel, confidence, OptionalDouble.empty());
    }

    /**
     * Appends a served prediction. Outcomes are accepted after the test ended.
     * Ground truth for a prediction recorded earlier goes through
     * {@link #recordGroundTruth(String, String, int, int)}.
     *
     * @param testId        a known test
     * @param version       one of the test's arms
     * @param prediction    the predicted label, 0 or 1
     * @param actualLabel   the ground truth, if known
     * @param confidence    the confidence of the prediction
     * @param latencyMillis the time taken to serve the prediction, if measured
     * @throws UnknownTestException if the test id is not known
     */
    public void recordOutcome(String testId, String version, int prediction, Optional<Integer> actualLabel,
            double confidence, OptionalDouble latencyMillis) {
        TestRecord record = getOrThrow(testId);
        checkArgument(record.test.isArm(version), version + " is not an arm of test " + testId);
        ABTestOutcome outcome = new ABTestOutcome(testId, version, prediction, actualLabel, confidence,
                latencyMillis, clock.instant());
        record.lock.writeLock().lock();
        try {
            record.outcomes.add(outcome);
        } finally {
            record.lock.writeLock().unlock();
        }
    }

    /**
     * Appends ground truth for a prediction that was already recorded without
     * it. The label feeds the accuracy figures of the arm; the prediction is
     * not counted a second time.
     *
     * @param testId      a known test
     * @param version     the arm that served the prediction
     * @param prediction  the label predicted at serving time, 0 or 1
     * @param actualLabel the observed label, 0 or 1
     * @throws UnknownTestException if the test id is not known
     */
    public void recordGroundTruth(String testId, String version, int prediction, int actualLabel) {
        TestRecord record = getOrThrow(testId);
        checkArgument(record.test.isArm(version), version + " is not an arm of test " + testId);
        ABTestOutcome outcome = ABTestOutcome.groundTruth(testId, version, prediction, actualLabel, clock.instant());
        record.lock.writeLock().lock();
        try {
            record.outcomes.add(outcome);
        } finally {
            record.lock.writeLock().unlock();
        }
    }

    /**
     * Stops a test before its end time. Stopping a stopped or expired test has
     * no effect.
     *
     * @throws UnknownTestException if the test id is not known
     */
    public void stopTest(String testId) {
        TestRecord record = getOrThrow(testId);
        record.lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            if (record.statusAt(now) == ABTestStatus.ACTIVE) {
                record.stoppedAt = now;
                logger.info("stopped A/B test {}", testId);
            }
        } finally {
            record.lock.writeLock().unlock();
        }
    }

    /**
     * @return whether the test is known and currently splitting traffic
     */
    public boolean isActive(String testId) {
        checkNotNull(testId, "testId must not be null");
        TestRecord record = tests.get(testId);
        return record != null && record.statusAt(clock.instant()) == ABTestStatus.ACTIVE;
    }

    /**
     * @throws UnknownTestException if the test id is not known
     */
    public ABTestStatus getStatus(String testId) {
        return getOrThrow(testId).statusAt(clock.instant());
    }

    /**
     * @return the definition of the test
     * @throws UnknownTestException if the test id is not known
     */
    public ABTest getTest(String testId) {
        return getOrThrow(testId).test;
    }

    /**
     * @return every test ever started, in start order
     */
    public List<ABTest> listTests() {
        List<ABTest> result = new ArrayList<>();
        for (TestRecord record : tests.values()) {
            result.add(record.test);
        }
        result.sort(Comparator.comparing(ABTest::getStartTime).thenComparing(ABTest::getId));
        return result;
    }

    /**
     * @return number of tests currently splitting traffic
     */
    public int countActive() {
        Instant now = clock.instant();
        int count = 0;
        for (TestRecord record : tests.values()) {
            if (record.statusAt(now) == ABTestStatus.ACTIVE) {
                count++;
            }
        }
        return count;
    }

    /**
     * Aggregates the outcomes recorded so far for each arm.
     *
     * @throws UnknownTestException if the test id is not known
     */
    public ABTestMetrics computeMetrics(String testId) {
        TestRecord record = getOrThrow(testId);
        List<ABTestOutcome> outcomes;
        ABTestStatus status;
        record.lock.readLock().lock();
        try {
            outcomes = new ArrayList<>(record.outcomes);
            status = record.statusAt(clock.instant());
        } finally {
            record.lock.readLock().unlock();
        }
        ABTest test = record.test;
        return new ABTestMetrics(testId, status, aggregate(test.getVersionA(), outcomes),
                aggregate(test.getVersionB(), outcomes));
    }

    private static ArmMetrics aggregate(String version, List<ABTestOutcome> outcomes) {
        ConfusionMatrix matrix = new ConfusionMatrix();
        long total = 0;
        long anomalies = 0;
        long timed = 0;
        double latencySum = 0;
        for (ABTestOutcome outcome : outcomes) {
            if (!outcome.getAssignedVersion().equals(version)) {
                continue;
            }
            outcome.getActualLabel().ifPresent(label -> matrix.add(outcome.getPrediction(), label));
            if (outcome.isGroundTruth()) {
                continue;
            }
            total++;
            anomalies += outcome.getPrediction();
            if (outcome.getLatencyMillis().isPresent()) {
                timed++;
                latencySum += outcome.getLatencyMillis().getAsDouble();
            }
        }
        return new ArmMetrics(version, total, matrix.getTotal(), matrix.accuracy(), matrix.precision(),
                matrix.recall(), matrix.f1(), total == 0 ? 0.0 : (double) anomalies / total,
                timed == 0 ? 0.0 : latencySum / timed);
    }

    private TestRecord getOrThrow(String testId) {
        checkNotNull(testId, "testId must not be null");
        TestRecord record = tests.get(testId);
        if (record == null) {
            throw new UnknownTestException("test id " + testId + " is not known");
        }
        return record;
    }

    private static class TestRecord {

        final ABTest test;

        final Random random;

        final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

        final List<ABTestOutcome> outcomes = new ArrayList<>();

        volatile Instant stoppedAt;

        TestRecord(ABTest test) {
            this.test = test;
            this.random = test.getSeed().map(seed -> new Random(seed)).orElseGet(Random::new);
        }

        ABTestStatus statusAt(Instant now) {
            if (stoppedAt != null) {
                return ABTestStatus.STOPPED;
            }
            return now.isAfter(test.getEndTime()) ? ABTestStatus.COMPLETED : ABTestStatus.ACTIVE;
        }
    }
}
