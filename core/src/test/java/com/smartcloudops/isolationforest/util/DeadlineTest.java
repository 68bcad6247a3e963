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

package com.smartcloudops.isolationforest.util;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.Test;

import com.smartcloudops.isolationforest.exception.ScoringTimeoutException;

public class DeadlineTest {

    @Test
    public void testDeadlineFollowsTheClock() {
        AtomicLong nanos = new AtomicLong(1_000L);
        Deadline deadline = Deadline.after(Duration.ofNanos(100), nanos::get);
        assertFalse(deadline.isExpired());
        assertFalse(deadline.isUnbounded());
        assertEquals(Duration.ofNanos(100), deadline.remaining());

        nanos.addAndGet(60);
        assertEquals(Duration.ofNanos(40), deadline.remaining());
        assertDoesNotThrow(() -> deadline.checkNotExpired("scoring"));

        nanos.addAndGet(40);
        assertTrue(deadline.isExpired());
        assertEquals(Duration.ZERO, deadline.remaining());
        ScoringTimeoutException e = assertThrows(ScoringTimeoutException.class,
                () -> deadline.checkNotExpired("scoring"));
        assertTrue(e.getMessage().startsWith("scoring"));
    }

    @Test
    public void testNonPositiveTimeoutIsAlreadyExpired() {
        assertTrue(Deadline.after(Duration.ZERO).isExpired());
        assertTrue(Deadline.after(Duration.ofSeconds(-5)).isExpired());
    }

    @Test
    public void testHugeTimeoutSaturates() {
        AtomicLong nanos = new AtomicLong(Long.MAX_VALUE - 10);
        Deadline deadline = Deadline.after(Duration.ofNanos(Long.MAX_VALUE), nanos::get);
        assertTrue(deadline.isUnbounded());
        assertTrue(Deadline.after(Duration.ofDays(365L * 1_000_000)).isUnbounded());
        assertFalse(Deadline.none().isExpired());
    }
}
