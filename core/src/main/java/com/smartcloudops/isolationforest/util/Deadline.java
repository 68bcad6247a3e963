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

import static com.smartcloudops.isolationforest.CommonUtils.checkNotNull;

import java.time.Duration;
import java.util.function.LongSupplier;

import com.smartcloudops.isolationforest.exception.ScoringTimeoutException;

/**
 * An absolute point in monotonic time after which work on a request must stop.
 * Deadlines are immutable and may be handed to any number of threads.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(Long.MAX_VALUE, System::nanoTime, true);

    private final long expiryNanos;

    private final LongSupplier nanoClock;

    private final boolean unbounded;

    private Deadline(long expiryNanos, LongSupplier nanoClock, boolean unbounded) {
        this.expiryNanos = expiryNanos;
        this.nanoClock = nanoClock;
        this.unbounded = unbounded;
    }

    /**
     * @return a deadline that never expires
     */
    public static Deadline none() {
        return NONE;
    }

    /**
     * @param timeout time allowed from now; zero or negative values give an
     *                already expired deadline
     * @return the deadline
     */
    public static Deadline after(Duration timeout) {
        return after(timeout, System::nanoTime);
    }

    public static Deadline after(Duration timeout, LongSupplier nanoClock) {
        checkNotNull(timeout, "timeout must not be null");
        checkNotNull(nanoClock, "nanoClock must not be null");
        long now = nanoClock.getAsLong();
        long budget;
        try {
            budget = timeout.toNanos();
        } catch (ArithmeticException e) {
            return NONE;
        }
        long expiry = now + budget;
        // saturate instead of wrapping around for very long timeouts
        if (budget > 0 && expiry < now) {
            return NONE;
        }
        return new Deadline(expiry, nanoClock, false);
    }

    public boolean isExpired() {
        return !unbounded && nanoClock.getAsLong() - expiryNanos >= 0;
    }

    /**
     * @return the time left, never negative; {@code Duration.ofNanos(Long.MAX_VALUE)}
     *         for an unbounded deadline
     */
    public Duration remaining() {
        if (unbounded) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        long left = expiryNanos - nanoClock.getAsLong();
        return Duration.ofNanos(Math.max(0L, left));
    }

    public boolean isUnbounded() {
        return unbounded;
    }

    /**
     * @param operation name of the work being guarded, used in the message
     * @throws ScoringTimeoutException if the deadline has passed
     */
    public void checkNotExpired(String operation) {
        if (isExpired()) {
            throw new ScoringTimeoutException(operation + " exceeded its deadline");
        }
    }
}
