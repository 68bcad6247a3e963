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

import java.util.Objects;

/** A collection of common utility functions. */
public class CommonUtils {

    /**
     * The Euler-Mascheroni constant, used to approximate harmonic numbers.
     */
    public static final double EULER_GAMMA = 0.5772156649;

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is
     *                  false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * Approximation of the harmonic number H(i) = ln(i) + gamma.
     *
     * @param i a positive value
     * @return the approximate harmonic number
     */
    public static double harmonicNumber(double i) {
        return Math.log(i) + EULER_GAMMA;
    }

    /**
     * The average path length of an unsuccessful search in a binary search tree
     * built over {@code n} points, c(n) = 2 H(n-1) - 2(n-1)/n. This normalizes
     * path lengths in an isolation forest and also stands in for the unexplored
     * part of a leaf that still holds more than one point.
     *
     * @param n number of points
     * @return c(n), which is 0 for n &lt;= 1
     */
    public static double averagePathLength(long n) {
        if (n <= 1) {
            return 0.0;
        }
        return 2.0 * harmonicNumber(n - 1.0) - 2.0 * (n - 1.0) / n;
    }

    /**
     * The isolation score 2^(-E[h] / c(n)) for an expected path length E[h] over
     * trees built from subsamples of size n. Shorter paths give scores closer to
     * 1. When c(n) is 0 no path carries information and the score is the neutral
     * 0.5.
     *
     * @param expectedPathLength the average path length over the ensemble
     * @param subsampleSize      the number of points used to build each tree
     * @return score in [0,1]
     */
    public static double isolationScore(double expectedPathLength, int subsampleSize) {
        double normalizer = averagePathLength(subsampleSize);
        if (normalizer <= 0) {
            return 0.5;
        }
        return Math.pow(2.0, -expectedPathLength / normalizer);
    }

    /**
     * the maximum depth of a partition tree, ceil(log2(subsampleSize))
     *
     * @param subsampleSize the number of points used to build a tree
     * @return the depth limit
     */
    public static int maximumDepth(int subsampleSize) {
        checkArgument(subsampleSize > 0, "subsampleSize must be positive");
        // integer ceil(log2) avoids rounding up exact powers of two
        return 32 - Integer.numberOfLeadingZeros(subsampleSize - 1);
    }

    public static double[] copyOf(double[] values) {
        checkNotNull(values, "values must not be null");
        return values.clone();
    }
}
