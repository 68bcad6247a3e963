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

package com.smartcloudops.isolationforest.testutils;

import java.util.Arrays;
import java.util.Random;

/**
 * This class samples labeled points from two isotropic normal clusters: a
 * normal cluster (label 0) and an anomalous cluster (label 1). With the default
 * parameters the clusters are centered at 0.1 and 0.9 in every dimension with a
 * spread of 0.02, far enough apart that no point of one cluster comes near the
 * other.
 */
public class ClusterTestData {

    public static final double DEFAULT_NORMAL_CENTER = 0.1;

    public static final double DEFAULT_ANOMALY_CENTER = 0.9;

    public static final double DEFAULT_SPREAD = 0.02;

    private final double normalCenter;

    private final double anomalyCenter;

    private final double spread;

    public ClusterTestData(double normalCenter, double anomalyCenter, double spread) {
        this.normalCenter = normalCenter;
        this.anomalyCenter = anomalyCenter;
        this.spread = spread;
    }

    public ClusterTestData() {
        this(DEFAULT_NORMAL_CENTER, DEFAULT_ANOMALY_CENTER, DEFAULT_SPREAD);
    }

    /**
     * Generates the normal rows first, then the anomalous rows.
     *
     * @param normalCount  number of label 0 rows
     * @param anomalyCount number of label 1 rows
     * @param dimensions   number of columns
     * @param seed         seed of the generator
     * @return the labeled rows
     */
    public LabeledData generate(int normalCount, int anomalyCount, int dimensions, long seed) {
        NormalDistribution dist = new NormalDistribution(new Random(seed));
        double[][] data = new double[normalCount + anomalyCount][dimensions];
        int[] labels = new int[normalCount + anomalyCount];
        for (int i = 0; i < normalCount; i++) {
            fillRow(data[i], dist, normalCenter);
        }
        for (int i = normalCount; i < data.length; i++) {
            fillRow(data[i], dist, anomalyCenter);
            labels[i] = 1;
        }
        return new LabeledData(data, labels);
    }

    /**
     * @param count      number of rows
     * @param dimensions number of columns
     * @param seed       seed of the generator
     * @return rows drawn from the normal cluster only
     */
    public double[][] generateNormal(int count, int dimensions, long seed) {
        NormalDistribution dist = new NormalDistribution(new Random(seed));
        double[][] data = new double[count][dimensions];
        for (double[] row : data) {
            fillRow(row, dist, normalCenter);
        }
        return data;
    }

    public double[] normalCentroid(int dimensions) {
        return constant(dimensions, normalCenter);
    }

    public double[] anomalyCentroid(int dimensions) {
        return constant(dimensions, anomalyCenter);
    }

    private static double[] constant(int dimensions, double value) {
        double[] result = new double[dimensions];
        Arrays.fill(result, value);
        return result;
    }

    private void fillRow(double[] row, NormalDistribution dist, double mu) {
        for (int j = 0; j < row.length; j++) {
            row[j] = dist.nextDouble(mu, spread);
        }
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // apply the Box-Muller transform to produce Normal variates
                double u = 1.0 - rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}
