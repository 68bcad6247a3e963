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

package com.smartcloudops.isolationforest.serving.registry;

import static com.smartcloudops.isolationforest.CommonUtils.checkNotNull;

import com.smartcloudops.isolationforest.FeatureSchema;
import com.smartcloudops.isolationforest.FeatureVector;
import com.smartcloudops.isolationforest.IsolationForest;
import com.smartcloudops.isolationforest.util.Deadline;

/**
 * A trained scorer tagged with its algorithm. New algorithms add a constant to
 * {@link Algorithm}, a payload field and a branch in {@link #score}; the
 * registry only ever deals with this type. Artifacts are immutable.
 */
public final class ScorerArtifact {

    private final Algorithm algorithm;

    private final IsolationForest isolationForest;

    private ScorerArtifact(Algorithm algorithm, IsolationForest isolationForest) {
        this.algorithm = algorithm;
        this.isolationForest = isolationForest;
    }

    public static ScorerArtifact isolationForest(IsolationForest forest) {
        checkNotNull(forest, "forest must not be null");
        return new ScorerArtifact(Algorithm.ISOLATION_FOREST, forest);
    }

    public Algorithm getAlgorithm() {
        return algorithm;
    }

    /**
     * @return the forest payload
     * @throws IllegalStateException if the artifact holds another algorithm
     */
    public IsolationForest getIsolationForest() {
        if (algorithm != Algorithm.ISOLATION_FOREST) {
            throw new IllegalStateException("artifact holds " + algorithm);
        }
        return isolationForest;
    }

    public FeatureSchema getSchema() {
        switch (algorithm) {
        case ISOLATION_FOREST:
            return isolationForest.getSchema();
        default:
            throw new IllegalStateException("unsupported algorithm " + algorithm);
        }
    }

    /**
     * @param vector   the point to score, with the artifact's schema
     * @param deadline the time after which scoring is abandoned
     * @return anomaly score in [0,1]; higher is more anomalous
     */
    public double score(FeatureVector vector, Deadline deadline) {
        switch (algorithm) {
        case ISOLATION_FOREST:
            return isolationForest.getAnomalyScore(vector, deadline);
        default:
            throw new IllegalStateException("unsupported algorithm " + algorithm);
        }
    }
}
