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

import static com.smartcloudops.isolationforest.TestUtils.SCHEMA;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.smartcloudops.isolationforest.exception.ErrorCode;
import com.smartcloudops.isolationforest.exception.MalformedFeatureVectorException;

public class FeatureVectorTest {

    @Test
    public void testSchemaRejectsDuplicatesAndBlanks() {
        assertThrows(IllegalArgumentException.class, () -> FeatureSchema.of("a", "a"));
        assertThrows(IllegalArgumentException.class, () -> FeatureSchema.of("a", " "));
        assertThrows(IllegalArgumentException.class, () -> FeatureSchema.of());
    }

    @Test
    public void testLengthMismatchIsNeverPadded() {
        MalformedFeatureVectorException e = assertThrows(MalformedFeatureVectorException.class,
                () -> FeatureVector.of(SCHEMA, 1.0, 2.0, 3.0));
        assertEquals(ErrorCode.MISSING_FEATURES, e.getErrorCode());
        assertThrows(MalformedFeatureVectorException.class, () -> FeatureVector.of(SCHEMA, 1, 2, 3, 4, 5));
    }

    @Test
    public void testValuesAreCopied() {
        double[] values = new double[] { 1, 2, 3, 4 };
        FeatureVector vector = new FeatureVector(SCHEMA, values);
        values[0] = 100;
        assertEquals(1.0, vector.get(0));
        vector.toArray()[1] = 100;
        assertEquals(2.0, vector.get("memory_usage"));
    }

    @Test
    public void testToVectorFromMap() {
        Map<String, Double> values = new HashMap<>();
        values.put("network_io", 4.0);
        values.put("cpu_usage", 1.0);
        values.put("disk_usage", 3.0);
        values.put("memory_usage", 2.0);
        FeatureVector vector = SCHEMA.toVector(values);
        assertArrayEquals(new double[] { 1, 2, 3, 4 }, vector.toArray());
        assertEquals(values, vector.toMap());
    }

    @Test
    public void testToVectorReportsMissingFeatures() {
        Map<String, Double> values = new HashMap<>();
        values.put("cpu_usage", 1.0);
        values.put("memory_usage", Double.NaN);
        MalformedFeatureVectorException e = assertThrows(MalformedFeatureVectorException.class,
                () -> SCHEMA.toVector(values));
        assertTrue(e.getMessage().contains("disk_usage"));
        assertTrue(e.getMessage().contains("memory_usage"));
        assertFalse(e.getMessage().contains("cpu_usage"));
    }

    @Test
    public void testToVectorRejectsUnknownFeatures() {
        Map<String, Double> values = new HashMap<>();
        for (String name : SCHEMA.getFieldNames()) {
            values.put(name, 0.5);
        }
        values.put("gpu_usage", 0.5);
        assertThrows(MalformedFeatureVectorException.class, () -> SCHEMA.toVector(values));
    }

    @Test
    public void testSchemaConformance() {
        FeatureSchema other = FeatureSchema.of("cpu_usage", "disk_usage", "memory_usage", "network_io");
        FeatureVector vector = FeatureVector.of(SCHEMA, 1, 2, 3, 4);
        assertTrue(vector.conformsTo(FeatureSchema.of("cpu_usage", "memory_usage", "disk_usage", "network_io")));
        assertFalse(vector.conformsTo(other));
        assertThrows(MalformedFeatureVectorException.class, () -> vector.checkConformsTo(other));
        assertNotEquals(vector, FeatureVector.of(other, 1, 2, 3, 4));
        assertEquals(vector, FeatureVector.of(SCHEMA, 1, 2, 3, 4));
    }
}
