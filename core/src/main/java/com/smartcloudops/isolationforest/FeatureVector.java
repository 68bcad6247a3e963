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

import static com.smartcloudops.isolationforest.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import com.smartcloudops.isolationforest.exception.MalformedFeatureVectorException;

/**
 * A fixed-order numeric array tied to the schema that names its fields. The
 * values are copied on the way in and on the way out so that a vector can be
 * shared between threads without coordination.
 */
public final class FeatureVector {

    private final FeatureSchema schema;

    private final double[] values;

    public FeatureVector(FeatureSchema schema, double[] values) {
        this.schema = checkNotNull(schema, "schema must not be null");
        checkNotNull(values, "values must not be null");
        if (values.length != schema.size()) {
            throw new MalformedFeatureVectorException(String.format(
                    "vector has %d values but schema %s expects %d", values.length, schema, schema.size()));
        }
        this.values = values.clone();
    }

    public static FeatureVector of(FeatureSchema schema, double... values) {
        return new FeatureVector(schema, values);
    }

    public FeatureSchema getSchema() {
        return schema;
    }

    public int getDimensions() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public double get(String name) {
        return values[schema.indexOf(name)];
    }

    /**
     * @return a copy of the values in schema order
     */
    public double[] toArray() {
        return values.clone();
    }

    public Map<String, Double> toMap() {
        Map<String, Double> result = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            result.put(schema.getFieldName(i), values[i]);
        }
        return result;
    }

    public boolean conformsTo(FeatureSchema other) {
        return schema.equals(other);
    }

    /**
     * @param expected the schema a consumer was built for
     * @throws MalformedFeatureVectorException if this vector uses another schema
     */
    public void checkConformsTo(FeatureSchema expected) {
        if (!conformsTo(expected)) {
            throw new MalformedFeatureVectorException(
                    String.format("vector with schema %s does not match expected schema %s", schema, expected));
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FeatureVector)) {
            return false;
        }
        FeatureVector that = (FeatureVector) other;
        return schema.equals(that.schema) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * schema.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + toMap();
    }
}
