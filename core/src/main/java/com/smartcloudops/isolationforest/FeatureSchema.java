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

import static com.smartcloudops.isolationforest.CommonUtils.checkArgument;
import static com.smartcloudops.isolationforest.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import com.smartcloudops.isolationforest.exception.MalformedFeatureVectorException;

/**
 * The ordered list of named numeric fields that every feature vector of a
 * deployment carries. A schema is fixed once created; scorers remember the
 * schema they were trained with and reject vectors of any other shape.
 */
public final class FeatureSchema {

    private final List<String> fieldNames;

    private final Map<String, Integer> positions;

    public FeatureSchema(List<String> fieldNames) {
        checkNotNull(fieldNames, "fieldNames must not be null");
        checkArgument(!fieldNames.isEmpty(), "a schema needs at least one field");
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < fieldNames.size(); i++) {
            String name = fieldNames.get(i);
            checkArgument(name != null && !name.isBlank(), "field names must be non-blank");
            checkArgument(index.put(name, i) == null, "duplicate field name " + name);
        }
        this.fieldNames = Collections.unmodifiableList(new ArrayList<>(fieldNames));
        this.positions = Collections.unmodifiableMap(index);
    }

    public static FeatureSchema of(String... fieldNames) {
        checkNotNull(fieldNames, "fieldNames must not be null");
        return new FeatureSchema(Arrays.asList(fieldNames));
    }

    public int size() {
        return fieldNames.size();
    }

    public List<String> getFieldNames() {
        return fieldNames;
    }

    public String getFieldName(int index) {
        return fieldNames.get(index);
    }

    public boolean contains(String name) {
        return positions.containsKey(name);
    }

    /**
     * @param name a field name
     * @return the position of the field in every vector of this schema
     * @throws MalformedFeatureVectorException if the field is not part of the
     *                                         schema
     */
    public int indexOf(String name) {
        Integer position = positions.get(name);
        if (position == null) {
            throw new MalformedFeatureVectorException("unknown feature " + name);
        }
        return position;
    }

    /**
     * Builds a vector from named values. Every field of the schema must be
     * present with a finite value and no other names are accepted.
     *
     * @param values feature values keyed by field name
     * @return the vector in schema order
     * @throws MalformedFeatureVectorException if a field is missing, not finite,
     *                                         or not part of the schema
     */
    public FeatureVector toVector(Map<String, ? extends Number> values) {
        checkNotNull(values, "values must not be null");
        TreeSet<String> missing = new TreeSet<>();
        double[] point = new double[fieldNames.size()];
        for (int i = 0; i < point.length; i++) {
            Number value = values.get(fieldNames.get(i));
            if (value == null || !Double.isFinite(value.doubleValue())) {
                missing.add(fieldNames.get(i));
            } else {
                point[i] = value.doubleValue();
            }
        }
        if (!missing.isEmpty()) {
            throw new MalformedFeatureVectorException("missing or non-finite features " + missing);
        }
        if (values.size() != fieldNames.size()) {
            TreeSet<String> unknown = new TreeSet<>(values.keySet());
            unknown.removeAll(fieldNames);
            throw new MalformedFeatureVectorException("features not in schema " + unknown);
        }
        return new FeatureVector(this, point);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FeatureSchema)) {
            return false;
        }
        return fieldNames.equals(((FeatureSchema) other).fieldNames);
    }

    @Override
    public int hashCode() {
        return fieldNames.hashCode();
    }

    @Override
    public String toString() {
        return "FeatureSchema" + fieldNames;
    }
}
