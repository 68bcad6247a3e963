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

package com.smartcloudops.isolationforest.serving.registry.store;

import static com.smartcloudops.isolationforest.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.smartcloudops.isolationforest.serving.registry.RegistryEntry;

/**
 * Keeps entries in memory only. Used when no durability across restarts is
 * needed.
 */
public class InMemoryRegistryStore implements IRegistryStore {

    private final Map<String, RegistryEntry> entries = new ConcurrentHashMap<>();

    @Override
    public void save(RegistryEntry entry) {
        checkNotNull(entry, "entry must not be null");
        entries.put(entry.getVersion(), entry);
    }

    @Override
    public List<RegistryEntry> loadAll() {
        return new ArrayList<>(entries.values());
    }
}
