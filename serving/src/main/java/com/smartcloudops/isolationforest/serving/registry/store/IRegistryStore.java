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

import java.io.IOException;
import java.util.List;

import com.smartcloudops.isolationforest.serving.registry.RegistryEntry;

/**
 * Durable storage for registry entries. Both operations must be atomic at the
 * granularity of one entry: a reader never sees a partly written entry.
 */
public interface IRegistryStore {

    /**
     * Stores the entry, replacing any earlier entry with the same version.
     *
     * @param entry the entry to store
     * @throws IOException if the entry could not be stored
     */
    void save(RegistryEntry entry) throws IOException;

    /**
     * @return every stored entry, in no particular order
     * @throws IOException if the entries could not be read
     */
    List<RegistryEntry> loadAll() throws IOException;
}
