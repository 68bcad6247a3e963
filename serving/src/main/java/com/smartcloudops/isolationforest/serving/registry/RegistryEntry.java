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

/**
 * A scorer artifact paired with its metadata. Entries handed out by the
 * registry carry a snapshot of the metadata taken under the registry lock.
 */
public final class RegistryEntry {

    private final ScorerArtifact artifact;

    private final ModelMetadata metadata;

    public RegistryEntry(ScorerArtifact artifact, ModelMetadata metadata) {
        this.artifact = checkNotNull(artifact, "artifact must not be null");
        this.metadata = checkNotNull(metadata, "metadata must not be null");
    }

    public ScorerArtifact getArtifact() {
        return artifact;
    }

    public ModelMetadata getMetadata() {
        return metadata;
    }

    public String getVersion() {
        return metadata.getVersion();
    }

    RegistryEntry snapshot() {
        return new RegistryEntry(artifact, metadata.copy());
    }
}
