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

import static com.smartcloudops.isolationforest.CommonUtils.checkArgument;
import static com.smartcloudops.isolationforest.CommonUtils.checkNotNull;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.smartcloudops.isolationforest.serving.registry.RegistryEntry;
import com.smartcloudops.isolationforest.serving.state.RegistryEntryMapper;
import com.smartcloudops.isolationforest.serving.state.RegistryEntryState;

/**
 * Stores one JSON document per model version in a directory. A document is
 * written to a temporary file in the same directory and then moved over the
 * target, so readers see either the old or the new document.
 */
public class JsonFileRegistryStore implements IRegistryStore {

    private static final Logger logger = LogManager.getLogger(JsonFileRegistryStore.class);

    static final String SUFFIX = ".json";

    private static final String TEMP_SUFFIX = ".tmp";

    private final Path directory;

    private final ObjectMapper objectMapper;

    private final RegistryEntryMapper mapper = new RegistryEntryMapper();

    public JsonFileRegistryStore(Path directory) throws IOException {
        this.directory = checkNotNull(directory, "directory must not be null");
        Files.createDirectories(directory);
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public void save(RegistryEntry entry) throws IOException {
        checkNotNull(entry, "entry must not be null");
        Path target = pathOf(entry.getVersion());
        Path temp = directory.resolve(target.getFileName() + TEMP_SUFFIX);
        objectMapper.writeValue(temp.toFile(), mapper.toState(entry));
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.debug("saved model {} to {}", entry.getVersion(), target);
    }

    @Override
    public List<RegistryEntry> loadAll() throws IOException {
        List<RegistryEntry> result = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                RegistryEntryState state = objectMapper.readValue(file.toFile(), RegistryEntryState.class);
                try {
                    result.add(mapper.toModel(state));
                } catch (IllegalArgumentException | NullPointerException e) {
                    throw new IOException("corrupt registry document " + file, e);
                }
            }
        }
        return result;
    }

    Path pathOf(String version) {
        checkArgument(version.matches("[A-Za-z0-9._-]+") && !version.startsWith("."),
                "version " + version + " cannot be used as a file name");
        return directory.resolve(version + SUFFIX);
    }
}
