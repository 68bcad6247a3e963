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

import static com.smartcloudops.isolationforest.CommonUtils.checkArgument;
import static com.smartcloudops.isolationforest.CommonUtils.checkNotNull;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.smartcloudops.isolationforest.serving.exception.DuplicateVersionException;
import com.smartcloudops.isolationforest.serving.exception.ModelNotFoundException;
import com.smartcloudops.isolationforest.serving.exception.NoActiveModelException;
import com.smartcloudops.isolationforest.serving.exception.NoProductionModelException;
import com.smartcloudops.isolationforest.serving.exception.RegistryPersistenceException;
import com.smartcloudops.isolationforest.serving.registry.store.IRegistryStore;
import com.smartcloudops.isolationforest.serving.registry.store.InMemoryRegistryStore;

/**
 * Versioned catalogue of scorer artifacts. At most one entry is active and at
 * most one is in production at any time. Every read and write runs under one read-write lock, so a reader
 * never observes a promotion half done.
 * <p>
 * Changes are written to the {@link IRegistryStore} before they become
 * visible. When the store fails, the registry keeps its previous state and the
 * failure surfaces as {@link RegistryPersistenceException}.
 */
public class ModelRegistry {

    private static final Logger logger = LogManager.getLogger(ModelRegistry.class);

    static final Comparator<ModelMetadata> CREATION_ORDER = Comparator.comparing(ModelMetadata::getCreatedAt)
            .thenComparing(ModelMetadata::getVersion);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, RegistryEntry> entries = new HashMap<>();

    private final IRegistryStore store;

    public ModelRegistry() {
        this(new InMemoryRegistryStore());
    }

    public ModelRegistry(IRegistryStore store) {
        this.store = checkNotNull(store, "store must not be null");
    }

    /**
     * Rebuilds a registry from the entries of a store. If the stored flags
     * break the single active or single production rule, the most recently
     * created flagged entry keeps its flag and the others lose it; the repaired
     * entries are written back.
     *
     * @param store the store to read and to write subsequent changes to
     * @return the restored registry
     * @throws RegistryPersistenceException if the store cannot be read or the
     *                                      repair cannot be written
     */
    public static ModelRegistry load(IRegistryStore store) {
        ModelRegistry registry = new ModelRegistry(store);
        List<RegistryEntry> stored;
        try {
            stored = store.loadAll();
        } catch (IOException e) {
            throw new RegistryPersistenceException("failed to load the registry", e);
        }

        List<RegistryEntry> newestFirst = new ArrayList<>(stored.size());
        for (RegistryEntry entry : stored) {
            checkArgument(!registry.entries.containsKey(entry.getVersion()),
                    "store holds duplicate version " + entry.getVersion());
            RegistryEntry own = entry.snapshot();
            registry.entries.put(own.getVersion(), own);
            newestFirst.add(own);
        }
        newestFirst.sort(Comparator.comparing(RegistryEntry::getMetadata, CREATION_ORDER).reversed());

        String active = null;
        String production = null;
        List<RegistryEntry> repaired = new ArrayList<>();
        for (RegistryEntry own : newestFirst) {
            ModelMetadata metadata = own.getMetadata();
            boolean changed = false;
            if (metadata.isActive()) {
                if (active == null) {
                    active = own.getVersion();
                } else {
                    metadata.setActive(false);
                    changed = true;
                }
            }
            if (metadata.isProduction()) {
                if (production == null) {
                    production = own.getVersion();
                } else {
                    metadata.setProduction(false);
                    changed = true;
                }
            }
            if (changed) {
                repaired.add(own);
            }
        }
        for (RegistryEntry own : repaired) {
            logger.warn("repaired flags of stored model {}: active={} production={}", own.getVersion(),
                    own.getMetadata().isActive(), own.getMetadata().isProduction());
            registry.persist(own);
        }
        logger.info("loaded {} models from the registry store, active {}, production {}", registry.entries.size(),
                active, production);
        return registry;
    }

    /**
     * Adds a new version. The flags of the registered metadata are cleared; use
     * {@link #promote} to make the version active.
     *
     * @param artifact the trained scorer
     * @param metadata its description; the version must be new
     * @return a snapshot of the registered entry
     * @throws DuplicateVersionException   if the version is already registered
     * @throws RegistryPersistenceException if the store rejects the entry
     */
    public RegistryEntry register(ScorerArtifact artifact, ModelMetadata metadata) {
        checkNotNull(artifact, "artifact must not be null");
        checkNotNull(metadata, "metadata must not be null");
        checkArgument(artifact.getAlgorithm() == metadata.getAlgorithm(),
                "artifact algorithm does not match the metadata");
        checkArgument(artifact.getSchema().equals(metadata.getSchema()),
                "artifact schema does not match the metadata");

        ModelMetadata own = metadata.toBuilder().active(false).production(false).build();
        RegistryEntry entry = new RegistryEntry(artifact, own);
        lock.writeLock().lock();
        try {
            if (entries.containsKey(own.getVersion())) {
                throw new DuplicateVersionException("model version " + own.getVersion() + " is already registered");
            }
            persist(entry);
            entries.put(own.getVersion(), entry);
            logger.info("registered model {} ({}) with threshold {}", own.getVersion(),
                    own.getAlgorithm().getDisplayName(), own.getThreshold());
            return entry.snapshot();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @throws ModelNotFoundException if the version is not registered
     */
    public RegistryEntry get(String version) {
        checkNotNull(version, "version must not be null");
        lock.readLock().lock();
        try {
            return getOrThrow(version).snapshot();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @throws NoActiveModelException if no entry is active
     */
    public RegistryEntry getActive() {
        return findActive().orElseThrow(() -> new NoActiveModelException("no model is active"));
    }

    /**
     * @throws NoProductionModelException if no entry is in production
     */
    public RegistryEntry getProduction() {
        return findProduction().orElseThrow(() -> new NoProductionModelException("no model is in production"));
    }

    public Optional<RegistryEntry> findActive() {
        lock.readLock().lock();
        try {
            return entries.values().stream().filter(e -> e.getMetadata().isActive()).findFirst()
                    .map(RegistryEntry::snapshot);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<RegistryEntry> findProduction() {
        lock.readLock().lock();
        try {
            return entries.values().stream().filter(e -> e.getMetadata().isProduction()).findFirst()
                    .map(RegistryEntry::snapshot);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Makes a version active, and when {@code toProduction} is set, also the
     * production version. The flags of the previous holders are cleared in the
     * same critical section. Promoting to active only leaves the production
     * flag where it is, so the production version may then be inactive.
     *
     * @param version      the version to promote
     * @param toProduction whether to also move the production flag
     * @throws ModelNotFoundException       if the version is not registered
     * @throws RegistryPersistenceException if the store rejects the change, in
     *                                      which case no flag changes
     */
    public void promote(String version, boolean toProduction) {
        checkNotNull(version, "version must not be null");
        lock.writeLock().lock();
        try {
            RegistryEntry target = getOrThrow(version);
            Map<RegistryEntry, boolean[]> previous = new IdentityHashMap<>();
            for (RegistryEntry entry : entries.values()) {
                ModelMetadata metadata = entry.getMetadata();
                boolean active = entry == target;
                boolean production = toProduction ? entry == target : metadata.isProduction();
                if (metadata.isActive() != active || metadata.isProduction() != production) {
                    previous.put(entry, new boolean[] { metadata.isActive(), metadata.isProduction() });
                    metadata.setActive(active);
                    metadata.setProduction(production);
                }
            }

            List<RegistryEntry> saved = new ArrayList<>();
            try {
                for (RegistryEntry entry : previous.keySet()) {
                    persist(entry);
                    saved.add(entry);
                }
            } catch (RuntimeException e) {
                rollback(previous, saved, e);
                throw e;
            }
            logger.info("promoted model {} to {}", version, toProduction ? "production" : "active");
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return snapshots of every entry's metadata, oldest first, ties broken by
     *         version
     */
    public List<ModelMetadata> listModels() {
        lock.readLock().lock();
        try {
            List<ModelMetadata> result = new ArrayList<>(entries.size());
            for (RegistryEntry entry : entries.values()) {
                result.add(entry.getMetadata().copy());
            }
            result.sort(CREATION_ORDER);
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String version) {
        lock.readLock().lock();
        try {
            return entries.containsKey(version);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private RegistryEntry getOrThrow(String version) {
        RegistryEntry entry = entries.get(version);
        if (entry == null) {
            throw new ModelNotFoundException("model version " + version + " is not registered");
        }
        return entry;
    }

    private void persist(RegistryEntry entry) {
        try {
            store.save(entry.snapshot());
        } catch (IOException e) {
            throw new RegistryPersistenceException("failed to save model " + entry.getVersion(), e);
        }
    }

    private void rollback(Map<RegistryEntry, boolean[]> previous, List<RegistryEntry> saved, RuntimeException cause) {
        for (Map.Entry<RegistryEntry, boolean[]> change : previous.entrySet()) {
            change.getKey().getMetadata().setActive(change.getValue()[0]);
            change.getKey().getMetadata().setProduction(change.getValue()[1]);
        }
        logger.warn("promotion rolled back after the store failed", cause);
        for (RegistryEntry entry : saved) {
            try {
                persist(entry);
            } catch (RuntimeException e) {
                cause.addSuppressed(e);
                logger.error("store still holds the promoted flags of model {}", entry.getVersion(), e);
            }
        }
    }
}
