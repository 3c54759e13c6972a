package com.simmodel.catalog.catalog;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.simmodel.catalog.catalog.config.CatalogConfig;
import com.simmodel.catalog.catalog.model.DirSetting;
import com.simmodel.catalog.catalog.model.ModelBasic;
import com.simmodel.catalog.catalog.model.ModelCatalogConfig;
import com.simmodel.catalog.catalog.model.ModelCatalogState;
import com.simmodel.catalog.catalog.model.RegistryEntry;
import com.simmodel.catalog.catalog.service.CatalogBuildResult;
import com.simmodel.catalog.catalog.service.CatalogBuilderService;
import com.simmodel.catalog.catalog.service.ModelStoreDiscoveryService;
import com.simmodel.catalog.catalog.service.StoreProbeService;
import com.simmodel.catalog.catalog.store.StoreAccess;
import com.simmodel.catalog.catalog.store.StoreException;
import com.simmodel.catalog.catalog.store.StoreHandle;
import com.simmodel.catalog.catalog.store.sqlite.SqliteStoreAccess;

/**
 * Catalog of models found in model store files under the model directory.
 *
 * All fields are guarded by one lock: directory settings and the model list are always
 * observed together. A refresh builds the new model list without the lock, swaps it in under
 * the lock and then closes the store connections of the previous list.
 *
 * Each store connection is closed exactly once: by the refresh that replaced it or by {@link #close()}.
 */
public class ModelCatalog {

    private static final Logger log = LoggerFactory.getLogger(ModelCatalog.class);

    private final ModelStoreDiscoveryService discoveryService;
    private final CatalogBuilderService builderService;

    private final ReentrantLock lock = new ReentrantLock();

    private String modelDir = "";
    private boolean modelDirEnabled;
    private String modelLogDir = "";
    private boolean logDirEnabled;
    private List<RegistryEntry> entries = List.of();

    public ModelCatalog(ModelStoreDiscoveryService discoveryService, CatalogBuilderService builderService) {
        this.discoveryService = Objects.requireNonNull(discoveryService, "discoveryService");
        this.builderService = Objects.requireNonNull(builderService, "builderService");
    }

    /**
     * Create catalog over the given store access.
     */
    public static ModelCatalog create(StoreAccess storeAccess, String storeExtension) {
        return new ModelCatalog(
                new ModelStoreDiscoveryService(storeExtension),
                new CatalogBuilderService(new StoreProbeService(storeAccess)));
    }

    /**
     * Create catalog reading SQLite model stores as configured.
     */
    public static ModelCatalog create(CatalogConfig config) {
        return create(new SqliteStoreAccess(config.getMinSchemaVersion()), config.getStoreExtension());
    }

    /**
     * Rescan model directory, open all model stores and replace the catalog content.
     *
     * If the same model (equal by digest) exists in multiple stores then only the first, by path, is used.
     * Connections to previous model stores are closed after the new list is installed.
     *
     * @param modelDir model directory, must exist
     * @param modelLogDir model log directory, optional: if empty or not exists then model log is disabled
     * @throws CatalogException if model directory does not exist, is not accessible or cannot be listed;
     *                          catalog is not changed in that case
     */
    public RefreshResult refresh(String modelDir, String modelLogDir) throws CatalogException {

        if (!isUsableDir(modelDir)) {
            throw new CatalogException("Error: model directory not exist or not accessible: " + modelDir);
        }
        String logDir = modelLogDir != null ? modelLogDir : "";
        boolean isLogDir = isUsableDir(logDir);
        if (!isLogDir && !logDir.isEmpty()) {
            log.warn("Model log directory not exist or not accessible, model log disabled: {}", logDir);
        }

        log.info("Refresh model catalog: {}", modelDir);

        List<Path> paths;
        try {
            paths = discoveryService.discoverStoreFiles(Path.of(modelDir));
        } catch (IOException e) {
            log.error("Error: fail to list model directory: {} : {}", modelDir, e.getMessage());
            throw new CatalogException("Error: fail to list model directory: " + modelDir, e);
        }

        CatalogBuildResult built = builderService.build(paths, logDir, isLogDir);

        List<RegistryEntry> previous;
        lock.lock();
        try {
            this.modelDir = modelDir;
            this.modelDirEnabled = true;
            this.modelLogDir = logDir;
            this.logDirEnabled = isLogDir;

            previous = entries;
            entries = List.copyOf(built.getEntries());
        } finally {
            lock.unlock();
        }

        Optional<StoreException> releaseError = release(previous);

        log.info("Model catalog refreshed: {} model(s) from {} store(s), {} store(s) skipped, {} duplicate(s) skipped",
                built.getEntries().size(), built.getStoresFound(), built.getStoresSkipped(), built.getDuplicatesSkipped());

        return RefreshResult.builder()
                .modelDir(modelDir)
                .modelLogDir(logDir)
                .logDirEnabled(isLogDir)
                .modelCount(built.getEntries().size())
                .storesFound(built.getStoresFound())
                .storesSkipped(built.getStoresSkipped())
                .duplicatesSkipped(built.getDuplicatesSkipped())
                .retiredModels(previous.size())
                .releaseError(releaseError.orElse(null))
                .build();
    }

    /**
     * Close all model store connections and clear the model list.
     *
     * @return first close error, if any; all connections are closed regardless
     */
    public Optional<StoreException> close() {
        lock.lock();
        try {
            Optional<StoreException> firstErr = release(entries);
            entries = List.of();
            return firstErr;
        } finally {
            lock.unlock();
        }
    }

    // close each distinct store of the retired entries, entries from the same store share one handle
    private static Optional<StoreException> release(List<RegistryEntry> retired) {
        Set<StoreHandle> stores = Collections.newSetFromMap(new IdentityHashMap<>());
        StoreException firstErr = null;

        for (RegistryEntry e : retired) {
            if (!stores.add(e.getStore())) {
                continue;
            }
            try {
                e.getStore().release();
            } catch (StoreException ex) {
                log.error("Error: close db connection error: {} : {}", e.getStore().getPath(), ex.getMessage());
                if (firstErr == null) {
                    firstErr = ex;
                }
            }
        }
        return Optional.ofNullable(firstErr);
    }

    public DirSetting getModelDir() {
        lock.lock();
        try {
            return new DirSetting(modelDir, modelDirEnabled);
        } finally {
            lock.unlock();
        }
    }

    public DirSetting getModelLogDir() {
        lock.lock();
        try {
            return new DirSetting(modelLogDir, logDirEnabled);
        } finally {
            lock.unlock();
        }
    }

    public ModelCatalogConfig toPublicConfig() {
        lock.lock();
        try {
            return ModelCatalogConfig.builder()
                    .modelDir(modelDir)
                    .modelLogDir(modelLogDir)
                    .logDirEnabled(logDirEnabled)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public ModelCatalogState toPublicState() {
        lock.lock();
        try {
            ModelCatalogState.ModelCatalogStateBuilder st = ModelCatalogState.builder()
                    .modelDir(modelDir)
                    .modelDirEnabled(modelDirEnabled)
                    .modelLogDir(modelLogDir)
                    .logDirEnabled(logDirEnabled);
            for (RegistryEntry e : entries) {
                st.digest(e.getDigest());
                st.model(e.toBasic());
            }
            return st.build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Index of model by digest in the current model list.
     * The index is only meaningful until the next refresh or close.
     */
    public OptionalInt indexByDigest(String digest) {
        lock.lock();
        try {
            return byDigest(digest).apply(entries);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Index of model by digest or, if there is no such digest, index of first model with that name.
     */
    public OptionalInt indexByDigestOrName(String digestOrName) {
        lock.lock();
        try {
            return byDigestOrName(digestOrName).apply(entries);
        } finally {
            lock.unlock();
        }
    }

    public List<String> allDigests() {
        lock.lock();
        try {
            List<String> ds = new ArrayList<>(entries.size());
            for (RegistryEntry e : entries) {
                ds.add(e.getDigest());
            }
            return ds;
        } finally {
            lock.unlock();
        }
    }

    public List<ModelBasic> allBasics() {
        lock.lock();
        try {
            List<ModelBasic> mbs = new ArrayList<>(entries.size());
            for (RegistryEntry e : entries) {
                mbs.add(e.toBasic());
            }
            return mbs;
        } finally {
            lock.unlock();
        }
    }

    public Optional<ModelBasic> modelBasicByDigest(String digest) {
        return withEntry(byDigest(digest), RegistryEntry::toBasic);
    }

    public Optional<ModelBasic> modelBasicByDigestOrName(String digestOrName) {
        return withEntry(byDigestOrName(digestOrName), RegistryEntry::toBasic);
    }

    /**
     * Model language codes, default language first.
     */
    public Optional<List<String>> languageCodes(String digestOrName) {
        return withEntry(byDigestOrName(digestOrName), RegistryEntry::getLanguageCodes);
    }

    /**
     * Best model language for the preferred language tags, default model language if none matches.
     */
    public Optional<String> matchLanguage(String digestOrName, List<String> preferred) {
        return withEntry(byDigestOrName(digestOrName), e -> e.getLanguageMatcher().match(preferred))
                .flatMap(m -> m);
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    // apply fn to the entry found by finder, both under one lock hold
    private <T> Optional<T> withEntry(Function<List<RegistryEntry>, OptionalInt> finder, Function<RegistryEntry, T> fn) {
        lock.lock();
        try {
            OptionalInt idx = finder.apply(entries);
            if (idx.isEmpty()) {
                return Optional.empty();
            }
            return Optional.ofNullable(fn.apply(entries.get(idx.getAsInt())));
        } finally {
            lock.unlock();
        }
    }

    private static Function<List<RegistryEntry>, OptionalInt> byDigest(String digest) {
        return lst -> {
            for (int k = 0; k < lst.size(); k++) {
                if (Objects.equals(lst.get(k).getDigest(), digest)) {
                    return OptionalInt.of(k);
                }
            }
            return OptionalInt.empty();
        };
    }

    // single pass: digest match wins over any name match, otherwise first name match
    private static Function<List<RegistryEntry>, OptionalInt> byDigestOrName(String digestOrName) {
        return lst -> {
            int n = -1;
            for (int k = 0; k < lst.size(); k++) {
                if (Objects.equals(lst.get(k).getDigest(), digestOrName)) {
                    return OptionalInt.of(k);
                }
                if (n < 0 && Objects.equals(lst.get(k).getName(), digestOrName)) {
                    n = k;
                }
            }
            return n >= 0 ? OptionalInt.of(n) : OptionalInt.empty();
        };
    }

    private static boolean isUsableDir(String dir) {
        if (dir == null || dir.isEmpty() || dir.equals(".")) {
            return false;
        }
        try {
            Path p = Path.of(dir);
            return Files.isDirectory(p) && Files.isReadable(p);
        } catch (InvalidPathException e) {
            log.warn("Invalid directory path: {} : {}", dir, e.getMessage());
            return false;
        }
    }
}
