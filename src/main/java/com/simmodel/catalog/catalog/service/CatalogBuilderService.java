package com.simmodel.catalog.catalog.service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.simmodel.catalog.catalog.language.LanguageMatcher;
import com.simmodel.catalog.catalog.model.LanguageMeta;
import com.simmodel.catalog.catalog.model.ModelDicRow;
import com.simmodel.catalog.catalog.model.RegistryEntry;
import com.simmodel.catalog.catalog.store.ProbedStore;
import com.simmodel.catalog.catalog.store.StoreException;
import com.simmodel.catalog.catalog.store.StoreHandle;

import lombok.RequiredArgsConstructor;

/**
 * Builds a deduplicated list of registry entries from store files.
 *
 * Rules:
 * - stores are probed in the given order (sorted by path), unusable stores are skipped;
 * - a model whose digest is already accepted is skipped, first found wins;
 * - all entries from one store share one store handle;
 * - a store which contributes no entry is closed immediately;
 * - a store whose content fails while building its entries is closed and skipped.
 *
 * Does not touch the live catalog.
 */
@RequiredArgsConstructor
public class CatalogBuilderService {

    private static final Logger log = LoggerFactory.getLogger(CatalogBuilderService.class);

    private final StoreProbeService probeService;

    public CatalogBuildResult build(List<Path> storePaths, String logDir, boolean logEnabled) {
        Objects.requireNonNull(storePaths, "storePaths");

        List<RegistryEntry> entries = new ArrayList<>();
        Set<String> digests = new HashSet<>();
        int skippedStores = 0;
        int skippedModels = 0;

        try {
            for (Path path : storePaths) {

                Optional<ProbedStore> probed = probeService.probe(path);
                if (probed.isEmpty()) {
                    skippedStores++;
                    continue;
                }
                ProbedStore store = probed.get();

                List<RegistryEntry> storeEntries = new ArrayList<>();
                Set<String> storeDigests = new HashSet<>();
                int storeDuplicates = 0;
                try {
                    String binDir = binDirOf(path);

                    for (ModelDicRow row : store.getModels()) {

                        if (digests.contains(row.getDigest()) || !storeDigests.add(row.getDigest())) {
                            log.warn("Skip: model already exist in other database: {} {}", row.getName(), row.getDigest());
                            storeDuplicates++;
                            continue;
                        }

                        List<String> codes = languageCodes(store.getLanguages(), row.getDefaultLangCode());

                        storeEntries.add(RegistryEntry.builder()
                                .model(row)
                                .store(store.getHandle())
                                .binDir(binDir)
                                .logDir(logDir)
                                .logEnabled(logEnabled)
                                .languageCodes(codes)
                                .languageMeta(store.getLanguages())
                                .languageMatcher(new LanguageMatcher(codes))
                                .metaFull(false)
                                .build());
                    }
                } catch (RuntimeException e) {
                    log.error("Error: invalid model store content, skipped: {} : {}", path, e.toString());
                    releaseQuietly(store.getHandle());
                    skippedStores++;
                    continue;
                }

                skippedModels += storeDuplicates;
                if (storeEntries.isEmpty()) {
                    log.info("All models of {} already exist in other databases, closing it", path);
                    releaseQuietly(store.getHandle());
                    continue;
                }
                digests.addAll(storeDigests);
                entries.addAll(storeEntries);
            }
        } catch (RuntimeException e) {
            log.error("Error: model catalog build failed, closing {} opened model(s)", entries.size());
            for (RegistryEntry entry : entries) {
                releaseQuietly(entry.getStore());
            }
            throw e;
        }

        return CatalogBuildResult.builder()
                .entries(entries)
                .storesFound(storePaths.size())
                .storesSkipped(skippedStores)
                .duplicatesSkipped(skippedModels)
                .build();
    }

    private static void releaseQuietly(StoreHandle handle) {
        try {
            handle.release();
        } catch (StoreException e) {
            log.error("Close db connection error: {} : {}", handle.getPath(), e.getMessage());
        }
    }

    /**
     * Store language codes with the default language moved to the front, others in store order.
     */
    static List<String> languageCodes(LanguageMeta languages, String defaultLangCode) {
        List<String> codes = new ArrayList<>(languages.getLanguages().size());
        List<String> storeCodes = languages.getCodes();

        if (defaultLangCode != null && storeCodes.contains(defaultLangCode)) {
            codes.add(defaultLangCode);
        }
        for (String code : storeCodes) {
            if (!Objects.equals(code, defaultLangCode)) {
                codes.add(code);
            }
        }
        return List.copyOf(codes);
    }

    private static String binDirOf(Path storePath) {
        Path parent = storePath.getParent();
        return parent != null ? parent.toString() : "";
    }
}
