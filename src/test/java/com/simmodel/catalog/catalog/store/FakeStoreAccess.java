package com.simmodel.catalog.catalog.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import com.simmodel.catalog.catalog.model.LanguageMeta;
import com.simmodel.catalog.catalog.model.LanguageRow;
import com.simmodel.catalog.catalog.model.ModelDicRow;

/**
 * In-memory store access for tests. Each store is registered by file path; the file itself is
 * created empty so directory discovery can find it.
 */
public class FakeStoreAccess implements StoreAccess {

    private final Map<Path, FakeStore> stores = new HashMap<>();
    private final List<FakeConnection> opened = new CopyOnWriteArrayList<>();

    public FakeStore store(Path path) throws IOException {
        Files.createDirectories(path.getParent());
        if (!Files.exists(path)) {
            Files.createFile(path);
        }
        FakeStore store = new FakeStore();
        stores.put(key(path), store);
        return store;
    }

    public List<FakeConnection> getOpened() {
        return opened;
    }

    public FakeConnection connectionOf(Path path) {
        Path k = key(path);
        FakeConnection found = null;
        for (FakeConnection c : opened) {
            if (key(c.getPath()).equals(k)) {
                found = c;
            }
        }
        return found;
    }

    @Override
    public StoreConnection openStore(Path path) throws StoreException {
        FakeStore store = stores.get(key(path));
        if (store == null || store.openFails) {
            throw new StoreException(path, "cannot open " + path);
        }
        if (store.openHook != null) {
            store.openHook.run();
        }
        FakeConnection conn = new FakeConnection(path, store);
        opened.add(conn);
        return conn;
    }

    @Override
    public boolean checkCompatibility(StoreConnection connection) throws StoreException {
        FakeStore store = ((FakeConnection) connection).store;
        if (store.corrupt) {
            throw new StoreException(connection.getPath(), "file is not a database");
        }
        return store.compatible;
    }

    @Override
    public List<ModelDicRow> listModels(StoreConnection connection) {
        return ((FakeConnection) connection).store.models;
    }

    @Override
    public LanguageMeta listLanguages(StoreConnection connection) throws StoreException {
        FakeStore store = ((FakeConnection) connection).store;
        if (store.languagesFail) {
            throw new StoreException(connection.getPath(), "no lang_lst table");
        }
        LanguageMeta.LanguageMetaBuilder b = LanguageMeta.builder();
        int id = 0;
        for (String code : store.languages) {
            b.language(LanguageRow.builder().langId(id++).langCode(code).name(code).build());
        }
        return b.build();
    }

    private static Path key(Path path) {
        return path.toAbsolutePath().normalize();
    }

    public static ModelDicRow row(String name, String digest, String defaultLang) {
        return ModelDicRow.builder()
                .modelId(1)
                .name(name)
                .digest(digest)
                .version("1.0")
                .defaultLangCode(defaultLang)
                .build();
    }

    /** Test definition of one store file. */
    public static class FakeStore {
        final List<ModelDicRow> models = new ArrayList<>();
        final List<String> languages = new ArrayList<>(List.of("EN"));
        boolean compatible = true;
        boolean corrupt;
        boolean openFails;
        boolean languagesFail;
        boolean closeFails;
        Runnable openHook;

        public FakeStore model(String name, String digest) {
            return model(name, digest, languages.isEmpty() ? null : languages.get(0));
        }

        public FakeStore model(String name, String digest, String defaultLang) {
            models.add(row(name, digest, defaultLang));
            return this;
        }

        public FakeStore unreadableRow() {
            models.add(null);
            return this;
        }

        public FakeStore languages(String... codes) {
            languages.clear();
            languages.addAll(Arrays.asList(codes));
            return this;
        }

        public FakeStore incompatible() {
            compatible = false;
            return this;
        }

        public FakeStore corrupt() {
            corrupt = true;
            return this;
        }

        public FakeStore openFails() {
            openFails = true;
            return this;
        }

        public FakeStore languagesFail() {
            languagesFail = true;
            return this;
        }

        public FakeStore closeFails() {
            closeFails = true;
            return this;
        }

        public FakeStore onOpen(Runnable hook) {
            openHook = hook;
            return this;
        }
    }

    /** Connection that counts close calls. */
    public static class FakeConnection implements StoreConnection {
        private final Path path;
        private final FakeStore store;
        private int closeCount;

        FakeConnection(Path path, FakeStore store) {
            this.path = path;
            this.store = store;
        }

        @Override
        public Path getPath() {
            return path;
        }

        public synchronized int getCloseCount() {
            return closeCount;
        }

        @Override
        public synchronized void close() throws StoreException {
            closeCount++;
            if (store.closeFails) {
                throw new StoreException(path, "close failed: " + path);
            }
        }
    }
}
