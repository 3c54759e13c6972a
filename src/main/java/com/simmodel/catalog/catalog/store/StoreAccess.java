package com.simmodel.catalog.catalog.store;

import java.nio.file.Path;
import java.util.List;

import com.simmodel.catalog.catalog.model.LanguageMeta;
import com.simmodel.catalog.catalog.model.ModelDicRow;

/**
 * Access to model store files. The catalog only consumes these typed results or failures.
 */
public interface StoreAccess {

    /**
     * Open a connection to the store file at {@code path}.
     */
    StoreConnection openStore(Path path) throws StoreException;

    /**
     * @return true if the store schema version is supported
     */
    boolean checkCompatibility(StoreConnection connection) throws StoreException;

    /**
     * List models found in the store, in store order.
     */
    List<ModelDicRow> listModels(StoreConnection connection) throws StoreException;

    /**
     * Read all languages of the store with their words.
     */
    LanguageMeta listLanguages(StoreConnection connection) throws StoreException;
}
