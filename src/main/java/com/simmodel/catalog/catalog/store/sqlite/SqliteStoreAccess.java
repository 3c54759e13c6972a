package com.simmodel.catalog.catalog.store.sqlite;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import com.simmodel.catalog.catalog.model.LanguageMeta;
import com.simmodel.catalog.catalog.model.LanguageRow;
import com.simmodel.catalog.catalog.model.ModelDicRow;
import com.simmodel.catalog.catalog.store.StoreAccess;
import com.simmodel.catalog.catalog.store.StoreConnection;
import com.simmodel.catalog.catalog.store.StoreException;

/**
 * Reads model stores from SQLite database files over JDBC.
 *
 * Expected tables:
 * - id_lst (id_key, id_value): row 'openmpp' holds the schema version
 * - lang_lst (lang_id, lang_code, lang_name)
 * - lang_word (lang_id, word_code, word_value), optional
 * - model_dic (model_id, model_name, model_digest, model_type, model_ver, create_dt, default_lang_id)
 */
public class SqliteStoreAccess implements StoreAccess {

    private static final Logger log = LoggerFactory.getLogger(SqliteStoreAccess.class);

    static final String SCHEMA_VERSION_KEY = "openmpp";

    private static final String SQL_SCHEMA_VERSION =
            "SELECT id_value FROM id_lst WHERE id_key = ?";

    private static final String SQL_MODEL_LIST =
            "SELECT M.model_id, M.model_name, M.model_digest, M.model_type, M.model_ver, M.create_dt, L.lang_code"
                    + " FROM model_dic M"
                    + " INNER JOIN lang_lst L ON (L.lang_id = M.default_lang_id)"
                    + " ORDER BY 1";

    private static final String SQL_LANG_LIST =
            "SELECT lang_id, lang_code, lang_name FROM lang_lst ORDER BY 1";

    private static final String SQL_LANG_WORD =
            "SELECT lang_id, word_code, word_value FROM lang_word ORDER BY 1, 2";

    private final int minSchemaVersion;
    private final int busyTimeoutMs;

    public SqliteStoreAccess(int minSchemaVersion) {
        this(minSchemaVersion, 86_400_000);
    }

    public SqliteStoreAccess(int minSchemaVersion, int busyTimeoutMs) {
        this.minSchemaVersion = minSchemaVersion;
        this.busyTimeoutMs = busyTimeoutMs;
    }

    @Override
    public StoreConnection openStore(Path path) throws StoreException {
        SQLiteConfig cfg = new SQLiteConfig();
        cfg.setReadOnly(true);
        cfg.setBusyTimeout(busyTimeoutMs);

        String url = "jdbc:sqlite:" + path.toAbsolutePath();
        try {
            Connection conn = DriverManager.getConnection(url, cfg.toProperties());
            log.debug("Opened model store: {}", path);
            return new SqliteStoreConnection(path, conn);
        } catch (SQLException e) {
            throw new StoreException(path, "Failed to open model store: " + path + " : " + e.getMessage(), e);
        }
    }

    @Override
    public boolean checkCompatibility(StoreConnection connection) throws StoreException {
        SqliteStoreConnection sc = unwrap(connection);
        try (PreparedStatement ps = sc.jdbc().prepareStatement(SQL_SCHEMA_VERSION)) {
            ps.setString(1, SCHEMA_VERSION_KEY);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    log.debug("Schema version not found in: {}", sc.getPath());
                    return false;
                }
                int version = rs.getInt(1);
                if (rs.wasNull()) {
                    return false;
                }
                return version >= minSchemaVersion;
            }
        } catch (SQLException e) {
            throw new StoreException(sc.getPath(),
                    "Invalid database, likely not a model store: " + sc.getPath() + " : " + e.getMessage(), e);
        }
    }

    @Override
    public List<ModelDicRow> listModels(StoreConnection connection) throws StoreException {
        SqliteStoreConnection sc = unwrap(connection);
        List<ModelDicRow> rows = new ArrayList<>();
        try (Statement st = sc.jdbc().createStatement();
             ResultSet rs = st.executeQuery(SQL_MODEL_LIST)) {
            while (rs.next()) {
                rows.add(ModelDicRow.builder()
                        .modelId(rs.getInt(1))
                        .name(rs.getString(2))
                        .digest(rs.getString(3))
                        .type(rs.getInt(4))
                        .version(rs.getString(5))
                        .createDateTime(rs.getString(6))
                        .defaultLangCode(rs.getString(7))
                        .build());
            }
        } catch (SQLException e) {
            throw new StoreException(sc.getPath(), "Failed to read model list: " + sc.getPath() + " : " + e.getMessage(), e);
        }
        return rows;
    }

    @Override
    public LanguageMeta listLanguages(StoreConnection connection) throws StoreException {
        SqliteStoreConnection sc = unwrap(connection);

        Map<Integer, LanguageRow.LanguageRowBuilder> byId = new LinkedHashMap<>();
        try (Statement st = sc.jdbc().createStatement();
             ResultSet rs = st.executeQuery(SQL_LANG_LIST)) {
            while (rs.next()) {
                int langId = rs.getInt(1);
                String langCode = rs.getString(2);
                if (langCode == null || langCode.isBlank()) {
                    throw new StoreException(sc.getPath(), "Invalid empty language code, lang_id: " + langId + " : " + sc.getPath());
                }
                byId.put(langId, LanguageRow.builder()
                        .langId(langId)
                        .langCode(langCode)
                        .name(rs.getString(3)));
            }
        } catch (SQLException e) {
            throw new StoreException(sc.getPath(), "Failed to read languages: " + sc.getPath() + " : " + e.getMessage(), e);
        }

        if (byId.isEmpty()) {
            throw new StoreException(sc.getPath(), "No languages found in model store: " + sc.getPath());
        }

        if (hasTable(sc, "lang_word")) {
            try (Statement st = sc.jdbc().createStatement();
                 ResultSet rs = st.executeQuery(SQL_LANG_WORD)) {
                while (rs.next()) {
                    LanguageRow.LanguageRowBuilder b = byId.get(rs.getInt(1));
                    if (b != null) {
                        b.word(rs.getString(2), rs.getString(3));
                    }
                }
            } catch (SQLException e) {
                throw new StoreException(sc.getPath(), "Failed to read language words: " + sc.getPath() + " : " + e.getMessage(), e);
            }
        }

        LanguageMeta.LanguageMetaBuilder meta = LanguageMeta.builder();
        byId.values().forEach(b -> meta.language(b.build()));
        return meta.build();
    }

    private static boolean hasTable(SqliteStoreConnection sc, String table) throws StoreException {
        try {
            DatabaseMetaData md = sc.jdbc().getMetaData();
            try (ResultSet rs = md.getTables(null, null, table, new String[] { "TABLE" })) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new StoreException(sc.getPath(), "Failed to read database metadata: " + sc.getPath(), e);
        }
    }

    private static SqliteStoreConnection unwrap(StoreConnection connection) {
        if (connection instanceof SqliteStoreConnection sc) {
            return sc;
        }
        throw new IllegalArgumentException("Not a SQLite model store connection: " + connection);
    }
}
