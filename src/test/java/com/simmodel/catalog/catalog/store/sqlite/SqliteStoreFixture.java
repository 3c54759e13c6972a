package com.simmodel.catalog.catalog.store.sqlite;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Creates minimal model store databases for tests.
 */
public class SqliteStoreFixture {

    private final Path path;
    private int schemaVersion = 1;
    private boolean withWords = true;
    private final List<String[]> languages = new ArrayList<>();
    private final List<String[]> models = new ArrayList<>();

    private SqliteStoreFixture(Path path) {
        this.path = path;
    }

    public static SqliteStoreFixture at(Path path) {
        return new SqliteStoreFixture(path);
    }

    public SqliteStoreFixture schemaVersion(int version) {
        this.schemaVersion = version;
        return this;
    }

    public SqliteStoreFixture withoutWords() {
        this.withWords = false;
        return this;
    }

    public SqliteStoreFixture language(String code, String name) {
        languages.add(new String[] { code, name });
        return this;
    }

    public SqliteStoreFixture model(String name, String digest, String defaultLangCode) {
        models.add(new String[] { name, digest, defaultLangCode });
        return this;
    }

    public Path create() throws IOException, SQLException {
        Files.createDirectories(path.toAbsolutePath().getParent());

        try (Connection c = DriverManager.getConnection("jdbc:sqlite:" + path.toAbsolutePath());
             Statement st = c.createStatement()) {

            st.executeUpdate("CREATE TABLE id_lst (id_key VARCHAR(32) NOT NULL PRIMARY KEY, id_value INT NOT NULL)");
            boolean nullCodes = languages.stream().anyMatch(l -> l[0] == null);
            st.executeUpdate("CREATE TABLE lang_lst (lang_id INT NOT NULL PRIMARY KEY, lang_code VARCHAR(32)"
                    + (nullCodes ? "" : " NOT NULL") + ", lang_name VARCHAR(255) NOT NULL)");
            st.executeUpdate("CREATE TABLE model_dic (model_id INT NOT NULL PRIMARY KEY, model_name VARCHAR(255) NOT NULL,"
                    + " model_digest VARCHAR(32) NOT NULL, model_type INT NOT NULL, model_ver VARCHAR(32) NOT NULL,"
                    + " create_dt VARCHAR(32) NOT NULL, default_lang_id INT NOT NULL)");
            if (withWords) {
                st.executeUpdate("CREATE TABLE lang_word (lang_id INT NOT NULL, word_code VARCHAR(255) NOT NULL, word_value VARCHAR(255) NOT NULL)");
            }

            st.executeUpdate("INSERT INTO id_lst (id_key, id_value) VALUES ('openmpp', " + schemaVersion + ")");

            try (PreparedStatement ps = c.prepareStatement("INSERT INTO lang_lst (lang_id, lang_code, lang_name) VALUES (?, ?, ?)")) {
                for (int k = 0; k < languages.size(); k++) {
                    ps.setInt(1, k);
                    ps.setString(2, languages.get(k)[0]);
                    ps.setString(3, languages.get(k)[1]);
                    ps.executeUpdate();
                }
            }
            if (withWords) {
                try (PreparedStatement ps = c.prepareStatement("INSERT INTO lang_word (lang_id, word_code, word_value) VALUES (?, ?, ?)")) {
                    for (int k = 0; k < languages.size(); k++) {
                        ps.setInt(1, k);
                        ps.setString(2, "Model");
                        ps.setString(3, "Model-" + languages.get(k)[0]);
                        ps.executeUpdate();
                    }
                }
            }

            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO model_dic (model_id, model_name, model_digest, model_type, model_ver, create_dt, default_lang_id)"
                            + " VALUES (?, ?, ?, 0, '1.0.0.0', '2024-01-15 10:20:30.000', ?)")) {
                for (int k = 0; k < models.size(); k++) {
                    ps.setInt(1, k + 1);
                    ps.setString(2, models.get(k)[0]);
                    ps.setString(3, models.get(k)[1]);
                    ps.setInt(4, langIdOf(models.get(k)[2]));
                    ps.executeUpdate();
                }
            }
        }
        return path;
    }

    private int langIdOf(String code) {
        for (int k = 0; k < languages.size(); k++) {
            if (Objects.equals(languages.get(k)[0], code)) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown language: " + code);
    }
}
