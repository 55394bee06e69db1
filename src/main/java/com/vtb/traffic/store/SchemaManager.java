package com.vtb.traffic.store;

import com.vtb.traffic.errors.StoreCorruptedException;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Создание и проверка схемы SQLite.
 * Миграции версионированы и идемпотентны; несовпадение схемы при старте фатально.
 */
@Slf4j
class SchemaManager {

    static final String TABLE = "transactions";
    static final int CURRENT_SCHEMA_VERSION = 1;

    static final List<String> COLUMNS = List.of(
        "id", "timestamp", "method", "url", "host", "path", "protocol",
        "request_headers", "request_body", "request_body_truncated",
        "response_status", "response_headers", "response_body", "response_body_truncated",
        "duration", "analyzed", "notes");

    @FunctionalInterface
    private interface MigrationTask {
        void execute(Connection connection) throws SQLException;
    }

    private final Map<Integer, MigrationTask> migrations = new TreeMap<>();

    SchemaManager() {
        migrations.put(1, this::applyMigrationV1);
    }

    /**
     * Создать недостающие таблицы, применить миграции и проверить целостность
     */
    void initializeSchema(Connection connection) throws SQLException {
        log.debug("Инициализация схемы (целевая версия {})", CURRENT_SCHEMA_VERSION);
        createSchemaVersionTable(connection);

        int currentVersion = getCurrentSchemaVersion(connection);
        if (currentVersion > CURRENT_SCHEMA_VERSION) {
            throw new StoreCorruptedException(
                "Версия схемы " + currentVersion + " новее поддерживаемой " + CURRENT_SCHEMA_VERSION, null);
        }
        if (currentVersion < CURRENT_SCHEMA_VERSION) {
            log.info("Обновление схемы хранилища: {} -> {}", currentVersion, CURRENT_SCHEMA_VERSION);
            applyMigrations(connection, currentVersion);
        }
        verifySchemaIntegrity(connection);
    }

    private void createSchemaVersionTable(Connection connection) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("CREATE TABLE IF NOT EXISTS schema_version (" +
                "version INTEGER PRIMARY KEY, " +
                "applied_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP, " +
                "description TEXT)");
        }
    }

    private int getCurrentSchemaVersion(Connection connection) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement("SELECT MAX(version) AS version FROM schema_version");
             ResultSet rs = stmt.executeQuery()) {
            if (rs.next()) {
                int version = rs.getInt("version");
                return rs.wasNull() ? 0 : version;
            }
        }
        return 0;
    }

    private void applyMigrations(Connection connection, int fromVersion) throws SQLException {
        boolean originalAutoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try {
            for (int version = fromVersion + 1; version <= CURRENT_SCHEMA_VERSION; version++) {
                MigrationTask task = migrations.get(version);
                if (task == null) {
                    throw new SQLException("Миграция v" + version + " не зарегистрирована");
                }
                task.execute(connection);
                try (PreparedStatement stmt = connection.prepareStatement(
                    "INSERT INTO schema_version (version, description) VALUES (?, ?)")) {
                    stmt.setInt(1, version);
                    stmt.setString(2, "migration v" + version);
                    stmt.executeUpdate();
                }
            }
            connection.commit();
        } catch (SQLException e) {
            connection.rollback();
            throw e;
        } finally {
            connection.setAutoCommit(originalAutoCommit);
        }
    }

    private void applyMigrationV1(Connection connection) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("CREATE TABLE IF NOT EXISTS " + TABLE + " (" +
                "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                "timestamp REAL NOT NULL, " +
                "method TEXT NOT NULL, " +
                "url TEXT NOT NULL, " +
                "host TEXT NOT NULL, " +
                "path TEXT, " +
                "protocol TEXT NOT NULL, " +
                "request_headers TEXT, " +
                "request_body TEXT, " +
                "request_body_truncated INTEGER NOT NULL DEFAULT 0, " +
                "response_status INTEGER, " +
                "response_headers TEXT, " +
                "response_body TEXT, " +
                "response_body_truncated INTEGER NOT NULL DEFAULT 0, " +
                "duration REAL NOT NULL DEFAULT 0, " +
                "analyzed INTEGER NOT NULL DEFAULT 0, " +
                "notes TEXT)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_transactions_host ON " + TABLE + "(host)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_transactions_method ON " + TABLE + "(method)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_transactions_status ON " + TABLE + "(response_status)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_transactions_timestamp ON " + TABLE + "(timestamp)");
        }
    }

    /**
     * Проверить, что файл читается и таблица содержит все ожидаемые колонки
     */
    private void verifySchemaIntegrity(Connection connection) throws SQLException {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("PRAGMA quick_check")) {
            String result = rs.next() ? rs.getString(1) : null;
            if (!"ok".equalsIgnoreCase(result)) {
                throw new StoreCorruptedException("Проверка целостности SQLite не пройдена: " + result, null);
            }
        }

        Set<String> actual = new LinkedHashSet<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("PRAGMA table_info(" + TABLE + ")")) {
            while (rs.next()) {
                actual.add(rs.getString("name"));
            }
        }
        for (String column : COLUMNS) {
            if (!actual.contains(column)) {
                throw new StoreCorruptedException(
                    "В таблице " + TABLE + " отсутствует колонка " + column, null);
            }
        }
    }
}
