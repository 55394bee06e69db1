package com.vtb.traffic.store;

import com.vtb.traffic.config.TrafficConfig;
import com.vtb.traffic.errors.StoreCorruptedException;
import com.vtb.traffic.errors.StoreException;
import com.vtb.traffic.errors.TransactionNotFoundException;
import com.vtb.traffic.models.Transaction;
import com.vtb.traffic.models.TrafficStatistics;
import com.vtb.traffic.query.QueryCriteria;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Хранилище транзакций на SQLite.
 *
 * <p>Все записи идут через одно соединение под {@link ReentrantLock}. Каждое чтение
 * открывает собственное соединение; в режиме WAL оно видит последний зафиксированный
 * снимок и не ждет незавершенной записи.
 */
@Slf4j
public class SqliteTransactionStore implements TransactionStore {

    private static final String INSERT_SQL = "INSERT INTO " + SchemaManager.TABLE + " (" +
        "timestamp, method, url, host, path, protocol, request_headers, request_body, " +
        "request_body_truncated, response_status, response_headers, response_body, " +
        "response_body_truncated, duration, analyzed, notes) " +
        "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private final String jdbcUrl;
    private final int busyTimeoutMs;
    private final TransactionValidator validator;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Connection writer;

    public SqliteTransactionStore(TrafficConfig.Store settings) {
        this(Path.of(settings.getPath()), settings);
    }

    public SqliteTransactionStore(Path databasePath, TrafficConfig.Store settings) {
        settings.ensureDefaults();
        this.validator = new TransactionValidator(settings);
        this.busyTimeoutMs = settings.getBusyTimeoutMs();
        this.jdbcUrl = "jdbc:sqlite:" + databasePath.toAbsolutePath();

        Path parent = databasePath.toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            try {
                Files.createDirectories(parent);
                log.info("Создан каталог хранилища: {}", parent);
            } catch (IOException e) {
                throw new StoreException("Не удалось создать каталог " + parent + ": " + e.getMessage(), e);
            }
        }

        Connection connection;
        try {
            connection = DriverManager.getConnection(jdbcUrl);
        } catch (SQLException e) {
            throw new StoreException("Не удалось открыть хранилище " + databasePath + ": " + e.getMessage(), e);
        }
        try {
            configureConnection(connection, true);
            new SchemaManager().initializeSchema(connection);
        } catch (StoreCorruptedException e) {
            closeQuietly(connection);
            throw e;
        } catch (SQLException e) {
            closeQuietly(connection);
            throw new StoreCorruptedException(
                "Хранилище " + databasePath + " повреждено или не является базой SQLite: " + e.getMessage(), e);
        }
        this.writer = connection;
        log.debug("Хранилище открыто: {}", databasePath.toAbsolutePath());
    }

    private void configureConnection(Connection connection, boolean writerConnection) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("PRAGMA busy_timeout = " + busyTimeoutMs);
            if (writerConnection) {
                stmt.execute("PRAGMA journal_mode = WAL");
                stmt.execute("PRAGMA synchronous = NORMAL");
            }
        }
        ContainsTextFunction.register(connection);
    }

    @Override
    public long append(Transaction transaction) {
        Transaction normalized = validator.normalize(transaction);
        ensureOpen();
        writeLock.lock();
        try (PreparedStatement stmt = writer.prepareStatement(INSERT_SQL)) {
            stmt.setDouble(1, normalized.getTimestamp());
            stmt.setString(2, normalized.getMethod());
            stmt.setString(3, normalized.getUrl());
            stmt.setString(4, normalized.getHost());
            stmt.setString(5, normalized.getPath());
            stmt.setString(6, normalized.getProtocol());
            stmt.setString(7, HeaderCodec.encode(normalized.getRequestHeaders()));
            stmt.setString(8, normalized.getRequestBody());
            stmt.setInt(9, normalized.isRequestBodyTruncated() ? 1 : 0);
            if (normalized.getResponseStatus() != null) {
                stmt.setInt(10, normalized.getResponseStatus());
            } else {
                stmt.setNull(10, Types.INTEGER);
            }
            stmt.setString(11, HeaderCodec.encode(normalized.getResponseHeaders()));
            stmt.setString(12, normalized.getResponseBody());
            stmt.setInt(13, normalized.isResponseBodyTruncated() ? 1 : 0);
            stmt.setDouble(14, normalized.getDuration());
            stmt.setInt(15, normalized.isAnalyzed() ? 1 : 0);
            stmt.setString(16, normalized.getNotes());
            stmt.executeUpdate();

            long id = lastInsertRowId();
            log.debug("Сохранена транзакция {} {} {}", id, normalized.getMethod(), normalized.getUrl());
            return id;
        } catch (SQLException e) {
            throw new StoreException("Ошибка записи транзакции: " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    private long lastInsertRowId() throws SQLException {
        try (Statement stmt = writer.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT last_insert_rowid()")) {
            if (!rs.next()) {
                throw new SQLException("last_insert_rowid() не вернул значение");
            }
            return rs.getLong(1);
        }
    }

    @Override
    public Transaction get(long id) {
        String sql = "SELECT " + TransactionRowMapper.SELECT_COLUMNS + " FROM " + SchemaManager.TABLE + " WHERE id = ?";
        try (Connection connection = openReader();
             PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new TransactionNotFoundException(id);
                }
                return TransactionRowMapper.map(rs);
            }
        } catch (SQLException e) {
            throw new StoreException("Ошибка чтения транзакции " + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<Transaction> list(QueryCriteria criteria, int limit, int offset) {
        if (limit < 0 || offset < 0) {
            throw new IllegalArgumentException("limit и offset должны быть неотрицательными");
        }
        SqlWhereBuilder where = SqlWhereBuilder.from(criteria);
        String sql = "SELECT " + TransactionRowMapper.SELECT_COLUMNS + " FROM " + SchemaManager.TABLE +
            where.toSql() + " ORDER BY id DESC LIMIT ? OFFSET ?";
        List<Object> parameters = new ArrayList<>(where.getParameters());
        parameters.add(limit);
        parameters.add(offset);
        return queryTransactions(sql, parameters);
    }

    @Override
    public List<Transaction> listBefore(QueryCriteria criteria, long beforeId, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit должен быть неотрицательным");
        }
        SqlWhereBuilder where = SqlWhereBuilder.from(criteria).and("id < ?", beforeId);
        String sql = "SELECT " + TransactionRowMapper.SELECT_COLUMNS + " FROM " + SchemaManager.TABLE +
            where.toSql() + " ORDER BY id DESC LIMIT ?";
        List<Object> parameters = new ArrayList<>(where.getParameters());
        parameters.add(limit);
        return queryTransactions(sql, parameters);
    }

    private List<Transaction> queryTransactions(String sql, List<Object> parameters) {
        try (Connection connection = openReader();
             PreparedStatement stmt = connection.prepareStatement(sql)) {
            bind(stmt, parameters);
            List<Transaction> result = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(TransactionRowMapper.map(rs));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new StoreException("Ошибка выборки транзакций: " + e.getMessage(), e);
        }
    }

    @Override
    public long count(QueryCriteria criteria) {
        SqlWhereBuilder where = SqlWhereBuilder.from(criteria);
        String sql = "SELECT COUNT(*) FROM " + SchemaManager.TABLE + where.toSql();
        try (Connection connection = openReader();
             PreparedStatement stmt = connection.prepareStatement(sql)) {
            bind(stmt, where.getParameters());
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new StoreException("Ошибка подсчета транзакций: " + e.getMessage(), e);
        }
    }

    @Override
    public TrafficStatistics statistics(QueryCriteria criteria, double slowThresholdSec, int topHosts) {
        SqlWhereBuilder where = SqlWhereBuilder.from(criteria);
        String whereSql = where.toSql();
        List<Object> whereParams = where.getParameters();

        try (Connection connection = openReader()) {
            TrafficStatistics.TrafficStatisticsBuilder builder = TrafficStatistics.builder();

            String summarySql = "SELECT COUNT(*), COUNT(DISTINCT LOWER(host)), AVG(duration), MIN(duration), " +
                "MAX(duration), SUM(CASE WHEN duration > ? THEN 1 ELSE 0 END) FROM " + SchemaManager.TABLE + whereSql;
            try (PreparedStatement stmt = connection.prepareStatement(summarySql)) {
                List<Object> params = new ArrayList<>();
                params.add(slowThresholdSec);
                params.addAll(whereParams);
                bind(stmt, params);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (rs.next()) {
                        builder.totalRequests(rs.getLong(1))
                            .uniqueHosts(rs.getLong(2))
                            .avgDurationSec(rs.getDouble(3))
                            .minDurationSec(rs.getDouble(4))
                            .maxDurationSec(rs.getDouble(5))
                            .slowRequests(rs.getLong(6));
                    }
                }
            }

            Map<String, Long> methods = new LinkedHashMap<>();
            String methodSql = "SELECT UPPER(method) AS m, COUNT(*) AS c FROM " + SchemaManager.TABLE + whereSql +
                " GROUP BY m ORDER BY c DESC, m";
            try (PreparedStatement stmt = connection.prepareStatement(methodSql)) {
                bind(stmt, whereParams);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        methods.put(rs.getString("m"), rs.getLong("c"));
                    }
                }
            }
            builder.methods(methods);

            Map<Integer, Long> statusCodes = new LinkedHashMap<>();
            String statusSql = "SELECT response_status AS s, COUNT(*) AS c FROM " + SchemaManager.TABLE +
                appendCondition(whereSql, "response_status IS NOT NULL") + " GROUP BY s ORDER BY s";
            try (PreparedStatement stmt = connection.prepareStatement(statusSql)) {
                bind(stmt, whereParams);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        statusCodes.put(rs.getInt("s"), rs.getLong("c"));
                    }
                }
            }
            builder.statusCodes(statusCodes);

            Map<String, Long> hosts = new LinkedHashMap<>();
            String hostSql = "SELECT LOWER(host) AS h, COUNT(*) AS c FROM " + SchemaManager.TABLE + whereSql +
                " GROUP BY h ORDER BY c DESC, h LIMIT ?";
            try (PreparedStatement stmt = connection.prepareStatement(hostSql)) {
                List<Object> params = new ArrayList<>(whereParams);
                params.add(Math.max(0, topHosts));
                bind(stmt, params);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        hosts.put(rs.getString("h"), rs.getLong("c"));
                    }
                }
            }
            builder.topHosts(hosts);

            return builder.build();
        } catch (SQLException e) {
            throw new StoreException("Ошибка расчета статистики: " + e.getMessage(), e);
        }
    }

    private static String appendCondition(String whereSql, String condition) {
        return whereSql.isEmpty() ? " WHERE " + condition : whereSql + " AND " + condition;
    }

    @Override
    public void updateNotes(long id, String notes) {
        updateById(id, "UPDATE " + SchemaManager.TABLE + " SET notes = ? WHERE id = ?", stmt -> {
            stmt.setString(1, notes);
            stmt.setLong(2, id);
        });
    }

    @Override
    public void markAnalyzed(long id) {
        updateById(id, "UPDATE " + SchemaManager.TABLE + " SET analyzed = 1 WHERE id = ?",
            stmt -> stmt.setLong(1, id));
    }

    @FunctionalInterface
    private interface StatementBinder {
        void bind(PreparedStatement stmt) throws SQLException;
    }

    private void updateById(long id, String sql, StatementBinder binder) {
        ensureOpen();
        writeLock.lock();
        try (PreparedStatement stmt = writer.prepareStatement(sql)) {
            binder.bind(stmt);
            if (stmt.executeUpdate() == 0) {
                throw new TransactionNotFoundException(id);
            }
        } catch (SQLException e) {
            throw new StoreException("Ошибка обновления транзакции " + id + ": " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int clear() {
        ensureOpen();
        writeLock.lock();
        try {
            boolean originalAutoCommit = writer.getAutoCommit();
            writer.setAutoCommit(false);
            try (Statement stmt = writer.createStatement()) {
                int removed = stmt.executeUpdate("DELETE FROM " + SchemaManager.TABLE);
                writer.commit();
                log.info("Хранилище очищено, удалено транзакций: {}", removed);
                return removed;
            } catch (SQLException e) {
                writer.rollback();
                throw e;
            } finally {
                writer.setAutoCommit(originalAutoCommit);
            }
        } catch (SQLException e) {
            throw new StoreException("Ошибка очистки хранилища: " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    private Connection openReader() throws SQLException {
        ensureOpen();
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try {
            configureConnection(connection, false);
        } catch (SQLException e) {
            closeQuietly(connection);
            throw e;
        }
        return connection;
    }

    private static void bind(PreparedStatement stmt, List<Object> parameters) throws SQLException {
        for (int i = 0; i < parameters.size(); i++) {
            stmt.setObject(i + 1, parameters.get(i));
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new StoreException("Хранилище уже закрыто", null);
        }
    }

    private static void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.debug("Ошибка закрытия соединения: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        if (closed.getAndSet(true)) {
            return;
        }
        writeLock.lock();
        try {
            writer.close();
            log.debug("Хранилище закрыто");
        } catch (SQLException e) {
            log.warn("Ошибка закрытия хранилища: {}", e.getMessage());
        } finally {
            writeLock.unlock();
        }
    }
}
