package com.hybridorm.repositories.rdbms;

import com.hybridorm.core.LocalStore;
import com.hybridorm.core.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static com.hybridorm.repositories.rdbms.Converters.bind;
import static com.hybridorm.repositories.rdbms.Converters.resultSetToRows;

/**
 * {@link LocalStore} over a single shared JDBC connection.
 * <p>
 * Dialects supply column introspection and last-insert-id lookup. Column lists are cached
 * per table until {@link #clearSchemaCache()}; a table that does not exist yet is not cached.
 * <p>
 * Statements are serialized on the store, so the id and row count returned by
 * {@link #executeInsert} and {@link #executeUpdate} always belong to that statement.
 */
public abstract class JdbcLocalStore implements LocalStore, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(JdbcLocalStore.class);

    protected final Connection connection;
    private final SqlGrammar grammar;
    private final Map<String, List<String>> schemaCache = new ConcurrentHashMap<>();
    private volatile int affectedRows = 0;
    private boolean inTransaction = false;

    protected JdbcLocalStore(Connection connection) {
        this(connection, SqlGrammar.DEFAULT);
    }

    protected JdbcLocalStore(Connection connection, SqlGrammar grammar) {
        this.connection = connection;
        this.grammar = grammar;
    }

    /**
     * Reads the column names of {@code table} from the database catalogue.
     */
    protected abstract List<String> loadColumns(String table) throws SQLException;

    /**
     * Returns the id generated by the last insert on {@link #connection}.
     */
    protected abstract long queryLastInsertId() throws SQLException;

    /**
     * A fresh query builder against {@code table} on this store.
     */
    public QueryBuilder table(String table) {
        return new QueryBuilder(this, table, grammar);
    }

    @Override
    public synchronized List<Map<String, Object>> select(String sql, List<?> params) {
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            bind(stmt, params);
            try (ResultSet rs = stmt.executeQuery()) {
                return resultSetToRows(rs);
            }
        } catch (SQLException e) {
            logger.error("Error executing query {}: {}", sql, e.getMessage());
            throw new StoreException("Error executing query: " + sql, e);
        }
    }

    @Override
    public void execute(String sql, List<?> params) {
        executeUpdate(sql, params);
    }

    @Override
    public synchronized int executeUpdate(String sql, List<?> params) {
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            bind(stmt, params);
            stmt.execute();
            int count = Math.max(stmt.getUpdateCount(), 0);
            affectedRows = count;
            return count;
        } catch (SQLException e) {
            logger.error("Error executing statement {}: {}", sql, e.getMessage());
            throw new StoreException("Error executing statement: " + sql, e);
        }
    }

    @Override
    public synchronized long executeInsert(String sql, List<?> params) {
        executeUpdate(sql, params);
        return lastInsertId();
    }

    @Override
    public synchronized long lastInsertId() {
        try {
            return queryLastInsertId();
        } catch (SQLException e) {
            throw new StoreException("Could not read last insert id", e);
        }
    }

    @Override
    public int affectedRows() {
        return affectedRows;
    }

    @Override
    public List<String> getColumns(String table) {
        List<String> cached = schemaCache.get(table);
        if (cached != null) {
            return cached;
        }
        try {
            List<String> columns;
            synchronized (this) {
                columns = List.copyOf(loadColumns(table));
            }
            if (!columns.isEmpty()) {
                schemaCache.put(table, columns);
            }
            return columns;
        } catch (SQLException e) {
            throw new StoreException("Could not read columns of " + table, e);
        }
    }

    public void clearSchemaCache() {
        schemaCache.clear();
        logger.info("Cleared schema cache");
    }

    public void clearSchemaCache(String table) {
        schemaCache.remove(table);
        logger.info("Cleared schema cache for {}", table);
    }

    @Override
    public synchronized void beginTransaction() {
        if (inTransaction) {
            throw new IllegalStateException("A transaction is already active");
        }
        try {
            connection.setAutoCommit(false);
            inTransaction = true;
        } catch (SQLException e) {
            throw new StoreException("Could not begin transaction", e);
        }
    }

    @Override
    public synchronized void commit() {
        requireTransaction();
        try {
            connection.commit();
        } catch (SQLException e) {
            throw new StoreException("Could not commit transaction", e);
        } finally {
            endTransaction();
        }
    }

    @Override
    public synchronized void rollback() {
        requireTransaction();
        try {
            connection.rollback();
        } catch (SQLException e) {
            throw new StoreException("Could not roll back transaction", e);
        } finally {
            endTransaction();
        }
    }

    public synchronized boolean inTransaction() {
        return inTransaction;
    }

    private void requireTransaction() {
        if (!inTransaction) {
            throw new IllegalStateException("No active transaction");
        }
    }

    private void endTransaction() {
        inTransaction = false;
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            logger.error("Failed to restore auto-commit", e);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new StoreException("Could not close connection", e);
        }
    }
}
