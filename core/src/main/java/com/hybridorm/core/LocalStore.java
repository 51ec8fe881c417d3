package com.hybridorm.core;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * An embedded relational store reached through parameterized SQL.
 * <p>
 * Rows come back as column-keyed maps carrying the driver's native types; no casting is
 * performed at this level. Every method may throw {@link StoreException}.
 * <p>
 * Transactions belong to the store, not to a thread: statements other threads run while a
 * transaction is open take part in it.
 */
public interface LocalStore {
    List<Map<String, Object>> select(String sql, List<?> params);

    void execute(String sql, List<?> params);

    /**
     * Runs a data-changing statement.
     *
     * @return rows changed by this statement
     */
    int executeUpdate(String sql, List<?> params);

    /**
     * Runs an insert and reads the identifier it generated before any other statement
     * can run on this store.
     *
     * @return the generated identifier
     */
    long executeInsert(String sql, List<?> params);

    /**
     * Identifier generated by the most recent insert on this store's connection. Another
     * thread's insert may already have replaced it; use {@link #executeInsert} when the
     * store is shared.
     */
    long lastInsertId();

    /**
     * Rows changed by the most recent statement on this store. Shared the same way as
     * {@link #lastInsertId()}.
     */
    int affectedRows();

    /**
     * Column names of {@code table}, empty when the table does not exist.
     */
    List<String> getColumns(String table);

    default boolean hasColumn(String table, String column) {
        return getColumns(table).contains(column);
    }

    void beginTransaction();

    void commit();

    void rollback();

    /**
     * Runs {@code work} inside a transaction, committing on return and rolling back on any
     * runtime exception, which is rethrown.
     */
    default <T> T transaction(Function<LocalStore, T> work) {
        beginTransaction();
        T result;
        try {
            result = work.apply(this);
        } catch (RuntimeException e) {
            rollback();
            throw e;
        }
        commit();
        return result;
    }
}
