package com.hybridorm.repositories.rdbms;

import com.hybridorm.core.LocalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Fluent builder for one statement against one table.
 * <p>
 * Predicates are AND-combined in registration order. A builder is consumed by its first
 * terminal operation; any further call throws {@link IllegalStateException}. Rows are
 * returned with the driver's native types, no casting is applied here. Store failures
 * propagate as {@link com.hybridorm.core.StoreException}.
 *
 * <pre>{@code
 * List<Map<String, Object>> adults = new QueryBuilder(store, "users")
 *         .where("age", ">=", 18)
 *         .where("status", "active")
 *         .orderBy("id", "desc")
 *         .limit(10)
 *         .get();
 * }</pre>
 */
public class QueryBuilder {
    private static final Logger logger = LoggerFactory.getLogger(QueryBuilder.class);

    private final LocalStore store;
    private final String table;
    private final SqlGrammar grammar;

    private final List<String> columns = new ArrayList<>();
    private final List<WhereClause> wheres = new ArrayList<>();
    private final List<OrderClause> orders = new ArrayList<>();
    private Integer limit;
    private Integer offset;
    private boolean consumed = false;

    public QueryBuilder(LocalStore store, String table) {
        this(store, table, SqlGrammar.DEFAULT);
    }

    public QueryBuilder(LocalStore store, String table, SqlGrammar grammar) {
        this.store = Objects.requireNonNull(store, "store");
        this.table = Objects.requireNonNull(table, "table");
        this.grammar = grammar;
    }

    public String table() {
        return table;
    }

    public QueryBuilder select(String... columns) {
        return select(Arrays.asList(columns));
    }

    public QueryBuilder select(List<String> columns) {
        ensureOpen();
        this.columns.clear();
        this.columns.addAll(columns);
        return this;
    }

    public QueryBuilder where(String column, Object value) {
        return where(column, Operator.EQ, value);
    }

    public QueryBuilder where(String column, String operator, Object value) {
        return where(column, Operator.fromSymbol(operator), value);
    }

    public QueryBuilder where(String column, Operator operator, Object value) {
        ensureOpen();
        wheres.add(new WhereClause(column, operator, operator.takesValue() ? value : null));
        return this;
    }

    public QueryBuilder whereNull(String column) {
        return where(column, Operator.IS_NULL, null);
    }

    public QueryBuilder whereNotNull(String column) {
        return where(column, Operator.IS_NOT_NULL, null);
    }

    public QueryBuilder orderBy(String column) {
        return orderBy(column, Direction.ASC);
    }

    public QueryBuilder orderBy(String column, String direction) {
        return orderBy(column, Direction.parse(direction));
    }

    public QueryBuilder orderBy(String column, Direction direction) {
        ensureOpen();
        orders.add(new OrderClause(column, direction));
        return this;
    }

    public QueryBuilder limit(int limit) {
        ensureOpen();
        this.limit = limit;
        return this;
    }

    public QueryBuilder offset(int offset) {
        ensureOpen();
        this.offset = offset;
        return this;
    }

    /**
     * The SELECT this builder would run, without executing or consuming it.
     */
    public CompiledQuery toSql() {
        ensureOpen();
        return grammar.compileSelect(table, columns, wheres, orders, limit, offset);
    }

    // Terminal operations

    public List<Map<String, Object>> get() {
        consume();
        return fetch(grammar.compileSelect(table, columns, wheres, orders, limit, offset));
    }

    public Map<String, Object> first() {
        consume();
        List<Map<String, Object>> rows = fetch(grammar.compileSelect(table, columns, wheres, orders, 1, offset));
        return rows.isEmpty() ? null : rows.get(0);
    }

    public Object value(String column) {
        select(List.of(column));
        Map<String, Object> row = first();
        return row == null ? null : row.get(column);
    }

    public List<Object> pluck(String column) {
        select(List.of(column));
        List<Object> values = new ArrayList<>();
        for (Map<String, Object> row : get()) {
            values.add(row.get(column));
        }
        return values;
    }

    public long count() {
        consume();
        List<Map<String, Object>> rows = fetch(grammar.compileCount(table, wheres));
        if (rows.isEmpty()) {
            return 0;
        }
        Object aggregate = rows.get(0).get("aggregate");
        return aggregate instanceof Number ? ((Number) aggregate).longValue() : 0;
    }

    public boolean exists() {
        return count() > 0;
    }

    /**
     * Inserts one row with the given columns.
     *
     * @return the id generated for this row
     */
    public long insert(Map<String, ?> row) {
        consume();
        return insertRow(row);
    }

    /**
     * Inserts rows one statement at a time. The batch is not atomic: rows inserted before a
     * failing row stay inserted. Wrap the call in {@link LocalStore#transaction} when the
     * batch must be all-or-nothing.
     *
     * @return the generated ids, in row order
     */
    public List<Long> insertAll(List<? extends Map<String, ?>> rows) {
        consume();
        List<Long> ids = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            ids.add(insertRow(row));
        }
        return ids;
    }

    /**
     * Updates every row matching the accumulated predicates.
     *
     * @return affected rows; 0 without touching the store when {@code row} is empty
     */
    public int update(Map<String, ?> row) {
        consume();
        if (row.isEmpty()) {
            return 0;
        }
        CompiledQuery query = grammar.compileUpdate(table, row, wheres);
        log(query);
        return store.executeUpdate(query.sql(), query.bindings());
    }

    public int delete() {
        consume();
        CompiledQuery query = grammar.compileDelete(table, wheres);
        log(query);
        return store.executeUpdate(query.sql(), query.bindings());
    }

    public void truncate() {
        consume();
        execute(grammar.compileTruncate(table));
    }

    private long insertRow(Map<String, ?> row) {
        CompiledQuery query = grammar.compileInsert(table, row);
        log(query);
        return store.executeInsert(query.sql(), query.bindings());
    }

    private List<Map<String, Object>> fetch(CompiledQuery query) {
        log(query);
        return store.select(query.sql(), query.bindings());
    }

    private void execute(CompiledQuery query) {
        log(query);
        store.execute(query.sql(), query.bindings());
    }

    private static void log(CompiledQuery query) {
        logger.debug("{} {}", query.sql(), query.bindings());
    }

    private void consume() {
        ensureOpen();
        consumed = true;
    }

    private void ensureOpen() {
        if (consumed) {
            throw new IllegalStateException("Query builder for " + table + " has already been executed");
        }
    }
}
