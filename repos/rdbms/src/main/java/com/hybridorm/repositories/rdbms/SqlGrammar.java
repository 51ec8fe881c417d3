package com.hybridorm.repositories.rdbms;

import com.github.jknack.handlebars.Handlebars;
import com.github.jknack.handlebars.Template;

import java.io.IOException;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Compiles query specifications into SQLite-flavoured parameterized SQL.
 * <p>
 * Statement skeletons are Handlebars templates; only identifiers and placeholders are
 * rendered into the text, values always travel as bindings.
 */
public class SqlGrammar {
    private static final String SELECT =
            "SELECT {{{columns}}} FROM {{{table}}}"
                    + "{{#if where}} WHERE {{{where}}}{{/if}}"
                    + "{{#if order}} ORDER BY {{{order}}}{{/if}}"
                    + "{{#if limit}} LIMIT {{{limit}}}{{/if}}"
                    + "{{#if offset}} OFFSET {{{offset}}}{{/if}}";
    private static final String COUNT =
            "SELECT COUNT(*) AS aggregate FROM {{{table}}}{{#if where}} WHERE {{{where}}}{{/if}}";
    private static final String INSERT =
            "INSERT INTO {{{table}}} ({{{columns}}}) VALUES ({{{placeholders}}})";
    private static final String INSERT_DEFAULTS =
            "INSERT INTO {{{table}}} DEFAULT VALUES";
    private static final String UPDATE =
            "UPDATE {{{table}}} SET {{{assignments}}}{{#if where}} WHERE {{{where}}}{{/if}}";
    private static final String DELETE =
            "DELETE FROM {{{table}}}{{#if where}} WHERE {{{where}}}{{/if}}";

    public static final SqlGrammar DEFAULT = new SqlGrammar();

    private final Template select;
    private final Template count;
    private final Template insert;
    private final Template insertDefaults;
    private final Template update;
    private final Template delete;

    public SqlGrammar() {
        Handlebars handlebars = new Handlebars();
        try {
            this.select = handlebars.compileInline(SELECT);
            this.count = handlebars.compileInline(COUNT);
            this.insert = handlebars.compileInline(INSERT);
            this.insertDefaults = handlebars.compileInline(INSERT_DEFAULTS);
            this.update = handlebars.compileInline(UPDATE);
            this.delete = handlebars.compileInline(DELETE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to compile SQL templates", e);
        }
    }

    public CompiledQuery compileSelect(String table, List<String> columns, List<WhereClause> wheres,
                                       List<OrderClause> orders, Integer limit, Integer offset) {
        Map<String, Object> context = new HashMap<>();
        context.put("table", table);
        context.put("columns", columns.isEmpty() ? "*" : String.join(", ", columns));
        context.put("where", whereSql(wheres));
        context.put("order", orders.stream().map(OrderClause::toSql).collect(Collectors.joining(", ")));
        if (limit != null) {
            context.put("limit", String.valueOf(limit));
        } else if (offset != null) {
            context.put("limit", "-1");
        }
        if (offset != null) {
            context.put("offset", String.valueOf(offset));
        }
        return new CompiledQuery(render(select, context), whereBindings(wheres));
    }

    public CompiledQuery compileCount(String table, List<WhereClause> wheres) {
        Map<String, Object> context = new HashMap<>();
        context.put("table", table);
        context.put("where", whereSql(wheres));
        return new CompiledQuery(render(count, context), whereBindings(wheres));
    }

    public CompiledQuery compileInsert(String table, Map<String, ?> row) {
        Map<String, Object> context = new HashMap<>();
        context.put("table", table);
        if (row.isEmpty()) {
            return new CompiledQuery(render(insertDefaults, context), List.of());
        }
        context.put("columns", String.join(", ", row.keySet()));
        context.put("placeholders", String.join(", ", Collections.nCopies(row.size(), "?")));
        return new CompiledQuery(render(insert, context), Converters.prepareAll(row.values()));
    }

    public CompiledQuery compileUpdate(String table, Map<String, ?> row, List<WhereClause> wheres) {
        Map<String, Object> context = new HashMap<>();
        context.put("table", table);
        context.put("assignments", row.keySet().stream().map(column -> column + " = ?").collect(Collectors.joining(", ")));
        context.put("where", whereSql(wheres));
        List<Object> bindings = Converters.prepareAll(row.values());
        bindings.addAll(whereBindings(wheres));
        return new CompiledQuery(render(update, context), bindings);
    }

    public CompiledQuery compileDelete(String table, List<WhereClause> wheres) {
        Map<String, Object> context = new HashMap<>();
        context.put("table", table);
        context.put("where", whereSql(wheres));
        return new CompiledQuery(render(delete, context), whereBindings(wheres));
    }

    public CompiledQuery compileTruncate(String table) {
        return compileDelete(table, List.of());
    }

    private static String whereSql(List<WhereClause> wheres) {
        return wheres.stream().map(WhereClause::toSql).collect(Collectors.joining(" AND "));
    }

    private static List<Object> whereBindings(List<WhereClause> wheres) {
        List<Object> bindings = new ArrayList<>();
        for (WhereClause where : wheres) {
            if (where.operator().takesValue()) {
                bindings.add(Converters.prepare(where.value()));
            }
        }
        return bindings;
    }

    private static String render(Template template, Map<String, Object> context) {
        try {
            return template.apply(context);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to apply SQL template", e);
        }
    }
}
