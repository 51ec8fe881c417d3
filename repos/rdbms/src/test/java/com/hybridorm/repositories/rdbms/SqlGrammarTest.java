package com.hybridorm.repositories.rdbms;

import com.hybridorm.core.Moment;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SqlGrammarTest {
    private final SqlGrammar grammar = new SqlGrammar();

    @Test
    void selectWithoutClausesSelectsEverything() {
        CompiledQuery query = grammar.compileSelect("users", List.of(), List.of(), List.of(), null, null);

        assertEquals("SELECT * FROM users", query.sql());
        assertTrue(query.bindings().isEmpty());
    }

    @Test
    void predicatesCompileInRegistrationOrderWithOneBindingEach() {
        CompiledQuery query = grammar.compileSelect("users", List.of(),
                List.of(new WhereClause("age", Operator.GTE, 18), new WhereClause("status", Operator.EQ, "active")),
                List.of(new OrderClause("id", Direction.DESC)), 10, null);

        assertEquals("SELECT * FROM users WHERE age >= ? AND status = ? ORDER BY id DESC LIMIT 10", query.sql());
        assertEquals(List.of(18, "active"), query.bindings());
    }

    @Test
    void nullChecksHaveNoPlaceholder() {
        CompiledQuery query = grammar.compileSelect("users", List.of("id", "name"),
                List.of(new WhereClause("deleted_at", Operator.IS_NULL, null),
                        new WhereClause("email", Operator.IS_NOT_NULL, null),
                        new WhereClause("name", Operator.LIKE, "A%")),
                List.of(), null, null);

        assertEquals("SELECT id, name FROM users WHERE deleted_at IS NULL AND email IS NOT NULL AND name LIKE ?", query.sql());
        assertEquals(List.of("A%"), query.bindings());
    }

    @Test
    void offsetWithoutLimitUsesUnboundedLimit() {
        CompiledQuery query = grammar.compileSelect("users", List.of(), List.of(), List.of(), null, 20);

        assertEquals("SELECT * FROM users LIMIT -1 OFFSET 20", query.sql());
    }

    @Test
    void zeroLimitIsStillRendered() {
        CompiledQuery query = grammar.compileSelect("users", List.of(), List.of(), List.of(), 0, 0);

        assertEquals("SELECT * FROM users LIMIT 0 OFFSET 0", query.sql());
    }

    @Test
    void countIgnoresOrdering() {
        CompiledQuery query = grammar.compileCount("users", List.of(new WhereClause("active", Operator.EQ, true)));

        assertEquals("SELECT COUNT(*) AS aggregate FROM users WHERE active = ?", query.sql());
        assertEquals(List.of(1), query.bindings());
    }

    @Test
    void insertPreparesValues() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", "Alice");
        row.put("active", false);
        row.put("meta", Map.of("a", 1));
        row.put("born_at", Moment.of(1990, 5, 1, 8, 30, 0));

        CompiledQuery query = grammar.compileInsert("users", row);

        assertEquals("INSERT INTO users (name, active, meta, born_at) VALUES (?, ?, ?, ?)", query.sql());
        assertEquals(List.of("Alice", 0, "{\"a\":1}", "1990-05-01T08:30:00"), query.bindings());
    }

    @Test
    void emptyInsertUsesDefaultValues() {
        CompiledQuery query = grammar.compileInsert("users", Map.of());

        assertEquals("INSERT INTO users DEFAULT VALUES", query.sql());
        assertTrue(query.bindings().isEmpty());
    }

    @Test
    void updateBindsAssignmentsBeforePredicates() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", "Bob");
        row.put("age", 31);

        CompiledQuery query = grammar.compileUpdate("users", row, List.of(new WhereClause("id", Operator.EQ, 7)));

        assertEquals("UPDATE users SET name = ?, age = ? WHERE id = ?", query.sql());
        assertEquals(List.of("Bob", 31, 7), query.bindings());
    }

    @Test
    void deleteAndTruncate() {
        assertEquals("DELETE FROM users WHERE id != ?",
                grammar.compileDelete("users", List.of(new WhereClause("id", Operator.NE, 1))).sql());
        assertEquals("DELETE FROM users", grammar.compileTruncate("users").sql());
    }

    @Test
    void valuesAreNeverInterpolated() {
        CompiledQuery query = grammar.compileSelect("users", List.of(),
                List.of(new WhereClause("name", Operator.EQ, "x' OR '1'='1")), List.of(), null, null);

        assertFalse(query.sql().contains("OR"));
        assertEquals(List.of("x' OR '1'='1"), query.bindings());
    }
}
