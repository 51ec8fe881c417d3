package com.hybridorm.repos.certification;

import com.hybridorm.core.LocalStore;
import com.hybridorm.core.StoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract every {@link LocalStore} must satisfy. Subclasses assign {@link #store} in
 * {@link #init()} with a fresh, empty database.
 */
public abstract class LocalStoreCertification {
    protected LocalStore store;

    public abstract void init();

    @BeforeEach
    public void setUp() {
        init();
        store.execute("CREATE TABLE hens (id INTEGER PRIMARY KEY AUTOINCREMENT, name TEXT NOT NULL, eggs INTEGER, laid_at TEXT)", List.of());
    }

    @Test
    public void getColumnsShouldListColumnsInDeclarationOrder() {
        assertEquals(List.of("id", "name", "eggs", "laid_at"), store.getColumns("hens"));
    }

    @Test
    public void getColumnsShouldBeEmptyForAMissingTable() {
        assertTrue(store.getColumns("roosters").isEmpty());
        assertFalse(store.hasColumn("roosters", "id"));
    }

    @Test
    public void hasColumnShouldReflectTheSchema() {
        assertTrue(store.hasColumn("hens", "eggs"));
        assertFalse(store.hasColumn("hens", "feathers"));
    }

    @Test
    public void executeShouldInsertAndReportTheGeneratedId() {
        store.execute("INSERT INTO hens (name, eggs) VALUES (?, ?)", List.of("Henny", 3));
        long first = store.lastInsertId();
        store.execute("INSERT INTO hens (name, eggs) VALUES (?, ?)", List.of("Penny", 5));

        assertEquals(first + 1, store.lastInsertId());
    }

    @Test
    public void selectShouldReturnColumnKeyedRows() {
        store.execute("INSERT INTO hens (name, eggs) VALUES (?, ?)", List.of("Henny", 3));

        List<Map<String, Object>> rows = store.select("SELECT name, eggs FROM hens WHERE name = ?", List.of("Henny"));

        assertEquals(1, rows.size());
        assertEquals("Henny", rows.get(0).get("name"));
        assertEquals(3, ((Number) rows.get(0).get("eggs")).intValue());
    }

    @Test
    public void affectedRowsShouldCountUpdatedRows() {
        store.execute("INSERT INTO hens (name, eggs) VALUES (?, ?)", List.of("Henny", 3));
        store.execute("INSERT INTO hens (name, eggs) VALUES (?, ?)", List.of("Penny", 3));
        store.execute("INSERT INTO hens (name, eggs) VALUES (?, ?)", List.of("Jenny", 1));

        store.execute("UPDATE hens SET eggs = ? WHERE eggs = ?", List.of(4, 3));

        assertEquals(2, store.affectedRows());
    }

    @Test
    public void executeInsertShouldReturnTheIdOfItsOwnRow() {
        long henny = store.executeInsert("INSERT INTO hens (name, eggs) VALUES (?, ?)", List.of("Henny", 3));
        long penny = store.executeInsert("INSERT INTO hens (name, eggs) VALUES (?, ?)", List.of("Penny", 5));

        assertNotEquals(henny, penny);
        assertEquals("Henny", store.select("SELECT name FROM hens WHERE id = ?", List.of(henny)).get(0).get("name"));
        assertEquals("Penny", store.select("SELECT name FROM hens WHERE id = ?", List.of(penny)).get(0).get("name"));
    }

    @Test
    public void executeUpdateShouldReturnItsOwnRowCount() {
        store.execute("INSERT INTO hens (name, eggs) VALUES (?, ?)", List.of("Henny", 3));
        store.execute("INSERT INTO hens (name, eggs) VALUES (?, ?)", List.of("Penny", 3));

        assertEquals(2, store.executeUpdate("UPDATE hens SET eggs = ? WHERE eggs = ?", List.of(4, 3)));
        assertEquals(0, store.executeUpdate("DELETE FROM hens WHERE eggs = ?", List.of(3)));
        assertThrows(StoreException.class, () -> store.executeUpdate("UPDATE roosters SET name = ?", List.of("x")));
    }

    @Test
    public void nullParametersShouldBind() {
        store.execute("INSERT INTO hens (name, eggs) VALUES (?, ?)", Arrays.asList("Henny", null));

        List<Map<String, Object>> rows = store.select("SELECT eggs FROM hens", List.of());

        assertNull(rows.get(0).get("eggs"));
    }

    @Test
    public void invalidSqlShouldRaiseStoreException() {
        assertThrows(StoreException.class, () -> store.select("SELECT * FROM roosters", List.of()));
        assertThrows(StoreException.class, () -> store.execute("INSERT INTO roosters (name) VALUES (?)", List.of("x")));
    }

    @Test
    public void commitShouldKeepWrites() {
        store.beginTransaction();
        store.execute("INSERT INTO hens (name) VALUES (?)", List.of("Henny"));
        store.commit();

        assertEquals(1, count());
    }

    @Test
    public void rollbackShouldDiscardWrites() {
        store.beginTransaction();
        store.execute("INSERT INTO hens (name) VALUES (?)", List.of("Henny"));
        store.rollback();

        assertEquals(0, count());
    }

    @Test
    public void transactionShouldRollBackAndRethrowOnFailure() {
        RuntimeException failure = assertThrows(IllegalStateException.class, () -> store.transaction(s -> {
            s.execute("INSERT INTO hens (name) VALUES (?)", List.of("Henny"));
            throw new IllegalStateException("boom");
        }));

        assertEquals("boom", failure.getMessage());
        assertEquals(0, count());
    }

    @Test
    public void transactionShouldCommitAndReturnTheResult() {
        long id = store.transaction(s -> {
            s.execute("INSERT INTO hens (name) VALUES (?)", List.of("Henny"));
            return s.lastInsertId();
        });

        assertTrue(id > 0);
        assertEquals(1, count());
    }

    @Test
    public void transactionControlShouldRequireMatchingState() {
        assertThrows(IllegalStateException.class, () -> store.commit());
        assertThrows(IllegalStateException.class, () -> store.rollback());

        store.beginTransaction();
        assertThrows(IllegalStateException.class, () -> store.beginTransaction());
        store.rollback();
    }

    private int count() {
        Object aggregate = store.select("SELECT COUNT(*) AS n FROM hens", List.of()).get(0).get("n");
        return ((Number) aggregate).intValue();
    }
}
