package com.hybridorm.repos.sqlite;

import com.hybridorm.core.config.DatabaseConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SQLiteQueryBuilderTest {
    private SQLiteStoreFactory factory;
    private SQLiteLocalStore db;

    @BeforeEach
    void setUp() {
        factory = new SQLiteStoreFactory();
        db = factory.create(DatabaseConfig.inMemory());
        db.execute("CREATE TABLE users (id INTEGER PRIMARY KEY AUTOINCREMENT, name TEXT NOT NULL, "
                + "email TEXT, age INTEGER, is_active INTEGER DEFAULT 1)", List.of());
        db.execute("INSERT INTO users (name, email, age) VALUES ('Alice', 'alice@example.com', 25)", List.of());
        db.execute("INSERT INTO users (name, email, age) VALUES ('Bob', 'bob@example.com', 30)", List.of());
        db.execute("INSERT INTO users (name, email, age) VALUES ('Charlie', NULL, 35)", List.of());
    }

    @AfterEach
    void tearDown() {
        factory.cleanUp();
    }

    @Test
    void selectsAllRows() {
        List<Map<String, Object>> users = db.table("users").get();

        assertEquals(3, users.size());
        assertEquals("Alice", users.get(0).get("name"));
    }

    @Test
    void selectsSpecificColumns() {
        List<Map<String, Object>> users = db.table("users").select("name").get();

        assertEquals(List.of("name"), List.copyOf(users.get(0).keySet()));
    }

    @Test
    void filtersWithWhere() {
        List<Map<String, Object>> users = db.table("users").where("age", ">=", 30).get();

        assertEquals(2, users.size());
        assertEquals("Bob", users.get(0).get("name"));
    }

    @Test
    void filtersWithWhereNull() {
        List<Map<String, Object>> users = db.table("users").whereNull("email").get();

        assertEquals(1, users.size());
        assertEquals("Charlie", users.get(0).get("name"));
    }

    @Test
    void ordersResults() {
        assertEquals(List.of("Charlie", "Bob", "Alice"), db.table("users").orderBy("age", "desc").pluck("name"));
    }

    @Test
    void limitsAndOffsetsResults() {
        assertEquals(1, db.table("users").limit(1).get().size());
        assertEquals(List.of("Bob", "Charlie"), db.table("users").orderBy("id").offset(1).pluck("name"));
    }

    @Test
    void countsRows() {
        assertEquals(3, db.table("users").count());
        assertEquals(2, db.table("users").whereNotNull("email").count());
    }

    @Test
    void checksExistence() {
        assertTrue(db.table("users").where("name", "Alice").exists());
        assertFalse(db.table("users").where("name", "Dave").exists());
    }

    @Test
    void insertsRecords() {
        long id = db.table("users").insert(Map.of("name", "Dave", "email", "dave@example.com", "age", 40));

        assertEquals(4L, id);
        assertEquals(4, db.table("users").count());
    }

    @Test
    void insertAllIsNotAtomic() {
        List<Map<String, Object>> rows = List.of(Map.of("name", "Eve"), Map.of("email", "no-name@example.com"));

        assertThrows(RuntimeException.class, () -> db.table("users").insertAll(rows));
        assertTrue(db.table("users").where("name", "Eve").exists());
    }

    @Test
    void insertAllInsideATransactionRollsBackTogether() {
        List<Map<String, Object>> rows = List.of(Map.of("name", "Eve"), Map.of("email", "no-name@example.com"));

        assertThrows(RuntimeException.class, () -> db.transaction(store -> db.table("users").insertAll(rows)));
        assertFalse(db.table("users").where("name", "Eve").exists());
    }

    @Test
    void updatesRecords() {
        assertEquals(1, db.table("users").where("name", "Alice").update(Map.of("age", 26)));

        Map<String, Object> alice = db.table("users").where("name", "Alice").first();
        assertEquals(26, ((Number) alice.get("age")).intValue());
    }

    @Test
    void deletesRecords() {
        assertEquals(1, db.table("users").where("name", "Bob").delete());
        assertEquals(2, db.table("users").count());
    }

    @Test
    void truncatesTable() {
        db.table("users").truncate();

        assertEquals(0, db.table("users").count());
    }

    @Test
    void likeAndNotEqual() {
        assertEquals(List.of("Alice"), db.table("users").where("name", "like", "a%").pluck("name"));
        assertEquals(2, db.table("users").where("name", "<>", "Bob").count());
    }
}
