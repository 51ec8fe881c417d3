package com.hybridorm.persistence;

import com.hybridorm.core.RemoteResponse;
import com.hybridorm.repos.sqlite.SQLiteLocalStore;
import com.hybridorm.repos.sqlite.SQLiteStoreFactory;
import com.hybridorm.repositories.memory.InMemoryResource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DualStorePersistenceTest {
    private SQLiteStoreFactory stores;
    private SQLiteLocalStore local;
    private InMemoryResource remote;
    private PersistenceCoordinator coordinator;

    @BeforeEach
    void setUp() {
        stores = new SQLiteStoreFactory();
        local = stores.create(":memory:");
        local.execute(User.DDL, List.of());
        remote = new InMemoryResource();
        coordinator = new PersistenceCoordinator(local, remote);
    }

    @AfterEach
    void tearDown() {
        stores.cleanUp();
    }

    private User newUser(String name) {
        User user = User.dual().get();
        user.fill(Map.of("name", name, "email", name.toLowerCase() + "@example.com"));
        return user;
    }

    private long localCount() {
        return local.table("users").count();
    }

    @Test
    void remoteAssignedIdIsUsedForTheLocalRow() {
        remote.store("users", Map.of("name", "seed 1"));
        remote.store("users", Map.of("name", "seed 2"));
        User user = newUser("Ada");

        assertTrue(coordinator.save(user));

        assertEquals(3L, user.getId());
        assertEquals("Ada", local.table("users").where("id", 3).value("name"));
        assertEquals(1, localCount());
    }

    @Test
    void remotePayloadKeepsKeysTheLocalTableLacks() {
        User user = newUser("Ada");
        user.setAttribute("nickname", "Countess");

        assertTrue(coordinator.save(user));

        Map<String, Object> remoteCopy = remote.show("users", String.valueOf(user.getId())).entityData().orElseThrow();
        assertEquals("Countess", remoteCopy.get("nickname"));
        Map<String, Object> localCopy = local.table("users").where("id", user.getId()).first();
        assertFalse(localCopy.containsKey("nickname"));
    }

    @Test
    void findPrefersTheLocalRow() {
        User user = newUser("Ada");
        coordinator.save(user);
        remote.update("users", String.valueOf(user.getId()), Map.of("name", "Remote Ada"));

        assertEquals("Ada", coordinator.find(User.dual(), user.getId()).getAttribute("name"));
    }

    @Test
    void findFallsBackToRemoteAndSyncsLocally() {
        remote.store("users", Map.of("name", "Grace", "email", "grace@example.com", "team", Map.of("name", "Navy")));

        User found = coordinator.find(User.dual(), 1);

        assertNotNull(found);
        assertTrue(found.exists());
        assertFalse(found.isDirty());
        assertEquals("Grace", found.getAttribute("name"));
        assertEquals("Grace", local.table("users").where("id", 1).value("name"));
    }

    @Test
    void findSurvivesAMissingLocalTable() {
        remote.store("users", Map.of("name", "Grace"));
        local.execute("DROP TABLE users", List.of());

        User found = coordinator.find(User.dual(), 1);

        assertNotNull(found);
        assertEquals("Grace", found.getAttribute("name"));
    }

    @Test
    void envelopedAndBareResponsesHydrateTheSameEntity() {
        InMemoryResource wrapped = new InMemoryResource(true);
        InMemoryResource bare = new InMemoryResource(false);
        wrapped.store("users", Map.of("name", "A"));
        bare.store("users", Map.of("name", "A"));

        User fromWrapped = new PersistenceCoordinator(null, wrapped).find(User.remoteOnly(), 1);
        User fromBare = new PersistenceCoordinator(null, bare).find(User.remoteOnly(), 1);

        assertEquals(fromBare.attributes(), fromWrapped.attributes());
        assertEquals("A", fromWrapped.getAttribute("name"));
    }

    @Test
    void allUsesTheLocalResultEvenWhenEmpty() {
        remote.store("users", Map.of("name", "Remote only"));

        assertTrue(coordinator.all(User.dual()).isEmpty());
    }

    @Test
    void allFallsBackToRemoteWhenTheLocalQueryFails() {
        remote.store("users", Map.of("name", "A"));
        remote.store("users", Map.of("name", "B"));
        local.execute("ALTER TABLE users RENAME TO users_old", List.of());

        assertEquals(2, coordinator.all(User.dual()).size());

        local.execute("ALTER TABLE users_old RENAME TO users", List.of());
        assertEquals(0, localCount());
    }

    @Test
    void saveSucceedsLocallyWhileTheRemoteIsDown() {
        remote.setAvailable(false);
        User user = newUser("Ada");

        assertTrue(coordinator.save(user));

        assertTrue(user.exists());
        assertEquals(1, localCount());
    }

    @Test
    void saveSucceedsRemotelyWhenTheLocalWriteFails() {
        local.execute("DROP TABLE users", List.of());
        local.clearSchemaCache();
        User user = newUser("Ada");

        assertTrue(coordinator.save(user));

        assertEquals(1, remote.size("users"));
        assertEquals(1L, user.getId());
    }

    @Test
    void updatesGoToBothStores() {
        User user = newUser("Ada");
        coordinator.save(user);
        user.setAttribute("name", "Ada L.");

        assertTrue(coordinator.save(user));

        RemoteResponse response = remote.show("users", String.valueOf(user.getId()));
        assertEquals("Ada L.", response.get("name"));
        assertEquals("Ada L.", local.table("users").where("id", user.getId()).value("name"));
    }

    @Test
    void deleteRemovesFromBothStores() {
        User user = newUser("Ada");
        coordinator.save(user);

        assertTrue(coordinator.delete(user));

        assertEquals(0, remote.size("users"));
        assertEquals(0, localCount());
    }

    @Test
    void deleteSucceedsWhenOnlyTheLocalStoreAnswers() {
        User user = newUser("Ada");
        coordinator.save(user);
        remote.setAvailable(false);

        assertTrue(coordinator.delete(user));
        assertFalse(user.exists());
    }

    @Test
    void refreshFallsBackToRemote() {
        User user = newUser("Ada");
        coordinator.save(user);
        local.table("users").truncate();
        remote.update("users", String.valueOf(user.getId()), Map.of("name", "Remote Ada"));

        assertTrue(coordinator.refresh(user));
        assertEquals("Remote Ada", user.getAttribute("name"));
    }
}
