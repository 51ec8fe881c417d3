package com.hybridorm.repos.certification;

import com.hybridorm.core.RemoteResource;
import com.hybridorm.core.RemoteResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract every {@link RemoteResource} must satisfy against an empty {@code hens}
 * resource. Subclasses assign {@link #remote} in {@link #init()}.
 */
public abstract class RemoteResourceCertification {
    protected static final String RESOURCE = "hens";

    protected RemoteResource remote;

    public abstract void init();

    @BeforeEach
    public void setUp() {
        init();
    }

    @Test
    public void storeShouldReturnTheCreatedEntityWithAnId() {
        RemoteResponse response = remote.store(RESOURCE, Map.of("name", "Henny", "eggs", 3));

        assertTrue(response.successful());
        Map<String, Object> created = response.entityData().orElseThrow();
        assertNotNull(created.get("id"));
        assertEquals("Henny", created.get("name"));
    }

    @Test
    public void showShouldReturnAStoredEntity() {
        Object id = idOf(remote.store(RESOURCE, Map.of("name", "Henny")));

        RemoteResponse response = remote.show(RESOURCE, String.valueOf(id));

        assertTrue(response.successful());
        assertEquals("Henny", response.entityData().orElseThrow().get("name"));
    }

    @Test
    public void showShouldReportAMissingEntityAsNotFound() {
        RemoteResponse response = remote.show(RESOURCE, "999999");

        assertFalse(response.successful());
        assertTrue(response.notFound());
    }

    @Test
    public void indexShouldListStoredEntities() {
        remote.store(RESOURCE, Map.of("name", "Henny"));
        remote.store(RESOURCE, Map.of("name", "Penny"));

        List<Map<String, Object>> hens = remote.index(RESOURCE).collectionData();

        assertEquals(2, hens.size());
    }

    @Test
    public void updateShouldChangeAStoredEntity() {
        Object id = idOf(remote.store(RESOURCE, Map.of("name", "Henny", "eggs", 1)));

        RemoteResponse response = remote.update(RESOURCE, String.valueOf(id), Map.of("name", "Henny", "eggs", 2));

        assertTrue(response.successful());
        Map<String, Object> reread = remote.show(RESOURCE, String.valueOf(id)).entityData().orElseThrow();
        assertEquals(2, ((Number) reread.get("eggs")).intValue());
    }

    @Test
    public void destroyShouldRemoveAStoredEntity() {
        Object id = idOf(remote.store(RESOURCE, Map.of("name", "Henny")));

        assertTrue(remote.destroy(RESOURCE, String.valueOf(id)).successful());
        assertTrue(remote.show(RESOURCE, String.valueOf(id)).notFound());
    }

    @Test
    public void destroyShouldReportAMissingEntityAsNotFound() {
        assertFalse(remote.destroy(RESOURCE, "999999").successful());
    }

    private static Object idOf(RemoteResponse response) {
        return response.entityData().orElseThrow().get("id");
    }
}
