package com.hybridorm.remote.http;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.hybridorm.core.RemoteResponse;
import com.hybridorm.core.RemoteUnavailableException;
import com.hybridorm.core.config.NetworkConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.junit.jupiter.api.Assertions.*;

class HttpRemoteResourceTest {
    private WireMockServer wireMockServer;
    private HttpRemoteResource remote;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(options().dynamicPort());
        wireMockServer.start();
        WireMock.configureFor("localhost", wireMockServer.port());
        remote = new HttpRemoteResource(new NetworkConfig("http://localhost:" + wireMockServer.port() + "/api/", 2000, Map.of("X-Client", "hybridorm")));
    }

    @AfterEach
    void tearDown() {
        wireMockServer.stop();
    }

    @Test
    void showUnwrapsEnvelopedAndBareBodiesAlike() {
        stubFor(get(urlEqualTo("/api/users/1")).willReturn(okJson("{\"data\": {\"id\": 1, \"name\": \"A\"}}")));
        stubFor(get(urlEqualTo("/api/users/2")).willReturn(okJson("{\"id\": 1, \"name\": \"A\"}")));

        Map<String, Object> wrapped = remote.show("users", "1").entityData().orElseThrow();
        Map<String, Object> bare = remote.show("users", "2").entityData().orElseThrow();

        assertEquals(bare, wrapped);
        assertEquals("A", wrapped.get("name"));
    }

    @Test
    void indexSendsFiltersAsQueryParameters() {
        stubFor(get(urlPathEqualTo("/api/users"))
                .withQueryParam("status", equalTo("active"))
                .willReturn(okJson("{\"data\": [{\"id\": 1}, {\"id\": 2}]}")));

        RemoteResponse response = remote.index("users", Map.of("status", "active"), Map.of());

        assertTrue(response.successful());
        assertEquals(2, response.collectionData().size());
    }

    @Test
    void storePostsJsonWithMergedHeaders() {
        stubFor(post(urlEqualTo("/api/users")).willReturn(aResponse()
                .withStatus(201)
                .withHeader("Content-Type", "application/json")
                .withBody("{\"id\": 10, \"name\": \"Alice\"}")));

        RemoteResponse response = remote.store("users", Map.of("name", "Alice"), Map.of("Authorization", "Bearer t0k3n"));

        assertEquals(201, response.statusCode());
        assertEquals(10, response.entityData().orElseThrow().get("id"));
        verify(postRequestedFor(urlEqualTo("/api/users"))
                .withHeader("Accept", equalTo("application/json"))
                .withHeader("Content-Type", equalTo("application/json"))
                .withHeader("X-Client", equalTo("hybridorm"))
                .withHeader("Authorization", equalTo("Bearer t0k3n"))
                .withRequestBody(equalToJson("{\"name\": \"Alice\"}")));
    }

    @Test
    void updatePutsToTheEntityRoute() {
        stubFor(put(urlEqualTo("/api/users/7")).willReturn(okJson("{\"id\": 7, \"name\": \"Bob\"}")));

        assertTrue(remote.update("users", "7", Map.of("name", "Bob")).successful());
        verify(putRequestedFor(urlEqualTo("/api/users/7")).withRequestBody(equalToJson("{\"name\": \"Bob\"}")));
    }

    @Test
    void destroyWithEmptyBody() {
        stubFor(delete(urlEqualTo("/api/users/7")).willReturn(aResponse().withStatus(204)));

        RemoteResponse response = remote.destroy("users", "7");

        assertTrue(response.successful());
        assertNull(response.data());
    }

    @Test
    void idsAreUrlEncoded() {
        stubFor(get(urlEqualTo("/api/users/a%20b")).willReturn(okJson("{\"id\": \"a b\"}")));

        assertTrue(remote.show("users", "a b").successful());
    }

    @Test
    void validationErrorsAreReadable() {
        stubFor(post(urlEqualTo("/api/users")).willReturn(aResponse()
                .withStatus(422)
                .withHeader("Content-Type", "application/json")
                .withBody("{\"message\": \"Invalid\", \"errors\": {\"email\": [\"Email is taken\"]}}")));

        RemoteResponse response = remote.store("users", Map.of("email", "a@example.com"));

        assertFalse(response.successful());
        assertTrue(response.isValidationError());
        assertEquals(Map.of("email", List.of("Email is taken")), response.errors());
        assertEquals("Email is taken", response.firstError());
        assertEquals("Invalid", response.errorMessage());
    }

    @Test
    void errorStatusesWithTextBodiesAreResponsesNotExceptions() {
        stubFor(get(urlEqualTo("/api/users/1")).willReturn(aResponse().withStatus(503).withBody("<html>down</html>")));

        RemoteResponse response = remote.show("users", "1");

        assertTrue(response.serverError());
        assertEquals("<html>down</html>", response.errorMessage());
    }

    @Test
    void unreadableSuccessBodyIsUnavailable() {
        stubFor(get(urlEqualTo("/api/users/1")).willReturn(aResponse().withStatus(200).withBody("not json")));

        assertThrows(RemoteUnavailableException.class, () -> remote.show("users", "1"));
    }

    @Test
    void slowServerTimesOut() {
        stubFor(get(urlEqualTo("/api/users/1")).willReturn(okJson("{}").withFixedDelay(5000)));

        assertThrows(RemoteUnavailableException.class, () -> remote.show("users", "1"));
    }

    @Test
    void refusedConnectionIsUnavailable() {
        int port = wireMockServer.port();
        wireMockServer.stop();

        HttpRemoteResource offline = new HttpRemoteResource(NetworkConfig.of("http://localhost:" + port));

        assertThrows(RemoteUnavailableException.class, () -> offline.index("users"));
    }

    @Test
    void missingBaseUrlIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new HttpRemoteResource(NetworkConfig.disabled()));
    }
}
