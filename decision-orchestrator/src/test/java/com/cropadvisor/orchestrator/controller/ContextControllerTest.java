package com.cropadvisor.orchestrator.controller;

import com.cropadvisor.orchestrator.OrchestratorFixtures;
import com.cropadvisor.orchestrator.context.InMemoryContextStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import static com.cropadvisor.orchestrator.OrchestratorFixtures.FARMER;
import static org.junit.jupiter.api.Assertions.*;

class ContextControllerTest {

    private InMemoryContextStore store;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        store = new InMemoryContextStore();
        client = WebTestClient.bindToController(new ContextController(store, OrchestratorFixtures.knowledgeBase()))
            .build();
    }

    private void seedProfile() {
        client.put().uri("/api/v1/context/farmers/{id}/profile", FARMER)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"landSizeAcres\":2.5,\"irrigationType\":\"drip\",\"latitude\":16.3,"
                       + "\"longitude\":80.45,\"locationName\":\"Guntur\"}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.irrigationType").isEqualTo("drip")
            .jsonPath("$.location.name").isEqualTo("Guntur");
    }

    @Test
    @DisplayName("profile and crop seeded through the API are read back")
    void seedAndRead() {
        seedProfile();

        client.post().uri("/api/v1/context/farmers/{id}/crops", FARMER)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"cropType\":\"paddy\",\"sowingDate\":\"2024-06-10\"}")
            .exchange()
            .expectStatus().isCreated()
            .expectBody()
            .jsonPath("$.cropKind").isEqualTo("rice")
            .jsonPath("$.stage").isEqualTo("germination")
            .jsonPath("$.version").isEqualTo(1);

        client.get().uri("/api/v1/context/farmers/{id}", FARMER)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.profile.landSizeAcres").isEqualTo(2.5)
            .jsonPath("$.activeCrop.sowingDate").isEqualTo("2024-06-10");

        assertNotNull(store.getActiveCrop(FARMER).block());
    }

    @Test
    @DisplayName("unknown farmer is 404")
    void notFound() {
        client.get().uri("/api/v1/context/farmers/{id}", 404L)
            .exchange()
            .expectStatus().isNotFound();
    }

    @Test
    @DisplayName("unsupported crop is 400")
    void unsupportedCrop() {
        client.post().uri("/api/v1/context/farmers/{id}/crops", FARMER)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"cropType\":\"quinoa\"}")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").isEqualTo("unsupported crop: quinoa");
    }

    @Test
    @DisplayName("out-of-range coordinates are 400")
    void badLocation() {
        client.put().uri("/api/v1/context/farmers/{id}/profile", FARMER)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"landSizeAcres\":2.5,\"latitude\":120.0,\"longitude\":80.45}")
            .exchange()
            .expectStatus().isBadRequest();
    }
}
