package com.whereq.helios;

import com.whereq.helios.store.InMemorySharedStateStore;
import com.whereq.helios.store.SharedStateStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@AutoConfigureWebTestClient
class HeliosApplicationTest {

    @Autowired
    private SharedStateStore store;

    @Autowired
    private WebTestClient webTestClient;

    @Test
    @DisplayName("Context starts on the in-memory store and reports itself up")
    void contextStarts() {
        assertInstanceOf(InMemorySharedStateStore.class, store);

        webTestClient.get().uri("/api/v1/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("UP")
            .jsonPath("$.service").isEqualTo("whereq-helios");
    }

    @Test
    @DisplayName("Admission through the HTTP API charges the live window")
    void budgetEndpointsRespond() {
        webTestClient.post().uri("/api/v1/helios/budget/request")
            .header("Content-Type", "application/json")
            .bodyValue("{\"taskId\": \"smoke\", \"estimatedUnits\": 5}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.admitted").isEqualTo(true)
            .jsonPath("$.reservedUnits").isEqualTo(5);

        webTestClient.get().uri("/api/v1/helios/budget/status")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.usedUnits").isEqualTo(5);
    }
}
