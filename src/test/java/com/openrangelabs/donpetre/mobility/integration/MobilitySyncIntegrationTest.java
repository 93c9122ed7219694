package com.openrangelabs.donpetre.mobility.integration;

import com.openrangelabs.donpetre.mobility.entity.ChunkProgress;
import com.openrangelabs.donpetre.mobility.model.ChunkKey;
import com.openrangelabs.donpetre.mobility.model.SchemaType;
import com.openrangelabs.donpetre.mobility.model.SyncSpec;
import com.openrangelabs.donpetre.mobility.progress.ChunkProgressStore;
import com.openrangelabs.donpetre.mobility.repository.ChunkProgressRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.security.test.web.reactive.server.SecurityMockServerConfigurers.mockJwt;

@SpringBootTest
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class MobilitySyncIntegrationTest {

    private static final String RUN_REQUEST = """
            {
                "runId": "it-run",
                "fromDate": "2026-10-01",
                "toDate": "2026-10-02",
                "selections": [ { "endpoint": "movement/job/pings", "schema": "BASIC" } ]
            }
            """;

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private ChunkProgressStore progressStore;

    @Autowired
    private ChunkProgressRepository repository;

    @BeforeEach
    void setUp() {
        // Clean up progress rows
        repository.deleteAll().block();
    }

    @Test
    void health_IsPublic() {
        webTestClient.get()
                .uri("/actuator/health")
                .exchange()
                .expectStatus().isOk();
    }

    @Test
    void startRun_WithoutVendorSecrets_RejectedBeforeDispatch() {
        webTestClient.mutateWith(mockJwt().authorities(new SimpleGrantedAuthority("ROLE_ADMIN")))
                .post()
                .uri("/api/sync/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(RUN_REQUEST)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("mobility-sync.vendor.api-key is not set");

        assertThat(repository.count().block()).isZero();
    }

    @Test
    void startRun_UserRole_Forbidden() {
        webTestClient.mutateWith(mockJwt().authorities(new SimpleGrantedAuthority("ROLE_USER")))
                .post()
                .uri("/api/sync/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(RUN_REQUEST)
                .exchange()
                .expectStatus().isForbidden();
    }

    @Test
    void getRun_ReadsPersistedProgress() {
        ChunkKey key = ChunkKey.of(0, 0, new SyncSpec("movement/job/pings", SchemaType.BASIC, "bucket"));
        progressStore.attemptStarted("it-progress", key, 1).block();
        progressStore.failed("it-progress", key, 3, "JobFailedException: boom").block();

        webTestClient.mutateWith(mockJwt().authorities(new SimpleGrantedAuthority("ROLE_USER")))
                .get()
                .uri("/api/sync/runs/{runId}", "it-progress")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.active").isEqualTo(false)
                .jsonPath("$.failedChunks").isEqualTo(1)
                .jsonPath("$.chunks[0].lastError").isEqualTo("JobFailedException: boom");

        ChunkProgress stored = repository.findById(ChunkProgress.idFor("it-progress", key.asString())).block();
        assertThat(stored.getAttempts()).isEqualTo(3);
        assertThat(stored.getVersion()).isEqualTo(1L);
    }

    @Test
    void getRuns_Unauthenticated_Unauthorized() {
        webTestClient.get()
                .uri("/api/sync/runs")
                .exchange()
                .expectStatus().isUnauthorized();
    }
}
