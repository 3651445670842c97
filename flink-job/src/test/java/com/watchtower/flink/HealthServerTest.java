package com.watchtower.flink;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link HealthServer} on an ephemeral port.
 */
class HealthServerTest {

    private final HttpClient client = HttpClient.newHttpClient();
    private HealthServer server;

    @BeforeEach
    void setUp() {
        server = new HealthServer();
        server.start(0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    @DisplayName("Should report liveness once started")
    void shouldReportLiveness() throws Exception {
        HttpResponse<String> response = get("/health");

        assertThat(server.isRunning()).isTrue();
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("UP");
    }

    @Test
    @DisplayName("Should report not ready until marked ready")
    void shouldReportReadiness() throws Exception {
        assertThat(get("/readiness").statusCode()).isEqualTo(503);

        server.markReady();

        HttpResponse<String> response = get("/readiness");
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("READY");
    }

    @Test
    @DisplayName("Should stop idempotently")
    void shouldStopIdempotently() {
        server.stop();
        server.stop();

        assertThat(server.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should reject an out-of-range port")
    void shouldRejectBadPort() {
        assertThatThrownBy(() -> new HealthServer().start(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(
                URI.create("http://localhost:" + server.getPort() + path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
