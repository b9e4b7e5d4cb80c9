package com.example.courier.realtime.controller;

import com.example.courier.realtime.CourierRealtimeApplication;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.Map;

@SpringBootTest(classes = CourierRealtimeApplication.class, webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class RealtimeControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @Test
    void statsReportInstanceAndCounts() {
        webTestClient.get().uri("/api/realtime/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.instanceId").isNotEmpty()
                .jsonPath("$.totalConnections").isNumber()
                .jsonPath("$.connectionsByRole.courier").isNumber()
                .jsonPath("$.timestamp").isNotEmpty();
    }

    @Test
    void unknownUserIsNotConnected() {
        webTestClient.get().uri("/api/realtime/connected/{userId}", 424242)
                .exchange()
                .expectStatus().isOk()
                .expectBody(Boolean.class).isEqualTo(false);
    }

    @Test
    void announcementIsAccepted() {
        webTestClient.post().uri("/api/realtime/announcements")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("message", "Depot closes early today"))
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.status").isEqualTo("accepted");
    }

    @Test
    void announcementForSelectedRolesIsAccepted() {
        webTestClient.post().uri("/api/realtime/announcements")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("message", "Couriers: depot B is closed", "target_roles", List.of("courier")))
                .exchange()
                .expectStatus().isAccepted();
    }

    @Test
    void blankAnnouncementIsRejected() {
        webTestClient.post().uri("/api/realtime/announcements")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("message", " "))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.status").isEqualTo(400)
                .jsonPath("$.error").isEqualTo("Validation Failed")
                .jsonPath("$.message").isEqualTo("Message is required")
                .jsonPath("$.path").isEqualTo("/api/realtime/announcements");
    }

    @Test
    void correlationIdIsEchoed() {
        webTestClient.get().uri("/api/realtime/stats")
                .header("X-Correlation-ID", "trace-123")
                .exchange()
                .expectHeader().valueEquals("X-Correlation-ID", "trace-123");
    }

    @Test
    void correlationIdFromTheQueryIsEchoedWhenNoHeaderIsSent() {
        webTestClient.get().uri("/api/realtime/stats?correlation_id=ws-client-9")
                .exchange()
                .expectHeader().valueEquals("X-Correlation-ID", "ws-client-9");
    }

    @Test
    void healthIncludesConnectionDetails() {
        webTestClient.get().uri("/actuator/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.components.realtime.status").isEqualTo("UP")
                .jsonPath("$.components.realtime.details.routerStatus").isEqualTo("UP");
    }
}
