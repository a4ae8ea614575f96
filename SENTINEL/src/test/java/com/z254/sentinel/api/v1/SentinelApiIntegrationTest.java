package com.z254.sentinel.api.v1;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests for the v1 REST API.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class SentinelApiIntegrationTest {

    @Autowired
    private WebTestClient webTestClient;

    @Nested
    @DisplayName("/api/v1/detectors")
    class DetectorTests {

        @Test
        @DisplayName("should create detector and report it unconfigured")
        void createDetector() {
            webTestClient.post()
                    .uri("/api/v1/detectors")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of(
                            "id", "checkout_latency",
                            "name", "Checkout Latency",
                            "metric", "checkout_latency_ms",
                            "algorithm", "statistical",
                            "minDataPoints", 20))
                    .exchange()
                    .expectStatus().isCreated()
                    .expectBody()
                    .jsonPath("$.config.id").isEqualTo("checkout_latency")
                    .jsonPath("$.config.algorithm").isEqualTo("STATISTICAL")
                    .jsonPath("$.status").isEqualTo("UNCONFIGURED");

            webTestClient.post()
                    .uri("/api/v1/detectors/checkout_latency/detect")
                    .exchange()
                    .expectStatus().isNoContent();
        }

        @Test
        @DisplayName("should reject invalid detector with violations")
        void rejectInvalidDetector() {
            webTestClient.post()
                    .uri("/api/v1/detectors")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("id", "broken", "sensitivity", 3))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo(400)
                    .jsonPath("$.violations.length()").isEqualTo(2);
        }

        @Test
        @DisplayName("should return 404 for unknown detector")
        void unknownDetector() {
            webTestClient.get()
                    .uri("/api/v1/detectors/does-not-exist")
                    .exchange()
                    .expectStatus().isNotFound();
        }
    }

    @Nested
    @DisplayName("/api/v1/metrics")
    class MetricTests {

        @Test
        @DisplayName("should accept samples and expose the latest value")
        void ingestSamples() {
            webTestClient.post()
                    .uri("/api/v1/metrics")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(List.of(
                            Map.of("metric", "queue_depth", "value", 12),
                            Map.of("metric", "payments_db", "value", "unhealthy")))
                    .exchange()
                    .expectStatus().isAccepted()
                    .expectBody()
                    .jsonPath("$.accepted").isEqualTo(2);

            webTestClient.get()
                    .uri("/api/v1/metrics/payments_db")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody(String.class)
                    .isEqualTo("\"unhealthy\"");
        }

        @Test
        @DisplayName("should reject sample without value")
        void rejectSampleWithoutValue() {
            webTestClient.post()
                    .uri("/api/v1/metrics")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(List.of(Map.of("metric", "queue_depth")))
                    .exchange()
                    .expectStatus().isBadRequest();
        }
    }

    @Nested
    @DisplayName("/api/v1/rules and /api/v1/alerts")
    class AlertLifecycleTests {

        @Test
        @DisplayName("should fire rule, then acknowledge its alert once")
        void fireAndAcknowledge() {
            webTestClient.post()
                    .uri("/api/v1/rules")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of(
                            "id", "api_errors",
                            "name", "API Errors",
                            "severity", "HIGH",
                            "condition", Map.of("metric", "api_error_rate", "operator", "GT", "threshold", 5)))
                    .exchange()
                    .expectStatus().isCreated();

            webTestClient.post()
                    .uri("/api/v1/metrics")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(List.of(Map.of("metric", "api_error_rate", "value", 9.5)))
                    .exchange()
                    .expectStatus().isAccepted();

            webTestClient.post()
                    .uri("/api/v1/rules/api_errors/evaluate")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.outcome").isEqualTo("FIRED");

            byte[] listed = webTestClient.get()
                    .uri("/api/v1/alerts?ruleId=api_errors&status=OPEN")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.total").isEqualTo(1)
                    .jsonPath("$.alerts[0].context.value").isEqualTo(9.5)
                    .returnResult()
                    .getResponseBody();
            assertThat(listed).isNotNull();
            String alertId = JsonPath.read(new String(listed), "$.alerts[0].id");

            webTestClient.post()
                    .uri("/api/v1/alerts/{id}/acknowledge", alertId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("acknowledgedBy", "alice"))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("ACKNOWLEDGED")
                    .jsonPath("$.acknowledgedBy").isEqualTo("alice");

            webTestClient.post()
                    .uri("/api/v1/alerts/{id}/acknowledge", alertId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("acknowledgedBy", "bob"))
                    .exchange()
                    .expectStatus().isEqualTo(409);
        }

        @Test
        @DisplayName("should reject rule with non-numeric threshold for GT")
        void rejectInvalidRule() {
            webTestClient.post()
                    .uri("/api/v1/rules")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of(
                            "id", "bad_rule",
                            "name", "Bad Rule",
                            "condition", Map.of("metric", "cpu", "operator", "GT", "threshold", "high")))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.violations").value(v -> assertThat(String.valueOf(v)).contains("must be numeric"));
        }
    }

    @Nested
    @DisplayName("/api/v1/summary")
    class SummaryTests {

        @Test
        @DisplayName("should report detection and alert summaries")
        void summary() {
            webTestClient.get()
                    .uri("/api/v1/summary")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.detection").exists()
                    .jsonPath("$.alerts").exists()
                    .jsonPath("$.loopsRunning").isEqualTo(false);
        }
    }
}
