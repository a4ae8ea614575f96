package com.z254.sentinel.notification.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.*;
import com.z254.sentinel.exception.DispatchException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PagerDutyNotificationProviderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockWebServer server;
    private SentinelProperties.Notifications.PagerDuty settings;
    private PagerDutyNotificationProvider provider;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        settings = new SentinelProperties.Notifications.PagerDuty();
        settings.setEventsUrl(server.url("/v2/enqueue").toString());
        settings.setApiKey("pd-key");
        settings.setRoutingKey("routing-123");
        provider = new PagerDutyNotificationProvider(WebClient.builder(), settings);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void triggersEventDedupedByAlertId() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(202)
                .setHeader("Content-Type", "application/json")
                .setBody("{\"status\":\"success\",\"dedup_key\":\"alert-42\"}"));

        StepVerifier.create(provider.send(alert(Severity.HIGH), List.of("oncall-service")))
                .expectNext(true)
                .verifyComplete();

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getHeader("Authorization")).isEqualTo("Token token=pd-key");
        JsonNode event = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(event.get("routing_key").asText()).isEqualTo("routing-123");
        assertThat(event.get("event_action").asText()).isEqualTo("trigger");
        assertThat(event.get("dedup_key").asText()).isEqualTo("alert-42");
        assertThat(event.at("/payload/severity").asText()).isEqualTo("error");
        assertThat(event.at("/payload/custom_details/metric").asText()).isEqualTo("error_rate");
    }

    @Test
    void severityMapsToEventsApiLevels() {
        assertThat(provider.event(alert(Severity.CRITICAL))).extractingByKey("payload")
                .asString().contains("severity=critical");
        assertThat(provider.event(alert(Severity.LOW))).extractingByKey("payload")
                .asString().contains("severity=info");
    }

    @Test
    void rejectedEventBecomesDispatchException() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"status\":\"invalid event\"}"));

        StepVerifier.create(provider.send(alert(Severity.HIGH), List.of("oncall-service")))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(DispatchException.class)
                        .hasMessageContaining("400"))
                .verify();
    }

    @Test
    void missingRoutingKeyIsUnhealthy() {
        settings.setRoutingKey(" ");

        StepVerifier.create(provider.healthCheck()).expectNext(false).verifyComplete();
        StepVerifier.create(provider.send(alert(Severity.HIGH), List.of()))
                .expectError(DispatchException.class)
                .verify();
    }

    private static Alert alert(Severity severity) {
        return Alert.builder()
                .id("alert-42")
                .title("High Error Rate")
                .severity(severity)
                .status(AlertStatus.OPEN)
                .category("system")
                .timestamp(Instant.parse("2026-03-02T12:00:00Z"))
                .context(Alert.Context.builder()
                        .metric("error_rate")
                        .value(MetricValue.of(7.5))
                        .threshold(MetricValue.of(5))
                        .source("sentinel")
                        .build())
                .build();
    }
}
