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

class EmailNotificationProviderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockWebServer server;
    private SentinelProperties.Notifications.Email settings;
    private EmailNotificationProvider provider;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        settings = new SentinelProperties.Notifications.Email();
        settings.setRelayUrl(server.url("/v3/mail/send").toString());
        settings.setApiKey("relay-key");
        settings.setFrom("alerts@example.com");
        provider = new EmailNotificationProvider(WebClient.builder(), settings);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void sendsMailToEveryRecipient() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(202));

        StepVerifier.create(provider.send(alert(), List.of("oncall@example.com", "lead@example.com")))
                .expectNext(true)
                .verifyComplete();

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer relay-key");
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.get("personalizations").get(0).get("to").findValuesAsText("email"))
                .containsExactly("oncall@example.com", "lead@example.com");
        assertThat(body.get("from").get("email").asText()).isEqualTo("alerts@example.com");
        assertThat(body.get("subject").asText()).isEqualTo("🟠 HIGH: Database Connection Failure");
        assertThat(body.get("content").get(0).get("value").asText())
                .contains("<h2>Database Connection Failure</h2>")
                .contains("Alert ID: alert-9");
    }

    @Test
    void omitsAuthorizationWithoutApiKey() throws Exception {
        settings.setApiKey(null);
        server.enqueue(new MockResponse().setResponseCode(202));

        StepVerifier.create(provider.send(alert(), List.of("oncall@example.com")))
                .expectNext(true)
                .verifyComplete();

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getHeader("Authorization")).isNull();
    }

    @Test
    void missingRelayFailsWithoutRequest() {
        settings.setRelayUrl(null);

        StepVerifier.create(provider.send(alert(), List.of("oncall@example.com")))
                .expectError(DispatchException.class)
                .verify();
        assertThat(server.getRequestCount()).isZero();
    }

    private static Alert alert() {
        return Alert.builder()
                .id("alert-9")
                .title("Database Connection Failure")
                .description("db_connection_status is unhealthy")
                .severity(Severity.HIGH)
                .status(AlertStatus.OPEN)
                .category("database")
                .timestamp(Instant.parse("2026-03-02T12:00:00Z"))
                .context(Alert.Context.builder()
                        .metric("db_connection_status")
                        .value(MetricValue.of("unhealthy"))
                        .threshold(MetricValue.of("healthy"))
                        .environment("production")
                        .build())
                .build();
    }
}
