package com.z254.sentinel.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation configuration for SENTINEL service.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8090}")
    private int serverPort;

    @Bean
    public OpenAPI sentinelOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("SENTINEL Anomaly Detection & Alerting API")
                        .description("""
                                SENTINEL watches metric streams and turns abnormal behavior into alerts.
                                
                                ## Features
                                
                                - **Anomaly Detection**: Statistical and seasonal detectors trained per metric
                                - **Forecasting**: Short-horizon projections with backtested confidence
                                - **Alert Rules**: Threshold, text and regex conditions with debounce and rate limits
                                - **Escalation**: Timed multi-level policies over email, Slack, webhooks and PagerDuty
                                """)
                        .version("0.1.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")))
                .tags(List.of(
                        new Tag().name("Detectors").description("Anomaly detector configuration, training and prediction"),
                        new Tag().name("Anomalies").description("Detected anomaly querying"),
                        new Tag().name("Rules").description("Alert rule management"),
                        new Tag().name("Alerts").description("Alert querying and lifecycle"),
                        new Tag().name("Metrics").description("Metric ingestion"),
                        new Tag().name("System").description("Summary, provider health and loop control")));
    }
}
