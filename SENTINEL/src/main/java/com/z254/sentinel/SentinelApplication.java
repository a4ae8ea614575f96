package com.z254.sentinel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * SENTINEL - Anomaly Detection and Alert Escalation Service.
 *
 * <p>SENTINEL provides:
 * <ul>
 *   <li>Anomaly detection - statistical and seasonal classifiers trained per metric</li>
 *   <li>Forecasting - short-horizon linear projections with backtested confidence</li>
 *   <li>Alert rules - threshold, text and regex conditions with debounce and rate limits</li>
 *   <li>Escalation - timed multi-level policies with notification fan-out</li>
 * </ul>
 *
 * <p>Notifications go out over email relay, Slack webhooks, generic webhooks and PagerDuty.
 */
@SpringBootApplication
@EnableConfigurationProperties
public class SentinelApplication {

    public static void main(String[] args) {
        SpringApplication.run(SentinelApplication.class, args);
    }
}
