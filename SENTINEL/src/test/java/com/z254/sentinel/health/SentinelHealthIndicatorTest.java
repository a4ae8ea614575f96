package com.z254.sentinel.health;

import com.z254.sentinel.domain.model.NotificationChannel;
import com.z254.sentinel.notification.NotificationDispatcher;
import com.z254.sentinel.scheduling.SentinelScheduler;
import com.z254.sentinel.scheduling.SentinelScheduler.Loop;
import com.z254.sentinel.scheduling.SentinelScheduler.LoopStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SentinelHealthIndicatorTest {

    @Mock
    private NotificationDispatcher dispatcher;

    @Mock
    private SentinelScheduler scheduler;

    @InjectMocks
    private SentinelHealthIndicator healthIndicator;

    @Test
    void upWhileOneProviderIsHealthy() {
        when(dispatcher.healthCheck()).thenReturn(Mono.just(Map.of(
                NotificationChannel.SLACK, true,
                NotificationChannel.EMAIL, false)));
        when(scheduler.isRunning()).thenReturn(true);
        when(scheduler.statuses()).thenReturn(Map.of(
                Loop.RULE_EVALUATION, new LoopStatus(Instant.parse("2026-03-02T12:00:00Z"), null, null),
                Loop.TRAINING, new LoopStatus(null, Instant.parse("2026-03-02T11:00:00Z"), "metric store offline")));

        StepVerifier.create(healthIndicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("providers.slack", "UP")
                            .containsEntry("providers.email", "DOWN")
                            .containsEntry("loops.rule_evaluation.lastRunAt", "2026-03-02T12:00:00Z")
                            .containsEntry("loops.training.lastError", "metric store offline");
                })
                .verifyComplete();
    }

    @Test
    void downWhenNoProviderIsHealthy() {
        when(dispatcher.healthCheck()).thenReturn(Mono.just(Map.of(NotificationChannel.SLACK, false)));
        when(scheduler.statuses()).thenReturn(Map.of());

        StepVerifier.create(healthIndicator.health())
                .assertNext(health -> assertThat(health.getStatus()).isEqualTo(Status.DOWN))
                .verifyComplete();
    }
}
