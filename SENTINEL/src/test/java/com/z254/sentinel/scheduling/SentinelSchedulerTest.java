package com.z254.sentinel.scheduling;

import com.z254.sentinel.alerting.EscalationScheduler;
import com.z254.sentinel.alerting.RuleEngine;
import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.detection.DetectorRegistry;
import com.z254.sentinel.scheduling.SentinelScheduler.Loop;
import com.z254.sentinel.scheduling.SentinelScheduler.LoopStatus;
import com.z254.sentinel.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SentinelSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

    @Mock
    private DetectorRegistry detectorRegistry;

    @Mock
    private RuleEngine ruleEngine;

    @Mock
    private EscalationScheduler escalationScheduler;

    private SentinelScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new SentinelScheduler(detectorRegistry, ruleEngine, escalationScheduler,
                new SentinelProperties(), new MutableClock(NOW));
    }

    @Test
    void ticksRunTheirLoopAndRecordStatus() {
        when(detectorRegistry.detectAll()).thenReturn(List.of());

        scheduler.detectionTick();
        scheduler.ruleEvaluationTick();
        scheduler.escalationTick();

        verify(detectorRegistry).detectAll();
        verify(ruleEngine).evaluateAll();
        verify(escalationScheduler).escalateAll();
        assertThat(scheduler.statuses().get(Loop.DETECTION)).isEqualTo(new LoopStatus(NOW, null, null));
        assertThat(scheduler.statuses().get(Loop.TRAINING).lastRunAt()).isNull();
    }

    @Test
    void failedTickIsRecordedAndNextTickStillRuns() {
        when(detectorRegistry.trainAll())
                .thenThrow(new IllegalStateException("metric store offline"))
                .thenReturn(3);

        scheduler.trainingTick();
        LoopStatus failed = scheduler.statuses().get(Loop.TRAINING);
        scheduler.trainingTick();

        assertThat(failed.lastFailureAt()).isEqualTo(NOW);
        assertThat(failed.lastError()).isEqualTo("metric store offline");
        assertThat(scheduler.statuses().get(Loop.TRAINING).lastRunAt()).isEqualTo(NOW);
        verify(detectorRegistry, times(2)).trainAll();
    }

    @Test
    void stoppedSchedulerSkipsTicks() {
        scheduler.stop();

        scheduler.trainingTick();
        scheduler.detectionTick();
        scheduler.ruleEvaluationTick();
        scheduler.escalationTick();

        assertThat(scheduler.isRunning()).isFalse();
        verifyNoInteractions(detectorRegistry, ruleEngine, escalationScheduler);

        scheduler.start();
        assertThat(scheduler.isRunning()).isTrue();
    }

    @Test
    void disabledSchedulingStartsStopped() {
        SentinelProperties properties = new SentinelProperties();
        properties.getScheduling().setEnabled(false);

        SentinelScheduler disabled = new SentinelScheduler(detectorRegistry, ruleEngine, escalationScheduler,
                properties, new MutableClock(NOW));

        assertThat(disabled.isRunning()).isFalse();
    }
}
