package com.z254.sentinel.observability;

import com.z254.sentinel.alerting.EscalationScheduler;
import com.z254.sentinel.alerting.RuleEngine;
import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.detection.DetectorRegistry;
import com.z254.sentinel.scheduling.SentinelScheduler;
import com.z254.sentinel.support.MutableClock;
import io.micrometer.tracing.test.simple.SimpleSpan;
import io.micrometer.tracing.test.simple.SimpleTracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SentinelTracingAspectTest {

    @Mock
    private DetectorRegistry detectorRegistry;

    @Mock
    private RuleEngine ruleEngine;

    @Mock
    private EscalationScheduler escalationScheduler;

    private SimpleTracer tracer;
    private SentinelScheduler scheduler;

    @BeforeEach
    void setUp() {
        tracer = new SimpleTracer();
        SentinelScheduler target = new SentinelScheduler(detectorRegistry, ruleEngine, escalationScheduler,
                new SentinelProperties(), new MutableClock(Instant.parse("2026-03-02T12:00:00Z")));
        AspectJProxyFactory factory = new AspectJProxyFactory(target);
        factory.setProxyTargetClass(true);
        factory.addAspect(new SentinelTracingAspect(tracer));
        scheduler = factory.getProxy();
    }

    @Test
    void loopTickRunsInsideNamedSpan() {
        when(escalationScheduler.escalateAll()).thenReturn(0);

        scheduler.escalationTick();

        SimpleSpan span = tracer.onlySpan();
        assertThat(span.getName()).isEqualTo("sentinel.loop.escalationTick");
        assertThat(span.getTags()).containsEntry("class", "SentinelScheduler");
        assertThat(span.getEndTimestamp()).isNotNull();
        assertThat(MDC.get(SentinelStructuredLogger.MDC_TRACE_ID)).isNull();
    }

    @Test
    void methodsOutsidePointcutAreNotTraced() {
        scheduler.isRunning();

        assertThat(tracer.getSpans()).isEmpty();
    }
}
