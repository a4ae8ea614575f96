package com.z254.sentinel.scheduling;

import com.z254.sentinel.alerting.EscalationScheduler;
import com.z254.sentinel.alerting.RuleEngine;
import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.detection.DetectorRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The four periodic loops. Each tick is a no-op once {@link #stop()} has been called or when
 * {@code sentinel.scheduling.enabled} is false.
 */
@Slf4j
@Component
public class SentinelScheduler {

    public enum Loop {
        TRAINING, DETECTION, RULE_EVALUATION, ESCALATION
    }

    /**
     * Last completed run of a loop and the error of the last failed run, if any.
     */
    public record LoopStatus(Instant lastRunAt, Instant lastFailureAt, String lastError) {
    }

    private final DetectorRegistry detectorRegistry;
    private final RuleEngine ruleEngine;
    private final EscalationScheduler escalationScheduler;
    private final Clock clock;

    private final AtomicBoolean running;
    private final Map<Loop, LoopStatus> statuses = new EnumMap<>(Loop.class);

    public SentinelScheduler(DetectorRegistry detectorRegistry,
                             RuleEngine ruleEngine,
                             EscalationScheduler escalationScheduler,
                             SentinelProperties properties,
                             Clock clock) {
        this.detectorRegistry = detectorRegistry;
        this.ruleEngine = ruleEngine;
        this.escalationScheduler = escalationScheduler;
        this.clock = clock;
        this.running = new AtomicBoolean(properties.getScheduling().isEnabled());
        for (Loop loop : Loop.values()) {
            statuses.put(loop, new LoopStatus(null, null, null));
        }
    }

    @Scheduled(fixedDelayString = "${sentinel.scheduling.training-interval:PT6H}",
            initialDelayString = "${sentinel.scheduling.training-initial-delay:PT30S}")
    public void trainingTick() {
        run(Loop.TRAINING, () -> {
            int trained = detectorRegistry.trainAll();
            log.info("Training pass complete: {} detectors trained", trained);
        });
    }

    @Scheduled(fixedDelayString = "${sentinel.scheduling.detection-interval:PT1M}")
    public void detectionTick() {
        run(Loop.DETECTION, () -> {
            int found = detectorRegistry.detectAll().size();
            if (found > 0) {
                log.info("Detection pass found {} anomalies", found);
            }
        });
    }

    @Scheduled(fixedDelayString = "${sentinel.scheduling.rule-evaluation-interval:PT1M}")
    public void ruleEvaluationTick() {
        run(Loop.RULE_EVALUATION, ruleEngine::evaluateAll);
    }

    @Scheduled(fixedDelayString = "${sentinel.scheduling.escalation-interval:PT30S}")
    public void escalationTick() {
        run(Loop.ESCALATION, () -> {
            int stepped = escalationScheduler.escalateAll();
            if (stepped > 0) {
                log.info("Escalation pass advanced {} alerts", stepped);
            }
        });
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Sentinel loops started");
        }
    }

    /**
     * Halt all loops. A tick already in progress completes.
     */
    @PreDestroy
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Sentinel loops stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public synchronized Map<Loop, LoopStatus> statuses() {
        return new EnumMap<>(statuses);
    }

    // ========== Private Methods ==========

    private void run(Loop loop, Runnable tick) {
        if (!running.get()) {
            return;
        }
        try {
            tick.run();
            record(loop, null);
        } catch (RuntimeException e) {
            log.error("{} loop tick failed", loop, e);
            record(loop, e);
        }
    }

    private synchronized void record(Loop loop, RuntimeException failure) {
        Instant now = clock.instant();
        LoopStatus previous = statuses.get(loop);
        statuses.put(loop, failure == null
                ? new LoopStatus(now, previous.lastFailureAt(), previous.lastError())
                : new LoopStatus(previous.lastRunAt(), now, String.valueOf(failure.getMessage())));
    }
}
