package com.z254.sentinel.detection;

import com.z254.sentinel.alerting.AlertService;
import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.*;
import com.z254.sentinel.domain.repository.InMemoryAnomalyRepository;
import com.z254.sentinel.exception.ConfigurationException;
import com.z254.sentinel.exception.NotFoundException;
import com.z254.sentinel.kafka.SentinelEventPublisher;
import com.z254.sentinel.metrics.InMemoryMetricSource;
import com.z254.sentinel.metrics.MetricSource;
import com.z254.sentinel.observability.SentinelMetrics;
import com.z254.sentinel.observability.SentinelStructuredLogger;
import com.z254.sentinel.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DetectorRegistryTest {

    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

    @Mock
    private AlertService alertService;

    @Mock
    private SentinelEventPublisher eventPublisher;

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private InMemoryMetricSource metricSource;
    private InMemoryAnomalyRepository anomalyRepository;
    private DetectorRegistry registry;

    @BeforeEach
    void setUp() {
        SentinelProperties properties = new SentinelProperties();
        clock = new MutableClock(NOW);
        meterRegistry = new SimpleMeterRegistry();
        metricSource = new InMemoryMetricSource(properties, clock);
        anomalyRepository = new InMemoryAnomalyRepository(properties);
        registry = new DetectorRegistry(
                new DetectorFactory(properties, clock),
                new DetectorConfigValidator(),
                metricSource,
                anomalyRepository,
                alertService,
                eventPublisher,
                new SentinelMetrics(meterRegistry),
                new SentinelStructuredLogger(),
                properties,
                clock);
    }

    @Test
    void trainingWithTooFewSamplesKeepsDetectorUnconfigured() {
        registry.addDetector(errorRateDetector(0.6));
        recordHistory(10);

        assertThat(registry.trainDetector("error_rate")).isFalse();
        assertThat(registry.getDetector("error_rate").status()).isEqualTo(DetectorStatus.UNCONFIGURED);
        assertThat(meterRegistry.counter("sentinel.detectors.training.skipped").count()).isEqualTo(1.0);
    }

    @Test
    void detectLogsPublishesAndAlertsOnce() {
        registry.addDetector(errorRateDetector(0.6));
        recordHistory(100);
        assertThat(registry.trainDetector("error_rate")).isTrue();

        metricSource.record("error_rate", MetricValue.of(30));
        Anomaly first = registry.detect("error_rate").orElseThrow();
        clock.advance(Duration.ofMinutes(1));
        registry.detect("error_rate").orElseThrow();

        assertThat(first.getId()).startsWith("anomaly-");
        assertThat(first.getDetectorId()).isEqualTo("error_rate");
        assertThat(first.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(registry.getAnomalies(AnomalyFilter.all())).hasSize(2);
        verify(eventPublisher, times(2)).publishAnomaly(any());
        // second anomaly falls inside the 10 minute detector cooldown
        verify(alertService, times(1)).createDetectorAlert(any(), eq(first));
        verifyNoMoreInteractions(alertService);
    }

    @Test
    void normalValueProducesNothing() {
        registry.addDetector(errorRateDetector(0.6));
        recordHistory(100);
        registry.trainDetector("error_rate");

        metricSource.record("error_rate", MetricValue.of(10.5));

        assertThat(registry.detect("error_rate")).isEmpty();
        verifyNoInteractions(alertService, eventPublisher);
    }

    @Test
    void forecastIsAttachedOnlyAboveConfidenceFloor() {
        registry.addDetector(errorRateDetector(0.6));
        registry.addDetector(errorRateDetector(0.99).toBuilder().id("error_rate_strict").build());
        recordHistory(100);
        registry.trainAll();

        metricSource.record("error_rate", MetricValue.of(30));

        assertThat(registry.detect("error_rate").orElseThrow().getPrediction()).isNotNull();
        assertThat(registry.detect("error_rate_strict").orElseThrow().getPrediction()).isNull();
        assertThat(registry.getPrediction("error_rate", 4).values()).hasSize(4);
    }

    @Test
    void untrainedDetectorDetectsNothingAndForecastsEmpty() {
        registry.addDetector(errorRateDetector(0.6));
        metricSource.record("error_rate", MetricValue.of(30));

        assertThat(registry.detect("error_rate")).isEmpty();
        assertThat(registry.getPrediction("error_rate", null).isEmpty()).isTrue();
    }

    @Test
    void sensitivityChangeSchedulesRetrain() {
        VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
        registry.setRetrainScheduler(scheduler);
        registry.addDetector(errorRateDetector(0.6));
        recordHistory(100);

        registry.updateDetector("error_rate", errorRateDetector(0.6).toBuilder().sensitivity(0.9).build());
        assertThat(registry.getDetector("error_rate").status()).isEqualTo(DetectorStatus.UNCONFIGURED);

        scheduler.advanceTimeBy(Duration.ofSeconds(1));

        DetectorInfo info = registry.getDetector("error_rate");
        assertThat(info.status()).isEqualTo(DetectorStatus.READY);
        assertThat(info.config().getSensitivity()).isEqualTo(0.9);
        assertThat(info.sampleCount()).isEqualTo(100);
    }

    @Test
    void removeDetectorDropsItsAnomalies() {
        registry.addDetector(errorRateDetector(0.6));
        recordHistory(100);
        registry.trainDetector("error_rate");
        metricSource.record("error_rate", MetricValue.of(30));
        registry.detect("error_rate");

        registry.removeDetector("error_rate");

        assertThat(registry.getAnomalies(AnomalyFilter.all())).isEmpty();
        assertThatThrownBy(() -> registry.getDetector("error_rate")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void detectionFinishingAfterRemovalLeavesNoAnomalyLog() {
        AtomicReference<DetectorRegistry> removing = new AtomicReference<>();
        MetricSource removingSource = new MetricSource() {
            @Override
            public Optional<MetricValue> getMetricValue(String metric) {
                removing.get().removeDetector("error_rate");
                return metricSource.getMetricValue(metric);
            }

            @Override
            public List<MetricSample> getHistoricalSeries(String metric, Instant start, Instant end) {
                return metricSource.getHistoricalSeries(metric, start, end);
            }
        };
        SentinelProperties properties = new SentinelProperties();
        DetectorRegistry racing = new DetectorRegistry(
                new DetectorFactory(properties, clock),
                new DetectorConfigValidator(),
                removingSource,
                anomalyRepository,
                alertService,
                eventPublisher,
                new SentinelMetrics(meterRegistry),
                new SentinelStructuredLogger(),
                properties,
                clock);
        removing.set(racing);
        racing.addDetector(errorRateDetector(0.6));
        recordHistory(100);
        assertThat(racing.trainDetector("error_rate")).isTrue();
        metricSource.record("error_rate", MetricValue.of(30));

        assertThat(racing.detect("error_rate")).isEmpty();

        assertThat(anomalyRepository.find(AnomalyFilter.all())).isEmpty();
        verifyNoInteractions(alertService, eventPublisher);
    }

    @Test
    void invalidAndDuplicateDetectorsAreRejected() {
        DetectorConfig invalid = errorRateDetector(0.6).toBuilder().metric(" ").sensitivity(2).build();

        assertThatThrownBy(() -> registry.addDetector(invalid))
                .isInstanceOf(ConfigurationException.class)
                .satisfies(e -> assertThat(((ConfigurationException) e).getViolations()).hasSize(2));

        registry.addDetector(errorRateDetector(0.6));
        assertThatThrownBy(() -> registry.addDetector(errorRateDetector(0.6)))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void summaryCountsAnomaliesBySeverityAndMetric() {
        registry.addDetector(errorRateDetector(0.6));
        recordHistory(100);
        registry.trainDetector("error_rate");
        metricSource.record("error_rate", MetricValue.of(30));
        registry.detect("error_rate");

        DetectionSummary summary = registry.getSummary();

        assertThat(summary.detectors()).isEqualTo(1);
        assertThat(summary.readyDetectors()).isEqualTo(1);
        assertThat(summary.totalAnomalies()).isEqualTo(1);
        assertThat(summary.recentAnomalies()).isEqualTo(1);
        assertThat(summary.bySeverity()).containsEntry(Severity.CRITICAL, 1L);
        assertThat(summary.byMetric()).containsEntry("error_rate", 1L);
    }

    private static DetectorConfig errorRateDetector(double forecastFloor) {
        return DetectorConfig.builder()
                .id("error_rate")
                .name("Error Rate Anomaly Detection")
                .metric("error_rate")
                .minDataPoints(30)
                .trainingWindow(Duration.ofDays(3))
                .prediction(new DetectorConfig.PredictionSettings(true, 15, forecastFloor))
                .alerting(DetectorConfig.AlertingSettings.builder()
                        .enabled(true)
                        .cooldown(10)
                        .channels(List.of(NotificationChannel.SLACK))
                        .build())
                .build();
    }

    /**
     * Alternating 9 / 11 once a minute: mean 10, standard deviation 1.
     */
    private void recordHistory(int samples) {
        for (int i = 0; i < samples; i++) {
            Instant at = NOW.minus(Duration.ofMinutes(samples - i));
            metricSource.record("error_rate", MetricValue.of(i % 2 == 0 ? 9 : 11), at);
        }
    }
}
