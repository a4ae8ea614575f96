package com.z254.sentinel.detection;

import com.z254.sentinel.alerting.AlertService;
import com.z254.sentinel.config.SentinelProperties;
import com.z254.sentinel.domain.model.*;
import com.z254.sentinel.domain.repository.AnomalyRepository;
import com.z254.sentinel.exception.ConfigurationException;
import com.z254.sentinel.exception.NotFoundException;
import com.z254.sentinel.kafka.SentinelEventPublisher;
import com.z254.sentinel.metrics.MetricSource;
import com.z254.sentinel.observability.SentinelMetrics;
import com.z254.sentinel.observability.SentinelStructuredLogger;
import com.z254.sentinel.observability.SentinelStructuredLogger.DetectorEventType;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Owns the configured detectors, their trained models and the anomaly log.
 * <p>
 * Each detector lives in a slot guarded by the slot's monitor. Training runs outside the monitor
 * and installs the new {@link TrainedDetector} in one assignment, so detection keeps using the
 * previous model until the replacement is ready.
 */
@Slf4j
@Service
public class DetectorRegistry {

    private final Map<String, DetectorSlot> slots = new ConcurrentHashMap<>();

    private final DetectorFactory detectorFactory;
    private final DetectorConfigValidator validator;
    private final MetricSource metricSource;
    private final AnomalyRepository anomalyRepository;
    private final AlertService alertService;
    private final SentinelEventPublisher eventPublisher;
    private final SentinelMetrics metrics;
    private final SentinelStructuredLogger structuredLogger;
    private final SentinelProperties properties;
    private final Clock clock;

    private Scheduler retrainScheduler = Schedulers.boundedElastic();

    public DetectorRegistry(DetectorFactory detectorFactory,
                            DetectorConfigValidator validator,
                            MetricSource metricSource,
                            AnomalyRepository anomalyRepository,
                            AlertService alertService,
                            SentinelEventPublisher eventPublisher,
                            SentinelMetrics metrics,
                            SentinelStructuredLogger structuredLogger,
                            SentinelProperties properties,
                            Clock clock) {
        this.detectorFactory = detectorFactory;
        this.validator = validator;
        this.metricSource = metricSource;
        this.anomalyRepository = anomalyRepository;
        this.alertService = alertService;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.properties = properties;
        this.clock = clock;
    }

    void setRetrainScheduler(Scheduler retrainScheduler) {
        this.retrainScheduler = retrainScheduler;
    }

    // ========== Detector Administration ==========

    public DetectorInfo addDetector(DetectorConfig config) {
        validator.validate(config);
        DetectorSlot slot = new DetectorSlot(config);
        if (slots.putIfAbsent(config.getId(), slot) != null) {
            throw new ConfigurationException(config.getId(), "detector already exists");
        }
        structuredLogger.logDetectorEvent(config.getId(), DetectorEventType.ADDED, "Added anomaly detector",
                Map.of("metric", config.getMetric(), "algorithm", config.getAlgorithm().name()));
        return slot.info();
    }

    /**
     * Replace a detector's config. A change of algorithm, sensitivity or seasonality schedules
     * an asynchronous retrain after {@code sentinel.detection.retrain-delay}.
     */
    public DetectorInfo updateDetector(String detectorId, DetectorConfig updated) {
        DetectorConfig config = updated.toBuilder().id(detectorId).build();
        validator.validate(config);
        DetectorSlot slot = slotOf(detectorId);

        boolean retrain;
        synchronized (slot) {
            DetectorConfig previous = slot.config;
            retrain = previous.getAlgorithm() != config.getAlgorithm()
                    || previous.getSensitivity() != config.getSensitivity()
                    || !Objects.equals(previous.getSeasonality(), config.getSeasonality())
                    || !Objects.equals(previous.getMetric(), config.getMetric());
            slot.config = config;
        }
        structuredLogger.logDetectorEvent(detectorId, DetectorEventType.UPDATED, "Updated anomaly detector",
                Map.of("retrain", retrain));
        if (retrain) {
            scheduleRetrain(slot);
        }
        return slot.info();
    }

    public void removeDetector(String detectorId) {
        DetectorSlot slot = slots.remove(detectorId);
        if (slot == null) {
            throw new NotFoundException("Detector", detectorId);
        }
        synchronized (slot) {
            slot.removed = true;
            if (slot.pendingRetrain != null) {
                slot.pendingRetrain.dispose();
            }
            anomalyRepository.deleteByDetector(detectorId);
        }
        structuredLogger.logDetectorEvent(detectorId, DetectorEventType.REMOVED, "Removed anomaly detector", null);
    }

    public DetectorInfo getDetector(String detectorId) {
        return slotOf(detectorId).info();
    }

    public List<DetectorInfo> getDetectors() {
        return slots.values().stream()
                .map(DetectorSlot::info)
                .sorted(Comparator.comparing(info -> info.config().getId()))
                .toList();
    }

    // ========== Training ==========

    /**
     * Train every enabled detector. One detector failing does not stop the others.
     *
     * @return number of detectors that installed a new model
     */
    public int trainAll() {
        int trained = 0;
        for (String detectorId : new ArrayList<>(slots.keySet())) {
            DetectorSlot slot = slots.get(detectorId);
            if (slot == null || !slot.config.isEnabled()) {
                continue;
            }
            try {
                if (trainDetector(detectorId)) {
                    trained++;
                }
            } catch (RuntimeException e) {
                metrics.recordDetectionError();
                structuredLogger.logDetectorEvent(detectorId, DetectorEventType.FAILED, "Training failed",
                        Map.of("error", String.valueOf(e.getMessage())));
            }
        }
        return trained;
    }

    /**
     * Train one detector on its training window. With fewer than {@code minDataPoints} samples
     * a warning is logged and the detector keeps its previous state.
     *
     * @return {@code true} when a new model was installed
     */
    public boolean trainDetector(String detectorId) {
        DetectorSlot slot = slotOf(detectorId);
        DetectorConfig config;
        DetectorStatus previousStatus;
        synchronized (slot) {
            if (slot.status == DetectorStatus.TRAINING) {
                log.debug("Detector {} is already training", detectorId);
                return false;
            }
            config = slot.config;
            previousStatus = slot.status;
            slot.status = DetectorStatus.TRAINING;
        }

        Timer.Sample sample = metrics.startTrainingTimer();
        Optional<TrainedDetector> trained;
        try {
            Instant now = clock.instant();
            List<MetricSample> series = metricSource.getHistoricalSeries(
                    config.getMetric(), now.minus(config.getTrainingWindow()), now);
            trained = detectorFactory.train(config, series);
            if (trained.isEmpty()) {
                metrics.recordTrainingSkipped();
                structuredLogger.logDetectorEvent(detectorId, DetectorEventType.INSUFFICIENT_DATA,
                        "Insufficient data for training",
                        Map.of("samples", series.size(), "required", config.getMinDataPoints()));
            }
        } catch (RuntimeException e) {
            synchronized (slot) {
                slot.status = previousStatus;
            }
            throw e;
        }

        synchronized (slot) {
            if (trained.isEmpty()) {
                slot.status = previousStatus;
                return false;
            }
            slot.trained = trained.get();
            slot.status = DetectorStatus.READY;
        }
        metrics.recordTrainingCompleted(sample);
        structuredLogger.logDetectorEvent(detectorId, DetectorEventType.TRAINED, "Detector trained",
                Map.of("samples", trained.get().sampleCount(),
                        "algorithm", activeAlgorithm(trained.get()).name()));
        return true;
    }

    // ========== Detection ==========

    /**
     * Run detection for every enabled detector.
     */
    public List<Anomaly> detectAll() {
        List<Anomaly> anomalies = new ArrayList<>();
        for (String detectorId : new ArrayList<>(slots.keySet())) {
            DetectorSlot slot = slots.get(detectorId);
            if (slot == null || !slot.config.isEnabled()) {
                continue;
            }
            try {
                detect(detectorId).ifPresent(anomalies::add);
            } catch (RuntimeException e) {
                metrics.recordDetectionError();
                structuredLogger.logDetectorEvent(detectorId, DetectorEventType.FAILED, "Detection failed",
                        Map.of("error", String.valueOf(e.getMessage())));
            }
        }
        return anomalies;
    }

    /**
     * Classify the metric's current value. Empty when the detector has no usable model, the
     * metric has no numeric value, or the value is normal.
     */
    public Optional<Anomaly> detect(String detectorId) {
        DetectorSlot slot = slotOf(detectorId);
        DetectorConfig config;
        TrainedDetector trained;
        synchronized (slot) {
            config = slot.config;
            trained = slot.trained;
        }
        if (trained == null || !trained.isUsable(config.getMinDataPoints())) {
            log.debug("Detector {} has no usable model", detectorId);
            return Optional.empty();
        }

        Optional<MetricValue> current = metricSource.getMetricValue(config.getMetric());
        if (current.isEmpty()) {
            log.debug("No current value for metric {}", config.getMetric());
            return Optional.empty();
        }
        if (!(current.get() instanceof MetricValue.NumericValue numeric)) {
            log.warn("Detector {} skipped non-numeric value of metric {}", detectorId, config.getMetric());
            return Optional.empty();
        }

        MetricSample sample = new MetricSample(config.getMetric(), clock.instant(), numeric.value());
        Optional<Anomaly> detected = trained.detector().detect(sample);
        if (detected.isEmpty()) {
            return Optional.empty();
        }

        Anomaly.AnomalyBuilder builder = detected.get().toBuilder()
                .id("anomaly-" + UUID.randomUUID())
                .detectorId(detectorId);
        attachPrediction(config, trained).ifPresent(builder::prediction);
        Anomaly anomaly;
        synchronized (slot) {
            // removed while this detection was in flight
            if (slot.removed) {
                log.debug("Detector {} was removed, discarding anomaly", detectorId);
                return Optional.empty();
            }
            anomaly = anomalyRepository.append(builder.build());
        }

        metrics.recordAnomaly(anomaly.getSeverity(), anomaly.getScore());
        structuredLogger.logDetectorEvent(detectorId, DetectorEventType.ANOMALY_DETECTED, "Anomaly detected",
                Map.of("metric", anomaly.getMetric(),
                        "severity", anomaly.getSeverity().name(),
                        "score", anomaly.getScore(),
                        "value", anomaly.getValue(),
                        "expected", anomaly.getExpectedValue()));
        eventPublisher.publishAnomaly(anomaly);

        if (reserveAlert(slot, config)) {
            alertService.createDetectorAlert(config, anomaly);
        }
        return Optional.of(anomaly);
    }

    /**
     * Forecast the detector's metric. The horizon defaults to the configured one; an untrained
     * detector or one without prediction enabled yields an empty forecast.
     */
    public Forecast getPrediction(String detectorId, Integer horizon) {
        DetectorSlot slot = slotOf(detectorId);
        DetectorConfig config;
        TrainedDetector trained;
        synchronized (slot) {
            config = slot.config;
            trained = slot.trained;
        }
        int steps = horizon != null ? horizon : config.getPrediction().getHorizon();
        if (steps < 1) {
            throw new IllegalArgumentException("horizon must be >= 1");
        }
        if (trained == null) {
            return Forecast.empty(steps);
        }
        return trained.forecast().map(model -> model.predict(steps)).orElseGet(() -> Forecast.empty(steps));
    }

    // ========== Queries ==========

    public List<Anomaly> getAnomalies(AnomalyFilter filter) {
        return anomalyRepository.find(filter);
    }

    public DetectionSummary getSummary() {
        List<Anomaly> anomalies = anomalyRepository.find(AnomalyFilter.all());
        Instant recentSince = clock.instant().minus(properties.getDetection().getSummaryWindow());

        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity, anomalies.stream().filter(a -> a.getSeverity() == severity).count());
        }
        Map<String, Long> byMetric = anomalies.stream()
                .collect(Collectors.groupingBy(Anomaly::getMetric, TreeMap::new, Collectors.counting()));

        List<DetectorInfo> detectors = getDetectors();
        return new DetectionSummary(
                detectors.size(),
                (int) detectors.stream().filter(d -> d.status() == DetectorStatus.READY).count(),
                anomalies.size(),
                anomalies.stream().filter(a -> !a.getTimestamp().isBefore(recentSince)).count(),
                bySeverity,
                byMetric);
    }

    // ========== Private Methods ==========

    private DetectorSlot slotOf(String detectorId) {
        DetectorSlot slot = slots.get(detectorId);
        if (slot == null) {
            throw new NotFoundException("Detector", detectorId);
        }
        return slot;
    }

    private void scheduleRetrain(DetectorSlot slot) {
        String detectorId = slot.config.getId();
        synchronized (slot) {
            if (slot.pendingRetrain != null) {
                slot.pendingRetrain.dispose();
            }
            slot.pendingRetrain = Mono.delay(properties.getDetection().getRetrainDelay(), retrainScheduler)
                    .subscribe(tick -> {
                        if (slots.get(detectorId) != slot) {
                            return;
                        }
                        try {
                            trainDetector(detectorId);
                        } catch (RuntimeException e) {
                            metrics.recordDetectionError();
                            structuredLogger.logDetectorEvent(detectorId, DetectorEventType.FAILED,
                                    "Retraining failed", Map.of("error", String.valueOf(e.getMessage())));
                        }
                    });
        }
    }

    private Optional<Anomaly.Prediction> attachPrediction(DetectorConfig config, TrainedDetector trained) {
        DetectorConfig.PredictionSettings settings = config.getPrediction();
        if (!settings.isEnabled()) {
            return Optional.empty();
        }
        return trained.forecast()
                .map(model -> model.predict(settings.getHorizon()))
                .filter(forecast -> !forecast.isEmpty() && forecast.confidence() >= settings.getConfidence())
                .map(forecast -> Anomaly.Prediction.builder()
                        .nextValues(forecast.values())
                        .timeHorizon(forecast.horizon())
                        .confidence(forecast.confidence())
                        .build());
    }

    private boolean reserveAlert(DetectorSlot slot, DetectorConfig config) {
        DetectorConfig.AlertingSettings alerting = config.getAlerting();
        if (alerting == null || !alerting.isEnabled()) {
            return false;
        }
        Instant now = clock.instant();
        synchronized (slot) {
            if (slot.lastAlertAt != null
                    && Duration.between(slot.lastAlertAt, now).compareTo(Duration.ofMinutes(alerting.getCooldown())) < 0) {
                log.debug("Detector {} alert within cooldown", config.getId());
                return false;
            }
            slot.lastAlertAt = now;
            return true;
        }
    }

    private static AnomalyAlgorithm activeAlgorithm(TrainedDetector trained) {
        if (trained.detector() instanceof SeasonalDetector seasonal && !seasonal.isSeasonal()) {
            return AnomalyAlgorithm.STATISTICAL;
        }
        return trained.detector().algorithm();
    }

    private static final class DetectorSlot {
        private volatile DetectorConfig config;
        private DetectorStatus status = DetectorStatus.UNCONFIGURED;
        private TrainedDetector trained;
        private Instant lastAlertAt;
        private Disposable pendingRetrain;
        private boolean removed;

        private DetectorSlot(DetectorConfig config) {
            this.config = config;
        }

        private synchronized DetectorInfo info() {
            return new DetectorInfo(
                    config,
                    status,
                    trained != null ? trained.sampleCount() : 0,
                    trained != null ? trained.trainedAt() : null,
                    trained != null ? activeAlgorithm(trained) : null,
                    lastAlertAt);
        }
    }
}
