package org.nowstart.signalforge.service.calibration;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.signalforge.data.dto.CalibrationRecord;
import org.nowstart.signalforge.data.dto.CalibrationRunResult;
import org.nowstart.signalforge.data.dto.DirectionStats;
import org.nowstart.signalforge.data.dto.ThresholdEvaluation;
import org.nowstart.signalforge.data.entity.LabeledSignal;
import org.nowstart.signalforge.data.exception.CalibrationInsufficientDataException;
import org.nowstart.signalforge.data.exception.CalibrationTimeoutException;
import org.nowstart.signalforge.data.property.CalibrationProperties;
import org.nowstart.signalforge.data.type.CalibrationRunStatus;
import org.nowstart.signalforge.data.type.SignalDirection;
import org.nowstart.signalforge.data.type.TradeOutcome;
import org.nowstart.signalforge.repository.LabeledSignalRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Grid-searches the confidence threshold that maximizes {@code winRate * w1 + avgPips * w2} over
 * recently labeled signals and supersedes the active calibration record with the winner.
 */
@Slf4j
@Service
public class ThresholdCalibrationService {

    private final LabeledSignalRepository labeledSignalRepository;
    private final CalibrationRecordStore calibrationRecordStore;
    private final CalibrationRecordHolder calibrationRecordHolder;
    private final CalibrationProperties calibrationProperties;
    private final ExecutorService calibrationExecutor;
    private final Clock clock;
    private final ReentrantLock runLock = new ReentrantLock();

    public ThresholdCalibrationService(
            LabeledSignalRepository labeledSignalRepository,
            CalibrationRecordStore calibrationRecordStore,
            CalibrationRecordHolder calibrationRecordHolder,
            CalibrationProperties calibrationProperties,
            @Qualifier("calibrationExecutor") ExecutorService calibrationExecutor,
            Clock clock
    ) {
        this.labeledSignalRepository = labeledSignalRepository;
        this.calibrationRecordStore = calibrationRecordStore;
        this.calibrationRecordHolder = calibrationRecordHolder;
        this.calibrationProperties = calibrationProperties;
        this.calibrationExecutor = calibrationExecutor;
        this.clock = clock;
    }

    /**
     * Runs one calibration. A run started while another is in progress is rejected without side effects.
     *
     * @throws CalibrationInsufficientDataException when there are too few labeled signals or no threshold qualifies
     * @throws CalibrationTimeoutException          when the historical fetch exceeds its deadline
     */
    public CalibrationRunResult calibrate() {
        if (!runLock.tryLock()) {
            log.warn("event=calibration_rejected reason=already_running");
            return new CalibrationRunResult(
                    CalibrationRunStatus.REJECTED_CONCURRENT_RUN,
                    calibrationRecordHolder.current().orElse(null),
                    List.of(),
                    List.of(),
                    "Calibration already running"
            );
        }
        try {
            return runLocked();
        } finally {
            runLock.unlock();
        }
    }

    private CalibrationRunResult runLocked() {
        Instant now = clock.instant();
        Instant from = now.minus(calibrationProperties.window());
        List<LabeledSignal> signals = fetchLabeledSignals(from);

        if (signals.size() < calibrationProperties.minSamples()) {
            log.warn("event=calibration_skipped reason=insufficient_samples samples={} required={}",
                    signals.size(), calibrationProperties.minSamples());
            throw new CalibrationInsufficientDataException(
                    signals.size(),
                    calibrationProperties.minSamples(),
                    "Need at least " + calibrationProperties.minSamples() + " labeled signals, found " + signals.size()
            );
        }

        List<ThresholdEvaluation> evaluations = evaluateThresholds(signals);
        ThresholdEvaluation best = selectBest(evaluations).orElseThrow(() -> {
            log.warn("event=calibration_skipped reason=no_qualified_threshold samples={}", signals.size());
            return new CalibrationInsufficientDataException(
                    signals.size(),
                    calibrationProperties.minSamples(),
                    "No threshold has at least " + calibrationProperties.minQualifiedSignals() + " qualifying signals"
            );
        });

        CalibrationRecord record = calibrationRecordStore.supersede(best, signals.size(), now);
        calibrationRecordHolder.publish(record);

        log.info(
                "event=calibration_completed version={} threshold={} qualified={} win_rate_pct={} avg_pips={} score={} samples={}",
                record.version(),
                best.threshold(),
                best.qualifiedCount(),
                best.winRate(),
                best.avgPips(),
                best.score(),
                signals.size()
        );

        return new CalibrationRunResult(
                CalibrationRunStatus.COMPLETED,
                record,
                evaluations,
                directionBreakdown(signals, best.threshold()),
                "Threshold calibrated to " + best.threshold()
        );
    }

    List<ThresholdEvaluation> evaluateThresholds(List<LabeledSignal> signals) {
        List<ThresholdEvaluation> evaluations = new ArrayList<>();
        for (int threshold : calibrationProperties.thresholds()) {
            List<LabeledSignal> qualified = signals.stream()
                    .filter(signal -> signal.getConfidence() >= threshold)
                    .toList();
            if (qualified.size() < calibrationProperties.minQualifiedSignals()) {
                continue;
            }

            int wins = (int) qualified.stream().filter(signal -> signal.getOutcome() == TradeOutcome.WIN).count();
            double winRate = wins * 100.0 / qualified.size();
            double avgPips = qualified.stream().mapToDouble(LabeledSignal::realizedPips).average().orElse(0.0);
            double score = winRate * calibrationProperties.winRateWeight() + avgPips * calibrationProperties.avgPipsWeight();
            evaluations.add(new ThresholdEvaluation(threshold, qualified.size(), wins, winRate, avgPips, score));
        }
        return evaluations;
    }

    /**
     * Highest score wins; ties go to the larger sample, then to the lower threshold.
     */
    Optional<ThresholdEvaluation> selectBest(List<ThresholdEvaluation> evaluations) {
        return evaluations.stream().max(
                Comparator.comparingDouble(ThresholdEvaluation::score)
                        .thenComparingInt(ThresholdEvaluation::qualifiedCount)
                        .thenComparing(ThresholdEvaluation::threshold, Comparator.reverseOrder())
        );
    }

    private List<DirectionStats> directionBreakdown(List<LabeledSignal> signals, int threshold) {
        List<DirectionStats> breakdown = new ArrayList<>();
        for (SignalDirection direction : List.of(SignalDirection.BUY, SignalDirection.SELL)) {
            List<LabeledSignal> subset = signals.stream()
                    .filter(signal -> signal.getDirection() == direction && signal.getConfidence() >= threshold)
                    .toList();
            if (subset.isEmpty()) {
                breakdown.add(new DirectionStats(direction, 0, 0.0, 0.0));
                continue;
            }
            long wins = subset.stream().filter(signal -> signal.getOutcome() == TradeOutcome.WIN).count();
            breakdown.add(new DirectionStats(
                    direction,
                    subset.size(),
                    wins * 100.0 / subset.size(),
                    subset.stream().mapToDouble(LabeledSignal::realizedPips).average().orElse(0.0)
            ));
        }
        return breakdown;
    }

    private List<LabeledSignal> fetchLabeledSignals(Instant from) {
        Duration timeout = calibrationProperties.fetchTimeout();
        Future<List<LabeledSignal>> future = calibrationExecutor.submit(
                () -> labeledSignalRepository.findByLabeledAtGreaterThanEqualOrderByLabeledAtAsc(from)
        );
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // interrupts the stalled fetch so the single fetch thread is free for the next run
            future.cancel(true);
            log.warn("event=calibration_fetch_timeout timeout_ms={}", timeout.toMillis());
            throw new CalibrationTimeoutException(timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while fetching labeled signals", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Failed to fetch labeled signals", cause);
        }
    }
}
