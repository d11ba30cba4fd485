package org.nowstart.signalforge.service.modulation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.signalforge.data.dto.CalibrationRecord;
import org.nowstart.signalforge.data.dto.CandidateSignal;
import org.nowstart.signalforge.data.dto.ExternalPrediction;
import org.nowstart.signalforge.data.dto.ModulatedSignal;
import org.nowstart.signalforge.data.dto.ModulationInput;
import org.nowstart.signalforge.data.dto.PredictionSource;
import org.nowstart.signalforge.data.dto.SentimentOverlayResult;
import org.nowstart.signalforge.data.dto.WeightInput;
import org.nowstart.signalforge.data.dto.WeightResult;
import org.nowstart.signalforge.data.property.ModulationProperties;
import org.nowstart.signalforge.data.type.SignalDirection;
import org.nowstart.signalforge.service.calibration.CalibrationRecordHolder;
import org.nowstart.signalforge.strategy.core.StrategyEvaluation;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class ConfidenceModulationService {

    private final ModulationProperties modulationProperties;
    private final TechnicalConfidenceCalculator technicalConfidenceCalculator;
    private final SignalWeightCalculator signalWeightCalculator;
    private final SentimentOverlayService sentimentOverlayService;
    private final CalibrationRecordHolder calibrationRecordHolder;

    public ModulatedSignal modulate(ModulationInput input) {
        StrategyEvaluation evaluation = input.evaluation();
        CandidateSignal candidate = evaluation.candidate();
        List<String> reasons = new ArrayList<>();

        PredictionSource source = resolveSource(input.prediction(), evaluation);
        reasons.add(source.describe());

        SignalDirection direction = resolveDirection(candidate.direction(), source, reasons);
        double signalConfidence = Math.max(
                modulationProperties.minSignalConfidence(),
                Math.min(modulationProperties.maxSignalConfidence(), source.confidence())
        );

        WeightResult weight = signalWeightCalculator.calculate(new WeightInput(
                candidate.symbol(),
                direction,
                signalConfidence,
                evaluation.indicators(),
                input.lastCandle(),
                input.granularity(),
                input.timeframeSignals(),
                input.riskMetrics()
        ));
        reasons.addAll(weight.reasons());

        double finalIntensity;
        if (input.sentiment() != null) {
            SentimentOverlayResult overlay = sentimentOverlayService.apply(
                    weight.positionSizeMultiplier(),
                    signalConfidence,
                    input.sentiment()
            );
            finalIntensity = overlay.finalIntensity();
            reasons.add(String.format(
                    Locale.ROOT,
                    "Sentiment overlay: multiplier %.3f, risk penalty %.3f, confidence bonus %.3f -> intensity %.2f",
                    overlay.sentimentMultiplier(),
                    overlay.riskPenalty(),
                    overlay.confidenceBonus(),
                    finalIntensity
            ));
        } else {
            finalIntensity = sentimentOverlayService.clampIntensity(weight.positionSizeMultiplier());
        }

        Optional<CalibrationRecord> calibration = calibrationRecordHolder.current();
        double threshold = calibration.map(CalibrationRecord::threshold).orElse(modulationProperties.defaultThreshold());
        Long calibrationVersion = calibration.map(CalibrationRecord::version).orElse(null);
        boolean marketClosed = evaluation.levels() != null && evaluation.levels().marketClosed();
        boolean actionable = weight.totalWeight() >= threshold && !marketClosed;
        reasons.add(String.format(
                Locale.ROOT,
                "Threshold %.0f (%s): %s",
                threshold,
                calibrationVersion == null ? "default" : "calibration v" + calibrationVersion,
                actionable ? "actionable" : "below threshold or market closed"
        ));

        return new ModulatedSignal(
                candidate,
                direction,
                signalConfidence,
                weight.totalWeight(),
                weight.recommendation(),
                weight.positionSizeMultiplier(),
                finalIntensity,
                weight.factors(),
                source,
                threshold,
                calibrationVersion,
                actionable,
                reasons
        );
    }

    private PredictionSource resolveSource(ExternalPrediction prediction, StrategyEvaluation evaluation) {
        if (prediction != null && prediction.modelAvailable()) {
            return new PredictionSource.External(prediction.direction(), prediction.confidence());
        }
        return new PredictionSource.TechnicalFallback(technicalConfidenceCalculator.calculate(
                evaluation.candidate().direction(),
                evaluation.indicators(),
                evaluation.regime().regime()
        ));
    }

    /**
     * A confident external prediction pointing the other way flips the candidate direction.
     */
    private SignalDirection resolveDirection(SignalDirection candidateDirection, PredictionSource source, List<String> reasons) {
        if (!(source instanceof PredictionSource.External external)) {
            return candidateDirection;
        }
        boolean decisive = Math.abs(external.confidence() - 50.0) > modulationProperties.predictionOverrideDistance();
        if (decisive && external.direction() != SignalDirection.HOLD && external.direction() != candidateDirection) {
            log.info("event=prediction_override from={} to={} prediction_confidence={}",
                    candidateDirection, external.direction(), external.confidence());
            reasons.add("Prediction override " + candidateDirection + " -> " + external.direction());
            return external.direction();
        }
        return candidateDirection;
    }
}
