package org.nowstart.signalforge.data.dto;

import java.util.List;
import org.nowstart.signalforge.data.type.Recommendation;
import org.nowstart.signalforge.data.type.SignalDirection;

/**
 * @param direction          final direction, differs from the candidate only on a prediction override
 * @param signalConfidence   prediction-source confidence clamped to the configured signal band
 * @param finalConfidence    weighted total in [0, 100]
 * @param calibrationVersion version of the calibration record used, null when the default threshold applied
 * @param actionable         final confidence reached the threshold and the market is open
 */
public record ModulatedSignal(
        CandidateSignal candidate,
        SignalDirection direction,
        double signalConfidence,
        double finalConfidence,
        Recommendation recommendation,
        double positionSizeMultiplier,
        double finalIntensity,
        ModulationFactors factors,
        PredictionSource predictionSource,
        double threshold,
        Long calibrationVersion,
        boolean actionable,
        List<String> reasons
) {

    public ModulatedSignal {
        if (!(finalConfidence >= 0.0 && finalConfidence <= 100.0)) {
            throw new IllegalArgumentException("finalConfidence must be within [0, 100]");
        }
        if (!(finalIntensity >= 0.1 && finalIntensity <= 2.0)) {
            throw new IllegalArgumentException("finalIntensity must be within [0.1, 2.0]");
        }
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }
}
