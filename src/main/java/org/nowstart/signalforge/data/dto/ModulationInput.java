package org.nowstart.signalforge.data.dto;

import java.util.List;
import org.nowstart.signalforge.data.type.Timeframe;
import org.nowstart.signalforge.strategy.core.OhlcvCandle;
import org.nowstart.signalforge.strategy.core.StrategyEvaluation;

/**
 * @param prediction external prediction, null when unavailable
 * @param sentiment  sentiment overlay input, null to skip the overlay
 */
public record ModulationInput(
        StrategyEvaluation evaluation,
        OhlcvCandle lastCandle,
        Timeframe granularity,
        ExternalPrediction prediction,
        SentimentAssessment sentiment,
        List<TimeframeSignal> timeframeSignals,
        RiskMetrics riskMetrics
) {

    public ModulationInput {
        if (evaluation == null) {
            throw new IllegalArgumentException("evaluation is required");
        }
        timeframeSignals = timeframeSignals == null ? List.of() : List.copyOf(timeframeSignals);
        riskMetrics = riskMetrics == null ? RiskMetrics.none() : riskMetrics;
    }
}
