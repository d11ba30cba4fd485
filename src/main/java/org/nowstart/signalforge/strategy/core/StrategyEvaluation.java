package org.nowstart.signalforge.strategy.core;

import java.util.List;
import org.nowstart.signalforge.data.dto.CandidateSignal;
import org.nowstart.signalforge.data.dto.IndicatorSet;
import org.nowstart.signalforge.data.dto.RegimeClassification;
import org.nowstart.signalforge.data.dto.SessionLevels;

/**
 * Immutable output of one strategy evaluation.
 *
 * @param candidate   selected direction, base confidence and reasons
 * @param indicators  indicator values the decision was made on
 * @param regime      regime classification of the primary timeframe
 * @param levels      session levels at evaluation time
 * @param entryPrice  mid price (or last close when no quote was supplied)
 * @param spread      ask minus bid, 0 without a quote
 * @param diagnostics explainability values for logging
 */
public record StrategyEvaluation(
        CandidateSignal candidate,
        IndicatorSet indicators,
        RegimeClassification regime,
        SessionLevels levels,
        double entryPrice,
        double spread,
        List<StrategyDiagnostic> diagnostics
) {

    public StrategyEvaluation {
        if (candidate == null) {
            throw new IllegalArgumentException("candidate is required");
        }
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }
}
