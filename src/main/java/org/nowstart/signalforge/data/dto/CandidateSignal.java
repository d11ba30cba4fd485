package org.nowstart.signalforge.data.dto;

import java.util.List;
import org.nowstart.signalforge.data.type.SignalDirection;
import org.nowstart.signalforge.data.type.StrategyMode;

/**
 * Selector output before modulation. Structural hints are NaN when absent.
 */
public record CandidateSignal(
        String symbol,
        SignalDirection direction,
        double baseConfidence,
        StrategyMode mode,
        List<String> reasons,
        double structuralStopHint,
        double structuralTargetHint
) {

    public CandidateSignal {
        if (direction == null || direction == SignalDirection.HOLD) {
            throw new IllegalArgumentException("candidate direction must be BUY or SELL");
        }
        if (!(baseConfidence >= 0.0 && baseConfidence <= 100.0)) {
            throw new IllegalArgumentException("baseConfidence must be within [0, 100]");
        }
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }
}
