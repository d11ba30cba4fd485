package org.nowstart.signalforge.data.dto;

import org.nowstart.signalforge.data.type.SignalDirection;
import org.nowstart.signalforge.data.type.StrategyMode;
import org.nowstart.signalforge.data.type.SymbolClass;

/**
 * Inputs for stop/target placement. {@code meanReversionTarget}, {@code structuralHigh} and
 * {@code structuralLow} are NaN when unavailable.
 */
public record RiskInput(
        SignalDirection direction,
        StrategyMode mode,
        SymbolClass symbolClass,
        double entryPrice,
        double atr,
        double spread,
        double meanReversionTarget,
        double structuralHigh,
        double structuralLow
) {

    public RiskInput {
        if (direction == null || direction == SignalDirection.HOLD) {
            throw new IllegalArgumentException("risk direction must be BUY or SELL");
        }
        if (!(entryPrice > 0.0)) {
            throw new IllegalArgumentException("entryPrice must be positive");
        }
        if (!(atr >= 0.0) || !(spread >= 0.0)) {
            throw new IllegalArgumentException("atr and spread must be non-negative");
        }
    }
}
