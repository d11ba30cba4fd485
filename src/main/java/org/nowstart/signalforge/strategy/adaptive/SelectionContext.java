package org.nowstart.signalforge.strategy.adaptive;

import org.nowstart.signalforge.data.dto.IndicatorSet;
import org.nowstart.signalforge.data.dto.RegimeClassification;
import org.nowstart.signalforge.data.dto.SessionLevels;

/**
 * Everything the selector reads. Built by {@link AdaptiveStrategyEngine} from candles.
 */
public record SelectionContext(
        String symbol,
        double price,
        IndicatorSet indicators,
        RegimeClassification regime,
        SessionLevels levels
) {
}
