package org.nowstart.signalforge.strategy.core;

import org.nowstart.signalforge.data.type.Timeframe;

/**
 * Parameter set consumed by a {@link SignalStrategyEngine}.
 */
public interface StrategyParams {

    /**
     * Timeframe whose last candle the signal is generated on.
     */
    Timeframe primaryTimeframe();
}
