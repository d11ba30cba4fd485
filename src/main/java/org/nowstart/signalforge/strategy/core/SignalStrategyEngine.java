package org.nowstart.signalforge.strategy.core;

import java.util.Map;
import org.nowstart.signalforge.data.type.Timeframe;

/**
 * Versioned signal strategy contract.
 *
 * @param <P> parameter type consumed by the strategy implementation
 */
public interface SignalStrategyEngine<P extends StrategyParams> {

    /**
     * Returns the strategy version key (for example {@code adaptive-v1}).
     */
    String version();

    /**
     * Returns the runtime class for parameter binding/validation.
     */
    Class<P> parameterType();

    /**
     * Returns the minimum candle count required per timeframe.
     */
    Map<Timeframe, Integer> requiredHistory(P params);

    /**
     * Evaluates the latest candles and returns a candidate signal plus diagnostics.
     *
     * @throws org.nowstart.signalforge.data.exception.InsufficientDataException when a timeframe is too short
     */
    StrategyEvaluation evaluate(StrategyInput<P> input);
}
