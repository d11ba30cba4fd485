package org.nowstart.signalforge.data.dto;

import java.util.List;
import org.nowstart.signalforge.data.type.SignalDirection;
import org.nowstart.signalforge.data.type.Timeframe;
import org.nowstart.signalforge.strategy.core.OhlcvCandle;

/**
 * @param mlConfidence     prediction-source confidence after clamping
 * @param lastCandle       latest primary-timeframe candle, used for the candle-range volatility band
 * @param granularity      primary timeframe
 * @param timeframeSignals directions reported on other timeframes, may be empty
 */
public record WeightInput(
        String symbol,
        SignalDirection direction,
        double mlConfidence,
        IndicatorSet indicators,
        OhlcvCandle lastCandle,
        Timeframe granularity,
        List<TimeframeSignal> timeframeSignals,
        RiskMetrics riskMetrics
) {

    public WeightInput {
        timeframeSignals = timeframeSignals == null ? List.of() : List.copyOf(timeframeSignals);
        riskMetrics = riskMetrics == null ? RiskMetrics.none() : riskMetrics;
    }
}
