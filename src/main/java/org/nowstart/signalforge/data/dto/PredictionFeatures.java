package org.nowstart.signalforge.data.dto;

public record PredictionFeatures(
        double close,
        double rsi,
        double ema12,
        double ema21,
        double ema50,
        double atr,
        double adx,
        double price
) {

    public static PredictionFeatures from(IndicatorSet indicators, double price) {
        return new PredictionFeatures(
                indicators.lastClose(),
                indicators.rsi(),
                indicators.emaFast(),
                indicators.emaSlow(),
                indicators.emaMid(),
                indicators.atr(),
                indicators.adx(),
                price
        );
    }
}
