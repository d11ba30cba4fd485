package org.nowstart.signalforge.data.dto;

import java.util.LinkedHashMap;
import java.util.Map;
import org.nowstart.signalforge.data.type.TrendBias;

/**
 * Indicator snapshot for one evaluation. Fast/slow EMA, RSI, ADX, choppiness and VWAP come from
 * the primary timeframe; mid EMA and ATR from the structure timeframe.
 */
public record IndicatorSet(
        double emaFast,
        double emaSlow,
        double emaMid,
        double rsi,
        double atr,
        double atrPercent,
        double adx,
        double choppiness,
        boolean choppinessDegenerate,
        double vwap,
        TrendBias structureTrend,
        TrendBias higherTrend,
        double lastClose
) {

    public Map<String, Double> asMap() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("ema_fast", emaFast);
        values.put("ema_slow", emaSlow);
        values.put("ema_mid", emaMid);
        values.put("rsi", rsi);
        values.put("atr", atr);
        values.put("atr_percent", atrPercent);
        values.put("adx", adx);
        values.put("choppiness", choppiness);
        values.put("vwap", vwap);
        return values;
    }

    public boolean bullishEmaStack() {
        return emaFast > emaSlow;
    }

    public boolean bearishEmaStack() {
        return emaFast < emaSlow;
    }
}
