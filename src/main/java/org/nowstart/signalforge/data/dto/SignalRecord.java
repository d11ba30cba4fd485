package org.nowstart.signalforge.data.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.nowstart.signalforge.data.type.MarketRegime;
import org.nowstart.signalforge.data.type.Recommendation;
import org.nowstart.signalforge.data.type.SignalDirection;
import org.nowstart.signalforge.data.type.StrategyMode;

public record SignalRecord(
        String symbol,
        SignalDirection direction,
        double confidence,
        Recommendation recommendation,
        double positionSizeMultiplier,
        double finalIntensity,
        double entryPrice,
        double stopLoss,
        double takeProfit,
        double riskRewardRatio,
        double stopDistancePips,
        MarketRegime regime,
        StrategyMode mode,
        double adx,
        double choppiness,
        boolean actionable,
        double threshold,
        Long calibrationVersion,
        String strategyVersion,
        Instant generatedAt,
        List<String> reasons,
        Map<String, Object> diagnostics
) {
}
