package org.nowstart.signalforge.data.dto;

import java.util.List;

public record RiskLevels(
        double entryPrice,
        double stopLoss,
        double takeProfit,
        double riskRewardRatio,
        double stopDistancePips,
        boolean corrected,
        List<String> reasons
) {

    public RiskLevels {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }
}
