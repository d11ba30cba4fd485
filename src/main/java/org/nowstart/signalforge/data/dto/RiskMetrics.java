package org.nowstart.signalforge.data.dto;

/**
 * @param drawdownPercent current account drawdown in percent
 * @param symbolWinRate   recent win rate of the symbol in percent, null when unknown
 */
public record RiskMetrics(
        double drawdownPercent,
        Double symbolWinRate
) {

    public static RiskMetrics none() {
        return new RiskMetrics(0.0, null);
    }
}
