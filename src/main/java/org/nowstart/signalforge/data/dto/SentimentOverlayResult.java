package org.nowstart.signalforge.data.dto;

public record SentimentOverlayResult(
        double sentimentMultiplier,
        double riskPenalty,
        double confidenceBonus,
        double finalIntensity
) {
}
