package org.nowstart.signalforge.data.dto;

public record ThresholdEvaluation(
        int threshold,
        int qualifiedCount,
        int wins,
        double winRate,
        double avgPips,
        double score
) {
}
