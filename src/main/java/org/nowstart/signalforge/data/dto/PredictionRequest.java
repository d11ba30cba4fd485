package org.nowstart.signalforge.data.dto;

public record PredictionRequest(
        String symbol,
        PredictionFeatures features
) {
}
