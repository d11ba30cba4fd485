package org.nowstart.signalforge.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PredictionResponse(
        String prediction,
        Double confidence,
        Boolean model_available
) {
}
