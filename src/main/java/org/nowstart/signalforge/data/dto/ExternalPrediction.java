package org.nowstart.signalforge.data.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import org.nowstart.signalforge.data.type.SignalDirection;

public record ExternalPrediction(
        @NotNull SignalDirection direction,
        @DecimalMin("0") @DecimalMax("100") double confidence,
        boolean modelAvailable
) {
}
