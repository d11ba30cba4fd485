package org.nowstart.signalforge.data.dto;

import jakarta.validation.constraints.NotNull;
import org.nowstart.signalforge.data.type.SignalDirection;
import org.nowstart.signalforge.data.type.Timeframe;

public record TimeframeSignal(
        @NotNull Timeframe timeframe,
        @NotNull SignalDirection direction
) {
}
