package org.nowstart.signalforge.data.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Instant;
import org.nowstart.signalforge.strategy.core.OhlcvCandle;

public record CandleDto(
        @NotNull Instant timestamp,
        @PositiveOrZero double open,
        @PositiveOrZero double high,
        @PositiveOrZero double low,
        @PositiveOrZero double close,
        @PositiveOrZero double volume
) {

    public OhlcvCandle toCandle() {
        return new OhlcvCandle(timestamp, open, high, low, close, volume);
    }
}
