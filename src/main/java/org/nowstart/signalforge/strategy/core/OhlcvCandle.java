package org.nowstart.signalforge.strategy.core;

import java.time.Instant;

public record OhlcvCandle(
        Instant timestamp,
        double open,
        double high,
        double low,
        double close,
        double volume
) {

    public OhlcvCandle {
        if (timestamp == null) {
            throw new IllegalArgumentException("candle timestamp is required");
        }
        if (high < low) {
            throw new IllegalArgumentException("candle high must be >= low at " + timestamp);
        }
    }

    public double typicalPrice() {
        return (high + low + close) / 3.0;
    }
}
