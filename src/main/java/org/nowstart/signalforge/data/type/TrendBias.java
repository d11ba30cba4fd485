package org.nowstart.signalforge.data.type;

public enum TrendBias {
    BULLISH,
    BEARISH;

    public boolean agrees(SignalDirection direction) {
        return (this == BULLISH && direction == SignalDirection.BUY)
                || (this == BEARISH && direction == SignalDirection.SELL);
    }
}
