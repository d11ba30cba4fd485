package org.nowstart.signalforge.data.type;

public enum SignalDirection {
    BUY,
    SELL,
    HOLD;

    public SignalDirection opposite() {
        return switch (this) {
            case BUY -> SELL;
            case SELL -> BUY;
            case HOLD -> HOLD;
        };
    }
}
