package org.nowstart.signalforge.data.type;

public enum TradeOutcome {
    WIN,
    LOSS
}
