package org.nowstart.signalforge.data.type;

public enum MarketRegime {
    TREND,
    RANGE,
    UNCERTAIN
}
