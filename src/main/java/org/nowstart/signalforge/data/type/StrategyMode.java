package org.nowstart.signalforge.data.type;

public enum StrategyMode {
    TREND,
    RANGE,
    FALLBACK
}
