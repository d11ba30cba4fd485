package org.nowstart.signalforge.data.type;

/**
 * States of the adaptive strategy selector. Every path ends in {@link #EMIT}.
 */
public enum SelectorState {
    TREND_BUY_EVAL,
    TREND_SELL_EVAL,
    RANGE_BUY_EVAL,
    RANGE_SELL_EVAL,
    FALLBACK_EVAL,
    EMIT;

    public static SelectorState initial(MarketRegime regime) {
        return switch (regime) {
            case TREND -> TREND_BUY_EVAL;
            case RANGE -> RANGE_BUY_EVAL;
            case UNCERTAIN -> FALLBACK_EVAL;
        };
    }

    public boolean terminal() {
        return this == EMIT;
    }
}
