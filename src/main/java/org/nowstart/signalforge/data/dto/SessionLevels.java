package org.nowstart.signalforge.data.dto;

/**
 * Session-derived price levels at evaluation time.
 *
 * @param initialBalance      IB of the active session, null when none is formed
 * @param previousPeriodHigh  previous day high, NaN without previous-day candles
 * @param previousPeriodLow   previous day low, NaN without previous-day candles
 * @param roundNumberAbove    nearest grid level at or above price
 * @param roundNumberBelow    nearest grid level at or below price
 * @param activeSession       name of the session active at evaluation time, {@code CLOSED} otherwise
 * @param openBreakoutSession session whose opening-breakout window is open, null otherwise
 * @param marketClosed        weekend or after the Friday close
 */
public record SessionLevels(
        InitialBalance initialBalance,
        double previousPeriodHigh,
        double previousPeriodLow,
        double roundNumberAbove,
        double roundNumberBelow,
        String activeSession,
        String openBreakoutSession,
        boolean marketClosed
) {

    public boolean hasInitialBalance() {
        return initialBalance != null;
    }

    public boolean hasPreviousPeriod() {
        return Double.isFinite(previousPeriodHigh) && Double.isFinite(previousPeriodLow);
    }

    public boolean inOpenBreakoutWindow() {
        return openBreakoutSession != null;
    }
}
