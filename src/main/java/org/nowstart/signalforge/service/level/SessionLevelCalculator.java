package org.nowstart.signalforge.service.level;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.nowstart.signalforge.data.dto.InitialBalance;
import org.nowstart.signalforge.data.dto.SessionLevels;
import org.nowstart.signalforge.data.property.RiskProperties;
import org.nowstart.signalforge.data.property.SessionProperties;
import org.nowstart.signalforge.data.property.SessionProperties.SessionWindow;
import org.nowstart.signalforge.data.type.SymbolClass;
import org.nowstart.signalforge.strategy.core.OhlcvCandle;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SessionLevelCalculator {

    public static final String CLOSED_SESSION = "CLOSED";

    private static final double GRID_EPSILON = 1e-9;

    private final SessionProperties sessionProperties;
    private final RiskProperties riskProperties;

    public SessionLevels calculate(List<OhlcvCandle> candles, double price, SymbolClass symbolClass, Instant asOf) {
        ZonedDateTime now = asOf.atZone(sessionProperties.zone());
        Optional<SessionWindow> activeSession = resolveActiveSession(now.getHour());

        InitialBalance initialBalance = activeSession
                .filter(SessionWindow::hasInitialBalance)
                .flatMap(session -> initialBalance(candles, session, now))
                .orElse(null);

        double[] previousPeriod = previousPeriodRange(candles, now.toLocalDate());
        double step = riskProperties.instrument(symbolClass).roundNumberStep();

        return new SessionLevels(
                initialBalance,
                previousPeriod[0],
                previousPeriod[1],
                roundNumberAbove(price, step),
                roundNumberBelow(price, step),
                activeSession.map(SessionWindow::name).orElse(CLOSED_SESSION),
                resolveOpenBreakoutSession(now),
                isMarketClosed(asOf)
        );
    }

    public Optional<SessionWindow> resolveActiveSession(int hour) {
        return sessionProperties.sessions().stream()
                .filter(session -> session.contains(hour))
                .findFirst();
    }

    /**
     * High/low of the evaluation day's candles inside {@code [ibStart, ibStart + duration)}.
     */
    public Optional<InitialBalance> initialBalance(List<OhlcvCandle> candles, SessionWindow session, ZonedDateTime now) {
        ZonedDateTime start = now.toLocalDate().atTime(session.ibStartHour(), 0).atZone(now.getZone());
        Instant from = start.toInstant();
        Instant to = start.plus(sessionProperties.initialBalanceDuration()).toInstant();

        double high = Double.NEGATIVE_INFINITY;
        double low = Double.POSITIVE_INFINITY;
        boolean found = false;
        for (OhlcvCandle candle : candles) {
            Instant ts = candle.timestamp();
            if (ts.isBefore(from) || !ts.isBefore(to) || ts.isAfter(now.toInstant())) {
                continue;
            }
            high = Math.max(high, candle.high());
            low = Math.min(low, candle.low());
            found = true;
        }
        return found ? Optional.of(new InitialBalance(session.name(), high, low)) : Optional.empty();
    }

    public List<OhlcvCandle> sameDayCandles(List<OhlcvCandle> candles, Instant asOf) {
        LocalDate today = asOf.atZone(sessionProperties.zone()).toLocalDate();
        return candles.stream()
                .filter(candle -> candle.timestamp().atZone(sessionProperties.zone()).toLocalDate().equals(today))
                .toList();
    }

    public boolean isMarketClosed(Instant asOf) {
        ZonedDateTime now = asOf.atZone(sessionProperties.zone());
        DayOfWeek day = now.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            return true;
        }
        return day == DayOfWeek.FRIDAY && now.getHour() >= sessionProperties.fridayCloseHour();
    }

    public double roundNumberAbove(double price, double step) {
        return Math.ceil(snapToGrid(price / step)) * step;
    }

    public double roundNumberBelow(double price, double step) {
        return Math.floor(snapToGrid(price / step)) * step;
    }

    /**
     * Session whose open-breakout window {@code [ibStart + ibDuration, + breakoutWindow)} contains {@code now}.
     */
    private String resolveOpenBreakoutSession(ZonedDateTime now) {
        for (SessionWindow session : sessionProperties.sessions()) {
            if (!session.hasInitialBalance()) {
                continue;
            }
            ZonedDateTime windowStart = now.toLocalDate()
                    .atTime(session.ibStartHour(), 0)
                    .atZone(now.getZone())
                    .plus(sessionProperties.initialBalanceDuration());
            ZonedDateTime windowEnd = windowStart.plus(sessionProperties.breakoutWindow());
            if (!now.isBefore(windowStart) && now.isBefore(windowEnd)) {
                return session.name();
            }
        }
        return null;
    }

    /**
     * High/low of the most recent day before the evaluation date that has candles. NaN pair when none.
     */
    private double[] previousPeriodRange(List<OhlcvCandle> candles, LocalDate today) {
        LocalDate previousDate = null;
        for (OhlcvCandle candle : candles) {
            LocalDate date = candle.timestamp().atZone(sessionProperties.zone()).toLocalDate();
            if (date.isBefore(today) && (previousDate == null || date.isAfter(previousDate))) {
                previousDate = date;
            }
        }
        if (previousDate == null) {
            return new double[] {Double.NaN, Double.NaN};
        }

        double high = Double.NEGATIVE_INFINITY;
        double low = Double.POSITIVE_INFINITY;
        for (OhlcvCandle candle : candles) {
            if (candle.timestamp().atZone(sessionProperties.zone()).toLocalDate().equals(previousDate)) {
                high = Math.max(high, candle.high());
                low = Math.min(low, candle.low());
            }
        }
        return new double[] {high, low};
    }

    private double snapToGrid(double ratio) {
        double nearest = Math.rint(ratio);
        return Math.abs(ratio - nearest) < GRID_EPSILON ? nearest : ratio;
    }
}
