package org.nowstart.signalforge.strategy.adaptive;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.nowstart.signalforge.data.dto.CandidateSignal;
import org.nowstart.signalforge.data.dto.IndicatorSet;
import org.nowstart.signalforge.data.dto.InitialBalance;
import org.nowstart.signalforge.data.dto.RegimeClassification;
import org.nowstart.signalforge.data.dto.SessionLevels;
import org.nowstart.signalforge.data.type.MarketRegime;
import org.nowstart.signalforge.data.type.SignalDirection;
import org.nowstart.signalforge.data.type.StrategyMode;
import org.nowstart.signalforge.data.type.TrendBias;

@ExtendWith(OutputCaptureExtension.class)
class AdaptiveStrategySelectorTest {

    private static final RegimeClassification TREND = new RegimeClassification(MarketRegime.TREND, 30, 40);
    private static final RegimeClassification RANGE = new RegimeClassification(MarketRegime.RANGE, 15, 65);
    private static final RegimeClassification UNCERTAIN = new RegimeClassification(MarketRegime.UNCERTAIN, 20, 55);

    private final AdaptiveStrategySelector selector = new AdaptiveStrategySelector();
    private final AdaptiveStrategyParams params = AdaptiveStrategyParams.defaults();

    @Test
    void select_trendBuyWithAlignedTimeframes() {
        CandidateSignal candidate = select(1.0873, bullishTrend(), TREND, levels(null, Double.NaN, Double.NaN, null, false));

        assertThat(candidate.direction()).isEqualTo(SignalDirection.BUY);
        assertThat(candidate.mode()).isEqualTo(StrategyMode.TREND);
        assertThat(candidate.baseConfidence()).isEqualTo(70.0);
        assertThat(candidate.reasons()).anyMatch(reason -> reason.startsWith("Regime TREND"));
        assertThat(candidate.reasons()).anyMatch(reason -> reason.contains("aligned (+10)"));
        assertThat(candidate.structuralStopHint()).isNaN();
    }

    @Test
    void select_trendBuyOpeningBreakoutIsCappedAtHundred() {
        SessionLevels levels = levels(new InitialBalance("LONDON", 1.0865, 1.0840), Double.NaN, Double.NaN, "LONDON", false);

        CandidateSignal candidate = select(1.0873, bullishTrend(), TREND, levels);

        assertThat(candidate.baseConfidence()).isEqualTo(100.0);
        assertThat(candidate.reasons()).contains("Confidence capped at 100 (adjusted 105)");
        assertThat(candidate.reasons()).anyMatch(reason -> reason.contains("initial balance breakout above"));
        assertThat(candidate.reasons()).anyMatch(reason -> reason.contains("opening breakout confirmed by M15 (+20)"));
        assertThat(candidate.structuralStopHint()).isEqualTo(1.0840);
    }

    @Test
    void select_trendBuyNearPreviousDayHighIsPenalized() {
        CandidateSignal candidate = select(1.0873, bullishTrend(), TREND, levels(null, 1.0880, 1.0700, null, false));

        assertThat(candidate.baseConfidence()).isEqualTo(60.0);
        assertThat(candidate.reasons()).anyMatch(reason -> reason.startsWith("Near previous day high"));
    }

    @Test
    void select_trendSellWhenBearishStackAndHigherTimeframeAgree() {
        IndicatorSet indicators = indicators(1.0832, 1.0840, 1.0900, 42, 0.11, 1.0845, TrendBias.BEARISH, TrendBias.BEARISH, false);

        CandidateSignal candidate = select(1.0827, indicators, TREND, levels(null, Double.NaN, Double.NaN, null, false));

        assertThat(candidate.direction()).isEqualTo(SignalDirection.SELL);
        assertThat(candidate.mode()).isEqualTo(StrategyMode.TREND);
        assertThat(candidate.baseConfidence()).isEqualTo(70.0);
    }

    @Test
    void select_rangeBuyAtInitialBalanceLowTargetsVwap() {
        IndicatorSet indicators = indicators(1.0860, 1.0862, 1.0870, 30, 0.06, 1.0875, TrendBias.BEARISH, TrendBias.BULLISH, false);
        SessionLevels levels = levels(new InitialBalance("LONDON", 1.0900, 1.0850), Double.NaN, Double.NaN, null, false);

        CandidateSignal candidate = select(1.0851, indicators, RANGE, levels);

        assertThat(candidate.direction()).isEqualTo(SignalDirection.BUY);
        assertThat(candidate.mode()).isEqualTo(StrategyMode.RANGE);
        assertThat(candidate.baseConfidence()).isEqualTo(60.0);
        assertThat(candidate.structuralTargetHint()).isEqualTo(1.0875);
        assertThat(candidate.structuralStopHint()).isEqualTo(1.0850);
        assertThat(candidate.reasons()).anyMatch(reason -> reason.startsWith("Round number support"));
        assertThat(candidate.reasons()).anyMatch(reason -> reason.startsWith("Low volatility"));
    }

    @Test
    void select_rangeBuyWithPreviousDayLowConfluence() {
        IndicatorSet indicators = indicators(1.0860, 1.0862, 1.0870, 30, 0.06, 1.0875, TrendBias.BEARISH, TrendBias.BULLISH, false);
        SessionLevels levels = levels(new InitialBalance("LONDON", 1.0900, 1.0850), 1.0950, 1.0845, null, false);

        CandidateSignal candidate = select(1.0851, indicators, RANGE, levels);

        assertThat(candidate.baseConfidence()).isEqualTo(75.0);
        assertThat(candidate.reasons()).anyMatch(reason -> reason.startsWith("Previous day low confluence"));
    }

    @Test
    void select_rangeSellAtInitialBalanceHigh() {
        IndicatorSet indicators = indicators(1.0880, 1.0878, 1.0870, 70, 0.06, 1.0875, TrendBias.BULLISH, TrendBias.BULLISH, false);
        SessionLevels levels = levels(new InitialBalance("NEW_YORK", 1.0900, 1.0850), Double.NaN, Double.NaN, null, false);

        CandidateSignal candidate = select(1.0899, indicators, RANGE, levels);

        assertThat(candidate.direction()).isEqualTo(SignalDirection.SELL);
        assertThat(candidate.mode()).isEqualTo(StrategyMode.RANGE);
        assertThat(candidate.baseConfidence()).isEqualTo(60.0);
    }

    @Test
    void select_rangeWithoutInitialBalanceFallsBack() {
        CandidateSignal candidate = select(1.0873, bullishTrend(), RANGE, levels(null, Double.NaN, Double.NaN, null, false));

        assertThat(candidate.mode()).isEqualTo(StrategyMode.FALLBACK);
        assertThat(candidate.direction()).isEqualTo(SignalDirection.BUY);
        assertThat(candidate.baseConfidence()).isEqualTo(45.0);
        assertThat(candidate.reasons()).anyMatch(reason -> reason.startsWith("No initial balance"));
    }

    @Test
    void select_uncertainFallbackIsClampedToFloor() {
        IndicatorSet indicators = indicators(1.0860, 1.0868, 1.0870, 50, 0.02, 1.0855, TrendBias.BEARISH, TrendBias.BULLISH, false);

        CandidateSignal candidate = select(1.0873, indicators, UNCERTAIN, levels(null, Double.NaN, Double.NaN, null, false));

        assertThat(candidate.mode()).isEqualTo(StrategyMode.FALLBACK);
        assertThat(candidate.direction()).isEqualTo(SignalDirection.SELL);
        assertThat(candidate.baseConfidence()).isEqualTo(40.0);
        assertThat(candidate.reasons()).anyMatch(reason -> reason.startsWith("Uncertain regime"));
        assertThat(candidate.reasons()).last().isEqualTo("Confidence floored at 40 (adjusted 22)");
    }

    @Test
    void select_fallbackConfidenceStaysWithinBand() {
        for (RegimeClassification regime : new RegimeClassification[] {TREND, RANGE, UNCERTAIN}) {
            for (double atrPercent : new double[] {0.01, 0.06, 0.2}) {
                IndicatorSet indicators = indicators(1.0860, 1.0862, 1.0870, 50, atrPercent, 1.0900, TrendBias.BEARISH, TrendBias.BULLISH, false);

                CandidateSignal candidate = select(1.0873, indicators, regime, levels(null, Double.NaN, Double.NaN, null, false));

                assertThat(candidate.mode()).isEqualTo(StrategyMode.FALLBACK);
                assertThat(candidate.baseConfidence()).isBetween(40.0, 45.0);
            }
        }
    }

    @Test
    void select_notesDegenerateChoppinessAndClosedMarket(CapturedOutput output) {
        IndicatorSet indicators = indicators(1.0868, 1.0860, 1.0800, 58, 0.11, 1.0855, TrendBias.BULLISH, TrendBias.BULLISH, true);

        CandidateSignal candidate = select(1.0873, indicators, UNCERTAIN, levels(null, Double.NaN, Double.NaN, null, true));

        assertThat(candidate.direction()).isNotEqualTo(SignalDirection.HOLD);
        assertThat(candidate.reasons()).anyMatch(reason -> reason.startsWith("Choppiness window has no price range"));
        assertThat(candidate.reasons()).anyMatch(reason -> reason.startsWith("Market closed"));
        assertThat(output.getOut()).contains("event=degenerate_choppiness symbol=EURUSD choppiness=55.0 regime=UNCERTAIN");
    }

    @Test
    void select_fallbackWithinBandRecordsNoClamp() {
        CandidateSignal candidate = select(1.0873, bullishTrend(), RANGE, levels(null, Double.NaN, Double.NaN, null, false));

        assertThat(candidate.baseConfidence()).isEqualTo(45.0);
        assertThat(candidate.reasons()).noneMatch(reason -> reason.startsWith("Confidence floored")
                || reason.startsWith("Confidence capped"));
    }

    private CandidateSignal select(double price, IndicatorSet indicators, RegimeClassification regime, SessionLevels levels) {
        return selector.select(new SelectionContext("EURUSD", price, indicators, regime, levels), params);
    }

    private IndicatorSet bullishTrend() {
        return indicators(1.0868, 1.0860, 1.0800, 58, 0.11, 1.0855, TrendBias.BULLISH, TrendBias.BULLISH, false);
    }

    private IndicatorSet indicators(
            double emaFast,
            double emaSlow,
            double emaMid,
            double rsi,
            double atrPercent,
            double vwap,
            TrendBias structure,
            TrendBias higher,
            boolean degenerate
    ) {
        return new IndicatorSet(emaFast, emaSlow, emaMid, rsi, 0.0012, atrPercent, 30, 40, degenerate, vwap, structure, higher, 1.0870);
    }

    private SessionLevels levels(InitialBalance ib, double pdh, double pdl, String openBreakoutSession, boolean marketClosed) {
        return new SessionLevels(ib, pdh, pdl, 1.090, 1.085, "LONDON", openBreakoutSession, marketClosed);
    }
}
