package org.nowstart.signalforge.strategy.adaptive;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.signalforge.data.dto.CandidateSignal;
import org.nowstart.signalforge.data.dto.IndicatorSet;
import org.nowstart.signalforge.data.dto.InitialBalance;
import org.nowstart.signalforge.data.dto.SessionLevels;
import org.nowstart.signalforge.data.type.MarketRegime;
import org.nowstart.signalforge.data.type.SelectorState;
import org.nowstart.signalforge.data.type.SignalDirection;
import org.nowstart.signalforge.data.type.StrategyMode;
import org.nowstart.signalforge.data.type.TrendBias;
import org.springframework.stereotype.Component;

/**
 * Regime-driven state machine that always ends in a BUY or SELL candidate.
 *
 * <pre>
 * TREND     : TREND_BUY_EVAL -> TREND_SELL_EVAL -> FALLBACK_EVAL -> EMIT
 * RANGE     : RANGE_BUY_EVAL -> RANGE_SELL_EVAL -> FALLBACK_EVAL -> EMIT
 * UNCERTAIN : FALLBACK_EVAL -> EMIT
 * </pre>
 * A state that qualifies jumps straight to EMIT.
 */
@Slf4j
@Component
public class AdaptiveStrategySelector {

    static final double PULLBACK_BAND = 0.003;
    static final double PULLBACK_BONUS = 10.0;
    static final double IB_BREAKOUT_BONUS = 15.0;
    static final double OPEN_BREAKOUT_BONUS = 20.0;
    static final double TIMEFRAME_ALIGNMENT_BONUS = 10.0;
    static final double PREVIOUS_EXTREME_BAND = 0.003;
    static final double PREVIOUS_EXTREME_PENALTY = 10.0;
    static final double ROUND_NUMBER_BAND = 0.001;
    static final double ROUND_NUMBER_PENALTY = 5.0;
    static final double RANGE_EDGE_BAND = 0.001;
    static final double PREVIOUS_EXTREME_CONFLUENCE_BAND = 0.002;
    static final double PREVIOUS_EXTREME_CONFLUENCE_BONUS = 15.0;
    static final double ROUND_NUMBER_CONFLUENCE_BONUS = 10.0;
    static final double MOMENTUM_RSI_PIVOT = 45.0;
    static final double UNCERTAIN_PENALTY = 5.0;
    static final double FALLBACK_LOW_VOLATILITY_PENALTY = 8.0;
    static final double LOW_VOLATILITY_PENALTY = 5.0;

    public CandidateSignal select(SelectionContext context, AdaptiveStrategyParams params) {
        List<String> preamble = new ArrayList<>();
        IndicatorSet indicators = context.indicators();
        MarketRegime regime = context.regime().regime();
        preamble.add(String.format(Locale.ROOT,
                "Regime %s (ADX %.1f, CHOP %.1f)",
                regime,
                context.regime().adx(),
                context.regime().choppiness()
        ));
        if (indicators.choppinessDegenerate()) {
            log.warn("event=degenerate_choppiness symbol={} choppiness={} regime={}",
                    context.symbol(), context.regime().choppiness(), regime);
            preamble.add("Choppiness window has no price range; treated as fully choppy");
        }

        SelectorState state = SelectorState.initial(regime);
        Draft selected = null;
        while (!state.terminal()) {
            Optional<Draft> draft = evaluate(state, context, params, preamble);
            if (draft.isPresent()) {
                selected = draft.get();
                state = SelectorState.EMIT;
            } else {
                state = next(state, context.levels());
            }
        }

        return emit(context, params, preamble, selected);
    }

    private Optional<Draft> evaluate(
            SelectorState state,
            SelectionContext context,
            AdaptiveStrategyParams params,
            List<String> preamble
    ) {
        return switch (state) {
            case TREND_BUY_EVAL -> evaluateTrend(SignalDirection.BUY, context, params);
            case TREND_SELL_EVAL -> evaluateTrend(SignalDirection.SELL, context, params);
            case RANGE_BUY_EVAL -> {
                if (!context.levels().hasInitialBalance()) {
                    preamble.add("No initial balance for the active session; range setups skipped");
                    yield Optional.empty();
                }
                yield evaluateRange(SignalDirection.BUY, context, params);
            }
            case RANGE_SELL_EVAL -> evaluateRange(SignalDirection.SELL, context, params);
            case FALLBACK_EVAL -> Optional.of(evaluateFallback(context, params));
            case EMIT -> throw new IllegalStateException("EMIT is terminal");
        };
    }

    private SelectorState next(SelectorState state, SessionLevels levels) {
        return switch (state) {
            case TREND_BUY_EVAL -> SelectorState.TREND_SELL_EVAL;
            case RANGE_BUY_EVAL -> levels.hasInitialBalance() ? SelectorState.RANGE_SELL_EVAL : SelectorState.FALLBACK_EVAL;
            case TREND_SELL_EVAL, RANGE_SELL_EVAL -> SelectorState.FALLBACK_EVAL;
            case FALLBACK_EVAL, EMIT -> SelectorState.EMIT;
        };
    }

    private Optional<Draft> evaluateTrend(SignalDirection direction, SelectionContext context, AdaptiveStrategyParams params) {
        IndicatorSet indicators = context.indicators();
        SessionLevels levels = context.levels();
        double price = context.price();
        boolean buy = direction == SignalDirection.BUY;

        boolean emaAligned = buy ? indicators.bullishEmaStack() : indicators.bearishEmaStack();
        boolean vwapSide = buy ? price > indicators.vwap() : price < indicators.vwap();
        boolean rsiInBand = buy
                ? indicators.rsi() > params.trendBuyRsiFloor() && indicators.rsi() < params.trendBuyRsiCeiling()
                : indicators.rsi() > params.trendSellRsiFloor() && indicators.rsi() < params.trendSellRsiCeiling();
        boolean higherAgrees = indicators.higherTrend() != null && indicators.higherTrend().agrees(direction);
        boolean volatileEnough = indicators.atrPercent() > params.trendMinAtrPercent();

        if (!(emaAligned && vwapSide && rsiInBand && higherAgrees && volatileEnough)) {
            return Optional.empty();
        }

        Draft draft = new Draft(direction, StrategyMode.TREND, params.trendBaseConfidence());
        draft.reasons.add(String.format(Locale.ROOT,
                "Trend %s: EMA%d %s EMA%d, price %s VWAP, RSI %.1f, %s %s",
                direction,
                params.emaFastLength(),
                buy ? ">" : "<",
                params.emaSlowLength(),
                buy ? "above" : "below",
                indicators.rsi(),
                params.higherTimeframe(),
                buy ? "bullish" : "bearish"
        ));

        if (Double.isFinite(indicators.emaMid()) && indicators.emaMid() > 0
                && Math.abs(price - indicators.emaMid()) / indicators.emaMid() <= PULLBACK_BAND) {
            draft.add(PULLBACK_BONUS, "Pullback to EMA" + params.emaMidLength());
        }

        InitialBalance ib = levels.initialBalance();
        boolean ibBreak = ib != null && (buy ? price > ib.high() : price < ib.low());
        if (ibBreak) {
            draft.add(IB_BREAKOUT_BONUS, String.format(Locale.ROOT,
                    "%s initial balance breakout %s %s",
                    ib.sessionName(),
                    buy ? "above" : "below",
                    format(buy ? ib.high() : ib.low())
            ));
            if (levels.inOpenBreakoutWindow()
                    && indicators.structureTrend() != null
                    && indicators.structureTrend().agrees(direction)) {
                draft.add(OPEN_BREAKOUT_BONUS, levels.openBreakoutSession() + " opening breakout confirmed by "
                        + params.structureTimeframe());
            }
        }

        if (indicators.structureTrend() != null && indicators.structureTrend().agrees(direction)) {
            draft.add(TIMEFRAME_ALIGNMENT_BONUS, params.structureTimeframe() + " and " + params.higherTimeframe() + " aligned");
        }

        if (levels.hasPreviousPeriod()) {
            boolean nearExtreme = buy
                    ? price > levels.previousPeriodHigh() * (1.0 - PREVIOUS_EXTREME_BAND)
                    : price < levels.previousPeriodLow() * (1.0 + PREVIOUS_EXTREME_BAND);
            if (nearExtreme) {
                draft.add(-PREVIOUS_EXTREME_PENALTY, buy
                        ? "Near previous day high " + format(levels.previousPeriodHigh())
                        : "Near previous day low " + format(levels.previousPeriodLow()));
            }
        }

        double round = buy ? levels.roundNumberAbove() : levels.roundNumberBelow();
        if (Math.abs(price - round) / price < ROUND_NUMBER_BAND) {
            draft.add(-ROUND_NUMBER_PENALTY, (buy ? "Round number resistance " : "Round number support ") + format(round));
        }

        if (ib != null) {
            draft.stopHint = buy ? ib.low() : ib.high();
        }
        return Optional.of(draft);
    }

    private Optional<Draft> evaluateRange(SignalDirection direction, SelectionContext context, AdaptiveStrategyParams params) {
        IndicatorSet indicators = context.indicators();
        SessionLevels levels = context.levels();
        InitialBalance ib = levels.initialBalance();
        double price = context.price();
        boolean buy = direction == SignalDirection.BUY;

        boolean atEdge = buy
                ? price <= ib.low() * (1.0 + RANGE_EDGE_BAND)
                : price >= ib.high() * (1.0 - RANGE_EDGE_BAND);
        boolean rsiExtreme = buy ? indicators.rsi() < params.rangeBuyRsiCeiling() : indicators.rsi() > params.rangeSellRsiFloor();
        boolean volatileEnough = indicators.atrPercent() > params.rangeMinAtrPercent();

        if (!(atEdge && rsiExtreme && volatileEnough)) {
            return Optional.empty();
        }

        Draft draft = new Draft(direction, StrategyMode.RANGE, params.rangeBaseConfidence());
        draft.reasons.add(String.format(Locale.ROOT,
                "Range %s at %s initial balance %s %s, RSI %.1f",
                direction,
                ib.sessionName(),
                buy ? "low" : "high",
                format(buy ? ib.low() : ib.high()),
                indicators.rsi()
        ));

        if (levels.hasPreviousPeriod()) {
            boolean confluence = buy
                    ? price <= levels.previousPeriodLow() * (1.0 + PREVIOUS_EXTREME_CONFLUENCE_BAND)
                    : price >= levels.previousPeriodHigh() * (1.0 - PREVIOUS_EXTREME_CONFLUENCE_BAND);
            if (confluence) {
                draft.add(PREVIOUS_EXTREME_CONFLUENCE_BONUS, buy
                        ? "Previous day low confluence " + format(levels.previousPeriodLow())
                        : "Previous day high confluence " + format(levels.previousPeriodHigh()));
            }
        }

        double round = buy ? levels.roundNumberBelow() : levels.roundNumberAbove();
        if (Math.abs(price - round) / price < ROUND_NUMBER_BAND) {
            draft.add(ROUND_NUMBER_CONFLUENCE_BONUS, (buy ? "Round number support " : "Round number resistance ") + format(round));
        }

        draft.stopHint = buy ? ib.low() : ib.high();
        draft.targetHint = indicators.vwap();
        return Optional.of(draft);
    }

    private Draft evaluateFallback(SelectionContext context, AdaptiveStrategyParams params) {
        IndicatorSet indicators = context.indicators();
        double price = context.price();
        Draft draft;

        if (indicators.bullishEmaStack() && price > indicators.vwap() && indicators.rsi() > MOMENTUM_RSI_PIVOT) {
            draft = new Draft(SignalDirection.BUY, StrategyMode.FALLBACK, params.momentumFallbackConfidence());
            draft.reasons.add("Fallback: bullish momentum");
        } else if (indicators.bearishEmaStack() && price < indicators.vwap() && indicators.rsi() < 100.0 - MOMENTUM_RSI_PIVOT) {
            draft = new Draft(SignalDirection.SELL, StrategyMode.FALLBACK, params.momentumFallbackConfidence());
            draft.reasons.add("Fallback: bearish momentum");
        } else {
            boolean bullishAlignment = indicators.structureTrend() == TrendBias.BULLISH
                    && indicators.higherTrend() == TrendBias.BULLISH;
            SignalDirection direction = bullishAlignment ? SignalDirection.BUY : SignalDirection.SELL;
            draft = new Draft(direction, StrategyMode.FALLBACK, params.alignmentFallbackConfidence());
            draft.reasons.add(String.format(Locale.ROOT,
                    "Fallback: %s/%s trend alignment (%s, %s)",
                    params.structureTimeframe(),
                    params.higherTimeframe(),
                    indicators.structureTrend(),
                    indicators.higherTrend()
            ));
        }

        if (context.regime().regime() == MarketRegime.UNCERTAIN) {
            draft.add(-UNCERTAIN_PENALTY, "Uncertain regime");
        }
        if (indicators.atrPercent() < params.trendMinAtrPercent()) {
            draft.add(-FALLBACK_LOW_VOLATILITY_PENALTY, "Fallback in low volatility");
        }
        return draft;
    }

    private CandidateSignal emit(
            SelectionContext context,
            AdaptiveStrategyParams params,
            List<String> preamble,
            Draft draft
    ) {
        if (context.indicators().atrPercent() < params.lowVolatilityAtrPercent()) {
            draft.add(-LOW_VOLATILITY_PENALTY, String.format(Locale.ROOT, "Low volatility (ATR %.3f%%)", context.indicators().atrPercent()));
        }
        if (context.levels().marketClosed()) {
            draft.reasons.add("Market closed (weekend or after Friday close)");
        }

        double confidence = draft.mode == StrategyMode.FALLBACK
                ? clamp(draft.confidence, params.alignmentFallbackConfidence(), params.momentumFallbackConfidence())
                : clamp(draft.confidence, 0.0, 100.0);
        if (confidence != draft.confidence) {
            draft.reasons.add(String.format(Locale.ROOT,
                    "Confidence %s at %.0f (adjusted %.0f)",
                    confidence > draft.confidence ? "floored" : "capped",
                    confidence,
                    draft.confidence
            ));
        }

        List<String> reasons = new ArrayList<>(preamble);
        reasons.addAll(draft.reasons);
        return new CandidateSignal(
                context.symbol(),
                draft.direction,
                confidence,
                draft.mode,
                reasons,
                draft.stopHint,
                draft.targetHint
        );
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.5f", value);
    }

    private static final class Draft {

        private final SignalDirection direction;
        private final StrategyMode mode;
        private final List<String> reasons = new ArrayList<>();
        private double confidence;
        private double stopHint = Double.NaN;
        private double targetHint = Double.NaN;

        private Draft(SignalDirection direction, StrategyMode mode, double confidence) {
            this.direction = direction;
            this.mode = mode;
            this.confidence = confidence;
        }

        private void add(double points, String reason) {
            confidence += points;
            reasons.add(reason + String.format(Locale.ROOT, " (%+.0f)", points));
        }
    }
}
