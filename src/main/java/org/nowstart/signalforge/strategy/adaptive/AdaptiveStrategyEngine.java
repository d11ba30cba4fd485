package org.nowstart.signalforge.strategy.adaptive;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.signalforge.data.dto.CandidateSignal;
import org.nowstart.signalforge.data.dto.ChoppinessReading;
import org.nowstart.signalforge.data.dto.IndicatorSet;
import org.nowstart.signalforge.data.dto.RegimeClassification;
import org.nowstart.signalforge.data.dto.SessionLevels;
import org.nowstart.signalforge.data.exception.InsufficientDataException;
import org.nowstart.signalforge.data.property.RegimeProperties;
import org.nowstart.signalforge.data.type.Timeframe;
import org.nowstart.signalforge.data.type.TrendBias;
import org.nowstart.signalforge.service.indicator.IndicatorComputationService;
import org.nowstart.signalforge.service.level.SessionLevelCalculator;
import org.nowstart.signalforge.service.regime.MarketRegimeClassifier;
import org.nowstart.signalforge.strategy.core.OhlcvCandle;
import org.nowstart.signalforge.strategy.core.SignalStrategyEngine;
import org.nowstart.signalforge.strategy.core.StrategyDiagnostic;
import org.nowstart.signalforge.strategy.core.StrategyEvaluation;
import org.nowstart.signalforge.strategy.core.StrategyInput;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AdaptiveStrategyEngine implements SignalStrategyEngine<AdaptiveStrategyParams> {

    public static final String VERSION = "adaptive-v1";

    private final IndicatorComputationService indicatorComputationService;
    private final MarketRegimeClassifier marketRegimeClassifier;
    private final SessionLevelCalculator sessionLevelCalculator;
    private final AdaptiveStrategySelector adaptiveStrategySelector;
    private final RegimeProperties regimeProperties;

    @Override
    public String version() {
        return VERSION;
    }

    @Override
    public Class<AdaptiveStrategyParams> parameterType() {
        return AdaptiveStrategyParams.class;
    }

    @Override
    public Map<Timeframe, Integer> requiredHistory(AdaptiveStrategyParams params) {
        Map<Timeframe, Integer> required = new EnumMap<>(Timeframe.class);
        required.merge(params.primaryTimeframe(), Math.max(params.emaSlowLength(), params.rsiPeriod() + 1), Math::max);
        required.merge(
                params.structureTimeframe(),
                Math.max(Math.max(params.emaMidLength(), params.trendEmaLength()), params.atrPeriod() + 1),
                Math::max
        );
        required.merge(params.higherTimeframe(), params.trendEmaLength(), Math::max);
        return required;
    }

    @Override
    public StrategyEvaluation evaluate(StrategyInput<AdaptiveStrategyParams> input) {
        AdaptiveStrategyParams params = input.params();
        requireHistory(input, params);

        List<OhlcvCandle> primary = input.candles(params.primaryTimeframe());
        List<OhlcvCandle> structure = input.candles(params.structureTimeframe());
        List<OhlcvCandle> higher = input.candles(params.higherTimeframe());

        double lastClose = primary.get(primary.size() - 1).close();
        double entryPrice = input.quote() == null ? lastClose : input.quote().mid();
        double spread = input.quote() == null ? 0.0 : input.quote().spread();

        IndicatorSet indicators = computeIndicators(input, params, primary, structure, higher, entryPrice, lastClose);
        RegimeClassification regime = marketRegimeClassifier.classify(indicators.adx(), indicators.choppiness());
        SessionLevels levels = sessionLevelCalculator.calculate(primary, entryPrice, input.symbolClass(), input.asOf());

        CandidateSignal candidate = adaptiveStrategySelector.select(
                new SelectionContext(input.symbol(), entryPrice, indicators, regime, levels),
                params
        );

        return new StrategyEvaluation(
                candidate,
                indicators,
                regime,
                levels,
                entryPrice,
                spread,
                buildDiagnostics(indicators, regime, levels, candidate)
        );
    }

    private IndicatorSet computeIndicators(
            StrategyInput<AdaptiveStrategyParams> input,
            AdaptiveStrategyParams params,
            List<OhlcvCandle> primary,
            List<OhlcvCandle> structure,
            List<OhlcvCandle> higher,
            double entryPrice,
            double lastClose
    ) {
        double[] primaryCloses = indicatorComputationService.closes(primary);
        double[] structureCloses = indicatorComputationService.closes(structure);
        double[] higherCloses = indicatorComputationService.closes(higher);

        double atr = indicatorComputationService.averageTrueRange(structure, params.atrPeriod());
        ChoppinessReading choppiness = indicatorComputationService.choppinessIndex(primary, regimeProperties.choppinessPeriod());

        return new IndicatorSet(
                indicatorComputationService.exponentialMovingAverage(primaryCloses, params.emaFastLength()),
                indicatorComputationService.exponentialMovingAverage(primaryCloses, params.emaSlowLength()),
                indicatorComputationService.exponentialMovingAverage(structureCloses, params.emaMidLength()),
                indicatorComputationService.relativeStrengthIndex(primaryCloses, params.rsiPeriod()),
                atr,
                atr / entryPrice * 100.0,
                indicatorComputationService.averageDirectionalIndex(primary, regimeProperties.adxPeriod()),
                choppiness.value(),
                choppiness.degenerate(),
                indicatorComputationService.volumeWeightedAveragePrice(vwapWindow(input, params, primary)),
                trendBias(structureCloses, params.trendEmaLength()),
                trendBias(higherCloses, params.trendEmaLength()),
                lastClose
        );
    }

    private List<OhlcvCandle> vwapWindow(
            StrategyInput<AdaptiveStrategyParams> input,
            AdaptiveStrategyParams params,
            List<OhlcvCandle> primary
    ) {
        List<OhlcvCandle> today = sessionLevelCalculator.sameDayCandles(primary, input.asOf());
        if (!today.isEmpty()) {
            return today;
        }
        int from = Math.max(0, primary.size() - params.vwapFallbackCandles());
        return primary.subList(from, primary.size());
    }

    private TrendBias trendBias(double[] closes, int emaLength) {
        double ema = indicatorComputationService.exponentialMovingAverage(closes, emaLength);
        return closes[closes.length - 1] > ema ? TrendBias.BULLISH : TrendBias.BEARISH;
    }

    private void requireHistory(StrategyInput<AdaptiveStrategyParams> input, AdaptiveStrategyParams params) {
        for (Map.Entry<Timeframe, Integer> entry : requiredHistory(params).entrySet()) {
            int actual = input.candles(entry.getKey()).size();
            if (actual < entry.getValue()) {
                throw new InsufficientDataException(entry.getKey() + " candles", entry.getValue(), actual);
            }
        }
    }

    private List<StrategyDiagnostic> buildDiagnostics(
            IndicatorSet indicators,
            RegimeClassification regime,
            SessionLevels levels,
            CandidateSignal candidate
    ) {
        List<StrategyDiagnostic> diagnostics = new ArrayList<>();
        diagnostics.add(StrategyDiagnostic.text("regime.current", "Regime", "ADX/Choppiness regime", regime.regime().name()));
        diagnostics.add(StrategyDiagnostic.text("strategy.mode", "Strategy Mode", "Selector path that emitted the candidate", candidate.mode().name()));
        diagnostics.add(StrategyDiagnostic.number("indicator.ema_fast", "EMA Fast", "price", "", indicators.emaFast()));
        diagnostics.add(StrategyDiagnostic.number("indicator.ema_slow", "EMA Slow", "price", "", indicators.emaSlow()));
        diagnostics.add(StrategyDiagnostic.number("indicator.ema_mid", "EMA Mid", "price", "", indicators.emaMid()));
        diagnostics.add(StrategyDiagnostic.number("indicator.rsi", "RSI", "", "", indicators.rsi()));
        diagnostics.add(StrategyDiagnostic.number("indicator.atr", "ATR", "price", "", indicators.atr()));
        diagnostics.add(StrategyDiagnostic.number("indicator.atr_percent", "ATR %", "%", "ATR relative to entry price", indicators.atrPercent()));
        diagnostics.add(StrategyDiagnostic.number("indicator.adx", "ADX", "", "", indicators.adx()));
        diagnostics.add(StrategyDiagnostic.number("indicator.choppiness", "Choppiness", "", "", indicators.choppiness()));
        diagnostics.add(StrategyDiagnostic.number("indicator.vwap", "VWAP", "price", "", indicators.vwap()));
        diagnostics.add(StrategyDiagnostic.bool("level.ib_present", "IB Present", "Active session initial balance formed", levels.hasInitialBalance()));
        if (levels.hasInitialBalance()) {
            diagnostics.add(StrategyDiagnostic.number("level.ib_high", "IB High", "price", "", levels.initialBalance().high()));
            diagnostics.add(StrategyDiagnostic.number("level.ib_low", "IB Low", "price", "", levels.initialBalance().low()));
        }
        if (levels.hasPreviousPeriod()) {
            diagnostics.add(StrategyDiagnostic.number("level.pdh", "Previous Day High", "price", "", levels.previousPeriodHigh()));
            diagnostics.add(StrategyDiagnostic.number("level.pdl", "Previous Day Low", "price", "", levels.previousPeriodLow()));
        }
        diagnostics.add(StrategyDiagnostic.text("session.active", "Active Session", "", levels.activeSession()));
        diagnostics.add(StrategyDiagnostic.bool("session.market_closed", "Market Closed", "", levels.marketClosed()));
        diagnostics.add(StrategyDiagnostic.number("signal.base_confidence", "Base Confidence", "%", "", candidate.baseConfidence()));
        return diagnostics;
    }
}
