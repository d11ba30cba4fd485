package org.nowstart.signalforge.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.signalforge.data.dto.CandidateSignal;
import org.nowstart.signalforge.data.dto.CandleDto;
import org.nowstart.signalforge.data.dto.ExternalPrediction;
import org.nowstart.signalforge.data.dto.ModulatedSignal;
import org.nowstart.signalforge.data.dto.ModulationInput;
import org.nowstart.signalforge.data.dto.RiskInput;
import org.nowstart.signalforge.data.dto.RiskLevels;
import org.nowstart.signalforge.data.dto.SessionLevels;
import org.nowstart.signalforge.data.dto.SignalRecord;
import org.nowstart.signalforge.data.dto.SignalRequest;
import org.nowstart.signalforge.data.type.SymbolClass;
import org.nowstart.signalforge.data.type.Timeframe;
import org.nowstart.signalforge.service.modulation.ConfidenceModulationService;
import org.nowstart.signalforge.service.prediction.ExternalPredictionService;
import org.nowstart.signalforge.service.risk.RiskLevelCalculator;
import org.nowstart.signalforge.strategy.StrategyParamResolver;
import org.nowstart.signalforge.strategy.StrategyRegistry;
import org.nowstart.signalforge.strategy.core.OhlcvCandle;
import org.nowstart.signalforge.strategy.core.StrategyDiagnostic;
import org.nowstart.signalforge.strategy.core.StrategyEvaluation;
import org.nowstart.signalforge.strategy.core.StrategyInput;
import org.nowstart.signalforge.strategy.core.StrategyParams;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;

/**
 * Runs one request through strategy evaluation, confidence modulation and risk placement.
 * Holds no state between requests apart from the calibration snapshot read during modulation.
 */
@Slf4j
@Service
@RefreshScope
@RequiredArgsConstructor
public class SignalGenerationService {

    private final StrategyParamResolver strategyParamResolver;
    private final StrategyRegistry strategyRegistry;
    private final ExternalPredictionService externalPredictionService;
    private final ConfidenceModulationService confidenceModulationService;
    private final RiskLevelCalculator riskLevelCalculator;
    private final SignalLogService signalLogService;
    private final Clock clock;

    public SignalRecord generate(SignalRequest request) {
        String symbol = normalizeSymbol(request.symbol());
        SymbolClass symbolClass = SymbolClass.resolve(symbol);
        String strategyVersion = strategyParamResolver.resolveActiveStrategyVersion();
        StrategyParams params = strategyParamResolver.resolve(strategyVersion);
        Instant asOf = request.asOf() == null ? clock.instant() : request.asOf();
        Map<Timeframe, List<OhlcvCandle>> candles = toCandles(request.candles());

        StrategyEvaluation evaluation = strategyRegistry.evaluate(
                strategyVersion,
                new StrategyInput<>(symbol, symbolClass, candles, request.quote(), asOf, params)
        );

        ExternalPrediction prediction = request.prediction() != null
                ? request.prediction()
                : externalPredictionService.fetch(symbol, evaluation.indicators(), evaluation.entryPrice()).orElse(null);

        List<OhlcvCandle> primary = candles.get(params.primaryTimeframe());
        ModulatedSignal modulated = confidenceModulationService.modulate(new ModulationInput(
                evaluation,
                primary.get(primary.size() - 1),
                params.primaryTimeframe(),
                prediction,
                request.sentiment(),
                request.timeframeSignals(),
                request.riskMetrics()
        ));

        CandidateSignal candidate = evaluation.candidate();
        SessionLevels levels = evaluation.levels();
        RiskLevels risk = riskLevelCalculator.calculate(new RiskInput(
                modulated.direction(),
                candidate.mode(),
                symbolClass,
                evaluation.entryPrice(),
                evaluation.indicators().atr(),
                evaluation.spread(),
                candidate.structuralTargetHint(),
                levels.previousPeriodHigh(),
                levels.previousPeriodLow()
        ));

        List<String> reasons = new ArrayList<>(candidate.reasons());
        reasons.addAll(modulated.reasons());
        reasons.addAll(risk.reasons());

        SignalRecord record = new SignalRecord(
                symbol,
                modulated.direction(),
                modulated.finalConfidence(),
                modulated.recommendation(),
                modulated.positionSizeMultiplier(),
                modulated.finalIntensity(),
                risk.entryPrice(),
                risk.stopLoss(),
                risk.takeProfit(),
                risk.riskRewardRatio(),
                risk.stopDistancePips(),
                evaluation.regime().regime(),
                candidate.mode(),
                evaluation.regime().adx(),
                evaluation.regime().choppiness(),
                modulated.actionable(),
                modulated.threshold(),
                modulated.calibrationVersion(),
                strategyVersion,
                asOf,
                List.copyOf(reasons),
                diagnosticValues(evaluation)
        );

        signalLogService.logSignal(record, evaluation);
        return record;
    }

    String normalizeSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        return symbol.trim().replace("/", "").toUpperCase(Locale.ROOT);
    }

    private Map<Timeframe, List<OhlcvCandle>> toCandles(Map<Timeframe, List<CandleDto>> source) {
        Map<Timeframe, List<OhlcvCandle>> candles = new EnumMap<>(Timeframe.class);
        if (source == null) {
            return candles;
        }
        source.forEach((timeframe, items) -> {
            if (timeframe == null || items == null) {
                return;
            }
            candles.put(timeframe, items.stream()
                    .map(CandleDto::toCandle)
                    .sorted(Comparator.comparing(OhlcvCandle::timestamp))
                    .toList());
        });
        return candles;
    }

    private Map<String, Object> diagnosticValues(StrategyEvaluation evaluation) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (StrategyDiagnostic diagnostic : evaluation.diagnostics()) {
            values.put(diagnostic.key(), diagnostic.value());
        }
        return values;
    }
}
