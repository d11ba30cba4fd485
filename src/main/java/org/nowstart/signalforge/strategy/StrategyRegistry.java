package org.nowstart.signalforge.strategy;

import jakarta.annotation.PostConstruct;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.signalforge.data.type.Timeframe;
import org.nowstart.signalforge.strategy.core.SignalStrategyEngine;
import org.nowstart.signalforge.strategy.core.StrategyEvaluation;
import org.nowstart.signalforge.strategy.core.StrategyInput;
import org.nowstart.signalforge.strategy.core.StrategyParams;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class StrategyRegistry {

    private final List<SignalStrategyEngine<? extends StrategyParams>> engines;
    private Map<String, SignalStrategyEngine<? extends StrategyParams>> enginesByVersion = Map.of();

    @PostConstruct
    public void init() {
        Map<String, SignalStrategyEngine<? extends StrategyParams>> byVersion = new HashMap<>();
        for (SignalStrategyEngine<? extends StrategyParams> engine : engines) {
            String version = normalize(engine.version());
            SignalStrategyEngine<? extends StrategyParams> previous = byVersion.put(version, engine);
            if (previous != null) {
                throw new IllegalStateException("Duplicate strategy engine registered for version=" + version);
            }
        }
        enginesByVersion = Map.copyOf(byVersion);
    }

    public SignalStrategyEngine<? extends StrategyParams> getRequired(String strategyVersion) {
        SignalStrategyEngine<? extends StrategyParams> engine = enginesByVersion.get(normalize(strategyVersion));
        if (engine == null) {
            throw new IllegalStateException("No strategy engine registered for version=" + strategyVersion);
        }
        return engine;
    }

    public StrategyEvaluation evaluate(String strategyVersion, StrategyInput<? extends StrategyParams> input) {
        SignalStrategyEngine<? extends StrategyParams> engine = getRequired(strategyVersion);
        return evaluateInternal(engine, input);
    }

    public Map<Timeframe, Integer> requiredHistory(String strategyVersion, StrategyParams params) {
        SignalStrategyEngine<? extends StrategyParams> engine = getRequired(strategyVersion);
        return requiredHistoryInternal(engine, params);
    }

    private <P extends StrategyParams> StrategyEvaluation evaluateInternal(
            SignalStrategyEngine<P> engine,
            StrategyInput<? extends StrategyParams> input
    ) {
        P typedParams = castParams(engine, input.params());
        return engine.evaluate(new StrategyInput<>(
                input.symbol(),
                input.symbolClass(),
                input.candles(),
                input.quote(),
                input.asOf(),
                typedParams
        ));
    }

    private <P extends StrategyParams> Map<Timeframe, Integer> requiredHistoryInternal(
            SignalStrategyEngine<P> engine,
            StrategyParams params
    ) {
        return engine.requiredHistory(castParams(engine, params));
    }

    private <P extends StrategyParams> P castParams(SignalStrategyEngine<P> engine, StrategyParams params) {
        if (!engine.parameterType().isInstance(params)) {
            throw new IllegalArgumentException(
                    "Invalid params type for strategy version=" + engine.version()
                            + ", required=" + engine.parameterType().getSimpleName()
                            + ", actual=" + (params == null ? "null" : params.getClass().getSimpleName())
            );
        }
        return engine.parameterType().cast(params);
    }

    private String normalize(String strategyVersion) {
        if (strategyVersion == null || strategyVersion.isBlank()) {
            throw new IllegalArgumentException("strategyVersion is required");
        }
        return strategyVersion.trim().toLowerCase(Locale.ROOT);
    }
}
