package org.nowstart.signalforge.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.signalforge.data.exception.InsufficientDataException;
import org.nowstart.signalforge.data.property.RegimeProperties;
import org.nowstart.signalforge.data.property.RiskProperties;
import org.nowstart.signalforge.data.property.SessionProperties;
import org.nowstart.signalforge.data.type.SymbolClass;
import org.nowstart.signalforge.data.type.Timeframe;
import org.nowstart.signalforge.service.indicator.IndicatorComputationService;
import org.nowstart.signalforge.service.level.SessionLevelCalculator;
import org.nowstart.signalforge.service.regime.MarketRegimeClassifier;
import org.nowstart.signalforge.strategy.adaptive.AdaptiveStrategyEngine;
import org.nowstart.signalforge.strategy.adaptive.AdaptiveStrategyParams;
import org.nowstart.signalforge.strategy.adaptive.AdaptiveStrategySelector;
import org.nowstart.signalforge.strategy.core.StrategyInput;
import org.nowstart.signalforge.strategy.core.StrategyParams;
import org.nowstart.signalforge.support.Candles;

class StrategyRegistryTest {

    @Test
    void getRequired_resolvesVersionCaseInsensitively() {
        AdaptiveStrategyEngine engine = adaptiveEngine();
        StrategyRegistry registry = new StrategyRegistry(List.of(engine));
        registry.init();

        assertThat(registry.getRequired(" ADAPTIVE-V1 ")).isSameAs(engine);
    }

    @Test
    void getRequired_throwsWhenVersionMissing() {
        StrategyRegistry registry = new StrategyRegistry(List.of(adaptiveEngine()));
        registry.init();

        assertThatThrownBy(() -> registry.getRequired("v9"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("v9");
    }

    @Test
    void requiredHistory_throwsForWrongParamType() {
        StrategyRegistry registry = new StrategyRegistry(List.of(adaptiveEngine()));
        registry.init();

        StrategyParams wrong = () -> Timeframe.M5;

        assertThatThrownBy(() -> registry.requiredHistory(AdaptiveStrategyEngine.VERSION, wrong))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid params type");
    }

    @Test
    void requiredHistory_returnsEngineValueForValidParams() {
        StrategyRegistry registry = new StrategyRegistry(List.of(adaptiveEngine()));
        registry.init();

        Map<Timeframe, Integer> history = registry.requiredHistory(AdaptiveStrategyEngine.VERSION, AdaptiveStrategyParams.defaults());

        assertThat(history).containsEntry(Timeframe.M15, 50);
    }

    @Test
    void evaluate_dispatchesToAdaptiveEngine() {
        StrategyRegistry registry = new StrategyRegistry(List.of(adaptiveEngine()));
        registry.init();
        Instant start = Instant.parse("2026-01-05T09:00:00Z");
        StrategyInput<AdaptiveStrategyParams> input = new StrategyInput<>(
                "EURUSD",
                SymbolClass.MAJOR_FX,
                Map.of(Timeframe.M5, Candles.rising(start, Duration.ofMinutes(5), 5, 1.08, 0.0001)),
                null,
                start.plus(Duration.ofHours(1)),
                AdaptiveStrategyParams.defaults()
        );

        assertThatThrownBy(() -> registry.evaluate("adaptive-v1", input))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("M5 candles");
    }

    @Test
    void init_throwsWhenDuplicateEngineVersionRegistered() {
        StrategyRegistry registry = new StrategyRegistry(List.of(adaptiveEngine(), adaptiveEngine()));

        assertThatThrownBy(registry::init)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate strategy engine");
    }

    @Test
    void evaluate_throwsWhenStrategyVersionBlank() {
        StrategyRegistry registry = new StrategyRegistry(List.of(adaptiveEngine()));
        registry.init();

        assertThatThrownBy(() -> registry.evaluate(" ", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("strategyVersion is required");
    }

    static AdaptiveStrategyEngine adaptiveEngine() {
        return new AdaptiveStrategyEngine(
                new IndicatorComputationService(),
                new MarketRegimeClassifier(RegimeProperties.defaults()),
                new SessionLevelCalculator(SessionProperties.defaults(), RiskProperties.defaults()),
                new AdaptiveStrategySelector(),
                RegimeProperties.defaults()
        );
    }
}
