package org.nowstart.signalforge.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.nowstart.signalforge.data.property.SignalEngineProperties;
import org.nowstart.signalforge.strategy.adaptive.AdaptiveStrategyParams;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

@ExtendWith(OutputCaptureExtension.class)
class StrategyBootstrapValidatorTest {

    @Test
    void validate_logsRequiredHistoryForActiveStrategy(CapturedOutput output) {
        StrategyBootstrapValidator validator = createValidator("adaptive-v1");

        validator.validate();

        assertThat(output).contains("event=strategy_bootstrap strategy_version=adaptive-v1 timeframe=M15 required_candles=50");
    }

    @Test
    void validate_failsFastForUnregisteredVersion() {
        StrategyBootstrapValidator validator = createValidator("adaptive-v9");

        assertThatThrownBy(validator::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("adaptive-v9");
    }

    private StrategyBootstrapValidator createValidator(String activeVersion) {
        StrategyRegistry registry = new StrategyRegistry(List.of(StrategyRegistryTest.adaptiveEngine()));
        registry.init();
        StrategyParamResolver resolver = new StrategyParamResolver(
                new SignalEngineProperties(activeVersion),
                List.of(AdaptiveStrategyParams.defaults())
        );
        return new StrategyBootstrapValidator(resolver, registry);
    }
}
