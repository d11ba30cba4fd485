package org.nowstart.signalforge.strategy;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class StrategyBootstrapValidator {

    private final StrategyParamResolver strategyParamResolver;
    private final StrategyRegistry strategyRegistry;

    @PostConstruct
    void validate() {
        String activeVersion = strategyParamResolver.resolveActiveStrategyVersion();
        strategyRegistry.getRequired(activeVersion);
        strategyRegistry.requiredHistory(activeVersion, strategyParamResolver.resolve(activeVersion))
                .forEach((timeframe, candles) ->
                        log.info("event=strategy_bootstrap strategy_version={} timeframe={} required_candles={}",
                                activeVersion, timeframe, candles));
    }
}
