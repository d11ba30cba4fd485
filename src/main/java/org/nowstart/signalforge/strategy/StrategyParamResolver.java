package org.nowstart.signalforge.strategy;

import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.nowstart.signalforge.data.property.SignalEngineProperties;
import org.nowstart.signalforge.strategy.adaptive.AdaptiveStrategyEngine;
import org.nowstart.signalforge.strategy.core.StrategyParams;
import org.nowstart.signalforge.strategy.core.VersionedStrategyParams;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class StrategyParamResolver {

    private final SignalEngineProperties signalEngineProperties;
    private final List<VersionedStrategyParams> strategyParams;

    public String resolveActiveStrategyVersion() {
        String raw = signalEngineProperties.activeStrategyVersion();
        if (raw == null || raw.isBlank()) {
            return AdaptiveStrategyEngine.VERSION;
        }
        return raw.trim().toLowerCase(Locale.ROOT);
    }

    public StrategyParams resolve(String strategyVersion) {
        String normalized = normalize(strategyVersion);
        return strategyParams.stream()
                .filter(params -> normalize(params.version()).equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported strategy version: " + strategyVersion));
    }

    private String normalize(String strategyVersion) {
        if (strategyVersion == null || strategyVersion.isBlank()) {
            throw new IllegalArgumentException("strategyVersion is required");
        }
        return strategyVersion.trim().toLowerCase(Locale.ROOT);
    }
}
