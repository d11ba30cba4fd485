package org.nowstart.signalforge.data.dto;

import org.nowstart.signalforge.data.type.MarketRegime;

public record RegimeClassification(
        MarketRegime regime,
        double adx,
        double choppiness
) {
}
