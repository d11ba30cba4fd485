package org.nowstart.signalforge.service.regime;

import lombok.RequiredArgsConstructor;
import org.nowstart.signalforge.data.dto.RegimeClassification;
import org.nowstart.signalforge.data.property.RegimeProperties;
import org.nowstart.signalforge.data.type.MarketRegime;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MarketRegimeClassifier {

    private final RegimeProperties regimeProperties;

    /**
     * TREND needs a strong ADX and low choppiness; RANGE needs high choppiness. Anything between is UNCERTAIN.
     */
    public RegimeClassification classify(double adx, double choppiness) {
        MarketRegime regime;
        if (adx > regimeProperties.adxTrendThreshold() && choppiness < regimeProperties.choppinessTrendCeiling()) {
            regime = MarketRegime.TREND;
        } else if (choppiness > regimeProperties.choppinessRangeThreshold()) {
            regime = MarketRegime.RANGE;
        } else {
            regime = MarketRegime.UNCERTAIN;
        }
        return new RegimeClassification(regime, adx, choppiness);
    }
}
