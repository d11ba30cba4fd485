package org.nowstart.signalforge.service.modulation;

import lombok.RequiredArgsConstructor;
import org.nowstart.signalforge.data.dto.IndicatorSet;
import org.nowstart.signalforge.data.property.ModulationProperties;
import org.nowstart.signalforge.data.type.MarketRegime;
import org.nowstart.signalforge.data.type.SignalDirection;
import org.springframework.stereotype.Service;

/**
 * Indicator-only confidence used when no external prediction is available.
 */
@Service
@RequiredArgsConstructor
public class TechnicalConfidenceCalculator {

    private final ModulationProperties modulationProperties;

    public double calculate(SignalDirection direction, IndicatorSet indicators, MarketRegime regime) {
        double confidence = 50.0;
        boolean buy = direction == SignalDirection.BUY;

        double adx = indicators.adx();
        if (adx > 35) {
            confidence += 15;
        } else if (adx > 25) {
            confidence += 10;
        } else if (adx < 15) {
            confidence -= 10;
        }

        double rsi = indicators.rsi();
        if (buy) {
            if (rsi < 30) {
                confidence += 15;
            } else if (rsi < 45) {
                confidence += 8;
            } else if (rsi > 70) {
                confidence -= 10;
            }
        } else {
            if (rsi > 70) {
                confidence += 15;
            } else if (rsi > 55) {
                confidence += 8;
            } else if (rsi < 30) {
                confidence -= 10;
            }
        }

        if (Double.isFinite(indicators.emaMid())) {
            boolean aligned = buy ? indicators.emaFast() > indicators.emaMid() : indicators.emaFast() < indicators.emaMid();
            if (aligned) {
                confidence += 10;
            }
        }

        double atrPercent = indicators.atrPercent();
        if (atrPercent >= 0.05 && atrPercent <= 0.15) {
            confidence += 8;
        } else if (atrPercent > 0.30) {
            confidence -= 10;
        } else if (atrPercent < 0.03) {
            confidence -= 8;
        }

        if (regime == MarketRegime.UNCERTAIN) {
            confidence -= 5;
        } else if (regime == MarketRegime.TREND) {
            confidence += 5;
        }

        return Math.max(
                modulationProperties.technicalFallbackFloor(),
                Math.min(modulationProperties.technicalFallbackCeiling(), confidence)
        );
    }
}
