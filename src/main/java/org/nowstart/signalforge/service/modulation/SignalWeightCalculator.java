package org.nowstart.signalforge.service.modulation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.nowstart.signalforge.data.dto.IndicatorSet;
import org.nowstart.signalforge.data.dto.ModulationFactors;
import org.nowstart.signalforge.data.dto.RiskMetrics;
import org.nowstart.signalforge.data.dto.TimeframeSignal;
import org.nowstart.signalforge.data.dto.WeightInput;
import org.nowstart.signalforge.data.dto.WeightResult;
import org.nowstart.signalforge.data.property.ModulationProperties;
import org.nowstart.signalforge.data.property.ModulationProperties.Weights;
import org.nowstart.signalforge.data.type.Recommendation;
import org.nowstart.signalforge.data.type.SignalDirection;
import org.nowstart.signalforge.data.type.Timeframe;
import org.nowstart.signalforge.strategy.core.OhlcvCandle;
import org.springframework.stereotype.Service;

/**
 * Combines five scored components into a total weight in [0, 100] and derives the recommendation
 * tier and position-size multiplier from it.
 */
@Service
@RequiredArgsConstructor
public class SignalWeightCalculator {

    private final ModulationProperties modulationProperties;

    public WeightResult calculate(WeightInput input) {
        ModulationFactors factors = new ModulationFactors(
                scoreMlConfidence(input.mlConfidence()),
                scoreTechnicalQuality(input.indicators(), input.direction()),
                scoreMarketConditions(input.lastCandle(), input.granularity()),
                scoreTimeframeConfirmation(input.direction(), input.timeframeSignals()),
                scoreRiskFactors(input.symbol(), input.riskMetrics())
        );

        Weights weights = modulationProperties.weights();
        double total = factors.mlConfidence() * weights.mlConfidence()
                + factors.technicalQuality() * weights.technicalQuality()
                + factors.marketConditions() * weights.marketConditions()
                + factors.mtfConfirmation() * weights.mtfConfirmation()
                + factors.riskFactors() * weights.riskFactors();
        total = clamp(total);

        Recommendation recommendation = Recommendation.fromScore(total);
        List<String> reasons = new ArrayList<>();
        reasons.add(String.format(
                Locale.ROOT,
                "Weighted confidence %.1f (ml %.1f, technical %.1f, market %.1f, mtf %.1f, risk %.1f) -> %s",
                total,
                factors.mlConfidence(),
                factors.technicalQuality(),
                factors.marketConditions(),
                factors.mtfConfirmation(),
                factors.riskFactors(),
                recommendation
        ));

        return new WeightResult(total, factors, recommendation, positionSizeMultiplier(total), reasons);
    }

    /**
     * Piecewise rescale that compresses low confidence and stretches the 50..85 band.
     */
    double scoreMlConfidence(double confidence) {
        double score;
        if (confidence < 50) {
            score = confidence * 0.8;
        } else if (confidence < 70) {
            score = 40 + (confidence - 50) * 1.5;
        } else if (confidence < 85) {
            score = 70 + (confidence - 70) * 1.33;
        } else {
            score = 90 + (confidence - 85) * 0.67;
        }
        return clamp(score);
    }

    double scoreTechnicalQuality(IndicatorSet indicators, SignalDirection direction) {
        double score = 50.0;
        double rsi = indicators.rsi();
        boolean buy = direction == SignalDirection.BUY;

        if (Double.isFinite(rsi)) {
            if (buy) {
                if (rsi < 30) {
                    score += 15;
                } else if (rsi < 50) {
                    score += 10;
                } else if (rsi > 70) {
                    score -= 15;
                }
            } else {
                if (rsi > 70) {
                    score += 15;
                } else if (rsi > 50) {
                    score += 10;
                } else if (rsi < 30) {
                    score -= 15;
                }
            }
        }

        boolean emaBullish = indicators.emaFast() > indicators.emaSlow();
        if ((buy && emaBullish) || (!buy && !emaBullish)) {
            score += 20;
        } else {
            score -= 10;
        }

        double adx = indicators.adx();
        if (adx > 25) {
            score += 15;
        } else if (adx > 20) {
            score += 10;
        } else if (adx < 15) {
            score -= 10;
        }
        return clamp(score);
    }

    double scoreMarketConditions(OhlcvCandle candle, Timeframe granularity) {
        double score = 50.0;

        if (candle != null && candle.close() > 0) {
            double volatilityPct = (candle.high() - candle.low()) / candle.close() * 100.0;
            if (volatilityPct >= 0.05 && volatilityPct <= 0.15) {
                score += 20;
            } else if (volatilityPct >= 0.03 && volatilityPct <= 0.20) {
                score += 10;
            } else if (volatilityPct > 0.30) {
                score -= 15;
            } else if (volatilityPct < 0.02) {
                score -= 10;
            }
        }

        if (granularity != null) {
            switch (granularity) {
                case M5, M15, H1 -> score += 15;
                case M1 -> score -= 5;
                case H4 -> score += 10;
                default -> {
                }
            }
        }
        return clamp(score);
    }

    double scoreTimeframeConfirmation(SignalDirection direction, List<TimeframeSignal> signals) {
        if (signals.isEmpty()) {
            return 50.0;
        }

        long agreements = signals.stream().filter(signal -> signal.direction() == direction).count();
        long disagreements = signals.size() - agreements;
        double score = 50.0 + agreements * 15.0 - disagreements * 10.0;

        for (TimeframeSignal signal : signals) {
            boolean higherTimeframe = signal.timeframe() == Timeframe.H4 || signal.timeframe() == Timeframe.H1;
            if (higherTimeframe && signal.direction() == direction) {
                score += 10;
            }
        }
        return clamp(score);
    }

    double scoreRiskFactors(String symbol, RiskMetrics riskMetrics) {
        double score = 50.0;

        if (modulationProperties.stableSymbols().contains(symbol)) {
            score += 20;
        } else if (modulationProperties.volatileSymbols().contains(symbol)) {
            score += 5;
        }

        double drawdown = riskMetrics.drawdownPercent();
        if (drawdown > 10) {
            score -= 20;
        } else if (drawdown > 5) {
            score -= 10;
        }

        Double winRate = riskMetrics.symbolWinRate();
        if (winRate != null) {
            if (winRate > 60) {
                score += 15;
            } else if (winRate < 40) {
                score -= 15;
            }
        }
        return clamp(score);
    }

    double positionSizeMultiplier(double totalWeight) {
        if (totalWeight >= 80) {
            return 2.0;
        }
        if (totalWeight >= 70) {
            return 1.5;
        }
        if (totalWeight >= 60) {
            return 1.0;
        }
        if (totalWeight >= 50) {
            return 0.75;
        }
        if (totalWeight >= 40) {
            return 0.5;
        }
        return 0.25;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }
}
