package org.nowstart.signalforge.service.modulation;

import org.nowstart.signalforge.data.dto.SentimentAssessment;
import org.nowstart.signalforge.data.dto.SentimentOverlayResult;
import org.springframework.stereotype.Service;

/**
 * {@code final = clamp(base * multiplier * (1 + penalty + bonus), 0.1, 2.0)} where
 * {@code multiplier = (score - 3) * 0.1 * (0.5 + 0.5 * confidence)}.
 */
@Service
public class SentimentOverlayService {

    static final double MIN_INTENSITY = 0.1;
    static final double MAX_INTENSITY = 2.0;

    public SentimentOverlayResult apply(double baseIntensity, double baseConfidence, SentimentAssessment sentiment) {
        double multiplier = sentimentMultiplier(sentiment);
        double penalty = riskPenalty(sentiment);
        double bonus = confidenceBonus(baseConfidence, sentiment);
        double finalIntensity = clampIntensity(baseIntensity * multiplier * (1.0 + penalty + bonus));
        return new SentimentOverlayResult(multiplier, penalty, bonus, finalIntensity);
    }

    public double clampIntensity(double intensity) {
        if (!Double.isFinite(intensity)) {
            return MIN_INTENSITY;
        }
        return Math.max(MIN_INTENSITY, Math.min(MAX_INTENSITY, intensity));
    }

    double sentimentMultiplier(SentimentAssessment sentiment) {
        return (sentiment.score() - 3.0) * 0.1 * (0.5 + sentiment.confidence() * 0.5);
    }

    double riskPenalty(SentimentAssessment sentiment) {
        return sentiment.riskScore() > 3.0 ? -0.15 * sentiment.riskConfidence() : 0.0;
    }

    double confidenceBonus(double baseConfidence, SentimentAssessment sentiment) {
        double bonus = 0.0;
        if (baseConfidence > 70.0) {
            bonus += 0.05;
        }
        if (sentiment.confidence() > 0.7) {
            bonus += 0.03;
        }
        return bonus;
    }
}
