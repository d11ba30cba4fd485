package org.nowstart.signalforge.data.dto;

/**
 * External sentiment view. {@code riskConfidence} falls back to {@code confidence} when absent.
 *
 * @param score          sentiment score in [1, 5], 3 is neutral
 * @param confidence     sentiment confidence in [0, 1]
 * @param riskScore      risk score in [1, 5]
 * @param riskConfidence risk confidence in [0, 1]
 */
public record SentimentAssessment(
        double score,
        double confidence,
        double riskScore,
        Double riskConfidence
) {

    public SentimentAssessment {
        requireWithin("score", score, 1.0, 5.0);
        requireWithin("confidence", confidence, 0.0, 1.0);
        requireWithin("riskScore", riskScore, 1.0, 5.0);
        if (riskConfidence == null) {
            riskConfidence = confidence;
        }
        requireWithin("riskConfidence", riskConfidence, 0.0, 1.0);
    }

    private static void requireWithin(String name, double value, double min, double max) {
        if (!(value >= min && value <= max)) {
            throw new IllegalArgumentException("sentiment " + name + " must be within [" + min + ", " + max + "]");
        }
    }
}
