package org.nowstart.signalforge.data.dto;

import org.nowstart.signalforge.data.type.SignalDirection;

/**
 * Where the ML confidence component came from. Exactly one source is chosen per signal.
 */
public sealed interface PredictionSource permits PredictionSource.External, PredictionSource.TechnicalFallback {

    double confidence();

    String describe();

    record External(SignalDirection direction, double confidence) implements PredictionSource {

        @Override
        public String describe() {
            return "External prediction " + direction + " at " + Math.round(confidence) + "%";
        }
    }

    record TechnicalFallback(double score) implements PredictionSource {

        @Override
        public double confidence() {
            return score;
        }

        @Override
        public String describe() {
            return "Technical fallback confidence " + Math.round(score) + "%";
        }
    }
}
