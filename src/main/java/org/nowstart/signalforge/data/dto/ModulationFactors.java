package org.nowstart.signalforge.data.dto;

/**
 * Weighting components, each clamped to [0, 100].
 */
public record ModulationFactors(
        double mlConfidence,
        double technicalQuality,
        double marketConditions,
        double mtfConfirmation,
        double riskFactors
) {
}
