package org.nowstart.signalforge.data.dto;

import java.time.Instant;

/**
 * Immutable snapshot of one calibration result. Exactly one record is active at a time.
 */
public record CalibrationRecord(
        long version,
        double threshold,
        int qualifiedSignalCount,
        double blendedScore,
        double winRate,
        double avgPips,
        int totalSignals,
        Instant computedAt
) {
}
