package org.nowstart.signalforge.data.dto;

import java.util.List;
import org.nowstart.signalforge.data.type.CalibrationRunStatus;

/**
 * @param record      newly active record, or the unchanged active record when the run was skipped
 * @param evaluations scored thresholds in ascending order
 * @param breakdown   BUY/SELL stats at the chosen threshold
 */
public record CalibrationRunResult(
        CalibrationRunStatus status,
        CalibrationRecord record,
        List<ThresholdEvaluation> evaluations,
        List<DirectionStats> breakdown,
        String message
) {

    public CalibrationRunResult {
        evaluations = evaluations == null ? List.of() : List.copyOf(evaluations);
        breakdown = breakdown == null ? List.of() : List.copyOf(breakdown);
    }
}
