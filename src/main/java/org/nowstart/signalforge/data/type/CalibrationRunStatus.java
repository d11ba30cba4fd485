package org.nowstart.signalforge.data.type;

public enum CalibrationRunStatus {
    COMPLETED,
    REJECTED_CONCURRENT_RUN
}
