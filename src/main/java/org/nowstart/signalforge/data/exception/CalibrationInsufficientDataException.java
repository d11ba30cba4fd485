package org.nowstart.signalforge.data.exception;

import lombok.Getter;

@Getter
public class CalibrationInsufficientDataException extends RuntimeException {

    private final int sampleCount;
    private final int requiredSamples;

    public CalibrationInsufficientDataException(int sampleCount, int requiredSamples, String message) {
        super(message);
        this.sampleCount = sampleCount;
        this.requiredSamples = requiredSamples;
    }
}
