package org.nowstart.signalforge.data.exception;

import java.time.Duration;
import lombok.Getter;

/**
 * Historical signal fetch exceeded its deadline. Callers may retry the run.
 */
@Getter
public class CalibrationTimeoutException extends RuntimeException {

    private final Duration timeout;

    public CalibrationTimeoutException(Duration timeout, Throwable cause) {
        super("Labeled signal fetch timed out after " + timeout.toMillis() + "ms", cause);
        this.timeout = timeout;
    }

    public boolean isRetryable() {
        return true;
    }
}
