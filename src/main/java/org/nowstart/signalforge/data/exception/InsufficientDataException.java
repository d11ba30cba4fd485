package org.nowstart.signalforge.data.exception;

import lombok.Getter;

/**
 * Raised when an indicator or the strategy input does not carry enough history.
 */
@Getter
public class InsufficientDataException extends RuntimeException {

    private final String indicator;
    private final int required;
    private final int actual;

    public InsufficientDataException(String indicator, int required, int actual) {
        super(indicator + " requires at least " + required + " samples but got " + actual);
        this.indicator = indicator;
        this.required = required;
        this.actual = actual;
    }
}
