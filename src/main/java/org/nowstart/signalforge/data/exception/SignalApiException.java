package org.nowstart.signalforge.data.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class SignalApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public SignalApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

}
