package com.riskgate.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the exceptions raised by operator-facing operations. The admission gate itself never
 * throws; these only surface from the circuit breaker admin actions and the REST layer.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = Map.of();
    }
}
