package com.riskgate.exception;

import java.util.Map;

/** Operator action rejected or failed: bad admin input or a state file that could not be written. */
public class BusinessException extends BaseException {

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
