package com.riskfactor.exception;

import java.util.Map;

/**
 * Malformed arguments for a batch trigger. Raised before the run tracker is touched,
 * so a rejected call never leaves any run state behind.
 */
public class InvalidArgumentsException extends BaseException {

    public InvalidArgumentsException(String message) {
        super(ErrorCode.INVALID_ARGUMENTS, message);
    }

    public InvalidArgumentsException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_ARGUMENTS, message, details);
    }
}
