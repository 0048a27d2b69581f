package com.riskfactor.exception;

/**
 * Fatal orchestration error: the phase loop itself could not continue (deadline expired,
 * worker interrupted, executor rejected the work). The run tracker is always cleared
 * before this propagates.
 */
public class BatchExecutionException extends BaseException {

    public BatchExecutionException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public BatchExecutionException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
