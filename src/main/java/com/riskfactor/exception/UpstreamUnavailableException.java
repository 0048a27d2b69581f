package com.riskfactor.exception;

public class UpstreamUnavailableException extends BaseException {

    public UpstreamUnavailableException(String message) {
        super(ErrorCode.UPSTREAM_UNAVAILABLE, message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(ErrorCode.UPSTREAM_UNAVAILABLE, message, cause);
    }
}
