package com.riskfactor.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error taxonomy for the batch service. {@code retryable} tells the caller whether the same
 * request can succeed later without being changed (a rejected trigger while another run is
 * active) or must be fixed first (malformed trigger arguments).
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INVALID_ARGUMENTS("INVALID_ARGUMENTS", false),
    BATCH_ALREADY_RUNNING("BATCH_ALREADY_RUNNING", true),
    NO_RETURN_DATA("NO_RETURN_DATA", true),
    UPSTREAM_UNAVAILABLE("UPSTREAM_UNAVAILABLE", true),
    BATCH_DEADLINE_EXCEEDED("BATCH_DEADLINE_EXCEEDED", true),
    BATCH_CANCELLED("BATCH_CANCELLED", true),
    INTERNAL_ERROR("INTERNAL_ERROR", false);

    private final String code;
    private final boolean retryable;
}
