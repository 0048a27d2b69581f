package com.riskfactor.domain.enums;

/**
 * Terminal outcome of a batch run request.
 * REJECTED means the run never started (another run was active); it is retryable and
 * distinct from FAILED, which is an in-run failure.
 */
public enum RunOutcome {
    COMPLETED,
    FAILED,
    REJECTED
}
