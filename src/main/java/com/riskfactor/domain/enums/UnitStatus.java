package com.riskfactor.domain.enums;

/**
 * Outcome of one portfolio within one phase. SKIPPED means the portfolio failed an earlier
 * critical phase, or the run was aborted before the unit could execute.
 */
public enum UnitStatus {
    SUCCEEDED,
    FAILED,
    SKIPPED
}
