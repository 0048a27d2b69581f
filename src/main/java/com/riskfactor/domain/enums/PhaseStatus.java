package com.riskfactor.domain.enums;

public enum PhaseStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    SKIPPED
}
