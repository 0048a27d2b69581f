package com.riskfactor.domain.enums;

/**
 * Run state reported to status pollers. COMPLETED is retained for a while after a run ends
 * (successful or not) and then decays back to IDLE.
 */
public enum BatchRunState {
    IDLE,
    RUNNING,
    COMPLETED
}
