package com.riskfactor.domain.enums;

/**
 * CORE factors regress against a single benchmark series. SPREAD factors regress against
 * the long benchmark minus the short benchmark (e.g. QUAL - SPY).
 */
public enum FactorCategory {
    CORE,
    SPREAD
}
