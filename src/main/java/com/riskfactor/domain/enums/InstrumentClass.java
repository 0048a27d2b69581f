package com.riskfactor.domain.enums;

/**
 * Investment class of a position. Only PUBLIC and OPTIONS instruments have a market-correlated
 * return series and take part in factor regressions; PRIVATE holdings are valued statically.
 */
public enum InstrumentClass {
    PUBLIC,
    OPTIONS,
    PRIVATE;

    public boolean isRegressionEligible() {
        return this == PUBLIC || this == OPTIONS;
    }
}
