package com.riskfactor.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Ordered phases of a daily batch run. A later phase never starts for a portfolio before
 * the preceding phase has finished for it.
 *
 * <p>A portfolio that fails a critical phase is skipped in every later phase, since their
 * inputs depend on it. Failures in non-critical phases do not cascade.
 */
@Getter
@RequiredArgsConstructor
public enum BatchPhase {
    MARKET_DATA_COVERAGE(1, "Market Data Coverage", true),
    FACTOR_EXPOSURE(2, "Factor Exposure", false);

    private final int order;
    private final String displayName;
    private final boolean critical;
}
