package com.riskfactor.domain.enums;

/**
 * How a portfolio-level exposure row was built.
 * <ul>
 *   <li>FULL: every eligible position produced a beta</li>
 *   <li>PARTIAL: some eligible positions were excluded for insufficient data</li>
 *   <li>FALLBACK: no position produced a beta; regressed directly on portfolio returns.
 *       Lower confidence: not diversified across positions and diluted by static-valued holdings.</li>
 * </ul>
 */
public enum ExposureCompleteness {
    FULL,
    PARTIAL,
    FALLBACK
}
