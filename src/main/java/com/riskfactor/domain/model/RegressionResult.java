package com.riskfactor.domain.model;

import com.riskfactor.domain.enums.RSquaredQuality;
import lombok.Builder;
import lombok.Getter;

/**
 * Output of one single-factor OLS regression: y = alpha + beta * x + e.
 * {@code beta} is the value used downstream and may be capped; {@code rawBeta} is the
 * unmodified slope.
 */
@Getter
@Builder
public class RegressionResult {

    static final double SIGNIFICANCE_STRICT = 0.05;
    static final double SIGNIFICANCE_RELAXED = 0.10;

    private final double beta;
    private final double rawBeta;
    private final double alpha;
    private final double rSquared;
    private final double standardError;
    private final double pValue;
    private final int observations;
    private final boolean capped;

    public RSquaredQuality getQuality() {
        return RSquaredQuality.classify(rSquared);
    }

    public boolean isSignificant(boolean strict) {
        return pValue < (strict ? SIGNIFICANCE_STRICT : SIGNIFICANCE_RELAXED);
    }
}
