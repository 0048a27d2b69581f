package com.riskfactor.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Goodness-of-fit buckets for a single-factor regression. Low R-squared means the position is
 * dominated by idiosyncratic risk and the beta explains little of its variance.
 */
@Getter
@RequiredArgsConstructor
public enum RSquaredQuality {
    EXCELLENT(0.70),
    GOOD(0.50),
    FAIR(0.30),
    POOR(0.10),
    VERY_POOR(Double.NEGATIVE_INFINITY);

    private final double lowerBound;

    public static RSquaredQuality classify(double rSquared) {
        for (RSquaredQuality quality : values()) {
            if (rSquared >= quality.lowerBound) {
                return quality;
            }
        }
        return VERY_POOR;
    }
}
