package com.riskfactor.factor;

import com.riskfactor.domain.enums.ExposureCompleteness;
import com.riskfactor.domain.model.RegressionResult;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;

/**
 * Portfolio-level exposure to one factor, tagged by how it was obtained.
 *
 * <ul>
 *   <li>{@link Full}: every eligible position produced a beta</li>
 *   <li>{@link Partial}: some eligible positions produced a beta; the rest are listed</li>
 *   <li>{@link Fallback}: no position produced a beta, so the portfolio's own return series was
 *       regressed on the factor. Not diversified across positions and diluted by statically
 *       valued holdings, so it is lower confidence.</li>
 * </ul>
 *
 * <p>Consumers go through {@link #fold} so that each variant is handled explicitly.
 */
public sealed interface AggregatedExposure
        permits AggregatedExposure.Full, AggregatedExposure.Partial, AggregatedExposure.Fallback {

    String factorCode();

    double beta();

    double dollarExposure();

    int eligiblePositions();

    ExposureCompleteness completeness();

    /** Number of positions whose betas were aggregated; zero for a fallback. */
    int contributingPositions();

    <R> R fold(Function<Full, R> onFull, Function<Partial, R> onPartial, Function<Fallback, R> onFallback);

    record Full(String factorCode, double beta, double dollarExposure, int eligiblePositions)
            implements AggregatedExposure {

        @Override
        public ExposureCompleteness completeness() {
            return ExposureCompleteness.FULL;
        }

        @Override
        public int contributingPositions() {
            return eligiblePositions;
        }

        @Override
        public <R> R fold(Function<Full, R> onFull, Function<Partial, R> onPartial, Function<Fallback, R> onFallback) {
            return onFull.apply(this);
        }
    }

    record Partial(
            String factorCode,
            double beta,
            double dollarExposure,
            int eligiblePositions,
            int contributingPositions,
            List<UUID> missingPositionIds)
            implements AggregatedExposure {

        public Partial {
            missingPositionIds = List.copyOf(missingPositionIds);
        }

        @Override
        public ExposureCompleteness completeness() {
            return ExposureCompleteness.PARTIAL;
        }

        @Override
        public <R> R fold(Function<Full, R> onFull, Function<Partial, R> onPartial, Function<Fallback, R> onFallback) {
            return onPartial.apply(this);
        }
    }

    record Fallback(
            String factorCode, double beta, double dollarExposure, int eligiblePositions, RegressionResult regression)
            implements AggregatedExposure {

        @Override
        public ExposureCompleteness completeness() {
            return ExposureCompleteness.FALLBACK;
        }

        @Override
        public int contributingPositions() {
            return 0;
        }

        @Override
        public <R> R fold(Function<Full, R> onFull, Function<Partial, R> onPartial, Function<Fallback, R> onFallback) {
            return onFallback.apply(this);
        }
    }
}
