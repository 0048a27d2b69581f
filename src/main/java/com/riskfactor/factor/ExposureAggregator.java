package com.riskfactor.factor;

import com.riskfactor.domain.model.Position;
import com.riskfactor.domain.model.RegressionResult;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Rolls position betas for one factor up to the portfolio.
 *
 * <p>Portfolio beta = sum(signedMV_i * beta_i) / sum(|MV_i|) over the contributing positions.
 * For a long-only book this is the market-value-weighted average; short positions keep their
 * sign, so a short in a high-beta name lowers the portfolio beta. When every contributor has a
 * zero market value the betas are averaged with equal weight.
 *
 * <p>Dollar exposure = portfolio beta * net market value, where net market value is the sum of
 * signed market values of all positions including PRIVATE and non-contributing ones.
 *
 * <p>When no position contributed, the supplied fallback regression is evaluated; if it is
 * insufficient as well there is no exposure for the factor.
 */
@Component
public class ExposureAggregator {

    public Optional<AggregatedExposure> aggregate(
            String factorCode,
            List<Position> positions,
            Map<UUID, Double> positionBetas,
            Supplier<Optional<RegressionResult>> fallbackRegression) {
        double netMarketValue = netMarketValue(positions);

        List<Position> eligible = positions.stream()
                .filter(Position::isRegressionEligible)
                .toList();

        double weightedSum = 0.0;
        double grossWeight = 0.0;
        double plainSum = 0.0;
        int contributors = 0;
        List<UUID> missing = new ArrayList<>();

        for (Position position : eligible) {
            Double beta = positionBetas.get(position.getId());
            if (beta == null) {
                missing.add(position.getId());
                continue;
            }
            double signedMarketValue = position.getSignedMarketValue().doubleValue();
            weightedSum += signedMarketValue * beta;
            grossWeight += Math.abs(signedMarketValue);
            plainSum += beta;
            contributors++;
        }

        if (contributors == 0) {
            return fallbackRegression.get()
                    .map(regression -> new AggregatedExposure.Fallback(
                            factorCode,
                            regression.getBeta(),
                            regression.getBeta() * netMarketValue,
                            eligible.size(),
                            regression));
        }

        double beta = grossWeight > 0 ? weightedSum / grossWeight : plainSum / contributors;
        double dollarExposure = beta * netMarketValue;

        if (missing.isEmpty()) {
            return Optional.of(new AggregatedExposure.Full(factorCode, beta, dollarExposure, eligible.size()));
        }
        return Optional.of(new AggregatedExposure.Partial(
                factorCode, beta, dollarExposure, eligible.size(), contributors, missing));
    }

    static double netMarketValue(List<Position> positions) {
        return positions.stream()
                .map(Position::getSignedMarketValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .doubleValue();
    }
}
