package com.riskfactor.factor;

import com.riskfactor.domain.model.PortfolioFactorExposure;
import com.riskfactor.domain.model.PositionFactorExposure;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * What one engine invocation computed and persisted for a portfolio.
 * {@code factorsWithoutExposure} lists factors for which even the fallback was insufficient.
 */
@Getter
@Builder
@ToString(exclude = {"positionExposures", "aggregatedExposures"})
public class FactorExposureResult {

    private final UUID portfolioId;
    private final LocalDate calculationDate;
    private final int totalPositions;
    private final int eligiblePositions;
    private final int regressionsComputed;
    private final int regressionsSkipped;
    private final List<PositionFactorExposure> positionExposures;
    private final List<PortfolioFactorExposure> portfolioExposures;
    private final List<AggregatedExposure> aggregatedExposures;
    private final List<String> factorsWithoutExposure;

    public long getFallbackCount() {
        return aggregatedExposures.stream()
                .filter(a -> a instanceof AggregatedExposure.Fallback)
                .count();
    }
}
