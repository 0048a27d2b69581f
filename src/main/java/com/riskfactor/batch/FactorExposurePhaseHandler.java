package com.riskfactor.batch;

import com.riskfactor.domain.enums.BatchPhase;
import com.riskfactor.factor.FactorExposureEngine;
import com.riskfactor.factor.FactorExposureResult;
import java.time.LocalDate;
import java.util.UUID;
import org.springframework.stereotype.Component;

@Component
public class FactorExposurePhaseHandler implements BatchPhaseHandler {

    private final FactorExposureEngine factorExposureEngine;

    public FactorExposurePhaseHandler(FactorExposureEngine factorExposureEngine) {
        this.factorExposureEngine = factorExposureEngine;
    }

    @Override
    public BatchPhase phase() {
        return BatchPhase.FACTOR_EXPOSURE;
    }

    @Override
    public String execute(UUID portfolioId, LocalDate calculationDate) {
        FactorExposureResult result = factorExposureEngine.calculate(portfolioId, calculationDate);
        return String.format(
                "%d/%d regressions, %d portfolio exposures (%d fallback), %d factors without exposure",
                result.getRegressionsComputed(),
                result.getRegressionsComputed() + result.getRegressionsSkipped(),
                result.getPortfolioExposures().size(),
                result.getFallbackCount(),
                result.getFactorsWithoutExposure().size());
    }
}
