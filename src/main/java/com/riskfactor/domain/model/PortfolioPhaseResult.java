package com.riskfactor.domain.model;

import com.riskfactor.domain.enums.BatchPhase;
import com.riskfactor.domain.enums.UnitStatus;
import java.util.UUID;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one (portfolio, phase) unit of work. Units never throw past their boundary;
 * failures are reported here instead.
 */
@Getter
@Builder
@ToString
public class PortfolioPhaseResult {

    private final UUID portfolioId;
    private final BatchPhase phase;
    private final UnitStatus status;
    private final String message;
    private final long durationMs;

    public static PortfolioPhaseResult succeeded(UUID portfolioId, BatchPhase phase, String message, long durationMs) {
        return new PortfolioPhaseResult(portfolioId, phase, UnitStatus.SUCCEEDED, message, durationMs);
    }

    public static PortfolioPhaseResult failed(UUID portfolioId, BatchPhase phase, String message, long durationMs) {
        return new PortfolioPhaseResult(portfolioId, phase, UnitStatus.FAILED, message, durationMs);
    }

    public static PortfolioPhaseResult skipped(UUID portfolioId, BatchPhase phase, String reason) {
        return new PortfolioPhaseResult(portfolioId, phase, UnitStatus.SKIPPED, reason, 0L);
    }

    public boolean isFailed() {
        return status == UnitStatus.FAILED;
    }
}
