package com.riskfactor.domain.model;

import com.riskfactor.domain.enums.BatchPhase;
import com.riskfactor.domain.enums.RunOutcome;
import com.riskfactor.domain.enums.UnitStatus;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Summary of one orchestrated batch run.
 *
 * <p>{@code portfolioResults} holds, for every portfolio in scope, the result of each phase in
 * execution order. A portfolio counts as failed when any of its phases failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunResult {

    private String runId;
    private LocalDate calculationDate;
    private String triggeredBy;
    private RunOutcome outcome;
    private Instant startedAt;
    private Instant finishedAt;

    @Builder.Default
    private Map<UUID, Map<BatchPhase, PortfolioPhaseResult>> portfolioResults = new LinkedHashMap<>();

    private int succeededPortfolios;
    private int failedPortfolios;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public boolean isSuccess() {
        return outcome == RunOutcome.COMPLETED && failedPortfolios == 0;
    }

    public UnitStatus getPhaseStatus(UUID portfolioId, BatchPhase phase) {
        Map<BatchPhase, PortfolioPhaseResult> phases = portfolioResults.get(portfolioId);
        if (phases == null || !phases.containsKey(phase)) {
            return null;
        }
        return phases.get(phase).getStatus();
    }

    /** FAILED if any phase failed, SUCCEEDED otherwise; null for a portfolio outside the run. */
    public UnitStatus getPortfolioStatus(UUID portfolioId) {
        Map<BatchPhase, PortfolioPhaseResult> phases = portfolioResults.get(portfolioId);
        if (phases == null) {
            return null;
        }
        return phases.values().stream().anyMatch(PortfolioPhaseResult::isFailed)
                ? UnitStatus.FAILED
                : UnitStatus.SUCCEEDED;
    }

    public Duration getDuration() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }
}
