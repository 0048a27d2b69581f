package com.riskfactor.domain.model;

import java.time.Instant;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * The batch run currently held by the run tracker. Never persisted; it exists from a
 * successful start until the matching complete.
 */
@Getter
@Builder
@ToString
public class BatchRun {

    private final String runId;
    private final LocalDate calculationDate;
    private final PortfolioScope portfolioScope;
    private final Instant startedAt;
    private final String triggeredBy;
}
