package com.riskfactor.domain.model;

import java.time.LocalDate;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Beta of one position against one factor as of a calculation date.
 * Only written when the regression had enough overlapping observations; a missing row
 * means the regression was skipped.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionFactorExposure {

    private UUID positionId;
    private UUID portfolioId;
    private String symbol;
    private String factorCode;
    private LocalDate calculationDate;
    private double beta;
    private int observations;
    private double rSquared;
    private boolean capped;
}
