package com.riskfactor.domain.model;

import com.riskfactor.domain.enums.ExposureCompleteness;
import java.time.LocalDate;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioFactorExposure {

    private UUID portfolioId;
    private String factorCode;
    private LocalDate calculationDate;
    private double beta;
    private double dollarExposure;
    private ExposureCompleteness completeness;
    private int contributingPositions;
    private int eligiblePositions;
}
