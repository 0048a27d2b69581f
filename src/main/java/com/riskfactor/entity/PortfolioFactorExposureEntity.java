package com.riskfactor.entity;

import com.riskfactor.domain.enums.ExposureCompleteness;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the portfolio_factor_exposures table.
 * One row per (portfolio, factor, calculation date). FALLBACK rows come from a direct
 * portfolio-return regression and must be read as lower confidence than FULL or PARTIAL.
 */
@Entity
@Table(
        name = "portfolio_factor_exposures",
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uk_portfolio_factor_exposure",
                        columnNames = {"portfolio_id", "factor_code", "calculation_date"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PortfolioFactorExposureEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "portfolio_id", length = 36, nullable = false)
    private String portfolioId;

    @Column(name = "factor_code", length = 40, nullable = false)
    private String factorCode;

    @Column(name = "calculation_date", nullable = false)
    private LocalDate calculationDate;

    private double beta;

    @Column(name = "dollar_exposure")
    private double dollarExposure;

    @Enumerated(EnumType.STRING)
    @Column(length = 10, nullable = false)
    private ExposureCompleteness completeness;

    @Column(name = "contributing_positions")
    private int contributingPositions;

    @Column(name = "eligible_positions")
    private int eligiblePositions;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
