package com.riskfactor.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
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
 * JPA entity for the position_factor_exposures table.
 * One row per (position, factor, calculation date) whose regression had enough aligned history.
 * A missing row is the recorded outcome of a skipped regression.
 */
@Entity
@Table(
        name = "position_factor_exposures",
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uk_position_factor_exposure",
                        columnNames = {"position_id", "factor_code", "calculation_date"}),
        indexes = @Index(name = "idx_pfe_portfolio_date", columnList = "portfolio_id, calculation_date"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionFactorExposureEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "position_id", length = 36, nullable = false)
    private String positionId;

    @Column(name = "portfolio_id", length = 36, nullable = false)
    private String portfolioId;

    @Column(length = 50)
    private String symbol;

    @Column(name = "factor_code", length = 40, nullable = false)
    private String factorCode;

    @Column(name = "calculation_date", nullable = false)
    private LocalDate calculationDate;

    private double beta;

    private int observations;

    @Column(name = "r_squared")
    private double rSquared;

    private boolean capped;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
