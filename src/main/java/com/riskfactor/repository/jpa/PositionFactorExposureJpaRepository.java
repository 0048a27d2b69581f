package com.riskfactor.repository.jpa;

import com.riskfactor.entity.PositionFactorExposureEntity;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for position-level betas.
 * Rows for a (portfolio, date) are replaced as a set by the factor exposure persistence service.
 */
@Repository
public interface PositionFactorExposureJpaRepository extends JpaRepository<PositionFactorExposureEntity, Long> {

    @Query("SELECT e FROM PositionFactorExposureEntity e WHERE e.portfolioId = :portfolioId"
            + " AND e.calculationDate = :date ORDER BY e.symbol ASC, e.factorCode ASC")
    List<PositionFactorExposureEntity> findByPortfolioAndDate(
            @Param("portfolioId") String portfolioId, @Param("date") LocalDate date);

    List<PositionFactorExposureEntity> findByPositionIdAndCalculationDate(String positionId, LocalDate calculationDate);

    long countByPortfolioIdAndCalculationDate(String portfolioId, LocalDate calculationDate);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM PositionFactorExposureEntity e WHERE e.portfolioId = :portfolioId AND e.calculationDate = :date")
    int deleteByPortfolioAndDate(@Param("portfolioId") String portfolioId, @Param("date") LocalDate date);
}
