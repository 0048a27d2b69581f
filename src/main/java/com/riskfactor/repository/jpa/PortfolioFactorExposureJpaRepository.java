package com.riskfactor.repository.jpa;

import com.riskfactor.entity.PortfolioFactorExposureEntity;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface PortfolioFactorExposureJpaRepository extends JpaRepository<PortfolioFactorExposureEntity, Long> {

    @Query("SELECT e FROM PortfolioFactorExposureEntity e WHERE e.portfolioId = :portfolioId"
            + " AND e.calculationDate = :date ORDER BY e.factorCode ASC")
    List<PortfolioFactorExposureEntity> findByPortfolioAndDate(
            @Param("portfolioId") String portfolioId, @Param("date") LocalDate date);

    Optional<PortfolioFactorExposureEntity> findByPortfolioIdAndFactorCodeAndCalculationDate(
            String portfolioId, String factorCode, LocalDate calculationDate);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM PortfolioFactorExposureEntity e WHERE e.portfolioId = :portfolioId AND e.calculationDate = :date")
    int deleteByPortfolioAndDate(@Param("portfolioId") String portfolioId, @Param("date") LocalDate date);
}
