package com.riskfactor.repository.jpa;

import com.riskfactor.entity.PositionEntity;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the positions table.
 * Positions are read as of a calculation date so that a re-run for a past date sees the book
 * as it stood then.
 */
@Repository
public interface PositionJpaRepository extends JpaRepository<PositionEntity, String> {

    @Query("SELECT p FROM PositionEntity p WHERE p.portfolioId = :portfolioId"
            + " AND (p.entryDate IS NULL OR p.entryDate <= :asOf)"
            + " AND (p.exitDate IS NULL OR p.exitDate > :asOf)"
            + " ORDER BY p.symbol ASC")
    List<PositionEntity> findActiveAsOf(@Param("portfolioId") String portfolioId, @Param("asOf") LocalDate asOf);
}
