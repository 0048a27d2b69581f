package com.riskfactor.repository.jpa;

import com.riskfactor.entity.DailyPriceEntity;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface DailyPriceJpaRepository extends JpaRepository<DailyPriceEntity, Long> {

    @Query("SELECT d FROM DailyPriceEntity d WHERE d.symbol = :symbol"
            + " AND d.priceDate BETWEEN :from AND :to ORDER BY d.priceDate ASC")
    List<DailyPriceEntity> findBySymbolAndDateRange(
            @Param("symbol") String symbol, @Param("from") LocalDate from, @Param("to") LocalDate to);
}
