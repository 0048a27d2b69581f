package com.riskfactor.repository.jpa;

import com.riskfactor.entity.PortfolioEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

@Repository
public interface PortfolioJpaRepository extends JpaRepository<PortfolioEntity, String> {

    @Query("SELECT p.id FROM PortfolioEntity p WHERE p.active = true ORDER BY p.createdAt ASC, p.id ASC")
    List<String> findActivePortfolioIds();
}
