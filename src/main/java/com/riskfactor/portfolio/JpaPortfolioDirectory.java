package com.riskfactor.portfolio;

import com.riskfactor.exception.UpstreamUnavailableException;
import com.riskfactor.repository.jpa.PortfolioJpaRepository;
import java.util.List;
import java.util.UUID;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
public class JpaPortfolioDirectory implements PortfolioDirectory {

    private final PortfolioJpaRepository portfolioJpaRepository;

    public JpaPortfolioDirectory(PortfolioJpaRepository portfolioJpaRepository) {
        this.portfolioJpaRepository = portfolioJpaRepository;
    }

    @Override
    public List<UUID> getActivePortfolioIds() {
        try {
            return portfolioJpaRepository.findActivePortfolioIds().stream()
                    .map(UUID::fromString)
                    .toList();
        } catch (DataAccessException e) {
            throw new UpstreamUnavailableException("Portfolio directory unavailable", e);
        }
    }
}
