package com.riskfactor.factor;

import com.riskfactor.domain.model.PortfolioFactorExposure;
import com.riskfactor.domain.model.PositionFactorExposure;
import com.riskfactor.entity.PortfolioFactorExposureEntity;
import com.riskfactor.entity.PositionFactorExposureEntity;
import com.riskfactor.mapper.FactorExposureMapper;
import com.riskfactor.repository.jpa.PortfolioFactorExposureJpaRepository;
import com.riskfactor.repository.jpa.PositionFactorExposureJpaRepository;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes the factor exposures of one portfolio for one calculation date.
 *
 * <p>The write replaces the whole (portfolio, date) slice of both exposure tables in a single
 * transaction: existing rows are deleted, then the new set is inserted. A re-run for the same
 * date therefore overwrites instead of duplicating, and a regression that no longer succeeds
 * leaves no stale row behind. Rows of other portfolios and other dates are untouched.
 */
@Service
public class FactorExposurePersistenceService {

    private static final Logger log = LoggerFactory.getLogger(FactorExposurePersistenceService.class);

    private final PositionFactorExposureJpaRepository positionExposureRepository;
    private final PortfolioFactorExposureJpaRepository portfolioExposureRepository;
    private final FactorExposureMapper factorExposureMapper;

    public FactorExposurePersistenceService(
            PositionFactorExposureJpaRepository positionExposureRepository,
            PortfolioFactorExposureJpaRepository portfolioExposureRepository,
            FactorExposureMapper factorExposureMapper) {
        this.positionExposureRepository = positionExposureRepository;
        this.portfolioExposureRepository = portfolioExposureRepository;
        this.factorExposureMapper = factorExposureMapper;
    }

    @Transactional
    public void replaceExposures(
            UUID portfolioId,
            LocalDate calculationDate,
            List<PositionFactorExposure> positionExposures,
            List<PortfolioFactorExposure> portfolioExposures) {
        String key = portfolioId.toString();
        int deletedPositionRows = positionExposureRepository.deleteByPortfolioAndDate(key, calculationDate);
        int deletedPortfolioRows = portfolioExposureRepository.deleteByPortfolioAndDate(key, calculationDate);

        LocalDateTime now = LocalDateTime.now();
        List<PositionFactorExposureEntity> positionEntities = factorExposureMapper.toPositionEntityList(positionExposures);
        positionEntities.forEach(e -> e.setCreatedAt(now));
        List<PortfolioFactorExposureEntity> portfolioEntities =
                factorExposureMapper.toPortfolioEntityList(portfolioExposures);
        portfolioEntities.forEach(e -> e.setCreatedAt(now));

        positionExposureRepository.saveAll(positionEntities);
        portfolioExposureRepository.saveAll(portfolioEntities);

        log.info("Factor exposures for portfolio {} on {}: {} position rows, {} portfolio rows (replaced {}/{})",
                portfolioId, calculationDate, positionEntities.size(), portfolioEntities.size(),
                deletedPositionRows, deletedPortfolioRows);
    }

    @Transactional(readOnly = true)
    public List<PositionFactorExposure> findPositionExposures(UUID portfolioId, LocalDate calculationDate) {
        return factorExposureMapper.toPositionDomainList(
                positionExposureRepository.findByPortfolioAndDate(portfolioId.toString(), calculationDate));
    }

    @Transactional(readOnly = true)
    public List<PortfolioFactorExposure> findPortfolioExposures(UUID portfolioId, LocalDate calculationDate) {
        return factorExposureMapper.toPortfolioDomainList(
                portfolioExposureRepository.findByPortfolioAndDate(portfolioId.toString(), calculationDate));
    }
}
