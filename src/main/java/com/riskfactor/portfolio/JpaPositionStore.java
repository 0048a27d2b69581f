package com.riskfactor.portfolio;

import com.riskfactor.domain.model.Position;
import com.riskfactor.exception.UpstreamUnavailableException;
import com.riskfactor.mapper.PositionMapper;
import com.riskfactor.repository.jpa.PositionJpaRepository;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
public class JpaPositionStore implements PositionStore {

    private static final Logger log = LoggerFactory.getLogger(JpaPositionStore.class);

    private final PositionJpaRepository positionJpaRepository;
    private final PositionMapper positionMapper;

    public JpaPositionStore(PositionJpaRepository positionJpaRepository, PositionMapper positionMapper) {
        this.positionJpaRepository = positionJpaRepository;
        this.positionMapper = positionMapper;
    }

    @Override
    public List<Position> getPositions(UUID portfolioId, LocalDate asOfDate) {
        try {
            List<Position> positions =
                    positionMapper.toDomainList(positionJpaRepository.findActiveAsOf(portfolioId.toString(), asOfDate));
            log.debug("Loaded {} positions for portfolio {} as of {}", positions.size(), portfolioId, asOfDate);
            return positions;
        } catch (DataAccessException e) {
            throw new UpstreamUnavailableException("Position store unavailable for portfolio " + portfolioId, e);
        }
    }
}
