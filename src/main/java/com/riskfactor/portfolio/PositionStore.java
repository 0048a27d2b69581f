package com.riskfactor.portfolio;

import com.riskfactor.domain.model.Position;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Read-only access to the holdings of a portfolio.
 */
public interface PositionStore {

    /**
     * Positions held by the portfolio on {@code asOfDate}. Never null; an unknown or empty
     * portfolio yields an empty list.
     */
    List<Position> getPositions(UUID portfolioId, LocalDate asOfDate);
}
