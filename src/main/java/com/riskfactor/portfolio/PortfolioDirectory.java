package com.riskfactor.portfolio;

import java.util.List;
import java.util.UUID;

/** Resolves the "all active portfolios" scope of a batch run. */
public interface PortfolioDirectory {

    List<UUID> getActivePortfolioIds();
}
