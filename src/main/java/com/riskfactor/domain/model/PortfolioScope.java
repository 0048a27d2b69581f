package com.riskfactor.domain.model;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * The set of portfolios a batch run covers: either every active portfolio, or exactly the
 * listed ones. An explicit scope is never empty.
 */
public final class PortfolioScope {

    private static final PortfolioScope ALL = new PortfolioScope(null);

    private final List<UUID> portfolioIds;

    private PortfolioScope(List<UUID> portfolioIds) {
        this.portfolioIds = portfolioIds;
    }

    public static PortfolioScope all() {
        return ALL;
    }

    /** A null list means all active portfolios. */
    public static PortfolioScope of(List<UUID> portfolioIds) {
        if (portfolioIds == null) {
            return ALL;
        }
        if (portfolioIds.isEmpty()) {
            throw new IllegalArgumentException("Explicit portfolio scope must not be empty");
        }
        return new PortfolioScope(List.copyOf(portfolioIds));
    }

    public boolean isAll() {
        return portfolioIds == null;
    }

    /** Explicit ids, or an empty list for {@link #all()}. */
    public List<UUID> getPortfolioIds() {
        return portfolioIds == null ? List.of() : portfolioIds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PortfolioScope that)) {
            return false;
        }
        return Objects.equals(portfolioIds, that.portfolioIds);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(portfolioIds);
    }

    @Override
    public String toString() {
        return isAll() ? "ALL" : portfolioIds.size() + " portfolio(s)";
    }
}
