package com.riskfactor.marketdata;

import com.riskfactor.domain.model.ReturnSeries;
import java.time.LocalDate;

/**
 * Source of daily return series for a symbol.
 *
 * <p>The returned series may be shorter than requested (partial history) or empty when the
 * symbol has no stored prices in the range; callers must align and count observations rather
 * than assume full coverage. An implementation that cannot answer at all throws
 * {@link com.riskfactor.exception.NoReturnDataAvailableException}.
 */
public interface ReturnSeriesAccessor {

    /**
     * @param symbol ticker
     * @param startDate first date of the range, inclusive
     * @param endDate last date of the range, inclusive
     */
    ReturnSeries getReturns(String symbol, LocalDate startDate, LocalDate endDate);
}
