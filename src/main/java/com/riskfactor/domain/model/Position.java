package com.riskfactor.domain.model;

import com.riskfactor.domain.enums.InstrumentClass;
import com.riskfactor.domain.enums.OptionType;
import java.math.BigDecimal;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A holding of a portfolio as of a calculation date, as supplied by the position store.
 *
 * <p>Quantity is signed: positive = long, negative = short. Market value may be stored
 * unsigned by upstream importers, so direction is always taken from the quantity and
 * never from the stored value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private UUID id;
    private UUID portfolioId;
    private String symbol;

    /** Underlying equity for option contracts. The option's return series is read for it when set. */
    private String underlyingSymbol;

    private BigDecimal signedQuantity;
    private BigDecimal marketValue;
    private InstrumentClass instrumentClass;

    /** Null for non-option instruments. */
    private OptionType optionType;

    public boolean isShort() {
        return signedQuantity != null && signedQuantity.signum() < 0;
    }

    /** Market value carrying the direction of the quantity. Zero when either input is missing. */
    public BigDecimal getSignedMarketValue() {
        if (marketValue == null || signedQuantity == null || signedQuantity.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal magnitude = marketValue.abs();
        return isShort() ? magnitude.negate() : magnitude;
    }

    /** PUBLIC or OPTIONS with a non-zero quantity and a symbol to look up returns for. */
    public boolean isRegressionEligible() {
        return instrumentClass != null
                && instrumentClass.isRegressionEligible()
                && signedQuantity != null
                && signedQuantity.signum() != 0
                && getReturnSymbol() != null;
    }

    public String getReturnSymbol() {
        if (instrumentClass == InstrumentClass.OPTIONS && underlyingSymbol != null && !underlyingSymbol.isBlank()) {
            return underlyingSymbol;
        }
        return symbol == null || symbol.isBlank() ? null : symbol;
    }
}
