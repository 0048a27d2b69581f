package com.riskfactor.domain.model;

import com.riskfactor.domain.enums.FactorCategory;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A risk factor and the benchmark series it is measured against.
 *
 * <p>CORE factors use {@code longSymbol} alone. SPREAD factors are long {@code longSymbol},
 * short {@code shortSymbol}, and typically use a longer lookback than core factors.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FactorDefinition {

    /** Stable factor id used as the persistence key, e.g. MARKET or QUALITY_SPREAD. */
    private String code;

    private String name;
    private FactorCategory category;
    private String longSymbol;
    private String shortSymbol;
    private int lookbackWindowDays;
    private int minRequiredDays;

    public boolean isSpread() {
        return category == FactorCategory.SPREAD;
    }

    public List<String> getBenchmarkSymbols() {
        return isSpread() ? List.of(longSymbol, shortSymbol) : List.of(longSymbol);
    }
}
