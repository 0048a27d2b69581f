package com.riskfactor.config;

import com.riskfactor.domain.enums.FactorCategory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Factor catalogue and regression settings, bound from {@code riskfactor.factors}.
 *
 * <p>When {@code definitions} is empty the built-in catalogue of seven core style factors and
 * four spread factors is used.
 */
@Configuration
@ConfigurationProperties(prefix = "riskfactor.factors")
@Validated
@Getter
@Setter
public class FactorProperties {

    /** Betas beyond +/- this value are clamped. Zero or negative disables the cap. */
    private double betaCap = 5.0;

    /** Calendar days fetched beyond the lookback so weekends and holidays still leave a full window. */
    @PositiveOrZero
    private int fetchBufferDays = 30;

    @Min(3)
    private int coreLookbackDays = 90;

    @Min(3)
    private int coreMinRequiredDays = 60;

    @Min(3)
    private int spreadLookbackDays = 180;

    @Min(3)
    private int spreadMinRequiredDays = 60;

    @Valid
    private List<Definition> definitions = new ArrayList<>();

    /**
     * A configured factor. Lookback and minimum default to the category settings when left at zero.
     */
    @Getter
    @Setter
    public static class Definition {

        @NotBlank
        private String code;

        private String name;

        @NotNull
        private FactorCategory category = FactorCategory.CORE;

        @NotBlank
        private String longSymbol;

        /** Required for SPREAD factors; checked by the registry once categories are known. */
        private String shortSymbol;

        @PositiveOrZero
        private int lookbackWindowDays;

        @PositiveOrZero
        private int minRequiredDays;
    }
}
