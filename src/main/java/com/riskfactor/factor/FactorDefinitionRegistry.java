package com.riskfactor.factor;

import com.riskfactor.config.FactorProperties;
import com.riskfactor.domain.enums.FactorCategory;
import com.riskfactor.domain.model.FactorDefinition;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Catalogue of the factors computed for every portfolio.
 *
 * <p>Built once from {@link FactorProperties}. When no definitions are configured the default
 * catalogue is used:
 * <ul>
 *   <li>CORE: Market (SPY), Value (VTV), Growth (VUG), Momentum (MTUM), Quality (QUAL),
 *       Size (IWM), Low Volatility (USMV)</li>
 *   <li>SPREAD: Growth-Value (VUG - VTV), Momentum (MTUM - SPY), Size (IWM - SPY),
 *       Quality (QUAL - SPY)</li>
 * </ul>
 */
@Component
public class FactorDefinitionRegistry {

    private static final Logger log = LoggerFactory.getLogger(FactorDefinitionRegistry.class);

    private final Map<String, FactorDefinition> definitions;

    public FactorDefinitionRegistry(FactorProperties factorProperties) {
        List<FactorDefinition> source = factorProperties.getDefinitions().isEmpty()
                ? defaultCatalogue(factorProperties)
                : fromProperties(factorProperties);

        Map<String, FactorDefinition> byCode = new LinkedHashMap<>();
        for (FactorDefinition definition : source) {
            validate(definition);
            if (byCode.putIfAbsent(definition.getCode(), definition) != null) {
                throw new IllegalStateException("Duplicate factor code: " + definition.getCode());
            }
        }
        this.definitions = Collections.unmodifiableMap(byCode);
        log.info("Factor catalogue loaded: {} factors {}", definitions.size(), definitions.keySet());
    }

    public List<FactorDefinition> getAll() {
        return List.copyOf(definitions.values());
    }

    public List<FactorDefinition> getByCategory(FactorCategory category) {
        return definitions.values().stream()
                .filter(d -> d.getCategory() == category)
                .toList();
    }

    public Optional<FactorDefinition> get(String code) {
        return Optional.ofNullable(definitions.get(code));
    }

    /** Every benchmark symbol referenced by the catalogue, in catalogue order. */
    public Set<String> getBenchmarkSymbols() {
        Set<String> symbols = new LinkedHashSet<>();
        definitions.values().forEach(d -> symbols.addAll(d.getBenchmarkSymbols()));
        return symbols;
    }

    public int getMaxLookbackDays() {
        return definitions.values().stream()
                .mapToInt(FactorDefinition::getLookbackWindowDays)
                .max()
                .orElse(0);
    }

    /**
     * Cross-field checks on the resolved definitions. Single-field constraints are declared on
     * {@link FactorProperties} and enforced when the properties are bound.
     */
    private static void validate(FactorDefinition definition) {
        if (definition.isSpread() && definition.getShortSymbol() == null) {
            throw new IllegalStateException("Spread factor " + definition.getCode() + " needs a short symbol");
        }
        if (definition.getMinRequiredDays() < 3 || definition.getMinRequiredDays() > definition.getLookbackWindowDays()) {
            throw new IllegalStateException("Factor " + definition.getCode()
                    + " needs 3 <= minRequiredDays <= lookbackWindowDays, got "
                    + definition.getMinRequiredDays() + "/" + definition.getLookbackWindowDays());
        }
    }

    private static List<FactorDefinition> fromProperties(FactorProperties properties) {
        List<FactorDefinition> result = new ArrayList<>();
        for (FactorProperties.Definition d : properties.getDefinitions()) {
            boolean spread = d.getCategory() == FactorCategory.SPREAD;
            int lookback = d.getLookbackWindowDays() > 0
                    ? d.getLookbackWindowDays()
                    : spread ? properties.getSpreadLookbackDays() : properties.getCoreLookbackDays();
            int min = d.getMinRequiredDays() > 0
                    ? d.getMinRequiredDays()
                    : spread ? properties.getSpreadMinRequiredDays() : properties.getCoreMinRequiredDays();
            result.add(FactorDefinition.builder()
                    .code(d.getCode())
                    .name(d.getName() != null ? d.getName() : d.getCode())
                    .category(d.getCategory())
                    .longSymbol(d.getLongSymbol())
                    .shortSymbol(spread ? d.getShortSymbol() : null)
                    .lookbackWindowDays(lookback)
                    .minRequiredDays(min)
                    .build());
        }
        return result;
    }

    private static List<FactorDefinition> defaultCatalogue(FactorProperties p) {
        return List.of(
                core("MARKET", "Market", "SPY", p),
                core("VALUE", "Value", "VTV", p),
                core("GROWTH", "Growth", "VUG", p),
                core("MOMENTUM", "Momentum", "MTUM", p),
                core("QUALITY", "Quality", "QUAL", p),
                core("SIZE", "Size", "IWM", p),
                core("LOW_VOLATILITY", "Low Volatility", "USMV", p),
                spread("GROWTH_VALUE_SPREAD", "Growth-Value Spread", "VUG", "VTV", p),
                spread("MOMENTUM_SPREAD", "Momentum Spread", "MTUM", "SPY", p),
                spread("SIZE_SPREAD", "Size Spread", "IWM", "SPY", p),
                spread("QUALITY_SPREAD", "Quality Spread", "QUAL", "SPY", p));
    }

    private static FactorDefinition core(String code, String name, String symbol, FactorProperties p) {
        return FactorDefinition.builder()
                .code(code)
                .name(name)
                .category(FactorCategory.CORE)
                .longSymbol(symbol)
                .lookbackWindowDays(p.getCoreLookbackDays())
                .minRequiredDays(p.getCoreMinRequiredDays())
                .build();
    }

    private static FactorDefinition spread(
            String code, String name, String longSymbol, String shortSymbol, FactorProperties p) {
        return FactorDefinition.builder()
                .code(code)
                .name(name)
                .category(FactorCategory.SPREAD)
                .longSymbol(longSymbol)
                .shortSymbol(shortSymbol)
                .lookbackWindowDays(p.getSpreadLookbackDays())
                .minRequiredDays(p.getSpreadMinRequiredDays())
                .build();
    }
}
