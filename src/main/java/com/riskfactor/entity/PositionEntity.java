package com.riskfactor.entity;

import com.riskfactor.domain.enums.InstrumentClass;
import com.riskfactor.domain.enums.OptionType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the positions table.
 * A position is active on a date when it was entered on or before it and not yet exited.
 */
@Entity
@Table(name = "positions", indexes = @Index(name = "idx_positions_portfolio", columnList = "portfolio_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "portfolio_id", length = 36, nullable = false)
    private String portfolioId;

    @Column(length = 50)
    private String symbol;

    @Column(name = "underlying_symbol", length = 50)
    private String underlyingSymbol;

    @Column(name = "signed_quantity", precision = 20, scale = 6)
    private BigDecimal signedQuantity;

    @Column(name = "market_value", precision = 20, scale = 2)
    private BigDecimal marketValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "instrument_class", length = 10)
    private InstrumentClass instrumentClass;

    @Enumerated(EnumType.STRING)
    @Column(name = "option_type", length = 4)
    private OptionType optionType;

    @Column(name = "entry_date")
    private LocalDate entryDate;

    @Column(name = "exit_date")
    private LocalDate exitDate;
}
