package com.riskfactor.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the portfolios table. Written by the portfolio import layer;
 * read here only to resolve the "all active portfolios" scope of a batch run.
 */
@Entity
@Table(name = "portfolios")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PortfolioEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(length = 100)
    private String name;

    private boolean active;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
