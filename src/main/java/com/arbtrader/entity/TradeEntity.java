package com.arbtrader.entity;

import com.arbtrader.domain.enums.TradeMode;
import com.arbtrader.domain.enums.TradeStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the trades table.
 * One row per attempted trade, paper or live, with expected and realized profit.
 */
@Entity
@Table(name = "trades", indexes = @Index(name = "idx_trades_executed_at", columnList = "executed_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "route_id", length = 100)
    private String routeId;

    @Column(name = "notional_usd", precision = 20, scale = 6)
    private BigDecimal notionalUsd;

    @Column(name = "expected_profit_usd", precision = 20, scale = 6)
    private BigDecimal expectedProfitUsd;

    @Column(name = "realized_profit_usd", precision = 20, scale = 6)
    private BigDecimal realizedProfitUsd;

    @Column(name = "gas_cost_usd", precision = 20, scale = 8)
    private BigDecimal gasCostUsd;

    private double score;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private TradeStatus status;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private TradeMode mode;

    @Column(name = "tx_ref", length = 100)
    private String txRef;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(name = "executed_at")
    private Instant executedAt;
}
