package com.arbtrader.domain.model;

import com.arbtrader.domain.enums.TradeMode;
import com.arbtrader.domain.enums.TradeStatus;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * Append-only journal entry for an attempted trade. {@code txRef} and {@code error}
 * are null unless the executor filled them in.
 */
@Data
@Builder
public class TradeRecord {

    private String id;
    private String routeId;
    private BigDecimal notionalUsd;
    private BigDecimal expectedProfitUsd;
    private BigDecimal realizedProfitUsd;
    private BigDecimal gasCostUsd;
    private double score;
    private TradeStatus status;
    private TradeMode mode;
    private String txRef;
    private String error;
    private Instant executedAt;
}
