package com.arbtrader.domain.enums;

/** PAPER journals authorized candidates without touching the chain; LIVE is handled by an external executor. */
public enum TradeMode {
    PAPER,
    LIVE
}
