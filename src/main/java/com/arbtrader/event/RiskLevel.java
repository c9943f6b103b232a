package com.arbtrader.event;

/**
 * Severity level for a {@link RiskEvent}.
 *
 * <p>INFO for bookkeeping (resets, limit changes), WARNING for advisories that need
 * attention, CRITICAL for transitions that stop trading.
 */
public enum RiskLevel {
    INFO,
    WARNING,
    CRITICAL
}
