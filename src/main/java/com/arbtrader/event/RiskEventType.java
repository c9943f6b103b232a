package com.arbtrader.event;

/**
 * Classifies the condition behind a {@link RiskEvent}. Persisted as the {@code type}
 * column of the risk_events table.
 */
public enum RiskEventType {

    /** Kill switch latched: daily loss breach, manual kill or emergency stop. */
    KILL_SWITCH_TRIGGERED,

    /** Kill switch cleared by an operator. */
    KILL_SWITCH_RESET,

    /** Advisory: the loss streak reached the reporting threshold. Does not block trading by itself. */
    CONSECUTIVE_LOSSES,

    /** Risk limits changed at runtime (operator or retuning job). */
    LIMITS_UPDATED,

    /** Daily PnL and loss-streak counters were reset at the day boundary. */
    DAILY_COUNTERS_RESET
}
