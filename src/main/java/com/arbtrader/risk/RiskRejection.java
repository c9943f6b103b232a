package com.arbtrader.risk;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Why {@link RiskController#canTrade} refused a trade; used as the metrics tag. */
@Getter
@RequiredArgsConstructor
public enum RiskRejection {
    KILLED("killed", true),
    NOTIONAL_LIMIT("notional_limit", true),
    DAILY_LOSS_LIMIT("daily_loss_limit", true),
    CONSECUTIVE_LOSSES("consecutive_losses", true),
    LOSS_COOLDOWN("loss_cooldown", false),
    TRADE_SPACING("trade_spacing", false),
    HOURLY_LIMIT("hourly_limit", true);

    private final String tag;

    /** Hard blocks are logged at WARN, pacing rejections at DEBUG. */
    private final boolean hardBlock;
}
