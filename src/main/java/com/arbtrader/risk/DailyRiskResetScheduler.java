package com.arbtrader.risk;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Drives the controller's time-based duties: the UTC day rollover and the periodic loss check. */
@Component
public class DailyRiskResetScheduler {

    private final RiskController riskController;

    public DailyRiskResetScheduler(RiskController riskController) {
        this.riskController = riskController;
    }

    @Scheduled(cron = "${arbtrader.risk.daily-reset-cron:0 0 0 * * *}", zone = "UTC")
    public void resetDailyCounters() {
        riskController.resetDailyCounters();
    }

    @Scheduled(fixedRateString = "${arbtrader.risk.check-interval-ms:1000}")
    public void checkLimits() {
        riskController.checkLimits();
    }
}
