package com.arbtrader.risk;

import com.arbtrader.domain.model.DailyAggregate;
import com.arbtrader.domain.model.TradeOutcome;
import com.arbtrader.domain.model.TradeRecord;
import com.arbtrader.event.RiskEvent;
import com.arbtrader.event.RiskEventType;
import com.arbtrader.event.RiskLevel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Stateful authorization gate for trade execution.
 *
 * <p>Two states: ACTIVE (initial) and KILLED. The kill switch latches: once tripped,
 * every {@link #canTrade} call returns false until {@link #resetKillSwitch()}. It trips on:
 * <ul>
 *   <li>a realized daily PnL at or below {@code -maxDailyLossUsd} ({@link #recordTrade},
 *       {@link #checkLimits})</li>
 *   <li>a projected daily PnL at or below the same line ({@link #canTrade})</li>
 *   <li>an explicit {@link #killSwitch(String)} or {@link #emergencyStop()}</li>
 * </ul>
 *
 * <p><b>Guard order in canTrade:</b>
 * <ol>
 *   <li>not killed</li>
 *   <li>notional within {@code maxNotionalUsd}</li>
 *   <li>projected daily PnL above the loss line (trips the kill switch otherwise)</li>
 *   <li>loss streak below {@code maxConsecutiveLosses}</li>
 *   <li>loss cooldown elapsed</li>
 *   <li>minimum spacing since the last trade elapsed</li>
 *   <li>trades in the trailing hour below {@code maxTradesPerHour}</li>
 * </ol>
 * Guards 4-7 are advisory: an internal failure while evaluating one of them is logged
 * and treated as a pass. Guards 1-3 are never bypassed.
 *
 * <p><b>Thread safety:</b> every operation serializes on a single {@link ReentrantLock}.
 * Risk events are collected under the lock and published after it is released, so
 * listeners never run while the lock is held.
 */
@Service
public class RiskController {

    private static final Logger log = LoggerFactory.getLogger(RiskController.class);

    static final int CONSECUTIVE_LOSS_ALERT_THRESHOLD = 3;
    static final String DAILY_LOSS_EXCEEDED = "Daily loss limit exceeded";
    static final String DAILY_LOSS_WOULD_BE_EXCEEDED = "Daily loss limit would be exceeded";

    private static final Duration HOURLY_WINDOW = Duration.ofHours(1);

    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Map<RiskRejection, Counter> rejectionCounters = new EnumMap<>(RiskRejection.class);

    private RiskLimits limits;
    private boolean killed;
    private String killReason;
    private BigDecimal dailyPnl = BigDecimal.ZERO;
    private int consecutiveLosses;
    private Instant lastTradeTime;
    private Instant lastLossTime;
    private final Deque<Instant> recentTradeTimes = new ArrayDeque<>();

    public RiskController(
            RiskLimits riskLimits,
            Clock clock,
            ApplicationEventPublisher applicationEventPublisher,
            MeterRegistry meterRegistry) {
        riskLimits.validate();
        this.limits = riskLimits.copy();
        this.clock = clock;
        this.applicationEventPublisher = applicationEventPublisher;
        for (RiskRejection rejection : RiskRejection.values()) {
            rejectionCounters.put(
                    rejection,
                    Counter.builder("risk.rejections")
                            .description("Trades refused by the risk controller")
                            .tag("reason", rejection.getTag())
                            .register(meterRegistry));
        }
    }

    // ========================
    // AUTHORIZATION
    // ========================

    /**
     * Decides whether a trade of {@code notionalUsd} expected to make {@code expectedProfitUsd}
     * may execute. Never throws. A rejection mutates nothing, except that a projected
     * daily-loss breach trips the kill switch.
     */
    public boolean canTrade(BigDecimal notionalUsd, BigDecimal expectedProfitUsd) {
        List<RiskEvent> pending = new ArrayList<>();
        RiskRejection rejection;
        lock.lock();
        try {
            rejection = evaluateGuards(notionalUsd, expectedProfitUsd, pending);
        } finally {
            lock.unlock();
        }
        publishAll(pending);

        if (rejection == null) {
            return true;
        }
        rejectionCounters.get(rejection).increment();
        if (rejection.isHardBlock()) {
            log.warn("Trade rejected ({}): notional={}, expectedProfit={}", rejection, notionalUsd, expectedProfitUsd);
        } else {
            log.debug("Trade deferred ({}): notional={}", rejection, notionalUsd);
        }
        return false;
    }

    private RiskRejection evaluateGuards(BigDecimal notionalUsd, BigDecimal expectedProfitUsd, List<RiskEvent> pending) {
        if (killed) {
            return RiskRejection.KILLED;
        }
        if (notionalUsd.compareTo(limits.getMaxNotionalUsd()) > 0) {
            return RiskRejection.NOTIONAL_LIMIT;
        }
        BigDecimal projectedPnl = dailyPnl.add(expectedProfitUsd);
        if (projectedPnl.compareTo(limits.getMaxDailyLossUsd().negate()) <= 0) {
            killLocked(DAILY_LOSS_WOULD_BE_EXCEEDED, pending);
            return RiskRejection.DAILY_LOSS_LIMIT;
        }

        try {
            return evaluateAdvisoryGuards(Instant.now(clock));
        } catch (RuntimeException e) {
            log.warn("Advisory risk guard failed, allowing trade: {}", e.getMessage(), e);
            return null;
        }
    }

    private RiskRejection evaluateAdvisoryGuards(Instant now) {
        if (consecutiveLosses >= limits.getMaxConsecutiveLosses()) {
            return RiskRejection.CONSECUTIVE_LOSSES;
        }
        if (lastLossTime != null && elapsedMs(lastLossTime, now) < limits.getCooldownAfterLossMs()) {
            return RiskRejection.LOSS_COOLDOWN;
        }
        if (lastTradeTime != null && elapsedMs(lastTradeTime, now) < limits.getMinTimeBetweenTradesMs()) {
            return RiskRejection.TRADE_SPACING;
        }
        if (tradesInLastHour(now) >= limits.getMaxTradesPerHour()) {
            return RiskRejection.HOURLY_LIMIT;
        }
        return null;
    }

    // ========================
    // OUTCOMES
    // ========================

    /**
     * Books a realized outcome: updates daily PnL, the loss streak and trade times, then
     * trips the kill switch if the daily loss line has been reached. A realized profit of
     * exactly zero counts as a loss.
     */
    public void recordTrade(TradeOutcome outcome) {
        List<RiskEvent> pending = new ArrayList<>();
        lock.lock();
        try {
            Instant now = Instant.now(clock);
            dailyPnl = dailyPnl.add(outcome.getRealizedProfitUsd());
            if (outcome.isLoss()) {
                consecutiveLosses++;
                lastLossTime = now;
            } else {
                consecutiveLosses = 0;
            }
            lastTradeTime = now;
            recentTradeTimes.addLast(now);

            log.info(
                    "Trade recorded: realized={}, dailyPnl={}, consecutiveLosses={}",
                    outcome.getRealizedProfitUsd(),
                    dailyPnl,
                    consecutiveLosses);

            if (outcome.isLoss() && consecutiveLosses >= CONSECUTIVE_LOSS_ALERT_THRESHOLD) {
                log.warn("{} consecutive losing trades", consecutiveLosses);
                pending.add(event(
                        RiskEventType.CONSECUTIVE_LOSSES,
                        RiskLevel.WARNING,
                        consecutiveLosses + " consecutive losing trades"));
            }
            checkDailyLossLocked(pending);
        } finally {
            lock.unlock();
        }
        publishAll(pending);
    }

    /** Re-applies the realized daily loss rule; scheduled every second by default. */
    public void checkLimits() {
        List<RiskEvent> pending = new ArrayList<>();
        lock.lock();
        try {
            checkDailyLossLocked(pending);
        } finally {
            lock.unlock();
        }
        publishAll(pending);
    }

    private void checkDailyLossLocked(List<RiskEvent> pending) {
        if (dailyPnl.compareTo(limits.getMaxDailyLossUsd().negate()) <= 0) {
            killLocked(DAILY_LOSS_EXCEEDED + ": dailyPnl=" + dailyPnl.toPlainString(), pending);
        }
    }

    // ========================
    // KILL SWITCH
    // ========================

    /** Trips the kill switch. If already killed, the first reason is kept and nothing is published. */
    public void killSwitch(String reason) {
        List<RiskEvent> pending = new ArrayList<>();
        lock.lock();
        try {
            if (!killLocked(reason, pending)) {
                log.warn("Kill switch already active ({}), ignoring: {}", killReason, reason);
            }
        } finally {
            lock.unlock();
        }
        publishAll(pending);
    }

    public void emergencyStop() {
        killSwitch("Emergency stop");
    }

    public void resetKillSwitch() {
        List<RiskEvent> pending = new ArrayList<>();
        lock.lock();
        try {
            if (!killed) {
                log.info("Kill switch reset requested but controller is active");
                return;
            }
            String previousReason = killReason;
            killed = false;
            killReason = null;
            log.info("Kill switch reset, trading resumed (was: {})", previousReason);
            pending.add(event(
                    RiskEventType.KILL_SWITCH_RESET, RiskLevel.INFO, "Kill switch reset (was: " + previousReason + ")"));
        } finally {
            lock.unlock();
        }
        publishAll(pending);
    }

    private boolean killLocked(String reason, List<RiskEvent> pending) {
        if (killed) {
            return false;
        }
        killed = true;
        killReason = reason;
        log.error("KILL SWITCH ACTIVATED: {}", reason);
        pending.add(event(RiskEventType.KILL_SWITCH_TRIGGERED, RiskLevel.CRITICAL, "Kill switch activated: " + reason));
        return true;
    }

    // ========================
    // LIMITS & COUNTERS
    // ========================

    /**
     * Merges the non-null fields of {@code update} into the live limits, effective for the
     * next {@link #canTrade} call.
     *
     * @throws com.arbtrader.exception.InvalidConfigurationException if the merged limits are invalid;
     *     the current limits are kept
     */
    public RiskLimits updateLimits(RiskLimitsUpdate update) {
        List<RiskEvent> pending = new ArrayList<>();
        RiskLimits applied;
        lock.lock();
        try {
            RiskLimits merged = update.applyTo(limits);
            merged.validate();
            limits = merged;
            applied = merged.copy();
            log.info("Risk limits updated: {}", applied);
            pending.add(event(RiskEventType.LIMITS_UPDATED, RiskLevel.INFO, "Risk limits updated: " + applied));
        } finally {
            lock.unlock();
        }
        publishAll(pending);
        return applied;
    }

    /** Start of a new trading day: clears PnL, the loss streak and the loss cooldown. The kill switch stays as is. */
    public void resetDailyCounters() {
        List<RiskEvent> pending = new ArrayList<>();
        lock.lock();
        try {
            log.info("Resetting daily risk counters (dailyPnl was {})", dailyPnl);
            dailyPnl = BigDecimal.ZERO;
            consecutiveLosses = 0;
            lastLossTime = null;
            pending.add(event(RiskEventType.DAILY_COUNTERS_RESET, RiskLevel.INFO, "Daily risk counters reset"));
        } finally {
            lock.unlock();
        }
        publishAll(pending);
    }

    /**
     * Seeds state after a restart from today's aggregate and the journaled trades.
     *
     * @param aggregate today's PnL aggregate (UTC day)
     * @param recentTrades journaled trades, newest first; today's trades give the loss
     *     streak and loss time, those of the trailing hour the rate window
     */
    public void rehydrate(DailyAggregate aggregate, List<TradeRecord> recentTrades) {
        List<RiskEvent> pending = new ArrayList<>();
        lock.lock();
        try {
            Instant now = Instant.now(clock);
            Instant startOfDay = LocalDate.now(clock.withZone(ZoneOffset.UTC))
                    .atStartOfDay(ZoneOffset.UTC)
                    .toInstant();

            dailyPnl = aggregate.getDailyPnl();
            consecutiveLosses = 0;
            lastLossTime = null;
            lastTradeTime = null;
            recentTradeTimes.clear();

            boolean streakOpen = true;
            for (TradeRecord trade : recentTrades) {
                Instant executedAt = trade.getExecutedAt();
                if (executedAt == null || trade.getRealizedProfitUsd() == null) {
                    continue;
                }
                if (lastTradeTime == null || executedAt.isAfter(lastTradeTime)) {
                    lastTradeTime = executedAt;
                }
                if (executedAt.isAfter(now.minus(HOURLY_WINDOW))) {
                    recentTradeTimes.addFirst(executedAt);
                }
                if (executedAt.isBefore(startOfDay)) {
                    continue;
                }
                boolean loss = trade.getRealizedProfitUsd().signum() <= 0;
                if (loss && lastLossTime == null) {
                    lastLossTime = executedAt;
                }
                if (streakOpen && loss) {
                    consecutiveLosses++;
                } else {
                    streakOpen = false;
                }
            }

            log.info(
                    "Risk state rehydrated: dailyPnl={}, consecutiveLosses={}, tradesInLastHour={}",
                    dailyPnl,
                    consecutiveLosses,
                    recentTradeTimes.size());
            checkDailyLossLocked(pending);
        } finally {
            lock.unlock();
        }
        publishAll(pending);
    }

    // ========================
    // QUERIES
    // ========================

    public RiskState getState() {
        lock.lock();
        try {
            return snapshotLocked();
        } finally {
            lock.unlock();
        }
    }

    public RiskLimits getLimits() {
        lock.lock();
        try {
            return limits.copy();
        } finally {
            lock.unlock();
        }
    }

    public boolean isKilled() {
        lock.lock();
        try {
            return killed;
        } finally {
            lock.unlock();
        }
    }

    private RiskState snapshotLocked() {
        return RiskState.builder()
                .killed(killed)
                .killReason(killReason)
                .dailyPnl(dailyPnl)
                .consecutiveLosses(consecutiveLosses)
                .lastTradeTime(lastTradeTime)
                .lastLossTime(lastLossTime)
                .tradesInLastHour(tradesInLastHour(Instant.now(clock)))
                .build();
    }

    private int tradesInLastHour(Instant now) {
        Instant windowStart = now.minus(HOURLY_WINDOW);
        while (!recentTradeTimes.isEmpty() && !recentTradeTimes.peekFirst().isAfter(windowStart)) {
            recentTradeTimes.pollFirst();
        }
        return recentTradeTimes.size();
    }

    private static long elapsedMs(Instant from, Instant to) {
        return Duration.between(from, to).toMillis();
    }

    private RiskEvent event(RiskEventType type, RiskLevel level, String message) {
        return new RiskEvent(this, type, level, message, snapshotLocked().toSnapshot(), Instant.now(clock));
    }

    private void publishAll(List<RiskEvent> events) {
        for (RiskEvent event : events) {
            applicationEventPublisher.publishEvent(event);
        }
    }
}
