package com.launchbot.hft.launchpad.risk;

import com.launchbot.hft.domain.Signal;
import com.launchbot.hft.domain.SignalAction;
import com.launchbot.hft.domain.StrategyTag;
import com.launchbot.hft.events.AlertCategory;
import com.launchbot.hft.events.AlertSeverity;
import com.launchbot.hft.launchpad.alert.AlertPublisher;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Single authority for trade approval. Owns the portfolio risk state and the circuit breaker.
 *
 * <p>Every public method takes the manager's monitor, so checks and reservations are atomic with respect
 * to each other. Entry approvals reserve an open-position slot and exposure that is either confirmed at the
 * filled size, released, or expired after {@link RiskLimits#reservationTimeout()}. An expired reservation
 * stays on record for {@link #LATE_FILL_WINDOW_MULTIPLE} timeouts so a fill that lands late is still booked.
 *
 * <p>Exits ({@link SignalAction#SELL}) are always approved at their requested size.
 */
@Slf4j
public class RiskManager {

    private static final int SCALE = 12;
    static final int LATE_FILL_WINDOW_MULTIPLE = 10;

    private final RiskLimits limits;
    private final AlertPublisher alerts;
    private final Clock clock;

    private final Map<String, Reservation> reservations = new LinkedHashMap<>();
    private final Map<String, Reservation> lapsed = new LinkedHashMap<>();
    private final Map<String, BigDecimal> exposureByMint = new HashMap<>();
    private final Map<StrategyTag, BigDecimal> exposureByStrategy = new EnumMap<>(StrategyTag.class);
    private final Set<StrategyTag> paused = EnumSet.noneOf(StrategyTag.class);
    private final Deque<Boolean> apiOutcomes = new ArrayDeque<>();

    private int openPositionCount;
    private int consecutiveLossCount;
    private BigDecimal dailyRealizedPnl = BigDecimal.ZERO;
    private BigDecimal equity;
    private BigDecimal peakEquity;
    private boolean circuitBreakerTripped;
    private String tripReason;
    private LocalDate tradingDay;

    public RiskManager(RiskLimits limits, AlertPublisher alerts, Clock clock) {
        this.limits = limits;
        this.alerts = alerts;
        this.clock = clock;
        this.equity = limits.portfolioValue();
        this.peakEquity = limits.portfolioValue();
        this.tradingDay = tradingDay(clock.instant());
    }

    public synchronized RiskDecision evaluate(Signal signal) {
        Instant now = clock.instant();
        rollDayIfNeeded(now);

        if (signal.action() == SignalAction.AVOID) {
            return RiskDecision.reject(signal.id(), RejectReason.NO_ACTION, signal.protectionLevel());
        }
        if (signal.action() == SignalAction.SELL) {
            log.debug("exit {} approved mint={} size={}", signal.id(), signal.mintId(), signal.targetSizeBaseUnits());
            return RiskDecision.approve(signal.id(), signal.targetSizeBaseUnits(), signal.protectionLevel());
        }

        BigDecimal requested = signal.targetSizeBaseUnits() == null ? BigDecimal.ZERO : signal.targetSizeBaseUnits();

        if (circuitBreakerTripped) {
            return reject(signal, RejectReason.CIRCUIT_BREAKER);
        }
        if (dailyRealizedPnl.compareTo(limits.maxDailyLoss().negate()) <= 0) {
            alerts.publish(AlertSeverity.HIGH, AlertCategory.DAILY_LOSS_LIMIT, Map.of(
                    "dailyRealizedPnl", dailyRealizedPnl,
                    "maxDailyLoss", limits.maxDailyLoss()
            ), now);
            trip("daily loss limit reached: " + dailyRealizedPnl.toPlainString(), now);
            return reject(signal, RejectReason.DAILY_LOSS_LIMIT);
        }
        if (paused.contains(signal.strategyTag())) {
            return reject(signal, RejectReason.STRATEGY_PAUSED);
        }
        if (openPositionCount + reservations.size() >= limits.maxOpenPositions()) {
            return reject(signal, RejectReason.MAX_OPEN_POSITIONS);
        }

        BigDecimal mintCap = equity.multiply(BigDecimal.valueOf(limits.maxPerMintFraction()));
        if (mintExposure(signal.mintId()).add(requested).compareTo(mintCap) > 0) {
            return reject(signal, RejectReason.CONCENTRATION);
        }
        BigDecimal clusterCap = equity.multiply(BigDecimal.valueOf(limits.maxCorrelatedFraction()));
        if (strategyExposure(signal.strategyTag()).add(requested).compareTo(clusterCap) > 0) {
            return reject(signal, RejectReason.CORRELATION);
        }

        BigDecimal cap = limits.maxPositionSize().multiply(BigDecimal.valueOf(drawdownScale()));
        BigDecimal adjusted = requested.min(cap).setScale(SCALE, RoundingMode.DOWN).stripTrailingZeros();
        if (adjusted.compareTo(limits.minTradeSize()) < 0) {
            return reject(signal, RejectReason.SIZE_TOO_SMALL);
        }

        reservations.put(signal.id(), new Reservation(signal.mintId(), signal.strategyTag(), adjusted, now));
        log.info("risk approved {} mint={} strategy={} requested={} adjusted={} reserved={}",
                signal.id(), signal.mintId(), signal.strategyTag(), requested, adjusted, reservations.size());
        return RiskDecision.approve(signal.id(), adjusted, signal.protectionLevel());
    }

    /**
     * Convert a reservation into exposure at the filled size. A zero fill releases it.
     *
     * <p>A fill whose reservation already expired is still booked and raises a {@link AlertCategory#LATE_FILL}
     * alert.
     *
     * @return false when no reservation is known for the signal (released, or expired too long ago)
     */
    public synchronized boolean confirm(String signalId, BigDecimal filledSize) {
        Reservation reservation = reservations.remove(signalId);
        boolean late = false;
        if (reservation == null) {
            reservation = lapsed.remove(signalId);
            late = reservation != null;
        }
        if (reservation == null) {
            log.warn("confirm for unknown reservation {}", signalId);
            return false;
        }
        if (filledSize == null || filledSize.signum() <= 0) {
            log.info("reservation {} released on zero fill", signalId);
            return true;
        }
        if (late) {
            log.warn("reservation {} expired before its fill, booking {} on mint {} anyway",
                    signalId, filledSize, reservation.mintId());
            alerts.publish(AlertSeverity.HIGH, AlertCategory.LATE_FILL, Map.of(
                    "signalId", signalId,
                    "mintId", reservation.mintId(),
                    "filledSize", filledSize
            ), clock.instant());
        }
        exposureByMint.merge(reservation.mintId(), filledSize, BigDecimal::add);
        exposureByStrategy.merge(reservation.strategyTag(), filledSize, BigDecimal::add);
        openPositionCount++;
        log.info("reservation {} confirmed mint={} filled={} openPositions={}",
                signalId, reservation.mintId(), filledSize, openPositionCount);
        return true;
    }

    public synchronized boolean release(String signalId) {
        lapsed.remove(signalId);
        Reservation reservation = reservations.remove(signalId);
        if (reservation != null) {
            log.info("reservation {} released mint={} size={}", signalId, reservation.mintId(), reservation.size());
        }
        return reservation != null;
    }

    /**
     * Release reservations that were never confirmed within the timeout.
     *
     * @return ids of the expired reservations
     */
    public synchronized List<String> expireReservations() {
        Instant now = clock.instant();
        List<String> expired = new ArrayList<>();
        Iterator<Map.Entry<String, Reservation>> it = reservations.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Reservation> e = it.next();
            Reservation r = e.getValue();
            if (Duration.between(r.createdAt(), now).compareTo(limits.reservationTimeout()) >= 0) {
                it.remove();
                lapsed.put(e.getKey(), r);
                expired.add(e.getKey());
                log.warn("reservation {} expired mint={} size={}", e.getKey(), r.mintId(), r.size());
                alerts.publish(AlertSeverity.MEDIUM, AlertCategory.RESERVATION_EXPIRED, Map.of(
                        "signalId", e.getKey(),
                        "mintId", r.mintId(),
                        "size", r.size()
                ), now);
            }
        }
        Duration lateWindow = limits.reservationTimeout().multipliedBy(LATE_FILL_WINDOW_MULTIPLE);
        lapsed.values().removeIf(r -> Duration.between(r.createdAt(), now).compareTo(lateWindow) >= 0);
        return expired;
    }

    /**
     * Fold a partial or final exit into portfolio state.
     */
    public synchronized void recordExit(ExitFill fill) {
        Instant now = clock.instant();
        rollDayIfNeeded(now);

        BigDecimal released = fill.releasedBaseUnits() == null ? BigDecimal.ZERO : fill.releasedBaseUnits();
        reduce(exposureByMint, fill.mintId(), released);
        reduce(exposureByStrategy, fill.strategyTag(), released);

        BigDecimal pnl = fill.realizedPnl() == null ? BigDecimal.ZERO : fill.realizedPnl();
        dailyRealizedPnl = dailyRealizedPnl.add(pnl);
        equity = equity.add(pnl);
        if (equity.compareTo(peakEquity) > 0) {
            peakEquity = equity;
        }

        if (fill.closed()) {
            if (openPositionCount > 0) {
                openPositionCount--;
            }
            BigDecimal positionPnl = fill.positionPnl() == null ? pnl : fill.positionPnl();
            if (positionPnl.signum() < 0) {
                consecutiveLossCount++;
            } else {
                consecutiveLossCount = 0;
            }
        }
        log.info("exit recorded mint={} strategy={} released={} pnl={} closed={} daily={} equity={} losses={}",
                fill.mintId(), fill.strategyTag(), released, pnl, fill.closed(), dailyRealizedPnl, equity,
                consecutiveLossCount);

        if (consecutiveLossCount >= limits.consecutiveLossLimit()) {
            trip(consecutiveLossCount + " consecutive losses", now);
        }
        double drawdown = drawdownFromPeak();
        if (limits.maxDrawdownPct() > 0.0 && drawdown >= limits.maxDrawdownPct()) {
            trip(String.format("drawdown %.4f from peak", drawdown), now);
        }
    }

    /**
     * Feed the external API error-rate window. Trips the breaker once the window has enough samples and the
     * error rate exceeds the threshold.
     */
    public synchronized void recordApiOutcome(boolean success) {
        apiOutcomes.addLast(success);
        while (apiOutcomes.size() > limits.apiErrorWindow()) {
            apiOutcomes.removeFirst();
        }
        if (apiOutcomes.size() < limits.apiErrorMinSamples()) {
            return;
        }
        long errors = apiOutcomes.stream().filter(ok -> !ok).count();
        double rate = (double) errors / apiOutcomes.size();
        if (rate > limits.apiErrorRateThreshold()) {
            trip(String.format("api error rate %.2f over %d calls", rate, apiOutcomes.size()), clock.instant());
        }
    }

    /**
     * Clear the breaker. The loss streak and API window restart, and the drawdown peak is re-based to current
     * equity so the same drawdown does not trip again immediately.
     *
     * @return false when the breaker was not tripped
     */
    public synchronized boolean manualResetCircuitBreaker() {
        if (!circuitBreakerTripped) {
            return false;
        }
        String previous = tripReason;
        circuitBreakerTripped = false;
        tripReason = null;
        consecutiveLossCount = 0;
        apiOutcomes.clear();
        peakEquity = equity;
        log.warn("circuit breaker manually reset (was: {})", previous);
        alerts.publish(AlertSeverity.INFO, AlertCategory.CIRCUIT_BREAKER_RESET,
                Map.of("previousReason", previous == null ? "" : previous), clock.instant());
        return true;
    }

    public synchronized boolean pauseStrategy(StrategyTag tag) {
        if (!paused.add(tag)) {
            return false;
        }
        log.warn("strategy {} paused", tag);
        alerts.publish(AlertSeverity.LOW, AlertCategory.STRATEGY_PAUSED, Map.of("strategy", tag.name()),
                clock.instant());
        return true;
    }

    public synchronized boolean resumeStrategy(StrategyTag tag) {
        if (!paused.remove(tag)) {
            return false;
        }
        log.info("strategy {} resumed", tag);
        alerts.publish(AlertSeverity.LOW, AlertCategory.STRATEGY_RESUMED, Map.of("strategy", tag.name()),
                clock.instant());
        return true;
    }

    public synchronized boolean isPaused(StrategyTag tag) {
        return paused.contains(tag);
    }

    public synchronized boolean isCircuitBreakerTripped() {
        return circuitBreakerTripped;
    }

    /**
     * Reset daily counters if the configured boundary has passed. Called on every evaluation and by housekeeping.
     */
    public synchronized void rollDayIfNeeded() {
        rollDayIfNeeded(clock.instant());
    }

    public synchronized PortfolioRiskState snapshot() {
        Map<String, BigDecimal> byMint = new HashMap<>(exposureByMint);
        reservations.values().forEach(r -> byMint.merge(r.mintId(), r.size(), BigDecimal::add));
        return new PortfolioRiskState(
                dailyRealizedPnl,
                openPositionCount,
                reservations.size(),
                byMint,
                exposureByStrategy,
                consecutiveLossCount,
                circuitBreakerTripped,
                tripReason,
                equity,
                peakEquity,
                drawdownFromPeak(),
                paused,
                clock.instant()
        );
    }

    /**
     * Sizing multiplier in [minDrawdownScale, 1]; shrinks linearly as drawdown approaches the maximum.
     */
    double drawdownScale() {
        if (limits.maxDrawdownPct() <= 0.0) {
            return 1.0;
        }
        double scale = 1.0 - drawdownFromPeak() / limits.maxDrawdownPct();
        return Math.max(limits.minDrawdownScale(), Math.min(1.0, scale));
    }

    private double drawdownFromPeak() {
        if (peakEquity.signum() <= 0 || equity.compareTo(peakEquity) >= 0) {
            return 0.0;
        }
        return peakEquity.subtract(equity).divide(peakEquity, 8, RoundingMode.HALF_UP).doubleValue();
    }

    private void trip(String reason, Instant now) {
        if (circuitBreakerTripped) {
            return;
        }
        circuitBreakerTripped = true;
        tripReason = reason;
        log.error("CIRCUIT BREAKER TRIPPED: {}", reason);
        alerts.publish(AlertSeverity.CRITICAL, AlertCategory.CIRCUIT_BREAKER_TRIPPED, Map.of(
                "reason", reason,
                "consecutiveLossCount", consecutiveLossCount,
                "dailyRealizedPnl", dailyRealizedPnl,
                "equity", equity
        ), now);
    }

    private RiskDecision reject(Signal signal, RejectReason reason) {
        log.warn("risk rejected {} mint={} strategy={} reason={}",
                signal.id(), signal.mintId(), signal.strategyTag(), reason.code());
        return RiskDecision.reject(signal.id(), reason, signal.protectionLevel());
    }

    private BigDecimal mintExposure(String mintId) {
        BigDecimal total = exposureByMint.getOrDefault(mintId, BigDecimal.ZERO);
        for (Reservation r : reservations.values()) {
            if (r.mintId().equals(mintId)) {
                total = total.add(r.size());
            }
        }
        return total;
    }

    private BigDecimal strategyExposure(StrategyTag tag) {
        BigDecimal total = exposureByStrategy.getOrDefault(tag, BigDecimal.ZERO);
        for (Reservation r : reservations.values()) {
            if (r.strategyTag() == tag) {
                total = total.add(r.size());
            }
        }
        return total;
    }

    private void rollDayIfNeeded(Instant now) {
        LocalDate day = tradingDay(now);
        if (!day.equals(tradingDay)) {
            log.info("daily risk counters reset: {} -> {} (realized {})", tradingDay, day, dailyRealizedPnl);
            tradingDay = day;
            dailyRealizedPnl = BigDecimal.ZERO;
        }
    }

    private LocalDate tradingDay(Instant now) {
        return LocalDateTime.ofInstant(now, limits.dailyResetZone())
                .minusHours(limits.dailyResetHour())
                .toLocalDate();
    }

    private static <K> void reduce(Map<K, BigDecimal> map, K key, BigDecimal amount) {
        BigDecimal current = map.get(key);
        if (current == null) {
            return;
        }
        BigDecimal next = current.subtract(amount);
        if (next.compareTo(BigDecimal.ZERO) <= 0) {
            map.remove(key);
        } else {
            map.put(key, next);
        }
    }

    private record Reservation(String mintId, StrategyTag strategyTag, BigDecimal size, Instant createdAt) {
    }
}
