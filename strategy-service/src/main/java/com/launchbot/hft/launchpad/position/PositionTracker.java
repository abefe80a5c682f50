package com.launchbot.hft.launchpad.position;

import com.launchbot.hft.domain.ExitReason;
import com.launchbot.hft.domain.MarketSnapshot;
import com.launchbot.hft.domain.Signal;
import com.launchbot.hft.domain.StrategyTag;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sole owner of positions. Mutations are serialized on the tracker; reads go straight to the map.
 *
 * <pre>
 * PENDING -> OPEN -> PARTIALLY_EXITED ... -> CLOSED
 *        \-> CLOSED (entry never filled)
 * </pre>
 */
@Slf4j
public class PositionTracker {

    /**
     * Remaining cost basis at or below this closes the position.
     */
    static final BigDecimal DUST = new BigDecimal("0.000000001");
    private static final int SCALE = 12;

    private final Map<StrategyTag, ExitPolicy> exitPolicies;
    private final Clock clock;
    private final Map<String, Position> positions = new ConcurrentHashMap<>();

    public PositionTracker(Map<StrategyTag, ExitPolicy> exitPolicies, Clock clock) {
        this.exitPolicies = new EnumMap<>(exitPolicies);
        this.clock = clock;
    }

    /**
     * Register a pending position for an approved entry.
     *
     * @return empty when the wallet already holds a live position in the mint
     */
    public synchronized Optional<Position> openPending(Signal entry, String walletId, String creator) {
        boolean duplicate = positions.values().stream()
                .anyMatch(p -> p.isLive() && p.mintId().equals(entry.mintId()) && p.walletId().equals(walletId));
        if (duplicate) {
            log.warn("live position already exists mint={} wallet={}, skipping entry {}",
                    entry.mintId(), walletId, entry.id());
            return Optional.empty();
        }
        policy(entry.strategyTag());
        Position position = Position.pending(UUID.randomUUID().toString(), entry.mintId(), walletId, creator,
                entry.strategyTag(), entry.targetSizeBaseUnits(), clock.instant());
        positions.put(position.id(), position);
        log.info("position {} PENDING mint={} wallet={} strategy={} size={}",
                position.id(), position.mintId(), walletId, entry.strategyTag(), entry.targetSizeBaseUnits());
        return Optional.of(position);
    }

    /**
     * First confirmed fill: the position opens and its exit levels are fixed from the fill price.
     */
    public synchronized Position onEntryFill(String positionId, BigDecimal filledBaseUnits, BigDecimal avgPrice,
                                             BigDecimal fees) {
        Position position = require(positionId);
        if (position.state() != PositionState.PENDING) {
            throw new PositionTrackingException(
                    "Entry fill for position " + positionId + " in state " + position.state());
        }
        if (filledBaseUnits == null || filledBaseUnits.signum() <= 0) {
            return onEntryFailed(positionId);
        }
        if (avgPrice == null || avgPrice.signum() <= 0) {
            throw new PositionTrackingException("Entry fill for position " + positionId + " without a price");
        }
        Position opened = position.opened(filledBaseUnits, avgPrice, fees == null ? BigDecimal.ZERO : fees,
                policy(position.strategyTag()), clock.instant());
        positions.put(positionId, opened);
        log.info("position {} OPEN mint={} entry={} size={} stop={} targets={}",
                positionId, opened.mintId(), avgPrice, filledBaseUnits, opened.stopLossPrice(),
                opened.takeProfitLevels());
        return opened;
    }

    /**
     * Entry never filled. Closes the pending position without PnL.
     */
    public synchronized Position onEntryFailed(String positionId) {
        Position position = require(positionId);
        if (position.state() != PositionState.PENDING) {
            throw new PositionTrackingException(
                    "Entry failure for position " + positionId + " in state " + position.state());
        }
        Position closed = position.abandoned(clock.instant());
        positions.put(positionId, closed);
        log.info("position {} CLOSED without fill mint={}", positionId, closed.mintId());
        return closed;
    }

    /**
     * Apply a snapshot to every monitorable position in its mint.
     *
     * At most one exit per position, in priority order: hard stop, take-profit tier, then timeout.
     * A trailing stop raise happens between the take-profit and timeout checks. Positions with an exit
     * already in flight are skipped.
     */
    public synchronized List<ExitDecision> evaluate(MarketSnapshot snapshot) {
        BigDecimal price = snapshot.price();
        if (price == null || price.signum() <= 0) {
            return List.of();
        }
        Instant now = clock.instant();
        List<ExitDecision> decisions = new ArrayList<>();
        for (Position position : monitorable(snapshot.mintId())) {
            ExitPolicy policy = policy(position.strategyTag());
            ExitDecision decision = stopLoss(position, price);
            if (decision == null) {
                decision = takeProfit(position, price, policy);
            }
            if (decision == null) {
                position = raiseTrailingStop(position, price, policy);
                decision = timeout(position, policy, now);
            }
            if (decision != null) {
                decisions.add(markPending(decision));
            }
        }
        return decisions;
    }

    /**
     * Sell the configured fraction of every live position in a mint that graduated off its curve.
     */
    public synchronized List<ExitDecision> onMigration(String mintId) {
        List<ExitDecision> decisions = new ArrayList<>();
        for (Position position : monitorable(mintId)) {
            double fraction = policy(position.strategyTag()).migrationExitFraction();
            if (fraction <= 0.0) {
                continue;
            }
            decisions.add(markPending(new ExitDecision(position, ExitReason.MIGRATION,
                    fractionOf(position, fraction))));
        }
        return decisions;
    }

    /**
     * Timeout sweep for mints that stopped trading.
     */
    public synchronized List<ExitDecision> evaluateTimeouts() {
        Instant now = clock.instant();
        List<ExitDecision> decisions = new ArrayList<>();
        for (Position position : List.copyOf(positions.values())) {
            if (!position.isMonitorable() || position.pendingExit() != null) {
                continue;
            }
            ExitDecision decision = timeout(position, policy(position.strategyTag()), now);
            if (decision != null) {
                decisions.add(markPending(decision));
            }
        }
        return decisions;
    }

    /**
     * Apply a (possibly partial) exit fill.
     *
     * <p>An exit that sold every token planned for {@code requestedBaseUnits} releases exactly that cost basis;
     * token rounding does not leak into the remaining size. A short fill releases what its tokens cost. A
     * take-profit tier only advances on a complete fill, so a short fill leaves the tier armed.
     *
     * @param requestedBaseUnits cost basis the exit was sized for
     * @param filledTokens token quantity sold
     * @param avgPrice volume-weighted sale price
     */
    public synchronized PositionUpdate applyExitFill(String positionId, ExitReason reason,
                                                     BigDecimal requestedBaseUnits, BigDecimal filledTokens,
                                                     BigDecimal avgPrice, BigDecimal fees) {
        Position position = require(positionId);
        if (!position.isMonitorable()) {
            throw new PositionTrackingException(
                    "Exit fill for position " + positionId + " in state " + position.state());
        }
        if (filledTokens == null || filledTokens.signum() <= 0) {
            Position cleared = position.withPendingExit(null);
            positions.put(positionId, cleared);
            return new PositionUpdate(cleared, BigDecimal.ZERO, BigDecimal.ZERO, false);
        }
        BigDecimal released = filledTokens.multiply(position.entryPrice());
        BigDecimal overshoot = released.subtract(position.remainingSizeBaseUnits());
        if (overshoot.compareTo(DUST) > 0) {
            throw new PositionTrackingException("Exit fill of " + released + " exceeds remaining "
                    + position.remainingSizeBaseUnits() + " on position " + positionId);
        }
        BigDecimal requested = requestedBaseUnits == null || requestedBaseUnits.signum() <= 0
                ? position.remainingSizeBaseUnits()
                : requestedBaseUnits.min(position.remainingSizeBaseUnits());
        BigDecimal plannedTokens = requested.divide(position.entryPrice(), Position.TOKEN_SCALE, RoundingMode.DOWN);
        boolean complete = filledTokens.compareTo(plannedTokens) >= 0;
        released = complete ? requested : released.min(position.remainingSizeBaseUnits());

        BigDecimal proceeds = filledTokens.multiply(avgPrice == null ? BigDecimal.ZERO : avgPrice);
        BigDecimal pnl = proceeds.subtract(released).subtract(fees == null ? BigDecimal.ZERO : fees);
        boolean firstExit = position.state() == PositionState.OPEN;
        if (firstExit) {
            pnl = pnl.subtract(position.entryFees());
        }
        pnl = pnl.setScale(SCALE, RoundingMode.HALF_EVEN).stripTrailingZeros();

        BigDecimal remaining = position.remainingSizeBaseUnits().subtract(released);
        boolean close = remaining.compareTo(DUST) <= 0;
        int nextTier = reason == ExitReason.TAKE_PROFIT && complete
                ? position.nextTakeProfitTier() + 1
                : position.nextTakeProfitTier();
        Position updated = position.reduced(remaining, position.realizedPnl().add(pnl), nextTier, close,
                clock.instant());
        positions.put(positionId, updated);

        log.info("position {} {} mint={} reason={} released={} pnl={} remaining={}{}",
                positionId, updated.state(), updated.mintId(), reason, released, pnl,
                updated.remainingSizeBaseUnits(), complete ? "" : " (short fill)");
        return new PositionUpdate(updated, released, pnl, close);
    }

    /**
     * Exit did not fill at all. The exit condition is re-evaluated on the next snapshot.
     */
    public synchronized Position onExitFailed(String positionId) {
        Position position = require(positionId);
        Position cleared = position.withPendingExit(null);
        positions.put(positionId, cleared);
        log.warn("position {} exit failed, pending exit cleared", positionId);
        return cleared;
    }

    public Optional<Position> find(String positionId) {
        return Optional.ofNullable(positions.get(positionId));
    }

    public List<Position> liveForMint(String mintId) {
        return positions.values().stream()
                .filter(p -> p.isLive() && p.mintId().equals(mintId))
                .sorted(Comparator.comparing(Position::createdAt))
                .toList();
    }

    public boolean hasLivePosition(String mintId) {
        return positions.values().stream().anyMatch(p -> p.isLive() && p.mintId().equals(mintId));
    }

    public List<Position> openPositions() {
        return positions.values().stream()
                .filter(Position::isLive)
                .sorted(Comparator.comparing(Position::createdAt))
                .toList();
    }

    public List<Position> all() {
        return List.copyOf(positions.values());
    }

    public PerformanceSummary performance() {
        return PerformanceSummary.of(all());
    }

    private ExitDecision stopLoss(Position position, BigDecimal price) {
        if (position.stopLossPrice() == null || price.compareTo(position.stopLossPrice()) > 0) {
            return null;
        }
        boolean trailing = position.trailingStopPrice() != null
                && position.trailingStopPrice().compareTo(position.stopLossPrice()) == 0;
        return new ExitDecision(position, trailing ? ExitReason.TRAILING_STOP : ExitReason.STOP_LOSS,
                position.remainingSizeBaseUnits());
    }

    private ExitDecision takeProfit(Position position, BigDecimal price, ExitPolicy policy) {
        int tier = position.nextTakeProfitTier();
        if (tier >= position.takeProfitLevels().size()) {
            return null;
        }
        if (price.compareTo(position.takeProfitLevels().get(tier)) < 0) {
            return null;
        }
        double fraction = policy.takeProfitTiers().get(tier).fraction();
        return new ExitDecision(position, ExitReason.TAKE_PROFIT, fractionOf(position, fraction));
    }

    private Position raiseTrailingStop(Position position, BigDecimal price, ExitPolicy policy) {
        if (policy.trailingStopPct() <= 0.0 || price.compareTo(position.entryPrice()) <= 0) {
            return position;
        }
        BigDecimal candidate = price.multiply(BigDecimal.valueOf(1.0 - policy.trailingStopPct()));
        if (candidate.compareTo(position.stopLossPrice()) <= 0) {
            return position;
        }
        Position raised = position.withTrailingStop(candidate);
        positions.put(raised.id(), raised);
        log.debug("position {} trailing stop raised {} -> {}", raised.id(), position.stopLossPrice(), candidate);
        return raised;
    }

    private static ExitDecision timeout(Position position, ExitPolicy policy, Instant now) {
        Duration maxHold = policy.maxHold();
        if (maxHold == null || maxHold.isZero() || position.openedAt() == null) {
            return null;
        }
        if (Duration.between(position.openedAt(), now).compareTo(maxHold) < 0) {
            return null;
        }
        return new ExitDecision(position, ExitReason.TIMEOUT, position.remainingSizeBaseUnits());
    }

    private ExitDecision markPending(ExitDecision decision) {
        Position marked = decision.position().withPendingExit(decision.reason());
        positions.put(marked.id(), marked);
        log.info("position {} exit {} size={} mint={}",
                marked.id(), decision.reason(), decision.sizeBaseUnits(), marked.mintId());
        return new ExitDecision(marked, decision.reason(), decision.sizeBaseUnits());
    }

    private List<Position> monitorable(String mintId) {
        return positions.values().stream()
                .filter(p -> p.isMonitorable() && p.pendingExit() == null && p.mintId().equals(mintId))
                .sorted(Comparator.comparing(Position::createdAt))
                .toList();
    }

    private static BigDecimal fractionOf(Position position, double fraction) {
        if (fraction >= 1.0) {
            return position.remainingSizeBaseUnits();
        }
        return position.remainingSizeBaseUnits()
                .multiply(BigDecimal.valueOf(fraction))
                .setScale(SCALE, RoundingMode.DOWN)
                .stripTrailingZeros();
    }

    private Position require(String positionId) {
        Position position = positions.get(positionId);
        if (position == null) {
            throw new PositionTrackingException("Unknown position " + positionId);
        }
        return position;
    }

    private ExitPolicy policy(StrategyTag tag) {
        ExitPolicy policy = exitPolicies.get(tag);
        if (policy == null) {
            throw new PositionTrackingException("No exit policy for strategy " + tag);
        }
        return policy;
    }
}
