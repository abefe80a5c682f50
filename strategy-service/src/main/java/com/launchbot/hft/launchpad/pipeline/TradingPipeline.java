package com.launchbot.hft.launchpad.pipeline;

import com.launchbot.hft.domain.MarketEvent;
import com.launchbot.hft.domain.MarketSnapshot;
import com.launchbot.hft.domain.MigrationEvent;
import com.launchbot.hft.domain.Signal;
import com.launchbot.hft.domain.SignalAction;
import com.launchbot.hft.domain.TokenEvent;
import com.launchbot.hft.domain.TradeEvent;
import com.launchbot.hft.domain.Wallet;
import com.launchbot.hft.domain.WalletRole;
import com.launchbot.hft.events.AlertCategory;
import com.launchbot.hft.events.AlertSeverity;
import com.launchbot.hft.launchpad.alert.AlertPublisher;
import com.launchbot.hft.launchpad.execution.ExecutionEngine;
import com.launchbot.hft.launchpad.execution.ExecutionResult;
import com.launchbot.hft.launchpad.execution.ExecutionStatus;
import com.launchbot.hft.launchpad.position.ExitDecision;
import com.launchbot.hft.launchpad.position.Position;
import com.launchbot.hft.launchpad.position.PositionTracker;
import com.launchbot.hft.launchpad.position.PositionTrackingException;
import com.launchbot.hft.launchpad.position.PositionUpdate;
import com.launchbot.hft.launchpad.risk.ExitFill;
import com.launchbot.hft.launchpad.risk.RiskDecision;
import com.launchbot.hft.launchpad.risk.RiskManager;
import com.launchbot.hft.launchpad.scoring.CreatorHistoryBook;
import com.launchbot.hft.launchpad.scoring.OpportunityBoard;
import com.launchbot.hft.launchpad.scoring.Score;
import com.launchbot.hft.launchpad.signal.SignalGenerator;
import com.launchbot.hft.launchpad.strategy.StrategyRegistry;
import com.launchbot.hft.launchpad.strategy.TradingStrategy;
import com.launchbot.hft.launchpad.wallet.WalletManager;
import com.launchbot.hft.launchpad.wallet.WalletUnavailableException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Wires the decision chain: event, score, signal, risk gate, wallet, execution, position lifecycle and back
 * into portfolio risk state.
 *
 * <p>The event loop de-duplicates and hands each event to its mint's lane. Lanes run scoring and signal
 * decisions; executions run on a separate pool and report back through callbacks. Exits take the same path
 * as entries so every order is risk-checked and wallet-accounted.
 */
@Slf4j
public class TradingPipeline {

    private static final Duration IDLE_TAPE_RETENTION = Duration.ofMinutes(30);
    private static final Duration LAUNCH_RETENTION = Duration.ofHours(24);

    private final StrategyRegistry strategies;
    private final SignalGenerator signalGenerator;
    private final RiskManager riskManager;
    private final WalletManager walletManager;
    private final ExecutionEngine executionEngine;
    private final PositionTracker positionTracker;
    private final MarketSnapshotBook snapshotBook;
    private final CreatorHistoryBook creatorHistory;
    private final AlertPublisher alerts;
    private final EventDeduplicator deduplicator;
    private final MintLaneDispatcher lanes;
    private final Executor executionPool;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final Map<String, TokenEvent> launches = new ConcurrentHashMap<>();
    private final OpportunityBoard opportunities = new OpportunityBoard();

    private final Counter eventsCounter;
    private final Counter duplicatesCounter;
    private final Counter deferredCounter;

    public TradingPipeline(
            StrategyRegistry strategies,
            SignalGenerator signalGenerator,
            RiskManager riskManager,
            WalletManager walletManager,
            ExecutionEngine executionEngine,
            PositionTracker positionTracker,
            MarketSnapshotBook snapshotBook,
            CreatorHistoryBook creatorHistory,
            AlertPublisher alerts,
            EventDeduplicator deduplicator,
            MintLaneDispatcher lanes,
            Executor executionPool,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.strategies = strategies;
        this.signalGenerator = signalGenerator;
        this.riskManager = riskManager;
        this.walletManager = walletManager;
        this.executionEngine = executionEngine;
        this.positionTracker = positionTracker;
        this.snapshotBook = snapshotBook;
        this.creatorHistory = creatorHistory;
        this.alerts = alerts;
        this.deduplicator = deduplicator;
        this.lanes = lanes;
        this.executionPool = executionPool;
        this.clock = clock;
        this.meterRegistry = meterRegistry;

        this.eventsCounter = Counter.builder("launchbot.events.processed")
                .description("Unique market events handed to mint lanes")
                .register(meterRegistry);
        this.duplicatesCounter = Counter.builder("launchbot.events.duplicates")
                .description("Redelivered market events dropped by de-duplication")
                .register(meterRegistry);
        this.deferredCounter = Counter.builder("launchbot.entries.deferred")
                .description("Approved entries deferred for lack of an eligible wallet")
                .register(meterRegistry);
        Gauge.builder("launchbot.positions.live", positionTracker, t -> t.openPositions().size())
                .description("Positions not yet closed")
                .register(meterRegistry);
    }

    /**
     * Event-loop entry point. Drops redeliveries, then queues the event on its mint's lane.
     */
    public void onEvent(MarketEvent event) {
        if (!deduplicator.firstSeen(event.dedupKey())) {
            duplicatesCounter.increment();
            log.debug("duplicate {} for mint {} dropped", event.eventType(), event.mintId());
            return;
        }
        eventsCounter.increment();
        lanes.dispatch(event.mintId(), () -> process(event));
    }

    void process(MarketEvent event) {
        if (event instanceof TokenEvent token) {
            onLaunch(token);
        } else if (event instanceof TradeEvent trade) {
            onTrade(trade);
        } else if (event instanceof MigrationEvent migration) {
            onMigration(migration);
        } else {
            log.warn("unsupported event type {}", event.getClass().getSimpleName());
        }
    }

    /**
     * Periodic work: reservation expiry, daily rollovers, timeout exits for quiet mints, memory trimming.
     */
    public void housekeeping() {
        riskManager.expireReservations();
        riskManager.rollDayIfNeeded();
        walletManager.resetDailyCountersIfNeeded();
        positionTracker.evaluateTimeouts().forEach(this::handleExit);

        Set<String> held = positionTracker.openPositions().stream()
                .map(Position::mintId)
                .collect(Collectors.toSet());
        snapshotBook.evictIdle(IDLE_TAPE_RETENTION, held);
        Instant cutoff = clock.instant().minus(LAUNCH_RETENTION);
        Iterator<TokenEvent> it = launches.values().iterator();
        while (it.hasNext()) {
            TokenEvent token = it.next();
            if (held.contains(token.mintId()) || token.createdAt() == null || !token.createdAt().isBefore(cutoff)) {
                continue;
            }
            it.remove();
            opportunities.forget(token.mintId());
            strategies.all().forEach(s -> s.forget(token.mintId()));
            log.debug("launch {} no longer tracked", token.mintId());
        }
    }

    private void onLaunch(TokenEvent token) {
        launches.put(token.mintId(), token);
        MarketSnapshot snapshot = snapshotBook.latest(token.mintId()).orElse(null);
        for (TradingStrategy strategy : strategies.enabled()) {
            if (strategy.evaluatesOnLaunch()) {
                evaluate(strategy, token, snapshot);
            }
        }
    }

    private void onTrade(TradeEvent trade) {
        MarketSnapshot snapshot = snapshotBook.onTrade(trade);
        positionTracker.evaluate(snapshot).forEach(this::handleExit);

        TokenEvent token = launches.get(trade.mintId());
        if (token == null) {
            return;
        }
        for (TradingStrategy strategy : strategies.enabled()) {
            if (strategy.reevaluateOnSnapshot()) {
                evaluate(strategy, token, snapshot);
            }
        }
    }

    private void onMigration(MigrationEvent migration) {
        log.info("mint {} migrated to {}", migration.mintId(), migration.destination());
        positionTracker.onMigration(migration.mintId()).forEach(this::handleExit);
        launches.remove(migration.mintId());
        opportunities.forget(migration.mintId());
        strategies.all().forEach(s -> s.forget(migration.mintId()));
    }

    private void evaluate(TradingStrategy strategy, TokenEvent token, MarketSnapshot snapshot) {
        Score score = strategy.score(token, snapshot);
        opportunities.record(score);
        Optional<Signal> maybeSignal = strategy.generateSignal(score, snapshot);
        if (maybeSignal.isEmpty()) {
            return;
        }
        Signal signal = maybeSignal.get();
        countSignal(signal);
        if (signal.action() != SignalAction.BUY) {
            riskManager.evaluate(signal);
            return;
        }
        boolean alreadyHeld = positionTracker.liveForMint(token.mintId()).stream()
                .anyMatch(p -> p.strategyTag() == strategy.tag());
        if (alreadyHeld) {
            log.info("strategy {} already holds mint {}, ignoring {}", strategy.tag(), token.mintId(), signal.id());
            return;
        }
        handleEntry(strategy, signal, token, snapshot);
    }

    private void handleEntry(TradingStrategy strategy, Signal signal, TokenEvent token, MarketSnapshot snapshot) {
        RiskDecision decision = riskManager.evaluate(signal);
        if (!decision.approved()) {
            Counter.builder("launchbot.risk.rejections")
                    .description("Signals rejected by the risk gate")
                    .tag("reason", decision.reason().code())
                    .register(meterRegistry)
                    .increment();
            return;
        }

        Optional<Wallet> wallet = selectWallet(strategy, decision);
        if (wallet.isEmpty()) {
            riskManager.release(signal.id());
            deferredCounter.increment();
            // next evaluation of the mint signals again
            strategy.forget(token.mintId());
            return;
        }

        Optional<Position> pending = positionTracker.openPending(signal, wallet.get().id(), token.creator());
        if (pending.isEmpty()) {
            riskManager.release(signal.id());
            return;
        }
        Position position = pending.get();
        try {
            CompletableFuture
                    .supplyAsync(() -> executionEngine.execute(signal, decision, wallet.get(), snapshot), executionPool)
                    .whenComplete((result, error) -> onEntryExecuted(signal, position, result, error));
        } catch (RejectedExecutionException e) {
            log.warn("execution pool saturated, dropping entry {} for mint {}", signal.id(), signal.mintId());
            riskManager.release(signal.id());
            positionTracker.onEntryFailed(position.id());
        }
    }

    private Optional<Wallet> selectWallet(TradingStrategy strategy, RiskDecision decision) {
        WalletRole role = strategy.walletRole();
        try {
            return Optional.of(walletManager.selectWallet(role, decision.adjustedSize()));
        } catch (WalletUnavailableException e) {
            WalletRole fallback = strategy.fallbackRole();
            if (fallback == null || fallback == role) {
                log.warn("entry {} deferred: {}", decision.signalId(), e.getMessage());
                return Optional.empty();
            }
            log.info("no {} wallet for {} ({}), trying {}", role, decision.signalId(), e.getMessage(), fallback);
            try {
                return Optional.of(walletManager.selectWallet(fallback, decision.adjustedSize()));
            } catch (WalletUnavailableException fallbackFailure) {
                log.warn("entry {} deferred: {}; fallback: {}",
                        decision.signalId(), e.getMessage(), fallbackFailure.getMessage());
                return Optional.empty();
            }
        }
    }

    private void onEntryExecuted(Signal signal, Position position, ExecutionResult result, Throwable error) {
        try {
            if (error == null && result.hasFill()) {
                positionTracker.onEntryFill(position.id(), result.filledBaseUnits(), result.avgPrice(), result.fees());
                if (!riskManager.confirm(signal.id(), result.filledBaseUnits())) {
                    trackingFailure(position, "fill of " + result.filledBaseUnits().toPlainString()
                            + " has no reservation for " + signal.id(), null);
                }
                if (result.status() == ExecutionStatus.PARTIAL) {
                    log.warn("entry {} partially filled {}/{} tranches: {}",
                            signal.id(), result.tranchesFilled(), result.tranchesPlanned(), result.error());
                }
                return;
            }
            positionTracker.onEntryFailed(position.id());
            riskManager.release(signal.id());
            executionFailed(signal, position.walletId(), result, error);
        } catch (PositionTrackingException e) {
            trackingFailure(position, e);
            throw e;
        }
    }

    private void handleExit(ExitDecision exit) {
        Position position = exit.position();
        MarketSnapshot snapshot = snapshotBook.latest(position.mintId()).orElse(null);
        Signal signal = signalGenerator.exitSignal(position, exit.sizeBaseUnits(), exit.reason(), snapshot);
        countSignal(signal);
        RiskDecision decision = riskManager.evaluate(signal);
        Wallet wallet;
        try {
            wallet = walletManager.require(position.walletId());
        } catch (IllegalArgumentException e) {
            positionTracker.onExitFailed(position.id());
            trackingFailure(position, e.getMessage(), e);
            return;
        }
        try {
            CompletableFuture
                    .supplyAsync(() -> executionEngine.execute(signal, decision, wallet, snapshot), executionPool)
                    .whenComplete((result, error) -> onExitExecuted(signal, exit, result, error));
        } catch (RejectedExecutionException e) {
            log.warn("execution pool saturated, exit {} for position {} retried on next evaluation",
                    signal.id(), position.id());
            positionTracker.onExitFailed(position.id());
        }
    }

    private void onExitExecuted(Signal signal, ExitDecision exit, ExecutionResult result, Throwable error) {
        Position position = exit.position();
        try {
            if (error != null || !result.hasFill()) {
                positionTracker.onExitFailed(position.id());
                executionFailed(signal, position.walletId(), result, error);
                return;
            }
            PositionUpdate update = positionTracker.applyExitFill(position.id(), exit.reason(), exit.sizeBaseUnits(),
                    result.filledTokens(), result.avgPrice(), result.fees());
            riskManager.recordExit(new ExitFill(
                    position.mintId(),
                    position.strategyTag(),
                    update.releasedBaseUnits(),
                    update.realizedPnlDelta(),
                    update.closed(),
                    update.position().realizedPnl()
            ));
            if (update.closed()) {
                if (position.creator() != null) {
                    creatorHistory.recordOutcome(position.creator(), update.position().realizedPnl().signum() > 0);
                }
                log.info("position {} closed mint={} reason={} realizedPnl={}",
                        position.id(), position.mintId(), exit.reason(), update.position().realizedPnl());
            }
        } catch (PositionTrackingException e) {
            trackingFailure(position, e);
            throw e;
        }
    }

    private void executionFailed(Signal signal, String walletId, ExecutionResult result, Throwable error) {
        String reason = error != null ? error.toString() : result.error();
        log.error("execution failed {} {} mint={} wallet={}: {}",
                signal.action(), signal.id(), signal.mintId(), walletId, reason);
        Map<String, Object> payload = new HashMap<>();
        payload.put("signalId", signal.id());
        payload.put("mintId", signal.mintId());
        payload.put("action", signal.action().name());
        payload.put("walletId", walletId);
        payload.put("status", result == null ? ExecutionStatus.FAILED.name() : result.status().name());
        payload.put("error", reason == null ? "" : reason);
        alerts.publish(AlertSeverity.HIGH, AlertCategory.EXECUTION_FAILED, payload, clock.instant());
    }

    private void trackingFailure(Position position, PositionTrackingException e) {
        trackingFailure(position, e.getMessage(), e);
    }

    private void trackingFailure(Position position, String error, Throwable cause) {
        log.error("position tracking failure for {} mint={}: {}", position.id(), position.mintId(), error, cause);
        alerts.publish(AlertSeverity.CRITICAL, AlertCategory.POSITION_TRACKING, Map.of(
                "positionId", position.id(),
                "mintId", position.mintId(),
                "error", String.valueOf(error)
        ), clock.instant());
    }

    private void countSignal(Signal signal) {
        Counter.builder("launchbot.signals")
                .description("Signals emitted by action and strategy")
                .tag("action", signal.action().name())
                .tag("strategy", signal.strategyTag().name())
                .register(meterRegistry)
                .increment();
    }

    public List<TokenEvent> trackedLaunches() {
        return List.copyOf(launches.values());
    }

    /**
     * Latest score per tracked launch and strategy.
     */
    public OpportunityBoard opportunities() {
        return opportunities;
    }
}
