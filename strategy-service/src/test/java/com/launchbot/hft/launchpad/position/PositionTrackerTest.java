package com.launchbot.hft.launchpad.position;

import com.launchbot.hft.config.HftProperties;
import com.launchbot.hft.domain.ExitReason;
import com.launchbot.hft.domain.MarketSnapshot;
import com.launchbot.hft.domain.ProtectionLevel;
import com.launchbot.hft.domain.Signal;
import com.launchbot.hft.domain.SignalAction;
import com.launchbot.hft.domain.StrategyTag;
import com.launchbot.hft.domain.WhaleSentiment;
import com.launchbot.hft.launchpad.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PositionTrackerTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");
    private static final BigDecimal ENTRY = new BigDecimal("0.0001");
    private static final BigDecimal SIZE = new BigDecimal("0.05");

    private MutableClock clock;
    private PositionTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        HftProperties.Strategies strategies = new HftProperties.Strategies(null, null);
        tracker = new PositionTracker(Map.of(
                StrategyTag.SNIPE, ExitPolicy.from(StrategyTag.SNIPE, strategies.snipe().exit()),
                StrategyTag.LONGTERM, ExitPolicy.from(StrategyTag.LONGTERM, strategies.longterm().exit())
        ), clock);
    }

    @Test
    void shouldFixExitLevelsFromEntryFill() {
        // Given: a pending snipe entry
        Position pending = tracker.openPending(entry("mint-1"), "sniping-1", "creator-a").orElseThrow();
        assertThat(pending.state()).isEqualTo(PositionState.PENDING);

        // When: the entry fills at P
        Position open = tracker.onEntryFill(pending.id(), SIZE, ENTRY, BigDecimal.ZERO);

        // Then: stop at 0.9P, targets at 1.25P and 1.5P
        assertThat(open.state()).isEqualTo(PositionState.OPEN);
        assertThat(open.stopLossPrice()).isEqualByComparingTo("0.00009");
        assertThat(open.takeProfitLevels()).hasSize(2);
        assertThat(open.takeProfitLevels().get(0)).isEqualByComparingTo("0.000125");
        assertThat(open.takeProfitLevels().get(1)).isEqualByComparingTo("0.00015");
        assertThat(open.remainingTokens()).isEqualByComparingTo("500");
        assertThat(open.openedAt()).isEqualTo(NOW);
    }

    @Test
    void shouldSellHalfAtFirstTargetAndStayPartiallyExited() {
        Position open = openPosition("mint-1");

        // When: price reaches tier one
        List<ExitDecision> decisions = tracker.evaluate(snapshot("mint-1", "0.000125"));

        // Then: half the remaining cost basis is sold
        assertThat(decisions).hasSize(1);
        ExitDecision decision = decisions.get(0);
        assertThat(decision.reason()).isEqualTo(ExitReason.TAKE_PROFIT);
        assertThat(decision.sizeBaseUnits()).isEqualByComparingTo("0.025");
        assertThat(decision.position().pendingExit()).isEqualTo(ExitReason.TAKE_PROFIT);

        PositionUpdate update = tracker.applyExitFill(open.id(), ExitReason.TAKE_PROFIT, decision.sizeBaseUnits(),
                new BigDecimal("250"),
                new BigDecimal("0.000125"), BigDecimal.ZERO);

        assertThat(update.closed()).isFalse();
        assertThat(update.releasedBaseUnits()).isEqualByComparingTo("0.025");
        assertThat(update.realizedPnlDelta()).isEqualByComparingTo("0.00625");
        Position after = update.position();
        assertThat(after.state()).isEqualTo(PositionState.PARTIALLY_EXITED);
        assertThat(after.remainingSizeBaseUnits()).isEqualByComparingTo("0.025");
        assertThat(after.nextTakeProfitTier()).isEqualTo(1);
        assertThat(after.pendingExit()).isNull();
    }

    @Test
    void shouldReleaseExactFractionAtIrregularEntryPrice() {
        // Given: a launch-priced entry whose token count does not divide evenly
        BigDecimal entryPrice = new BigDecimal("0.000000031");
        Position pending = tracker.openPending(entry("mint-1"), "sniping-1", null).orElseThrow();
        Position open = tracker.onEntryFill(pending.id(), SIZE, entryPrice, BigDecimal.ZERO);

        ExitDecision decision = tracker.evaluate(snapshot("mint-1", "0.00000004")).get(0);
        assertThat(decision.sizeBaseUnits()).isEqualByComparingTo("0.025");

        // When: every planned token sells (sized the way the execution engine rounds)
        BigDecimal tokens = decision.sizeBaseUnits().divide(entryPrice, Position.TOKEN_SCALE, RoundingMode.DOWN);
        PositionUpdate update = tracker.applyExitFill(open.id(), ExitReason.TAKE_PROFIT, decision.sizeBaseUnits(),
                tokens, new BigDecimal("0.00000004"), BigDecimal.ZERO);

        // Then: exactly half the cost basis is released, no rounding residue
        assertThat(update.releasedBaseUnits()).isEqualByComparingTo("0.025");
        assertThat(update.position().remainingSizeBaseUnits()).isEqualByComparingTo("0.025");
        assertThat(update.position().state()).isEqualTo(PositionState.PARTIALLY_EXITED);
        assertThat(update.position().nextTakeProfitTier()).isEqualTo(1);
    }

    @Test
    void shouldKeepTakeProfitTierArmedAfterShortFill() {
        Position open = openPosition("mint-1");
        ExitDecision decision = tracker.evaluate(snapshot("mint-1", "0.000125")).get(0);

        // When: only 100 of the 250 planned tokens sell
        PositionUpdate update = tracker.applyExitFill(open.id(), ExitReason.TAKE_PROFIT, decision.sizeBaseUnits(),
                new BigDecimal("100"), new BigDecimal("0.000125"), BigDecimal.ZERO);

        // Then: only the sold tokens' cost is released and tier one fires again on the remainder
        assertThat(update.releasedBaseUnits()).isEqualByComparingTo("0.01");
        assertThat(update.position().remainingSizeBaseUnits()).isEqualByComparingTo("0.04");
        assertThat(update.position().nextTakeProfitTier()).isZero();

        List<ExitDecision> retry = tracker.evaluate(snapshot("mint-1", "0.000125"));
        assertThat(retry).extracting(ExitDecision::reason).containsExactly(ExitReason.TAKE_PROFIT);
        assertThat(retry.get(0).sizeBaseUnits()).isEqualByComparingTo("0.02");
    }

    @Test
    void shouldOnlyRaiseTrailingStop() {
        Position open = openPosition("mint-1");

        // When: price rises above entry but below the first target
        assertThat(tracker.evaluate(snapshot("mint-1", "0.00012"))).isEmpty();
        BigDecimal raised = tracker.find(open.id()).orElseThrow().stopLossPrice();

        // Then: stop follows at 90% of the high
        assertThat(raised).isEqualByComparingTo("0.000108");

        // When: price pulls back without hitting the stop
        assertThat(tracker.evaluate(snapshot("mint-1", "0.00011"))).isEmpty();

        // Then: the stop does not move down
        assertThat(tracker.find(open.id()).orElseThrow().stopLossPrice()).isEqualByComparingTo(raised);

        // When: price falls through the raised stop
        List<ExitDecision> decisions = tracker.evaluate(snapshot("mint-1", "0.000107"));

        assertThat(decisions).hasSize(1);
        assertThat(decisions.get(0).reason()).isEqualTo(ExitReason.TRAILING_STOP);
        assertThat(decisions.get(0).sizeBaseUnits()).isEqualByComparingTo(SIZE);
    }

    @Test
    void shouldCloseFullyOnStopLossWithLoss() {
        Position pending = tracker.openPending(entry("mint-1"), "sniping-1", null).orElseThrow();
        Position open = tracker.onEntryFill(pending.id(), SIZE, ENTRY, new BigDecimal("0.0001"));

        List<ExitDecision> decisions = tracker.evaluate(snapshot("mint-1", "0.000088"));

        assertThat(decisions).extracting(ExitDecision::reason).containsExactly(ExitReason.STOP_LOSS);
        PositionUpdate update = tracker.applyExitFill(open.id(), ExitReason.STOP_LOSS, SIZE, new BigDecimal("500"),
                new BigDecimal("0.000088"), BigDecimal.ZERO);

        // 500 * 0.000088 - 0.05 - entry fee 0.0001
        assertThat(update.closed()).isTrue();
        assertThat(update.realizedPnlDelta()).isEqualByComparingTo("-0.0061");
        assertThat(update.position().state()).isEqualTo(PositionState.CLOSED);
        assertThat(update.position().closedAt()).isEqualTo(NOW);
        assertThat(tracker.openPositions()).isEmpty();
    }

    @Test
    void shouldNotEmitSecondExitWhileOneIsPending() {
        openPosition("mint-1");

        assertThat(tracker.evaluate(snapshot("mint-1", "0.00008"))).hasSize(1);
        assertThat(tracker.evaluate(snapshot("mint-1", "0.00007"))).isEmpty();
    }

    @Test
    void shouldRetryExitAfterFailure() {
        Position open = openPosition("mint-1");
        assertThat(tracker.evaluate(snapshot("mint-1", "0.00008"))).hasSize(1);

        tracker.onExitFailed(open.id());

        assertThat(tracker.evaluate(snapshot("mint-1", "0.00008")))
                .extracting(ExitDecision::reason)
                .containsExactly(ExitReason.STOP_LOSS);
    }

    @Test
    void shouldTimeOutAfterMaxHold() {
        openPosition("mint-1");

        clock.advance(Duration.ofMinutes(59));
        assertThat(tracker.evaluateTimeouts()).isEmpty();

        clock.advance(Duration.ofMinutes(1));
        List<ExitDecision> decisions = tracker.evaluateTimeouts();

        assertThat(decisions).hasSize(1);
        assertThat(decisions.get(0).reason()).isEqualTo(ExitReason.TIMEOUT);
        assertThat(decisions.get(0).sizeBaseUnits()).isEqualByComparingTo(SIZE);
    }

    @Test
    void shouldSellConfiguredFractionOnMigration() {
        openPosition("mint-1");

        List<ExitDecision> decisions = tracker.onMigration("mint-1");

        assertThat(decisions).hasSize(1);
        assertThat(decisions.get(0).reason()).isEqualTo(ExitReason.MIGRATION);
        assertThat(decisions.get(0).sizeBaseUnits()).isEqualByComparingTo("0.025");
    }

    @Test
    void shouldRejectDuplicateLivePositionForSameWallet() {
        openPosition("mint-1");

        assertThat(tracker.openPending(entry("mint-1"), "sniping-1", null)).isEmpty();
        assertThat(tracker.openPending(entry("mint-1"), "sniping-2", null)).isPresent();
    }

    @Test
    void shouldCloseWithoutPnlWhenEntryNeverFills() {
        Position pending = tracker.openPending(entry("mint-1"), "sniping-1", null).orElseThrow();

        Position closed = tracker.onEntryFill(pending.id(), BigDecimal.ZERO, null, null);

        assertThat(closed.state()).isEqualTo(PositionState.CLOSED);
        assertThat(closed.realizedPnl()).isEqualByComparingTo("0");
        assertThat(tracker.hasLivePosition("mint-1")).isFalse();
    }

    @Test
    void shouldFailLoudlyOnInconsistentUpdates() {
        Position open = openPosition("mint-1");

        assertThatThrownBy(() -> tracker.onEntryFill("missing", SIZE, ENTRY, null))
                .isInstanceOf(PositionTrackingException.class)
                .hasMessageContaining("Unknown position");
        assertThatThrownBy(() -> tracker.onEntryFill(open.id(), SIZE, ENTRY, null))
                .isInstanceOf(PositionTrackingException.class);
        assertThatThrownBy(() -> tracker.applyExitFill(open.id(), ExitReason.STOP_LOSS, SIZE,
                new BigDecimal("501"), ENTRY, null))
                .isInstanceOf(PositionTrackingException.class)
                .hasMessageContaining("exceeds remaining");
    }

    @Test
    void shouldSummarizeRealizedPerformance() {
        // Given: a winner, a loser, an entry that never filled and a partially exited position
        Position winner = openPosition("mint-1");
        tracker.applyExitFill(winner.id(), ExitReason.TIMEOUT, SIZE, new BigDecimal("500"),
                new BigDecimal("0.0002"), BigDecimal.ZERO);
        Position loser = openPosition("mint-2");
        tracker.applyExitFill(loser.id(), ExitReason.STOP_LOSS, SIZE, new BigDecimal("500"),
                new BigDecimal("0.00008"), BigDecimal.ZERO);
        Position unfilled = tracker.openPending(entry("mint-3"), "sniping-1", "creator-a").orElseThrow();
        tracker.onEntryFailed(unfilled.id());
        Position partial = openPosition("mint-4");
        tracker.applyExitFill(partial.id(), ExitReason.TAKE_PROFIT, new BigDecimal("0.025"), new BigDecimal("250"),
                new BigDecimal("0.000125"), BigDecimal.ZERO);

        // When
        PerformanceSummary summary = tracker.performance();

        // Then: 0.05 - 0.01 + 0.00625, unfilled entries outside the win rate
        assertThat(summary.livePositions()).isEqualTo(1);
        assertThat(summary.closedPositions()).isEqualTo(2);
        assertThat(summary.unfilledEntries()).isEqualTo(1);
        assertThat(summary.wins()).isEqualTo(1);
        assertThat(summary.losses()).isEqualTo(1);
        assertThat(summary.winRate()).isEqualTo(0.5);
        assertThat(summary.realizedPnl()).isEqualByComparingTo("0.04625");
    }

    private Position openPosition(String mint) {
        Position pending = tracker.openPending(entry(mint), "sniping-1", "creator-a").orElseThrow();
        return tracker.onEntryFill(pending.id(), SIZE, ENTRY, BigDecimal.ZERO);
    }

    private Signal entry(String mint) {
        return Signal.entry("sig-" + mint, mint, SignalAction.BUY, SIZE, 8.5, ProtectionLevel.STANDARD,
                StrategyTag.SNIPE, ENTRY, clock.instant());
    }

    private MarketSnapshot snapshot(String mint, String price) {
        return new MarketSnapshot(mint, new BigDecimal(price), List.of(), 0.3, WhaleSentiment.NEUTRAL, false,
                clock.instant());
    }
}
