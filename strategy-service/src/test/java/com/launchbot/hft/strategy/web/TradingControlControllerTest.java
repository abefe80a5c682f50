package com.launchbot.hft.strategy.web;

import com.launchbot.hft.domain.StrategyTag;
import com.launchbot.hft.launchpad.pipeline.TradingPipeline;
import com.launchbot.hft.launchpad.position.PerformanceSummary;
import com.launchbot.hft.launchpad.position.PositionTracker;
import com.launchbot.hft.launchpad.risk.PortfolioRiskState;
import com.launchbot.hft.launchpad.risk.RiskManager;
import com.launchbot.hft.launchpad.scoring.OpportunityBoard;
import com.launchbot.hft.launchpad.scoring.Score;
import com.launchbot.hft.launchpad.strategy.StrategyRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TradingControlControllerTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    private RiskManager riskManager;
    private PositionTracker positionTracker;
    private OpportunityBoard board;
    private TradingControlController controller;

    @BeforeEach
    void setUp() {
        riskManager = mock(RiskManager.class);
        positionTracker = mock(PositionTracker.class);
        TradingPipeline pipeline = mock(TradingPipeline.class);
        board = new OpportunityBoard();
        when(pipeline.opportunities()).thenReturn(board);
        controller = new TradingControlController(riskManager, mock(StrategyRegistry.class), positionTracker,
                pipeline);
    }

    @Test
    void shouldRankOpportunitiesWithinLimit() {
        board.record(new Score("mint-1", StrategyTag.SNIPE, 5.0, Map.of(), NOW));
        board.record(new Score("mint-2", StrategyTag.SNIPE, 9.0, Map.of(), NOW.plusSeconds(1)));
        board.record(new Score("mint-3", StrategyTag.SNIPE, 7.0, Map.of(), NOW.plusSeconds(2)));

        List<Score> ranked = controller.opportunities(2).getBody();
        List<Score> recent = controller.recentlyAnalyzed(1).getBody();

        assertThat(ranked).extracting(Score::mintId).containsExactly("mint-2", "mint-3");
        assertThat(recent).extracting(Score::mintId).containsExactly("mint-3");
        assertThat(controller.opportunities(100_000).getBody()).hasSize(3);
    }

    @Test
    void shouldCombinePerformanceWithRiskState() {
        PerformanceSummary performance = new PerformanceSummary(1, 4, 2, 3, 1, new BigDecimal("0.12"), 0.75);
        when(positionTracker.performance()).thenReturn(performance);
        when(riskManager.snapshot()).thenReturn(new PortfolioRiskState(new BigDecimal("-0.02"), 1, 0, Map.of(),
                Map.of(), 1, false, null, new BigDecimal("10.12"), new BigDecimal("10.2"), 0.0078, Set.of(), NOW));
        board.record(new Score("mint-1", StrategyTag.SNIPE, 5.0, Map.of(), NOW));

        TradingControlController.TradingSummary summary = controller.summary().getBody();

        assertThat(summary.performance()).isEqualTo(performance);
        assertThat(summary.dailyRealizedPnl()).isEqualByComparingTo("-0.02");
        assertThat(summary.equity()).isEqualByComparingTo("10.12");
        assertThat(summary.consecutiveLosses()).isEqualTo(1);
        assertThat(summary.scoredLaunches()).isEqualTo(1);
    }
}
