package com.launchbot.hft.launchpad.scoring;

import com.launchbot.hft.domain.StrategyTag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OpportunityBoardTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    private final OpportunityBoard board = new OpportunityBoard();

    @Test
    void shouldRankByCompositeAndKeepLatestPerStrategy() {
        board.record(score("mint-1", StrategyTag.SNIPE, 6.0, 0));
        board.record(score("mint-2", StrategyTag.SNIPE, 8.0, 1));
        board.record(score("mint-3", StrategyTag.SNIPE, 7.0, 2));
        board.record(score("mint-3", StrategyTag.LONGTERM, 5.0, 3));

        // When: mint-1 is re-scored higher
        board.record(score("mint-1", StrategyTag.SNIPE, 9.0, 4));

        // Then
        assertThat(board.top(3)).extracting(Score::mintId).containsExactly("mint-1", "mint-2", "mint-3");
        assertThat(board.top(10)).hasSize(4);
        assertThat(board.size()).isEqualTo(3);
    }

    @Test
    void shouldListMostRecentlyAnalyzedFirst() {
        board.record(score("mint-1", StrategyTag.SNIPE, 9.0, 0));
        board.record(score("mint-2", StrategyTag.SNIPE, 2.0, 5));
        board.record(score("mint-3", StrategyTag.SNIPE, 4.0, 3));

        assertThat(board.recent(2)).extracting(Score::mintId).containsExactly("mint-2", "mint-3");
    }

    @Test
    void shouldDropForgottenMintAcrossStrategies() {
        board.record(score("mint-1", StrategyTag.SNIPE, 9.0, 0));
        board.record(score("mint-1", StrategyTag.LONGTERM, 8.0, 0));
        board.record(score("mint-2", StrategyTag.SNIPE, 3.0, 0));

        board.forget("mint-1");

        assertThat(board.top(10)).extracting(Score::mintId).containsExactly("mint-2");
        assertThat(board.top(-1)).isEmpty();
    }

    private static Score score(String mint, StrategyTag tag, double value, int secondsLater) {
        return new Score(mint, tag, value, Map.of(), NOW.plusSeconds(secondsLater));
    }
}
