package com.launchbot.hft.launchpad.strategy;

import com.launchbot.hft.config.ConfigurationException;
import com.launchbot.hft.config.HftProperties;
import com.launchbot.hft.domain.StrategyTag;
import com.launchbot.hft.domain.WalletRole;
import com.launchbot.hft.launchpad.scoring.CreatorHistoryBook;
import com.launchbot.hft.launchpad.scoring.ScoringEngine;
import com.launchbot.hft.launchpad.signal.SignalGenerator;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StrategyRegistryTest {

    private final Clock fixedClock = Clock.fixed(Instant.parse("2024-01-15T10:00:00Z"), ZoneId.of("UTC"));
    private final ScoringEngine scoringEngine = new ScoringEngine(new CreatorHistoryBook(), fixedClock);
    private final SignalGenerator signalGenerator = new SignalGenerator(fixedClock);
    private final HftProperties.Strategies defaults = new HftProperties.Strategies(null, null);

    @Test
    void shouldKeepExitPoliciesOfDisabledStrategies() {
        HftProperties.Strategy disabledLongterm = new HftProperties.Strategy(false, WalletRole.LONGTERM, null, 7.5,
                null, null, null, null, null, HftProperties.BondingCurvePreference.LATE, null, null, null, null);

        StrategyRegistry registry = new StrategyRegistry(List.of(
                new SnipeStrategy(defaults.snipe(), scoringEngine, signalGenerator),
                new LongTermStrategy(disabledLongterm, scoringEngine, signalGenerator)));

        assertThat(registry.enabled()).extracting(TradingStrategy::tag).containsExactly(StrategyTag.SNIPE);
        assertThat(registry.all()).hasSize(2);
        assertThat(registry.exitPolicies()).containsKeys(StrategyTag.SNIPE, StrategyTag.LONGTERM);
        assertThat(registry.get(StrategyTag.LONGTERM)).isPresent();
    }

    @Test
    void shouldDescribeEvaluationTiming() {
        SnipeStrategy snipe = new SnipeStrategy(defaults.snipe(), scoringEngine, signalGenerator);
        LongTermStrategy longterm = new LongTermStrategy(defaults.longterm(), scoringEngine, signalGenerator);

        assertThat(snipe.evaluatesOnLaunch()).isTrue();
        assertThat(longterm.evaluatesOnLaunch()).isFalse();
        assertThat(longterm.reevaluateOnSnapshot()).isTrue();
        assertThat(longterm.walletRole()).isEqualTo(WalletRole.LONGTERM);
    }

    @Test
    void shouldRejectDuplicateTags() {
        SnipeStrategy snipe = new SnipeStrategy(defaults.snipe(), scoringEngine, signalGenerator);

        assertThatThrownBy(() -> new StrategyRegistry(List.of(snipe, snipe)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate strategy SNIPE");
    }

    @Test
    void shouldFailFastOnInvalidStrategyBlock() {
        HftProperties.Strategy badWeights = new HftProperties.Strategy(null, WalletRole.SNIPING, null, null, null,
                null, null, null, null, null, null, null, new HftProperties.Weights(0.5, 0.5, 0.5, 0.5), null);
        HftProperties.Strategy badStop = new HftProperties.Strategy(null, WalletRole.SNIPING, null, null, null,
                null, null, null, null, null, null, null, null,
                new HftProperties.Exit(1.5, null, null, null, null));

        assertThatThrownBy(() -> new SnipeStrategy(badWeights, scoringEngine, signalGenerator))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new SnipeStrategy(badStop, scoringEngine, signalGenerator))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("stopLossPct");
    }
}
