package com.launchbot.hft.launchpad.wallet;

import com.launchbot.hft.config.HftProperties;
import com.launchbot.hft.domain.Wallet;
import com.launchbot.hft.domain.WalletRole;
import com.launchbot.hft.events.AlertCategory;
import com.launchbot.hft.events.AlertEvent;
import com.launchbot.hft.launchpad.MutableClock;
import com.launchbot.hft.launchpad.alert.LoggingAlertPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WalletManagerTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");
    private static final BigDecimal SIZE = new BigDecimal("0.05");

    private MutableClock clock;
    private LoggingAlertPublisher alerts;
    private WalletPolicy policy;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        alerts = new LoggingAlertPublisher();
        policy = WalletPolicy.from(
                new HftProperties.Wallets(null, null, null, null, null, null, null, null, null, null),
                new HftProperties.Risk(null, null, null, null, null, null, null, null, null, null, null, null, null,
                        null, null, null));
    }

    @Test
    void shouldSkipWalletsBelowSizePlusFeeBuffer() throws Exception {
        WalletManager manager = manager(
                wallet("sniping-1", WalletRole.SNIPING, "0.055"),
                wallet("sniping-2", WalletRole.SNIPING, "1"));

        for (int i = 0; i < 3; i++) {
            assertThat(manager.selectWallet(WalletRole.SNIPING, SIZE).id()).isEqualTo("sniping-2");
        }
    }

    @Test
    void shouldFailWhenNoWalletIsFunded() {
        WalletManager manager = manager(wallet("sniping-1", WalletRole.SNIPING, "0.01"));

        assertThatThrownBy(() -> manager.selectWallet(WalletRole.SNIPING, SIZE))
                .isInstanceOf(NoEligibleWalletException.class)
                .hasMessageContaining("balance >= 0.06");
        assertThatThrownBy(() -> manager.selectWallet(WalletRole.UTILITY, SIZE))
                .isInstanceOf(NoEligibleWalletException.class)
                .hasMessageContaining("no UTILITY wallets");
    }

    @Test
    void shouldRotateRoundRobinAmongTiedWallets() throws Exception {
        WalletManager manager = manager(
                wallet("sniping-1", WalletRole.SNIPING, "1"),
                wallet("sniping-2", WalletRole.SNIPING, "1"));

        assertThat(manager.selectWallet(WalletRole.SNIPING, SIZE).id()).isEqualTo("sniping-1");
        assertThat(manager.selectWallet(WalletRole.SNIPING, SIZE).id()).isEqualTo("sniping-2");
        assertThat(manager.selectWallet(WalletRole.SNIPING, SIZE).id()).isEqualTo("sniping-1");
    }

    @Test
    void shouldPreferFewestDailyTransactions() throws Exception {
        WalletManager manager = manager(
                wallet("sniping-1", WalletRole.SNIPING, "1"),
                wallet("sniping-2", WalletRole.SNIPING, "1"));

        manager.recordExecution("sniping-1", ExecutionOutcome.SUCCESS);

        assertThat(manager.selectWallet(WalletRole.SNIPING, SIZE).id()).isEqualTo("sniping-2");
        assertThat(manager.selectWallet(WalletRole.SNIPING, SIZE).id()).isEqualTo("sniping-2");
    }

    @Test
    void shouldPreferReputableWallets() throws Exception {
        Wallet shady = new Wallet("sniping-1", WalletRole.SNIPING, BigDecimal.ONE, 2.0, NOW, null, 0, null, 0);
        Wallet clean = new Wallet("sniping-2", WalletRole.SNIPING, BigDecimal.ONE, 6.0, NOW, null, 5, null, 0);
        WalletManager manager = manager(shady, clean);

        // Fewer transactions on the low-reputation wallet do not outrank the preference
        assertThat(manager.selectWallet(WalletRole.SNIPING, SIZE).id()).isEqualTo("sniping-2");

        WalletManager onlyShady = manager(shady);
        assertThat(onlyShady.selectWallet(WalletRole.SNIPING, SIZE).id()).isEqualTo("sniping-1");
    }

    @Test
    void shouldEnforceLongtermSpacing() throws Exception {
        WalletManager manager = manager(wallet("longterm-1", WalletRole.LONGTERM, "5"));
        manager.recordExecution("longterm-1", ExecutionOutcome.SUCCESS);

        clock.advance(Duration.ofSeconds(599));
        assertThatThrownBy(() -> manager.selectWallet(WalletRole.LONGTERM, SIZE))
                .isInstanceOf(AllWalletsCoolingDownException.class);

        clock.advance(Duration.ofSeconds(1));
        assertThat(manager.selectWallet(WalletRole.LONGTERM, SIZE).id()).isEqualTo("longterm-1");
    }

    @Test
    void shouldStartLongtermSpacingWhenWalletIsSelected() throws Exception {
        WalletManager manager = manager(wallet("longterm-1", WalletRole.LONGTERM, "5"));

        // When: one lane takes the wallet and its execution has not reported back yet
        Wallet first = manager.selectWallet(WalletRole.LONGTERM, SIZE);

        // Then: a second lane cannot take it inside the spacing window
        assertThat(first.lastUsedAt()).isEqualTo(NOW);
        assertThatThrownBy(() -> manager.selectWallet(WalletRole.LONGTERM, SIZE))
                .isInstanceOf(AllWalletsCoolingDownException.class);

        clock.advance(Duration.ofSeconds(600));
        assertThat(manager.selectWallet(WalletRole.LONGTERM, SIZE).id()).isEqualTo("longterm-1");
    }

    @Test
    void shouldCoolDownAfterConsecutiveFailures() throws Exception {
        WalletManager manager = manager(wallet("sniping-1", WalletRole.SNIPING, "1"));

        manager.recordExecution("sniping-1", ExecutionOutcome.FAILURE);
        manager.recordExecution("sniping-1", ExecutionOutcome.FAILURE);
        assertThat(manager.selectWallet(WalletRole.SNIPING, SIZE).id()).isEqualTo("sniping-1");

        Wallet cooled = manager.recordExecution("sniping-1", ExecutionOutcome.FAILURE);
        assertThat(cooled.cooldownUntil()).isEqualTo(NOW.plusSeconds(300));
        assertThat(cooled.consecutiveFailures()).isZero();

        assertThatThrownBy(() -> manager.selectWallet(WalletRole.SNIPING, SIZE))
                .isInstanceOf(AllWalletsCoolingDownException.class);
        assertThat(alerts.recent()).extracting(AlertEvent::category)
                .containsExactly(AlertCategory.WALLET_COOLDOWN_EXHAUSTED);

        clock.advance(Duration.ofSeconds(300));
        assertThat(manager.selectWallet(WalletRole.SNIPING, SIZE).id()).isEqualTo("sniping-1");
    }

    @Test
    void shouldAdjustAndDecayReputation() {
        WalletManager manager = manager(wallet("sniping-1", WalletRole.SNIPING, "1"));

        Wallet flagged = manager.recordExecution("sniping-1", ExecutionOutcome.FLAGGED);
        assertThat(flagged.reputationScore()).isCloseTo(4.0, within(1e-9));

        Wallet ok = manager.recordExecution("sniping-1", ExecutionOutcome.SUCCESS);
        assertThat(ok.reputationScore()).isCloseTo(4.1, within(1e-9));

        // one half-life later the distance to neutral halves
        clock.advance(Duration.ofDays(1));
        assertThat(manager.reputation(ok, clock.instant())).isCloseTo(4.55, within(1e-9));
    }

    @Test
    void shouldRespectDailyCapAndResetNextDay() throws Exception {
        Wallet busy = new Wallet("longterm-1", WalletRole.LONGTERM, BigDecimal.TEN, 5.0, NOW, null, 20, null, 0);
        WalletManager manager = manager(busy);

        assertThatThrownBy(() -> manager.selectWallet(WalletRole.LONGTERM, SIZE))
                .isInstanceOf(NoEligibleWalletException.class);

        clock.advance(Duration.ofDays(1));
        manager.resetDailyCountersIfNeeded();

        assertThat(manager.require("longterm-1").dailyTxCount()).isZero();
        assertThat(manager.selectWallet(WalletRole.LONGTERM, SIZE).id()).isEqualTo("longterm-1");
    }

    @Test
    void shouldApplyFillsAndClampAtZero() {
        InMemoryWalletStore store = new InMemoryWalletStore(List.of(wallet("sniping-1", WalletRole.SNIPING, "1")));
        WalletManager manager = new WalletManager(store, policy, alerts, clock);

        manager.applyFill("sniping-1", new BigDecimal("-0.3"));
        assertThat(store.findById("sniping-1").orElseThrow().balance()).isEqualByComparingTo("0.7");

        manager.applyFill("sniping-1", new BigDecimal("-2"));
        assertThat(manager.require("sniping-1").balance()).isEqualByComparingTo("0");

        assertThatThrownBy(() -> manager.require("ghost")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRefreshBalanceFromStore() {
        InMemoryWalletStore store = new InMemoryWalletStore(List.of(wallet("sniping-1", WalletRole.SNIPING, "1")));
        WalletManager manager = new WalletManager(store, policy, alerts, clock);

        store.save(manager.require("sniping-1").withBalance(new BigDecimal("3")));

        assertThat(manager.refreshBalance("sniping-1").balance()).isEqualByComparingTo("3");
    }

    private WalletManager manager(Wallet... wallets) {
        return new WalletManager(new InMemoryWalletStore(List.of(wallets)), policy, alerts, clock);
    }

    private static Wallet wallet(String id, WalletRole role, String balance) {
        return Wallet.fresh(id, role, new BigDecimal(balance), NOW);
    }
}
