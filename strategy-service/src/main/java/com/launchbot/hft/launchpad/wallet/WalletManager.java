package com.launchbot.hft.launchpad.wallet;

import com.launchbot.hft.domain.Wallet;
import com.launchbot.hft.domain.WalletRole;
import com.launchbot.hft.events.AlertCategory;
import com.launchbot.hft.events.AlertSeverity;
import com.launchbot.hft.launchpad.alert.AlertPublisher;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Picks the wallet for each trade and keeps per-wallet usage, reputation and cooldown.
 *
 * <p>Selection among eligible wallets of a role:
 * <ol>
 *   <li>wallets at or above the minimum reputation first (only a preference),</li>
 *   <li>then the lowest daily transaction count,</li>
 *   <li>remaining ties rotate round-robin.</li>
 * </ol>
 * Reputation decays toward {@link Wallet#NEUTRAL_REPUTATION} with the configured half-life. Longterm wallets
 * are stamped as used when selected, which starts their spacing window.
 */
@Slf4j
public class WalletManager {

    private static final double MAX_REPUTATION = 10.0;

    private final WalletStore store;
    private final WalletPolicy policy;
    private final AlertPublisher alerts;
    private final Clock clock;

    private final Map<String, Wallet> wallets = new ConcurrentHashMap<>();
    private final Map<WalletRole, Integer> rotation = new EnumMap<>(WalletRole.class);
    private LocalDate countersDay;

    public WalletManager(WalletStore store, WalletPolicy policy, AlertPublisher alerts, Clock clock) {
        this.store = store;
        this.policy = policy;
        this.alerts = alerts;
        this.clock = clock;
        store.findAll().forEach(w -> wallets.put(w.id(), w));
        this.countersDay = day(clock.instant());
        log.info("wallet manager loaded {} wallets", wallets.size());
    }

    /**
     * @param estimatedSize base units the trade will spend, excluding fees
     * @throws NoEligibleWalletException when no wallet of the role qualifies
     * @throws AllWalletsCoolingDownException when qualifying wallets exist but all are cooling down
     */
    public synchronized Wallet selectWallet(WalletRole role, BigDecimal estimatedSize) throws WalletUnavailableException {
        Instant now = clock.instant();
        resetDailyCountersIfNeeded(now);
        BigDecimal required = estimatedSize.add(policy.feeBuffer());

        List<Wallet> ofRole = wallets.values().stream()
                .filter(w -> w.role() == role)
                .sorted(Comparator.comparing(Wallet::id))
                .toList();
        if (ofRole.isEmpty()) {
            throw new NoEligibleWalletException(role, "no " + role + " wallets configured");
        }

        List<Wallet> funded = ofRole.stream()
                .filter(w -> w.balance().compareTo(required) >= 0)
                .filter(w -> w.dailyTxCount() < policy.capFor(role))
                .toList();
        List<Wallet> eligible = funded.stream()
                .filter(w -> !w.inCooldown(now))
                .toList();
        if (role == WalletRole.LONGTERM) {
            eligible = eligible.stream()
                    .filter(w -> w.lastUsedAt() == null
                            || Duration.between(w.lastUsedAt(), now).compareTo(policy.longtermMinSpacing()) >= 0)
                    .toList();
        }

        if (eligible.isEmpty()) {
            if (!funded.isEmpty()) {
                alerts.publish(AlertSeverity.MEDIUM, AlertCategory.WALLET_COOLDOWN_EXHAUSTED, Map.of(
                        "role", role.name(),
                        "candidates", funded.size()
                ), now);
                throw new AllWalletsCoolingDownException(role,
                        funded.size() + " " + role + " wallets qualify but all are cooling down");
            }
            throw new NoEligibleWalletException(role,
                    "no " + role + " wallet with balance >= " + required.toPlainString() + " under the daily cap");
        }

        boolean anyReputable = eligible.stream().anyMatch(w -> reputation(w, now) >= policy.minReputation());
        List<Wallet> preferred = anyReputable
                ? eligible.stream().filter(w -> reputation(w, now) >= policy.minReputation()).toList()
                : eligible;
        int fewestTx = preferred.stream().mapToInt(Wallet::dailyTxCount).min().orElse(0);
        List<Wallet> tied = preferred.stream().filter(w -> w.dailyTxCount() == fewestTx).toList();

        int cursor = rotation.getOrDefault(role, 0);
        Wallet chosen = tied.get(Math.floorMod(cursor, tied.size()));
        rotation.put(role, cursor + 1);
        if (role == WalletRole.LONGTERM) {
            // spacing runs from selection, so a concurrent lane cannot pick the same wallet
            chosen = chosen.withUsage(now, chosen.dailyTxCount(), chosen.cooldownUntil(), chosen.consecutiveFailures());
            persist(chosen);
        }

        log.debug("selected wallet {} role={} size={} eligible={} tied={}",
                chosen.id(), role, estimatedSize, eligible.size(), tied.size());
        return chosen;
    }

    /**
     * Record the outcome of a submission made with the wallet.
     */
    public synchronized Wallet recordExecution(String walletId, ExecutionOutcome outcome) {
        Instant now = clock.instant();
        resetDailyCountersIfNeeded(now);
        Wallet wallet = require(walletId);

        double reputation = reputation(wallet, now);
        int failures;
        Instant cooldown = wallet.cooldownUntil();
        switch (outcome) {
            case SUCCESS -> {
                reputation += policy.successNudge();
                failures = 0;
            }
            case FLAGGED -> {
                reputation -= 2 * policy.failureNudge();
                failures = wallet.consecutiveFailures() + 1;
            }
            default -> {
                reputation -= policy.failureNudge();
                failures = wallet.consecutiveFailures() + 1;
            }
        }
        if (failures >= policy.maxConsecutiveFailures()) {
            cooldown = now.plus(policy.failureCooldown());
            log.warn("wallet {} cooling down until {} after {} consecutive failures", walletId, cooldown, failures);
            failures = 0;
        }
        reputation = Math.max(0.0, Math.min(MAX_REPUTATION, reputation));

        Wallet updated = wallet
                .withReputation(reputation, now)
                .withUsage(now, wallet.dailyTxCount() + 1, cooldown, failures);
        persist(updated);
        log.debug("wallet {} outcome={} reputation={} dailyTx={}",
                walletId, outcome, reputation, updated.dailyTxCount());
        return updated;
    }

    /**
     * Re-read the wallet's balance from the store.
     */
    public synchronized Wallet refreshBalance(String walletId) {
        Wallet cached = require(walletId);
        Optional<Wallet> stored = store.findById(walletId);
        if (stored.isEmpty()) {
            return cached;
        }
        Wallet updated = cached.withBalance(stored.get().balance());
        wallets.put(walletId, updated);
        return updated;
    }

    /**
     * Apply a balance change from a fill (negative for spend, positive for proceeds).
     */
    public synchronized Wallet applyFill(String walletId, BigDecimal delta) {
        Wallet wallet = require(walletId);
        BigDecimal next = wallet.balance().add(delta);
        if (next.signum() < 0) {
            log.warn("wallet {} balance would go negative ({}), clamping to zero", walletId, next);
            next = BigDecimal.ZERO;
        }
        Wallet updated = wallet.withBalance(next);
        persist(updated);
        return updated;
    }

    public synchronized void resetDailyCountersIfNeeded() {
        resetDailyCountersIfNeeded(clock.instant());
    }

    public Wallet require(String walletId) {
        Wallet wallet = wallets.get(walletId);
        if (wallet == null) {
            throw new IllegalArgumentException("Unknown wallet " + walletId);
        }
        return wallet;
    }

    public List<Wallet> wallets() {
        return wallets.values().stream()
                .sorted(Comparator.comparing(Wallet::id))
                .toList();
    }

    /**
     * Reputation as of {@code now}, decayed toward neutral since the last update.
     */
    public double reputation(Wallet wallet, Instant now) {
        Instant since = wallet.reputationUpdatedAt();
        if (since == null || !now.isAfter(since)) {
            return wallet.reputationScore();
        }
        double halfLives = (double) Duration.between(since, now).toMillis() / policy.reputationHalfLife().toMillis();
        double decay = Math.pow(0.5, halfLives);
        return Wallet.NEUTRAL_REPUTATION + (wallet.reputationScore() - Wallet.NEUTRAL_REPUTATION) * decay;
    }

    private void resetDailyCountersIfNeeded(Instant now) {
        LocalDate today = day(now);
        if (today.equals(countersDay)) {
            return;
        }
        countersDay = today;
        for (Wallet wallet : List.copyOf(wallets.values())) {
            if (wallet.dailyTxCount() != 0) {
                persist(wallet.withUsage(wallet.lastUsedAt(), 0, wallet.cooldownUntil(), wallet.consecutiveFailures()));
            }
        }
        log.info("wallet daily counters reset for {}", today);
    }

    private void persist(Wallet wallet) {
        wallets.put(wallet.id(), wallet);
        store.save(wallet);
    }

    private LocalDate day(Instant now) {
        return LocalDateTime.ofInstant(now, policy.dailyResetZone())
                .minusHours(policy.dailyResetHour())
                .toLocalDate();
    }
}
