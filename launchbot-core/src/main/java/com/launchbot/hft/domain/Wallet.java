package com.launchbot.hft.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A trading account. Only the wallet manager produces updated copies.
 */
public record Wallet(
    String id,
    WalletRole role,
    BigDecimal balance,
    double reputationScore,
    Instant reputationUpdatedAt,
    Instant lastUsedAt,
    int dailyTxCount,
    Instant cooldownUntil,
    int consecutiveFailures
) {

  public static final double NEUTRAL_REPUTATION = 5.0;

  public Wallet {
    if (balance == null) {
      balance = BigDecimal.ZERO;
    }
  }

  public static Wallet fresh(String id, WalletRole role, BigDecimal balance, Instant now) {
    return new Wallet(id, role, balance, NEUTRAL_REPUTATION, now, null, 0, null, 0);
  }

  public boolean inCooldown(Instant now) {
    return cooldownUntil != null && now.isBefore(cooldownUntil);
  }

  public Wallet withBalance(BigDecimal newBalance) {
    return new Wallet(id, role, newBalance, reputationScore, reputationUpdatedAt, lastUsedAt, dailyTxCount,
        cooldownUntil, consecutiveFailures);
  }

  public Wallet withReputation(double score, Instant at) {
    return new Wallet(id, role, balance, score, at, lastUsedAt, dailyTxCount, cooldownUntil, consecutiveFailures);
  }

  public Wallet withUsage(Instant usedAt, int txCount, Instant cooldown, int failures) {
    return new Wallet(id, role, balance, reputationScore, reputationUpdatedAt, usedAt, txCount, cooldown, failures);
  }
}
