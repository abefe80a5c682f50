package com.launchbot.hft.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An actionable trading intent. Immutable once handed to the risk manager.
 *
 * <p>Exit signals ({@link SignalAction#SELL}) also carry the position, its wallet and the entry price used to
 * convert {@code targetSizeBaseUnits} (cost basis to liquidate) into a token quantity.
 */
public record Signal(
    String id,
    String mintId,
    SignalAction action,
    BigDecimal targetSizeBaseUnits,
    double confidence,
    ProtectionLevel protectionLevel,
    StrategyTag strategyTag,
    Instant createdAt,
    String positionId,
    String walletId,
    BigDecimal referencePrice,
    ExitReason exitReason
) {

  public static Signal entry(String id, String mintId, SignalAction action, BigDecimal size, double confidence,
                             ProtectionLevel protection, StrategyTag tag, BigDecimal referencePrice, Instant now) {
    return new Signal(id, mintId, action, size, confidence, protection, tag, now, null, null, referencePrice, null);
  }

  public boolean isExit() {
    return action == SignalAction.SELL;
  }
}
