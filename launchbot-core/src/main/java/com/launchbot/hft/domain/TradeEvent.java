package com.launchbot.hft.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * A trade printed on a token's bonding curve.
 *
 * @param baseAmount trade size in base units
 * @param depthAtLevels visible liquidity per price level in base units, empty when the feed has none
 */
public record TradeEvent(
    String mintId,
    String trader,
    OrderSide side,
    BigDecimal baseAmount,
    BigDecimal price,
    Double bondingCurveProgress,
    List<BigDecimal> depthAtLevels,
    Instant timestamp,
    String signature
) implements MarketEvent {

  public TradeEvent {
    depthAtLevels = depthAtLevels == null ? List.of() : List.copyOf(depthAtLevels);
  }

  @Override
  public MarketEventType eventType() {
    return MarketEventType.TRADE;
  }

  /**
   * Several trades can share a timestamp; the transaction signature tells them apart.
   */
  @Override
  public String dedupKey() {
    String base = MarketEvent.super.dedupKey();
    return signature == null || signature.isBlank() ? base : base + "|" + signature;
  }
}
