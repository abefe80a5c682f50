package com.launchbot.hft.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of a mint's market. Consumed, never persisted.
 *
 * @param frontRunRiskElevated opaque flag from the risk-intel collaborator
 */
public record MarketSnapshot(
    String mintId,
    BigDecimal price,
    List<BigDecimal> depthAtLevels,
    Double bondingCurveProgress,
    WhaleSentiment whaleSentiment,
    boolean frontRunRiskElevated,
    Instant observedAt
) {

  public MarketSnapshot {
    depthAtLevels = depthAtLevels == null ? List.of() : List.copyOf(depthAtLevels);
    if (whaleSentiment == null) {
      whaleSentiment = WhaleSentiment.NEUTRAL;
    }
  }

  public BigDecimal visibleDepth() {
    return depthAtLevels.stream()
        .filter(d -> d != null && d.signum() > 0)
        .reduce(BigDecimal.ZERO, BigDecimal::add);
  }
}
