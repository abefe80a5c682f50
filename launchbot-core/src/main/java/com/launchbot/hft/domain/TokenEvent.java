package com.launchbot.hft.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A new token launched on the venue.
 *
 * @param metadataQuality 0..10 quality of name/symbol/socials as judged by the normalizer, {@code null} if unknown
 * @param initialLiquidity base units seeded into the curve at launch, {@code null} if unknown
 */
public record TokenEvent(
    String mintId,
    String creator,
    String name,
    String symbol,
    Instant createdAt,
    Double metadataQuality,
    BigDecimal initialLiquidity,
    String source
) implements MarketEvent {

  @Override
  public MarketEventType eventType() {
    return MarketEventType.TOKEN;
  }

  @Override
  public Instant timestamp() {
    return createdAt;
  }
}
