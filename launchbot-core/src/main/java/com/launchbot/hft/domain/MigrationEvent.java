package com.launchbot.hft.domain;

import java.time.Instant;

/**
 * A token graduated off its bonding curve onto an open exchange venue.
 */
public record MigrationEvent(
    String mintId,
    String destination,
    Instant timestamp
) implements MarketEvent {

  @Override
  public MarketEventType eventType() {
    return MarketEventType.MIGRATION;
  }
}
