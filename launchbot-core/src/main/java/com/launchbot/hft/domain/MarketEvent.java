package com.launchbot.hft.domain;

import java.time.Instant;

/**
 * Canonical event produced by the feed normalizer.
 */
public interface MarketEvent {

  String mintId();

  MarketEventType eventType();

  Instant timestamp();

  /**
   * Key used to de-duplicate at-least-once delivery.
   */
  default String dedupKey() {
    return mintId() + "|" + eventType() + "|" + (timestamp() == null ? "" : timestamp().toEpochMilli());
  }
}
