package com.launchbot.hft.events;

import java.time.Instant;
import java.util.Map;

/**
 * Typed alert handed to the monitoring collaborator.
 */
public record AlertEvent(
    AlertSeverity severity,
    AlertCategory category,
    Map<String, Object> payload,
    Instant emittedAt
) {

  public AlertEvent {
    payload = payload == null ? Map.of() : Map.copyOf(payload);
  }
}
