package com.launchbot.hft.domain;

/**
 * Front-running protection requested for an order.
 */
public enum ProtectionLevel {
  NONE,
  STANDARD,
  /**
   * Route privately and jitter submission timing.
   */
  HIGH
}
