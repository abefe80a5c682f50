package com.launchbot.hft.domain;

public enum SignalAction {
  BUY,
  SELL,
  /**
   * Explicit no-op: the opportunity was evaluated and declined.
   */
  AVOID
}
