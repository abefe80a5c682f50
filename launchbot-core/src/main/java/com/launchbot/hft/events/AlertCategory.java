package com.launchbot.hft.events;

public enum AlertCategory {
  CIRCUIT_BREAKER_TRIPPED,
  CIRCUIT_BREAKER_RESET,
  DAILY_LOSS_LIMIT,
  EXECUTION_FAILED,
  RESERVATION_EXPIRED,
  LATE_FILL,
  WALLET_COOLDOWN_EXHAUSTED,
  STRATEGY_PAUSED,
  STRATEGY_RESUMED,
  POSITION_TRACKING
}
