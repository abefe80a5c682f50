package com.launchbot.hft.domain;

public enum ExitReason {
  STOP_LOSS,
  TRAILING_STOP,
  TAKE_PROFIT,
  TIMEOUT,
  MIGRATION
}
