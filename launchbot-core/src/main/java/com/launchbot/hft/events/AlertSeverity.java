package com.launchbot.hft.events;

public enum AlertSeverity {
  INFO,
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL
}
