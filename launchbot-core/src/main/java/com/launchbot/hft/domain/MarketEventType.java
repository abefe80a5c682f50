package com.launchbot.hft.domain;

public enum MarketEventType {
  TOKEN,
  TRADE,
  MIGRATION
}
