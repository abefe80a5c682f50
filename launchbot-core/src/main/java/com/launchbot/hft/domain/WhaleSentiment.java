package com.launchbot.hft.domain;

public enum WhaleSentiment {
  BULLISH,
  NEUTRAL,
  BEARISH
}
