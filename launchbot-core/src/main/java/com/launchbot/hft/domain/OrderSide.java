package com.launchbot.hft.domain;

public enum OrderSide {
  BUY,
  SELL
}
