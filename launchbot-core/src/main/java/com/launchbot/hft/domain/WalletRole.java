package com.launchbot.hft.domain;

public enum WalletRole {
  SNIPING,
  LONGTERM,
  UTILITY,
  RESERVE
}
