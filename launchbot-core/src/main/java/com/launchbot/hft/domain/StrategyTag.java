package com.launchbot.hft.domain;

/**
 * Strategy families. Positions sharing a tag form one correlation cluster for risk purposes.
 */
public enum StrategyTag {
  SNIPE,
  LONGTERM
}
