package com.launchbot.hft.launchpad.position;

/**
 * Sell {@code fraction} of the remaining size once price reaches {@code multiple} times entry.
 */
public record TakeProfitTier(double multiple, double fraction) {
}
