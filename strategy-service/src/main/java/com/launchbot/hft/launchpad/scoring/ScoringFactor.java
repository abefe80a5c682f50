package com.launchbot.hft.launchpad.scoring;

public enum ScoringFactor {
    CREATOR_HISTORY,
    LIQUIDITY_SETUP,
    COMMUNITY_SIGNALS,
    BONDING_CURVE_PROGRESS
}
