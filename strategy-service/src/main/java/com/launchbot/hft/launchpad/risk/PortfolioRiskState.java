package com.launchbot.hft.launchpad.risk;

import com.launchbot.hft.domain.StrategyTag;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Read-only copy of the risk manager's portfolio state.
 */
public record PortfolioRiskState(
        BigDecimal dailyRealizedPnl,
        int openPositionCount,
        int reservedCount,
        Map<String, BigDecimal> concentrationByMint,
        Map<StrategyTag, BigDecimal> exposureByStrategy,
        int consecutiveLossCount,
        boolean circuitBreakerTripped,
        String tripReason,
        BigDecimal equity,
        BigDecimal peakEquity,
        double drawdownFromPeak,
        Set<StrategyTag> pausedStrategies,
        Instant asOf
) {

    public PortfolioRiskState {
        concentrationByMint = Map.copyOf(concentrationByMint);
        exposureByStrategy = Map.copyOf(exposureByStrategy);
        pausedStrategies = Set.copyOf(pausedStrategies);
    }
}
