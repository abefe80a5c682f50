package com.launchbot.hft.launchpad.scoring;

import com.launchbot.hft.domain.StrategyTag;

import java.time.Instant;
import java.util.Map;

/**
 * Composite opportunity score for a mint under one strategy. Never mutated; re-scoring yields a new instance.
 */
public record Score(
        String mintId,
        StrategyTag strategyTag,
        double compositeValue,
        Map<ScoringFactor, FactorScore> factorBreakdown,
        Instant computedAt
) {

    public Score {
        factorBreakdown = Map.copyOf(factorBreakdown);
    }

    public boolean isDegraded(ScoringFactor factor) {
        FactorScore fs = factorBreakdown.get(factor);
        return fs != null && fs.degraded();
    }
}
