package com.launchbot.hft.launchpad.scoring;

import com.launchbot.hft.config.HftProperties;
import com.launchbot.hft.domain.StrategyTag;

import java.math.BigDecimal;

/**
 * Strategy-specific inputs to the scoring engine.
 */
public record ScoringProfile(
        StrategyTag tag,
        ScoringWeights weights,
        HftProperties.BondingCurvePreference bondingCurvePreference,
        BigDecimal targetLiquidity,
        double whaleSentimentImpact
) {

    public static ScoringProfile from(StrategyTag tag, HftProperties.Strategy cfg) {
        return new ScoringProfile(
                tag,
                ScoringWeights.validated(tag, cfg.weights()),
                cfg.bondingCurvePreference(),
                cfg.targetLiquidity(),
                cfg.whaleSentimentImpact()
        );
    }
}
