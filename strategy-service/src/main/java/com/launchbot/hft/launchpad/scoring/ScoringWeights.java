package com.launchbot.hft.launchpad.scoring;

import com.launchbot.hft.config.ConfigurationException;
import com.launchbot.hft.config.HftProperties;
import com.launchbot.hft.domain.StrategyTag;

/**
 * Per-strategy factor weights. Only constructed through {@link #validated}, so every instance sums to 1.0.
 */
public record ScoringWeights(
        double creatorHistory,
        double liquiditySetup,
        double communitySignals,
        double bondingCurveProgress
) {

    public static final double SUM_TOLERANCE = 0.01;

    public static ScoringWeights validated(StrategyTag tag, HftProperties.Weights weights) {
        if (weights == null
                || weights.creatorHistory() == null
                || weights.liquiditySetup() == null
                || weights.communitySignals() == null
                || weights.bondingCurveProgress() == null) {
            throw new ConfigurationException("Scoring weights for " + tag + " must define all four factors");
        }
        return validated(tag, weights.creatorHistory(), weights.liquiditySetup(),
                weights.communitySignals(), weights.bondingCurveProgress());
    }

    public static ScoringWeights validated(StrategyTag tag, double creatorHistory, double liquiditySetup,
                                           double communitySignals, double bondingCurveProgress) {
        double[] all = {creatorHistory, liquiditySetup, communitySignals, bondingCurveProgress};
        for (double w : all) {
            if (Double.isNaN(w) || w < 0.0) {
                throw new ConfigurationException("Scoring weight for " + tag + " must be >= 0, got " + w);
            }
        }
        double sum = creatorHistory + liquiditySetup + communitySignals + bondingCurveProgress;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new ConfigurationException(String.format(
                    "Scoring weights for %s sum to %.4f, expected 1.0 +/- %.2f", tag, sum, SUM_TOLERANCE));
        }
        return new ScoringWeights(creatorHistory, liquiditySetup, communitySignals, bondingCurveProgress);
    }

    public double weight(ScoringFactor factor) {
        return switch (factor) {
            case CREATOR_HISTORY -> creatorHistory;
            case LIQUIDITY_SETUP -> liquiditySetup;
            case COMMUNITY_SIGNALS -> communitySignals;
            case BONDING_CURVE_PROGRESS -> bondingCurveProgress;
        };
    }
}
