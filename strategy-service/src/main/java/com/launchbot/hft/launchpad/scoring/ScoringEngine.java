package com.launchbot.hft.launchpad.scoring;

import com.launchbot.hft.config.HftProperties;
import com.launchbot.hft.domain.MarketSnapshot;
import com.launchbot.hft.domain.TokenEvent;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Weighted multi-factor scoring of new tokens.
 *
 * Each factor is normalized to [0, 10] before weighting. A factor whose input is missing or broken
 * degrades to {@link #NEUTRAL_FACTOR_VALUE} instead of failing the whole score.
 * Same inputs always produce the same composite value.
 */
@Slf4j
public class ScoringEngine {

    public static final double NEUTRAL_FACTOR_VALUE = 5.0;
    private static final double MAX = 10.0;

    private final CreatorReputationLookup creatorLookup;
    private final Clock clock;

    public ScoringEngine(CreatorReputationLookup creatorLookup, Clock clock) {
        this.creatorLookup = creatorLookup;
        this.clock = clock;
    }

    /**
     * Score a token for one strategy.
     *
     * @param snapshot latest market view, may be {@code null} right after launch
     */
    public Score score(TokenEvent token, MarketSnapshot snapshot, ScoringProfile profile) {
        ScoringWeights weights = profile.weights();
        Map<ScoringFactor, FactorScore> breakdown = new EnumMap<>(ScoringFactor.class);

        breakdown.put(ScoringFactor.CREATOR_HISTORY,
                creatorHistory(token, weights.weight(ScoringFactor.CREATOR_HISTORY)));
        breakdown.put(ScoringFactor.LIQUIDITY_SETUP,
                liquiditySetup(token, profile, weights.weight(ScoringFactor.LIQUIDITY_SETUP)));
        breakdown.put(ScoringFactor.COMMUNITY_SIGNALS,
                communitySignals(token, snapshot, profile, weights.weight(ScoringFactor.COMMUNITY_SIGNALS)));
        breakdown.put(ScoringFactor.BONDING_CURVE_PROGRESS,
                bondingCurve(snapshot, profile, weights.weight(ScoringFactor.BONDING_CURVE_PROGRESS)));

        double raw = 0.0;
        for (FactorScore fs : breakdown.values()) {
            raw += fs.contribution();
        }
        double composite = BigDecimal.valueOf(clamp(raw))
                .setScale(4, RoundingMode.HALF_UP)
                .doubleValue();

        Score score = new Score(token.mintId(), profile.tag(), composite, breakdown, clock.instant());
        log.debug("scored mint={} strategy={} composite={} breakdown={}",
                token.mintId(), profile.tag(), composite, breakdown);
        return score;
    }

    private FactorScore creatorHistory(TokenEvent token, double weight) {
        String creator = token.creator();
        if (creator == null || creator.isBlank()) {
            return FactorScore.degraded(weight, "creator missing");
        }
        try {
            OptionalDouble rep = creatorLookup.reputation(creator);
            if (rep.isEmpty() || !Double.isFinite(rep.getAsDouble())) {
                return FactorScore.degraded(weight, "no creator history");
            }
            return FactorScore.of(clamp(rep.getAsDouble()), weight);
        } catch (DataQualityException e) {
            log.debug("creator lookup degraded for mint={} creator={}: {}", token.mintId(), creator, e.getMessage());
            return FactorScore.degraded(weight, e.getMessage());
        }
    }

    private FactorScore liquiditySetup(TokenEvent token, ScoringProfile profile, double weight) {
        BigDecimal liquidity = token.initialLiquidity();
        BigDecimal target = profile.targetLiquidity();
        if (liquidity == null || liquidity.signum() < 0) {
            return FactorScore.degraded(weight, "initial liquidity unknown");
        }
        if (target == null || target.signum() <= 0) {
            return FactorScore.degraded(weight, "target liquidity not set");
        }
        double ratio = liquidity.divide(target, 8, RoundingMode.HALF_UP).doubleValue();
        return FactorScore.of(clamp(ratio * MAX), weight);
    }

    private FactorScore communitySignals(TokenEvent token, MarketSnapshot snapshot, ScoringProfile profile,
                                         double weight) {
        Double quality = token.metadataQuality();
        if (quality == null || !Double.isFinite(quality)) {
            return FactorScore.degraded(weight, "metadata quality unknown");
        }
        double value = clamp(quality);
        if (snapshot != null) {
            value = switch (snapshot.whaleSentiment()) {
                case BULLISH -> value + profile.whaleSentimentImpact();
                case BEARISH -> value - profile.whaleSentimentImpact();
                case NEUTRAL -> value;
            };
        }
        return FactorScore.of(clamp(value), weight);
    }

    private FactorScore bondingCurve(MarketSnapshot snapshot, ScoringProfile profile, double weight) {
        if (snapshot == null) {
            return FactorScore.degraded(weight, "no market snapshot");
        }
        Double progress = snapshot.bondingCurveProgress();
        if (progress == null || !Double.isFinite(progress) || progress < 0.0 || progress > 1.0) {
            return FactorScore.degraded(weight, "bonding curve progress unavailable");
        }
        double value = profile.bondingCurvePreference() == HftProperties.BondingCurvePreference.LATE
                ? progress * MAX
                : (1.0 - progress) * MAX;
        return FactorScore.of(clamp(value), weight);
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) return NEUTRAL_FACTOR_VALUE;
        return Math.max(0.0, Math.min(MAX, v));
    }
}
