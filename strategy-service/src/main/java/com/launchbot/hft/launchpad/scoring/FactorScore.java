package com.launchbot.hft.launchpad.scoring;

/**
 * One factor's normalized contribution to a score.
 *
 * @param value normalized to [0, 10]; the neutral midpoint when {@code degraded}
 * @param degraded the input was missing or unusable
 */
public record FactorScore(
        double value,
        double weight,
        boolean degraded,
        String note
) {

    public static FactorScore of(double value, double weight) {
        return new FactorScore(value, weight, false, null);
    }

    public static FactorScore degraded(double weight, String note) {
        return new FactorScore(ScoringEngine.NEUTRAL_FACTOR_VALUE, weight, true, note);
    }

    public double contribution() {
        return value * weight;
    }
}
