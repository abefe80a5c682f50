package com.launchbot.hft.launchpad.position;

import com.launchbot.hft.config.ConfigurationException;
import com.launchbot.hft.config.HftProperties;
import com.launchbot.hft.domain.StrategyTag;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Exit rules applied to every position of a strategy.
 */
public record ExitPolicy(
        double stopLossPct,
        List<TakeProfitTier> takeProfitTiers,
        double trailingStopPct,
        Duration maxHold,
        double migrationExitFraction
) {

    public ExitPolicy {
        takeProfitTiers = List.copyOf(takeProfitTiers);
    }

    public static ExitPolicy from(StrategyTag tag, HftProperties.Exit exit) {
        if (exit.stopLossPct() <= 0.0 || exit.stopLossPct() >= 1.0) {
            throw new ConfigurationException("Strategy " + tag + " stopLossPct must be in (0, 1)");
        }
        List<TakeProfitTier> tiers = new ArrayList<>();
        double lastMultiple = 1.0;
        for (HftProperties.TakeProfit tp : exit.takeProfit()) {
            if (tp.multiple() == null || tp.fraction() == null) {
                throw new ConfigurationException("Strategy " + tag + " take-profit tiers need multiple and fraction");
            }
            if (tp.multiple() <= lastMultiple) {
                throw new ConfigurationException("Strategy " + tag + " take-profit multiples must ascend above 1.0");
            }
            if (tp.fraction() <= 0.0 || tp.fraction() > 1.0) {
                throw new ConfigurationException("Strategy " + tag + " take-profit fraction must be in (0, 1]");
            }
            tiers.add(new TakeProfitTier(tp.multiple(), tp.fraction()));
            lastMultiple = tp.multiple();
        }
        return new ExitPolicy(
                exit.stopLossPct(),
                tiers,
                exit.trailingStopPct(),
                Duration.ofMinutes(exit.maxHoldMinutes()),
                exit.migrationExitFraction()
        );
    }
}
