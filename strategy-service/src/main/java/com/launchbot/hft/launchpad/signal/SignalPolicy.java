package com.launchbot.hft.launchpad.signal;

import com.launchbot.hft.config.ConfigurationException;
import com.launchbot.hft.config.HftProperties;
import com.launchbot.hft.domain.ProtectionLevel;
import com.launchbot.hft.domain.StrategyTag;

import java.math.BigDecimal;

/**
 * Decision thresholds and sizing curve for one strategy.
 */
public record SignalPolicy(
        StrategyTag tag,
        double scoreThreshold,
        double hysteresisBand,
        BigDecimal baseSize,
        BigDecimal sizePerPoint,
        BigDecimal maxSize,
        ProtectionLevel baseProtection
) {

    public static SignalPolicy from(StrategyTag tag, HftProperties.Strategy cfg) {
        if (cfg.maxSize().compareTo(cfg.baseSize()) < 0) {
            throw new ConfigurationException("Strategy " + tag + " maxSize must be >= baseSize");
        }
        return new SignalPolicy(tag, cfg.scoreThreshold(), cfg.hysteresisBand(), cfg.baseSize(),
                cfg.sizePerPoint(), cfg.maxSize(), cfg.baseProtection());
    }
}
