package com.launchbot.hft.launchpad.risk;

import com.launchbot.hft.config.ConfigurationException;
import com.launchbot.hft.config.HftProperties;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Validated portfolio limits.
 */
public record RiskLimits(
        BigDecimal portfolioValue,
        BigDecimal maxDailyLoss,
        int maxOpenPositions,
        double maxPerMintFraction,
        double maxCorrelatedFraction,
        BigDecimal maxPositionSize,
        BigDecimal minTradeSize,
        double maxDrawdownPct,
        double minDrawdownScale,
        int consecutiveLossLimit,
        double apiErrorRateThreshold,
        int apiErrorWindow,
        int apiErrorMinSamples,
        Duration reservationTimeout,
        ZoneId dailyResetZone,
        int dailyResetHour
) {

    public static RiskLimits from(HftProperties.Risk risk) {
        if (risk == null) {
            throw new ConfigurationException("hft.risk limits are missing");
        }
        if (risk.portfolioValue().signum() <= 0) {
            throw new ConfigurationException("hft.risk.portfolio-value must be positive");
        }
        if (risk.maxPositionSize().compareTo(risk.minTradeSize()) < 0) {
            throw new ConfigurationException("hft.risk.max-position-size is below min-trade-size");
        }
        if (risk.dailyResetHour() > 23) {
            throw new ConfigurationException("hft.risk.daily-reset-hour must be 0..23");
        }
        ZoneId zone;
        try {
            zone = ZoneId.of(risk.dailyResetZone());
        } catch (DateTimeException e) {
            throw new ConfigurationException("hft.risk.daily-reset-zone is invalid: " + risk.dailyResetZone(), e);
        }
        return new RiskLimits(
                risk.portfolioValue(),
                risk.maxDailyLoss(),
                risk.maxOpenPositions(),
                risk.maxPerMintFraction(),
                risk.maxCorrelatedFraction(),
                risk.maxPositionSize(),
                risk.minTradeSize(),
                risk.maxDrawdownPct(),
                risk.minDrawdownScale(),
                risk.consecutiveLossLimit(),
                risk.apiErrorRateThreshold(),
                risk.apiErrorWindow(),
                risk.apiErrorMinSamples(),
                Duration.ofMillis(risk.reservationTimeoutMillis()),
                zone,
                risk.dailyResetHour()
        );
    }
}
