package com.launchbot.hft.launchpad.execution;

import com.launchbot.hft.config.ConfigurationException;
import com.launchbot.hft.config.HftProperties;
import com.launchbot.hft.domain.ProtectionLevel;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Validated execution parameters.
 */
public record ExecutionSettings(
        int maxSlippageBps,
        int standardSlippageBps,
        int highProtectionSlippageBps,
        BigDecimal nonePriorityFee,
        BigDecimal standardPriorityFee,
        BigDecimal highPriorityFee,
        double maxDepthFraction,
        int maxTranches,
        Duration interTrancheDelay,
        Duration protectedJitter,
        int maxRetries,
        Duration retryBackoff,
        Duration submitTimeout
) {

    public static ExecutionSettings from(HftProperties.Execution e) {
        if (e == null) {
            throw new ConfigurationException("hft.execution is missing");
        }
        if (e.maxDepthFraction() <= 0.0) {
            throw new ConfigurationException("hft.execution.max-depth-fraction must be positive");
        }
        return new ExecutionSettings(
                e.maxSlippageBps(),
                e.standardSlippageBps(),
                e.highProtectionSlippageBps(),
                e.nonePriorityFee(),
                e.standardPriorityFee(),
                e.highPriorityFee(),
                e.maxDepthFraction(),
                e.maxTranches(),
                Duration.ofMillis(e.interTrancheDelayMillis()),
                Duration.ofMillis(e.protectedJitterMillis()),
                e.maxRetries(),
                Duration.ofMillis(e.retryBackoffMillis()),
                Duration.ofMillis(e.submitTimeoutMillis())
        );
    }

    /**
     * Slippage tolerance for a protection level, never above the configured ceiling.
     */
    public int slippageBpsFor(ProtectionLevel level) {
        int bps = switch (level) {
            case NONE -> maxSlippageBps;
            case STANDARD -> standardSlippageBps;
            case HIGH -> highProtectionSlippageBps;
        };
        return Math.min(bps, maxSlippageBps);
    }

    public BigDecimal priorityFeeFor(ProtectionLevel level) {
        return switch (level) {
            case NONE -> nonePriorityFee;
            case STANDARD -> standardPriorityFee;
            case HIGH -> highPriorityFee;
        };
    }
}
