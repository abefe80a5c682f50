package com.launchbot.hft.launchpad.execution;

import com.launchbot.hft.domain.OrderSide;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Outcome of one execution across all its tranches.
 *
 * @param filledTokens token quantity bought or sold
 * @param filledBaseUnits base units spent (BUY) or received before fees (SELL)
 * @param avgPrice volume-weighted average fill price, {@code null} when nothing filled
 */
public record ExecutionResult(
        String signalId,
        String walletId,
        OrderSide side,
        ExecutionMode mode,
        ExecutionStatus status,
        BigDecimal filledTokens,
        BigDecimal filledBaseUnits,
        BigDecimal avgPrice,
        BigDecimal fees,
        int tranchesPlanned,
        int tranchesFilled,
        String error,
        Instant completedAt
) {

    public boolean hasFill() {
        return filledTokens != null && filledTokens.signum() > 0;
    }
}
