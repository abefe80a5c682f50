package com.launchbot.hft.launchpad.risk;

import com.launchbot.hft.domain.StrategyTag;

import java.math.BigDecimal;

/**
 * Portfolio-level view of an exit fill.
 *
 * @param releasedBaseUnits cost basis taken off the book
 * @param realizedPnl PnL realized by this fill
 * @param closed whether the position is now closed
 * @param positionPnl the position's total realized PnL, meaningful once closed
 */
public record ExitFill(
        String mintId,
        StrategyTag strategyTag,
        BigDecimal releasedBaseUnits,
        BigDecimal realizedPnl,
        boolean closed,
        BigDecimal positionPnl
) {
}
