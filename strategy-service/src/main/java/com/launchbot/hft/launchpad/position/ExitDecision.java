package com.launchbot.hft.launchpad.position;

import com.launchbot.hft.domain.ExitReason;

import java.math.BigDecimal;

/**
 * An exit the tracker wants executed.
 *
 * @param sizeBaseUnits cost basis to liquidate
 */
public record ExitDecision(
        Position position,
        ExitReason reason,
        BigDecimal sizeBaseUnits
) {
}
