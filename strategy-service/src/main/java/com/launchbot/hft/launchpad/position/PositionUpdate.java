package com.launchbot.hft.launchpad.position;

import java.math.BigDecimal;

/**
 * Result of applying an exit fill.
 *
 * @param releasedBaseUnits cost basis taken off the position
 * @param realizedPnlDelta PnL realized by this fill (entry fees included on the first exit)
 */
public record PositionUpdate(
        Position position,
        BigDecimal releasedBaseUnits,
        BigDecimal realizedPnlDelta,
        boolean closed
) {
}
