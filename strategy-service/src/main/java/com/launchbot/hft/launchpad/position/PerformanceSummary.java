package com.launchbot.hft.launchpad.position;

import java.math.BigDecimal;
import java.util.List;

/**
 * Realized outcome of every position the tracker has seen.
 *
 * Wins and losses count closed positions that filled; entries that never filled are counted apart.
 * Realized PnL includes partial exits of positions still open.
 */
public record PerformanceSummary(
        int livePositions,
        int closedPositions,
        int unfilledEntries,
        int wins,
        int losses,
        BigDecimal realizedPnl,
        double winRate
) {

    static PerformanceSummary of(List<Position> positions) {
        int live = 0;
        int closed = 0;
        int unfilled = 0;
        int wins = 0;
        int losses = 0;
        BigDecimal realized = BigDecimal.ZERO;
        for (Position p : positions) {
            realized = realized.add(p.realizedPnl());
            if (p.isLive()) {
                live++;
                continue;
            }
            if (p.openedAt() == null) {
                unfilled++;
                continue;
            }
            closed++;
            if (p.realizedPnl().signum() > 0) {
                wins++;
            } else {
                losses++;
            }
        }
        double winRate = closed == 0 ? 0.0 : (double) wins / closed;
        return new PerformanceSummary(live, closed, unfilled, wins, losses, realized, winRate);
    }
}
