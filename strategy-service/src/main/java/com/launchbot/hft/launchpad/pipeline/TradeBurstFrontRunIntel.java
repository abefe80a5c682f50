package com.launchbot.hft.launchpad.pipeline;

import com.launchbot.hft.domain.OrderSide;
import com.launchbot.hft.domain.TradeEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Flags a mint when a burst of buys from several distinct traders lands within a couple of seconds,
 * the usual footprint of bots racing the same launch.
 */
public class TradeBurstFrontRunIntel implements FrontRunRiskIntel {

    private static final Duration BURST_WINDOW = Duration.ofSeconds(2);
    private static final int MIN_BUYS = 5;
    private static final int MIN_DISTINCT_TRADERS = 3;

    @Override
    public boolean isElevated(String mintId, List<TradeEvent> recentTrades) {
        if (recentTrades.size() < MIN_BUYS) {
            return false;
        }
        Instant latest = recentTrades.get(recentTrades.size() - 1).timestamp();
        if (latest == null) {
            return false;
        }
        Instant from = latest.minus(BURST_WINDOW);
        int buys = 0;
        Set<String> traders = new HashSet<>();
        for (TradeEvent t : recentTrades) {
            if (t.side() != OrderSide.BUY || t.timestamp() == null || t.timestamp().isBefore(from)) {
                continue;
            }
            buys++;
            if (t.trader() != null) {
                traders.add(t.trader());
            }
        }
        return buys >= MIN_BUYS && traders.size() >= MIN_DISTINCT_TRADERS;
    }
}
