package com.launchbot.hft.launchpad.pipeline;

import com.launchbot.hft.domain.TradeEvent;

import java.util.List;

/**
 * Decides whether a mint's order flow looks like it is being watched and front-run.
 */
public interface FrontRunRiskIntel {

    FrontRunRiskIntel NONE = (mintId, recentTrades) -> false;

    /**
     * @param recentTrades trades inside the tape window, oldest first
     */
    boolean isElevated(String mintId, List<TradeEvent> recentTrades);
}
