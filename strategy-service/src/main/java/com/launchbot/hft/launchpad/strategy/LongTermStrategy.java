package com.launchbot.hft.launchpad.strategy;

import com.launchbot.hft.config.HftProperties;
import com.launchbot.hft.domain.StrategyTag;
import com.launchbot.hft.launchpad.scoring.ScoringEngine;
import com.launchbot.hft.launchpad.signal.SignalGenerator;

/**
 * Patient entries on tokens that have proven traction. Waits for market data instead of scoring at launch.
 */
public class LongTermStrategy extends AbstractLaunchStrategy {

    public LongTermStrategy(HftProperties.Strategy cfg, ScoringEngine scoringEngine, SignalGenerator signalGenerator) {
        super(StrategyTag.LONGTERM, cfg, scoringEngine, signalGenerator);
    }

    @Override
    public boolean evaluatesOnLaunch() {
        return false;
    }

    @Override
    public boolean reevaluateOnSnapshot() {
        return true;
    }
}
