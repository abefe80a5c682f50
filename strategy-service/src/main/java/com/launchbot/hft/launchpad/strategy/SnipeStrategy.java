package com.launchbot.hft.launchpad.strategy;

import com.launchbot.hft.config.HftProperties;
import com.launchbot.hft.domain.StrategyTag;
import com.launchbot.hft.launchpad.scoring.ScoringEngine;
import com.launchbot.hft.launchpad.signal.SignalGenerator;

/**
 * Early entries on fresh launches. Scores at launch and keeps re-scoring as trades come in.
 */
public class SnipeStrategy extends AbstractLaunchStrategy {

    public SnipeStrategy(HftProperties.Strategy cfg, ScoringEngine scoringEngine, SignalGenerator signalGenerator) {
        super(StrategyTag.SNIPE, cfg, scoringEngine, signalGenerator);
    }

    @Override
    public boolean evaluatesOnLaunch() {
        return true;
    }

    @Override
    public boolean reevaluateOnSnapshot() {
        return true;
    }
}
