package com.launchbot.hft.launchpad.strategy;

import com.launchbot.hft.config.HftProperties;
import com.launchbot.hft.domain.MarketSnapshot;
import com.launchbot.hft.domain.Signal;
import com.launchbot.hft.domain.StrategyTag;
import com.launchbot.hft.domain.TokenEvent;
import com.launchbot.hft.domain.WalletRole;
import com.launchbot.hft.launchpad.position.ExitPolicy;
import com.launchbot.hft.launchpad.scoring.Score;
import com.launchbot.hft.launchpad.scoring.ScoringEngine;
import com.launchbot.hft.launchpad.scoring.ScoringProfile;
import com.launchbot.hft.launchpad.signal.SignalGenerator;
import com.launchbot.hft.launchpad.signal.SignalPolicy;

import java.util.Optional;

/**
 * Shared wiring for strategies that differ only in configuration and evaluation timing.
 *
 * Profiles and policies are validated in the constructor, so a bad strategy block fails startup.
 */
public abstract class AbstractLaunchStrategy implements TradingStrategy {

    private final StrategyTag tag;
    private final HftProperties.Strategy cfg;
    private final ScoringEngine scoringEngine;
    private final SignalGenerator signalGenerator;
    private final ScoringProfile scoringProfile;
    private final SignalPolicy signalPolicy;
    private final ExitPolicy exitPolicy;

    protected AbstractLaunchStrategy(StrategyTag tag, HftProperties.Strategy cfg, ScoringEngine scoringEngine,
                                     SignalGenerator signalGenerator) {
        this.tag = tag;
        this.cfg = cfg;
        this.scoringEngine = scoringEngine;
        this.signalGenerator = signalGenerator;
        this.scoringProfile = ScoringProfile.from(tag, cfg);
        this.signalPolicy = SignalPolicy.from(tag, cfg);
        this.exitPolicy = ExitPolicy.from(tag, cfg.exit());
    }

    @Override
    public StrategyTag tag() {
        return tag;
    }

    @Override
    public boolean enabled() {
        return cfg.enabled();
    }

    @Override
    public WalletRole walletRole() {
        return cfg.walletRole();
    }

    @Override
    public WalletRole fallbackRole() {
        return cfg.fallbackRole();
    }

    @Override
    public Score score(TokenEvent token, MarketSnapshot snapshot) {
        return scoringEngine.score(token, snapshot, scoringProfile);
    }

    @Override
    public Optional<Signal> generateSignal(Score score, MarketSnapshot snapshot) {
        return signalGenerator.evaluate(score, snapshot, signalPolicy);
    }

    @Override
    public ExitPolicy exitPolicy() {
        return exitPolicy;
    }

    @Override
    public void forget(String mintId) {
        signalGenerator.forget(mintId, tag);
    }
}
