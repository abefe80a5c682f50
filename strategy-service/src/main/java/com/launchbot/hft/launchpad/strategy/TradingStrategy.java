package com.launchbot.hft.launchpad.strategy;

import com.launchbot.hft.domain.MarketSnapshot;
import com.launchbot.hft.domain.Signal;
import com.launchbot.hft.domain.StrategyTag;
import com.launchbot.hft.domain.TokenEvent;
import com.launchbot.hft.domain.WalletRole;
import com.launchbot.hft.launchpad.position.ExitPolicy;
import com.launchbot.hft.launchpad.scoring.Score;

import java.util.Optional;

/**
 * A trading strategy: how it scores tokens, when it signals, and how its positions exit.
 */
public interface TradingStrategy {

    StrategyTag tag();

    boolean enabled();

    WalletRole walletRole();

    /**
     * Role tried when {@link #walletRole()} has no eligible wallet, or {@code null}.
     */
    WalletRole fallbackRole();

    Score score(TokenEvent token, MarketSnapshot snapshot);

    Optional<Signal> generateSignal(Score score, MarketSnapshot snapshot);

    ExitPolicy exitPolicy();

    /**
     * Whether the strategy scores a token as soon as it launches, before any trade data exists.
     */
    boolean evaluatesOnLaunch();

    /**
     * Whether later market snapshots re-score the token.
     */
    boolean reevaluateOnSnapshot();

    /**
     * Drop this strategy's decision memory for the mint.
     */
    void forget(String mintId);
}
