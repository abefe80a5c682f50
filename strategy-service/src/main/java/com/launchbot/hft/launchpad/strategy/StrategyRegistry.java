package com.launchbot.hft.launchpad.strategy;

import com.launchbot.hft.domain.StrategyTag;
import com.launchbot.hft.launchpad.position.ExitPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
public class StrategyRegistry {

    private final Map<StrategyTag, TradingStrategy> strategies = new EnumMap<>(StrategyTag.class);

    public StrategyRegistry(Collection<? extends TradingStrategy> all) {
        for (TradingStrategy s : all) {
            if (strategies.putIfAbsent(s.tag(), s) != null) {
                throw new IllegalStateException("Duplicate strategy " + s.tag());
            }
            log.info("strategy {} registered enabled={} walletRole={} fallback={}",
                    s.tag(), s.enabled(), s.walletRole(), s.fallbackRole());
        }
    }

    public Optional<TradingStrategy> get(StrategyTag tag) {
        return Optional.ofNullable(strategies.get(tag));
    }

    public List<TradingStrategy> enabled() {
        return strategies.values().stream().filter(TradingStrategy::enabled).toList();
    }

    public List<TradingStrategy> all() {
        return List.copyOf(strategies.values());
    }

    /**
     * Exit policies for every registered strategy, enabled or not, so open positions keep their rules.
     */
    public Map<StrategyTag, ExitPolicy> exitPolicies() {
        Map<StrategyTag, ExitPolicy> policies = new EnumMap<>(StrategyTag.class);
        strategies.forEach((tag, s) -> policies.put(tag, s.exitPolicy()));
        return policies;
    }
}
