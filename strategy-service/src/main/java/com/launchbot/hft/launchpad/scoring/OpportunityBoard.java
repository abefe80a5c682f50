package com.launchbot.hft.launchpad.scoring;

import com.launchbot.hft.domain.StrategyTag;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest score of every tracked launch, one per strategy, for ranking opportunities.
 */
public class OpportunityBoard {

    private final Map<String, Map<StrategyTag, Score>> latest = new ConcurrentHashMap<>();

    public void record(Score score) {
        latest.computeIfAbsent(score.mintId(), k -> new ConcurrentHashMap<>()).put(score.strategyTag(), score);
    }

    /**
     * Highest composite first. Ties go to the more recent score.
     */
    public List<Score> top(int limit) {
        return latest.values().stream()
                .flatMap(m -> m.values().stream())
                .sorted(Comparator.comparingDouble(Score::compositeValue).reversed()
                        .thenComparing(Score::computedAt, Comparator.reverseOrder()))
                .limit(Math.max(0, limit))
                .toList();
    }

    public List<Score> recent(int limit) {
        return latest.values().stream()
                .flatMap(m -> m.values().stream())
                .sorted(Comparator.comparing(Score::computedAt).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    public void forget(String mintId) {
        latest.remove(mintId);
    }

    public int size() {
        return latest.size();
    }
}
