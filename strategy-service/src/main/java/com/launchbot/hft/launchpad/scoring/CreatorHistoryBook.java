package com.launchbot.hft.launchpad.scoring;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process creator track record, learned from how positions in a creator's tokens ended.
 *
 * Reputation is a Laplace-smoothed win rate scaled to [0, 10], so a creator with no closed
 * positions yet is unknown rather than neutral. Externally sourced reputations can be seeded.
 */
@Slf4j
public class CreatorHistoryBook implements CreatorReputationLookup {

    private final Map<String, Record> byCreator = new ConcurrentHashMap<>();
    private final Map<String, Double> seeded = new ConcurrentHashMap<>();

    @Override
    public OptionalDouble reputation(String creator) {
        if (creator == null) return OptionalDouble.empty();
        Double seed = seeded.get(creator);
        if (seed != null) return OptionalDouble.of(seed);
        Record r = byCreator.get(creator);
        if (r == null || r.total() == 0) return OptionalDouble.empty();
        return OptionalDouble.of(10.0 * (r.wins() + 1) / (r.total() + 2));
    }

    public void seed(String creator, double reputation) {
        seeded.put(creator, Math.max(0.0, Math.min(10.0, reputation)));
    }

    /**
     * Record the outcome of a closed position on one of the creator's tokens.
     */
    public void recordOutcome(String creator, boolean profitable) {
        if (creator == null || creator.isBlank()) return;
        Record updated = byCreator.merge(creator,
                profitable ? new Record(1, 0) : new Record(0, 1),
                (a, b) -> new Record(a.wins() + b.wins(), a.losses() + b.losses()));
        log.debug("creator {} outcome recorded: wins={} losses={}", creator, updated.wins(), updated.losses());
    }

    private record Record(int wins, int losses) {
        int total() {
            return wins + losses;
        }
    }
}
