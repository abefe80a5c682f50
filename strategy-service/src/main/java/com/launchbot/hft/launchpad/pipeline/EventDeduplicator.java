package com.launchbot.hft.launchpad.pipeline;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded set of recently seen event keys. The oldest key is evicted once capacity is reached.
 */
public class EventDeduplicator {

    private final int capacity;
    private final Map<String, Boolean> seen;

    public EventDeduplicator(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.seen = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > EventDeduplicator.this.capacity;
            }
        };
    }

    /**
     * @return true the first time a key is seen (within the retention window)
     */
    public synchronized boolean firstSeen(String key) {
        return seen.put(key, Boolean.TRUE) == null;
    }

    public synchronized int size() {
        return seen.size();
    }
}
