package com.launchbot.hft.launchpad.pipeline;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventDeduplicatorTest {

    @Test
    void shouldReportOnlyFirstSighting() {
        EventDeduplicator dedup = new EventDeduplicator(10);

        assertThat(dedup.firstSeen("mint-1|TOKEN|1")).isTrue();
        assertThat(dedup.firstSeen("mint-1|TOKEN|1")).isFalse();
        assertThat(dedup.firstSeen("mint-1|TRADE|1")).isTrue();
    }

    @Test
    void shouldEvictOldestKeysBeyondCapacity() {
        EventDeduplicator dedup = new EventDeduplicator(2);
        dedup.firstSeen("a");
        dedup.firstSeen("b");
        dedup.firstSeen("c");

        assertThat(dedup.size()).isEqualTo(2);
        assertThat(dedup.firstSeen("a")).isTrue();
        assertThat(dedup.firstSeen("c")).isFalse();
    }

    @Test
    void shouldRejectZeroCapacity() {
        assertThatThrownBy(() -> new EventDeduplicator(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
