package com.launchbot.hft.launchpad.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.launchbot.hft.launchpad.pipeline.MarketEventQueue;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KafkaMarketEventListenerTest {

    private static final String TRADE = """
            {"type":"trade","data":{"mint":"mint-1","side":"buy","baseAmount":0.1,"price":0.0001,
             "timestamp":"2024-01-15T10:00:00Z","signature":"s1"}}
            """;

    private SimpleMeterRegistry meterRegistry;
    private MarketEventQueue queue;
    private KafkaMarketEventListener listener;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        queue = new MarketEventQueue(1, meterRegistry);
        listener = new KafkaMarketEventListener(new MarketEventCodec(new ObjectMapper()), queue, meterRegistry);
    }

    @AfterEach
    void tearDown() {
        queue.close();
    }

    @Test
    void shouldPublishDecodedEvents() {
        listener.onMessage(TRADE);

        assertThat(queue.size()).isEqualTo(1);
        assertThat(meterRegistry.counter("launchbot.events.published").count()).isEqualTo(1.0);
    }

    @Test
    void shouldDropMalformedPayloadsWithoutThrowing() {
        listener.onMessage("{\"type\":\"trade\"}");

        assertThat(queue.size()).isZero();
        assertThat(meterRegistry.counter("launchbot.ingest.malformed").count()).isEqualTo(1.0);
    }

    @Test
    void shouldThrowForRedeliveryWhenInboxIsFull() {
        listener.onMessage(TRADE);

        assertThatThrownBy(() -> listener.onMessage(TRADE))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("inbox full");
        assertThat(meterRegistry.counter("launchbot.events.rejected").count()).isEqualTo(1.0);
    }
}
