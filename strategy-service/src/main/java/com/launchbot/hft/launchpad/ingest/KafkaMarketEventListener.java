package com.launchbot.hft.launchpad.ingest;

import com.launchbot.hft.domain.MarketEvent;
import com.launchbot.hft.launchpad.pipeline.MarketEventQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;

/**
 * Consumes normalized feed envelopes from Kafka and publishes them to the event inbox.
 * Delivery is at-least-once; redeliveries are dropped by the pipeline's de-duplication.
 */
@Slf4j
public class KafkaMarketEventListener {

    private final MarketEventCodec codec;
    private final MarketEventQueue queue;
    private final Counter malformedCounter;

    public KafkaMarketEventListener(MarketEventCodec codec, MarketEventQueue queue, MeterRegistry meterRegistry) {
        this.codec = codec;
        this.queue = queue;
        this.malformedCounter = Counter.builder("launchbot.ingest.malformed")
                .description("Feed payloads that could not be decoded")
                .register(meterRegistry);
    }

    @KafkaListener(
            topics = "${hft.ingest.topic:launchbot.market-events}",
            groupId = "${hft.ingest.group-id:launchbot-strategy}"
    )
    public void onMessage(String payload) {
        MarketEvent event;
        try {
            event = codec.decode(payload);
        } catch (MalformedEventException e) {
            malformedCounter.increment();
            log.warn("dropping malformed feed payload: {}", e.getMessage());
            return;
        }
        if (!queue.publish(event)) {
            // let the container redeliver instead of losing the event
            throw new IllegalStateException("event inbox full, " + event.eventType() + " for " + event.mintId());
        }
    }
}
