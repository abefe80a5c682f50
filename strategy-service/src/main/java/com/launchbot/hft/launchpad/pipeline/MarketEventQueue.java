package com.launchbot.hft.launchpad.pipeline;

import com.launchbot.hft.domain.MarketEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Bounded inbox drained by a single event-loop thread. Adapters publish here.
 */
@Slf4j
public class MarketEventQueue implements AutoCloseable {

    private final BlockingQueue<MarketEvent> queue;
    private final Counter publishedCounter;
    private final Counter rejectedCounter;

    private volatile boolean running;
    private Thread loop;

    public MarketEventQueue(int capacity, MeterRegistry meterRegistry) {
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.publishedCounter = Counter.builder("launchbot.events.published")
                .description("Market events accepted into the inbox")
                .register(meterRegistry);
        this.rejectedCounter = Counter.builder("launchbot.events.rejected")
                .description("Market events refused because the inbox was full")
                .register(meterRegistry);
        Gauge.builder("launchbot.events.queued", queue, BlockingQueue::size)
                .description("Market events waiting for the event loop")
                .register(meterRegistry);
    }

    /**
     * @return false when the inbox is full and the event was not accepted
     */
    public boolean publish(MarketEvent event) {
        if (event == null || event.mintId() == null) {
            return false;
        }
        if (!queue.offer(event)) {
            rejectedCounter.increment();
            log.warn("event inbox full, rejected {} for mint {}", event.eventType(), event.mintId());
            return false;
        }
        publishedCounter.increment();
        return true;
    }

    public synchronized void start(Consumer<MarketEvent> handler) {
        if (running) {
            return;
        }
        running = true;
        loop = new Thread(() -> runLoop(handler), "launchbot-event-loop");
        loop.setDaemon(true);
        loop.start();
        log.info("event loop started");
    }

    public int size() {
        return queue.size();
    }

    @Override
    public synchronized void close() {
        running = false;
        if (loop != null) {
            loop.interrupt();
            try {
                loop.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            loop = null;
        }
        log.info("event loop stopped, {} events left unprocessed", queue.size());
    }

    private void runLoop(Consumer<MarketEvent> handler) {
        while (running) {
            MarketEvent event;
            try {
                event = queue.poll(500, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (event == null) {
                continue;
            }
            try {
                handler.accept(event);
            } catch (RuntimeException e) {
                log.error("event loop failed on {} for mint {}", event.eventType(), event.mintId(), e);
            }
        }
    }
}
