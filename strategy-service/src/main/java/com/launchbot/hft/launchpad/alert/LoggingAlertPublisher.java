package com.launchbot.hft.launchpad.alert;

import com.launchbot.hft.events.AlertEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Writes alerts to the application log and keeps the most recent ones for the status endpoint.
 */
@Slf4j
public class LoggingAlertPublisher implements AlertPublisher {

    private static final int RECENT_LIMIT = 100;

    private final List<AlertEvent> recent = new CopyOnWriteArrayList<>();

    @Override
    public void publish(AlertEvent event) {
        switch (event.severity()) {
            case CRITICAL, HIGH -> log.error("ALERT {} {} {}", event.severity(), event.category(), event.payload());
            case MEDIUM -> log.warn("ALERT {} {} {}", event.severity(), event.category(), event.payload());
            default -> log.info("ALERT {} {} {}", event.severity(), event.category(), event.payload());
        }
        recent.add(event);
        while (recent.size() > RECENT_LIMIT) {
            recent.remove(0);
        }
    }

    public List<AlertEvent> recent() {
        return List.copyOf(recent);
    }
}
