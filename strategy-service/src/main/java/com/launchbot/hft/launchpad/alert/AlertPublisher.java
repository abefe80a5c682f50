package com.launchbot.hft.launchpad.alert;

import com.launchbot.hft.events.AlertEvent;
import com.launchbot.hft.events.AlertCategory;
import com.launchbot.hft.events.AlertSeverity;

import java.time.Instant;
import java.util.Map;

/**
 * Outbound channel to the monitoring collaborator. Implementations must not throw.
 */
public interface AlertPublisher {

    void publish(AlertEvent event);

    default void publish(AlertSeverity severity, AlertCategory category, Map<String, Object> payload, Instant at) {
        publish(new AlertEvent(severity, category, payload, at));
    }
}
