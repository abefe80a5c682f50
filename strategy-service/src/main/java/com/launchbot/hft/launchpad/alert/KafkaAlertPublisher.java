package com.launchbot.hft.launchpad.alert;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.launchbot.hft.events.AlertEvent;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes alerts as JSON envelopes to a Kafka topic, then hands them to the local publisher.
 */
@Slf4j
@RequiredArgsConstructor
public class KafkaAlertPublisher implements AlertPublisher {

    private final @NonNull KafkaTemplate<String, String> kafkaTemplate;
    private final @NonNull ObjectMapper objectMapper;
    private final @NonNull String topic;
    private final @NonNull AlertPublisher local;

    @Override
    public void publish(AlertEvent event) {
        local.publish(event);
        try {
            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("ts", event.emittedAt() == null ? null : event.emittedAt().toString());
            envelope.put("source", "launchbot-strategy");
            envelope.put("type", "launchbot.alert");
            envelope.put("severity", event.severity().name());
            envelope.put("category", event.category().name());
            envelope.put("data", event.payload());
            String json = objectMapper.writeValueAsString(envelope);
            kafkaTemplate.send(topic, event.category().name(), json);
        } catch (Exception e) {
            log.warn("Failed to publish alert {} to {}: {}", event.category(), topic, e.getMessage());
        }
    }
}
