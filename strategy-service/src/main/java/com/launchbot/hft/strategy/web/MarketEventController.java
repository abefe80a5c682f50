package com.launchbot.hft.strategy.web;

import com.launchbot.hft.domain.MarketEvent;
import com.launchbot.hft.launchpad.ingest.MalformedEventException;
import com.launchbot.hft.launchpad.ingest.MarketEventCodec;
import com.launchbot.hft.launchpad.pipeline.MarketEventQueue;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Accepts feed envelopes over HTTP, the same shape the Kafka listener consumes.
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
@Slf4j
public class MarketEventController {

  private final @NonNull MarketEventCodec codec;
  private final @NonNull MarketEventQueue queue;

  @PostMapping
  public ResponseEntity<EventAccepted> publish(@RequestBody String payload) {
    MarketEvent event;
    try {
      event = codec.decode(payload);
    } catch (MalformedEventException e) {
      log.warn("rejected malformed event over HTTP: {}", e.getMessage());
      return ResponseEntity.badRequest().body(new EventAccepted(null, null, false, e.getMessage()));
    }
    if (!queue.publish(event)) {
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
          .body(new EventAccepted(event.eventType().name(), event.mintId(), false, "event inbox full"));
    }
    return ResponseEntity.accepted().body(new EventAccepted(event.eventType().name(), event.mintId(), true, null));
  }

  public record EventAccepted(
      String type,
      String mintId,
      boolean accepted,
      String error
  ) {
  }
}
