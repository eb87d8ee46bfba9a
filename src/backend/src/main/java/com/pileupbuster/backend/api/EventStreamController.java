package com.pileupbuster.backend.api;

import com.pileupbuster.backend.service.EventStreamService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/** Live state-change stream for viewers. */
@RestController
public class EventStreamController {
  private final EventStreamService eventStreamService;

  public EventStreamController(EventStreamService eventStreamService) {
    this.eventStreamService = eventStreamService;
  }

  /**
   * Opens an SSE stream carrying every state change.
   *
   * @return emitter that starts with a {@code connected} event
   */
  @GetMapping(path = "/api/events/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter stream() {
    return eventStreamService.openStream();
  }
}
