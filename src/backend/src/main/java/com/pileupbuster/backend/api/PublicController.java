package com.pileupbuster.backend.api;

import static com.pileupbuster.backend.api.ApiRequests.require;
import static com.pileupbuster.backend.api.ApiRequests.requireText;

import com.pileupbuster.backend.api.ApiRequests.RegisterRequest;
import com.pileupbuster.backend.api.ApiResponses.CurrentQsoResponse;
import com.pileupbuster.backend.model.CurrentContact;
import com.pileupbuster.backend.model.DisplayUpdate;
import com.pileupbuster.backend.model.QueueEntry;
import com.pileupbuster.backend.model.QueuePosition;
import com.pileupbuster.backend.model.QueueView;
import com.pileupbuster.backend.model.StateSnapshot;
import com.pileupbuster.backend.model.SystemStatus;
import com.pileupbuster.backend.model.WorkedHistoryView;
import com.pileupbuster.backend.service.QueueCoordinator;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated endpoints used by callers and viewers.
 *
 * <p>Route design:
 * <ul>
 *   <li>{@code /api/queue/*}: register, look up, list and leave the queue</li>
 *   <li>{@code /api/public/*}: read-only views of the current contact, settings and history</li>
 *   <li>{@code GET /api/public/snapshot}: every aggregate in one consistent read</li>
 * </ul>
 */
@RestController
@RequestMapping(produces = MediaType.APPLICATION_JSON_VALUE)
public class PublicController {
  private final QueueCoordinator coordinator;

  public PublicController(QueueCoordinator coordinator) {
    this.coordinator = coordinator;
  }

  /**
   * Adds the caller to the end of the queue.
   *
   * @param request body carrying the callsign
   * @return the new entry with its position
   */
  @PostMapping("/api/queue/register")
  @ResponseStatus(HttpStatus.CREATED)
  public QueuePosition register(@RequestBody(required = false) RegisterRequest request) {
    RegisterRequest body = require(request, "request body is required");
    return coordinator.register(requireText(body.callsign(), "callsign"));
  }

  @GetMapping("/api/queue/status/{callsign}")
  public QueuePosition position(@PathVariable("callsign") String callsign) {
    return coordinator.findQueued(callsign);
  }

  @GetMapping("/api/queue/list")
  public QueueView list() {
    return coordinator.queueView();
  }

  @DeleteMapping("/api/queue/{callsign}")
  public QueueEntry leave(@PathVariable("callsign") String callsign) {
    return coordinator.remove(callsign);
  }

  @GetMapping("/api/public/current-qso")
  public CurrentQsoResponse currentQso() {
    CurrentContact current = coordinator.currentContact().orElse(null);
    return new CurrentQsoResponse(current == null ? "no contact in progress" : "contact in progress", current);
  }

  @GetMapping("/api/public/status")
  public SystemStatus status() {
    return coordinator.status();
  }

  @GetMapping("/api/public/frequency")
  public DisplayUpdate frequency() {
    return coordinator.frequency();
  }

  @GetMapping("/api/public/split")
  public DisplayUpdate split() {
    return coordinator.split();
  }

  @GetMapping("/api/public/worked-callers")
  public WorkedHistoryView workedCallers() {
    return coordinator.workedHistory();
  }

  /**
   * Returns every aggregate read under the coordinator lock. Clients call this after
   * (re)connecting to the event stream.
   *
   * @return consistent state snapshot
   */
  @GetMapping("/api/public/snapshot")
  public StateSnapshot snapshot() {
    return coordinator.snapshot();
  }
}
