package com.pileupbuster.backend.api;

import static com.pileupbuster.backend.api.ApiRequests.require;
import static com.pileupbuster.backend.api.ApiRequests.requireText;

import com.pileupbuster.backend.api.ApiRequests.DirectStartRequest;
import com.pileupbuster.backend.api.ApiRequests.FrequencyRequest;
import com.pileupbuster.backend.api.ApiRequests.IntegrationRequest;
import com.pileupbuster.backend.api.ApiRequests.SplitRequest;
import com.pileupbuster.backend.api.ApiRequests.StatusRequest;
import com.pileupbuster.backend.api.ApiResponses.CountResponse;
import com.pileupbuster.backend.api.ApiResponses.CurrentQsoResponse;
import com.pileupbuster.backend.model.ChannelMeta;
import com.pileupbuster.backend.model.CurrentContact;
import com.pileupbuster.backend.model.DirectStartResult;
import com.pileupbuster.backend.model.DisplayUpdate;
import com.pileupbuster.backend.model.QueueEntry;
import com.pileupbuster.backend.model.SystemStatus;
import com.pileupbuster.backend.model.WorkedRecord;
import com.pileupbuster.backend.service.QueueCoordinator;
import java.util.Optional;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints under {@code /api/admin}. Authentication is enforced by
 * {@link com.pileupbuster.backend.auth.AdminAuthFilter} before requests reach this controller.
 */
@RestController
@RequestMapping(path = "/api/admin", produces = MediaType.APPLICATION_JSON_VALUE)
public class AdminController {
  private final QueueCoordinator coordinator;

  public AdminController(QueueCoordinator coordinator) {
    this.coordinator = coordinator;
  }

  /**
   * Works the next caller in line.
   *
   * @return the new contact; {@code currentQso} is null when the queue was empty
   */
  @PostMapping("/queue/next")
  public CurrentQsoResponse next() {
    Optional<CurrentContact> contact = coordinator.promoteNext();
    return new CurrentQsoResponse(contact.isPresent() ? "working next caller" : "queue is empty", contact.orElse(null));
  }

  @PostMapping("/queue/work/{callsign}")
  public CurrentQsoResponse workSpecific(@PathVariable("callsign") String callsign) {
    CurrentContact contact = coordinator.promoteSpecific(callsign);
    return new CurrentQsoResponse("working " + contact.callsign(), contact);
  }

  @PostMapping("/queue/clear")
  public CountResponse clearQueue() {
    return new CountResponse("queue cleared", coordinator.clear());
  }

  @DeleteMapping("/queue/{callsign}")
  public QueueEntry removeFromQueue(@PathVariable("callsign") String callsign) {
    return coordinator.remove(callsign);
  }

  /**
   * Starts a contact directly, typically reported by logging software through the bridge.
   *
   * @param request callsign plus optional frequency, mode and source tags
   * @return installed contact, whether it was dequeued, and any interrupted contact
   */
  @PostMapping("/qso/start")
  public DirectStartResult start(@RequestBody(required = false) DirectStartRequest request) {
    DirectStartRequest body = require(request, "request body is required");
    String callsign = requireText(body.callsign(), "callsign");
    ChannelMeta meta = new ChannelMeta(body.frequency(), body.mode(), body.source() == null ? "admin" : body.source());
    return coordinator.directStart(callsign, meta);
  }

  @PostMapping("/qso/complete")
  public WorkedRecord complete() {
    return coordinator.completeCurrent();
  }

  @PostMapping("/qso/cancel")
  public CurrentQsoResponse cancel() {
    Optional<CurrentContact> cancelled = coordinator.cancelCurrent();
    return new CurrentQsoResponse(
        cancelled.isPresent() ? "contact cancelled" : "no contact in progress", cancelled.orElse(null));
  }

  @PostMapping("/frequency")
  public DisplayUpdate setFrequency(@RequestBody(required = false) FrequencyRequest request) {
    FrequencyRequest body = require(request, "request body is required");
    return coordinator.setFrequency(requireText(body.frequency(), "frequency"));
  }

  @DeleteMapping("/frequency")
  public DisplayUpdate clearFrequency() {
    return coordinator.clearFrequency();
  }

  @PostMapping("/split")
  public DisplayUpdate setSplit(@RequestBody(required = false) SplitRequest request) {
    SplitRequest body = require(request, "request body is required");
    return coordinator.setSplit(requireText(body.split(), "split"));
  }

  @DeleteMapping("/split")
  public DisplayUpdate clearSplit() {
    return coordinator.clearSplit();
  }

  /**
   * Activates or deactivates the system. A change empties the queue and interrupts any contact.
   *
   * @param request body carrying {@code active}
   * @return resulting status
   */
  @PostMapping("/status")
  public SystemStatus setStatus(@RequestBody(required = false) StatusRequest request) {
    StatusRequest body = require(request, "request body is required");
    return coordinator.setActive(require(body.active(), "active is required"));
  }

  @PostMapping("/integration")
  public SystemStatus setIntegration(@RequestBody(required = false) IntegrationRequest request) {
    IntegrationRequest body = require(request, "request body is required");
    return coordinator.setIntegrationEnabled(require(body.enabled(), "enabled is required"));
  }

  @DeleteMapping("/worked-callers")
  public CountResponse clearWorked() {
    return new CountResponse("worked callers cleared", coordinator.clearWorked());
  }

  @PostMapping("/worked-callers/extend-retention")
  public CountResponse extendWorkedRetention() {
    return new CountResponse("worked callers retention extended", coordinator.extendWorkedRetention());
  }
}
