package com.pileupbuster.backend.service;

import com.pileupbuster.backend.config.PileupProperties;
import com.pileupbuster.backend.events.EventBus;
import com.pileupbuster.backend.events.EventType;
import com.pileupbuster.backend.integration.LoggerIntegrationService;
import com.pileupbuster.backend.model.CallsignProfile;
import com.pileupbuster.backend.model.ChannelMeta;
import com.pileupbuster.backend.model.ContactOrigin;
import com.pileupbuster.backend.model.ContactOutcome;
import com.pileupbuster.backend.model.CurrentContact;
import com.pileupbuster.backend.model.DirectStartResult;
import com.pileupbuster.backend.model.DisplayUpdate;
import com.pileupbuster.backend.model.QueueEntry;
import com.pileupbuster.backend.model.QueuePosition;
import com.pileupbuster.backend.model.QueueView;
import com.pileupbuster.backend.model.StateSnapshot;
import com.pileupbuster.backend.model.SystemSettings;
import com.pileupbuster.backend.model.SystemStatus;
import com.pileupbuster.backend.model.WorkedHistoryView;
import com.pileupbuster.backend.model.WorkedRecord;
import com.pileupbuster.backend.store.StateMutation;
import com.pileupbuster.backend.store.StateStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sole owner of queue, contact, history and settings transitions.
 *
 * <p>Every mutation runs under one fair coordinator-wide lock: read the aggregates it needs,
 * validate, commit the new values in one {@link StateMutation}, then publish the resulting events
 * before releasing the lock. Commit order therefore equals publish order. Side effects that talk
 * to the outside world (profile lookups, logging-software announcements) are dispatched after the
 * lock is released.
 */
@Service
public class QueueCoordinator {
  private static final Logger log = LoggerFactory.getLogger(QueueCoordinator.class);

  private final StateStore store;
  private final EventBus eventBus;
  private final CallsignValidator validator;
  private final ProfileEnricher enricher;
  private final LoggerIntegrationService loggerIntegration;
  private final PileupProperties properties;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock(true);
  private final AtomicInteger queueLength = new AtomicInteger();

  public QueueCoordinator(
      StateStore store,
      EventBus eventBus,
      CallsignValidator validator,
      ProfileEnricher enricher,
      LoggerIntegrationService loggerIntegration,
      PileupProperties properties,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.store = store;
    this.eventBus = eventBus;
    this.validator = validator;
    this.enricher = enricher;
    this.loggerIntegration = loggerIntegration;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
    meterRegistry.gauge("pileup.queue.length", queueLength);
  }

  /**
   * Appends a callsign to the end of the queue.
   *
   * @param rawCallsign user input, normalized before any check
   * @return the stored entry with its position
   * @throws QueueOperationException INVALID_FORMAT, SYSTEM_INACTIVE, DUPLICATE_CALLSIGN or
   *     QUEUE_FULL, checked in that order
   */
  public QueuePosition register(String rawCallsign) {
    QueuePosition entry = locked("register", () -> {
      String callsign = validator.normalize(rawCallsign);
      SystemSettings settings = store.settings();
      if (!settings.active()) {
        throw new QueueOperationException(QueueError.SYSTEM_INACTIVE, "Queue is not accepting registrations");
      }
      List<QueueEntry> queue = store.queue();
      if (indexOf(queue, callsign) >= 0 || isCurrent(store.currentContact(), callsign)) {
        throw new QueueOperationException(QueueError.DUPLICATE_CALLSIGN, callsign + " is already registered");
      }
      int maxSize = properties.getQueue().getMaxSize();
      if (queue.size() >= maxSize) {
        throw new QueueOperationException(QueueError.QUEUE_FULL, "Queue is full (" + maxSize + " entries)");
      }

      QueueEntry created = new QueueEntry(callsign, now(), null);
      List<QueueEntry> updated = new ArrayList<>(queue);
      updated.add(created);
      store.commit(StateMutation.create().queue(updated));
      publishQueue(updated, settings);
      log.info("Registered {} at position {}", callsign, updated.size());
      return new QueuePosition(callsign, created.joinedAt(), updated.size(), 0L, null);
    });
    requestProfile(entry.callsign());
    return entry;
  }

  /**
   * Removes one callsign from the queue.
   *
   * @param rawCallsign callsign to remove
   * @return the removed entry
   * @throws QueueOperationException NOT_FOUND when the callsign is not queued
   */
  public QueueEntry remove(String rawCallsign) {
    return locked("remove", () -> {
      String callsign = validator.canonicalize(rawCallsign);
      List<QueueEntry> queue = new ArrayList<>(store.queue());
      int index = indexOf(queue, callsign);
      if (index < 0) {
        throw new QueueOperationException(QueueError.NOT_FOUND, callsign + " is not in the queue");
      }
      QueueEntry removed = queue.remove(index);
      store.commit(StateMutation.create().queue(queue));
      publishQueue(queue, store.settings());
      log.info("Removed {} from the queue", callsign);
      return removed;
    });
  }

  /**
   * Empties the queue.
   *
   * @return number of entries removed
   */
  public int clear() {
    return locked("clear", () -> {
      int removed = store.queue().size();
      store.commit(StateMutation.create().queue(List.of()));
      publishQueue(List.of(), store.settings());
      log.info("Cleared {} queue entries", removed);
      return removed;
    });
  }

  /**
   * Moves the head of the queue into the active slot.
   *
   * @return the new contact, or empty when the queue is empty
   * @throws QueueOperationException CONTACT_IN_PROGRESS when a contact is already active
   */
  public Optional<CurrentContact> promoteNext() {
    Optional<Started> started = locked("promote_next", () -> {
      List<QueueEntry> queue = store.queue();
      if (queue.isEmpty()) {
        return Optional.<Started>empty();
      }
      Optional<CurrentContact> current = store.currentContact();
      if (current.isPresent()) {
        throw new QueueOperationException(
            QueueError.CONTACT_IN_PROGRESS, "Contact with " + current.get().callsign() + " is in progress");
      }
      return Optional.of(installFromQueue(new ArrayList<>(queue), 0));
    });
    started.ifPresent(this::afterQueuePromotion);
    return started.map(Started::contact);
  }

  /**
   * Moves a specific queued callsign into the active slot, whatever its position.
   *
   * @param rawCallsign callsign to work
   * @return the active contact; unchanged when that callsign is already being worked
   * @throws QueueOperationException CONTACT_IN_PROGRESS or NOT_FOUND
   */
  public CurrentContact promoteSpecific(String rawCallsign) {
    Started started = locked("promote_specific", () -> {
      String callsign = validator.canonicalize(rawCallsign);
      Optional<CurrentContact> current = store.currentContact();
      if (isCurrent(current, callsign)) {
        return new Started(current.get(), null);
      }
      if (current.isPresent()) {
        throw new QueueOperationException(
            QueueError.CONTACT_IN_PROGRESS, "Contact with " + current.get().callsign() + " is in progress");
      }
      List<QueueEntry> queue = new ArrayList<>(store.queue());
      int index = indexOf(queue, callsign);
      if (index < 0) {
        throw new QueueOperationException(QueueError.NOT_FOUND, callsign + " is not in the queue");
      }
      return installFromQueue(queue, index);
    });
    if (started.settings() != null) {
      afterQueuePromotion(started);
    }
    return started.contact();
  }

  /**
   * Installs a contact reported by logging software, bypassing the queue.
   *
   * <p>A different active contact is archived as interrupted. Re-starting the active callsign only
   * refreshes its channel tags.
   *
   * @param rawCallsign callsign being worked
   * @param channelMeta optional frequency/mode tags, may be null
   * @return the installed contact, whether it was dequeued, and any interrupted record
   * @throws QueueOperationException INVALID_FORMAT or SYSTEM_INACTIVE
   */
  public DirectStartResult directStart(String rawCallsign, ChannelMeta channelMeta) {
    DirectStartResult result = locked("direct_start", () -> {
      String callsign = validator.normalize(rawCallsign);
      SystemSettings settings = store.settings();
      if (!settings.active()) {
        throw new QueueOperationException(QueueError.SYSTEM_INACTIVE, "System is inactive");
      }
      Instant now = now();
      ChannelMeta meta = channelMeta == null ? ChannelMeta.NONE : channelMeta;
      StateMutation mutation = StateMutation.create();

      List<QueueEntry> queue = new ArrayList<>(store.queue());
      int index = indexOf(queue, callsign);
      QueueEntry dequeued = index >= 0 ? queue.remove(index) : null;
      if (dequeued != null) {
        mutation.queue(queue);
      }

      Optional<CurrentContact> current = store.currentContact();
      WorkedRecord interrupted = null;
      CurrentContact contact;
      if (isCurrent(current, callsign)) {
        contact = current.get().withChannelMeta(meta);
      } else {
        if (current.isPresent()) {
          interrupted = archive(current.get(), ContactOutcome.INTERRUPTED, now);
          mutation.workedHistory(appended(store.workedHistory(), interrupted));
        }
        CallsignProfile profile = dequeued == null ? null : dequeued.profile();
        contact = new CurrentContact(callsign, now, profile, ContactOrigin.DIRECT_START, meta);
      }
      mutation.currentContact(contact);
      store.commit(mutation);

      eventBus.publish(EventType.CURRENT_QSO, contact);
      if (dequeued != null) {
        publishQueue(queue, settings);
      }
      if (interrupted != null) {
        publishWorked();
        log.info("Direct start of {} interrupted {}", callsign, interrupted.callsign());
      } else {
        log.info("Direct start of {} (wasInQueue={})", callsign, dequeued != null);
      }
      return new DirectStartResult(contact, dequeued != null, interrupted);
    });
    if (result.contact().profile() == null) {
      requestProfile(result.contact().callsign());
    }
    return result;
  }

  /**
   * Archives the active contact as completed and frees the slot.
   *
   * @return the archived record
   * @throws QueueOperationException NOTHING_ACTIVE when idle
   */
  public WorkedRecord completeCurrent() {
    return locked("complete", () -> {
      CurrentContact current = store.currentContact()
          .orElseThrow(() -> new QueueOperationException(QueueError.NOTHING_ACTIVE, "No contact in progress"));
      WorkedRecord record = archive(current, ContactOutcome.COMPLETED, now());
      store.commit(StateMutation.create()
          .currentContact(null)
          .workedHistory(appended(store.workedHistory(), record)));
      eventBus.publish(EventType.CURRENT_QSO, null);
      publishWorked();
      log.info("Completed contact with {}", record.callsign());
      return record;
    });
  }

  /**
   * Clears the active slot without archiving.
   *
   * @return the contact that was cleared, empty when idle
   */
  public Optional<CurrentContact> cancelCurrent() {
    return locked("cancel", () -> {
      Optional<CurrentContact> current = store.currentContact();
      if (current.isEmpty()) {
        return current;
      }
      store.commit(StateMutation.create().currentContact(null));
      eventBus.publish(EventType.CURRENT_QSO, null);
      log.info("Cancelled contact with {}", current.get().callsign());
      return current;
    });
  }

  /**
   * Switches the system on or off.
   *
   * <p>Only an actual change has effect: the queue is emptied and any active contact archived as
   * interrupted in the same commit.
   *
   * @param active requested state
   * @return resulting status
   */
  public SystemStatus setActive(boolean active) {
    return locked("set_active", () -> {
      SystemSettings settings = store.settings();
      if (settings.active() == active) {
        return SystemStatus.of(settings);
      }
      Instant now = now();
      SystemSettings updated = settings.withActive(active, now);
      Optional<CurrentContact> current = store.currentContact();
      WorkedRecord archived = current.map(contact -> archive(contact, ContactOutcome.INTERRUPTED, now)).orElse(null);

      StateMutation mutation = StateMutation.create().settings(updated).queue(List.of());
      if (current.isPresent()) {
        mutation.currentContact(null).workedHistory(appended(store.workedHistory(), archived));
      }
      store.commit(mutation);

      SystemStatus status = SystemStatus.of(updated);
      eventBus.publish(EventType.SYSTEM_STATUS, status);
      publishQueue(List.of(), updated);
      if (current.isPresent()) {
        eventBus.publish(EventType.CURRENT_QSO, null);
        publishWorked();
      }
      log.info("System {}", active ? "activated" : "deactivated");
      return status;
    });
  }

  public DisplayUpdate setFrequency(String frequency) {
    return updateFrequency("set_frequency", trimToNull(frequency));
  }

  public DisplayUpdate clearFrequency() {
    return updateFrequency("clear_frequency", null);
  }

  public DisplayUpdate setSplit(String split) {
    return updateSplit("set_split", trimToNull(split));
  }

  public DisplayUpdate clearSplit() {
    return updateSplit("clear_split", null);
  }

  /**
   * Turns logging-software announcements on or off.
   *
   * @param enabled requested state
   * @return resulting status; {@code system_status} is published only on change
   */
  public SystemStatus setIntegrationEnabled(boolean enabled) {
    return locked("set_integration", () -> {
      SystemSettings settings = store.settings();
      if (settings.integrationEnabled() == enabled) {
        return SystemStatus.of(settings);
      }
      SystemSettings updated = settings.withIntegrationEnabled(enabled, now());
      store.commit(StateMutation.create().settings(updated));
      SystemStatus status = SystemStatus.of(updated);
      eventBus.publish(EventType.SYSTEM_STATUS, status);
      log.info("Logger integration {}", enabled ? "enabled" : "disabled");
      return status;
    });
  }

  /**
   * Deletes the whole worked history.
   *
   * @return number of visible records removed
   */
  public int clearWorked() {
    return locked("clear_worked", () -> {
      int removed = live(store.workedHistory(), now()).size();
      store.commit(StateMutation.create().workedHistory(List.of()));
      publishWorked();
      log.info("Cleared {} worked records", removed);
      return removed;
    });
  }

  /**
   * Pushes the expiry of every visible record to now plus the configured retention. Records that
   * already expired are purged, not revived.
   *
   * @return number of records extended
   */
  public int extendWorkedRetention() {
    return locked("extend_worked", () -> {
      Instant now = now();
      Instant expiresAt = now.plus(retention());
      List<WorkedRecord> extended = new ArrayList<>();
      for (WorkedRecord record : live(store.workedHistory(), now)) {
        extended.add(record.withExpiresAt(expiresAt));
      }
      store.commit(StateMutation.create().workedHistory(extended));
      publishWorked();
      log.info("Extended retention of {} worked records until {}", extended.size(), expiresAt);
      return extended.size();
    });
  }

  /**
   * Physically removes expired records. Nothing is published: expired records are already
   * invisible to every read.
   *
   * @return number of records removed
   */
  public int sweepExpiredWorked() {
    return locked("sweep_worked", () -> {
      List<WorkedRecord> history = store.workedHistory();
      List<WorkedRecord> kept = live(history, now());
      int removed = history.size() - kept.size();
      if (removed > 0) {
        store.commit(StateMutation.create().workedHistory(kept));
        log.debug("Swept {} expired worked records", removed);
      }
      return removed;
    });
  }

  /**
   * Merges a resolved profile into the queue entry and the current contact for the callsign.
   * Archived worked records keep the profile they were archived with.
   *
   * @param rawCallsign callsign the lookup was made for
   * @param profile lookup result
   */
  public void applyProfile(String rawCallsign, CallsignProfile profile) {
    if (profile == null) {
      return;
    }
    locked("apply_profile", () -> {
      String callsign = validator.canonicalize(rawCallsign);
      StateMutation mutation = StateMutation.create();

      List<QueueEntry> queue = new ArrayList<>(store.queue());
      int index = indexOf(queue, callsign);
      if (index >= 0) {
        queue.set(index, queue.get(index).withProfile(profile));
        mutation.queue(queue);
      }

      Optional<CurrentContact> current = store.currentContact();
      CurrentContact patched = null;
      if (isCurrent(current, callsign)) {
        patched = current.get().withProfile(profile);
        mutation.currentContact(patched);
      }

      if (mutation.isEmpty()) {
        log.debug("Profile for {} arrived after it left every aggregate", callsign);
        return null;
      }
      store.commit(mutation);
      if (mutation.hasQueue()) {
        publishQueue(queue, store.settings());
      }
      if (patched != null) {
        eventBus.publish(EventType.CURRENT_QSO, patched);
      }
      return null;
    });
  }

  public QueueView queueView() {
    return read(() -> toView(store.queue(), store.settings()));
  }

  /**
   * Looks up where a callsign stands in the queue.
   *
   * @param rawCallsign callsign to look for
   * @return positioned entry
   * @throws QueueOperationException NOT_FOUND when not queued
   */
  public QueuePosition findQueued(String rawCallsign) {
    String callsign = validator.canonicalize(rawCallsign);
    return read(() -> {
      QueueView view = toView(store.queue(), store.settings());
      return view.queue().stream()
          .filter(position -> position.callsign().equals(callsign))
          .findFirst()
          .orElseThrow(() -> new QueueOperationException(QueueError.NOT_FOUND, callsign + " is not in the queue"));
    });
  }

  public Optional<CurrentContact> currentContact() {
    return read(store::currentContact);
  }

  public SystemStatus status() {
    return read(() -> SystemStatus.of(store.settings()));
  }

  public DisplayUpdate frequency() {
    return read(() -> {
      SystemSettings settings = store.settings();
      return new DisplayUpdate(settings.frequencyDisplay(), settings.updatedAt());
    });
  }

  public DisplayUpdate split() {
    return read(() -> {
      SystemSettings settings = store.settings();
      return new DisplayUpdate(settings.splitDisplay(), settings.updatedAt());
    });
  }

  public WorkedHistoryView workedHistory() {
    return read(this::workedView);
  }

  /** Reads every aggregate under the coordinator lock so no mutation interleaves. */
  public StateSnapshot snapshot() {
    return read(() -> {
      SystemSettings settings = store.settings();
      return new StateSnapshot(
          toView(store.queue(), settings),
          store.currentContact().orElse(null),
          SystemStatus.of(settings),
          settings.frequencyDisplay(),
          settings.splitDisplay(),
          workedView());
    });
  }

  private Started installFromQueue(List<QueueEntry> queue, int index) {
    QueueEntry entry = queue.remove(index);
    CurrentContact contact =
        new CurrentContact(entry.callsign(), now(), entry.profile(), ContactOrigin.FROM_QUEUE, ChannelMeta.NONE);
    SystemSettings settings = store.settings();
    store.commit(StateMutation.create().queue(queue).currentContact(contact));
    eventBus.publish(EventType.CURRENT_QSO, contact);
    publishQueue(queue, settings);
    log.info("Working {} ({} left in queue)", contact.callsign(), queue.size());
    return new Started(contact, settings);
  }

  private void afterQueuePromotion(Started started) {
    if (started.settings().integrationEnabled()) {
      loggerIntegration.announce(started.contact(), started.settings().frequencyDisplay());
    }
    if (started.contact().profile() == null) {
      requestProfile(started.contact().callsign());
    }
  }

  private DisplayUpdate updateFrequency(String operation, String value) {
    return locked(operation, () -> {
      SystemSettings updated = store.settings().withFrequency(value, now());
      store.commit(StateMutation.create().settings(updated));
      DisplayUpdate update = new DisplayUpdate(updated.frequencyDisplay(), updated.updatedAt());
      eventBus.publish(EventType.FREQUENCY_UPDATE, update);
      log.info("Frequency display set to {}", value);
      return update;
    });
  }

  private DisplayUpdate updateSplit(String operation, String value) {
    return locked(operation, () -> {
      SystemSettings updated = store.settings().withSplit(value, now());
      store.commit(StateMutation.create().settings(updated));
      DisplayUpdate update = new DisplayUpdate(updated.splitDisplay(), updated.updatedAt());
      eventBus.publish(EventType.SPLIT_UPDATE, update);
      log.info("Split display set to {}", value);
      return update;
    });
  }

  private void requestProfile(String callsign) {
    enricher.enrich(callsign, profile -> applyProfile(callsign, profile));
  }

  private void publishQueue(List<QueueEntry> queue, SystemSettings settings) {
    queueLength.set(queue.size());
    eventBus.publish(EventType.QUEUE_UPDATE, toView(queue, settings));
  }

  private void publishWorked() {
    eventBus.publish(EventType.WORKED_CALLERS_UPDATE, workedView());
  }

  private QueueView toView(List<QueueEntry> queue, SystemSettings settings) {
    Instant now = now();
    List<QueuePosition> positions = new ArrayList<>(queue.size());
    for (int i = 0; i < queue.size(); i++) {
      QueueEntry entry = queue.get(i);
      long waitSeconds = Math.max(0L, Duration.between(entry.joinedAt(), now).getSeconds());
      positions.add(new QueuePosition(entry.callsign(), entry.joinedAt(), i + 1, waitSeconds, entry.profile()));
    }
    return new QueueView(List.copyOf(positions), positions.size(), properties.getQueue().getMaxSize(), settings.active());
  }

  private WorkedHistoryView workedView() {
    List<WorkedRecord> visible = new ArrayList<>(live(store.workedHistory(), now()));
    visible.sort(Comparator.comparing(WorkedRecord::completedAt).reversed());
    return new WorkedHistoryView(List.copyOf(visible), visible.size());
  }

  private WorkedRecord archive(CurrentContact contact, ContactOutcome outcome, Instant now) {
    return new WorkedRecord(
        contact.callsign(), now, now.plus(retention()), contact.profile(), contact.origin(), outcome);
  }

  private Duration retention() {
    return properties.getWorked().getTtl();
  }

  private Instant now() {
    return clock.instant();
  }

  private <T> T locked(String operation, Supplier<T> action) {
    lock.lock();
    try {
      T result = action.get();
      meterRegistry.counter("pileup.coordinator.operations.total", "operation", operation, "outcome", "ok")
          .increment();
      return result;
    } catch (QueueOperationException ex) {
      meterRegistry.counter(
              "pileup.coordinator.operations.total", "operation", operation, "outcome", ex.getError().code())
          .increment();
      log.debug("{} rejected: {}", operation, ex.getMessage());
      throw ex;
    } finally {
      lock.unlock();
    }
  }

  private <T> T read(Supplier<T> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  private static List<WorkedRecord> live(List<WorkedRecord> history, Instant now) {
    List<WorkedRecord> visible = new ArrayList<>();
    for (WorkedRecord record : history) {
      if (record.isLive(now)) {
        visible.add(record);
      }
    }
    return visible;
  }

  private static List<WorkedRecord> appended(List<WorkedRecord> history, WorkedRecord record) {
    List<WorkedRecord> updated = new ArrayList<>(history);
    updated.add(record);
    return updated;
  }

  private static int indexOf(List<QueueEntry> queue, String callsign) {
    for (int i = 0; i < queue.size(); i++) {
      if (queue.get(i).callsign().equals(callsign)) {
        return i;
      }
    }
    return -1;
  }

  private static boolean isCurrent(Optional<CurrentContact> current, String callsign) {
    return current.isPresent() && current.get().callsign().equals(callsign);
  }

  private static String trimToNull(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }

  /** Contact moved out of the queue plus the settings it was committed under. */
  private record Started(CurrentContact contact, SystemSettings settings) {}
}
