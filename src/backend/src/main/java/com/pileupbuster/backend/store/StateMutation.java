package com.pileupbuster.backend.store;

import com.pileupbuster.backend.model.CurrentContact;
import com.pileupbuster.backend.model.QueueEntry;
import com.pileupbuster.backend.model.SystemSettings;
import com.pileupbuster.backend.model.WorkedRecord;
import java.util.List;

/**
 * Set of aggregate replacements committed together.
 *
 * <p>Aggregates that were not touched stay unset and are left alone by the store. The current
 * contact uses an explicit flag because {@code null} is a legal new value (slot cleared).
 */
public final class StateMutation {
  private List<QueueEntry> queue;
  private boolean currentContactChanged;
  private CurrentContact currentContact;
  private List<WorkedRecord> workedHistory;
  private SystemSettings settings;

  public static StateMutation create() {
    return new StateMutation();
  }

  public StateMutation queue(List<QueueEntry> newQueue) {
    this.queue = List.copyOf(newQueue);
    return this;
  }

  public StateMutation currentContact(CurrentContact newCurrentContact) {
    this.currentContactChanged = true;
    this.currentContact = newCurrentContact;
    return this;
  }

  public StateMutation workedHistory(List<WorkedRecord> newWorkedHistory) {
    this.workedHistory = List.copyOf(newWorkedHistory);
    return this;
  }

  public StateMutation settings(SystemSettings newSettings) {
    this.settings = newSettings;
    return this;
  }

  public boolean hasQueue() {
    return queue != null;
  }

  public List<QueueEntry> getQueue() {
    return queue;
  }

  public boolean hasCurrentContact() {
    return currentContactChanged;
  }

  public CurrentContact getCurrentContact() {
    return currentContact;
  }

  public boolean hasWorkedHistory() {
    return workedHistory != null;
  }

  public List<WorkedRecord> getWorkedHistory() {
    return workedHistory;
  }

  public boolean hasSettings() {
    return settings != null;
  }

  public SystemSettings getSettings() {
    return settings;
  }

  public boolean isEmpty() {
    return !hasQueue() && !hasCurrentContact() && !hasWorkedHistory() && !hasSettings();
  }
}
