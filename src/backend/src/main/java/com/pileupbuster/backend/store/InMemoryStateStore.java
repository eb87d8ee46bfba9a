package com.pileupbuster.backend.store;

import com.pileupbuster.backend.model.CurrentContact;
import com.pileupbuster.backend.model.QueueEntry;
import com.pileupbuster.backend.model.SystemSettings;
import com.pileupbuster.backend.model.WorkedRecord;
import java.util.List;
import java.util.Optional;

/**
 * Process-local store for development and tests.
 *
 * <p>State does not survive a restart.
 */
public class InMemoryStateStore implements StateStore {
  private List<QueueEntry> queue = List.of();
  private CurrentContact currentContact;
  private List<WorkedRecord> workedHistory = List.of();
  private SystemSettings settings = SystemSettings.defaults();

  @Override
  public synchronized List<QueueEntry> queue() {
    return queue;
  }

  @Override
  public synchronized Optional<CurrentContact> currentContact() {
    return Optional.ofNullable(currentContact);
  }

  @Override
  public synchronized List<WorkedRecord> workedHistory() {
    return workedHistory;
  }

  @Override
  public synchronized SystemSettings settings() {
    return settings;
  }

  @Override
  public synchronized void commit(StateMutation mutation) {
    if (mutation.hasQueue()) {
      queue = mutation.getQueue();
    }
    if (mutation.hasCurrentContact()) {
      currentContact = mutation.getCurrentContact();
    }
    if (mutation.hasWorkedHistory()) {
      workedHistory = mutation.getWorkedHistory();
    }
    if (mutation.hasSettings()) {
      settings = mutation.getSettings();
    }
  }
}
