package com.pileupbuster.backend.store;

import com.pileupbuster.backend.model.CurrentContact;
import com.pileupbuster.backend.model.QueueEntry;
import com.pileupbuster.backend.model.SystemSettings;
import com.pileupbuster.backend.model.WorkedRecord;
import java.util.List;
import java.util.Optional;

/**
 * Durable holder of the four coordinator aggregates.
 *
 * <p>Reads return the last committed value of one aggregate. {@link #commit(StateMutation)}
 * writes every aggregate carried by the mutation atomically and durably before returning, so
 * callers may publish change events right after it.
 */
public interface StateStore {

  /** Returns the queue in FIFO order. */
  List<QueueEntry> queue();

  Optional<CurrentContact> currentContact();

  /** Returns the raw worked history, including records past their expiry. */
  List<WorkedRecord> workedHistory();

  SystemSettings settings();

  /**
   * Atomically applies the aggregates present in {@code mutation}.
   *
   * @param mutation changed aggregates; an empty mutation is a no-op
   */
  void commit(StateMutation mutation);
}
