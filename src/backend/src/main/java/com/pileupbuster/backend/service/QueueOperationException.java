package com.pileupbuster.backend.service;

/** Raised when a coordinator operation is rejected; state is left unchanged. */
public class QueueOperationException extends RuntimeException {
  private final QueueError error;

  public QueueOperationException(QueueError error, String message) {
    super(message);
    this.error = error;
  }

  public QueueError getError() {
    return error;
  }
}
