package com.pileupbuster.backend.store;

/** Raised when a stored document cannot be encoded or decoded. */
public class StateStoreException extends RuntimeException {
  public StateStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
