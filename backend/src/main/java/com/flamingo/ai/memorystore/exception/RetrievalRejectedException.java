package com.flamingo.ai.memorystore.exception;

/** Externally visible rejection of a retrieval operation. Retrying the same call will not help. */
public class RetrievalRejectedException extends RuntimeException {

  /** Why the operation was rejected. */
  public enum Reason {
    INVALID_REQUEST,
    DIMENSION_MISMATCH
  }

  private final Reason reason;

  public RetrievalRejectedException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public RetrievalRejectedException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
