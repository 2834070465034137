package com.flamingo.ai.memorystore.exception;

/** Exception thrown when the vector record store cannot complete an operation. */
public class StoreUnavailableException extends RuntimeException {

  public StoreUnavailableException(String message) {
    super(message);
  }

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
