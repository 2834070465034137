package com.flamingo.ai.memorystore.exception;

/**
 * Thrown when the embedding model cannot be reached, times out, or returns a malformed vector.
 *
 * <p>Transient: the operation that raised it has not written anything and may be retried.
 */
public class EmbeddingUnavailableException extends RuntimeException {

  public EmbeddingUnavailableException(String message) {
    super(message);
  }

  public EmbeddingUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
