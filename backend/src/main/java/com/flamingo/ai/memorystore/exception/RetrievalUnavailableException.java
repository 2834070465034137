package com.flamingo.ai.memorystore.exception;

/**
 * Externally visible failure of a retrieval operation caused by an unavailable dependency. Callers
 * may retry with backoff.
 */
public class RetrievalUnavailableException extends RuntimeException {

  /** The dependency that failed. */
  public enum Dependency {
    EMBEDDING,
    STORE
  }

  private final Dependency dependency;
  private final String userMessage;

  public RetrievalUnavailableException(Dependency dependency, String message, Throwable cause) {
    super(message, cause);
    this.dependency = dependency;
    this.userMessage =
        dependency == Dependency.EMBEDDING
            ? "Embedding service is temporarily unavailable. Please try again later."
            : "Vector store is temporarily unavailable. Please try again later.";
  }

  public Dependency getDependency() {
    return dependency;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
