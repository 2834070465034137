package com.flamingo.ai.memorystore.exception;

/** Thrown when a stored or queried vector does not have the store's configured dimension. */
public class DimensionMismatchException extends RuntimeException {

  private final int expected;
  private final int actual;

  public DimensionMismatchException(String storeName, int expected, int actual) {
    super(
        String.format(
            "Vector dimension mismatch in store '%s': expected %d but got %d",
            storeName, expected, actual));
    this.expected = expected;
    this.actual = actual;
  }

  public int getExpected() {
    return expected;
  }

  public int getActual() {
    return actual;
  }
}
