package com.example.billing.resilience.core.failure;

/**
 * Raised at the outer boundary of a {@link com.example.billing.resilience.core.ResilientCall} when
 * every retry attempt failed with a retryable error. The last error observed is the cause.
 */
public final class RetriesExhaustedException extends ResilienceException {

  public static final String CODE = "RETRIES_EXHAUSTED";

  private final int attempts;

  public RetriesExhaustedException(
      final String operation, final int attempts, final Throwable cause) {
    super(
        CODE,
        String.format(
            "Operation '%s' failed after %d attempt(s): %s",
            operation, attempts, cause == null ? "no result" : cause.getMessage()),
        cause);
    this.attempts = attempts;
  }

  /** Number of attempts that were made before giving up. */
  public int attempts() {
    return attempts;
  }
}
