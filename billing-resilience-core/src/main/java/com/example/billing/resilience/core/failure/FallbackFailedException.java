package com.example.billing.resilience.core.failure;

import com.example.billing.resilience.core.recovery.RecoveryAttempt;
import java.util.List;

/**
 * Raised at the outer boundary of a {@link com.example.billing.resilience.core.ResilientCall} when
 * both the primary operation and its fallback failed.
 *
 * <p>The cause is the fallback's error. The primary's error is only available through {@link
 * #attempts()}, never as the cause.
 */
public final class FallbackFailedException extends ResilienceException {

  public static final String CODE = "FALLBACK_FAILED";

  private final transient List<RecoveryAttempt> attempts;

  public FallbackFailedException(
      final String operation, final List<RecoveryAttempt> attempts, final Throwable cause) {
    super(
        CODE,
        String.format(
            "Operation '%s' and its fallback both failed: %s", operation, cause.getMessage()),
        cause);
    this.attempts = List.copyOf(attempts);
  }

  /** Attempt history of the recovery context, primary leg first. */
  public List<RecoveryAttempt> attempts() {
    return attempts;
  }
}
