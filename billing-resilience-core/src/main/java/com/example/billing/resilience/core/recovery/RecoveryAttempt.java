package com.example.billing.resilience.core.recovery;

import java.time.Instant;

/**
 * Outcome of one leg of {@link RecoveryContext#executeWithFallback}.
 *
 * @param leg which leg ran
 * @param operation name of the operation
 * @param success whether the leg completed without error
 * @param error error message (the class name if the error had none), null on success
 * @param errorType fully qualified class name of the error, null on success
 * @param recordedAt when the outcome was recorded
 */
public record RecoveryAttempt(
    Leg leg,
    String operation,
    boolean success,
    String error,
    String errorType,
    Instant recordedAt) {

  /** Leg of a primary/fallback pair. */
  public enum Leg {
    PRIMARY,
    FALLBACK
  }

  static RecoveryAttempt succeeded(final Leg leg, final String operation, final Instant at) {
    return new RecoveryAttempt(leg, operation, true, null, null, at);
  }

  static RecoveryAttempt failed(
      final Leg leg, final String operation, final Throwable error, final Instant at) {
    return new RecoveryAttempt(
        leg, operation, false, describe(error), error.getClass().getName(), at);
  }

  /** Message of the error, or its class name when it has none. */
  static String describe(final Throwable error) {
    final var message = error.getMessage();
    return message != null ? message : error.getClass().getName();
  }
}
