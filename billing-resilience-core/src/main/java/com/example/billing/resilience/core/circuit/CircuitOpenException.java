package com.example.billing.resilience.core.circuit;

import com.example.billing.resilience.core.failure.ResilienceException;
import java.time.Duration;

/**
 * Raised by {@link CircuitBreaker#call} when the circuit rejects a call. The protected operation
 * was not invoked, so this error never has a cause.
 */
public final class CircuitOpenException extends ResilienceException {

  public static final String CODE = "CIRCUIT_OPEN";

  private final String circuitName;
  private final CircuitState state;
  private final Duration retryAfter;

  public CircuitOpenException(
      final String circuitName, final CircuitState state, final Duration retryAfter) {
    super(
        CODE,
        String.format(
            "Circuit breaker '%s' is %s. Service is currently unavailable.", circuitName, state),
        null);
    this.circuitName = circuitName;
    this.state = state;
    this.retryAfter = retryAfter;
  }

  public String circuitName() {
    return circuitName;
  }

  /** State the breaker was in when it rejected the call. */
  public CircuitState state() {
    return state;
  }

  /** Time left until the breaker lets a trial call through; zero while a trial is in flight. */
  public Duration retryAfter() {
    return retryAfter;
  }

  /** Human-facing hint on when to try again. */
  public String recoveryHint() {
    if (retryAfter.isZero()) {
      return "A recovery probe is in progress for '" + circuitName + "'; retry shortly.";
    }
    final var seconds = Math.max(1L, (retryAfter.toMillis() + 999L) / 1000L);
    return "Retry after " + seconds + "s, once '" + circuitName + "' has had time to recover.";
  }
}
