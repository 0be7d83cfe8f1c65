package com.example.billing.resilience.core.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Linear backoff: {@code delay + attempt * increment}. Deterministic, for dependencies that do not
 * need bursts spread out.
 *
 * @param delay delay after attempt 0, must be &ge; 0
 * @param increment added per further attempt, must be &ge; 0
 */
public record LinearBackoff(Duration delay, Duration increment) implements RetryStrategy {

  public LinearBackoff {
    Objects.requireNonNull(delay, "delay");
    Objects.requireNonNull(increment, "increment");
    if (delay.isNegative()) throw new IllegalArgumentException("delay must be >= 0");
    if (increment.isNegative()) throw new IllegalArgumentException("increment must be >= 0");
  }

  @Override
  public Duration getDelay(final int attempt) {
    if (attempt < 0) throw new IllegalArgumentException("attempt must be >= 0");
    return delay.plus(increment.multipliedBy(attempt));
  }
}
