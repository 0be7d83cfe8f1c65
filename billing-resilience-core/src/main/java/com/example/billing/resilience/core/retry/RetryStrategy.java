package com.example.billing.resilience.core.retry;

import java.time.Duration;

/**
 * Maps an attempt index to the delay to wait before the next attempt.
 *
 * <p>Implementations are pure functions of the attempt index (apart from an optional random
 * source) and hold no per-call state, so one instance may be shared by any number of executors.
 *
 * <pre>{@code
 * // 100ms, 200ms, 400ms, ... capped at 5s, jittered
 * var exponential = RetryStrategy.exponential(Duration.ofMillis(100), Duration.ofSeconds(5));
 *
 * // 1s, 1.5s, 2s, ...
 * var linear = RetryStrategy.linear(Duration.ofSeconds(1), Duration.ofMillis(500));
 * }</pre>
 *
 * @see ExponentialBackoff
 * @see LinearBackoff
 */
@FunctionalInterface
public interface RetryStrategy {

  /**
   * Calculates the delay to apply after the given failed attempt.
   *
   * @param attempt zero-based index of the attempt that just failed
   * @return non-negative delay
   * @throws IllegalArgumentException if {@code attempt} is negative
   */
  Duration getDelay(int attempt);

  /**
   * Exponential backoff with jitter enabled.
   *
   * @param baseDelay delay after the first failed attempt
   * @param maxDelay cap for the nominal delay
   * @return exponential strategy
   */
  static RetryStrategy exponential(final Duration baseDelay, final Duration maxDelay) {
    return new ExponentialBackoff(baseDelay, maxDelay, true);
  }

  /**
   * Linear backoff.
   *
   * @param delay delay after the first failed attempt
   * @param increment added for every further attempt
   * @return linear strategy
   */
  static RetryStrategy linear(final Duration delay, final Duration increment) {
    return new LinearBackoff(delay, increment);
  }
}
