package com.example.billing.resilience.core.retry;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff: {@code min(baseDelay * 2^attempt, maxDelay)}.
 *
 * <h3>Jitter Mechanics</h3>
 *
 * <p>When enabled, the nominal delay is multiplied by a factor drawn uniformly from {@code [0.5,
 * 1.5)}:
 *
 * <ul>
 *   <li>Example: a nominal 400ms delay becomes 200ms-600ms
 *   <li>Callers that failed together stop retrying in lockstep
 *   <li>The factor comes from {@link SecureRandom} unless another source is supplied
 * </ul>
 *
 * <pre>{@code
 * // deterministic: 10ms, 20ms, 40ms, ... capped at 1s
 * var backoff = new ExponentialBackoff(Duration.ofMillis(10), Duration.ofSeconds(1), false);
 *
 * // tests: fixed random source, factor is always 0.5 + 0.25
 * var fixed =
 *     new ExponentialBackoff(Duration.ofMillis(10), Duration.ofSeconds(1), true, () -> 0.25);
 * }</pre>
 */
public final class ExponentialBackoff implements RetryStrategy {

  private final Duration baseDelay;
  private final Duration maxDelay;
  private final boolean jitter;
  private final DoubleSupplier random;

  public ExponentialBackoff(final Duration baseDelay, final Duration maxDelay) {
    this(baseDelay, maxDelay, true);
  }

  public ExponentialBackoff(
      final Duration baseDelay, final Duration maxDelay, final boolean jitter) {
    this(baseDelay, maxDelay, jitter, new SecureRandom()::nextDouble);
  }

  /**
   * Creates an exponential backoff with an explicit random source.
   *
   * @param baseDelay delay after attempt 0, must be &ge; 0
   * @param maxDelay cap for the nominal delay, must be &ge; baseDelay
   * @param jitter whether to apply the {@code [0.5, 1.5)} factor
   * @param random source of uniform values in {@code [0, 1)}
   */
  public ExponentialBackoff(
      final Duration baseDelay,
      final Duration maxDelay,
      final boolean jitter,
      final DoubleSupplier random) {
    Objects.requireNonNull(baseDelay, "baseDelay");
    Objects.requireNonNull(maxDelay, "maxDelay");
    if (baseDelay.isNegative()) throw new IllegalArgumentException("baseDelay must be >= 0");
    if (maxDelay.compareTo(baseDelay) < 0)
      throw new IllegalArgumentException("maxDelay must be >= baseDelay");
    this.baseDelay = baseDelay;
    this.maxDelay = maxDelay;
    this.jitter = jitter;
    this.random = Objects.requireNonNull(random, "random");
  }

  @Override
  public Duration getDelay(final int attempt) {
    if (attempt < 0) throw new IllegalArgumentException("attempt must be >= 0");

    final var nominal = nominalNanos(attempt);
    if (!jitter || nominal == 0L) return Duration.ofNanos(nominal);

    final var factor = 0.5 + random.getAsDouble();
    return Duration.ofNanos((long) Math.floor(nominal * factor));
  }

  /** {@code min(base << attempt, max)} without overflowing. */
  private long nominalNanos(final int attempt) {
    final var base = baseDelay.toNanos();
    final var max = maxDelay.toNanos();
    if (base == 0L) return 0L;
    if (attempt >= Long.SIZE - 1 || base > (max >> attempt)) return max;
    return base << attempt;
  }

  public Duration baseDelay() {
    return baseDelay;
  }

  public Duration maxDelay() {
    return maxDelay;
  }

  public boolean jitter() {
    return jitter;
  }

  @Override
  public String toString() {
    return "ExponentialBackoff[baseDelay="
        + baseDelay
        + ", maxDelay="
        + maxDelay
        + ", jitter="
        + jitter
        + "]";
  }
}
