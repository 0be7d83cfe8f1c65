package com.example.billing.resilience.core.retry;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.billing.resilience.core.failure.ErrorClassifier;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Re-invokes an operation that fails with a retryable error, waiting between attempts according
 * to a {@link RetryStrategy}.
 *
 * <p>Rules applied to each failure of attempt {@code n} (zero-based):
 *
 * <ul>
 *   <li>Error not matched by the retryable classifier: propagated at once, no delay, no listener
 *       call. Validation and business-rule failures are never retried.
 *   <li>Retryable and {@code n < maxAttempts - 1}: the listener is notified (and awaited), the
 *       sequence sleeps for {@code strategy.getDelay(n)} and the operation is subscribed again.
 *   <li>Retryable on the last attempt: the error is propagated unchanged.
 * </ul>
 *
 * <p>The delay is a {@link Sleeper} timer, so a retry sequence waiting for its next attempt holds
 * no thread. Cancelling the subscription cancels the pending delay or the in-flight attempt.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var executor = RetryExecutor.builder()
 *     .maxAttempts(3)
 *     .strategy(new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(30)))
 *     .retryOn(ErrorClassifier.transientDefaults())
 *     .listener(RetryListener.logging())
 *     .build();
 *
 * Mono<ChargeResult> charge = executor.execute("gateway.charge", () -> gateway.charge(request));
 * }</pre>
 */
public final class RetryExecutor {

  private static final System.Logger LOGGER = System.getLogger(RetryExecutor.class.getName());

  private final int maxAttempts;
  private final RetryStrategy strategy;
  private final ErrorClassifier retryableErrors;
  private final RetryListener listener;
  private final Sleeper sleeper;

  private RetryExecutor(final Builder builder) {
    this.maxAttempts = builder.maxAttempts;
    this.strategy = builder.strategy;
    this.retryableErrors = builder.retryableErrors;
    this.listener = builder.listener;
    this.sleeper = builder.sleeper;
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Executes the operation with retries.
   *
   * @param operation supplies a fresh attempt on every subscription
   * @param <T> result type
   * @return the first successful result, or the error that ended the sequence
   */
  public <T> Mono<T> execute(final Supplier<? extends Mono<T>> operation) {
    return execute("operation", operation);
  }

  /**
   * Executes the operation with retries, naming it in log events.
   *
   * @param operationName name used in log events
   * @param operation supplies a fresh attempt on every subscription
   * @param <T> result type
   * @return the first successful result, or the error that ended the sequence
   */
  public <T> Mono<T> execute(
      final String operationName, final Supplier<? extends Mono<T>> operation) {
    Objects.requireNonNull(operation, "operation");
    return Mono.defer(
        () -> {
          final var retries = new AtomicInteger();
          return Mono.defer(operation)
              .retryWhen(
                  Retry.from(
                      signals ->
                          signals.concatMap(
                              signal ->
                                  onFailure(
                                      operationName,
                                      (int) signal.totalRetries(),
                                      signal.failure(),
                                      retries))))
              .doOnSuccess(
                  result -> {
                    if (retries.get() > 0) {
                      LOGGER.log(
                          INFO,
                          "event=retry.recovered operation={0} attempts={1}",
                          operationName,
                          String.valueOf(retries.get() + 1));
                    }
                  });
        });
  }

  private Mono<Integer> onFailure(
      final String operationName,
      final int attempt,
      final Throwable error,
      final AtomicInteger retries) {
    if (!retryableErrors.matches(error)) {
      LOGGER.log(
          DEBUG,
          "event=retry.skipped operation={0} attempt={1} error={2}",
          operationName,
          String.valueOf(attempt),
          error.toString());
      return Mono.error(error);
    }

    if (attempt + 1 >= maxAttempts) {
      LOGGER.log(
          WARNING,
          "event=retry.exhausted operation={0} attempts={1} error={2}",
          operationName,
          String.valueOf(attempt + 1),
          error.getMessage());
      return Mono.error(error);
    }

    final Duration delay = strategy.getDelay(attempt);
    LOGGER.log(
        DEBUG,
        "event=retry.scheduled operation={0} attempt={1} delayMillis={2} error={3}",
        operationName,
        String.valueOf(attempt),
        String.valueOf(delay.toMillis()),
        error.getMessage());

    return listener
        .onRetry(new RetryAttempt(attempt, error, delay))
        .then(Mono.defer(() -> sleeper.sleep(delay)))
        .then(Mono.fromSupplier(retries::incrementAndGet));
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public RetryStrategy strategy() {
    return strategy;
  }

  public ErrorClassifier retryableErrors() {
    return retryableErrors;
  }

  /**
   * Builder for {@link RetryExecutor}.
   *
   * <h3>Example: Webhook Delivery</h3>
   *
   * <pre>{@code
   * var executor = RetryExecutor.builder()
   *     .maxAttempts(5)
   *     .strategy(new LinearBackoff(Duration.ofSeconds(2), Duration.ofSeconds(2)))
   *     .retryOn(ErrorClassifier.ofTypes(IOException.class, TransientDependencyException.class))
   *     .build();
   * }</pre>
   */
  public static final class Builder {
    private int maxAttempts = 3;
    private RetryStrategy strategy =
        new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(30));
    private ErrorClassifier retryableErrors = ErrorClassifier.transientDefaults();
    private RetryListener listener = RetryListener.noOp();
    private Sleeper sleeper = Sleeper.defaultSleeper();

    private Builder() {}

    /**
     * Sets the total number of attempts, including the first.
     *
     * <p>Default: 3
     *
     * @param maxAttempts attempts, must be &ge; 1
     * @return this builder
     */
    public Builder maxAttempts(final int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the backoff strategy.
     *
     * <p>Default: exponential, 1s base, 30s cap, jittered
     *
     * @param strategy backoff strategy
     * @return this builder
     */
    public Builder strategy(final RetryStrategy strategy) {
      this.strategy = strategy;
      return this;
    }

    /**
     * Sets the classification of retryable errors.
     *
     * <p>Default: {@link ErrorClassifier#transientDefaults()}
     *
     * @param retryableErrors classifier for retryable errors
     * @return this builder
     */
    public Builder retryOn(final ErrorClassifier retryableErrors) {
      this.retryableErrors = retryableErrors;
      return this;
    }

    /**
     * Shorthand for {@code retryOn(ErrorClassifier.ofTypes(types))}.
     *
     * @param types retryable error kinds
     * @return this builder
     */
    @SafeVarargs
    public final Builder retryOn(final Class<? extends Throwable>... types) {
      return retryOn(ErrorClassifier.ofTypes(types));
    }

    /**
     * Sets the observer notified before each retry.
     *
     * @param listener retry observer
     * @return this builder
     */
    public Builder listener(final RetryListener listener) {
      this.listener = listener;
      return this;
    }

    /**
     * Sets how the executor waits between attempts. Tests use this to record delays instead of
     * waiting.
     *
     * @param sleeper delay implementation
     * @return this builder
     */
    public Builder sleeper(final Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /**
     * Builds the executor.
     *
     * @return configured executor
     * @throws IllegalArgumentException if {@code maxAttempts < 1}
     * @throws NullPointerException if a collaborator is null
     */
    public RetryExecutor build() {
      if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
      Objects.requireNonNull(strategy, "strategy");
      Objects.requireNonNull(retryableErrors, "retryableErrors");
      Objects.requireNonNull(listener, "listener");
      Objects.requireNonNull(sleeper, "sleeper");
      return new RetryExecutor(this);
    }
  }
}
