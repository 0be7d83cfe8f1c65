package com.example.billing.resilience.core;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.billing.resilience.core.circuit.CircuitBreaker;
import com.example.billing.resilience.core.failure.FallbackFailedException;
import com.example.billing.resilience.core.failure.ResilienceException;
import com.example.billing.resilience.core.failure.RetriesExhaustedException;
import com.example.billing.resilience.core.idempotency.IdempotencyManager;
import com.example.billing.resilience.core.recovery.RecoveryContext;
import com.example.billing.resilience.core.retry.RetryExecutor;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import reactor.core.publisher.Mono;

/**
 * Composes the resilience layers around one operation:
 *
 * <pre>
 * recovery( breaker( retry( idempotency( operation ) ) ), fallback )
 * </pre>
 *
 * <p>Every layer is optional. The layers themselves never translate errors; this is the one place
 * where a failure is turned into a distinctly typed error for upstream code:
 *
 * <ul>
 *   <li>a retryable error still failing after every attempt becomes {@link
 *       RetriesExhaustedException}, with the last error as cause;
 *   <li>a call rejected by the breaker fails with {@link
 *       com.example.billing.resilience.core.circuit.CircuitOpenException};
 *   <li>a fallback that fails too becomes {@link FallbackFailedException}, with the fallback's
 *       error as cause;
 *   <li>any other error propagates unchanged.
 * </ul>
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var call = ResilientCall.<PaymentResult>builder()
 *     .retry(settings.retryExecutor())
 *     .circuitBreaker(breakers.breaker("stripe"))
 *     .idempotency(idempotency, "payment:" + paymentId)
 *     .fallback("manual_review", () -> queueForManualReview(paymentId))
 *     .recovery(RecoveryContext.builder()
 *         .saveState(true)
 *         .stateKey("payment_retry_" + paymentId)
 *         .store(stateStore))
 *     .build();
 *
 * Mono<PaymentResult> result = call.execute("gateway.charge", () -> gateway.charge(payment));
 * }</pre>
 *
 * <p>A built call is immutable and may be executed any number of times; each subscription gets its
 * own recovery context.
 *
 * @param <T> result type
 */
public final class ResilientCall<T> {

  private static final System.Logger LOGGER = System.getLogger(ResilientCall.class.getName());

  private final RetryExecutor retry;
  private final CircuitBreaker breaker;
  private final IdempotencyManager idempotency;
  private final String idempotencyKey;
  private final String fallbackName;
  private final Supplier<? extends Mono<T>> fallback;
  private final RecoveryContext.Builder recovery;

  private ResilientCall(final Builder<T> builder) {
    this.retry = builder.retry;
    this.breaker = builder.breaker;
    this.idempotency = builder.idempotency;
    this.idempotencyKey = builder.idempotencyKey;
    this.fallbackName = builder.fallbackName;
    this.fallback = builder.fallback;
    this.recovery = builder.recovery;
  }

  /**
   * Creates a new builder instance.
   *
   * @param <T> result type
   * @return new builder
   */
  public static <T> Builder<T> builder() {
    return new Builder<>();
  }

  public Mono<T> execute(final Supplier<? extends Mono<T>> operation) {
    return execute("operation", operation);
  }

  /**
   * Executes the operation through the configured layers.
   *
   * @param operationName name used in log events and in the attempt history
   * @param operation supplies a fresh attempt on every subscription
   * @return the operation's or the fallback's result, or a translated error
   */
  public Mono<T> execute(
      final String operationName, final Supplier<? extends Mono<T>> operation) {
    Objects.requireNonNull(operationName, "operationName");
    Objects.requireNonNull(operation, "operation");
    return Mono.defer(
        () -> {
          final var invocations = new AtomicInteger();
          final Supplier<Mono<T>> primary =
              () ->
                  protect(operationName, operation, invocations)
                      .onErrorMap(error -> translate(operationName, error, invocations.get()));

          if (fallback == null && recovery == null) return primary.get();

          final var options = recovery != null ? recovery : RecoveryContext.builder();
          return RecoveryContext.using(
              options,
              context -> {
                if (fallback == null) return context.execute(operationName, primary);
                return context
                    .executeWithFallback(operationName, primary, fallbackName, fallback)
                    .onErrorMap(
                        error ->
                            new FallbackFailedException(operationName, context.attempts(), error));
              });
        });
  }

  private Mono<T> protect(
      final String operationName,
      final Supplier<? extends Mono<T>> operation,
      final AtomicInteger invocations) {
    final Supplier<Mono<T>> attempt =
        () -> {
          invocations.incrementAndGet();
          if (idempotency == null) return Mono.defer(operation);
          return idempotency.ensureIdempotent(idempotencyKey, operation);
        };
    final Supplier<Mono<T>> retried =
        retry == null ? attempt : () -> retry.execute(operationName, attempt);
    return breaker == null ? retried.get() : breaker.call(retried);
  }

  private Throwable translate(
      final String operationName, final Throwable error, final int attempts) {
    if (error instanceof ResilienceException) return error;
    if (retry != null
        && attempts >= retry.maxAttempts()
        && retry.retryableErrors().matches(error)) {
      LOGGER.log(
          DEBUG,
          "event=call.retries_exhausted operation={0} attempts={1}",
          operationName,
          String.valueOf(attempts));
      return new RetriesExhaustedException(operationName, attempts, error);
    }
    return error;
  }

  /**
   * Builder for {@link ResilientCall}.
   *
   * @param <T> result type
   */
  public static final class Builder<T> {
    private RetryExecutor retry;
    private CircuitBreaker breaker;
    private IdempotencyManager idempotency;
    private String idempotencyKey;
    private String fallbackName = "fallback";
    private Supplier<? extends Mono<T>> fallback;
    private RecoveryContext.Builder recovery;

    private Builder() {}

    /**
     * Retries the operation with the given executor.
     *
     * <p>Default: no retries
     *
     * @param retry retry executor
     * @return this builder
     */
    public Builder<T> retry(final RetryExecutor retry) {
      this.retry = retry;
      return this;
    }

    /**
     * Guards the retried operation with a breaker. The breaker sees one call per execution, not
     * one per attempt.
     *
     * <p>Default: no breaker
     *
     * @param breaker circuit breaker of the dependency
     * @return this builder
     */
    public Builder<T> circuitBreaker(final CircuitBreaker breaker) {
      this.breaker = breaker;
      return this;
    }

    /**
     * Memoizes each attempt's successful result under {@code key}.
     *
     * @param idempotency idempotency cache
     * @param key idempotency key of the request
     * @return this builder
     */
    public Builder<T> idempotency(final IdempotencyManager idempotency, final String key) {
      this.idempotency = Objects.requireNonNull(idempotency, "idempotency");
      this.idempotencyKey = Objects.requireNonNull(key, "key");
      return this;
    }

    /**
     * Runs {@code fallback} when the protected operation fails for any reason. The fallback itself
     * is not retried or guarded.
     *
     * @param name name recorded for the fallback leg
     * @param fallback fallback operation
     * @return this builder
     */
    public Builder<T> fallback(final String name, final Supplier<? extends Mono<T>> fallback) {
      this.fallbackName = Objects.requireNonNull(name, "name");
      this.fallback = Objects.requireNonNull(fallback, "fallback");
      return this;
    }

    /**
     * Runs each execution inside a {@link RecoveryContext}. A call with a fallback always gets a
     * context; this sets its options. The context saves into {@link
     * com.example.billing.resilience.core.recovery.RecoveryStateStore#discarding()}; use {@link
     * #recovery(RecoveryContext.Builder)} to save into a real store.
     *
     * @param saveState whether the final state is saved on exit
     * @param stateKey key of the logical operation, or null for a random one
     * @return this builder
     */
    public Builder<T> recovery(final boolean saveState, final String stateKey) {
      return recovery(RecoveryContext.builder().saveState(saveState).stateKey(stateKey));
    }

    /**
     * Same as {@link #recovery(boolean, String)} with full control over the context options.
     *
     * @param options recovery context options
     * @return this builder
     */
    public Builder<T> recovery(final RecoveryContext.Builder options) {
      this.recovery = Objects.requireNonNull(options, "options");
      return this;
    }

    public ResilientCall<T> build() {
      return new ResilientCall<>(this);
    }
  }
}
