package com.example.billing.resilience.core.recovery;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.billing.resilience.core.recovery.RecoveryAttempt.Leg;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.function.Supplier;
import reactor.core.publisher.Mono;

/**
 * Runs a primary operation with a fallback and keeps the history of both legs for one logical
 * operation, such as "retry payment 42".
 *
 * <p>A context is a scope: {@link #enter()} records the start, {@link #exit(Throwable)} records the
 * outcome and logs a {@code recovery.completed} event with the attempt count. With {@code
 * saveState} the final {@link RecoveryState} is also saved to a {@link RecoveryStateStore}.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * Mono<PaymentResult> result = RecoveryContext.using(
 *     RecoveryContext.builder()
 *         .saveState(true)
 *         .stateKey("payment_retry_" + paymentId)
 *         .store(stateStore),
 *     context -> context.executeWithFallback(
 *         "gateway.charge", () -> gateway.charge(payment),
 *         "manual_review", () -> queueForManualReview(payment)));
 * }</pre>
 *
 * <p>A context is used by one logical operation at a time. The attempts list tolerates concurrent
 * appends, but the enter/exit bookkeeping assumes a single owner.
 */
public final class RecoveryContext {

  private static final System.Logger LOGGER = System.getLogger(RecoveryContext.class.getName());

  private final boolean saveState;
  private final String stateKey;
  private final Clock clock;
  private final RecoveryStateStore store;
  private final List<RecoveryAttempt> attempts = new CopyOnWriteArrayList<>();

  private volatile Instant startedAt;
  private volatile Instant completedAt;
  private volatile Boolean success;
  private volatile String error;

  /**
   * Creates a context using the system clock and the {@link RecoveryStateStore#discarding()}
   * store.
   *
   * @param saveState whether to save the final state on exit
   * @param stateKey key of the logical operation, or null for a random one
   */
  public RecoveryContext(final boolean saveState, final String stateKey) {
    this(builder().saveState(saveState).stateKey(stateKey));
  }

  private RecoveryContext(final Builder builder) {
    this.saveState = builder.saveState;
    this.stateKey = builder.stateKey != null ? builder.stateKey : UUID.randomUUID().toString();
    this.clock = builder.clock;
    this.store = builder.store;
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
   * Runs {@code body} inside a fresh context built from {@code options} on every subscription.
   * The context is exited when the body completes, fails or is cancelled.
   *
   * @param options context options
   * @param body work to run inside the context
   * @param <T> result type
   * @return the body's outcome
   */
  public static <T> Mono<T> using(
      final Builder options, final Function<RecoveryContext, ? extends Mono<T>> body) {
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(body, "body");
    return Mono.usingWhen(
        Mono.fromSupplier(() -> options.build().enter()),
        body,
        context -> Mono.fromRunnable(() -> context.exit(null)),
        (context, failure) -> Mono.fromRunnable(() -> context.exit(failure)),
        context ->
            Mono.fromRunnable(
                () -> context.exit(new CancellationException("recovery scope cancelled"))));
  }

  /**
   * Opens the scope.
   *
   * @return this context
   * @throws IllegalStateException if the context was already entered
   */
  public RecoveryContext enter() {
    if (startedAt != null) throw new IllegalStateException("Recovery context already entered");
    startedAt = clock.instant();
    LOGGER.log(INFO, "event=recovery.started state_key={0}", stateKey);
    return this;
  }

  /**
   * Closes the scope, logs the outcome and saves the final state when {@code saveState} is set.
   * A failing store is logged and does not replace the outcome of the scope.
   *
   * @param failure error that ended the scope, or null on success
   */
  public void exit(final Throwable failure) {
    completedAt = clock.instant();
    success = failure == null;
    error = failure == null ? null : RecoveryAttempt.describe(failure);

    if (failure == null) {
      LOGGER.log(
          INFO,
          "event=recovery.completed state_key={0} success=true attempts={1}",
          stateKey,
          String.valueOf(attempts.size()));
    } else {
      LOGGER.log(
          WARNING,
          "event=recovery.completed state_key={0} success=false attempts={1} error={2}",
          stateKey,
          String.valueOf(attempts.size()),
          error);
    }

    if (saveState) {
      try {
        store.save(state());
      } catch (RuntimeException e) {
        LOGGER.log(WARNING, "Failed to save recovery state " + stateKey, e);
      }
    }
  }

  /**
   * Runs {@code primary}; if it fails, runs {@code fallback} and returns its outcome. Both legs'
   * outcomes are appended to {@link #attempts()}.
   *
   * @param primary preferred operation
   * @param fallback operation used when the primary fails
   * @param <T> result type
   * @return the primary's result, or the fallback's result or error
   */
  public <T> Mono<T> executeWithFallback(
      final Supplier<? extends Mono<T>> primary, final Supplier<? extends Mono<T>> fallback) {
    return executeWithFallback("primary", primary, "fallback", fallback);
  }

  /**
   * Same as {@link #executeWithFallback(Supplier, Supplier)} but for two operations taking the
   * same argument.
   *
   * @param primary preferred operation
   * @param fallback operation used when the primary fails
   * @param argument argument passed to whichever leg runs
   * @param <A> argument type
   * @param <T> result type
   * @return the primary's result, or the fallback's result or error
   */
  public <A, T> Mono<T> executeWithFallback(
      final Function<? super A, ? extends Mono<T>> primary,
      final Function<? super A, ? extends Mono<T>> fallback,
      final A argument) {
    Objects.requireNonNull(primary, "primary");
    Objects.requireNonNull(fallback, "fallback");
    return executeWithFallback(
        "primary", () -> primary.apply(argument), "fallback", () -> fallback.apply(argument));
  }

  /**
   * Same as {@link #executeWithFallback(Supplier, Supplier)}, recording the given operation names.
   *
   * @param primaryName name recorded for the primary leg
   * @param primary preferred operation
   * @param fallbackName name recorded for the fallback leg
   * @param fallback operation used when the primary fails
   * @param <T> result type
   * @return the primary's result, or the fallback's result or error
   */
  public <T> Mono<T> executeWithFallback(
      final String primaryName,
      final Supplier<? extends Mono<T>> primary,
      final String fallbackName,
      final Supplier<? extends Mono<T>> fallback) {
    Objects.requireNonNull(primary, "primary");
    Objects.requireNonNull(fallback, "fallback");
    return runLeg(Leg.PRIMARY, primaryName, primary)
        .onErrorResume(
            primaryError -> {
              LOGGER.log(
                  DEBUG,
                  "event=recovery.fallback state_key={0} primary={1} fallback={2} error={3}",
                  stateKey,
                  primaryName,
                  fallbackName,
                  primaryError.getMessage());
              return runLeg(Leg.FALLBACK, fallbackName, fallback);
            });
  }

  /**
   * Runs a single operation without a fallback, recording its outcome as a primary leg.
   *
   * @param operationName name recorded for the leg
   * @param operation the operation
   * @param <T> result type
   * @return the operation's outcome
   */
  public <T> Mono<T> execute(
      final String operationName, final Supplier<? extends Mono<T>> operation) {
    Objects.requireNonNull(operation, "operation");
    return runLeg(Leg.PRIMARY, operationName, operation);
  }

  private <T> Mono<T> runLeg(
      final Leg leg, final String operationName, final Supplier<? extends Mono<T>> operation) {
    return Mono.<T>defer(operation)
        .doOnSuccess(result -> record(RecoveryAttempt.succeeded(leg, operationName, now())))
        .doOnError(error -> record(RecoveryAttempt.failed(leg, operationName, error, now())));
  }

  private void record(final RecoveryAttempt attempt) {
    attempts.add(attempt);
  }

  private Instant now() {
    return clock.instant();
  }

  /** Snapshot of the recorded leg outcomes, in order. */
  public List<RecoveryAttempt> attempts() {
    return List.copyOf(attempts);
  }

  /** Snapshot of the scope's state; completion fields are null until {@link #exit}. */
  public RecoveryState state() {
    return new RecoveryState(stateKey, startedAt, completedAt, success, error, attempts());
  }

  public String stateKey() {
    return stateKey;
  }

  public boolean saveState() {
    return saveState;
  }

  /** Builder for {@link RecoveryContext}. */
  public static final class Builder {
    private boolean saveState;
    private String stateKey;
    private Clock clock = Clock.systemUTC();
    private RecoveryStateStore store = RecoveryStateStore.discarding();

    private Builder() {}

    /**
     * Sets whether the final state is saved on exit.
     *
     * <p>Default: false
     *
     * @param saveState save flag
     * @return this builder
     */
    public Builder saveState(final boolean saveState) {
      this.saveState = saveState;
      return this;
    }

    /**
     * Sets the key of the logical operation.
     *
     * <p>Default: a random UUID per context
     *
     * @param stateKey state key, or null for a random one
     * @return this builder
     */
    public Builder stateKey(final String stateKey) {
      this.stateKey = stateKey;
      return this;
    }

    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets where the final state is saved.
     *
     * <p>Default: {@link RecoveryStateStore#discarding()}, which keeps nothing
     *
     * @param store state store
     * @return this builder
     */
    public Builder store(final RecoveryStateStore store) {
      this.store = store;
      return this;
    }

    /**
     * Builds a context that has not been entered yet.
     *
     * @return new context
     */
    public RecoveryContext build() {
      Objects.requireNonNull(clock, "clock");
      Objects.requireNonNull(store, "store");
      return new RecoveryContext(this);
    }
  }
}
