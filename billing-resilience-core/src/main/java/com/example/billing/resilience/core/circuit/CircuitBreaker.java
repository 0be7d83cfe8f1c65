package com.example.billing.resilience.core.circuit;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.billing.resilience.core.failure.ErrorClassifier;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import reactor.core.publisher.Mono;

/**
 * Gates calls to one external dependency and stops calling it while it keeps failing.
 *
 * <h2>State Machine</h2>
 *
 * <pre>
 *     CLOSED ──(failureCount &gt;= threshold)──&gt; OPEN
 *        ^                                       │
 *        │                              (recoveryTimeout elapsed,
 *    (trial succeeds)                    checked on the next call)
 *        │                                       │
 *        └──────────── HALF_OPEN &lt;───────────────┘
 *                         │
 *                  (trial fails) ──&gt; OPEN
 * </pre>
 *
 * <ul>
 *   <li>Only errors matched by the {@code expectedError} classifier are counted. Any other error
 *       propagates without touching the counters.
 *   <li>{@code failureCount} is reset only when a trial call succeeds and closes the circuit.
 *   <li>There is no background timer: the OPEN to HALF_OPEN transition happens lazily when a call
 *       arrives after the recovery timeout.
 *   <li>HALF_OPEN lets a single trial call through; calls arriving while it is in flight are
 *       rejected.
 * </ul>
 *
 * <h2>Concurrency</h2>
 *
 * <p>One instance is shared by every call to its dependency. Counters are atomics, so no update is
 * lost, but the check-then-transition steps are not serialized: under contention the circuit can
 * open a call or two earlier or later than the exact threshold. Only the HALF_OPEN trial slot is
 * guarded by a compare-and-set.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var breaker = CircuitBreaker.builder()
 *     .name("stripe")
 *     .failureThreshold(5)
 *     .recoveryTimeout(Duration.ofSeconds(60))
 *     .expectedError(ErrorClassifier.ofTypes(StripeConnectionException.class))
 *     .build();
 *
 * Mono<Charge> charge = breaker.call(() -> stripe.charge(request))
 *     .onErrorResume(CircuitOpenException.class, e -> queueForLater(request, e.retryAfter()));
 * }</pre>
 */
public final class CircuitBreaker {

  private static final System.Logger LOGGER = System.getLogger(CircuitBreaker.class.getName());

  private enum Admission {
    PASS,
    TRIAL,
    REJECT
  }

  private final String name;
  private final int failureThreshold;
  private final Duration recoveryTimeout;
  private final ErrorClassifier expectedError;
  private final Clock clock;

  private final AtomicReference<CircuitState> state = new AtomicReference<>(CircuitState.CLOSED);
  private final AtomicInteger failureCount = new AtomicInteger();
  private final AtomicReference<Instant> lastFailureTime = new AtomicReference<>();
  private final AtomicBoolean trialInFlight = new AtomicBoolean(false);

  private CircuitBreaker(final Builder builder) {
    this.name = builder.name;
    this.failureThreshold = builder.failureThreshold;
    this.recoveryTimeout = builder.recoveryTimeout;
    this.expectedError = builder.expectedError;
    this.clock = builder.clock;
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
   * Calls the operation through the breaker.
   *
   * <p>The breaker state is checked when the returned Mono is subscribed, not when this method is
   * called.
   *
   * @param operation supplies the call to the dependency
   * @param <T> result type
   * @return the operation's outcome, or a {@link CircuitOpenException} if the call was rejected
   */
  public <T> Mono<T> call(final Supplier<? extends Mono<T>> operation) {
    Objects.requireNonNull(operation, "operation");
    return Mono.defer(
        () -> {
          final var admission = admit();
          if (admission == Admission.REJECT) {
            final var current = state.get();
            LOGGER.log(DEBUG, "event=circuit.rejected circuit={0} state={1}", name, current);
            return Mono.error(new CircuitOpenException(name, current, retryAfter()));
          }

          final var trial = admission == Admission.TRIAL;
          return Mono.defer(operation)
              .doOnSuccess(result -> onSuccess(trial))
              .doOnError(error -> onError(error, trial))
              .doOnCancel(
                  () -> {
                    if (trial) trialInFlight.set(false);
                  });
        });
  }

  private Admission admit() {
    switch (state.get()) {
      case CLOSED:
        return Admission.PASS;
      case OPEN:
        if (!recoveryTimeoutElapsed()) return Admission.REJECT;
        if (state.compareAndSet(CircuitState.OPEN, CircuitState.HALF_OPEN)) {
          LOGGER.log(INFO, "event=circuit.half_open circuit={0}", name);
        }
        return acquireTrial();
      case HALF_OPEN:
        return acquireTrial();
      default:
        throw new IllegalStateException("Unknown circuit state: " + state.get());
    }
  }

  private Admission acquireTrial() {
    return trialInFlight.compareAndSet(false, true) ? Admission.TRIAL : Admission.REJECT;
  }

  private void onSuccess(final boolean trial) {
    if (!trial) return;

    state.set(CircuitState.CLOSED);
    failureCount.set(0);
    lastFailureTime.set(null);
    trialInFlight.set(false);
    LOGGER.log(INFO, "event=circuit.closed circuit={0}", name);
  }

  private void onError(final Throwable error, final boolean trial) {
    if (!expectedError.matches(error)) {
      if (trial) trialInFlight.set(false);
      LOGGER.log(
          DEBUG,
          "event=circuit.ignored circuit={0} error={1}",
          name,
          error.getClass().getSimpleName());
      return;
    }

    final var failures = failureCount.incrementAndGet();
    lastFailureTime.set(clock.instant());

    if (failures >= failureThreshold) {
      final var previous = state.getAndSet(CircuitState.OPEN);
      if (previous == CircuitState.HALF_OPEN) {
        LOGGER.log(WARNING, "event=circuit.reopened circuit={0} (still failing)", name);
      } else if (previous == CircuitState.CLOSED) {
        LOGGER.log(
            ERROR,
            "event=circuit.opened circuit={0} failures={1}",
            name,
            String.valueOf(failures));
      }
    }
    if (trial) trialInFlight.set(false);
  }

  private boolean recoveryTimeoutElapsed() {
    final var last = lastFailureTime.get();
    if (last == null) return true;
    return Duration.between(last, clock.instant()).compareTo(recoveryTimeout) >= 0;
  }

  private Duration retryAfter() {
    final var last = lastFailureTime.get();
    if (state.get() != CircuitState.OPEN || last == null) return Duration.ZERO;
    final var remaining = recoveryTimeout.minus(Duration.between(last, clock.instant()));
    return remaining.isNegative() ? Duration.ZERO : remaining;
  }

  /**
   * Forces the breaker back to CLOSED and clears its counters.
   *
   * <p>Intended for operators and tests; normal recovery goes through the HALF_OPEN trial.
   */
  public void reset() {
    state.set(CircuitState.CLOSED);
    failureCount.set(0);
    lastFailureTime.set(null);
    trialInFlight.set(false);
    LOGGER.log(INFO, "event=circuit.reset circuit={0}", name);
  }

  public String name() {
    return name;
  }

  /**
   * Returns the stored state. An OPEN breaker whose timeout has elapsed still reports OPEN until
   * the next call arrives.
   */
  public CircuitState state() {
    return state.get();
  }

  public int failureCount() {
    return failureCount.get();
  }

  public Optional<Instant> lastFailureTime() {
    return Optional.ofNullable(lastFailureTime.get());
  }

  public int failureThreshold() {
    return failureThreshold;
  }

  public Duration recoveryTimeout() {
    return recoveryTimeout;
  }

  @Override
  public String toString() {
    return "CircuitBreaker[name="
        + name
        + ", state="
        + state.get()
        + ", failureCount="
        + failureCount.get()
        + "/"
        + failureThreshold
        + "]";
  }

  /**
   * Builder for {@link CircuitBreaker}.
   *
   * <h3>Example: Webhook Target</h3>
   *
   * <pre>{@code
   * var breaker = CircuitBreaker.builder()
   *     .name("webhook:" + endpoint.host())
   *     .failureThreshold(3)
   *     .recoveryTimeout(Duration.ofMinutes(5))
   *     .expectedError(ErrorClassifier.transientDefaults())
   *     .build();
   * }</pre>
   */
  public static final class Builder {
    private String name = "default";
    private int failureThreshold = 5;
    private Duration recoveryTimeout = Duration.ofSeconds(60);
    private ErrorClassifier expectedError = ErrorClassifier.always();
    private Clock clock = Clock.systemUTC();

    private Builder() {}

    /**
     * Sets the dependency name used in logs and in {@link CircuitOpenException}.
     *
     * <p>Default: {@code default}
     *
     * @param name breaker name
     * @return this builder
     */
    public Builder name(final String name) {
      this.name = name;
      return this;
    }

    /**
     * Sets how many matching failures open the circuit.
     *
     * <p>Default: 5
     *
     * @param failureThreshold threshold, must be &gt; 0
     * @return this builder
     */
    public Builder failureThreshold(final int failureThreshold) {
      this.failureThreshold = failureThreshold;
      return this;
    }

    /**
     * Sets how long the circuit stays OPEN after the last failure.
     *
     * <p>Default: 60 seconds
     *
     * @param recoveryTimeout timeout, must be positive
     * @return this builder
     */
    public Builder recoveryTimeout(final Duration recoveryTimeout) {
      this.recoveryTimeout = recoveryTimeout;
      return this;
    }

    /**
     * Sets which errors count as dependency failures.
     *
     * <p>Default: {@link ErrorClassifier#always()}
     *
     * @param expectedError classifier of counted errors
     * @return this builder
     */
    public Builder expectedError(final ErrorClassifier expectedError) {
      this.expectedError = expectedError;
      return this;
    }

    /**
     * Shorthand for {@code expectedError(ErrorClassifier.ofTypes(types))}.
     *
     * @param types counted error kinds
     * @return this builder
     */
    @SafeVarargs
    public final Builder expectedError(final Class<? extends Throwable>... types) {
      return expectedError(ErrorClassifier.ofTypes(types));
    }

    /**
     * Sets the clock used for failure timestamps and the recovery timeout.
     *
     * @param clock clock
     * @return this builder
     */
    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the breaker in the CLOSED state.
     *
     * @return configured breaker
     * @throws IllegalArgumentException if the threshold or timeout is not positive
     */
    public CircuitBreaker build() {
      if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
      if (failureThreshold < 1) throw new IllegalArgumentException("failureThreshold must be > 0");
      Objects.requireNonNull(recoveryTimeout, "recoveryTimeout");
      if (recoveryTimeout.isZero() || recoveryTimeout.isNegative())
        throw new IllegalArgumentException("recoveryTimeout must be > 0");
      Objects.requireNonNull(expectedError, "expectedError");
      Objects.requireNonNull(clock, "clock");
      return new CircuitBreaker(this);
    }
  }
}
