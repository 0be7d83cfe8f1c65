package com.example.billing.resilience.core.retry;

import static java.lang.System.Logger.Level.WARNING;

import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Observer notified before each retry (never before the first attempt), useful for logging,
 * metrics and audit trails.
 *
 * <p>An observer is either immediate or deferred. The executor resolves both the same way: it waits
 * for the returned {@link Mono} before starting the backoff delay.
 *
 * <h3>Immediate Observer</h3>
 *
 * <pre>{@code
 * var listener = RetryListener.of((attempt, error) ->
 *     metrics.increment("gateway.retries", "attempt", String.valueOf(attempt)));
 * }</pre>
 *
 * <h3>Deferred Observer</h3>
 *
 * <pre>{@code
 * // waits for the audit row to be written before sleeping
 * var listener = RetryListener.deferred((attempt, error) ->
 *     auditLog.record("payment.retry", attempt, error.getMessage()));
 *
 * // or with a CompletableFuture based API
 * var listener = RetryListener.async((attempt, error) ->
 *     notifier.sendAsync(new RetryNotice(attempt, error)));
 * }</pre>
 */
@FunctionalInterface
public interface RetryListener {

  /**
   * Called before the backoff delay of each retry.
   *
   * @param attempt the failed attempt, its error and the delay chosen
   * @return completion of the notification; the executor waits for it
   */
  Mono<Void> onRetry(RetryAttempt attempt);

  /**
   * Wraps a fire-and-forget observer.
   *
   * @param observer receives the zero-based attempt index and the error
   * @return listener
   */
  static RetryListener of(final BiConsumer<Integer, Throwable> observer) {
    Objects.requireNonNull(observer, "observer");
    return attempt ->
        Mono.fromRunnable(() -> observer.accept(attempt.attempt(), attempt.error()));
  }

  /**
   * Wraps an observer returning a pending result as a reactive {@link Publisher}.
   *
   * @param observer receives the zero-based attempt index and the error
   * @return listener
   */
  static RetryListener deferred(
      final BiFunction<Integer, Throwable, ? extends Publisher<?>> observer) {
    Objects.requireNonNull(observer, "observer");
    return attempt ->
        Mono.defer(
            () -> {
              final Publisher<?> pending = observer.apply(attempt.attempt(), attempt.error());
              return Flux.from(pending).then();
            });
  }

  /**
   * Wraps an observer returning a pending result as a {@link CompletionStage}.
   *
   * @param observer receives the zero-based attempt index and the error
   * @return listener
   */
  static RetryListener async(
      final BiFunction<Integer, Throwable, ? extends CompletionStage<?>> observer) {
    Objects.requireNonNull(observer, "observer");
    return attempt ->
        Mono.defer(
            () -> {
              final CompletionStage<?> pending =
                  observer.apply(attempt.attempt(), attempt.error());
              return Mono.fromCompletionStage(pending).then();
            });
  }

  /** Returns a listener that does nothing. */
  static RetryListener noOp() {
    return attempt -> Mono.empty();
  }

  /**
   * Returns a listener that logs each retry at WARNING level.
   *
   * <p>Example output:
   *
   * <pre>
   * WARNING: event=retry attempt=1 delayMillis=200 error=Connection reset
   * </pre>
   */
  static RetryListener logging() {
    final var logger = System.getLogger(RetryListener.class.getName());
    return attempt ->
        Mono.fromRunnable(
            () ->
                logger.log(
                    WARNING,
                    "event=retry attempt={0} delayMillis={1} error={2}",
                    String.valueOf(attempt.attempt()),
                    String.valueOf(attempt.delay().toMillis()),
                    attempt.error().getMessage()));
  }

  /**
   * Runs this listener, then {@code next}.
   *
   * @param next listener to notify afterwards
   * @return combined listener
   */
  default RetryListener andThen(final RetryListener next) {
    return attempt -> this.onRetry(attempt).then(Mono.defer(() -> next.onRetry(attempt)));
  }
}
