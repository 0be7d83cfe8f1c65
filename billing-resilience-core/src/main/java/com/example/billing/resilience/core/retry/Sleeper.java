package com.example.billing.resilience.core.retry;

import java.time.Duration;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Suspends a retry sequence between attempts.
 *
 * <p>The default implementation is a {@link Mono#delay(Duration, Scheduler)} timer: the waiting
 * sequence holds no thread, so other operations sharing the scheduler keep running. Cancelling the
 * subscription cancels the timer.
 */
@FunctionalInterface
public interface Sleeper {

  /**
   * Returns a Mono that completes once {@code delay} has elapsed.
   *
   * @param delay non-negative delay
   * @return completion signal
   */
  Mono<Void> sleep(Duration delay);

  /** Timer-based sleeper on {@link Schedulers#parallel()}. */
  static Sleeper defaultSleeper() {
    return on(Schedulers.parallel());
  }

  /**
   * Timer-based sleeper on the given scheduler.
   *
   * @param scheduler scheduler running the timer
   * @return sleeper
   */
  static Sleeper on(final Scheduler scheduler) {
    return delay ->
        delay.isZero() || delay.isNegative() ? Mono.empty() : Mono.delay(delay, scheduler).then();
  }
}
