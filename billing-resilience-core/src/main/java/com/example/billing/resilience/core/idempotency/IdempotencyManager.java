package com.example.billing.resilience.core.idempotency;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Memoizes the successful result of an operation under a caller-supplied idempotency key, so that
 * a re-delivered request (a webhook retry, a double-clicked "pay" button) does not execute twice.
 *
 * <ul>
 *   <li>Only successful results are cached. A failed call leaves no entry, so the same key can be
 *       tried again later.
 *   <li>Entries are removed only by {@link #cleanupExpired()} (or {@link #invalidate(String)}). A
 *       lookup never evicts, so an expired entry that has not been swept is still returned.
 *       Schedule the sweep with {@link #scheduleCleanup(Duration)} or from the host's own
 *       scheduler, otherwise the cache grows without bound.
 *   <li>This is process-local memoization, not a lock: two concurrent first calls under the same
 *       key may both run the operation. Only the last one to complete stays cached.
 * </ul>
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var idempotency = new IdempotencyManager(Duration.ofHours(1));
 * var cleanup = idempotency.scheduleCleanup(Duration.ofMinutes(5));
 *
 * Mono<Charge> charge = idempotency.ensureIdempotent(
 *     "charge:" + request.idempotencyKey(),
 *     () -> gateway.charge(request));
 * }</pre>
 */
public final class IdempotencyManager {

  private static final System.Logger LOGGER = System.getLogger(IdempotencyManager.class.getName());

  private final ConcurrentHashMap<String, Entry> cache = new ConcurrentHashMap<>();
  private final Duration cacheTtl;
  private final Clock clock;

  public IdempotencyManager(final Duration cacheTtl) {
    this(cacheTtl, Clock.systemUTC());
  }

  /**
   * Creates a manager.
   *
   * @param cacheTtl age after which {@link #cleanupExpired()} removes an entry, must be positive
   * @param clock clock used for entry timestamps
   */
  public IdempotencyManager(final Duration cacheTtl, final Clock clock) {
    Objects.requireNonNull(cacheTtl, "cacheTtl");
    if (cacheTtl.isZero() || cacheTtl.isNegative())
      throw new IllegalArgumentException("cacheTtl must be > 0");
    this.cacheTtl = cacheTtl;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns the cached result for {@code key}, or runs the operation and caches its result if it
   * succeeds.
   *
   * <p>An operation completing empty is a success: the empty outcome is cached and replayed.
   *
   * @param key idempotency key
   * @param operation supplies the operation; not invoked on a cache hit
   * @param <T> result type; callers must use one type per key
   * @return the cached or fresh result
   */
  @SuppressWarnings("unchecked")
  public <T> Mono<T> ensureIdempotent(
      final String key, final Supplier<? extends Mono<T>> operation) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(operation, "operation");
    return Mono.defer(
        () -> {
          final var cached = cache.get(key);
          if (cached != null) {
            LOGGER.log(DEBUG, "event=idempotency.hit key={0}", key);
            return Mono.justOrEmpty((T) cached.result());
          }

          LOGGER.log(DEBUG, "event=idempotency.miss key={0}", key);
          return Mono.defer(operation)
              .doOnSuccess(result -> cache.put(key, new Entry(result, clock.instant())))
              .doOnError(
                  error ->
                      LOGGER.log(
                          DEBUG,
                          "event=idempotency.not_cached key={0} error={1}",
                          key,
                          error.getMessage()));
        });
  }

  /**
   * Removes every entry older than the cache TTL ({@code now - timestamp > cacheTtl}).
   *
   * @return number of entries removed
   */
  public int cleanupExpired() {
    final var now = clock.instant();
    var removed = 0;
    for (final var entry : cache.entrySet()) {
      if (isExpired(entry.getValue(), now) && cache.remove(entry.getKey(), entry.getValue())) {
        removed++;
      }
    }
    if (removed > 0) {
      LOGGER.log(
          INFO,
          "event=idempotency.cleanup removed={0} remaining={1}",
          String.valueOf(removed),
          String.valueOf(cache.size()));
    }
    return removed;
  }

  /**
   * Runs {@link #cleanupExpired()} periodically on {@link Schedulers#single()}.
   *
   * @param interval time between sweeps
   * @return handle to stop the sweeps
   */
  public Disposable scheduleCleanup(final Duration interval) {
    return scheduleCleanup(interval, Schedulers.single());
  }

  /**
   * Runs {@link #cleanupExpired()} periodically on the given scheduler.
   *
   * @param interval time between sweeps, must be positive
   * @param scheduler scheduler running the sweeps
   * @return handle to stop the sweeps
   */
  public Disposable scheduleCleanup(final Duration interval, final Scheduler scheduler) {
    if (interval.isZero() || interval.isNegative())
      throw new IllegalArgumentException("interval must be > 0");
    final var millis = interval.toMillis();
    return scheduler.schedulePeriodically(
        () -> {
          try {
            cleanupExpired();
          } catch (RuntimeException e) {
            LOGGER.log(WARNING, "Idempotency cache cleanup failed", e);
          }
        },
        millis,
        millis,
        TimeUnit.MILLISECONDS);
  }

  /**
   * Drops the entry for {@code key}, so the next call runs the operation again.
   *
   * @param key idempotency key
   * @return true if an entry was removed
   */
  public boolean invalidate(final String key) {
    return cache.remove(key) != null;
  }

  public boolean contains(final String key) {
    return cache.containsKey(key);
  }

  public int size() {
    return cache.size();
  }

  public Duration cacheTtl() {
    return cacheTtl;
  }

  private boolean isExpired(final Entry entry, final Instant now) {
    return Duration.between(entry.timestamp(), now).compareTo(cacheTtl) > 0;
  }

  /** Cached outcome; {@code result} is null for an operation that completed empty. */
  private record Entry(Object result, Instant timestamp) {}
}
