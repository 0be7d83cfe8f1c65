package com.example.billing.resilience.core.config;

import static java.lang.System.Logger.Level.WARNING;

import com.example.billing.resilience.core.circuit.CircuitBreaker;
import com.example.billing.resilience.core.failure.ErrorClassifier;
import com.example.billing.resilience.core.idempotency.IdempotencyManager;
import com.example.billing.resilience.core.retry.ExponentialBackoff;
import com.example.billing.resilience.core.retry.RetryExecutor;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Deployment defaults for the resilience components.
 *
 * <p>Each value is read from a system property, then from an environment variable, then falls
 * back to a built-in default:
 *
 * <table>
 *   <caption>Settings</caption>
 *   <tr><th>System property</th><th>Environment variable</th><th>Default</th></tr>
 *   <tr><td>billing.retry.max-attempts</td><td>BILLING_RETRY_MAX_ATTEMPTS</td><td>3</td></tr>
 *   <tr><td>billing.retry.base-delay-millis</td><td>BILLING_RETRY_BASE_DELAY_MILLIS</td>
 *       <td>1000</td></tr>
 *   <tr><td>billing.retry.max-delay-millis</td><td>BILLING_RETRY_MAX_DELAY_MILLIS</td>
 *       <td>30000</td></tr>
 *   <tr><td>billing.retry.jitter</td><td>BILLING_RETRY_JITTER</td><td>true</td></tr>
 *   <tr><td>billing.circuit.failure-threshold</td><td>BILLING_CIRCUIT_FAILURE_THRESHOLD</td>
 *       <td>5</td></tr>
 *   <tr><td>billing.circuit.recovery-timeout-millis</td>
 *       <td>BILLING_CIRCUIT_RECOVERY_TIMEOUT_MILLIS</td><td>60000</td></tr>
 *   <tr><td>billing.idempotency.cache-ttl-millis</td><td>BILLING_IDEMPOTENCY_CACHE_TTL_MILLIS</td>
 *       <td>3600000</td></tr>
 * </table>
 *
 * <p>A value that does not parse is ignored with a WARNING, as is a negative delay or a
 * non-positive attempt count, threshold, timeout or TTL. The retry delays may be zero.
 *
 * @param maxAttempts total retry attempts, including the first
 * @param baseDelay exponential backoff base delay
 * @param maxDelay exponential backoff cap
 * @param jitter whether backoff delays are jittered
 * @param failureThreshold matching failures that open a circuit
 * @param recoveryTimeout how long an open circuit waits before a trial call
 * @param cacheTtl idempotency entry age after which a sweep removes it
 */
public record ResilienceSettings(
    int maxAttempts,
    Duration baseDelay,
    Duration maxDelay,
    boolean jitter,
    int failureThreshold,
    Duration recoveryTimeout,
    Duration cacheTtl) {

  private static final System.Logger LOGGER = System.getLogger(ResilienceSettings.class.getName());

  public ResilienceSettings {
    if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
    if (baseDelay.isNegative()) throw new IllegalArgumentException("baseDelay must be >= 0");
    if (maxDelay.compareTo(baseDelay) < 0)
      throw new IllegalArgumentException("maxDelay must be >= baseDelay");
    if (failureThreshold < 1) throw new IllegalArgumentException("failureThreshold must be >= 1");
    if (recoveryTimeout.isZero() || recoveryTimeout.isNegative())
      throw new IllegalArgumentException("recoveryTimeout must be > 0");
    if (cacheTtl.isZero() || cacheTtl.isNegative())
      throw new IllegalArgumentException("cacheTtl must be > 0");
  }

  /** Built-in defaults, used by the billing reconciliation flows. */
  public static ResilienceSettings defaults() {
    return new ResilienceSettings(
        3,
        Duration.ofSeconds(1),
        Duration.ofSeconds(30),
        true,
        5,
        Duration.ofSeconds(60),
        Duration.ofHours(1));
  }

  /** Reads the settings from system properties and environment variables. */
  public static ResilienceSettings fromEnvironment() {
    return from(System::getProperty, System::getenv);
  }

  /**
   * Reads the settings from the given sources.
   *
   * @param properties property lookup, returning null when unset
   * @param environment environment lookup, returning null when unset
   * @return resolved settings
   */
  public static ResilienceSettings from(
      final Function<String, String> properties, final Function<String, String> environment) {
    final var defaults = defaults();
    final var source = new Source(properties, environment);
    final var baseDelay =
        source.longValue("billing.retry.base-delay-millis", 0).map(Duration::ofMillis);
    final var maxDelay =
        source.longValue("billing.retry.max-delay-millis", 0).map(Duration::ofMillis);

    final var resolvedBase = baseDelay.orElse(defaults.baseDelay());
    var resolvedMax = maxDelay.orElse(defaults.maxDelay());
    if (resolvedMax.compareTo(resolvedBase) < 0) {
      LOGGER.log(
          WARNING,
          "billing.retry.max-delay-millis={0} is below the base delay, using {1}",
          String.valueOf(resolvedMax.toMillis()),
          String.valueOf(resolvedBase.toMillis()));
      resolvedMax = resolvedBase;
    }

    return new ResilienceSettings(
        source.positiveLong("billing.retry.max-attempts").map(Math::toIntExact)
            .orElse(defaults.maxAttempts()),
        resolvedBase,
        resolvedMax,
        source.bool("billing.retry.jitter").orElse(defaults.jitter()),
        source.positiveLong("billing.circuit.failure-threshold").map(Math::toIntExact)
            .orElse(defaults.failureThreshold()),
        source.positiveLong("billing.circuit.recovery-timeout-millis").map(Duration::ofMillis)
            .orElse(defaults.recoveryTimeout()),
        source.positiveLong("billing.idempotency.cache-ttl-millis").map(Duration::ofMillis)
            .orElse(defaults.cacheTtl()));
  }

  /** Retry executor with these attempts and an exponential backoff, retrying transient errors. */
  public RetryExecutor retryExecutor() {
    return RetryExecutor.builder()
        .maxAttempts(maxAttempts)
        .strategy(new ExponentialBackoff(baseDelay, maxDelay, jitter))
        .retryOn(ErrorClassifier.transientDefaults())
        .build();
  }

  /**
   * Circuit breaker for one dependency, counting transient errors only.
   *
   * @param name dependency name
   * @return new breaker
   */
  public CircuitBreaker circuitBreaker(final String name) {
    return CircuitBreaker.builder()
        .name(name)
        .failureThreshold(failureThreshold)
        .recoveryTimeout(recoveryTimeout)
        .expectedError(ErrorClassifier.transientDefaults())
        .build();
  }

  public IdempotencyManager idempotencyManager() {
    return new IdempotencyManager(cacheTtl);
  }

  private static final class Source {
    private final Function<String, String> properties;
    private final Function<String, String> environment;

    private Source(
        final Function<String, String> properties, final Function<String, String> environment) {
      this.properties = properties;
      this.environment = environment;
    }

    private Optional<String> raw(final String property) {
      final var env = property.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
      return Optional.ofNullable(properties.apply(property))
          .or(() -> Optional.ofNullable(environment.apply(env)))
          .filter(val -> !val.isBlank())
          .map(String::trim);
    }

    private Optional<Long> positiveLong(final String property) {
      return longValue(property, 1);
    }

    private Optional<Long> longValue(final String property, final long min) {
      return raw(property)
          .flatMap(
              val -> {
                long parsed;
                try {
                  parsed = Long.parseLong(val);
                } catch (final NumberFormatException e) {
                  parsed = Long.MIN_VALUE;
                }
                if (parsed >= min && parsed <= Integer.MAX_VALUE) return Optional.of(parsed);
                LOGGER.log(WARNING, "Ignoring invalid value {0}={1}", property, val);
                return Optional.empty();
              });
    }

    private Optional<Boolean> bool(final String property) {
      return raw(property)
          .flatMap(
              val -> {
                if ("true".equalsIgnoreCase(val)) return Optional.of(Boolean.TRUE);
                if ("false".equalsIgnoreCase(val)) return Optional.of(Boolean.FALSE);
                LOGGER.log(WARNING, "Ignoring invalid value {0}={1}", property, val);
                return Optional.empty();
              });
    }
  }
}
