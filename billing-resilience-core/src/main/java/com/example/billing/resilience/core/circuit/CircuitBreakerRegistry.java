package com.example.billing.resilience.core.circuit;

import static java.lang.System.Logger.Level.DEBUG;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Holds one long-lived {@link CircuitBreaker} per external dependency, created on first use.
 *
 * <pre>{@code
 * var registry = new CircuitBreakerRegistry(name -> CircuitBreaker.builder()
 *     .name(name)
 *     .failureThreshold(5)
 *     .recoveryTimeout(Duration.ofSeconds(60))
 *     .build());
 *
 * registry.breaker("stripe").call(() -> stripe.charge(request));
 * registry.breaker("paystack").call(() -> paystack.charge(request));
 * }</pre>
 */
public final class CircuitBreakerRegistry {

  private static final System.Logger LOGGER =
      System.getLogger(CircuitBreakerRegistry.class.getName());

  private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
  private final Function<String, CircuitBreaker> factory;

  /**
   * Creates a registry.
   *
   * @param factory creates the breaker for a dependency name on first use
   */
  public CircuitBreakerRegistry(final Function<String, CircuitBreaker> factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  /**
   * Returns the breaker for the dependency, creating it if needed.
   *
   * @param name dependency name
   * @return the shared breaker
   */
  public CircuitBreaker breaker(final String name) {
    return breakers.computeIfAbsent(
        name,
        key -> {
          LOGGER.log(DEBUG, "event=circuit.registered circuit={0}", key);
          return Objects.requireNonNull(factory.apply(key), "factory returned null");
        });
  }

  /**
   * Returns the breaker for the dependency if one was already created.
   *
   * @param name dependency name
   * @return the breaker, or empty
   */
  public Optional<CircuitBreaker> find(final String name) {
    return Optional.ofNullable(breakers.get(name));
  }

  /** Snapshot of every registered breaker's state, sorted by name. */
  public Map<String, CircuitState> states() {
    final var snapshot = new TreeMap<String, CircuitState>();
    breakers.forEach((name, breaker) -> snapshot.put(name, breaker.state()));
    return snapshot;
  }

  /** Forces every registered breaker back to CLOSED. */
  public void resetAll() {
    breakers.values().forEach(CircuitBreaker::reset);
  }
}
