package com.example.billing.resilience.core.circuit;

import static org.junit.jupiter.api.Assertions.*;

import com.example.billing.resilience.core.MutableClock;
import com.example.billing.resilience.core.failure.BusinessRuleException;
import com.example.billing.resilience.core.failure.ErrorClassifier;
import com.example.billing.resilience.core.failure.TransientDependencyException;
import com.example.billing.resilience.core.failure.TransientDependencyException.Reason;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.*;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

class CircuitBreakerTest {

  private MutableClock clock;
  private AtomicInteger invocations;
  private CircuitBreaker breaker;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
    invocations = new AtomicInteger();
    breaker =
        CircuitBreaker.builder()
            .name("stripe")
            .failureThreshold(2)
            .recoveryTimeout(Duration.ofSeconds(30))
            .expectedError(TransientDependencyException.class)
            .clock(clock)
            .build();
  }

  private Mono<String> failing() {
    return Mono.defer(
        () -> {
          invocations.incrementAndGet();
          return Mono.error(
              new TransientDependencyException("stripe", Reason.UNAVAILABLE, "503 from stripe"));
        });
  }

  private Mono<String> succeeding() {
    return Mono.fromSupplier(
        () -> {
          invocations.incrementAndGet();
          return "ok";
        });
  }

  private void failOnce() {
    assertThrows(TransientDependencyException.class, () -> breaker.call(this::failing).block());
  }

  private String succeedOnce() {
    return breaker.call(this::succeeding).block();
  }

  private void trip() {
    failOnce();
    failOnce();
  }

  @Nested
  @DisplayName("CLOSED")
  class Closed {

    @Test
    @DisplayName("Passes successful calls through")
    void shouldPassSuccess() {
      assertEquals("ok", succeedOnce());
      assertEquals(CircuitState.CLOSED, breaker.state());
      assertEquals(0, breaker.failureCount());
    }

    @Test
    @DisplayName("Two consecutive matching failures open the circuit")
    void shouldOpenAtThreshold() {
      failOnce();
      assertEquals(CircuitState.CLOSED, breaker.state());
      assertEquals(1, breaker.failureCount());

      failOnce();
      assertEquals(CircuitState.OPEN, breaker.state());
      assertEquals(2, breaker.failureCount());
      assertEquals(clock.instant(), breaker.lastFailureTime().orElseThrow());
    }

    @Test
    @DisplayName("Non-matching errors propagate without touching the counters")
    void shouldIgnoreUnexpectedErrors() {
      for (var i = 0; i < 5; i++) {
        assertThrows(
            BusinessRuleException.class,
            () ->
                breaker
                    .call(() -> Mono.error(new BusinessRuleException("currency", "unsupported")))
                    .block());
      }

      assertEquals(CircuitState.CLOSED, breaker.state());
      assertEquals(0, breaker.failureCount());
      assertTrue(breaker.lastFailureTime().isEmpty());
    }

    @Test
    @DisplayName("A success in CLOSED does not reset the failure count")
    void shouldKeepCountAcrossClosedSuccess() {
      failOnce();
      succeedOnce();

      assertEquals(1, breaker.failureCount());
      failOnce();
      assertEquals(CircuitState.OPEN, breaker.state());
    }

    @Test
    @DisplayName("The state is checked at subscription, not when call() is invoked")
    void shouldCheckStateLazily() {
      final var pending = breaker.call(() -> succeeding());
      trip();

      assertThrows(CircuitOpenException.class, pending::block);
    }
  }

  @Nested
  @DisplayName("OPEN")
  class Open {

    @Test
    @DisplayName("Rejects calls before the recovery timeout without invoking the operation")
    void shouldRejectWhileOpen() {
      trip();
      invocations.set(0);
      clock.advance(Duration.ofSeconds(10));

      final var rejected =
          assertThrows(
              CircuitOpenException.class,
              () -> succeedOnce());

      assertEquals(0, invocations.get());
      assertEquals(CircuitOpenException.CODE, rejected.code());
      assertEquals("stripe", rejected.circuitName());
      assertEquals(CircuitState.OPEN, rejected.state());
      assertEquals(Duration.ofSeconds(20), rejected.retryAfter());
      assertNull(rejected.getCause());
      assertTrue(rejected.recoveryHint().contains("20s"));
    }

    @Test
    @DisplayName("Lets one trial call through once the recovery timeout has elapsed")
    void shouldAllowTrialAfterTimeout() {
      trip();
      clock.advance(Duration.ofSeconds(30));

      assertEquals("ok", succeedOnce());
      assertEquals(CircuitState.CLOSED, breaker.state());
      assertEquals(0, breaker.failureCount());
      assertTrue(breaker.lastFailureTime().isEmpty());
    }
  }

  @Nested
  @DisplayName("HALF_OPEN")
  class HalfOpen {

    @Test
    @DisplayName("A failing trial returns the circuit to OPEN for another full timeout")
    void shouldReopenOnFailedTrial() {
      trip();
      clock.advance(Duration.ofSeconds(31));

      failOnce();
      assertEquals(CircuitState.OPEN, breaker.state());
      assertEquals(3, breaker.failureCount());

      clock.advance(Duration.ofSeconds(29));
      assertThrows(CircuitOpenException.class, () -> succeedOnce());
    }

    @Test
    @DisplayName("Rejects calls arriving while the trial is in flight")
    void shouldAllowSingleTrial() {
      trip();
      clock.advance(Duration.ofSeconds(30));
      final Sinks.One<String> gateway = Sinks.one();

      final var trial = breaker.call(gateway::asMono).toFuture();
      assertEquals(CircuitState.HALF_OPEN, breaker.state());

      final var concurrent =
          assertThrows(
              CircuitOpenException.class,
              () -> succeedOnce());
      assertEquals(CircuitState.HALF_OPEN, concurrent.state());
      assertEquals(Duration.ZERO, concurrent.retryAfter());

      gateway.tryEmitValue("settled");
      assertEquals("settled", trial.join());
      assertEquals(CircuitState.CLOSED, breaker.state());
    }

    @Test
    @DisplayName("A trial failing with a non-matching error frees the trial slot")
    void shouldReleaseTrialOnUnexpectedError() {
      trip();
      clock.advance(Duration.ofSeconds(30));

      assertThrows(
          BusinessRuleException.class,
          () ->
              breaker
                  .call(() -> Mono.error(new BusinessRuleException("amount", "too large")))
                  .block());
      assertEquals(CircuitState.HALF_OPEN, breaker.state());

      assertEquals("ok", succeedOnce());
      assertEquals(CircuitState.CLOSED, breaker.state());
    }

    @Test
    @DisplayName("A cancelled trial frees the trial slot")
    void shouldReleaseTrialOnCancel() {
      trip();
      clock.advance(Duration.ofSeconds(30));

      breaker.call(Mono::<String>never).subscribe().dispose();

      assertEquals("ok", succeedOnce());
    }
  }

  @Nested
  @DisplayName("Configuration")
  class Configuration {

    @Test
    @DisplayName("reset() forces CLOSED and clears the counters")
    void shouldReset() {
      trip();

      breaker.reset();

      assertEquals(CircuitState.CLOSED, breaker.state());
      assertEquals(0, breaker.failureCount());
      assertEquals("ok", succeedOnce());
    }

    @Test
    @DisplayName("Defaults count every error, open after 5 and wait 60 seconds")
    void shouldExposeDefaults() {
      final var defaults = CircuitBreaker.builder().build();

      assertEquals("default", defaults.name());
      assertEquals(5, defaults.failureThreshold());
      assertEquals(Duration.ofSeconds(60), defaults.recoveryTimeout());
      for (var i = 0; i < 5; i++) {
        assertThrows(
            IllegalStateException.class,
            () -> defaults.call(() -> Mono.error(new IllegalStateException("x"))).block());
      }
      assertEquals(CircuitState.OPEN, defaults.state());
    }

    @Test
    @DisplayName("Rejects a non-positive threshold or timeout")
    void shouldValidate() {
      assertThrows(
          IllegalArgumentException.class,
          () -> CircuitBreaker.builder().failureThreshold(0).build());
      assertThrows(
          IllegalArgumentException.class,
          () -> CircuitBreaker.builder().recoveryTimeout(Duration.ZERO).build());
      assertThrows(
          IllegalArgumentException.class,
          () -> CircuitBreaker.builder().recoveryTimeout(Duration.ofSeconds(-1)).build());
    }

    @Test
    @DisplayName("Custom classifiers decide which errors are counted")
    void shouldUseClassifier() {
      final var onlyTimeouts =
          CircuitBreaker.builder()
              .failureThreshold(1)
              .expectedError(
                  ErrorClassifier.custom(
                      e -> e.getMessage() != null && e.getMessage().contains("timeout")))
              .clock(clock)
              .build();

      assertThrows(
          IllegalStateException.class,
          () ->
              onlyTimeouts
                  .call(() -> Mono.error(new IllegalStateException("declined")))
                  .block());
      assertEquals(CircuitState.CLOSED, onlyTimeouts.state());

      assertThrows(
          IllegalStateException.class,
          () ->
              onlyTimeouts
                  .call(() -> Mono.error(new IllegalStateException("read timeout")))
                  .block());
      assertEquals(CircuitState.OPEN, onlyTimeouts.state());
    }
  }
}
