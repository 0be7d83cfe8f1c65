package com.example.billing.resilience.core.retry;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.*;

class RetryStrategyTest {

  @Nested
  @DisplayName("ExponentialBackoff")
  class Exponential {

    @Test
    @DisplayName("Without jitter the delay is min(base * 2^attempt, max) exactly")
    void shouldDoubleUntilCapped() {
      final var backoff =
          new ExponentialBackoff(Duration.ofMillis(100), Duration.ofSeconds(1), false);

      assertEquals(Duration.ofMillis(100), backoff.getDelay(0));
      assertEquals(Duration.ofMillis(200), backoff.getDelay(1));
      assertEquals(Duration.ofMillis(400), backoff.getDelay(2));
      assertEquals(Duration.ofMillis(800), backoff.getDelay(3));
      assertEquals(Duration.ofSeconds(1), backoff.getDelay(4));
      assertEquals(Duration.ofSeconds(1), backoff.getDelay(10));
    }

    @Test
    @DisplayName("Very large attempt numbers saturate at the maximum delay")
    void shouldSaturateOnOverflow() {
      final var backoff =
          new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(30), false);

      assertEquals(Duration.ofSeconds(30), backoff.getDelay(62));
      assertEquals(Duration.ofSeconds(30), backoff.getDelay(63));
      assertEquals(Duration.ofSeconds(30), backoff.getDelay(Integer.MAX_VALUE));
    }

    @Test
    @DisplayName("Jitter stays within [0.5, 1.5) of the nominal delay")
    void shouldKeepJitterInBand() {
      final var backoff = new ExponentialBackoff(Duration.ofMillis(10), Duration.ofSeconds(1));

      for (var attempt = 0; attempt < 12; attempt++) {
        final var nominal = Math.min(10L << attempt, 1000L) * 1_000_000L;
        for (var i = 0; i < 50; i++) {
          final var nanos = backoff.getDelay(attempt).toNanos();
          assertTrue(nanos >= nominal / 2, "attempt " + attempt + " gave " + nanos);
          assertTrue(nanos < nominal + nominal / 2, "attempt " + attempt + " gave " + nanos);
        }
      }
    }

    @Test
    @DisplayName("The exponential factory builds a jittered backoff")
    void shouldBuildJitteredBackoffFromFactory() {
      final var strategy = RetryStrategy.exponential(Duration.ofMillis(100), Duration.ofSeconds(5));

      final var backoff = assertInstanceOf(ExponentialBackoff.class, strategy);
      assertTrue(backoff.jitter());
      assertEquals(Duration.ofMillis(100), backoff.baseDelay());
      assertEquals(Duration.ofSeconds(5), backoff.maxDelay());
      final var nanos = strategy.getDelay(2).toNanos();
      assertTrue(nanos >= 200_000_000L && nanos < 600_000_000L, "gave " + nanos);
    }

    @Test
    @DisplayName("Injected random source gives exact jittered delays")
    void shouldUseInjectedRandomSource() {
      final var base = Duration.ofMillis(100);
      final var max = Duration.ofSeconds(1);
      final var low = new ExponentialBackoff(base, max, true, () -> 0.0);
      final var mid = new ExponentialBackoff(base, max, true, () -> 0.5);
      final var high = new ExponentialBackoff(base, max, true, () -> 0.75);

      assertEquals(Duration.ofMillis(100), low.getDelay(1));
      assertEquals(Duration.ofMillis(200), mid.getDelay(1));
      assertEquals(Duration.ofMillis(250), high.getDelay(1));
    }

    @Test
    @DisplayName("Random source is not consulted when jitter is off")
    void shouldNotDrawWithoutJitter() {
      final var draws = new AtomicInteger();
      final var backoff =
          new ExponentialBackoff(
              Duration.ofMillis(5),
              Duration.ofMillis(50),
              false,
              () -> {
                draws.incrementAndGet();
                return 0.3;
              });

      backoff.getDelay(3);

      assertEquals(0, draws.get());
    }

    @Test
    @DisplayName("Rejects negative attempts and inconsistent bounds")
    void shouldValidateArguments() {
      final var backoff = new ExponentialBackoff(Duration.ofMillis(1), Duration.ofMillis(2));

      assertThrows(IllegalArgumentException.class, () -> backoff.getDelay(-1));
      assertThrows(
          IllegalArgumentException.class,
          () -> new ExponentialBackoff(Duration.ofMillis(-1), Duration.ofMillis(2)));
      assertThrows(
          IllegalArgumentException.class,
          () -> new ExponentialBackoff(Duration.ofSeconds(2), Duration.ofSeconds(1)));
    }
  }

  @Nested
  @DisplayName("LinearBackoff")
  class Linear {

    @Test
    @DisplayName("Delay is delay + attempt * increment exactly")
    void shouldGrowLinearly() {
      final var backoff = new LinearBackoff(Duration.ofMillis(250), Duration.ofMillis(100));

      for (var attempt = 0; attempt < 20; attempt++) {
        assertEquals(Duration.ofMillis(250 + attempt * 100L), backoff.getDelay(attempt));
      }
    }

    @Test
    @DisplayName("Zero increment gives a fixed delay")
    void shouldSupportFixedDelay() {
      final var backoff = RetryStrategy.linear(Duration.ofSeconds(2), Duration.ZERO);

      assertEquals(Duration.ofSeconds(2), backoff.getDelay(0));
      assertEquals(Duration.ofSeconds(2), backoff.getDelay(7));
    }

    @Test
    @DisplayName("Rejects negative values")
    void shouldValidateArguments() {
      assertThrows(
          IllegalArgumentException.class,
          () -> new LinearBackoff(Duration.ofMillis(-1), Duration.ZERO));
      assertThrows(
          IllegalArgumentException.class,
          () -> new LinearBackoff(Duration.ZERO, Duration.ofMillis(-1)));
      assertThrows(
          IllegalArgumentException.class,
          () -> new LinearBackoff(Duration.ZERO, Duration.ZERO).getDelay(-1));
    }
  }
}
