package com.example;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.example.billing.resilience.core.circuit.CircuitState;
import com.example.billing.resilience.core.config.ResilienceSettings;
import com.example.billing.resilience.core.failure.BusinessRuleException;
import com.example.billing.resilience.core.failure.RetriesExhaustedException;
import com.example.billing.resilience.core.failure.TransientDependencyException;
import com.example.billing.resilience.core.failure.TransientDependencyException.Reason;
import com.example.billing.resilience.core.idempotency.IdempotencyManager;
import com.example.billing.resilience.core.recovery.InMemoryRecoveryStateStore;
import com.example.billing.resilience.core.recovery.RecoveryAttempt.Leg;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.*;
import reactor.core.publisher.Mono;

class PaymentRecoveryServiceTest {

  private static final PaymentRequest PAYMENT =
      new PaymentRequest("pay_1", "cus_1", 1_000L, "EUR");

  private final ResilienceSettings settings =
      new ResilienceSettings(
          3,
          Duration.ofMillis(1),
          Duration.ofMillis(5),
          false,
          2,
          Duration.ofMinutes(1),
          Duration.ofHours(1));

  private PaymentGateway gateway;
  private AuditLog auditLog;
  private InMemoryRecoveryStateStore stateStore;
  private PaymentRecoveryService service;

  @BeforeEach
  void setUp() {
    gateway = mock(PaymentGateway.class);
    auditLog = mock(AuditLog.class);
    when(auditLog.record(anyString(), anyString(), anyMap())).thenReturn(Mono.empty());
    stateStore = new InMemoryRecoveryStateStore();
    service =
        new PaymentRecoveryService(
            gateway, settings, new IdempotencyManager(Duration.ofHours(1)), stateStore, auditLog);
  }

  private static Mono<PaymentResult> timeout() {
    return Mono.error(
        new TransientDependencyException("payment_gateway", Reason.TIMEOUT, "Gateway timed out"));
  }

  @Nested
  @DisplayName("retryFailedPaymentWithRecovery")
  class RetryFailedPayment {

    @Test
    @DisplayName("Succeeds after transient failures and saves a successful recovery state")
    void shouldRecoverAfterTransientFailures() {
      when(gateway.charge(PAYMENT))
          .thenReturn(timeout(), timeout(), Mono.just(PaymentResult.succeeded("pay_1", "ch_9")));

      final var result = service.retryFailedPaymentWithRecovery(PAYMENT).block();

      assertEquals(PaymentResult.Status.SUCCEEDED, result.status());
      assertEquals("ch_9", result.reference());
      verify(gateway, times(3)).charge(PAYMENT);
      verify(auditLog, times(2)).record(eq("payment.retry.attempt"), anyString(), anyMap());
      verify(auditLog).record(eq("payment.retry.success"), eq("pay_1"), anyMap());

      final var state = service.recoveryState("pay_1").orElseThrow();
      assertEquals(Boolean.TRUE, state.success());
      assertEquals(1, state.attemptCount());
    }

    @Test
    @DisplayName("Queues the payment for manual review when retries are exhausted")
    void shouldFallBackToManualReview() {
      when(gateway.charge(PAYMENT)).thenReturn(timeout());

      final var result = service.retryFailedPaymentWithRecovery(PAYMENT).block();

      assertEquals(PaymentResult.Status.PENDING_REVIEW, result.status());
      verify(gateway, times(3)).charge(PAYMENT);
      verify(auditLog).record(eq("payment.retry.manual_review"), eq("pay_1"), anyMap());

      final var state = service.recoveryState("pay_1").orElseThrow();
      assertEquals(2, state.attemptCount());
      assertEquals(Leg.PRIMARY, state.attempts().get(0).leg());
      assertEquals(RetriesExhaustedException.class.getName(), state.attempts().get(0).errorType());
      assertTrue(state.attempts().get(1).success());
    }

    @Test
    @DisplayName("Does not retry a rejected payment")
    void shouldNotRetryBusinessRuleFailure() {
      when(gateway.charge(PAYMENT))
          .thenReturn(Mono.error(new BusinessRuleException("card.declined", "Card declined")));

      final var result = service.retryFailedPaymentWithRecovery(PAYMENT).block();

      assertEquals(PaymentResult.Status.PENDING_REVIEW, result.status());
      verify(gateway, times(1)).charge(PAYMENT);
      assertEquals(
          BusinessRuleException.class.getName(),
          service.recoveryState("pay_1").orElseThrow().attempts().get(0).errorType());
    }

    @Test
    @DisplayName("Skips the gateway while its circuit is open")
    void shouldSkipGatewayWhenOpen() {
      when(gateway.charge(any())).thenReturn(timeout());
      service.retryFailedPaymentWithRecovery(PAYMENT).block();
      service.retryFailedPaymentWithRecovery(PAYMENT).block();
      assertEquals(
          CircuitState.OPEN,
          service.breakers().find(PaymentRecoveryService.GATEWAY).orElseThrow().state());
      clearInvocations(gateway);

      final var result = service.retryFailedPaymentWithRecovery(PAYMENT).block();

      assertEquals(PaymentResult.Status.PENDING_REVIEW, result.status());
      verifyNoInteractions(gateway);
    }
  }

  @Nested
  @DisplayName("executeWithIdempotency")
  class ExecuteWithIdempotency {

    @Test
    @DisplayName("Runs the operation once per key and audits every execution")
    void shouldRunOncePerKey() {
      final var runs = new AtomicInteger();

      final var first =
          service
              .executeWithIdempotency(
                  "refund:77", "refund", () -> Mono.fromSupplier(runs::incrementAndGet))
              .block();
      final var second =
          service
              .executeWithIdempotency(
                  "refund:77", "refund", () -> Mono.fromSupplier(runs::incrementAndGet))
              .block();

      assertEquals(1, first);
      assertEquals(1, second);
      assertEquals(1, runs.get());
      verify(auditLog, times(2)).record(eq("refund.idempotent"), eq("refund:77"), anyMap());
    }

    @Test
    @DisplayName("Charges through the gateway once per idempotency key")
    void shouldChargeOncePerKey() {
      when(gateway.charge(PAYMENT))
          .thenReturn(timeout(), Mono.just(PaymentResult.succeeded("pay_1", "ch_1")));

      final var first = service.chargeIdempotently("req-1", PAYMENT).block();
      final var second = service.chargeIdempotently("req-1", PAYMENT).block();

      assertEquals(first, second);
      verify(gateway, times(2)).charge(PAYMENT);
    }
  }

  @Test
  @DisplayName("Simulated gateway times out the configured number of times, then succeeds")
  void simulatedGatewayRecovers() {
    final var simulated = new SimulatedPaymentGateway(1, Duration.ZERO);

    assertThrows(TransientDependencyException.class, () -> simulated.charge(PAYMENT).block());
    assertEquals(PaymentResult.Status.SUCCEEDED, simulated.charge(PAYMENT).block().status());
    assertThrows(
        BusinessRuleException.class,
        () -> simulated.charge(new PaymentRequest("pay_2", "cus_1", 0L, "EUR")).block());
    assertEquals(3, simulated.charges());
  }
}
