package com.example;

import static java.lang.System.Logger.Level.INFO;

import com.example.billing.resilience.core.ResilientCall;
import com.example.billing.resilience.core.circuit.CircuitBreakerRegistry;
import com.example.billing.resilience.core.config.ResilienceSettings;
import com.example.billing.resilience.core.failure.ErrorClassifier;
import com.example.billing.resilience.core.idempotency.IdempotencyManager;
import com.example.billing.resilience.core.recovery.RecoveryContext;
import com.example.billing.resilience.core.recovery.RecoveryState;
import com.example.billing.resilience.core.recovery.RecoveryStateStore;
import com.example.billing.resilience.core.retry.ExponentialBackoff;
import com.example.billing.resilience.core.retry.RetryExecutor;
import com.example.billing.resilience.core.retry.RetryListener;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import reactor.core.publisher.Mono;

/**
 * Billing reconciliation flows built on the resilience toolkit.
 *
 * <ul>
 *   <li>{@link #retryFailedPaymentWithRecovery(PaymentRequest)} re-submits a failed payment
 *       through the gateway's circuit breaker with retries, inside a recovery context keyed by
 *       the payment id. If the gateway stays down the payment is queued for manual review.
 *   <li>{@link #executeWithIdempotency(String, String, Supplier)} runs any billing operation at
 *       most once per idempotency key while the key is cached.
 * </ul>
 */
public class PaymentRecoveryService {

  static final String GATEWAY = "payment_gateway";

  private static final System.Logger LOGGER =
      System.getLogger(PaymentRecoveryService.class.getName());

  private final PaymentGateway gateway;
  private final RetryExecutor retry;
  private final CircuitBreakerRegistry breakers;
  private final IdempotencyManager idempotency;
  private final RecoveryStateStore stateStore;
  private final AuditLog auditLog;

  /**
   * Creates the service.
   *
   * @param gateway payment processor
   * @param settings retry, breaker and cache settings
   * @param idempotency idempotency cache shared by every flow
   * @param stateStore where recovery contexts save their final state
   * @param auditLog audit sink
   */
  public PaymentRecoveryService(
      final PaymentGateway gateway,
      final ResilienceSettings settings,
      final IdempotencyManager idempotency,
      final RecoveryStateStore stateStore,
      final AuditLog auditLog) {
    this.gateway = gateway;
    this.breakers = new CircuitBreakerRegistry(settings::circuitBreaker);
    this.idempotency = idempotency;
    this.stateStore = stateStore;
    this.auditLog = auditLog;
    final var backoff =
        new ExponentialBackoff(settings.baseDelay(), settings.maxDelay(), settings.jitter());
    this.retry =
        RetryExecutor.builder()
            .maxAttempts(settings.maxAttempts())
            .strategy(backoff)
            .retryOn(ErrorClassifier.transientDefaults())
            .listener(
                RetryListener.logging()
                    .andThen(
                        RetryListener.deferred(
                            (attempt, error) ->
                                auditLog.record(
                                    "payment.retry.attempt",
                                    GATEWAY,
                                    Map.of(
                                        "attempt", String.valueOf(attempt),
                                        "error", String.valueOf(error.getMessage()))))))
            .build();
  }

  /**
   * Retries a failed payment, falling back to manual review if the gateway keeps failing or its
   * circuit is open. The recovery state is saved under {@code payment_retry_<paymentId>}.
   *
   * @param request payment to re-submit
   * @return the charge result, or a {@link PaymentResult.Status#PENDING_REVIEW} result
   */
  public Mono<PaymentResult> retryFailedPaymentWithRecovery(final PaymentRequest request) {
    final var call =
        ResilientCall.<PaymentResult>builder()
            .retry(retry)
            .circuitBreaker(breakers.breaker(GATEWAY))
            .fallback("manual_review", () -> queueForManualReview(request))
            .recovery(
                RecoveryContext.builder()
                    .saveState(true)
                    .stateKey(stateKey(request.paymentId()))
                    .store(stateStore))
            .build();

    return call.execute("gateway.charge", () -> gateway.charge(request))
        .flatMap(
            result ->
                auditLog
                    .record(
                        result.status() == PaymentResult.Status.SUCCEEDED
                            ? "payment.retry.success"
                            : "payment.retry.manual_review",
                        request.paymentId(),
                        Map.of("reference", result.reference()))
                    .thenReturn(result));
  }

  /**
   * Runs a billing operation at most once per idempotency key.
   *
   * @param idempotencyKey caller-supplied key of the request
   * @param operation operation name for auditing
   * @param work the operation
   * @param <T> result type
   * @return the first successful result under the key
   */
  public <T> Mono<T> executeWithIdempotency(
      final String idempotencyKey, final String operation, final Supplier<? extends Mono<T>> work) {
    return idempotency
        .ensureIdempotent(idempotencyKey, work)
        .flatMap(
            result ->
                auditLog
                    .record(
                        operation + ".idempotent",
                        idempotencyKey,
                        Map.of("operation", operation, "idempotency_key", idempotencyKey))
                    .thenReturn(result));
  }

  /**
   * Charges a payment with retries and the gateway breaker, at most once per idempotency key.
   *
   * @param idempotencyKey caller-supplied key of the request
   * @param request payment to charge
   * @return the charge result
   */
  public Mono<PaymentResult> chargeIdempotently(
      final String idempotencyKey, final PaymentRequest request) {
    final var call =
        ResilientCall.<PaymentResult>builder()
            .retry(retry)
            .circuitBreaker(breakers.breaker(GATEWAY))
            .build();
    return executeWithIdempotency(
        idempotencyKey,
        "payment.charge",
        () -> call.execute("gateway.charge", () -> gateway.charge(request)));
  }

  /** Last saved recovery state of a payment retry. */
  public Optional<RecoveryState> recoveryState(final String paymentId) {
    return stateStore.find(stateKey(paymentId));
  }

  CircuitBreakerRegistry breakers() {
    return breakers;
  }

  private Mono<PaymentResult> queueForManualReview(final PaymentRequest request) {
    return Mono.fromSupplier(
        () -> {
          LOGGER.log(INFO, "Queued payment {0} for manual review", request.paymentId());
          return PaymentResult.pendingReview(request.paymentId());
        });
  }

  private static String stateKey(final String paymentId) {
    return "payment_retry_" + paymentId;
  }
}
