package com.example;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.billing.resilience.core.failure.BusinessRuleException;
import com.example.billing.resilience.core.failure.TransientDependencyException;
import com.example.billing.resilience.core.failure.TransientDependencyException.Reason;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import reactor.core.publisher.Mono;

/**
 * In-process gateway that times out on its first {@code transientFailures} charges, then
 * succeeds. Non-positive amounts are rejected.
 */
public class SimulatedPaymentGateway implements PaymentGateway {

  private static final System.Logger LOGGER =
      System.getLogger(SimulatedPaymentGateway.class.getName());

  private final AtomicInteger remainingFailures;
  private final AtomicInteger charges = new AtomicInteger();
  private final Duration latency;

  public SimulatedPaymentGateway(final int transientFailures, final Duration latency) {
    this.remainingFailures = new AtomicInteger(transientFailures);
    this.latency = latency;
  }

  @Override
  public Mono<PaymentResult> charge(final PaymentRequest request) {
    return Mono.delay(latency)
        .flatMap(
            tick -> {
              final var attempt = charges.incrementAndGet();
              if (request.amountCents() <= 0) {
                return Mono.error(
                    new BusinessRuleException(
                        "amount.positive", "Payment amount must be positive: " + request));
              }
              if (remainingFailures.getAndDecrement() > 0) {
                LOGGER.log(
                    DEBUG, "Simulated gateway timeout on charge {0}", String.valueOf(attempt));
                return Mono.error(
                    new TransientDependencyException(
                        "payment_gateway", Reason.TIMEOUT, "Gateway timed out"));
              }
              return Mono.just(PaymentResult.succeeded(request.paymentId(), "ch_" + attempt));
            });
  }

  /** Number of charges received so far, failed ones included. */
  public int charges() {
    return charges.get();
  }
}
