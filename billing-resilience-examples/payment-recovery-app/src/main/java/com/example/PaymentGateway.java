package com.example;

import reactor.core.publisher.Mono;

/** External payment processor. */
public interface PaymentGateway {

  /**
   * Charges the payment.
   *
   * <p>Fails with {@link com.example.billing.resilience.core.failure.TransientDependencyException}
   * when the processor is unreachable or throttling, and with {@link
   * com.example.billing.resilience.core.failure.BusinessRuleException} when the payment is
   * rejected.
   *
   * @param request payment to charge
   * @return the charge result
   */
  Mono<PaymentResult> charge(PaymentRequest request);
}
