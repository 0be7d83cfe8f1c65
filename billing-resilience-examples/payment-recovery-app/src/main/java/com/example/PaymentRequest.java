package com.example;

import java.util.Objects;

/**
 * A payment to submit to the gateway.
 *
 * @param paymentId billing system payment id
 * @param customerId paying customer
 * @param amountCents amount in minor units
 * @param currency ISO-4217 currency code
 */
public record PaymentRequest(
    String paymentId, String customerId, long amountCents, String currency) {

  public PaymentRequest {
    Objects.requireNonNull(paymentId, "paymentId");
    Objects.requireNonNull(customerId, "customerId");
    Objects.requireNonNull(currency, "currency");
  }
}
