package com.example;

/**
 * Outcome of a payment attempt.
 *
 * @param paymentId billing system payment id
 * @param status final status
 * @param reference gateway charge id, or the review ticket for {@link Status#PENDING_REVIEW}
 */
public record PaymentResult(String paymentId, Status status, String reference) {

  public enum Status {
    SUCCEEDED,
    PENDING_REVIEW
  }

  static PaymentResult succeeded(final String paymentId, final String chargeId) {
    return new PaymentResult(paymentId, Status.SUCCEEDED, chargeId);
  }

  static PaymentResult pendingReview(final String paymentId) {
    return new PaymentResult(paymentId, Status.PENDING_REVIEW, "review-" + paymentId);
  }
}
