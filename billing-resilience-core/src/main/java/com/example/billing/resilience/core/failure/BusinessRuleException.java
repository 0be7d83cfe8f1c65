package com.example.billing.resilience.core.failure;

/**
 * Validation or business-rule violation. Never retried and never counted by a circuit breaker
 * configured with the default classifiers.
 */
public class BusinessRuleException extends RuntimeException {

  private final String rule;

  public BusinessRuleException(final String rule, final String message) {
    super(message);
    this.rule = rule;
  }

  /** Identifier of the violated rule, e.g. {@code amount.positive}. */
  public String rule() {
    return rule;
  }
}
