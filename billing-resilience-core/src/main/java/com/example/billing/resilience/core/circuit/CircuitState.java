package com.example.billing.resilience.core.circuit;

/** States of a {@link CircuitBreaker}. */
public enum CircuitState {
  /** Calls flow through; matching failures are counted. */
  CLOSED,
  /** Calls are rejected without reaching the dependency. */
  OPEN,
  /** One trial call is let through to probe the dependency. */
  HALF_OPEN
}
