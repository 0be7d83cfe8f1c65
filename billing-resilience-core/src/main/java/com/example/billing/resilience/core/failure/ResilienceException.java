package com.example.billing.resilience.core.failure;

/**
 * Base type for the errors raised by the toolkit itself, as opposed to errors raised by the
 * protected operations, which always propagate unchanged.
 *
 * <p>Every subtype carries a machine-readable {@link #code()} so that upstream code (an HTTP
 * layer, a job scheduler) can map the failure without parsing messages.
 */
public abstract class ResilienceException extends RuntimeException {

  private final String code;

  protected ResilienceException(final String code, final String message, final Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  /**
   * Returns the machine-readable error code, e.g. {@code CIRCUIT_OPEN}.
   *
   * @return error code, never null
   */
  public String code() {
    return code;
  }
}
