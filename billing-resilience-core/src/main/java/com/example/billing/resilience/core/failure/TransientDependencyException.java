package com.example.billing.resilience.core.failure;

import java.util.Objects;
import java.util.Optional;

/**
 * Transient failure of an external dependency (payment gateway, webhook target). Classified as
 * retryable by {@link ErrorClassifier#transientDefaults()}.
 */
public class TransientDependencyException extends RuntimeException {

  /** What went wrong on the wire. */
  public enum Reason {
    NETWORK,
    TIMEOUT,
    RATE_LIMITED,
    UNAVAILABLE;

    /**
     * Maps an HTTP response status to a transient reason.
     *
     * <ul>
     *   <li>408, 504: {@link #TIMEOUT}
     *   <li>429: {@link #RATE_LIMITED}
     *   <li>502, 503: {@link #UNAVAILABLE}
     * </ul>
     *
     * @param status HTTP status code
     * @return the reason, or empty for a status that is not transient
     */
    public static Optional<Reason> forHttpStatus(final int status) {
      switch (status) {
        case 408:
        case 504:
          return Optional.of(TIMEOUT);
        case 429:
          return Optional.of(RATE_LIMITED);
        case 502:
        case 503:
          return Optional.of(UNAVAILABLE);
        default:
          return Optional.empty();
      }
    }
  }

  private final String dependency;
  private final Reason reason;

  public TransientDependencyException(
      final String dependency, final Reason reason, final String message) {
    this(dependency, reason, message, null);
  }

  public TransientDependencyException(
      final String dependency, final Reason reason, final String message, final Throwable cause) {
    super(message, cause);
    this.dependency = Objects.requireNonNull(dependency, "dependency");
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public String dependency() {
    return dependency;
  }

  public Reason reason() {
    return reason;
  }
}
