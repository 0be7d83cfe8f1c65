package com.example.billing.resilience.core.failure;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Pluggable classification of errors, used by the retry executor to decide which errors are
 * retryable and by the circuit breaker to decide which errors count as dependency failures.
 *
 * <h2>Using the Defaults</h2>
 *
 * <pre>{@code
 * final var classifier = ErrorClassifier.transientDefaults();
 * if (classifier.matches(error)) {
 *     // network failure, gateway timeout, rate limiting...
 * }
 * }</pre>
 *
 * <h2>Classifying by Type</h2>
 *
 * <pre>{@code
 * var gatewayErrors = ErrorClassifier.ofTypes(StripeConnectionException.class,
 *     StripeRateLimitException.class);
 * }</pre>
 *
 * <h2>Combining Classifiers</h2>
 *
 * <pre>{@code
 * var combined = ErrorClassifier.transientDefaults()
 *     .or(ErrorClassifier.custom(e -> String.valueOf(e.getMessage()).contains("EAI_AGAIN")))
 *     .and(ErrorClassifier.ofTypes(BusinessRuleException.class).negate());
 * }</pre>
 */
@FunctionalInterface
public interface ErrorClassifier {

  /**
   * Determines whether the error belongs to this classification.
   *
   * @param error the error to check, may be null
   * @return true if the error matches
   */
  boolean matches(Throwable error);

  /**
   * Returns the default taxonomy for transient dependency failures.
   *
   * <p>Matches, anywhere in the cause chain:
   *
   * <ul>
   *   <li>{@link TransientDependencyException}
   *   <li>{@link IOException} and {@link TimeoutException}
   *   <li>Message keywords (case-insensitive): connection refused, connection reset, timed out,
   *       timeout, rate limit, too many requests, service unavailable, bad gateway, broken pipe
   * </ul>
   *
   * <p>HTTP status codes are not read from messages. Map a status to a {@link
   * TransientDependencyException} with {@link TransientDependencyException.Reason#forHttpStatus}.
   *
   * <p>A {@link BusinessRuleException} never matches, whatever its message says. The message of an
   * {@link IllegalArgumentException} or {@link IllegalStateException} is never searched for
   * keywords, since those carry validation failures.
   *
   * @return default transient classifier
   */
  static ErrorClassifier transientDefaults() {
    return Classifications::isTransient;
  }

  /**
   * Matches errors that are instances of any of the given types, anywhere in the cause chain.
   *
   * @param types the error kinds to match
   * @return type-based classifier
   */
  @SafeVarargs
  static ErrorClassifier ofTypes(final Class<? extends Throwable>... types) {
    final var kinds = List.of(types);
    return error ->
        Classifications.anyInChain(error, e -> kinds.stream().anyMatch(k -> k.isInstance(e)));
  }

  /**
   * Creates a classifier from a predicate applied to the top-level error only.
   *
   * @param predicate the predicate to use
   * @return custom classifier
   */
  static ErrorClassifier custom(final Predicate<Throwable> predicate) {
    return error -> error != null && predicate.test(error);
  }

  /** Matches every non-null error. */
  static ErrorClassifier always() {
    return error -> error != null;
  }

  /** Matches nothing. */
  static ErrorClassifier never() {
    return error -> false;
  }

  /**
   * Combines this classifier with another using OR logic.
   *
   * @param other the other classifier
   * @return combined classifier
   */
  default ErrorClassifier or(final ErrorClassifier other) {
    return e -> this.matches(e) || other.matches(e);
  }

  /**
   * Combines this classifier with another using AND logic.
   *
   * @param other the other classifier
   * @return combined classifier
   */
  default ErrorClassifier and(final ErrorClassifier other) {
    return e -> this.matches(e) && other.matches(e);
  }

  /** Returns a classifier matching exactly the non-null errors this one rejects. */
  default ErrorClassifier negate() {
    return e -> e != null && !this.matches(e);
  }

  /** Heuristics backing {@link #transientDefaults()}. */
  final class Classifications {

    private static final String[] TRANSIENT_KEYWORDS =
        new String[] {
          "connection refused",
          "connection reset",
          "timed out",
          "timeout",
          "rate limit",
          "too many requests",
          "service unavailable",
          "bad gateway",
          "broken pipe"
        };

    private Classifications() {}

    static boolean isTransient(final Throwable error) {
      if (error == null) return false;
      if (anyInChain(error, BusinessRuleException.class::isInstance)) return false;

      return anyInChain(
          error,
          e ->
              e instanceof TransientDependencyException
                  || e instanceof IOException
                  || e instanceof TimeoutException
                  || hasTransientKeyword(e));
    }

    static boolean anyInChain(final Throwable error, final Predicate<Throwable> predicate) {
      Throwable cur = error;
      var depth = 0;
      while (cur != null && depth++ < 32) {
        if (predicate.test(cur)) return true;
        if (cur.getCause() == cur) break;
        cur = cur.getCause();
      }
      return false;
    }

    private static boolean hasTransientKeyword(final Throwable e) {
      if (e instanceof IllegalArgumentException || e instanceof IllegalStateException) {
        return false;
      }
      final var msg = e.getMessage();
      if (msg == null) return false;
      final var lower = msg.toLowerCase(Locale.ROOT);
      for (final var keyword : TRANSIENT_KEYWORDS) if (lower.contains(keyword)) return true;
      return false;
    }
  }
}
