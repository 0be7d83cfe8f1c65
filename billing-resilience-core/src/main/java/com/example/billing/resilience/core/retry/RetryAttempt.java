package com.example.billing.resilience.core.retry;

import java.time.Duration;

/**
 * A failed attempt that is about to be retried.
 *
 * @param attempt zero-based index of the attempt that failed
 * @param error the retryable error it failed with
 * @param delay the delay chosen before the next attempt
 */
public record RetryAttempt(int attempt, Throwable error, Duration delay) {}
