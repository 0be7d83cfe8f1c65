package com.example.billing.resilience.core.recovery;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of a {@link RecoveryContext}, as logged and saved on exit.
 *
 * @param stateKey key identifying the logical operation
 * @param startedAt when the context was entered
 * @param completedAt when it exited, null while still open
 * @param success true iff the scope exited without error, null while still open
 * @param error message of the error the scope exited with, null otherwise
 * @param attempts primary/fallback outcomes in the order they happened
 */
public record RecoveryState(
    String stateKey,
    Instant startedAt,
    Instant completedAt,
    Boolean success,
    String error,
    List<RecoveryAttempt> attempts) {

  public RecoveryState {
    attempts = attempts == null ? List.of() : List.copyOf(attempts);
  }

  /** Number of recorded attempts. */
  public int attemptCount() {
    return attempts.size();
  }

  /** Whether the context has exited. */
  public boolean completed() {
    return completedAt != null;
  }
}
