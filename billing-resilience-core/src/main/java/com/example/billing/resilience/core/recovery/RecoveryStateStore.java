package com.example.billing.resilience.core.recovery;

import java.util.Optional;

/**
 * Where a {@link RecoveryContext} created with {@code saveState = true} saves its final state.
 *
 * <p>The toolkit ships the process-local {@link InMemoryRecoveryStateStore} and the {@link
 * #discarding()} store that contexts use unless given one. A host that needs recovery state to
 * survive a restart implements this interface over its own database.
 */
public interface RecoveryStateStore {

  /**
   * Saves (or replaces) the state stored under {@link RecoveryState#stateKey()}.
   *
   * @param state state to save
   */
  void save(RecoveryState state);

  /**
   * Loads the last state saved under the key.
   *
   * @param stateKey state key
   * @return the state, or empty
   */
  Optional<RecoveryState> find(String stateKey);

  /**
   * Returns a store that keeps nothing. The outcome of each scope is still logged by the context.
   *
   * @return discarding store
   */
  static RecoveryStateStore discarding() {
    return DiscardingStore.INSTANCE;
  }
}

enum DiscardingStore implements RecoveryStateStore {
  INSTANCE;

  @Override
  public void save(final RecoveryState state) {}

  @Override
  public Optional<RecoveryState> find(final String stateKey) {
    return Optional.empty();
  }
}
