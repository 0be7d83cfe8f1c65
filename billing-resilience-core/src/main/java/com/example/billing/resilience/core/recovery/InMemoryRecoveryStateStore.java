package com.example.billing.resilience.core.recovery;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link RecoveryStateStore} keeping each state as a JSON document, the same form a
 * persistent store would hold. Nothing survives a restart, and entries are only removed by {@link
 * #remove(String)} or {@link #clear()}.
 */
public final class InMemoryRecoveryStateStore implements RecoveryStateStore {

  private final ConcurrentHashMap<String, String> documents = new ConcurrentHashMap<>();
  private final RecoveryStateCodec codec;

  public InMemoryRecoveryStateStore() {
    this(new RecoveryStateCodec());
  }

  public InMemoryRecoveryStateStore(final RecoveryStateCodec codec) {
    this.codec = codec;
  }

  @Override
  public void save(final RecoveryState state) {
    documents.put(state.stateKey(), codec.toJson(state));
  }

  @Override
  public Optional<RecoveryState> find(final String stateKey) {
    return Optional.ofNullable(documents.get(stateKey)).map(codec::fromJson);
  }

  /** Raw JSON documents by state key, sorted. */
  public Map<String, String> documents() {
    return new TreeMap<>(documents);
  }

  /**
   * Drops the state saved under the key.
   *
   * @param stateKey state key
   * @return true if a state was removed
   */
  public boolean remove(final String stateKey) {
    return documents.remove(stateKey) != null;
  }

  public int size() {
    return documents.size();
  }

  public void clear() {
    documents.clear();
  }
}
