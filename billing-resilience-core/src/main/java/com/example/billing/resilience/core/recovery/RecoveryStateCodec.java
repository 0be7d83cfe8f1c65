package com.example.billing.resilience.core.recovery;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * JSON form of {@link RecoveryState}, used by {@link InMemoryRecoveryStateStore} and by hosts
 * that persist recovery state in their own store. Timestamps are ISO-8601 strings.
 */
public final class RecoveryStateCodec {

  private final Supplier<ObjectMapper> mapperSupplier;

  public RecoveryStateCodec() {
    this(RecoveryStateCodec::defaultMapper);
  }

  /**
   * Creates a codec using the given mapper.
   *
   * @param mapperSupplier supplier of the {@link ObjectMapper}; it must handle {@code java.time}
   */
  public RecoveryStateCodec(final Supplier<ObjectMapper> mapperSupplier) {
    this.mapperSupplier = Objects.requireNonNull(mapperSupplier, "mapperSupplier");
  }

  /** Mapper with the Java time module, ISO timestamps and lenient reading of unknown fields. */
  public static ObjectMapper defaultMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  /**
   * Serializes the state.
   *
   * @param state state to write
   * @return JSON document
   * @throws RuntimeException if the state cannot be serialized
   */
  public String toJson(final RecoveryState state) {
    try {
      return mapperSupplier.get().writeValueAsString(state);
    } catch (final Exception exception) {
      throw new RuntimeException(
          "Failed to serialize recovery state " + state.stateKey(), exception);
    }
  }

  /**
   * Parses a state document.
   *
   * @param json JSON document
   * @return parsed state
   * @throws RuntimeException if the document cannot be parsed
   */
  public RecoveryState fromJson(final String json) {
    try {
      return mapperSupplier.get().readValue(json, RecoveryState.class);
    } catch (final Exception exception) {
      throw new RuntimeException("Failed to parse recovery state", exception);
    }
  }
}
