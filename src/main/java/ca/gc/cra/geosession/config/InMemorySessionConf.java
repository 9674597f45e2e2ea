package ca.gc.cra.geosession.config;

import ca.gc.cra.geosession.application.port.SessionConf;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link SessionConf} backed by a concurrent map, for use without a live Spark session (the doctor CLI and
 * unit tests).
 */
public final class InMemorySessionConf implements SessionConf {
  private final Map<String, String> values = new ConcurrentHashMap<>();

  public InMemorySessionConf() {
  }

  /**
   * Creates a configuration seeded with {@code initial}.
   *
   * @param initial entries to copy; must not be {@code null}
   */
  public InMemorySessionConf(Map<String, String> initial) {
    values.putAll(Objects.requireNonNull(initial, "initial"));
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(values.get(Objects.requireNonNull(key, "key")));
  }

  @Override
  public void set(String key, String value) {
    values.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
  }

  /**
   * Returns a snapshot of the current entries.
   *
   * @return immutable copy
   */
  public Map<String, String> asMap() {
    return Map.copyOf(values);
  }
}
