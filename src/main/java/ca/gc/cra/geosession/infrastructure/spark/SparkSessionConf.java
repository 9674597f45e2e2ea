package ca.gc.cra.geosession.infrastructure.spark;

import ca.gc.cra.geosession.application.port.SessionConf;
import java.util.Objects;
import java.util.Optional;
import org.apache.spark.sql.RuntimeConfig;
import org.apache.spark.sql.SparkSession;
import scala.Option;

/**
 * {@link SessionConf} over a live session's {@link RuntimeConfig}.
 */
public final class SparkSessionConf implements SessionConf {
  private final RuntimeConfig conf;

  /**
   * Wraps the runtime configuration of {@code session}.
   *
   * @param session live session; must not be {@code null}
   */
  public SparkSessionConf(SparkSession session) {
    this.conf = Objects.requireNonNull(session, "session").conf();
  }

  @Override
  public Optional<String> get(String key) {
    Objects.requireNonNull(key, "key");
    Option<String> value = conf.getOption(key);
    return value.isDefined() ? Optional.of(value.get()) : Optional.empty();
  }

  @Override
  public void set(String key, String value) {
    conf.set(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
  }
}
