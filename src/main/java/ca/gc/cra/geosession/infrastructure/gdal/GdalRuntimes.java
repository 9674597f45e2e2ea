package ca.gc.cra.geosession.infrastructure.gdal;

import ca.gc.cra.geosession.application.port.GdalRuntime;
import ca.gc.cra.geosession.application.port.GdalRuntimeProvider;
import java.util.Locale;
import java.util.Objects;
import java.util.ServiceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a {@link GdalRuntime} by name.
 *
 * <p>{@code jni} and {@code disabled} are built in; other names are looked up among the
 * {@link GdalRuntimeProvider}s registered with {@link ServiceLoader}.</p>
 */
public final class GdalRuntimes {
  private static final Logger log = LoggerFactory.getLogger(GdalRuntimes.class);

  public static final String JNI = "jni";
  public static final String DISABLED = "disabled";

  private GdalRuntimes() {}

  /**
   * Creates the runtime registered under {@code name}, searching the context class loader.
   *
   * @param name runtime name, case-insensitive
   * @return runtime instance
   * @throws IllegalArgumentException if no runtime is registered under the name
   */
  public static GdalRuntime create(String name) {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    return create(name, loader != null ? loader : GdalRuntimes.class.getClassLoader());
  }

  /**
   * Creates the runtime registered under {@code name}.
   *
   * @param name runtime name, case-insensitive
   * @param loader class loader searched for providers
   * @return runtime instance
   * @throws IllegalArgumentException if no runtime is registered under the name
   */
  public static GdalRuntime create(String name, ClassLoader loader) {
    Objects.requireNonNull(name, "name");
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    switch (normalized) {
      case JNI:
        return new JniGdalRuntime();
      case DISABLED:
        return new DisabledGdalRuntime();
      default:
        break;
    }
    for (GdalRuntimeProvider provider : ServiceLoader.load(GdalRuntimeProvider.class, loader)) {
      if (normalized.equals(provider.name().trim().toLowerCase(Locale.ROOT))) {
        log.debug("Using GDAL runtime provider {} ({})", normalized, provider.getClass().getName());
        return provider.create();
      }
    }
    throw new IllegalArgumentException("Unknown GDAL runtime: " + name);
  }
}
