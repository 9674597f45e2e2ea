package ca.gc.cra.geosession.application.gdal;

import ca.gc.cra.geosession.application.port.GdalRuntime;
import ca.gc.cra.geosession.application.port.GdalUnavailableException;
import ca.gc.cra.geosession.application.port.MetricsPort;
import ca.gc.cra.geosession.application.port.SessionConf;
import ca.gc.cra.geosession.config.GeoConfigKeys;
import ca.gc.cra.geosession.config.GeoSettings;
import ca.gc.cra.geosession.validation.Paths;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Enables native GDAL raster support for a session.
 * <p><strong>Why:</strong> GDAL must be configured (scratch directories, caching, logging) and its driver
 * table populated before any raster expression runs; doing so more than once per process is wasted work,
 * while the checkpoint location may change from session to session.</p>
 * <p><strong>Role:</strong> Application service used by the test harness and the doctor CLI.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Apply {@link GdalOptions} and register drivers once per enabler.</li>
 *   <li>Mark each session with {@link GeoConfigKeys#GDAL_ENABLED}.</li>
 *   <li>Prepare the raster checkpoint directory on every call when checkpointing is on.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Calls are serialized on an internal lock because GDAL configuration is
 * process-wide.</p>
 * <p><strong>Observability:</strong> Logs outcome at INFO/ERROR and records {@code gdal.enable.*} metrics.</p>
 *
 * @since 0.1.0
 */
public final class GdalEnabler {
  private static final Logger log = LoggerFactory.getLogger(GdalEnabler.class);

  private final GdalRuntime runtime;
  private final MetricsPort metrics;
  private final Object lock = new Object();
  private boolean enabled; // guarded by lock

  /**
   * Creates an enabler without metrics.
   *
   * @param runtime native GDAL runtime; must not be {@code null}
   */
  public GdalEnabler(GdalRuntime runtime) {
    this(runtime, MetricsPort.NO_OP);
  }

  /**
   * Creates an enabler.
   *
   * @param runtime native GDAL runtime; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public GdalEnabler(GdalRuntime runtime, MetricsPort metrics) {
    this.runtime = Objects.requireNonNull(runtime, "runtime");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Enables GDAL for the session. Idempotent: once enabled, later calls only refresh the checkpoint
   * configuration and mark the session.
   *
   * @param conf session configuration; must not be {@code null}
   * @return whether this call configured GDAL or found it already enabled
   * @throws GdalUnavailableException if the session's geospatial settings are invalid, the raster checkpoint is
   *     not usable, or the native library cannot be configured; the enabler stays disabled
   */
  public GdalEnablement enable(SessionConf conf) throws GdalUnavailableException {
    Objects.requireNonNull(conf, "conf");
    synchronized (lock) {
      GeoSettings settings = readSettings(conf);
      GdalEnablement outcome;
      if (!enabled && !wasEnabled(conf)) {
        configure(conf, settings);
        outcome = GdalEnablement.ENABLED;
      } else {
        if (!wasEnabled(conf)) {
          conf.set(GeoConfigKeys.GDAL_ENABLED, "true");
        }
        outcome = GdalEnablement.ALREADY_ENABLED;
      }
      configureCheckpoint(settings);
      return outcome;
    }
  }

  /**
   * Enables GDAL only when the session requests the native backend via {@link GeoConfigKeys#GDAL_NATIVE}.
   *
   * @param conf session configuration; must not be {@code null}
   * @return the enablement outcome, or empty when the native backend is not requested
   * @throws GdalUnavailableException if the native library cannot be configured
   */
  public Optional<GdalEnablement> enableIfConfigured(SessionConf conf) throws GdalUnavailableException {
    boolean requested;
    synchronized (lock) {
      requested = readSettings(Objects.requireNonNull(conf, "conf")).gdalNative();
    }
    if (!requested) {
      log.debug("Native GDAL not requested ({}=false); skipping enablement", GeoConfigKeys.GDAL_NATIVE);
      return Optional.empty();
    }
    return Optional.of(enable(conf));
  }

  /**
   * Best-effort variant of {@link #enable(SessionConf)}: failures are logged and discarded.
   *
   * @param conf session configuration; must not be {@code null}
   * @return {@code true} when GDAL is enabled after the call
   */
  public boolean enableQuietly(SessionConf conf) {
    try {
      enable(conf);
      return true;
    } catch (GdalUnavailableException | RuntimeException ex) {
      log.warn("Continuing without native GDAL: {}", ex.getMessage());
      log.debug("GDAL enablement failure detail", ex);
      return false;
    }
  }

  /**
   * Forces the native driver table to be registered again.
   *
   * @throws GdalUnavailableException if the native library cannot be used
   */
  public void registerDrivers() throws GdalUnavailableException {
    synchronized (lock) {
      runtime.registerAll();
      metrics.increment("gdal.register.calls");
    }
  }

  /**
   * Reports whether this enabler has configured GDAL.
   *
   * @return {@code true} after a successful {@link #enable(SessionConf)} that configured GDAL
   */
  public boolean isEnabled() {
    synchronized (lock) {
      return enabled;
    }
  }

  /**
   * Returns the runtime this enabler configures.
   *
   * @return native runtime
   */
  public GdalRuntime runtime() {
    return runtime;
  }

  /**
   * Reports whether GDAL was already enabled for the session.
   *
   * @param conf session configuration
   * @return {@code true} when the session carries {@link GeoConfigKeys#GDAL_ENABLED}{@code =true}
   */
  public static boolean wasEnabled(SessionConf conf) {
    return conf.get(GeoConfigKeys.GDAL_ENABLED).map(v -> v.trim().equalsIgnoreCase("true")).orElse(false);
  }

  private GeoSettings readSettings(SessionConf conf) throws GdalUnavailableException {
    try {
      return GeoSettings.from(conf);
    } catch (IllegalArgumentException ex) {
      onFailure(ex);
      throw new GdalUnavailableException("Invalid geospatial settings: " + ex.getMessage(), ex);
    }
  }

  private void configure(SessionConf conf, GeoSettings settings) throws GdalUnavailableException {
    metrics.increment("gdal.enable.attempt");
    long start = System.nanoTime();
    enabled = true;
    try {
      Paths.validateWritableDir(settings.tmpDir(), true, true);
      for (Map.Entry<String, String> option : GdalOptions.forSettings(settings).entrySet()) {
        runtime.setConfigOption(option.getKey(), option.getValue());
      }
      runtime.registerAll();
      conf.set(GeoConfigKeys.GDAL_ENABLED, "true");
    } catch (GdalUnavailableException ex) {
      onFailure(ex);
      throw ex;
    } catch (RuntimeException | LinkageError ex) {
      onFailure(ex);
      throw new GdalUnavailableException("GDAL could not be configured: " + ex.getMessage(), ex);
    }
    metrics.increment("gdal.enable.success");
    metrics.observe("gdal.enable.latencyNanos", System.nanoTime() - start);
    log.info("GDAL environment enabled (tmpDir={})", settings.tmpDir());
  }

  private void onFailure(Throwable ex) {
    enabled = false;
    metrics.increment("gdal.enable.failure");
    log.error("GDAL not enabled. Native raster support requires GDAL and its Java bindings on every node; "
        + "run 'geosession doctor' to check the installation. Error: {}", ex.getMessage());
  }

  private void configureCheckpoint(GeoSettings settings) throws GdalUnavailableException {
    if (settings.useCheckpoint()) {
      try {
        CheckpointDirectories.prepare(settings.rasterCheckpoint());
      } catch (RuntimeException ex) {
        onFailure(ex);
        throw new GdalUnavailableException(
            "Raster checkpoint " + settings.rasterCheckpoint() + " is not usable: " + ex.getMessage(), ex);
      }
      log.debug("Raster checkpoint directory ready at {}", settings.rasterCheckpoint());
    }
  }
}
