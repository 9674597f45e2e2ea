package ca.gc.cra.geosession.api;

import ca.gc.cra.geosession.application.gdal.CheckpointDirectories;
import ca.gc.cra.geosession.application.gdal.GdalEnablement;
import ca.gc.cra.geosession.application.gdal.GdalEnabler;
import ca.gc.cra.geosession.application.port.GdalRuntime;
import ca.gc.cra.geosession.application.port.GdalUnavailableException;
import ca.gc.cra.geosession.config.GeoSettings;
import ca.gc.cra.geosession.config.InMemorySessionConf;
import ca.gc.cra.geosession.infrastructure.gdal.GdalRuntimes;
import ca.gc.cra.geosession.logging.LoggingConfigurator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code geosession doctor}: checks that native GDAL can be loaded and configured with the given settings.
 *
 * @since 0.1.0
 */
public final class DoctorCli {
  private static final Logger log = LoggerFactory.getLogger(DoctorCli.class);
  static final String RUNTIME_ARG = "runtime";
  static final List<String> SETTING_PREFIXES = List.of("spark.databricks.labs.mosaic.", "spark.mosaic.");
  private static final String SUMMARY_USAGE =
      "usage: doctor [runtime=jni|disabled|NAME] [spark.databricks.labs.mosaic.KEY=VALUE ...] "
          + "[--enable] [--drivers] [--verbose]";
  private static final String HELP_TEXT = """
      GeoSession GDAL doctor

      Usage:
        doctor [options] [settings]

      Options:
        runtime=jni|disabled|NAME   GDAL runtime to probe (default jni)
        --enable                    Run the full enablement (tmp dir, config options, drivers)
        --drivers                   List registered driver short names
        --verbose                   Enable DEBUG logging
        --help                      Show this message

      Settings (same keys as the Spark session):
        spark.databricks.labs.mosaic.raster.tmp.prefix=PATH
        spark.databricks.labs.mosaic.raster.checkpoint=PATH
        spark.databricks.labs.mosaic.raster.use.checkpoint=true|false
        spark.databricks.labs.mosaic.index.system=H3|BNG
        spark.databricks.labs.mosaic.geometry.api=JTS|ESRI
      """;

  private DoctorCli() {}

  /**
   * Runs the doctor and returns its exit code without terminating the JVM.
   *
   * @param args arguments after the {@code doctor} command
   * @return {@link ExitCode#SUCCESS} when GDAL is usable
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for doctor");
    }

    Map<String, String> kv;
    GdalRuntime runtime;
    try {
      kv = CliArgsParser.toMap(input.positional());
      String runtimeName = kv.getOrDefault(RUNTIME_ARG, GdalRuntimes.JNI);
      kv.remove(RUNTIME_ARG);
      requireSettingKeys(kv);
      runtime = GdalRuntimes.create(runtimeName);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    GeoSettings settings;
    try {
      settings = GeoSettings.fromMap(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid settings: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
    printSettings(settings);

    if (settings.useCheckpoint()) {
      try {
        CheckpointDirectories.prepare(settings.rasterCheckpoint());
        CliPrinter.field("checkpoint writable", "yes");
      } catch (IllegalArgumentException ex) {
        CliPrinter.field("checkpoint writable", "no (" + ex.getMessage() + ")");
        log.error("Raster checkpoint {} is not usable: {}", settings.rasterCheckpoint(), ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      }
    }

    boolean available = runtime.isAvailable();
    CliPrinter.field("gdal available", available ? "yes" : "no");
    if (!available) {
      log.error("Native GDAL could not be loaded; install GDAL and its Java bindings on the library path");
      return ExitCode.RUNTIME_FAILURE;
    }
    try {
      CliPrinter.field("gdal version", runtime.version());
      if (input.hasFlag("--enable")) {
        GdalEnablement outcome = new GdalEnabler(runtime).enable(new InMemorySessionConf(kv));
        CliPrinter.field("enablement", outcome);
      } else {
        runtime.registerAll();
      }
      CliPrinter.field("driver count", runtime.driverCount());
      if (input.hasFlag("--drivers")) {
        for (String driver : runtime.driverNames()) {
          CliPrinter.println("  " + driver);
        }
      }
      return ExitCode.SUCCESS;
    } catch (GdalUnavailableException ex) {
      CliPrinter.field("gdal usable", "no (" + ex.getMessage() + ")");
      log.error("GDAL check failed: {}", ex.getMessage());
      log.debug("GDAL check failure detail", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void requireSettingKeys(Map<String, String> kv) {
    for (String key : kv.keySet()) {
      if (SETTING_PREFIXES.stream().noneMatch(key::startsWith)) {
        throw new IllegalArgumentException("unsupported setting: " + key);
      }
    }
  }

  private static void printSettings(GeoSettings settings) {
    CliPrinter.field("gdal native", settings.gdalNative());
    CliPrinter.field("tmp dir", settings.tmpDir());
    CliPrinter.field("raster checkpoint", settings.rasterCheckpoint());
    CliPrinter.field("use checkpoint", settings.useCheckpoint());
    CliPrinter.field("index system", settings.indexSystem());
    CliPrinter.field("geometry api", settings.geometryApi());
  }
}
