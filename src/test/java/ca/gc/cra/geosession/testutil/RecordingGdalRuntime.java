package ca.gc.cra.geosession.testutil;

import ca.gc.cra.geosession.application.port.GdalRuntime;
import ca.gc.cra.geosession.application.port.GdalUnavailableException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory {@link GdalRuntime} that records every call. It can be switched to behave as if the native
 * library were missing.
 */
public class RecordingGdalRuntime implements GdalRuntime {
  public static final List<String> DRIVERS = List.of("GTiff", "MEM", "VRT", "netCDF");

  private final Map<String, String> options = new LinkedHashMap<>();
  private final List<String> calls = new ArrayList<>();
  private boolean available = true;
  private int registerCalls;

  public synchronized void setAvailable(boolean available) {
    this.available = available;
  }

  @Override
  public synchronized boolean isAvailable() {
    return available;
  }

  @Override
  public synchronized String version() throws GdalUnavailableException {
    record("version");
    return "3.4.1";
  }

  @Override
  public synchronized void setConfigOption(String key, String value) throws GdalUnavailableException {
    record("setConfigOption:" + key);
    options.put(key, value);
  }

  @Override
  public synchronized void registerAll() throws GdalUnavailableException {
    record("registerAll");
    registerCalls++;
  }

  @Override
  public synchronized int driverCount() throws GdalUnavailableException {
    record("driverCount");
    return registerCalls > 0 ? DRIVERS.size() : 0;
  }

  @Override
  public synchronized List<String> driverNames() throws GdalUnavailableException {
    record("driverNames");
    return registerCalls > 0 ? DRIVERS : List.of();
  }

  public synchronized Map<String, String> options() {
    return Map.copyOf(options);
  }

  public synchronized List<String> calls() {
    return List.copyOf(calls);
  }

  public synchronized int registerCalls() {
    return registerCalls;
  }

  public synchronized void reset() {
    options.clear();
    calls.clear();
    registerCalls = 0;
  }

  private void record(String call) throws GdalUnavailableException {
    if (!available) {
      throw new GdalUnavailableException("recording runtime marked unavailable");
    }
    calls.add(call);
  }
}
