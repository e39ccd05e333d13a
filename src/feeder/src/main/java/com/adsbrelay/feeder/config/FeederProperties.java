package com.adsbrelay.feeder.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the feeder service.
 *
 * <p>Values are bound from {@code application.yml} and environment variables under the
 * {@code feeder.*} prefix.
 */
@ConfigurationProperties(prefix = "feeder")
public class FeederProperties {
  private final Source source = new Source();
  private final Broadcast broadcast = new Broadcast();
  private final Cpr cpr = new Cpr();
  private final Assembly assembly = new Assembly();
  private final Receiver receiver = new Receiver();

  public Source getSource() {
    return source;
  }

  public Broadcast getBroadcast() {
    return broadcast;
  }

  public Cpr getCpr() {
    return cpr;
  }

  public Assembly getAssembly() {
    return assembly;
  }

  public Receiver getReceiver() {
    return receiver;
  }

  /** Raw frame feed (dump1090 "raw" output, one {@code *<hex>;} frame per line). */
  public static class Source {
    private boolean enabled = true;
    private String host = "127.0.0.1";
    private int port = 30002;
    private long reconnectDelayMs = 5_000;
    private int connectTimeoutMs = 5_000;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getHost() {
      return host;
    }

    public void setHost(String host) {
      this.host = host;
    }

    public int getPort() {
      return port;
    }

    public void setPort(int port) {
      this.port = port;
    }

    public long getReconnectDelayMs() {
      return reconnectDelayMs;
    }

    public void setReconnectDelayMs(long reconnectDelayMs) {
      this.reconnectDelayMs = reconnectDelayMs;
    }

    public int getConnectTimeoutMs() {
      return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
      this.connectTimeoutMs = connectTimeoutMs;
    }
  }

  /** WebSocket endpoint and cadence of the snapshot fan-out. */
  public static class Broadcast {
    private String path = "/adsb";
    private long intervalMs = 3_000;
    private int sendTimeLimitMs = 5_000;
    private int bufferSizeLimit = 4 * 1024 * 1024;
    private List<String> allowedOrigins = new ArrayList<>();

    public String getPath() {
      return path;
    }

    public void setPath(String path) {
      this.path = path;
    }

    public long getIntervalMs() {
      return intervalMs;
    }

    public void setIntervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
    }

    public int getSendTimeLimitMs() {
      return sendTimeLimitMs;
    }

    public void setSendTimeLimitMs(int sendTimeLimitMs) {
      this.sendTimeLimitMs = sendTimeLimitMs;
    }

    public int getBufferSizeLimit() {
      return bufferSizeLimit;
    }

    public void setBufferSizeLimit(int bufferSizeLimit) {
      this.bufferSizeLimit = bufferSizeLimit;
    }

    public List<String> getAllowedOrigins() {
      return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
      this.allowedOrigins = allowedOrigins;
    }
  }

  /** Split-position (CPR) pairing rules. */
  public static class Cpr {
    private double stalePairSeconds = 10.0;
    private double failureLogIntervalSeconds = 30.0;

    public double getStalePairSeconds() {
      return stalePairSeconds;
    }

    public void setStalePairSeconds(double stalePairSeconds) {
      this.stalePairSeconds = stalePairSeconds;
    }

    public double getFailureLogIntervalSeconds() {
      return failureLogIntervalSeconds;
    }

    public void setFailureLogIntervalSeconds(double failureLogIntervalSeconds) {
      this.failureLogIntervalSeconds = failureLogIntervalSeconds;
    }
  }

  /** Diagnostic tracking of how long it takes to learn every field of an aircraft. */
  public static class Assembly {
    private double timeoutSeconds = 120.0;

    public double getTimeoutSeconds() {
      return timeoutSeconds;
    }

    public void setTimeoutSeconds(double timeoutSeconds) {
      this.timeoutSeconds = timeoutSeconds;
    }
  }

  /** Optional receiver location, used for distance annotation and surface position decoding. */
  public static class Receiver {
    private Double latitude;
    private Double longitude;

    public Double getLatitude() {
      return latitude;
    }

    public void setLatitude(Double latitude) {
      this.latitude = latitude;
    }

    public Double getLongitude() {
      return longitude;
    }

    public void setLongitude(Double longitude) {
      this.longitude = longitude;
    }

    public boolean isConfigured() {
      return latitude != null && longitude != null;
    }
  }
}
