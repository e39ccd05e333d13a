package com.adsbrelay.feeder.source;

import com.adsbrelay.feeder.aircraft.AircraftStateAggregator;
import com.adsbrelay.feeder.config.FeederProperties;
import com.adsbrelay.feeder.support.FailureCauses;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads raw Mode S frames from a dump1090-style TCP feed and hands them to the aggregator.
 *
 * <p>The feed sends one {@code *<hex>;} frame per line. This component is the only thread that
 * calls into {@link AircraftStateAggregator}; on disconnect it waits the configured delay and
 * reconnects. A frame the aggregator fails on is counted and skipped.
 */
@Component
public class RawFrameSource {
  private static final Logger LOGGER = LoggerFactory.getLogger(RawFrameSource.class);

  private final AircraftStateAggregator aggregator;
  private final FeederProperties.Source properties;
  private final ExecutorService executor;
  private final Counter errorCounter;
  private volatile Socket socket;
  private volatile boolean stopping;

  public RawFrameSource(
      AircraftStateAggregator aggregator, FeederProperties properties, MeterRegistry meterRegistry) {
    this.aggregator = aggregator;
    this.properties = properties.getSource();
    this.errorCounter = meterRegistry.counter("feeder.source.errors");
    this.executor = Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, "feeder-frame-source");
      thread.setDaemon(true);
      return thread;
    });
  }

  /** Starts the reader loop after Spring context initialization. */
  @jakarta.annotation.PostConstruct
  public void start() {
    if (!properties.isEnabled()) {
      LOGGER.info("Raw frame source disabled (feeder.source.enabled=false)");
      return;
    }
    executor.submit(this::runLoop);
  }

  /** Closes the feed socket and stops the reader loop. */
  @jakarta.annotation.PreDestroy
  public void stop() {
    stopping = true;
    closeSocket();
    executor.shutdownNow();
    try {
      executor.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException ignored) {
      Thread.currentThread().interrupt();
    }
  }

  private void runLoop() {
    InetSocketAddress address = new InetSocketAddress(properties.getHost(), properties.getPort());
    while (!stopping && !Thread.currentThread().isInterrupted()) {
      try (Socket connection = new Socket()) {
        socket = connection;
        connection.connect(address, properties.getConnectTimeoutMs());
        LOGGER.info("Connected to raw frame feed {}:{}", properties.getHost(), properties.getPort());
        readFrames(connection);
        LOGGER.info("Raw frame feed closed by remote end");
      } catch (IOException ex) {
        if (stopping) {
          return;
        }
        LOGGER.warn("Raw frame feed {}:{} unavailable: {}",
            properties.getHost(), properties.getPort(), FailureCauses.rootCauseSummary(ex));
      } finally {
        socket = null;
      }

      try {
        Thread.sleep(properties.getReconnectDelayMs());
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return;
      }
    }
  }

  private void readFrames(Socket connection) throws IOException {
    BufferedReader reader = new BufferedReader(
        new InputStreamReader(connection.getInputStream(), StandardCharsets.US_ASCII));
    String line;
    while (!stopping && (line = reader.readLine()) != null) {
      String frame = normalize(line);
      if (frame == null) {
        continue;
      }
      try {
        aggregator.accept(frame, System.currentTimeMillis() / 1000.0);
      } catch (RuntimeException ex) {
        errorCounter.increment();
        LOGGER.warn("Failed to ingest frame {}", frame, ex);
      }
    }
  }

  /**
   * Strips the {@code *} / {@code ;} framing of a raw feed line.
   *
   * @param line one line of the feed
   * @return upper-case hex payload, or {@code null} when the line carries no hex frame
   */
  static String normalize(String line) {
    if (line == null) {
      return null;
    }
    String value = line.trim();
    if (value.startsWith("*")) {
      value = value.substring(1);
    }
    if (value.endsWith(";")) {
      value = value.substring(0, value.length() - 1);
    }
    if (value.isEmpty()) {
      return null;
    }
    for (int i = 0; i < value.length(); i++) {
      if (Character.digit(value.charAt(i), 16) < 0) {
        return null;
      }
    }
    return value.toUpperCase(Locale.ROOT);
  }

  private void closeSocket() {
    Socket current = socket;
    if (current == null) {
      return;
    }
    try {
      current.close();
    } catch (IOException ex) {
      LOGGER.debug("Failed to close raw frame feed socket", ex);
    }
  }
}
