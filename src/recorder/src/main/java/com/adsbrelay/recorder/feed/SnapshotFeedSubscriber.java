package com.adsbrelay.recorder.feed;

import com.adsbrelay.recorder.config.RecorderProperties;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Keeps a connection to the feeder's snapshot broadcast and feeds every message to the
 * {@link SnapshotMirror}.
 *
 * <p>The receive loop runs on its own thread and walks
 * {@code DISCONNECTED -> CONNECTING -> CONNECTED -> DISCONNECTED}; failed attempts wait for a
 * {@link ReconnectBackoff} delay that resets once a connection is established.
 */
@Component
public class SnapshotFeedSubscriber {
  private static final Logger LOGGER = LoggerFactory.getLogger(SnapshotFeedSubscriber.class);
  private static final Duration STOP_POLL = Duration.ofMillis(500);

  private final FeedTransport transport;
  private final SnapshotMirror mirror;
  private final RecorderProperties.Feed properties;
  private final ExecutorService executor;
  private final CountDownLatch stopSignal = new CountDownLatch(1);
  private volatile ConnectionState state = ConnectionState.DISCONNECTED;
  private volatile FeedConnection connection;

  public SnapshotFeedSubscriber(FeedTransport transport, SnapshotMirror mirror, RecorderProperties properties) {
    this.transport = transport;
    this.mirror = mirror;
    this.properties = properties.feed();
    this.executor = Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, "recorder-feed");
      thread.setDaemon(true);
      return thread;
    });
  }

  /** Starts the receive loop after Spring context initialization. */
  @jakarta.annotation.PostConstruct
  public void start() {
    executor.submit(this::runLoop);
  }

  /** Closes the current connection and stops the receive loop. */
  @jakarta.annotation.PreDestroy
  public void stop() {
    stopSignal.countDown();
    FeedConnection current = connection;
    if (current != null) {
      current.close();
    }
    executor.shutdownNow();
    try {
      executor.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException ignored) {
      Thread.currentThread().interrupt();
    }
  }

  public ConnectionState state() {
    return state;
  }

  private void runLoop() {
    ReconnectBackoff backoff = ReconnectBackoff.initial(
        Duration.ofMillis(properties.baseBackoffMs()), Duration.ofMillis(properties.maxBackoffMs()));
    while (!isStopping()) {
      state = ConnectionState.CONNECTING;
      FeedConnection opened = connect();
      if (opened != null) {
        connection = opened;
        state = ConnectionState.CONNECTED;
        backoff = backoff.reset();
        LOGGER.info("Connected to snapshot feed {}", properties.uri());
        boolean interrupted = !awaitDisconnect(opened);
        connection = null;
        state = ConnectionState.DISCONNECTED;
        if (interrupted || isStopping()) {
          return;
        }
        LOGGER.info("Snapshot feed disconnected: {}", opened.closeReason());
      } else {
        state = ConnectionState.DISCONNECTED;
      }

      LOGGER.info("Reconnecting to snapshot feed in {} ms", backoff.delay().toMillis());
      if (waitForStop(backoff.delay())) {
        return;
      }
      backoff = backoff.next();
    }
  }

  private FeedConnection connect() {
    CompletableFuture<FeedConnection> attempt;
    try {
      attempt = transport.open(properties.uri(), mirror::apply);
    } catch (RuntimeException ex) {
      LOGGER.warn("Cannot open snapshot feed {}: {}", properties.uri(), ex.getMessage());
      return null;
    }

    URI uri = properties.uri();
    FeedConnection opened = attempt
        .handle((result, error) -> {
          if (error != null) {
            LOGGER.warn("Snapshot feed {} unavailable: {}", uri, rootCauseSummary(error));
            return null;
          }
          return result;
        })
        .completeOnTimeout(null, properties.connectTimeoutMs(), TimeUnit.MILLISECONDS)
        .join();
    if (opened == null && !attempt.isDone()) {
      LOGGER.warn("Snapshot feed {} did not answer within {} ms", uri, properties.connectTimeoutMs());
      attempt.thenAccept(FeedConnection::close);
    }
    return opened;
  }

  /** Blocks until the connection drops or stop is requested; returns {@code false} if interrupted. */
  private boolean awaitDisconnect(FeedConnection opened) {
    try {
      while (!opened.awaitClosed(STOP_POLL)) {
        if (isStopping()) {
          opened.close();
          return true;
        }
      }
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      opened.close();
      return false;
    }
  }

  private boolean waitForStop(Duration delay) {
    try {
      return stopSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return true;
    }
  }

  private boolean isStopping() {
    return stopSignal.getCount() == 0 || Thread.currentThread().isInterrupted();
  }

  private static String rootCauseSummary(Throwable error) {
    Throwable current = error;
    while (current.getCause() != null && current.getCause() != current) {
      current = current.getCause();
    }
    String message = current.getMessage();
    if (message == null || message.isBlank()) {
      return current.getClass().getSimpleName();
    }
    return current.getClass().getSimpleName() + ": " + message;
  }
}
