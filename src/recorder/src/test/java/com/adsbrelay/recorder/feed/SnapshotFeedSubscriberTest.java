package com.adsbrelay.recorder.feed;

import static org.assertj.core.api.Assertions.assertThat;

import com.adsbrelay.recorder.config.RecorderProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class SnapshotFeedSubscriberTest {
  private SnapshotFeedSubscriber subscriber;

  @AfterEach
  void tearDown() {
    if (subscriber != null) {
      subscriber.stop();
    }
  }

  @Test
  void reconnectsWithBackoffAndFeedsMirror() {
    ScriptedTransport transport = new ScriptedTransport(2);
    SnapshotMirror mirror = new SnapshotMirror(new ObjectMapper(), new SimpleMeterRegistry());
    subscriber = new SnapshotFeedSubscriber(transport, mirror, properties(50, 200));

    subscriber.start();

    waitUntil(() -> subscriber.state() == ConnectionState.CONNECTED, 5_000);
    assertThat(transport.attempts.get()).isEqualTo(3);

    transport.lastListener.accept("{\"ABC123\":{\"icao\":\"ABC123\"}}");
    transport.lastListener.accept("[\"x\"]");
    assertThat(mirror.current()).containsOnlyKeys("ABC123");

    transport.lastConnection.markClosed("remote closed");
    waitUntil(() -> transport.attempts.get() == 4, 5_000);
    waitUntil(() -> subscriber.state() == ConnectionState.CONNECTED, 5_000);
  }

  @Test
  void waitsLongerAfterEachFailure() {
    ScriptedTransport transport = new ScriptedTransport(Integer.MAX_VALUE);
    SnapshotMirror mirror = new SnapshotMirror(new ObjectMapper(), new SimpleMeterRegistry());
    subscriber = new SnapshotFeedSubscriber(transport, mirror, properties(100, 400));

    subscriber.start();
    waitUntil(() -> transport.attempts.get() >= 4, 5_000);

    List<Long> times = transport.attemptTimesNanos;
    long firstGap = TimeUnit.NANOSECONDS.toMillis(times.get(1) - times.get(0));
    long thirdGap = TimeUnit.NANOSECONDS.toMillis(times.get(3) - times.get(2));
    assertThat(firstGap).isGreaterThanOrEqualTo(90);
    assertThat(thirdGap).isGreaterThanOrEqualTo(390);
    assertThat(subscriber.state()).isNotEqualTo(ConnectionState.CONNECTED);
  }

  @Test
  void stopClosesOpenConnection() {
    ScriptedTransport transport = new ScriptedTransport(0);
    SnapshotMirror mirror = new SnapshotMirror(new ObjectMapper(), new SimpleMeterRegistry());
    subscriber = new SnapshotFeedSubscriber(transport, mirror, properties(50, 200));
    subscriber.start();
    waitUntil(() -> subscriber.state() == ConnectionState.CONNECTED, 5_000);

    subscriber.stop();

    assertThat(transport.lastConnection.isClosed()).isTrue();
    assertThat(transport.closedBySubscriber.get()).isEqualTo(1);
  }

  private static RecorderProperties properties(long baseBackoffMs, long maxBackoffMs) {
    return new RecorderProperties(
        new RecorderProperties.Feed(URI.create("ws://127.0.0.1:1/adsb"), baseBackoffMs, maxBackoffMs, 1_000),
        new RecorderProperties.Persistence(10_000),
        new RecorderProperties.Store("unused.db", 50, 10_000, 300));
  }

  private static void waitUntil(BooleanSupplier condition, long timeoutMs) {
    long deadline = System.currentTimeMillis() + timeoutMs;
    while (System.currentTimeMillis() < deadline) {
      if (condition.getAsBoolean()) {
        return;
      }
      LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(20));
    }
    throw new AssertionError("Condition not met within " + timeoutMs + "ms");
  }

  /** Fails the first {@code failures} attempts, then connects. */
  private static final class ScriptedTransport implements FeedTransport {
    private final int failures;
    private final AtomicInteger attempts = new AtomicInteger();
    private final AtomicInteger closedBySubscriber = new AtomicInteger();
    private final List<Long> attemptTimesNanos = new CopyOnWriteArrayList<>();
    private volatile Consumer<String> lastListener;
    private volatile FeedConnection lastConnection;

    private ScriptedTransport(int failures) {
      this.failures = failures;
    }

    @Override
    public CompletableFuture<FeedConnection> open(URI uri, Consumer<String> onMessage) {
      attemptTimesNanos.add(System.nanoTime());
      if (attempts.incrementAndGet() <= failures) {
        return CompletableFuture.failedFuture(new IOException("Connection refused"));
      }
      FeedConnection connection = new FeedConnection();
      connection.bind(closedBySubscriber::incrementAndGet);
      lastListener = onMessage;
      lastConnection = connection;
      return CompletableFuture.completedFuture(connection);
    }
  }
}
