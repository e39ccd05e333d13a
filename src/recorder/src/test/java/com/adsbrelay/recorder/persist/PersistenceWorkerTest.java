package com.adsbrelay.recorder.persist;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.adsbrelay.recorder.config.RecorderProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PersistenceWorkerTest {
  @TempDir
  Path tempDir;

  @Test
  void appliesTasksInOrderAndSurvivesFailingTask() throws Exception {
    Path db = tempDir.resolve("adsb.db");
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    PersistenceWorker worker = new PersistenceWorker(properties(db, 3_600_000), new MutableClock(1_000), meterRegistry);
    worker.start();

    worker.enqueue(new PersistenceTask.StartSession("s-1", "ABC123", 100.0));
    worker.enqueue(store -> {
      throw new SQLException("disk on fire");
    });
    worker.enqueue(new PersistenceTask.InsertPathPoint(
        "s-1", "ABC123", 101.0, "1970-01-01T00:01:41Z", 49.0, 6.0, null, null, null, null, null));
    worker.enqueue(new PersistenceTask.InsertPathPoint(
        "s-1", "ABC123", 102.0, "1970-01-01T00:01:42Z", 49.1, 6.1, 1000, 200.0, 45.0, 0, "GS"));
    waitUntil(() -> worker.queueSize() == 0
        && meterRegistry.counter("recorder.store.tasks", "outcome", "applied").count() == 3.0, 5_000);
    worker.stop();

    assertThat(meterRegistry.counter("recorder.store.tasks", "outcome", "failed").count()).isEqualTo(1.0);
    assertThat(pathTimestamps(db)).containsExactly(101.0, 102.0);
  }

  @Test
  void stopDrainsQueuedTasks() throws Exception {
    Path db = tempDir.resolve("adsb.db");
    PersistenceWorker worker =
        new PersistenceWorker(properties(db, 3_600_000), new MutableClock(1_000), new SimpleMeterRegistry());
    worker.start();

    for (int i = 0; i < 200; i++) {
      worker.enqueue(new PersistenceTask.InsertPathPoint(
          "s-1", "ABC123", i, "ts", 49.0, 6.0, null, null, null, null, null));
    }
    worker.stop();

    assertThat(pathTimestamps(db)).hasSize(200);
  }

  @Test
  void stopLeavesQueueAloneWhileWriterIsStillBusy() throws Exception {
    Path db = tempDir.resolve("adsb.db");
    PersistenceWorker worker =
        new PersistenceWorker(properties(db, 3_600_000), new MutableClock(1_000), new SimpleMeterRegistry());
    worker.start();
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    worker.enqueue(store -> {
      entered.countDown();
      awaitIgnoringInterrupts(release);
    });
    assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
    worker.enqueue(new PersistenceTask.InsertPathPoint(
        "s-1", "ABC123", 1.0, "ts", 49.0, 6.0, null, null, null, null, null));

    try {
      worker.stop(Duration.ofMillis(100));

      assertThat(worker.queueSize()).isEqualTo(1);
      assertThat(pathTimestamps(db)).isEmpty();
    } finally {
      release.countDown();
    }
  }

  @Test
  void startupSweepEndsSessionIdleBeyondThreshold() throws Exception {
    Path db = seedSession(tempDir.resolve("adsb.db"));
    PersistenceWorker worker =
        new PersistenceWorker(properties(db, 3_600_000), new MutableClock(501_000), new SimpleMeterRegistry());

    worker.start();
    List<OpenSession> resumable = worker.resumableSessions();
    worker.stop();

    assertThat(resumable).isEmpty();
    assertThat(endTime(db, "s-1")).isEqualTo(501.0);
  }

  @Test
  void sessionWithinThresholdIsResumable() throws Exception {
    Path db = seedSession(tempDir.resolve("adsb.db"));
    PersistenceWorker worker =
        new PersistenceWorker(properties(db, 3_600_000), new MutableClock(499_000), new SimpleMeterRegistry());

    worker.start();
    List<OpenSession> resumable = worker.resumableSessions();
    worker.stop();

    assertThat(resumable).containsExactly(new OpenSession("s-1", "ABC123", 100.0, 200.0));
    assertThat(endTime(db, "s-1")).isNull();
  }

  @Test
  void periodicSweepNotifiesListeners() throws Exception {
    Path db = seedSession(tempDir.resolve("adsb.db"));
    MutableClock clock = new MutableClock(400_000);
    PersistenceWorker worker = new PersistenceWorker(properties(db, 50), clock, new SimpleMeterRegistry());
    List<ClosedSession> closed = new CopyOnWriteArrayList<>();
    worker.addClosedSessionListener(closed::add);
    worker.start();

    clock.set(501_000);
    waitUntil(() -> !closed.isEmpty(), 5_000);
    worker.stop();

    assertThat(closed).containsExactly(new ClosedSession("s-1", "ABC123", 501.0));
    assertThat(endTime(db, "s-1")).isEqualTo(501.0);
  }

  @Test
  void startFailsWhenStoreCannotBeOpened() throws Exception {
    Path blocker = Files.writeString(tempDir.resolve("not-a-dir"), "x");
    PersistenceWorker worker = new PersistenceWorker(
        properties(blocker.resolve("adsb.db"), 3_600_000), new MutableClock(0), new SimpleMeterRegistry());

    assertThatThrownBy(worker::start).isInstanceOf(IllegalStateException.class);
  }

  private static Path seedSession(Path db) throws SQLException {
    try (FlightStore store = FlightStore.open(db)) {
      store.startSession(new PersistenceTask.StartSession("s-1", "ABC123", 100.0));
      store.insertPathPoint(new PersistenceTask.InsertPathPoint(
          "s-1", "ABC123", 200.0, "1970-01-01T00:03:20Z", 49.0, 6.0, null, null, null, null, null));
    }
    return db;
  }

  private static RecorderProperties properties(Path db, long sweepIntervalMs) {
    return new RecorderProperties(
        new RecorderProperties.Feed(URI.create("ws://127.0.0.1:8443/adsb"), 5_000, 60_000, 1_000),
        new RecorderProperties.Persistence(10_000),
        new RecorderProperties.Store(db.toString(), 20, sweepIntervalMs, 300));
  }

  private static List<Double> pathTimestamps(Path db) throws Exception {
    List<Double> timestamps = new ArrayList<>();
    try (Connection connection = FlightStoreTest.connect(db);
         Statement statement = connection.createStatement();
         ResultSet rs = statement.executeQuery("SELECT ts FROM path ORDER BY id")) {
      while (rs.next()) {
        timestamps.add(rs.getDouble("ts"));
      }
    }
    return timestamps;
  }

  private static Double endTime(Path db, String sessionId) throws Exception {
    try (Connection connection = FlightStoreTest.connect(db);
         Statement statement = connection.createStatement();
         ResultSet rs = statement.executeQuery("SELECT end_time FROM flight_session WHERE id = '" + sessionId + "'")) {
      assertThat(rs.next()).isTrue();
      double value = rs.getDouble("end_time");
      return rs.wasNull() ? null : value;
    }
  }

  private static void awaitIgnoringInterrupts(CountDownLatch latch) {
    while (true) {
      try {
        latch.await();
        return;
      } catch (InterruptedException ignored) {
        // keep blocking like a writer stuck inside a JDBC call
      }
    }
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

  private static final class MutableClock extends Clock {
    private volatile long millis;

    private MutableClock(long millis) {
      this.millis = millis;
    }

    void set(long millis) {
      this.millis = millis;
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public long millis() {
      return millis;
    }

    @Override
    public Instant instant() {
      return Instant.ofEpochMilli(millis);
    }
  }
}
