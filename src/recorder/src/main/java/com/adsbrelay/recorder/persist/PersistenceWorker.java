package com.adsbrelay.recorder.persist;

import com.adsbrelay.recorder.config.RecorderProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Single writer for the flight store.
 *
 * <p>This component:
 * <ul>
 *   <li>accepts {@link PersistenceTask}s from any thread without blocking</li>
 *   <li>applies them in FIFO order on one dedicated thread</li>
 *   <li>ends sessions whose aircraft has been inactive longer than the configured threshold</li>
 * </ul>
 *
 * <p>A failing task is logged and skipped. Only failing to open the store at startup is fatal.
 */
@Component
public class PersistenceWorker {
  private static final Logger LOGGER = LoggerFactory.getLogger(PersistenceWorker.class);

  private final RecorderProperties.Store properties;
  private final Clock clock;
  private final BlockingQueue<PersistenceTask> queue = new LinkedBlockingQueue<>();
  private final List<Consumer<ClosedSession>> closedSessionListeners = new CopyOnWriteArrayList<>();
  private final ExecutorService executor;
  private final Counter appliedCounter;
  private final Counter failedCounter;
  private final Counter closedSessionCounter;
  private volatile FlightStore store;
  private volatile boolean running;
  private volatile List<OpenSession> resumableSessions = List.of();
  private double nextSweepAt;

  public PersistenceWorker(RecorderProperties properties, Clock clock, MeterRegistry meterRegistry) {
    this.properties = properties.store();
    this.clock = clock;
    this.executor = Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, "recorder-db-writer");
      thread.setDaemon(true);
      return thread;
    });
    this.appliedCounter = meterRegistry.counter("recorder.store.tasks", "outcome", "applied");
    this.failedCounter = meterRegistry.counter("recorder.store.tasks", "outcome", "failed");
    this.closedSessionCounter = meterRegistry.counter("recorder.sessions.closed");
  }

  /**
   * Opens the store, runs the startup session sweep and starts the writer thread.
   *
   * @throws IllegalStateException when the store cannot be opened
   */
  @jakarta.annotation.PostConstruct
  public void start() {
    store = FlightStore.open(Path.of(properties.path()));
    double now = now();
    sweepInactiveSessions(now);
    try {
      resumableSessions = List.copyOf(store.openSessions());
    } catch (SQLException ex) {
      LOGGER.error("Failed to load open sessions; recording starts with fresh sessions", ex);
    }
    nextSweepAt = now + properties.sweepIntervalMs() / 1000.0;
    running = true;
    executor.submit(this::runLoop);
    LOGGER.info("Flight store ready at {} ({} open sessions resumed)",
        properties.path(), resumableSessions.size());
  }

  /** Stops the writer thread, applies what is still queued, then closes the store. */
  @jakarta.annotation.PreDestroy
  public void stop() {
    stop(Duration.ofMillis(properties.pollMs() + 5_000));
  }

  /**
   * Stops with an explicit grace period per shutdown phase.
   *
   * <p>When the writer thread is still busy after both phases the queue is left as is and the
   * store stays open, since the connection must never be used from two threads.
   */
  void stop(Duration grace) {
    running = false;
    executor.shutdown();
    boolean terminated = false;
    try {
      terminated = executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS);
      if (!terminated) {
        executor.shutdownNow();
        terminated = executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }

    FlightStore current = store;
    if (current == null) {
      return;
    }
    if (!terminated) {
      LOGGER.warn("Writer thread did not stop; {} queued tasks not applied", queue.size());
      return;
    }
    List<PersistenceTask> remaining = new ArrayList<>();
    queue.drainTo(remaining);
    remaining.forEach(this::apply);
    if (!remaining.isEmpty()) {
      LOGGER.info("Drained {} queued tasks on shutdown", remaining.size());
    }
    current.close();
    store = null;
  }

  /** Queues a task for the writer thread. Never blocks. */
  public void enqueue(PersistenceTask task) {
    queue.offer(task);
  }

  /** Sessions still open after the startup sweep, for callers that track sessions in memory. */
  public List<OpenSession> resumableSessions() {
    return resumableSessions;
  }

  /** Registers a callback invoked on the writer thread for every session the sweep ends. */
  public void addClosedSessionListener(Consumer<ClosedSession> listener) {
    closedSessionListeners.add(listener);
  }

  int queueSize() {
    return queue.size();
  }

  private void runLoop() {
    while (running) {
      try {
        PersistenceTask task = queue.poll(properties.pollMs(), TimeUnit.MILLISECONDS);
        if (task != null) {
          apply(task);
        }
        double now = now();
        if (now >= nextSweepAt) {
          sweepInactiveSessions(now);
          nextSweepAt = now + properties.sweepIntervalMs() / 1000.0;
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        LOGGER.debug("Persistence worker interrupted during shutdown");
        return;
      } catch (Exception ex) {
        LOGGER.error("Persistence worker loop error", ex);
      }
    }
  }

  private void apply(PersistenceTask task) {
    try {
      task.applyTo(store);
      appliedCounter.increment();
    } catch (Exception ex) {
      failedCounter.increment();
      LOGGER.error("Failed to apply {}", task.getClass().getSimpleName(), ex);
    }
  }

  /**
   * Ends every open session whose last activity is older than the inactivity threshold.
   *
   * @param now sweep time, epoch seconds; also written as the session end time
   * @return sessions closed by this sweep
   */
  List<ClosedSession> sweepInactiveSessions(double now) {
    List<ClosedSession> closed = new ArrayList<>();
    try {
      for (OpenSession session : store.openSessions()) {
        if (now - session.lastActivity() <= properties.sessionInactivitySeconds()) {
          continue;
        }
        store.endSession(session.sessionId(), now);
        closed.add(new ClosedSession(session.sessionId(), session.address(), now));
        LOGGER.info("Ended session {} for {} (idle {}s)",
            session.sessionId(), session.address(), Math.round(now - session.lastActivity()));
      }
    } catch (SQLException ex) {
      LOGGER.error("Session sweep failed", ex);
    }

    closedSessionCounter.increment(closed.size());
    for (ClosedSession session : closed) {
      for (Consumer<ClosedSession> listener : closedSessionListeners) {
        try {
          listener.accept(session);
        } catch (Exception ex) {
          LOGGER.warn("Closed-session listener failed for {}", session.sessionId(), ex);
        }
      }
    }
    return closed;
  }

  private double now() {
    return clock.millis() / 1000.0;
  }
}
