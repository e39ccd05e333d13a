package com.adsbrelay.recorder;

import com.adsbrelay.recorder.feed.AircraftView;
import com.adsbrelay.recorder.feed.SnapshotMirror;
import com.adsbrelay.recorder.persist.ClosedSession;
import com.adsbrelay.recorder.persist.OpenSession;
import com.adsbrelay.recorder.persist.PersistenceTask;
import com.adsbrelay.recorder.persist.PersistenceWorker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Turns the mirrored snapshot into persistence tasks on a fixed cadence.
 *
 * <p>Every cycle upserts each mirrored aircraft. A path point is only written when the aircraft
 * has a position and its {@code last_update} moved past the last one persisted; the first such
 * point opens a flight session. Sessions are only ever ended by the worker's inactivity sweep,
 * which reports them back through {@link #onSessionClosed(ClosedSession)}.
 */
@Component
public class SnapshotPersistenceJob {
  private static final Logger log = LoggerFactory.getLogger(SnapshotPersistenceJob.class);

  private final SnapshotMirror mirror;
  private final PersistenceWorker worker;
  private final Counter pathCounter;
  private final Counter sessionCounter;
  private final Counter errorCounter;
  // Both maps are only touched by the scheduler thread (and by resumeOpenSessions before it starts).
  private final Map<String, Double> lastPersistedUpdate = new HashMap<>();
  private final Map<String, String> activeSessions = new HashMap<>();
  private final Queue<ClosedSession> closedSessions = new ConcurrentLinkedQueue<>();

  public SnapshotPersistenceJob(SnapshotMirror mirror, PersistenceWorker worker, MeterRegistry meterRegistry) {
    this.mirror = mirror;
    this.worker = worker;
    this.pathCounter = meterRegistry.counter("recorder.path.points");
    this.sessionCounter = meterRegistry.counter("recorder.sessions.started");
    this.errorCounter = meterRegistry.counter("recorder.persist.errors");
  }

  /** Picks up sessions left open by a previous run so a restart does not split a flight. */
  @PostConstruct
  public void resumeOpenSessions() {
    for (OpenSession session : worker.resumableSessions()) {
      activeSessions.put(session.address(), session.sessionId());
      if (session.lastPathTs() != null) {
        lastPersistedUpdate.put(session.address(), session.lastPathTs());
      }
    }
    worker.addClosedSessionListener(this::onSessionClosed);
    if (!activeSessions.isEmpty()) {
      log.info("Resumed {} open flight sessions", activeSessions.size());
    }
  }

  /** Inbox for sessions ended by the worker; drained at the start of the next cycle. */
  public void onSessionClosed(ClosedSession session) {
    closedSessions.add(session);
  }

  @Scheduled(fixedDelayString = "${recorder.persistence.interval-ms}")
  public void persist() {
    try {
      persistSnapshot();
    } catch (Exception ex) {
      // Keep the scheduler running even if a cycle fails.
      errorCounter.increment();
      log.error("Persistence cycle failed", ex);
    }
  }

  private void persistSnapshot() {
    forgetClosedSessions();

    Map<String, AircraftView> aircraft = mirror.current();
    if (aircraft.isEmpty()) {
      log.debug("No aircraft in mirror; nothing to persist");
      return;
    }

    int points = 0;
    for (Map.Entry<String, AircraftView> entry : aircraft.entrySet()) {
      String address = entry.getKey();
      AircraftView view = entry.getValue();
      worker.enqueue(new PersistenceTask.UpsertAircraft(
          address,
          view.callsign(),
          view.firstSeen(),
          view.lastUpdate(),
          view.assemblyTimeMs(),
          view.staleCprCount()));

      Double lastUpdate = view.lastUpdate();
      if (lastUpdate == null || !view.hasPosition()) {
        continue;
      }
      Double previous = lastPersistedUpdate.get(address);
      if (previous != null && lastUpdate <= previous) {
        continue;
      }

      String sessionId = activeSessions.get(address);
      if (sessionId == null) {
        sessionId = UUID.randomUUID().toString();
        activeSessions.put(address, sessionId);
        worker.enqueue(new PersistenceTask.StartSession(sessionId, address, lastUpdate));
        sessionCounter.increment();
        log.info("Started session {} for {}", sessionId, address);
      }

      worker.enqueue(toPathPoint(sessionId, address, lastUpdate, view));
      lastPersistedUpdate.put(address, lastUpdate);
      points++;
    }
    pathCounter.increment(points);
    log.debug("Persisted {} aircraft, {} new path points", aircraft.size(), points);
  }

  private void forgetClosedSessions() {
    ClosedSession closed;
    while ((closed = closedSessions.poll()) != null) {
      // Only forget the session if it is still the one tracked for that aircraft.
      activeSessions.remove(closed.address(), closed.sessionId());
    }
  }

  private static PersistenceTask.InsertPathPoint toPathPoint(
      String sessionId, String address, double ts, AircraftView view) {
    AircraftView.Velocity velocity = view.velocity();
    return new PersistenceTask.InsertPathPoint(
        sessionId,
        address,
        ts,
        Instant.ofEpochMilli(Math.round(ts * 1000.0)).toString(),
        view.position().lat(),
        view.position().lon(),
        view.altitude(),
        velocity == null ? null : velocity.speed(),
        velocity == null ? null : velocity.track(),
        velocity == null ? null : velocity.verticalRate(),
        velocity == null ? null : velocity.type());
  }
}
