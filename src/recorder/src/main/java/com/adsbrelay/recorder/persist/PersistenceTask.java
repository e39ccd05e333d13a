package com.adsbrelay.recorder.persist;

import java.sql.SQLException;

/** Unit of work applied by the {@link PersistenceWorker} thread. Implementations are immutable. */
public interface PersistenceTask {

  void applyTo(FlightStore store) throws SQLException;

  /** Insert-or-update of the aircraft registry row. */
  record UpsertAircraft(
      String address,
      String callsign,
      Double firstSeen,
      Double lastUpdate,
      Double assemblyTimeMs,
      Integer staleCprCount) implements PersistenceTask {
    @Override
    public void applyTo(FlightStore store) throws SQLException {
      store.upsertAircraft(this);
    }
  }

  /** Opens a flight session; a second start with the same id is ignored. */
  record StartSession(String sessionId, String address, double startTime) implements PersistenceTask {
    @Override
    public void applyTo(FlightStore store) throws SQLException {
      store.startSession(this);
    }
  }

  record EndSession(String sessionId, double endTime) implements PersistenceTask {
    @Override
    public void applyTo(FlightStore store) throws SQLException {
      store.endSession(sessionId, endTime);
    }
  }

  /** Appends one point to a session's path. */
  record InsertPathPoint(
      String sessionId,
      String address,
      double ts,
      String tsIso,
      double lat,
      double lon,
      Integer altitude,
      Double speed,
      Double track,
      Integer verticalRate,
      String velocityType) implements PersistenceTask {
    @Override
    public void applyTo(FlightStore store) throws SQLException {
      store.insertPathPoint(this);
    }
  }
}
