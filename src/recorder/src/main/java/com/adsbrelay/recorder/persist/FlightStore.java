package com.adsbrelay.recorder.persist;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;

/**
 * SQLite storage for the aircraft registry, flight sessions and paths.
 *
 * <p>Not thread-safe: only the {@link PersistenceWorker} thread uses it once it is running.
 */
public class FlightStore implements AutoCloseable {
  private static final String UPSERT_AIRCRAFT =
      "INSERT INTO aircraft (address, callsign, first_seen, last_seen, assembly_time_ms, stale_cpr_count) "
          + "VALUES (?, ?, ?, ?, ?, ?) "
          + "ON CONFLICT(address) DO UPDATE SET "
          + "callsign = COALESCE(excluded.callsign, aircraft.callsign), "
          + "first_seen = COALESCE(aircraft.first_seen, excluded.first_seen), "
          + "last_seen = COALESCE(excluded.last_seen, aircraft.last_seen), "
          + "assembly_time_ms = COALESCE(excluded.assembly_time_ms, aircraft.assembly_time_ms), "
          + "stale_cpr_count = COALESCE(excluded.stale_cpr_count, aircraft.stale_cpr_count)";
  private static final String START_SESSION =
      "INSERT OR IGNORE INTO flight_session (id, aircraft_address, start_time) VALUES (?, ?, ?)";
  private static final String END_SESSION =
      "UPDATE flight_session SET end_time = ? WHERE id = ?";
  private static final String INSERT_PATH =
      "INSERT INTO path (session_id, address, ts, ts_iso, lat, lon, alt, velocity, track, vertical_rate, type) "
          + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
  private static final String OPEN_SESSIONS =
      "SELECT s.id, s.aircraft_address, s.start_time, "
          + "(SELECT MAX(p.ts) FROM path p WHERE p.address = s.aircraft_address) AS last_path_ts "
          + "FROM flight_session s WHERE s.end_time IS NULL ORDER BY s.start_time";

  private final Connection connection;

  private FlightStore(Connection connection) {
    this.connection = connection;
  }

  /**
   * Opens (creating if needed) the database file and migrates it to the current schema.
   *
   * @param sqlitePath database file
   * @return ready store
   * @throws IllegalStateException when the file cannot be opened or migrated
   */
  public static FlightStore open(Path sqlitePath) {
    Connection connection = null;
    try {
      Path parent = sqlitePath.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      connection = DriverManager.getConnection("jdbc:sqlite:" + sqlitePath.toAbsolutePath());
      try (Statement statement = connection.createStatement()) {
        statement.execute("PRAGMA journal_mode=WAL");
      }
      SchemaMigrations.apply(connection);
      return new FlightStore(connection);
    } catch (Exception ex) {
      closeQuietly(connection);
      throw new IllegalStateException("Failed to open flight store at " + sqlitePath, ex);
    }
  }

  void upsertAircraft(PersistenceTask.UpsertAircraft task) throws SQLException {
    try (PreparedStatement stmt = connection.prepareStatement(UPSERT_AIRCRAFT)) {
      stmt.setString(1, task.address());
      stmt.setString(2, task.callsign());
      setNullableDouble(stmt, 3, task.firstSeen());
      setNullableDouble(stmt, 4, task.lastUpdate());
      setNullableDouble(stmt, 5, task.assemblyTimeMs());
      setNullableInteger(stmt, 6, task.staleCprCount());
      stmt.executeUpdate();
    }
  }

  void startSession(PersistenceTask.StartSession task) throws SQLException {
    try (PreparedStatement stmt = connection.prepareStatement(START_SESSION)) {
      stmt.setString(1, task.sessionId());
      stmt.setString(2, task.address());
      stmt.setDouble(3, task.startTime());
      stmt.executeUpdate();
    }
  }

  void endSession(String sessionId, double endTime) throws SQLException {
    try (PreparedStatement stmt = connection.prepareStatement(END_SESSION)) {
      stmt.setDouble(1, endTime);
      stmt.setString(2, sessionId);
      stmt.executeUpdate();
    }
  }

  void insertPathPoint(PersistenceTask.InsertPathPoint task) throws SQLException {
    try (PreparedStatement stmt = connection.prepareStatement(INSERT_PATH)) {
      stmt.setString(1, task.sessionId());
      stmt.setString(2, task.address());
      stmt.setDouble(3, task.ts());
      stmt.setString(4, task.tsIso());
      stmt.setDouble(5, task.lat());
      stmt.setDouble(6, task.lon());
      setNullableInteger(stmt, 7, task.altitude());
      setNullableDouble(stmt, 8, task.speed());
      setNullableDouble(stmt, 9, task.track());
      setNullableInteger(stmt, 10, task.verticalRate());
      stmt.setString(11, task.velocityType());
      stmt.executeUpdate();
    }
  }

  /** Lists every session with no end time, with the latest path timestamp of its aircraft. */
  public List<OpenSession> openSessions() throws SQLException {
    List<OpenSession> sessions = new ArrayList<>();
    try (PreparedStatement stmt = connection.prepareStatement(OPEN_SESSIONS);
         ResultSet rs = stmt.executeQuery()) {
      while (rs.next()) {
        double lastPath = rs.getDouble("last_path_ts");
        Double lastPathTs = rs.wasNull() ? null : lastPath;
        sessions.add(new OpenSession(
            rs.getString("id"),
            rs.getString("aircraft_address"),
            rs.getDouble("start_time"),
            lastPathTs));
      }
    }
    return sessions;
  }

  @Override
  public void close() {
    closeQuietly(connection);
  }

  private static void setNullableDouble(PreparedStatement stmt, int index, Double value) throws SQLException {
    if (value == null) {
      stmt.setNull(index, Types.REAL);
    } else {
      stmt.setDouble(index, value);
    }
  }

  private static void setNullableInteger(PreparedStatement stmt, int index, Integer value) throws SQLException {
    if (value == null) {
      stmt.setNull(index, Types.INTEGER);
    } else {
      stmt.setInt(index, value);
    }
  }

  private static void closeQuietly(Connection connection) {
    if (connection == null) {
      return;
    }
    try {
      connection.close();
    } catch (Exception ignored) {
      // ignore
    }
  }
}
