package com.adsbrelay.recorder.persist;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the base schema and applies additive column migrations.
 *
 * <p>Migrations only ever add nullable columns, in list order, and are skipped when the column is
 * already present, so running them again is a no-op. Nothing is dropped or renamed.
 */
final class SchemaMigrations {
  private static final Logger LOGGER = LoggerFactory.getLogger(SchemaMigrations.class);

  private static final List<String> BASE_SCHEMA = List.of(
      "CREATE TABLE IF NOT EXISTS aircraft ("
          + "address TEXT PRIMARY KEY, "
          + "callsign TEXT, "
          + "first_seen REAL, "
          + "last_seen REAL)",
      "CREATE TABLE IF NOT EXISTS flight_session ("
          + "id TEXT PRIMARY KEY, "
          + "aircraft_address TEXT, "
          + "start_time REAL, "
          + "end_time REAL)",
      "CREATE INDEX IF NOT EXISTS idx_flight_session_aircraft ON flight_session(aircraft_address)",
      "CREATE TABLE IF NOT EXISTS path ("
          + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
          + "session_id TEXT, "
          + "address TEXT, "
          + "ts REAL, "
          + "ts_iso TEXT, "
          + "lat REAL, "
          + "lon REAL, "
          + "alt REAL)",
      "CREATE INDEX IF NOT EXISTS idx_path_address_ts ON path(address, ts)");

  static final List<ColumnMigration> COLUMN_MIGRATIONS = List.of(
      new ColumnMigration("path", "velocity", "REAL"),
      new ColumnMigration("path", "track", "REAL"),
      new ColumnMigration("path", "vertical_rate", "REAL"),
      new ColumnMigration("path", "type", "TEXT"),
      new ColumnMigration("aircraft", "assembly_time_ms", "REAL"),
      new ColumnMigration("aircraft", "stale_cpr_count", "INTEGER"));

  record ColumnMigration(String table, String column, String sqlType) {}

  private SchemaMigrations() {}

  /**
   * Brings the database at {@code connection} to the current schema.
   *
   * @return number of columns added
   */
  static int apply(Connection connection) throws SQLException {
    try (Statement statement = connection.createStatement()) {
      for (String ddl : BASE_SCHEMA) {
        statement.execute(ddl);
      }
    }

    int added = 0;
    for (ColumnMigration migration : COLUMN_MIGRATIONS) {
      if (columns(connection, migration.table()).contains(migration.column())) {
        continue;
      }
      try (Statement statement = connection.createStatement()) {
        statement.execute("ALTER TABLE " + migration.table()
            + " ADD COLUMN " + migration.column() + " " + migration.sqlType());
      }
      LOGGER.info("Added column {}.{}", migration.table(), migration.column());
      added++;
    }
    return added;
  }

  static Set<String> columns(Connection connection, String table) throws SQLException {
    Set<String> columns = new HashSet<>();
    try (PreparedStatement stmt = connection.prepareStatement("PRAGMA table_info(" + table + ")");
         ResultSet rs = stmt.executeQuery()) {
      while (rs.next()) {
        String name = rs.getString("name");
        if (name != null) {
          columns.add(name);
        }
      }
    }
    return columns;
  }
}
