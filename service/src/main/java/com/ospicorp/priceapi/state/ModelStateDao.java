package com.ospicorp.priceapi.state;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class ModelStateDao {
  private final JdbcTemplate jdbc;

  public ModelStateDao(JdbcTemplate jdbc) { this.jdbc = jdbc; }

  public Optional<Double> findBase(String location) {
    List<Double> rows = jdbc.query("SELECT base FROM smoothed_base WHERE location = ?",
        (rs, i) -> rs.getDouble(1), location);
    return rows.stream().findFirst();
  }

  // Must run inside a transaction. The advisory lock also covers a location that has no
  // row yet and is held until the transaction ends.
  public Optional<Double> lockBase(String location) {
    jdbc.query("SELECT pg_advisory_xact_lock(hashtext(?))", rs -> { }, location);
    return findBase(location);
  }

  public void saveBase(String location, double base, Instant updatedAt) {
    String sql = """
      INSERT INTO smoothed_base (location, base, updated_at)
      VALUES (?, ?, ?)
      ON CONFLICT (location) DO UPDATE
        SET base = EXCLUDED.base, updated_at = EXCLUDED.updated_at
    """;
    jdbc.update(sql, location, base, Timestamp.from(updatedAt));
  }

  public Optional<SigmaRecord> findSigma(String location) {
    List<SigmaRecord> rows = jdbc.query(
        "SELECT location, sigma, last_updated FROM location_sigma WHERE location = ?",
        (rs, i) -> new SigmaRecord(rs.getString(1), rs.getDouble(2),
                                   rs.getTimestamp(3).toInstant()),
        location);
    return rows.stream().findFirst();
  }

  public void saveSigma(String location, double sigma, Instant lastUpdated) {
    if (sigma < 0 || Double.isNaN(sigma)) {
      throw new IllegalArgumentException("sigma must be a non-negative number: " + sigma);
    }
    String sql = """
      INSERT INTO location_sigma (location, sigma, last_updated)
      VALUES (?, ?, ?)
      ON CONFLICT (location) DO UPDATE
        SET sigma = EXCLUDED.sigma, last_updated = EXCLUDED.last_updated
    """;
    jdbc.update(sql, location, sigma, Timestamp.from(lastUpdated));
  }
}
