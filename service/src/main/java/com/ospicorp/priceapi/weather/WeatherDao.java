package com.ospicorp.priceapi.weather;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class WeatherDao {
  private final JdbcTemplate jdbc;

  public WeatherDao(JdbcTemplate jdbc) { this.jdbc = jdbc; }

  public Optional<WeatherReading> latest(String market) {
    String sql = """
      SELECT m.name, w.observed_at, w.rain_mm, w.weather_code, w.weather_index
      FROM weather_data w
      JOIN markets m ON m.id = w.market_id
      WHERE m.name = ?
      ORDER BY w.observed_at DESC
      LIMIT 1
    """;
    return jdbc.query(sql, WeatherDao::mapReading, market).stream().findFirst();
  }

  public List<WeatherReading> history(String market, Instant since, int limit) {
    String sql = """
      SELECT m.name, w.observed_at, w.rain_mm, w.weather_code, w.weather_index
      FROM weather_data w
      JOIN markets m ON m.id = w.market_id
      WHERE m.name = ? AND w.observed_at >= ?
      ORDER BY w.observed_at DESC
      LIMIT ?
    """;
    return jdbc.query(sql, WeatherDao::mapReading, market, Timestamp.from(since), limit);
  }

  // First reading of the UTC day
  public Optional<Double> indexOn(String market, LocalDate day) {
    String sql = """
      SELECT w.weather_index
      FROM weather_data w
      JOIN markets m ON m.id = w.market_id
      WHERE m.name = ? AND w.observed_at >= ? AND w.observed_at < ?
      ORDER BY w.observed_at
      LIMIT 1
    """;
    List<Double> rows = jdbc.query(sql, (rs, i) -> rs.getDouble(1), market,
        Timestamp.from(day.atStartOfDay().toInstant(ZoneOffset.UTC)),
        Timestamp.from(day.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC)));
    return rows.stream().findFirst();
  }

  public void save(long marketId, WeatherObservation observation) {
    String sql = """
      INSERT INTO weather_data (market_id, observed_at, rain_mm, weather_code, weather_index, raw)
      VALUES (?, ?, ?, ?, ?, ?)
    """;
    jdbc.update(sql, marketId, Timestamp.from(observation.timestamp()), observation.rainMm(),
        observation.weatherCode(), observation.weatherIndex(), observation.rawPayload());
  }

  public int deleteOlderThan(Instant cutoff) {
    return jdbc.update("DELETE FROM weather_data WHERE observed_at < ?", Timestamp.from(cutoff));
  }

  private static WeatherReading mapReading(ResultSet rs, int rowNum) throws SQLException {
    return new WeatherReading(
        rs.getString(1),
        rs.getTimestamp(2).toInstant(),
        rs.getDouble(3),
        rs.getString(4),
        rs.getDouble(5));
  }
}
