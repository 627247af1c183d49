package com.ospicorp.priceapi.market;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

// Append-only price observations; days are UTC calendar days
@Repository
public class MarketPriceDao {
  private final JdbcTemplate jdbc;
  private final NamedParameterJdbcTemplate named;

  public MarketPriceDao(JdbcTemplate jdbc) {
    this.jdbc = jdbc;
    this.named = new NamedParameterJdbcTemplate(jdbc);
  }

  public Optional<PriceObservation> latest(String market) {
    String sql = """
      SELECT m.name, p.price_kg, p.observed_at, p.source
      FROM market_prices p
      JOIN markets m ON m.id = p.market_id
      WHERE m.name = ?
      ORDER BY p.observed_at DESC
      LIMIT 1
    """;
    List<PriceObservation> rows = jdbc.query(sql, (rs, i) -> new PriceObservation(
        rs.getString(1), rs.getDouble(2), rs.getTimestamp(3).toInstant(), rs.getString(4)),
        market);
    return rows.stream().findFirst();
  }

  public Map<String, Double> latestPrices(Collection<String> markets) {
    Map<String, Double> out = new LinkedHashMap<>();
    if (markets.isEmpty()) {
      return out;
    }
    String sql = """
      SELECT DISTINCT ON (m.name) m.name, p.price_kg
      FROM market_prices p
      JOIN markets m ON m.id = p.market_id
      WHERE m.name IN (:markets)
      ORDER BY m.name, p.observed_at DESC
    """;
    named.query(sql, new MapSqlParameterSource("markets", markets),
        rs -> { out.put(rs.getString(1), rs.getDouble(2)); });
    return out;
  }

  public Map<String, Double> pricesOn(Collection<String> markets, LocalDate day) {
    Map<String, Double> out = new LinkedHashMap<>();
    if (markets.isEmpty()) {
      return out;
    }
    String sql = """
      SELECT DISTINCT ON (m.name) m.name, p.price_kg
      FROM market_prices p
      JOIN markets m ON m.id = p.market_id
      WHERE m.name IN (:markets)
        AND p.observed_at >= :from AND p.observed_at < :to
      ORDER BY m.name, p.observed_at
    """;
    MapSqlParameterSource params = new MapSqlParameterSource()
        .addValue("markets", markets)
        .addValue("from", startOf(day))
        .addValue("to", startOf(day.plusDays(1)));
    named.query(sql, params, rs -> { out.put(rs.getString(1), rs.getDouble(2)); });
    return out;
  }

  public Optional<Double> priceOn(String market, LocalDate day) {
    return Optional.ofNullable(pricesOn(List.of(market), day).get(market));
  }

  public void record(long marketId, double priceKg, Instant observedAt, String source) {
    if (priceKg < 0) {
      throw new IllegalArgumentException("price_kg must be >= 0");
    }
    jdbc.update(
        "INSERT INTO market_prices (market_id, observed_at, price_kg, source) VALUES (?, ?, ?, ?)",
        marketId, Timestamp.from(observedAt), priceKg, source);
  }

  public void recordBatch(List<Object[]> rows) {
    jdbc.batchUpdate(
        "INSERT INTO market_prices (market_id, observed_at, price_kg, source) VALUES (?, ?, ?, ?)",
        rows);
  }

  private static Timestamp startOf(LocalDate day) {
    return Timestamp.from(day.atStartOfDay().toInstant(ZoneOffset.UTC));
  }
}
