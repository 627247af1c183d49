package com.ospicorp.priceapi.market;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

// Friction between a source market and a destination location
@Repository
public class MarketDistanceDao {
  private final JdbcTemplate jdbc;

  public MarketDistanceDao(JdbcTemplate jdbc) { this.jdbc = jdbc; }

  public Map<String, Double> distancesTo(String destination) {
    String sql = """
      SELECT source_market, distance
      FROM market_distances
      WHERE destination = ?
      ORDER BY source_market
    """;
    Map<String, Double> out = new LinkedHashMap<>();
    jdbc.query(sql, rs -> { out.put(rs.getString(1), rs.getDouble(2)); }, destination);
    return out;
  }

  public List<String> destinations() {
    return jdbc.queryForList(
        "SELECT DISTINCT destination FROM market_distances ORDER BY destination", String.class);
  }

  public void save(String sourceMarket, String destination, double distance) {
    String sql = """
      INSERT INTO market_distances (source_market, destination, distance)
      VALUES (?, ?, ?)
      ON CONFLICT (source_market, destination) DO UPDATE SET distance = EXCLUDED.distance
    """;
    jdbc.update(sql, sourceMarket, destination, distance);
  }
}
