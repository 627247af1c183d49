package com.ospicorp.priceapi.weather;

import com.ospicorp.priceapi.market.Market;
import com.ospicorp.priceapi.market.MarketRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class WeatherService {
  private static final Logger log = LoggerFactory.getLogger(WeatherService.class);
  static final int MAX_HISTORY_DAYS = 30;
  // Upstream may report several readings per day
  private static final int READINGS_PER_DAY = 4;

  private final MarketRepository marketRepository;
  private final WeatherDao weatherDao;
  private final WeatherClient client;
  private final Clock clock;
  private final int retentionDays;

  public WeatherService(MarketRepository marketRepository, WeatherDao weatherDao,
      WeatherClient client, Clock clock,
      @Value("${pricing.weather.retention-days:90}") int retentionDays) {
    this.marketRepository = marketRepository;
    this.weatherDao = weatherDao;
    this.client = client;
    this.clock = clock;
    this.retentionDays = retentionDays;
  }

  public int refreshAll() {
    if (!client.isConfigured()) {
      log.info("Weather API key not configured; skipping weather refresh");
      return 0;
    }
    List<Market> markets = marketRepository.findAllWithCoordinates();
    int updated = 0;
    for (Market market : markets) {
      try {
        WeatherObservation observation = client.fetch(market.getLat(), market.getLon());
        weatherDao.save(market.getId(), observation);
        updated++;
        log.info("Fetched weather data for market {}", market.getName());
      } catch (RuntimeException ex) {
        log.error("Failed to fetch weather for market {}: {}", market.getName(), ex.getMessage());
      }
    }
    log.info("Updated weather data for {}/{} markets", updated, markets.size());
    return updated;
  }

  public Optional<Double> latestIndex(String location) {
    return weatherDao.latest(location).map(WeatherReading::weatherIndex);
  }

  @Transactional
  public WeatherReading latest(String location) {
    Market market = marketRepository.findByName(location)
        .orElseThrow(() -> new NoSuchElementException("Unknown location: " + location));
    Optional<WeatherReading> stored = weatherDao.latest(location);
    if (stored.isPresent()) {
      return stored.get();
    }
    if (!market.hasCoordinates()) {
      throw new NoSuchElementException("No weather data for " + location);
    }
    WeatherObservation observation = client.fetch(market.getLat(), market.getLon());
    weatherDao.save(market.getId(), observation);
    return new WeatherReading(location, observation.timestamp(), observation.rainMm(),
        observation.weatherCode(), observation.weatherIndex());
  }

  public List<WeatherReading> history(String location, int days) {
    if (days < 1 || days > MAX_HISTORY_DAYS) {
      throw new IllegalArgumentException("days must be between 1 and " + MAX_HISTORY_DAYS);
    }
    if (marketRepository.findByName(location).isEmpty()) {
      throw new NoSuchElementException("Unknown location: " + location);
    }
    Instant since = clock.instant().minus(Duration.ofDays(days));
    return weatherDao.history(location, since, days * READINGS_PER_DAY);
  }

  @Transactional
  public int purgeExpired() {
    Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
    int deleted = weatherDao.deleteOlderThan(cutoff);
    log.info("Cleaned up {} old weather records", deleted);
    return deleted;
  }
}
