package com.ospicorp.priceapi.calibration;

import com.ospicorp.priceapi.config.PricingProperties;
import com.ospicorp.priceapi.estimator.AdjustmentIndices;
import com.ospicorp.priceapi.estimator.EstimatorParameters;
import com.ospicorp.priceapi.estimator.PriceEstimator;
import com.ospicorp.priceapi.market.MarketDistanceDao;
import com.ospicorp.priceapi.market.MarketPriceDao;
import com.ospicorp.priceapi.state.ModelStateDao;
import com.ospicorp.priceapi.weather.WeatherDao;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Recomputes the residual sigma of a location by replaying the estimator over a trailing window
 * of days and comparing each estimate with the price actually observed at the location.
 *
 * <p>Each location is calibrated in its own transaction. A failing location is rolled back and
 * reported without affecting the others.
 */
@Service
public class CalibrationService {

  private static final Logger log = LoggerFactory.getLogger(CalibrationService.class);

  private final MarketDistanceDao distanceDao;
  private final MarketPriceDao priceDao;
  private final WeatherDao weatherDao;
  private final ModelStateDao stateDao;
  private final TransactionTemplate transactionTemplate;
  private final PricingProperties properties;
  private final Clock clock;

  public CalibrationService(MarketDistanceDao distanceDao, MarketPriceDao priceDao,
      WeatherDao weatherDao, ModelStateDao stateDao, TransactionTemplate transactionTemplate,
      PricingProperties properties, Clock clock) {
    this.distanceDao = distanceDao;
    this.priceDao = priceDao;
    this.weatherDao = weatherDao;
    this.stateDao = stateDao;
    this.transactionTemplate = transactionTemplate;
    this.properties = properties;
    this.clock = clock;
  }

  public CalibrationReport calibrateAll() {
    Instant startedAt = clock.instant();
    List<String> locations = properties.calibration().locations().isEmpty()
        ? distanceDao.destinations()
        : properties.calibration().locations();

    List<CalibrationResult> results = new ArrayList<>(locations.size());
    for (String location : locations) {
      results.add(calibrate(location));
    }

    CalibrationReport report = new CalibrationReport(startedAt, clock.instant(), results);
    log.info("Calibration finished: {} updated, {} skipped, {} failed of {} locations",
        report.updatedSigmas().size(), report.skipped().size(), report.failed().size(),
        locations.size());
    return report;
  }

  public CalibrationResult calibrate(String location) {
    PricingProperties.Calibration cfg = properties.calibration();
    return calibrate(location, cfg.windowDays(), cfg.minSamples());
  }

  public CalibrationResult calibrate(String location, int windowDays, int minSamples) {
    try {
      return transactionTemplate.execute(
          status -> calibrateInTransaction(location, windowDays, minSamples));
    } catch (RuntimeException ex) {
      log.error("Failed to compute sigma for {}: {}", location, ex.getMessage(), ex);
      String detail = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getName();
      return CalibrationResult.failed(location, detail);
    }
  }

  private CalibrationResult calibrateInTransaction(String location, int windowDays,
      int minSamples) {
    List<ResidualSample> samples = collectSamples(location, windowDays);
    if (samples.size() < minSamples) {
      log.warn("Insufficient data for {}: {} samples (need {})", location, samples.size(),
          minSamples);
      return CalibrationResult.skipped(location, samples.size(),
          "insufficient data: " + samples.size() + " of " + minSamples + " samples");
    }

    double sigma = ResidualStatistics.populationStdDev(samples);
    stateDao.saveSigma(location, sigma, clock.instant());
    log.info("Updated sigma for {}: {}", location, String.format("%.3f", sigma));
    return CalibrationResult.updated(location, sigma, samples.size());
  }

  List<ResidualSample> collectSamples(String location, int windowDays) {
    Map<String, Double> distances = distanceDao.distancesTo(location);
    if (distances.isEmpty()) {
      throw new NoSuchElementException("No market registry entry for location " + location);
    }

    EstimatorParameters parameters = properties.estimator().toParameters();
    int minMarkets = properties.calibration().minMarkets();
    Double previousBase = stateDao.findBase(location).orElse(null);
    LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);

    List<ResidualSample> samples = new ArrayList<>();
    for (int daysAgo = 1; daysAgo <= windowDays; daysAgo++) {
      LocalDate day = today.minusDays(daysAgo);

      Optional<Double> actual = priceDao.priceOn(location, day);
      if (actual.isEmpty()) {
        continue;
      }
      Map<String, Double> prices = priceDao.pricesOn(distances.keySet(), day);
      if (prices.size() < minMarkets) {
        continue;
      }
      double weatherIndex = weatherDao.indexOn(location, day).orElse(0d);

      double estimated = PriceEstimator.estimate(prices, distances, previousBase,
          AdjustmentIndices.neutral().withWeatherIndex(weatherIndex), parameters, null)
          .pointEstimate();
      samples.add(new ResidualSample(day, actual.get(), estimated));
    }
    return samples;
  }
}
