package com.ospicorp.priceapi.pricing;

import com.ospicorp.priceapi.config.PricingProperties;
import com.ospicorp.priceapi.estimator.AdjustmentIndices;
import com.ospicorp.priceapi.estimator.PriceEstimate;
import com.ospicorp.priceapi.estimator.PriceEstimator;
import com.ospicorp.priceapi.market.MarketDistanceDao;
import com.ospicorp.priceapi.market.MarketPriceDao;
import com.ospicorp.priceapi.state.ModelStateDao;
import com.ospicorp.priceapi.state.SigmaRecord;
import com.ospicorp.priceapi.weather.WeatherService;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
public class EstimateService {
  private static final Logger log = LoggerFactory.getLogger(EstimateService.class);

  private final MarketDistanceDao distanceDao;
  private final MarketPriceDao priceDao;
  private final ModelStateDao stateDao;
  private final WeatherService weatherService;
  private final PricingProperties properties;
  private final Clock clock;

  public EstimateService(MarketDistanceDao distanceDao, MarketPriceDao priceDao,
      ModelStateDao stateDao, WeatherService weatherService, PricingProperties properties,
      Clock clock) {
    this.distanceDao = distanceDao;
    this.priceDao = priceDao;
    this.stateDao = stateDao;
    this.weatherService = weatherService;
    this.properties = properties;
    this.clock = clock;
  }

  @Transactional
  public EstimateResponse estimate(EstimateRequest request) {
    if (request == null || !StringUtils.hasText(request.location())) {
      throw new IllegalArgumentException("location must be provided");
    }
    String location = request.location().trim();

    Map<String, Double> distances = distanceDao.distancesTo(location);
    if (distances.isEmpty()) {
      throw new NoSuchElementException("No reference markets registered for " + location);
    }
    Map<String, Double> prices = currentPrices(distances.keySet(), request.overridesOrEmpty());
    if (prices.isEmpty()) {
      throw new NoSuchElementException("No market prices available for " + location);
    }

    Double previousBase = stateDao.lockBase(location).orElse(null);
    double weatherIndex = request.weatherOverride() != null
        ? request.weatherOverride()
        : weatherService.latestIndex(location).orElse(0d);

    Optional<SigmaRecord> calibrated = stateDao.findSigma(location);
    double sigma = calibrated.map(SigmaRecord::sigma).orElse(properties.sigma().fallback());

    AdjustmentIndices indices = new AdjustmentIndices(
        request.seasonIndexOrDefault(),
        request.logisticsMode(),
        request.shockIndexOrDefault(),
        request.varietyGradeFactorOrDefault(),
        weatherIndex);

    PriceEstimate estimate = PriceEstimator.estimate(prices, distances, previousBase, indices,
        properties.estimator().toParameters(), sigma);
    stateDao.saveBase(location, estimate.newBase(), clock.instant());

    log.debug("Estimate for {} from {} markets: {} (base {} -> {}, sigma {})", location,
        prices.size(), estimate.pointEstimate(), previousBase, estimate.newBase(), sigma);

    return new EstimateResponse(
        PriceEstimator.round(estimate.pointEstimate(), 2),
        properties.units(),
        List.of(PriceEstimator.round(estimate.band().lower(), 2),
            PriceEstimator.round(estimate.band().upper(), 2)),
        sigma,
        calibrated.isPresent()
            ? EstimateResponse.SigmaSource.CALIBRATED
            : EstimateResponse.SigmaSource.DEFAULT,
        estimate.explain(),
        List.of(properties.sourceLabel()));
  }

  // Overrides win over stored prices; markets with neither are left out
  private Map<String, Double> currentPrices(Iterable<String> markets,
      Map<String, Double> overrides) {
    List<String> lookup = new ArrayList<>();
    for (String market : markets) {
      if (!overrides.containsKey(market)) {
        lookup.add(market);
      }
    }
    Map<String, Double> stored = priceDao.latestPrices(lookup);

    Map<String, Double> prices = new LinkedHashMap<>();
    for (String market : markets) {
      Double price = overrides.containsKey(market) ? overrides.get(market) : stored.get(market);
      if (price != null) {
        prices.put(market, price);
      }
    }
    return prices;
  }
}
