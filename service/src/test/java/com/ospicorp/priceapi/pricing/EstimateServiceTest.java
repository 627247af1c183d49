package com.ospicorp.priceapi.pricing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.doubleThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.ospicorp.priceapi.config.PricingProperties;
import com.ospicorp.priceapi.market.MarketDistanceDao;
import com.ospicorp.priceapi.market.MarketPriceDao;
import com.ospicorp.priceapi.state.ModelStateDao;
import com.ospicorp.priceapi.state.SigmaRecord;
import com.ospicorp.priceapi.weather.WeatherService;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EstimateServiceTest {

  private static final Instant NOW = Instant.parse("2024-06-30T12:00:00Z");

  private MarketDistanceDao distanceDao;
  private MarketPriceDao priceDao;
  private ModelStateDao stateDao;
  private WeatherService weatherService;
  private EstimateService service;

  @BeforeEach
  void setUp() {
    distanceDao = mock(MarketDistanceDao.class);
    priceDao = mock(MarketPriceDao.class);
    stateDao = mock(ModelStateDao.class);
    weatherService = mock(WeatherService.class);

    var properties = new PricingProperties("KES/kg", "KAMIS/NPCK (db)",
        new PricingProperties.Estimator(0.12, 0.08, 0.12, 0.4),
        new PricingProperties.Sigma(1.0),
        new PricingProperties.Calibration(30, 10, 2, List.of()));
    service = new EstimateService(distanceDao, priceDao, stateDao, weatherService, properties,
        Clock.fixed(NOW, ZoneOffset.UTC));

    Map<String, Double> distances = new LinkedHashMap<>();
    distances.put("Nairobi", 0.0);
    distances.put("Nakuru", 50.0);
    when(distanceDao.distancesTo("Nairobi")).thenReturn(distances);
    when(distanceDao.distancesTo("Atlantis")).thenReturn(Map.of());
    when(priceDao.latestPrices(anyCollection()))
        .thenReturn(Map.of("Nairobi", 100.0, "Nakuru", 90.0));
    when(stateDao.lockBase(anyString())).thenReturn(Optional.empty());
    when(stateDao.findSigma(anyString())).thenReturn(Optional.empty());
    when(weatherService.latestIndex(anyString())).thenReturn(Optional.empty());
  }

  private static EstimateRequest wholesale(Map<String, Double> overrides, Double weather) {
    return new EstimateRequest("Nairobi", "wholesale", null, null, null, overrides, weather);
  }

  @Test
  void firstEstimateUsesRawBaseAndDefaultSigma() {
    EstimateResponse response = service.estimate(wholesale(null, null));

    assertThat(response.estimate()).isEqualTo(99.81);
    assertThat(response.range()).containsExactly(98.81, 100.81);
    assertThat(response.sigma()).isEqualTo(1.0);
    assertThat(response.sigmaSource()).isEqualTo(EstimateResponse.SigmaSource.DEFAULT);
    assertThat(response.units()).isEqualTo("KES/kg");
    assertThat(response.sources()).containsExactly("KAMIS/NPCK (db)");
    assertThat(response.explain().baseSmoothed()).isEqualTo(99.808);
    verify(stateDao).saveBase(eq("Nairobi"),
        doubleThat(v -> Math.abs(v - 5190.0 / 52.0) < 1e-9), eq(NOW));
  }

  @Test
  void calibratedSigmaSizesTheBand() {
    when(stateDao.findSigma("Nairobi"))
        .thenReturn(Optional.of(new SigmaRecord("Nairobi", 4.0, NOW)));

    EstimateResponse response = service.estimate(wholesale(null, null));

    assertThat(response.sigma()).isEqualTo(4.0);
    assertThat(response.range()).containsExactly(95.81, 103.81);
    assertThat(response.sigmaSource()).isEqualTo(EstimateResponse.SigmaSource.CALIBRATED);
  }

  @Test
  void previousBaseIsSmoothedAndPersisted() {
    when(priceDao.latestPrices(anyCollection())).thenReturn(Map.of("Nairobi", 100.0));
    when(stateDao.lockBase("Nairobi")).thenReturn(Optional.of(90.0));

    EstimateResponse response = service.estimate(wholesale(null, null));

    assertThat(response.estimate()).isEqualTo(94.0);
    verify(stateDao).saveBase(eq("Nairobi"), doubleThat(v -> Math.abs(v - 94.0) < 1e-9),
        eq(NOW));
  }

  @Test
  void overridesReplaceStoredPrices() {
    when(priceDao.latestPrices(anyCollection())).thenReturn(Map.of("Nairobi", 100.0));

    EstimateResponse response = service.estimate(
        wholesale(Map.of("Nakuru", 90.0, "Kisumu", 500.0), null));

    assertThat(response.estimate()).isEqualTo(99.81);
    verify(priceDao).latestPrices(argThat(markets ->
        markets.size() == 1 && markets.contains("Nairobi")));
  }

  @Test
  void weatherOverrideWinsOverStoredReading() {
    when(priceDao.latestPrices(anyCollection())).thenReturn(Map.of("Nairobi", 100.0));

    EstimateResponse response = service.estimate(wholesale(null, 1.0));

    assertThat(response.estimate()).isEqualTo(112.0);
    assertThat(response.explain().weatherMultiplier()).isEqualTo(1.12);
    verifyNoInteractions(weatherService);
  }

  @Test
  void storedWeatherIndexIsApplied() {
    when(priceDao.latestPrices(anyCollection())).thenReturn(Map.of("Nairobi", 100.0));
    when(weatherService.latestIndex("Nairobi")).thenReturn(Optional.of(0.5));

    EstimateResponse response = service.estimate(wholesale(null, null));

    assertThat(response.explain().weatherMultiplier()).isEqualTo(1.06);
    assertThat(response.estimate()).isCloseTo(106.0, offset(1e-9));
  }

  @Test
  void marketsWithoutPriceAreLeftOut() {
    when(priceDao.latestPrices(anyCollection())).thenReturn(Map.of("Nakuru", 90.0));

    EstimateResponse response = service.estimate(wholesale(null, null));

    assertThat(response.estimate()).isEqualTo(90.0);
  }

  @Test
  void unknownLocationIsNotFoundAndStateUntouched() {
    EstimateRequest request =
        new EstimateRequest("Atlantis", "retail", null, null, null, null, null);

    assertThatThrownBy(() -> service.estimate(request))
        .isInstanceOf(NoSuchElementException.class)
        .hasMessageContaining("Atlantis");
    verify(stateDao, never()).saveBase(anyString(), anyDouble(), any());
  }

  @Test
  void noPricesIsNotFound() {
    when(priceDao.latestPrices(anyCollection())).thenReturn(Map.of());

    assertThatThrownBy(() -> service.estimate(wholesale(null, null)))
        .isInstanceOf(NoSuchElementException.class);
    verify(stateDao, never()).saveBase(anyString(), anyDouble(), any());
  }

  @Test
  void blankLocationIsRejected() {
    EstimateRequest request = new EstimateRequest(" ", "retail", null, null, null, null, null);

    assertThatThrownBy(() -> service.estimate(request))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
