package com.ospicorp.priceapi.weather;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.ospicorp.priceapi.market.Market;
import com.ospicorp.priceapi.market.MarketRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class WeatherServiceTest {

  private static final Instant NOW = Instant.parse("2024-06-30T06:00:00Z");

  private MarketRepository marketRepository;
  private WeatherDao weatherDao;
  private WeatherClient client;
  private WeatherService service;

  @BeforeEach
  void setUp() {
    marketRepository = mock(MarketRepository.class);
    weatherDao = mock(WeatherDao.class);
    client = mock(WeatherClient.class);
    service = new WeatherService(marketRepository, weatherDao, client,
        Clock.fixed(NOW, ZoneOffset.UTC), 90);
  }

  private static Market market(long id, String name, double lat, double lon) {
    Market market = new Market(name, name, lat, lon);
    ReflectionTestUtils.setField(market, "id", id);
    return market;
  }

  private static WeatherObservation observation(double rain) {
    return new WeatherObservation(NOW, rain, "500", rain / 30.0, "{}");
  }

  @Test
  void refreshIsSkippedWithoutApiKey() {
    when(client.isConfigured()).thenReturn(false);

    assertThat(service.refreshAll()).isZero();
    verifyNoInteractions(marketRepository, weatherDao);
  }

  @Test
  void failingMarketDoesNotStopRefresh() {
    when(client.isConfigured()).thenReturn(true);
    when(marketRepository.findAllWithCoordinates()).thenReturn(List.of(
        market(1, "Nairobi", -1.2921, 36.8219),
        market(2, "Mombasa", -4.0435, 39.6682)));
    when(client.fetch(-1.2921, 36.8219))
        .thenThrow(new WeatherFetchException("timeout", null));
    when(client.fetch(-4.0435, 39.6682)).thenReturn(observation(6.0));

    assertThat(service.refreshAll()).isEqualTo(1);
    verify(weatherDao).save(eq(2L), any());
    verify(weatherDao, never()).save(eq(1L), any());
  }

  @Test
  void latestFetchesAndStoresWhenNothingStored() {
    when(marketRepository.findByName("Nairobi"))
        .thenReturn(Optional.of(market(1, "Nairobi", -1.2921, 36.8219)));
    when(weatherDao.latest("Nairobi")).thenReturn(Optional.empty());
    when(client.fetch(-1.2921, 36.8219)).thenReturn(observation(15.0));

    WeatherReading reading = service.latest("Nairobi");

    assertThat(reading.market()).isEqualTo("Nairobi");
    assertThat(reading.weatherIndex()).isEqualTo(0.5);
    verify(weatherDao).save(eq(1L), any());
  }

  @Test
  void latestPrefersStoredReading() {
    WeatherReading stored = new WeatherReading("Nairobi", NOW, 3.0, "500", 0.1);
    when(marketRepository.findByName("Nairobi"))
        .thenReturn(Optional.of(market(1, "Nairobi", -1.2921, 36.8219)));
    when(weatherDao.latest("Nairobi")).thenReturn(Optional.of(stored));

    assertThat(service.latest("Nairobi")).isEqualTo(stored);
    verify(client, never()).fetch(anyDouble(), anyDouble());
  }

  @Test
  void unknownLocationIsNotFound() {
    when(marketRepository.findByName("Atlantis")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.latest("Atlantis"))
        .isInstanceOf(NoSuchElementException.class);
  }

  @Test
  void historyWindowIsBounded() {
    assertThatThrownBy(() -> service.history("Nairobi", 0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> service.history("Nairobi", 31))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void historyLooksBackRequestedDays() {
    when(marketRepository.findByName("Nairobi"))
        .thenReturn(Optional.of(market(1, "Nairobi", -1.2921, 36.8219)));
    when(weatherDao.history(eq("Nairobi"), any(), anyInt())).thenReturn(List.of());

    assertThat(service.history("Nairobi", 7)).isEmpty();
    verify(weatherDao).history("Nairobi", Instant.parse("2024-06-23T06:00:00Z"), 28);
  }

  @Test
  void purgeUsesRetentionWindow() {
    when(weatherDao.deleteOlderThan(any())).thenReturn(12);

    assertThat(service.purgeExpired()).isEqualTo(12);
    verify(weatherDao).deleteOlderThan(Instant.parse("2024-04-01T06:00:00Z"));
  }
}
