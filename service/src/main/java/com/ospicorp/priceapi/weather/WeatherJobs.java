package com.ospicorp.priceapi.weather;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class WeatherJobs {
  private final WeatherService weatherService;

  public WeatherJobs(WeatherService weatherService) {
    this.weatherService = weatherService;
  }

  @Scheduled(cron = "${pricing.weather.fetch-cron:0 0 * * * *}", zone = "UTC")
  public void fetchWeather() {
    weatherService.refreshAll();
  }

  @Scheduled(cron = "${pricing.weather.cleanup-cron:0 30 3 * * SUN}", zone = "UTC")
  public void purgeOldReadings() {
    weatherService.purgeExpired();
  }
}
