package com.ospicorp.priceapi.weather;

import com.ospicorp.priceapi.web.InvalidParameterException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/weather")
@Tag(name = "Weather")
public class WeatherController {
  private final WeatherService weatherService;

  public WeatherController(WeatherService weatherService) {
    this.weatherService = weatherService;
  }

  @GetMapping("/latest")
  @Operation(summary = "Latest weather reading",
      description = "Most recent stored reading for a location; fetched upstream when none is stored.")
  public WeatherReading latest(
      @RequestParam @Parameter(description = "Market / location name", example = "Nairobi") String location) {
    return weatherService.latest(location);
  }

  @GetMapping("/history")
  @Operation(summary = "Weather history", description = "Readings of the last days, newest first.")
  public Map<String, Object> history(
      @RequestParam @Parameter(description = "Market / location name", example = "Nairobi") String location,
      @RequestParam(defaultValue = "7") @Parameter(description = "Days back, at most 30") int days) {
    if (days < 1 || days > WeatherService.MAX_HISTORY_DAYS) {
      throw InvalidParameterException.of(
          "Invalid days parameter. Supported range: 1-" + WeatherService.MAX_HISTORY_DAYS + ".", 1201);
    }
    List<WeatherReading> readings = weatherService.history(location, days);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("location", location);
    body.put("days_requested", days);
    body.put("records_found", readings.size());
    body.put("history", readings);
    return body;
  }
}
