package com.ospicorp.priceapi.weather;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record WeatherReading(
    String market,
    Instant timestamp,
    @JsonProperty("rain_mm") double rainMm,
    @JsonProperty("weather_code") String weatherCode,
    @JsonProperty("weather_index") double weatherIndex
) {}
