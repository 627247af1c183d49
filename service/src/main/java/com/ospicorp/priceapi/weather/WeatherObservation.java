package com.ospicorp.priceapi.weather;

import java.time.Instant;

// Reading as returned by the upstream provider, before it is stored
public record WeatherObservation(
    Instant timestamp,
    double rainMm,
    String weatherCode,
    double weatherIndex,
    String rawPayload
) {}
