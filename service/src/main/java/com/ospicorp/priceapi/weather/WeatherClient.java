package com.ospicorp.priceapi.weather;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

@Component
public class WeatherClient {
  private final RestTemplate restTemplate;
  private final ObjectMapper mapper;
  private final Clock clock;
  private final String baseUrl;
  private final String apiKey;
  private final double rainCapMm;

  public WeatherClient(RestTemplate restTemplate,
      ObjectMapper mapper,
      Clock clock,
      @Value("${pricing.weather.url:https://api.openweathermap.org/data/3.0/onecall}") String baseUrl,
      @Value("${pricing.weather.api-key:}") String apiKey,
      @Value("${pricing.weather.rain-cap-mm:30.0}") double rainCapMm) {
    this.restTemplate = restTemplate;
    this.mapper = mapper;
    this.clock = clock;
    this.baseUrl = baseUrl;
    this.apiKey = apiKey;
    this.rainCapMm = rainCapMm;
  }

  public boolean isConfigured() {
    return StringUtils.hasText(apiKey);
  }

  public WeatherObservation fetch(double lat, double lon) {
    String url = UriComponentsBuilder.fromHttpUrl(baseUrl)
        .queryParam("lat", lat)
        .queryParam("lon", lon)
        .queryParam("appid", apiKey)
        .queryParam("units", "metric")
        .queryParam("exclude", "minutely")
        .toUriString();
    try {
      JsonNode body = restTemplate.getForObject(url, JsonNode.class);
      return parse(body);
    } catch (RestClientException | JsonProcessingException e) {
      throw new WeatherFetchException("Weather fetch failed for " + lat + "," + lon, e);
    }
  }

  private WeatherObservation parse(JsonNode body) throws JsonProcessingException {
    if (body == null) {
      throw new WeatherFetchException("Empty weather response", null);
    }
    JsonNode current = body.path("current");
    double rainMm = 0d;
    JsonNode rain = current.path("rain");
    if (rain.isObject()) {
      rainMm = rain.path("1h").asDouble(0d);
    }
    JsonNode code = current.path("weather").path(0).path("id");
    String weatherCode = code.isMissingNode() || code.isNull() ? null : code.asText();
    return new WeatherObservation(clock.instant(), rainMm, weatherCode,
        indexFor(rainMm, rainCapMm), mapper.writeValueAsString(body));
  }

  static double indexFor(double rainMm, double capMm) {
    return Math.min(1d, Math.max(0d, rainMm) / capMm);
  }
}
