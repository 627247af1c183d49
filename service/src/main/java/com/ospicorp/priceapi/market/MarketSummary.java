package com.ospicorp.priceapi.market;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record MarketSummary(
    Long id,
    String name,
    String county,
    Double lat,
    Double lon,
    @JsonProperty("latest_price") LatestPrice latestPrice
) {

  public record LatestPrice(
      @JsonProperty("price_kg") double priceKg,
      Instant date,
      String source
  ) {}
}
