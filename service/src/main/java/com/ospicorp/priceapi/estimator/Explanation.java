package com.ospicorp.priceapi.estimator;

import com.fasterxml.jackson.annotation.JsonProperty;

// Each component rounded to 3 decimals
public record Explanation(
    @JsonProperty("base_smoothed") double baseSmoothed,
    @JsonProperty("season_mult") double seasonMultiplier,
    @JsonProperty("logistics_mult") double logisticsMultiplier,
    @JsonProperty("shock_mult") double shockMultiplier,
    @JsonProperty("weather_mult") double weatherMultiplier,
    @JsonProperty("variety_mult") double varietyMultiplier
) {}
