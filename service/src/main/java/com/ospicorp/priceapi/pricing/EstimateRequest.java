package com.ospicorp.priceapi.pricing;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.Map;

public record EstimateRequest(
    @NotBlank String location,
    @NotNull @Pattern(regexp = "^(farmgate|wholesale|retail)$")
    @JsonProperty("logistics_mode") String logisticsMode,
    @DecimalMin("0.5") @DecimalMax("2.0")
    @JsonProperty("variety_grade_factor") Double varietyGradeFactor,
    @DecimalMin("-1.0") @DecimalMax("1.0")
    @JsonProperty("season_index") Double seasonIndex,
    @DecimalMin("-1.0") @DecimalMax("1.0")
    @JsonProperty("shock_index") Double shockIndex,
    Map<String, @NotNull @PositiveOrZero Double> overrides,
    @DecimalMin("0.0") @DecimalMax("1.0")
    @JsonProperty("weather_override") Double weatherOverride
) {

  public double varietyGradeFactorOrDefault() {
    return varietyGradeFactor != null ? varietyGradeFactor : 1.0;
  }

  public double seasonIndexOrDefault() {
    return seasonIndex != null ? seasonIndex : 0.0;
  }

  public double shockIndexOrDefault() {
    return shockIndex != null ? shockIndex : 0.0;
  }

  public Map<String, Double> overridesOrEmpty() {
    return overrides != null ? overrides : Map.of();
  }
}
