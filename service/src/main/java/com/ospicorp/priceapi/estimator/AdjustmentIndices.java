package com.ospicorp.priceapi.estimator;

public record AdjustmentIndices(
    double seasonIndex,
    String logisticsMode,
    double shockIndex,
    double varietyGradeFactor,
    double weatherIndex
) {
  public static final String DEFAULT_LOGISTICS_MODE = "wholesale";

  public static AdjustmentIndices neutral() {
    return new AdjustmentIndices(0.0, DEFAULT_LOGISTICS_MODE, 0.0, 1.0, 0.0);
  }

  public AdjustmentIndices withSeasonIndex(double value) {
    return new AdjustmentIndices(value, logisticsMode, shockIndex, varietyGradeFactor, weatherIndex);
  }

  public AdjustmentIndices withLogisticsMode(String value) {
    return new AdjustmentIndices(seasonIndex, value, shockIndex, varietyGradeFactor, weatherIndex);
  }

  public AdjustmentIndices withShockIndex(double value) {
    return new AdjustmentIndices(seasonIndex, logisticsMode, value, varietyGradeFactor, weatherIndex);
  }

  public AdjustmentIndices withVarietyGradeFactor(double value) {
    return new AdjustmentIndices(seasonIndex, logisticsMode, shockIndex, value, weatherIndex);
  }

  public AdjustmentIndices withWeatherIndex(double value) {
    return new AdjustmentIndices(seasonIndex, logisticsMode, shockIndex, varietyGradeFactor, value);
  }
}
