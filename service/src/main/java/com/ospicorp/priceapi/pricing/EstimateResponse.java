package com.ospicorp.priceapi.pricing;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.priceapi.estimator.Explanation;
import java.util.List;

public record EstimateResponse(
    double estimate,
    String units,
    List<Double> range,
    double sigma,
    @JsonProperty("sigma_source") SigmaSource sigmaSource,
    Explanation explain,
    List<String> sources
) {

  public enum SigmaSource {
    @JsonProperty("calibrated") CALIBRATED,
    @JsonProperty("default") DEFAULT
  }
}
