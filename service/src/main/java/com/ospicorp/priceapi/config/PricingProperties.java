package com.ospicorp.priceapi.config;

import com.ospicorp.priceapi.estimator.EstimatorParameters;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "pricing")
public record PricingProperties(
    @DefaultValue("KES/kg") String units,
    @DefaultValue("market prices (db)") String sourceLabel,
    @DefaultValue Estimator estimator,
    @DefaultValue Sigma sigma,
    @DefaultValue Calibration calibration
) {

  public record Estimator(
      @DefaultValue("0.12") double k1,
      @DefaultValue("0.08") double k2,
      @DefaultValue("0.12") double k3,
      @DefaultValue("0.4") double alpha
  ) {
    public EstimatorParameters toParameters() {
      return new EstimatorParameters(k1, k2, k3, alpha);
    }
  }

  public record Sigma(@DefaultValue("1.0") double fallback) {}

  public record Calibration(
      @DefaultValue("30") int windowDays,
      @DefaultValue("10") int minSamples,
      @DefaultValue("2") int minMarkets,
      @DefaultValue List<String> locations
  ) {
    public Calibration {
      locations = locations == null ? List.of() : List.copyOf(locations);
    }
  }
}
