package com.ospicorp.priceapi.estimator;

public record ConfidenceBand(double lower, double upper) {

  public static ConfidenceBand around(double center, double sigma) {
    return new ConfidenceBand(center - sigma, center + sigma);
  }

  public boolean contains(double value) {
    return lower < value && value < upper;
  }
}
