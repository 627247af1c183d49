package com.ospicorp.priceapi.estimator;

public record EstimatorParameters(double k1, double k2, double k3, double alpha) {

  public static final double DEFAULT_K1 = 0.12;
  public static final double DEFAULT_K2 = 0.08;
  public static final double DEFAULT_K3 = 0.12;
  public static final double DEFAULT_ALPHA = 0.4;

  public static EstimatorParameters defaults() {
    return new EstimatorParameters(DEFAULT_K1, DEFAULT_K2, DEFAULT_K3, DEFAULT_ALPHA);
  }
}
