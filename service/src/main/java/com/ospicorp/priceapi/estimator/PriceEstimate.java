package com.ospicorp.priceapi.estimator;

public record PriceEstimate(
    double pointEstimate,
    double sigma,
    ConfidenceBand band,
    Explanation explain,
    double newBase
) {

  public PriceEstimate withSigma(double sigma) {
    return new PriceEstimate(pointEstimate, sigma, ConfidenceBand.around(pointEstimate, sigma),
        explain, newBase);
  }
}
