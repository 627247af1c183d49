package com.ospicorp.priceapi.estimator;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Distance-weighted, exponentially smoothed price estimator with a multiplicative adjustment
 * chain.
 *
 * <p>All operations are pure functions of their arguments. The previous smoothed base is passed
 * in and the new one handed back in {@link PriceEstimate#newBase()}; persisting it, and guarding
 * the read-modify-write per location, is the caller's job.
 */
public final class PriceEstimator {

  static final double MIN_FALLBACK_SIGMA = 0.5;
  static final double FALLBACK_SIGMA_RATIO = 0.03;
  static final double NON_FINITE_FALLBACK_SIGMA = 1.0;

  private PriceEstimator() {
  }

  // Missing, negative and NaN distances count as 0; an empty price map yields 0
  public static double computeBase(Map<String, Double> prices, Map<String, Double> distances) {
    double weightSum = 0d;
    double weighted = 0d;
    for (var entry : prices.entrySet()) {
      Double distance = distances.get(entry.getKey());
      double d = distance == null || distance.isNaN() || distance < 0d ? 0d : distance;
      double weight = 1d / (1d + d);
      weightSum += weight;
      weighted += weight * entry.getValue();
    }
    double normalizer = weightSum == 0d ? 1d : weightSum;
    return weighted / normalizer;
  }

  public static double smooth(double raw, Double previous) {
    return smooth(raw, previous, EstimatorParameters.DEFAULT_ALPHA);
  }

  public static double smooth(double raw, Double previous, double alpha) {
    if (previous == null) {
      return raw;
    }
    return alpha * raw + (1 - alpha) * previous;
  }

  public static double fallbackSigma(double pointEstimate) {
    if (!Double.isFinite(pointEstimate)) {
      return NON_FINITE_FALLBACK_SIGMA;
    }
    return Math.max(MIN_FALLBACK_SIGMA, FALLBACK_SIGMA_RATIO * pointEstimate);
  }

  public static PriceEstimate estimate(Map<String, Double> prices, Map<String, Double> distances,
      Double previousBase) {
    return estimate(prices, distances, previousBase, AdjustmentIndices.neutral());
  }

  public static PriceEstimate estimate(Map<String, Double> prices, Map<String, Double> distances,
      Double previousBase, AdjustmentIndices indices) {
    return estimate(prices, distances, previousBase, indices, EstimatorParameters.defaults(), null);
  }

  public static PriceEstimate estimate(Map<String, Double> prices, Map<String, Double> distances,
      Double previousBase, AdjustmentIndices indices, EstimatorParameters parameters,
      Double sigma) {

    double rawBase = computeBase(prices, distances);
    double newBase = smooth(rawBase, previousBase, parameters.alpha());

    double season = 1 + parameters.k1() * indices.seasonIndex();
    double logistics = LogisticsMode.multiplierFor(indices.logisticsMode());
    double shock = 1 + parameters.k2() * indices.shockIndex();
    double weather = 1 + parameters.k3() * indices.weatherIndex();
    double variety = indices.varietyGradeFactor();

    double pointEstimate = newBase * season * logistics * shock * weather * variety;
    double effectiveSigma = sigma != null ? sigma : fallbackSigma(pointEstimate);

    Explanation explain = new Explanation(
        round3(newBase),
        round3(season),
        round3(logistics),
        round3(shock),
        round3(weather),
        round3(variety));

    return new PriceEstimate(pointEstimate, effectiveSigma,
        ConfidenceBand.around(pointEstimate, effectiveSigma), explain, newBase);
  }

  // half-even on the exact binary value, so 1.0005 (stored as 1.000499...) becomes 1.0
  static double round3(double value) {
    return round(value, 3);
  }

  public static double round(double value, int scale) {
    if (!Double.isFinite(value)) {
      return value;
    }
    return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
  }
}
