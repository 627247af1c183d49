package com.ospicorp.priceapi.calibration;

import java.util.List;

public final class ResidualStatistics {
  private ResidualStatistics() {
  }

  public static double populationStdDev(List<ResidualSample> samples) {
    if (samples.isEmpty()) {
      throw new IllegalArgumentException("at least one sample is required");
    }
    double mean = 0d;
    for (var s : samples) {
      mean += s.residual();
    }
    mean /= samples.size();

    double sumSquares = 0d;
    for (var s : samples) {
      double d = s.residual() - mean;
      sumSquares += d * d;
    }
    return Math.sqrt(sumSquares / samples.size());
  }
}
