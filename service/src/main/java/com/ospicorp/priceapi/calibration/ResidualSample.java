package com.ospicorp.priceapi.calibration;

import java.time.LocalDate;

public record ResidualSample(LocalDate day, double actual, double estimated) {

  public double residual() {
    return actual - estimated;
  }
}
