package com.ospicorp.priceapi.calibration;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CalibrationResult(
    String location,
    Status status,
    Double sigma,
    int samples,
    String detail
) {

  public enum Status { UPDATED, SKIPPED, FAILED }

  static CalibrationResult updated(String location, double sigma, int samples) {
    return new CalibrationResult(location, Status.UPDATED, sigma, samples, null);
  }

  static CalibrationResult skipped(String location, int samples, String detail) {
    return new CalibrationResult(location, Status.SKIPPED, null, samples, detail);
  }

  static CalibrationResult failed(String location, String detail) {
    return new CalibrationResult(location, Status.FAILED, null, 0, detail);
  }
}
