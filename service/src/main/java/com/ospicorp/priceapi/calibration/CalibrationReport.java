package com.ospicorp.priceapi.calibration;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record CalibrationReport(
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("finished_at") Instant finishedAt,
    List<CalibrationResult> results
) {

  @JsonProperty("updated")
  public Map<String, Double> updatedSigmas() {
    Map<String, Double> out = new LinkedHashMap<>();
    for (var r : results) {
      if (r.status() == CalibrationResult.Status.UPDATED) {
        out.put(r.location(), r.sigma());
      }
    }
    return out;
  }

  @JsonProperty("skipped")
  public List<String> skipped() {
    return locationsWith(CalibrationResult.Status.SKIPPED);
  }

  @JsonProperty("failed")
  public List<String> failed() {
    return locationsWith(CalibrationResult.Status.FAILED);
  }

  private List<String> locationsWith(CalibrationResult.Status status) {
    return results.stream()
        .filter(r -> r.status() == status)
        .map(CalibrationResult::location)
        .toList();
  }
}
