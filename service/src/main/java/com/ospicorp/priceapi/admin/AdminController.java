package com.ospicorp.priceapi.admin;

import com.ospicorp.priceapi.calibration.CalibrationJob;
import com.ospicorp.priceapi.calibration.CalibrationReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
@Tag(name = "Admin")
public class AdminController {
  private final CalibrationJob calibrationJob;

  public AdminController(CalibrationJob calibrationJob) {
    this.calibrationJob = calibrationJob;
  }

  @PostMapping("/calibration")
  @Operation(summary = "Start calibration", description = "Recompute sigma for every location in the background.")
  public ResponseEntity<Map<String, String>> calibrate() {
    if (!calibrationJob.trySubmit("admin")) {
      return ResponseEntity.status(HttpStatus.CONFLICT)
          .body(Map.of("status", "calibration already running"));
    }
    return ResponseEntity.accepted().body(Map.of("status", "calibration started"));
  }

  @GetMapping("/calibration/last")
  @Operation(summary = "Last calibration report")
  public ResponseEntity<CalibrationReport> lastReport() {
    return calibrationJob.lastReport()
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.noContent().build());
  }
}
